/*
 * Copyright 2010 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package symbolicbuilder.strings;

/**
 * Named regular expressions over symbolic strings. They are declared for
 * clients to refer to but have no encoding yet; see {@link #isSupported()}.
 */
public enum RegexPattern {
  NEWLINE("reNewline"),
  WHITESPACE("reWhitespace"),
  WHITESPACE_NO_NEWLINE("reWhiteSpaceNoNewLine"),
  TAB("reTab"),
  PUNCTUATION("rePunctuation"),
  DIGIT("reDigit"),
  OCT_DIGIT("reOctDigit"),
  HEX_DIGIT("reHexDigit"),
  DECIMAL("reDecimal"),
  OCTAL("reOctal"),
  HEXADECIMAL("reHexadecimal"),
  IDENTIFIER("reIdentifier");

  private final String functionName;

  private RegexPattern(String functionName) {
    this.functionName = functionName;
  }

  public String getFunctionName() {
    return functionName;
  }

  public boolean isSupported() {
    return false;
  }
}
