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
 * Character recognizers in the style of {@code java.lang.Character}'s
 * {@code isXxx} predicates. None of them has a symbolic encoding yet;
 * {@link #isSupported()} reports that, and
 * {@link SymbolicStrings#classify} refuses them.
 */
public enum CharacterClass {
  CONTROL("isControl"),
  SPACE("isSpace"),
  LOWER("isLower"),
  UPPER("isUpper"),
  ALPHA("isAlpha"),
  ALPHA_NUM("isAlphaNum"),
  PRINT("isPrint"),
  DIGIT("isDigit"),
  OCT_DIGIT("isOctDigit"),
  HEX_DIGIT("isHexDigit"),
  LETTER("isLetter"),
  PUNCTUATION("isPunctuation");

  private final String functionName;

  private CharacterClass(String functionName) {
    this.functionName = functionName;
  }

  public String getFunctionName() {
    return functionName;
  }

  /** Whether the recognizer can be applied to a symbolic character */
  public boolean isSupported() {
    return false;
  }
}
