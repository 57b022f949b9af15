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

package symbolicbuilder.codegen;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The artifacts of rendering a computation as a program: a makefile, a header
 * with the declarations and a body with the definitions. Each is a list of
 * lines.
 */
public final class RenderedProgram {
  private static final Joiner LINES = Joiner.on("\n");

  private final ImmutableList<String> makefile;
  private final ImmutableList<String> header;
  private final ImmutableList<String> body;

  public RenderedProgram(Iterable<String> makefile, Iterable<String> header,
      Iterable<String> body) {
    this.makefile = ImmutableList.copyOf(makefile);
    this.header = ImmutableList.copyOf(header);
    this.body = ImmutableList.copyOf(body);
  }

  /** A program with no content in any artifact */
  public static RenderedProgram empty() {
    return new RenderedProgram(ImmutableList.<String>of(),
        ImmutableList.<String>of(), ImmutableList.<String>of());
  }

  public ImmutableList<String> getMakefile() {
    return makefile;
  }

  public ImmutableList<String> getHeader() {
    return header;
  }

  public ImmutableList<String> getBody() {
    return body;
  }

  static String text(List<String> lines) {
    return lines.isEmpty() ? "" : LINES.join(lines) + "\n";
  }
}
