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

import symbolicbuilder.ConstructionResult;

/**
 * The C renderer, not yet written: produces empty artifacts with C file
 * extensions.
 */
public final class PlaceholderRenderer implements ProgramRenderer {
  @Override
  public RenderedProgram render(String name, ConstructionResult result) {
    return RenderedProgram.empty();
  }

  @Override
  public String headerExtension() {
    return "h";
  }

  @Override
  public String bodyExtension() {
    return "c";
  }
}
