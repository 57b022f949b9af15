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
 * A backend that turns a finished construction into program text. Each
 * target language supplies its own renderer.
 */
public interface ProgramRenderer {
  /**
   * @param name the entry point name, which also names the header and body
   * @param result the finished construction
   */
  RenderedProgram render(String name, ConstructionResult result);

  /** File extension of the header artifact, without the dot */
  String headerExtension();

  /** File extension of the body artifact, without the dot */
  String bodyExtension();
}
