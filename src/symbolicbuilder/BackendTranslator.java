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

package symbolicbuilder;

/**
 * The interface for a backend that lowers a finished construction into a
 * solver's assertion language. A translator declares one symbolic name per
 * variable node, defines every other node in order, and asserts the
 * constraints in the order given.
 *
 * @param <R> the translated form
 */
public interface BackendTranslator<R> {
  /**
   * @param result a finished construction
   * @return the construction in the backend's language
   */
  R translate(ConstructionResult result);
}
