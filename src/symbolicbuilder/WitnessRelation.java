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
 * How a witness relates to a term the backend can state: some fresh value
 * {@code w} such that {@code wrap(w)} equals {@code target()}.
 *
 * @param <T> the literal class of the witness
 * @param <U> the literal class of the compared forms
 */
public interface WitnessRelation<T, U> {
  /**
   * @param witness the fresh variable
   * @return the expressible form of the witness, e.g. a string holding it
   */
  Value<U> wrap(Context context, Value<T> witness);

  /** @return the expressible term the wrapped witness must equal */
  Value<U> target(Context context);
}
