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

import symbolicbuilder.Context;
import symbolicbuilder.Value;

import java.util.List;

/**
 * A symbolic computation to be rendered: given a fresh context, declares its
 * inputs, builds its result and returns the values to expose as outputs.
 */
public interface SymbolicComputation {
  List<Value<?>> run(Context context);
}
