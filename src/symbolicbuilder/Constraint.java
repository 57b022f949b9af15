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
 * An assertion that must hold in every solution of a construction: a boolean
 * value, with an optional label for readability of the emitted problem.
 */
public final class Constraint {
  private final Value<Boolean> condition;
  private final String label;

  Constraint(Value<Boolean> condition, String label) {
    this.condition = condition;
    this.label = label;
  }

  public Value<Boolean> getCondition() {
    return condition;
  }

  /** @return the label, or null if the constraint is unlabelled */
  public String getLabel() {
    return label;
  }

  @Override
  public String toString() {
    if (label == null) {
      return "(assert " + condition + ")";
    }
    return "(assert (! " + condition + " :named " + label + "))";
  }
}
