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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

import java.util.Map;

/**
 * Literal values for the variables of a construction, as supplied by a solver
 * after a successful solve. This is the boundary with whatever reads a
 * solver's answer; nothing here interprets solver output.
 */
public final class Model {
  private final ImmutableMap<NodeId, Object> values;

  private Model(ImmutableMap<NodeId, Object> values) {
    this.values = values;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** The nodes this model assigns */
  public ImmutableSet<NodeId> assigned() {
    return values.keySet();
  }

  /** True if the model assigns {@code variable} */
  public boolean hasValue(NodeId variable) {
    return values.containsKey(variable);
  }

  /**
   * @return the literal assigned to {@code variable}
   * @throws IllegalStateException if the model has no value for it
   */
  public Object valueOf(NodeId variable) {
    Object value = values.get(variable);
    Preconditions.checkState(value != null, "No value for variable %s", variable);
    return value;
  }

  @Override
  public String toString() {
    return values.toString();
  }

  /** Collects variable assignments, checking each literal against its kind */
  public static final class Builder {
    private final Map<NodeId, Object> values = Maps.newLinkedHashMap();

    private Builder() {}

    /**
     * @throws IllegalArgumentException if {@code variable} is known or
     *         {@code literal} is not a literal of its kind
     */
    public <T> Builder put(Value<T> variable, T literal) {
      Preconditions.checkArgument(!variable.isKnown(),
          "%s is already known", variable);
      Preconditions.checkArgument(variable.getKind().isValidLiteral(literal),
          "%s is not a literal of kind %s", literal, variable.getKind());
      values.put(variable.node(), literal);
      return this;
    }

    public Model build() {
      return new Model(ImmutableMap.copyOf(values));
    }
  }
}
