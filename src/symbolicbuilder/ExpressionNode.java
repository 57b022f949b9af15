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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * One node of the expression graph: an operator applied to operand values, or
 * a variable. Nodes are created by a {@link Context} and never change.
 */
public final class ExpressionNode {
  private final NodeId id;
  private final Kind<?> kind;
  private final Operator operator;
  private final ImmutableList<Value<?>> operands;
  /** Name of a variable node; null for applications */
  private final String name;

  private ExpressionNode(NodeId id, Kind<?> kind, Operator operator,
      ImmutableList<Value<?>> operands, String name) {
    this.id = id;
    this.kind = kind;
    this.operator = operator;
    this.operands = operands;
    this.name = name;
  }

  static ExpressionNode application(NodeId id, Kind<?> kind, Operator operator,
      ImmutableList<Value<?>> operands) {
    return new ExpressionNode(id, kind, operator, operands, null);
  }

  static ExpressionNode variable(NodeId id, Kind<?> kind, Operator operator,
      String name) {
    return new ExpressionNode(id, kind, operator, ImmutableList.<Value<?>>of(),
        name);
  }

  public NodeId getId() {
    return id;
  }

  public Kind<?> getKind() {
    return kind;
  }

  public Operator getOperator() {
    return operator;
  }

  public ImmutableList<Value<?>> getOperands() {
    return operands;
  }

  public boolean isVariable() {
    return operator.isVariable();
  }

  /**
   * @return the name of a variable node
   * @throws IllegalStateException if this node is an application
   */
  public String getName() {
    if (name == null) {
      throw new IllegalStateException(id + " is not a variable");
    }
    return name;
  }

  @Override
  public String toString() {
    String definition;
    if (isVariable()) {
      definition = String.format("(%s %s)", operator, name);
    } else {
      definition = String.format("(%s %s)", operator, Joiner.on(" ").join(operands));
    }
    return String.format("%s :: %s = %s", id, kind, definition);
  }
}
