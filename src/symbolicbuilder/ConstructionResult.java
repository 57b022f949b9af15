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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import java.util.Deque;
import java.util.List;
import java.util.SortedSet;

/**
 * A finished construction, as consumed by a {@link BackendTranslator}: the
 * root values, every node reachable from the roots or from a constraint, and
 * the constraints in insertion order.
 * <p>
 * Nodes are listed in allocation order, so every node comes after the nodes
 * it uses, and every {@link NodeId} referenced by a root, a constraint or a
 * listed node is itself listed.
 */
public final class ConstructionResult {
  private final Context context;
  private final ImmutableList<Value<?>> roots;
  private final ImmutableList<ExpressionNode> nodes;
  private final ImmutableList<Constraint> constraints;

  private ConstructionResult(Context context, ImmutableList<Value<?>> roots,
      ImmutableList<ExpressionNode> nodes, ImmutableList<Constraint> constraints) {
    this.context = context;
    this.roots = roots;
    this.nodes = nodes;
    this.constraints = constraints;
  }

  static ConstructionResult create(Context context,
      List<? extends Value<?>> roots, List<Constraint> constraints) {
    Deque<Value<?>> pending = Lists.newLinkedList();
    pending.addAll(roots);
    for (Constraint constraint : constraints) {
      pending.add(constraint.getCondition());
    }
    SortedSet<NodeId> reachable = Sets.newTreeSet();
    while (!pending.isEmpty()) {
      Value<?> value = pending.pop();
      if (value.isKnown() || !reachable.add(value.node())) {
        continue;
      }
      pending.addAll(context.node(value.node()).getOperands());
    }
    ImmutableList.Builder<ExpressionNode> nodes = ImmutableList.builder();
    for (NodeId id : reachable) {
      ExpressionNode node = context.node(id);
      for (Value<?> operand : node.getOperands()) {
        Preconditions.checkState(operand.isKnown() || reachable.contains(operand.node()),
            "Dangling node %s in %s", operand, node);
      }
      nodes.add(node);
    }
    return new ConstructionResult(context, ImmutableList.<Value<?>>copyOf(roots),
        nodes.build(), ImmutableList.copyOf(constraints));
  }

  /** The context this construction was built in */
  public Context getContext() {
    return context;
  }

  public ImmutableList<Value<?>> getRoots() {
    return roots;
  }

  public ImmutableList<ExpressionNode> getNodes() {
    return nodes;
  }

  public ImmutableList<Constraint> getConstraints() {
    return constraints;
  }

  /** The variable nodes, inputs and witnesses, in allocation order */
  public ImmutableList<ExpressionNode> getVariables() {
    ImmutableList.Builder<ExpressionNode> variables = ImmutableList.builder();
    for (ExpressionNode node : nodes) {
      if (node.isVariable()) {
        variables.add(node);
      }
    }
    return variables.build();
  }

  @Override
  public String toString() {
    List<String> lines = Lists.newArrayList();
    for (ExpressionNode node : nodes) {
      lines.add(node.toString());
    }
    for (Constraint constraint : constraints) {
      lines.add(constraint.toString());
    }
    lines.add("; roots: " + Joiner.on(" ").join(roots));
    return Joiner.on("\n").join(lines);
  }
}
