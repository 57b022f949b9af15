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
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import java.util.List;
import java.util.Map;

/**
 * Evaluates values of a {@link Context} under a {@link Model}, using each
 * operator's concrete semantics. Variable nodes take their value from the
 * model; every other node is computed from its operands. Results for shared
 * nodes are computed once per evaluator.
 */
public class ModelEvaluator {
  private final Context context;
  private final Model model;
  private final Map<NodeId, Object> computed = Maps.newHashMap();

  /**
   * @throws IllegalArgumentException if the model assigns a node that is not a
   *         variable of {@code context}
   */
  public ModelEvaluator(Context context, Model model) {
    this.context = Preconditions.checkNotNull(context);
    this.model = Preconditions.checkNotNull(model);
    for (NodeId id : model.assigned()) {
      ExpressionNode node = context.node(id);
      Preconditions.checkArgument(node.isVariable(),
          "Model assigns %s, which is not a variable", node);
    }
  }

  /**
   * @return the literal {@code value} takes under the model
   * @throws IllegalStateException if the model leaves a variable that
   *         {@code value} depends on unassigned
   */
  public <T> T evaluate(Value<T> value) {
    if (value.isKnown()) {
      return value.literal();
    }
    return value.getKind().cast(evaluate(value.node()));
  }

  /** True if the constraint holds under the model */
  public boolean holds(Constraint constraint) {
    return evaluate(constraint.getCondition());
  }

  /** True if every constraint of the context holds under the model */
  public boolean satisfiesConstraints() {
    for (Constraint constraint : context.constraints()) {
      if (!holds(constraint)) {
        return false;
      }
    }
    return true;
  }

  private Object evaluate(NodeId id) {
    Object result = computed.get(id);
    if (result != null) {
      return result;
    }
    ExpressionNode node = context.node(id);
    if (node.isVariable()) {
      result = model.valueOf(id);
    } else {
      List<Object> args = Lists.newArrayListWithCapacity(node.getOperands().size());
      for (Value<?> operand : node.getOperands()) {
        args.add(operand.isKnown() ? operand.literal() : evaluate(operand.node()));
      }
      result = node.getOperator().evaluate(node.getKind(), args);
    }
    computed.put(id, result);
    return result;
  }
}
