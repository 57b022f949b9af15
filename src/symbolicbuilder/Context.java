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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The mutable state of one symbolic construction: the expression graph with
 * its cache of shared nodes, the counter from which node ids are allocated, and
 * the ordered list of constraints.
 * <p>
 * Every construction call takes the context explicitly. A context is not
 * thread-safe and must not be shared between computations; independent
 * computations each create their own. When construction is done,
 * {@link #finish} hands the reachable graph and the constraints to a backend.
 */
public final class Context {
  private static final Logger log = LogManager.getLogger(Context.class);

  private final ConstructionOptions options;

  /** All nodes, indexed by {@link NodeId#getIndex()} */
  private final List<ExpressionNode> nodes = Lists.newArrayList();

  /** One entry per distinct application, for structural sharing */
  private final Map<NodeKey, NodeId> cache = Maps.newHashMap();

  private final List<Constraint> constraints = Lists.newArrayList();

  private final Set<String> variableNames = Sets.newHashSet();

  /** Index of the next node; every allocation takes it and increments it */
  private int nextIndex = 0;

  /** How many fresh witness variables have been allocated */
  private int freshCount = 0;

  private int inputCount = 0;

  private Context(ConstructionOptions options) {
    this.options = Preconditions.checkNotNull(options);
  }

  /** Creates an empty context with default options */
  public static Context create() {
    return new Context(new ConstructionOptions());
  }

  public static Context create(ConstructionOptions options) {
    return new Context(options);
  }

  public ConstructionOptions getOptions() {
    return options;
  }

  /**
   * Returns the node of {@code operator} applied to {@code operands}, creating
   * it only if no equal application exists yet. Operands are compared by
   * {@link Value#equals}, so applications to the same nodes and equal literals
   * share one node.
   *
   * @throws IllegalArgumentException if the operator cannot produce
   *         {@code resultKind} from the operands' kinds, if the operator is a
   *         variable, or if an operand belongs to another context
   */
  public NodeId intern(Operator operator, Kind<?> resultKind,
      List<? extends Value<?>> operands) {
    Preconditions.checkNotNull(operator);
    Preconditions.checkNotNull(resultKind);
    List<Kind<?>> operandKinds = Lists.newArrayListWithCapacity(operands.size());
    for (Value<?> operand : operands) {
      checkOwned(operand);
      operandKinds.add(operand.getKind());
    }
    operator.check(resultKind, operandKinds);

    ImmutableList<Value<?>> args = ImmutableList.copyOf(operands);
    NodeKey key = new NodeKey(operator, resultKind, args);
    NodeId id = cache.get(key);
    if (id != null) {
      return id;
    }
    id = allocate();
    ExpressionNode node = ExpressionNode.application(id, resultKind, operator, args);
    nodes.add(node);
    cache.put(key, id);
    log.trace("Interned {}", node);
    return id;
  }

  /** Interns an application and returns it as an unknown value */
  public <T> Value<T> apply(Operator operator, Kind<T> resultKind,
      Value<?>... operands) {
    return Value.unknown(resultKind,
        intern(operator, resultKind, Arrays.asList(operands)));
  }

  /**
   * Declares a named input of the computation.
   *
   * @param name the variable's name, or null to generate one
   * @throws IllegalArgumentException if the name is already in use
   */
  public <T> Value<T> input(Kind<T> kind, String name) {
    inputCount++;
    String varName = name;
    if (varName == null) {
      varName = uniqueName(options.inputVariablePrefix + (inputCount - 1));
    }
    Preconditions.checkArgument(!variableNames.contains(varName),
        "Duplicate variable name: %s", varName);
    return newVariable(kind, Operator.INPUT, varName);
  }

  /**
   * Allocates a new variable that is distinct from every node created so far,
   * for use as a witness. The variable is unconstrained until constraints
   * mention it.
   */
  public <T> Value<T> freshVariable(Kind<T> kind) {
    String varName = uniqueName(options.internalVariablePrefix + freshCount);
    freshCount++;
    return newVariable(kind, Operator.WITNESS, varName);
  }

  private <T> Value<T> newVariable(Kind<T> kind, Operator operator, String name) {
    Preconditions.checkNotNull(kind);
    NodeId id = allocate();
    ExpressionNode node = ExpressionNode.variable(id, kind, operator, name);
    nodes.add(node);
    variableNames.add(name);
    log.trace("New variable {}", node);
    return Value.unknown(kind, id);
  }

  private String uniqueName(String base) {
    String name = base;
    for (int suffix = 1; variableNames.contains(name); suffix++) {
      name = base + "_" + suffix;
    }
    return name;
  }

  private NodeId allocate() {
    NodeId id = new NodeId(this, nextIndex);
    nextIndex++;
    return id;
  }

  /**
   * Appends a constraint. A constraint that is known to be true says nothing
   * and is dropped; every other constraint, including one known to be false,
   * is kept in order.
   */
  public void addConstraint(Value<Boolean> condition) {
    addConstraint(condition, null);
  }

  /**
   * @param label a name for the constraint in the emitted problem, or null
   */
  public void addConstraint(Value<Boolean> condition, String label) {
    Preconditions.checkArgument(condition.getKind() == Kind.BOOL,
        "Constraint of kind %s", condition.getKind());
    checkOwned(condition);
    if (condition.isKnown() && condition.literal()) {
      return;
    }
    constraints.add(new Constraint(condition, label));
  }

  /** The constraints in the order they were added */
  public ImmutableList<Constraint> constraints() {
    return ImmutableList.copyOf(constraints);
  }

  public int constraintCount() {
    return constraints.size();
  }

  /** How many nodes, variables included, the graph holds */
  public int nodeCount() {
    return nodes.size();
  }

  public int freshCount() {
    return freshCount;
  }

  /**
   * @throws IllegalArgumentException if {@code id} was not allocated by this
   *         context
   */
  public ExpressionNode node(NodeId id) {
    Preconditions.checkArgument(id.belongsTo(this), "%s is from another context", id);
    return nodes.get(id.getIndex());
  }

  /**
   * Ends construction, collecting everything reachable from {@code roots} and
   * from the constraints.
   */
  public ConstructionResult finish(Value<?>... roots) {
    return finish(Arrays.asList(roots));
  }

  public ConstructionResult finish(List<? extends Value<?>> roots) {
    for (Value<?> root : roots) {
      checkOwned(root);
    }
    return ConstructionResult.create(this, roots, constraints);
  }

  void checkOwned(Value<?> value) {
    if (!value.isKnown()) {
      Preconditions.checkArgument(value.node().belongsTo(this),
          "%s is from another context", value);
    }
  }

  /** Cache key: an application up to operand identity */
  private static final class NodeKey {
    private final Operator operator;
    private final Kind<?> kind;
    private final ImmutableList<Value<?>> operands;

    NodeKey(Operator operator, Kind<?> kind, ImmutableList<Value<?>> operands) {
      this.operator = operator;
      this.kind = kind;
      this.operands = operands;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof NodeKey)) {
        return false;
      }
      NodeKey other = (NodeKey) obj;
      return operator == other.operator && kind == other.kind
          && operands.equals(other.operands);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(operator, kind.getName(), operands);
    }
  }
}
