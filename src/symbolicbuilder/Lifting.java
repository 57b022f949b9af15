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

import com.google.common.base.Function;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.Arrays;
import java.util.List;

/**
 * Combinators that turn a function on literals into an operation on
 * {@link Value}s. When every operand is known the function is applied directly
 * and the result is known; no node is created. Otherwise the operator is
 * interned in the context and the result is unknown.
 * <p>
 * A null concrete function means the operation has no direct evaluation, so
 * the result is always unknown.
 */
public final class Lifting {
  private Lifting() {}

  /** A function on two literals */
  public interface BinaryFunction<A, B, R> {
    R apply(A a, B b);
  }

  /** A function on three literals */
  public interface TernaryFunction<A, B, C, R> {
    R apply(A a, B b, C c);
  }

  public static <A, R> Value<R> liftUnary(Context context, Operator operator,
      Kind<R> resultKind, Function<? super A, ? extends R> concrete,
      Value<A> operand) {
    checkKinds(operator, resultKind, operand);
    if (concrete != null && operand.isKnown()) {
      return Value.known(resultKind, concrete.apply(operand.literal()));
    }
    return context.apply(operator, resultKind, operand);
  }

  public static <A, B, R> Value<R> liftBinary(Context context, Operator operator,
      Kind<R> resultKind, BinaryFunction<? super A, ? super B, ? extends R> concrete,
      Value<A> a, Value<B> b) {
    checkKinds(operator, resultKind, a, b);
    if (concrete != null && a.isKnown() && b.isKnown()) {
      return Value.known(resultKind, concrete.apply(a.literal(), b.literal()));
    }
    return context.apply(operator, resultKind, a, b);
  }

  public static <A, B, C, R> Value<R> liftTernary(Context context,
      Operator operator, Kind<R> resultKind,
      TernaryFunction<? super A, ? super B, ? super C, ? extends R> concrete,
      Value<A> a, Value<B> b, Value<C> c) {
    checkKinds(operator, resultKind, a, b, c);
    if (concrete != null && a.isKnown() && b.isKnown() && c.isKnown()) {
      return Value.known(resultKind,
          concrete.apply(a.literal(), b.literal(), c.literal()));
    }
    return context.apply(operator, resultKind, a, b, c);
  }

  /**
   * Lifts an operator of any arity. The concrete function receives the
   * operands' literals in order.
   */
  public static <R> Value<R> lift(Context context, Operator operator,
      Kind<R> resultKind, Function<? super List<Object>, ? extends R> concrete,
      List<? extends Value<?>> operands) {
    checkKinds(operator, resultKind, operands);
    if (concrete != null && allKnown(operands)) {
      List<Object> literals = Lists.newArrayListWithCapacity(operands.size());
      for (Value<?> operand : operands) {
        literals.add(operand.literal());
      }
      return Value.known(resultKind,
          concrete.apply(ImmutableList.copyOf(literals)));
    }
    return Value.unknown(resultKind, context.intern(operator, resultKind, operands));
  }

  /**
   * Lifts an operator using its own concrete semantics, the same semantics
   * {@link ModelEvaluator} uses.
   */
  public static <R> Value<R> lift(Context context, final Operator operator,
      final Kind<R> resultKind, List<? extends Value<?>> operands) {
    return lift(context, operator, resultKind,
        new Function<List<Object>, R>() {
          @Override
          public R apply(List<Object> literals) {
            return resultKind.cast(operator.evaluate(resultKind, literals));
          }
        }, operands);
  }

  private static void checkKinds(Operator operator, Kind<?> resultKind,
      Value<?>... operands) {
    checkKinds(operator, resultKind, Arrays.asList(operands));
  }

  // Checked before the concrete path is taken.
  private static void checkKinds(Operator operator, Kind<?> resultKind,
      List<? extends Value<?>> operands) {
    List<Kind<?>> kinds = Lists.newArrayListWithCapacity(operands.size());
    for (Value<?> operand : operands) {
      kinds.add(operand.getKind());
    }
    operator.check(resultKind, kinds);
  }

  private static boolean allKnown(List<? extends Value<?>> operands) {
    for (Value<?> operand : operands) {
      if (!operand.isKnown()) {
        return false;
      }
    }
    return true;
  }
}
