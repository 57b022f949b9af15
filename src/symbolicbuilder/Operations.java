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
import com.google.common.collect.ImmutableList;

import java.math.BigInteger;

/**
 * Lifted boolean, arithmetic and conversion operations. Each one computes its
 * result directly when its operands are known and interns a node otherwise.
 */
public final class Operations {
  private Operations() {}

  public static <T> Value<Boolean> equal(Context context, Value<T> a, Value<T> b) {
    return Lifting.lift(context, Operator.EQUAL, Kind.BOOL, ImmutableList.of(a, b));
  }

  public static Value<Boolean> not(Context context, Value<Boolean> a) {
    return Lifting.lift(context, Operator.NOT, Kind.BOOL, ImmutableList.of(a));
  }

  public static Value<Boolean> and(Context context, Value<Boolean> a,
      Value<Boolean> b) {
    return Lifting.lift(context, Operator.AND, Kind.BOOL, ImmutableList.of(a, b));
  }

  public static Value<Boolean> or(Context context, Value<Boolean> a,
      Value<Boolean> b) {
    return Lifting.lift(context, Operator.OR, Kind.BOOL, ImmutableList.of(a, b));
  }

  public static Value<Boolean> implies(Context context, Value<Boolean> a,
      Value<Boolean> b) {
    return Lifting.lift(context, Operator.IMPLIES, Kind.BOOL, ImmutableList.of(a, b));
  }

  /** Addition; bounded kinds wrap around */
  public static Value<BigInteger> add(Context context, Value<BigInteger> a,
      Value<BigInteger> b) {
    return Lifting.lift(context, Operator.ADD, a.getKind(), ImmutableList.of(a, b));
  }

  /** Subtraction; bounded kinds wrap around */
  public static Value<BigInteger> subtract(Context context, Value<BigInteger> a,
      Value<BigInteger> b) {
    return Lifting.lift(context, Operator.SUBTRACT, a.getKind(),
        ImmutableList.of(a, b));
  }

  public static Value<Boolean> lessThan(Context context, Value<BigInteger> a,
      Value<BigInteger> b) {
    return Lifting.lift(context, Operator.LESS_THAN, Kind.BOOL, ImmutableList.of(a, b));
  }

  public static Value<Boolean> lessOrEqual(Context context, Value<BigInteger> a,
      Value<BigInteger> b) {
    return Lifting.lift(context, Operator.LESS_OR_EQUAL, Kind.BOOL,
        ImmutableList.of(a, b));
  }

  /**
   * Converts between integral kinds. Values outside the target's range wrap
   * around, which callers must treat as unspecified. Converting to the
   * operand's own kind returns the operand.
   */
  public static Value<BigInteger> fromIntegral(Context context,
      Value<BigInteger> a, Kind<BigInteger> target) {
    Preconditions.checkArgument(target.isIntegral() && a.getKind().isIntegral(),
        "Cannot convert %s to %s", a.getKind(), target);
    if (a.getKind() == target) {
      return a;
    }
    return Lifting.lift(context, Operator.FROM_INTEGRAL, target, ImmutableList.of(a));
  }
}
