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

import junit.framework.TestCase;

import java.math.BigInteger;

public class LiftingTest extends TestCase {
  private static final Function<String, BigInteger> LENGTH =
      new Function<String, BigInteger>() {
        @Override
        public BigInteger apply(String s) {
          return BigInteger.valueOf(s.length());
        }
      };

  private static final Lifting.BinaryFunction<String, String, String> CONCAT =
      new Lifting.BinaryFunction<String, String, String>() {
        @Override
        public String apply(String a, String b) {
          return a + b;
        }
      };

  private Context context;

  @Override
  protected void setUp() {
    context = Context.create();
  }

  public void testKnownOperandDoesNotAllocate() {
    Value<BigInteger> length = Lifting.liftUnary(context, Operator.STR_LENGTH,
        Kind.INTEGER, LENGTH, Value.string("abc"));
    assertEquals(Value.integer(3), length);
    assertEquals(0, context.nodeCount());
  }

  public void testUnknownOperandInternsOnce() {
    Value<String> s = context.input(Kind.STRING, "s");
    Value<BigInteger> first = Lifting.liftUnary(context, Operator.STR_LENGTH,
        Kind.INTEGER, LENGTH, s);
    Value<BigInteger> second = Lifting.liftUnary(context, Operator.STR_LENGTH,
        Kind.INTEGER, LENGTH, s);
    assertFalse(first.isKnown());
    assertEquals(first, second);
    assertEquals(2, context.nodeCount());
  }

  public void testFastPathNeedsEveryOperandKnown() {
    Value<String> s = context.input(Kind.STRING, "s");
    assertEquals(Value.string("ab"), Lifting.liftBinary(context,
        Operator.STR_CONCAT, Kind.STRING, CONCAT, Value.string("a"), Value.string("b")));
    assertEquals(1, context.nodeCount());
    Value<String> partial = Lifting.liftBinary(context, Operator.STR_CONCAT,
        Kind.STRING, CONCAT, Value.string("a"), s);
    assertFalse(partial.isKnown());
    assertEquals(Operator.STR_CONCAT, context.node(partial.node()).getOperator());
  }

  public void testNullConcreteFunctionIsAlwaysSymbolic() {
    Value<BigInteger> length = Lifting.liftUnary(context, Operator.STR_LENGTH,
        Kind.INTEGER, null, Value.string("abc"));
    assertFalse(length.isKnown());
    assertEquals(1, context.nodeCount());
  }

  public void testOperatorSemantics() {
    assertEquals(Value.string("ell"), Lifting.lift(context, Operator.STR_SUBSTR,
        Kind.STRING, ImmutableList.<Value<?>>of(
            Value.string("hello"), Value.integer(1), Value.integer(3))));
    assertEquals(Value.string(""), Lifting.lift(context, Operator.STR_AT,
        Kind.STRING,
        ImmutableList.<Value<?>>of(Value.string("hello"), Value.integer(9))));
    assertEquals(Value.integer(-1), Lifting.lift(context, Operator.STR_INDEX_OF,
        Kind.INTEGER, ImmutableList.of(Value.string("hello"), Value.string("z"))));
    assertEquals(Value.string("cd"), Lifting.liftTernary(context,
        Operator.STR_SUBSTR, Kind.STRING,
        new Lifting.TernaryFunction<String, BigInteger, BigInteger, String>() {
          @Override
          public String apply(String s, BigInteger offset, BigInteger length) {
            return s.substring(offset.intValue(), offset.intValue() + length.intValue());
          }
        }, Value.string("abcd"), Value.integer(2), Value.integer(2)));
    assertEquals(0, context.nodeCount());
  }

  public void testKindMismatchOnKnownOperandsIsFatal() {
    try {
      Lifting.lift(context, Operator.STR_LENGTH, Kind.INTEGER,
          ImmutableList.of(Value.character(65)));
      fail("Should have thrown an exception");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  public void testOperations() {
    assertEquals(Value.character(4), Operations.add(context,
        Value.character(250), Value.character(10)));
    assertEquals(Value.integer(260), Operations.add(context,
        Value.integer(250), Value.integer(10)));
    assertEquals(Value.bool(true), Operations.lessThan(context,
        Value.integer(-3), Value.integer(2)));
    assertEquals(Value.bool(false), Operations.implies(context,
        Value.bool(true), Value.bool(false)));
    assertEquals(Value.known(Kind.INT8, BigInteger.valueOf(-56)),
        Operations.fromIntegral(context, Value.character(200), Kind.INT8));
    assertEquals(0, context.nodeCount());

    Value<BigInteger> x = context.input(Kind.INTEGER, "x");
    assertSame(x, Operations.fromIntegral(context, x, Kind.INTEGER));
    Value<Boolean> positive = Operations.lessThan(context, Value.integer(0), x);
    assertEquals(Operator.LESS_THAN, context.node(positive.node()).getOperator());
  }
}
