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

import java.math.BigInteger;
import java.util.List;

/**
 * The operators a backend can state directly. Each operator knows its symbol in
 * the backend's vocabulary, how many operands it takes, which operand kinds it
 * accepts and how to evaluate itself on literals.
 * <p>
 * String operators follow SMT-LIB semantics: extracting outside a string yields
 * the empty string and a failed search yields -1.
 */
public enum Operator {
  /** A user-declared free variable */
  INPUT("input", 0) {
    @Override
    void checkKinds(Kind<?> result, List<Kind<?>> operands) {
      throw new IllegalArgumentException("Variables are not interned");
    }

    @Override
    Object evaluate(Kind<?> result, List<Object> args) {
      throw new IllegalArgumentException("Variables have no concrete semantics");
    }
  },

  /** A fresh variable introduced by witness synthesis */
  WITNESS("witness", 0) {
    @Override
    void checkKinds(Kind<?> result, List<Kind<?>> operands) {
      throw new IllegalArgumentException("Variables are not interned");
    }

    @Override
    Object evaluate(Kind<?> result, List<Object> args) {
      throw new IllegalArgumentException("Variables have no concrete semantics");
    }
  },

  EQUAL("=", 2) {
    @Override
    void checkKinds(Kind<?> result, List<Kind<?>> operands) {
      checkResult(this, result, Kind.BOOL);
      Preconditions.checkArgument(operands.get(0) == operands.get(1),
          "%s applied to %s and %s", this, operands.get(0), operands.get(1));
    }

    @Override
    Object evaluate(Kind<?> result, List<Object> args) {
      return args.get(0).equals(args.get(1));
    }
  },

  NOT("not", 1) {
    @Override
    void checkKinds(Kind<?> result, List<Kind<?>> operands) {
      checkResult(this, result, Kind.BOOL);
      checkOperands(this, operands, Kind.BOOL);
    }

    @Override
    Object evaluate(Kind<?> result, List<Object> args) {
      return !(Boolean) args.get(0);
    }
  },

  AND("and", 2) {
    @Override
    void checkKinds(Kind<?> result, List<Kind<?>> operands) {
      checkResult(this, result, Kind.BOOL);
      checkOperands(this, operands, Kind.BOOL, Kind.BOOL);
    }

    @Override
    Object evaluate(Kind<?> result, List<Object> args) {
      return (Boolean) args.get(0) && (Boolean) args.get(1);
    }
  },

  OR("or", 2) {
    @Override
    void checkKinds(Kind<?> result, List<Kind<?>> operands) {
      checkResult(this, result, Kind.BOOL);
      checkOperands(this, operands, Kind.BOOL, Kind.BOOL);
    }

    @Override
    Object evaluate(Kind<?> result, List<Object> args) {
      return (Boolean) args.get(0) || (Boolean) args.get(1);
    }
  },

  IMPLIES("=>", 2) {
    @Override
    void checkKinds(Kind<?> result, List<Kind<?>> operands) {
      checkResult(this, result, Kind.BOOL);
      checkOperands(this, operands, Kind.BOOL, Kind.BOOL);
    }

    @Override
    Object evaluate(Kind<?> result, List<Object> args) {
      return !(Boolean) args.get(0) || (Boolean) args.get(1);
    }
  },

  ADD("+", 2) {
    @Override
    void checkKinds(Kind<?> result, List<Kind<?>> operands) {
      checkArithmetic(this, result, operands);
    }

    @Override
    Object evaluate(Kind<?> result, List<Object> args) {
      return result.wrap(integer(args, 0).add(integer(args, 1)));
    }
  },

  SUBTRACT("-", 2) {
    @Override
    void checkKinds(Kind<?> result, List<Kind<?>> operands) {
      checkArithmetic(this, result, operands);
    }

    @Override
    Object evaluate(Kind<?> result, List<Object> args) {
      return result.wrap(integer(args, 0).subtract(integer(args, 1)));
    }
  },

  LESS_THAN("<", 2) {
    @Override
    void checkKinds(Kind<?> result, List<Kind<?>> operands) {
      checkComparison(this, result, operands);
    }

    @Override
    Object evaluate(Kind<?> result, List<Object> args) {
      return integer(args, 0).compareTo(integer(args, 1)) < 0;
    }
  },

  LESS_OR_EQUAL("<=", 2) {
    @Override
    void checkKinds(Kind<?> result, List<Kind<?>> operands) {
      checkComparison(this, result, operands);
    }

    @Override
    Object evaluate(Kind<?> result, List<Object> args) {
      return integer(args, 0).compareTo(integer(args, 1)) <= 0;
    }
  },

  /** Conversion between integral kinds, wrapping into the result's range */
  FROM_INTEGRAL("from-integral", 1) {
    @Override
    void checkKinds(Kind<?> result, List<Kind<?>> operands) {
      Preconditions.checkArgument(result.isIntegral() && operands.get(0).isIntegral(),
          "%s from %s to %s", this, operands.get(0), result);
    }

    @Override
    Object evaluate(Kind<?> result, List<Object> args) {
      return result.wrap(integer(args, 0));
    }
  },

  /** The string of length one holding a character */
  STR_UNIT("str.unit", 1) {
    @Override
    void checkKinds(Kind<?> result, List<Kind<?>> operands) {
      checkResult(this, result, Kind.STRING);
      checkOperands(this, operands, Kind.CHAR);
    }

    @Override
    Object evaluate(Kind<?> result, List<Object> args) {
      return String.valueOf((char) integer(args, 0).intValue());
    }
  },

  STR_CONCAT("str.++", 2) {
    @Override
    void checkKinds(Kind<?> result, List<Kind<?>> operands) {
      checkResult(this, result, Kind.STRING);
      checkOperands(this, operands, Kind.STRING, Kind.STRING);
    }

    @Override
    Object evaluate(Kind<?> result, List<Object> args) {
      return (String) args.get(0) + (String) args.get(1);
    }
  },

  STR_LENGTH("str.len", 1) {
    @Override
    void checkKinds(Kind<?> result, List<Kind<?>> operands) {
      checkResult(this, result, Kind.INTEGER);
      checkOperands(this, operands, Kind.STRING);
    }

    @Override
    Object evaluate(Kind<?> result, List<Object> args) {
      return BigInteger.valueOf(((String) args.get(0)).length());
    }
  },

  /** The substring of length one at an offset */
  STR_AT("str.at", 2) {
    @Override
    void checkKinds(Kind<?> result, List<Kind<?>> operands) {
      checkResult(this, result, Kind.STRING);
      checkOperands(this, operands, Kind.STRING, Kind.INTEGER);
    }

    @Override
    Object evaluate(Kind<?> result, List<Object> args) {
      return substring((String) args.get(0), integer(args, 1), BigInteger.ONE);
    }
  },

  STR_SUBSTR("str.substr", 3) {
    @Override
    void checkKinds(Kind<?> result, List<Kind<?>> operands) {
      checkResult(this, result, Kind.STRING);
      checkOperands(this, operands, Kind.STRING, Kind.INTEGER, Kind.INTEGER);
    }

    @Override
    Object evaluate(Kind<?> result, List<Object> args) {
      return substring((String) args.get(0), integer(args, 1), integer(args, 2));
    }
  },

  STR_INDEX_OF("str.indexof", 2) {
    @Override
    void checkKinds(Kind<?> result, List<Kind<?>> operands) {
      checkResult(this, result, Kind.INTEGER);
      checkOperands(this, operands, Kind.STRING, Kind.STRING);
    }

    @Override
    Object evaluate(Kind<?> result, List<Object> args) {
      return BigInteger.valueOf(
          ((String) args.get(0)).indexOf((String) args.get(1)));
    }
  };

  private final String symbol;
  private final int arity;

  private Operator(String symbol, int arity) {
    this.symbol = symbol;
    this.arity = arity;
  }

  /** The operator's name in the backend's vocabulary */
  public String getSymbol() {
    return symbol;
  }

  public int getArity() {
    return arity;
  }

  /** True for the operators that introduce variables rather than apply */
  public boolean isVariable() {
    return this == INPUT || this == WITNESS;
  }

  /**
   * Checks that this operator can produce {@code result} from operands of the
   * given kinds.
   *
   * @throws IllegalArgumentException on an arity or kind mismatch
   */
  public void check(Kind<?> result, List<Kind<?>> operands) {
    Preconditions.checkArgument(operands.size() == arity,
        "%s expects %s operands, got %s", this, arity, operands.size());
    checkKinds(result, operands);
  }

  abstract void checkKinds(Kind<?> result, List<Kind<?>> operands);

  /**
   * Applies this operator to literals. The operands must already have passed
   * {@link #check}.
   */
  abstract Object evaluate(Kind<?> result, List<Object> args);

  private static void checkResult(Operator op, Kind<?> result, Kind<?> expected) {
    Preconditions.checkArgument(result == expected,
        "%s produces %s, not %s", op, expected, result);
  }

  private static void checkOperands(Operator op, List<Kind<?>> actual,
      Kind<?>... expected) {
    for (int i = 0; i < expected.length; i++) {
      Preconditions.checkArgument(actual.get(i) == expected[i],
          "%s operand %s must be %s, not %s", op, i, expected[i], actual.get(i));
    }
  }

  private static void checkArithmetic(Operator op, Kind<?> result,
      List<Kind<?>> operands) {
    Preconditions.checkArgument(result.isIntegral(), "%s produces %s", op, result);
    checkOperands(op, operands, result, result);
  }

  private static void checkComparison(Operator op, Kind<?> result,
      List<Kind<?>> operands) {
    checkResult(op, result, Kind.BOOL);
    Preconditions.checkArgument(operands.get(0).isIntegral(),
        "%s compares %s", op, operands.get(0));
    checkOperands(op, operands, operands.get(0), operands.get(0));
  }

  private static BigInteger integer(List<Object> args, int i) {
    return (BigInteger) args.get(i);
  }

  /**
   * SMT-LIB {@code str.substr}: the empty string unless the offset lies inside
   * {@code s} and the length is positive; otherwise as much of the requested
   * range as exists.
   */
  static String substring(String s, BigInteger offset, BigInteger length) {
    BigInteger size = BigInteger.valueOf(s.length());
    if (offset.signum() < 0 || offset.compareTo(size) >= 0
        || length.signum() <= 0) {
      return "";
    }
    BigInteger end = offset.add(length).min(size);
    return s.substring(offset.intValue(), end.intValue());
  }

  @Override
  public String toString() {
    return symbol;
  }
}
