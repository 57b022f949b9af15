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

package symbolicbuilder.strings;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import symbolicbuilder.Context;
import symbolicbuilder.Kind;
import symbolicbuilder.Lifting;
import symbolicbuilder.Operations;
import symbolicbuilder.Operator;
import symbolicbuilder.Value;
import symbolicbuilder.Witness;
import symbolicbuilder.WitnessRelation;

import java.math.BigInteger;
import java.util.List;

/**
 * Character and string operations on symbolic values.
 * <p>
 * A character is an unsigned 8-bit value ({@link Kind#CHAR}), i.e. a code
 * point of ISO-8859-1; strings are {@link Kind#STRING}. Several operations are
 * <em>underspecified</em> outside their domain: they still return a value of
 * the right kind, but callers must not rely on which one.
 */
public final class SymbolicStrings {
  private static final Logger log = LogManager.getLogger(SymbolicStrings.class);

  private SymbolicStrings() {}

  private static final Function<BigInteger, String> UNIT =
      new Function<BigInteger, String>() {
        @Override
        public String apply(BigInteger c) {
          return String.valueOf((char) c.intValue());
        }
      };

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

  /** The code of a character, as an unbounded integer */
  public static Value<BigInteger> toOrdinal(Context context, Value<BigInteger> c) {
    return toOrdinal(context, c, Kind.INTEGER);
  }

  /** The code of a character, as a value of any integral kind */
  public static Value<BigInteger> toOrdinal(Context context, Value<BigInteger> c,
      Kind<BigInteger> target) {
    checkChar(c);
    return Operations.fromIntegral(context, c, target);
  }

  /**
   * The character with a given code. Unspecified if the code is not in
   * 0..255.
   */
  public static Value<BigInteger> fromOrdinal(Context context, Value<BigInteger> n) {
    return Operations.fromIntegral(context, n, Kind.CHAR);
  }

  /** The string of length 1 holding {@code c} */
  public static Value<String> singleton(Context context, Value<BigInteger> c) {
    checkChar(c);
    return Lifting.liftUnary(context, Operator.STR_UNIT, Kind.STRING, UNIT, c);
  }

  public static Value<String> concat(Context context, Value<String> a,
      Value<String> b) {
    return Lifting.liftBinary(context, Operator.STR_CONCAT, Kind.STRING, CONCAT,
        a, b);
  }

  public static Value<BigInteger> length(Context context, Value<String> s) {
    return Lifting.liftUnary(context, Operator.STR_LENGTH, Kind.INTEGER, LENGTH, s);
  }

  public static Value<Boolean> isEmpty(Context context, Value<String> s) {
    return Operations.equal(context, length(context, s), Value.integer(0));
  }

  /**
   * The substring of {@code s} starting at {@code offset} with at most
   * {@code length} characters; empty if {@code offset} is outside {@code s}
   * or {@code length} is not positive.
   */
  public static Value<String> substring(Context context, Value<String> s,
      Value<BigInteger> offset, Value<BigInteger> length) {
    return Lifting.lift(context, Operator.STR_SUBSTR, Kind.STRING,
        ImmutableList.<Value<?>>of(s, offset, length));
  }

  /** The first position of {@code t} in {@code s}, or -1 */
  public static Value<BigInteger> indexOf(Context context, Value<String> s,
      Value<String> t) {
    return Lifting.lift(context, Operator.STR_INDEX_OF, Kind.INTEGER,
        ImmutableList.of(s, t));
  }

  /** The first character of {@code s}. Unspecified if {@code s} is empty. */
  public static Value<BigInteger> head(Context context, Value<String> s) {
    return elementAt(context, s, Value.integer(0));
  }

  /** {@code s} without its first character. Unspecified if {@code s} is empty. */
  public static Value<String> tail(Context context, Value<String> s) {
    Value<BigInteger> rest =
        Operations.subtract(context, length(context, s), Value.integer(1));
    return substring(context, s, Value.integer(1), rest);
  }

  /**
   * The character at position {@code i} of {@code s}. Unspecified if
   * {@code i} is out of bounds.
   * <p>
   * The backend cannot extract a character from a string, so on the symbolic
   * path the result is a fresh character {@code c} with the constraint
   * {@code singleton(c) == str.at(s, i)}.
   */
  public static Value<BigInteger> elementAt(Context context, final Value<String> s,
      final Value<BigInteger> i) {
    Preconditions.checkArgument(s.getKind() == Kind.STRING, "%s is not a string", s);
    Preconditions.checkArgument(i.getKind() == Kind.INTEGER,
        "Index %s of kind %s", i, i.getKind());
    if (s.isKnown() && i.isKnown()) {
      String string = s.literal();
      BigInteger index = i.literal();
      if (index.signum() >= 0
          && index.compareTo(BigInteger.valueOf(string.length())) < 0) {
        return Value.character(string.charAt(index.intValue()));
      }
      log.debug("Index {} outside {}; result is unconstrained", index, s);
      return context.freshVariable(Kind.CHAR);
    }
    // A negative index is outside every string.
    if (i.isKnown() && i.literal().signum() < 0) {
      log.debug("Negative index {} into {}; result is unconstrained", i, s);
      return context.freshVariable(Kind.CHAR);
    }
    if (context.getOptions().guardOutOfBoundsWitnesses) {
      return Witness.synthesize(context, Kind.CHAR,
          new Witness.WitnessCondition<BigInteger>() {
            @Override
            public Value<Boolean> apply(Context context, Value<BigInteger> c) {
              Value<Boolean> pinned = Operations.equal(context,
                  singleton(context, c), characterAt(context, s, i));
              Value<Boolean> inBounds = Operations.and(context,
                  Operations.lessOrEqual(context, Value.integer(0), i),
                  Operations.lessThan(context, i, length(context, s)));
              return Operations.implies(context, inBounds, pinned);
            }
          });
    }
    return Witness.synthesize(context, Kind.CHAR,
        new WitnessRelation<BigInteger, String>() {
          @Override
          public Value<String> wrap(Context context, Value<BigInteger> c) {
            return singleton(context, c);
          }

          @Override
          public Value<String> target(Context context) {
            return characterAt(context, s, i);
          }
        });
  }

  /** {@code str.at}: the length-1 substring of {@code s} at {@code i} */
  private static Value<String> characterAt(Context context, Value<String> s,
      Value<BigInteger> i) {
    return Lifting.lift(context, Operator.STR_AT, Kind.STRING,
        ImmutableList.<Value<?>>of(s, i));
  }

  /**
   * The string holding exactly {@code chars}, in order. There is no inverse,
   * since the length of a symbolic string is not known.
   */
  public static Value<String> implode(Context context,
      List<? extends Value<BigInteger>> chars) {
    Value<String> result = Value.string("");
    for (int i = chars.size() - 1; i >= 0; i--) {
      result = concat(context, singleton(context, chars.get(i)), result);
    }
    return result;
  }

  /**
   * Applies a character recognizer.
   *
   * @throws UnsupportedOperationException always, until recognizers have a
   *         symbolic encoding; see {@link CharacterClass#isSupported()}
   */
  public static Value<Boolean> classify(Context context, CharacterClass recognizer,
      Value<BigInteger> c) {
    Preconditions.checkNotNull(recognizer);
    throw new UnsupportedOperationException(
        recognizer.getFunctionName() + " is not implemented for symbolic characters");
  }

  /**
   * The backend term for a named regular expression.
   *
   * @throws UnsupportedOperationException always; see
   *         {@link RegexPattern#isSupported()}
   */
  public static String pattern(RegexPattern pattern) {
    Preconditions.checkNotNull(pattern);
    throw new UnsupportedOperationException(
        pattern.getFunctionName() + " is not implemented");
  }

  private static void checkChar(Value<BigInteger> c) {
    Preconditions.checkArgument(c.getKind() == Kind.CHAR,
        "%s is a %s, not a character", c, c.getKind());
  }
}
