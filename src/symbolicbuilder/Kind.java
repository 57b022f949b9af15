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

/**
 * The semantic type of a {@link Value}. A kind fixes the Java class of the
 * literals it admits and, for bounded integral kinds, their range.
 * <p>
 * Kinds are compared by identity; the constants below are the only instances.
 *
 * @param <T> the Java class of this kind's literals
 */
public final class Kind<T> {
  public static final Kind<Boolean> BOOL =
      new Kind<Boolean>("Bool", Boolean.class, false, 0);
  /** Mathematical (unbounded) integers */
  public static final Kind<BigInteger> INTEGER =
      new Kind<BigInteger>("Integer", BigInteger.class, true, 0);
  public static final Kind<BigInteger> WORD8 = unsigned(8);
  public static final Kind<BigInteger> WORD16 = unsigned(16);
  public static final Kind<BigInteger> WORD32 = unsigned(32);
  public static final Kind<BigInteger> WORD64 = unsigned(64);
  public static final Kind<BigInteger> INT8 = signed(8);
  public static final Kind<BigInteger> INT16 = signed(16);
  public static final Kind<BigInteger> INT32 = signed(32);
  public static final Kind<BigInteger> INT64 = signed(64);
  /** Strings over the ISO-8859-1 character set */
  public static final Kind<String> STRING =
      new Kind<String>("String", String.class, false, 0);

  /**
   * The symbolic character. As far as symbolic strings are concerned a
   * character is an unsigned 8-bit value.
   */
  public static final Kind<BigInteger> CHAR = WORD8;

  /** Largest character code a {@link #STRING} literal may contain */
  public static final int MAX_CHAR = 255;

  private final String name;
  private final Class<T> literalClass;
  private final boolean signed;
  /** Width in bits of a bounded integral kind; 0 if unbounded or not integral */
  private final int bits;
  private final boolean integral;

  private Kind(String name, Class<T> literalClass, boolean signed, int bits) {
    this.name = name;
    this.literalClass = literalClass;
    this.signed = signed;
    this.bits = bits;
    this.integral = literalClass == BigInteger.class;
  }

  private static Kind<BigInteger> unsigned(int bits) {
    return new Kind<BigInteger>("Word" + bits, BigInteger.class, false, bits);
  }

  private static Kind<BigInteger> signed(int bits) {
    return new Kind<BigInteger>("Int" + bits, BigInteger.class, true, bits);
  }

  public String getName() {
    return name;
  }

  public Class<T> getLiteralClass() {
    return literalClass;
  }

  public boolean isIntegral() {
    return integral;
  }

  /** True for integral kinds with a fixed width */
  public boolean isBounded() {
    return integral && bits > 0;
  }

  public boolean isSigned() {
    return signed;
  }

  public int getBits() {
    return bits;
  }

  /** Smallest literal of a bounded integral kind */
  public BigInteger minValue() {
    Preconditions.checkState(isBounded(), "%s has no minimum", name);
    return signed ? BigInteger.ONE.shiftLeft(bits - 1).negate() : BigInteger.ZERO;
  }

  /** Largest literal of a bounded integral kind */
  public BigInteger maxValue() {
    Preconditions.checkState(isBounded(), "%s has no maximum", name);
    return (signed ? BigInteger.ONE.shiftLeft(bits - 1)
        : BigInteger.ONE.shiftLeft(bits)).subtract(BigInteger.ONE);
  }

  /**
   * @return true if {@code literal} is an instance of this kind's literal class
   *         and, for bounded kinds, lies within range. Strings must only
   *         contain characters up to {@link #MAX_CHAR}.
   */
  public boolean isValidLiteral(Object literal) {
    if (!literalClass.isInstance(literal)) {
      return false;
    }
    if (isBounded()) {
      BigInteger n = (BigInteger) literal;
      return n.compareTo(minValue()) >= 0 && n.compareTo(maxValue()) <= 0;
    }
    if (this == STRING) {
      String s = (String) literal;
      for (int i = 0; i < s.length(); i++) {
        if (s.charAt(i) > MAX_CHAR) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Reduces an integer into this kind's range the way a fixed-width machine
   * conversion does: modulo 2^bits, then reinterpreted as signed if this kind
   * is signed. The identity on {@link #INTEGER}.
   */
  public BigInteger wrap(BigInteger n) {
    Preconditions.checkState(integral, "%s is not integral", name);
    if (!isBounded()) {
      return n;
    }
    BigInteger modulus = BigInteger.ONE.shiftLeft(bits);
    BigInteger reduced = n.mod(modulus);
    if (signed && reduced.testBit(bits - 1)) {
      reduced = reduced.subtract(modulus);
    }
    return reduced;
  }

  /** Casts a literal already known to be valid for this kind */
  T cast(Object literal) {
    return literalClass.cast(literal);
  }

  @Override
  public String toString() {
    return name;
  }
}
