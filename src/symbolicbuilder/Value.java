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

import java.math.BigInteger;

/**
 * A value in a symbolic computation: either a known literal, or an unknown
 * standing for the node of an expression graph that computes it. There are
 * exactly two implementations, and values are immutable.
 * <p>
 * Known values can be created from any valid literal. Unknown values are only
 * ever created by a {@link Context}.
 *
 * @param <T> the Java class of the literals of this value's {@link Kind}
 */
public abstract class Value<T> {
  /**
   * Exhaustive case analysis over the two kinds of value.
   *
   * @param <T> the literal class of the value visited
   * @param <R> the result of the visit
   */
  public interface Visitor<T, R> {
    R visitKnown(Kind<T> kind, T literal);

    R visitUnknown(Kind<T> kind, NodeId node);
  }

  private final Kind<T> kind;

  private Value(Kind<T> kind) {
    this.kind = Preconditions.checkNotNull(kind);
  }

  /**
   * @throws IllegalArgumentException if {@code literal} is not a valid literal
   *         of {@code kind}
   */
  public static <T> Value<T> known(Kind<T> kind, T literal) {
    Preconditions.checkArgument(kind.isValidLiteral(literal),
        "%s is not a literal of kind %s", literal, kind);
    return new Known<T>(kind, literal);
  }

  static <T> Value<T> unknown(Kind<T> kind, NodeId node) {
    return new Unknown<T>(kind, Preconditions.checkNotNull(node));
  }

  public static Value<Boolean> bool(boolean b) {
    return known(Kind.BOOL, b);
  }

  public static Value<BigInteger> integer(long n) {
    return known(Kind.INTEGER, BigInteger.valueOf(n));
  }

  /** A known character; {@code code} must be in 0..255 */
  public static Value<BigInteger> character(int code) {
    return known(Kind.CHAR, BigInteger.valueOf(code));
  }

  public static Value<String> string(String s) {
    return known(Kind.STRING, s);
  }

  public Kind<T> getKind() {
    return kind;
  }

  /** Whether the value is fully determined at construction time */
  public abstract boolean isKnown();

  /**
   * @return the literal of a known value
   * @throws IllegalStateException if this value is unknown
   */
  public abstract T literal();

  /**
   * @return the graph node of an unknown value
   * @throws IllegalStateException if this value is known
   */
  public abstract NodeId node();

  public abstract <R> R accept(Visitor<T, R> visitor);

  private static final class Known<T> extends Value<T> {
    private final T literal;

    Known(Kind<T> kind, T literal) {
      super(kind);
      this.literal = literal;
    }

    @Override
    public boolean isKnown() {
      return true;
    }

    @Override
    public T literal() {
      return literal;
    }

    @Override
    public NodeId node() {
      throw new IllegalStateException("Known value has no node: " + this);
    }

    @Override
    public <R> R accept(Visitor<T, R> visitor) {
      return visitor.visitKnown(getKind(), literal);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Known)) {
        return false;
      }
      Known<?> other = (Known<?>) obj;
      return getKind() == other.getKind() && literal.equals(other.literal);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(getKind().getName(), literal);
    }

    @Override
    public String toString() {
      if (getKind() == Kind.STRING) {
        return "\"" + literal + "\"";
      }
      return literal.toString();
    }
  }

  private static final class Unknown<T> extends Value<T> {
    private final NodeId node;

    Unknown(Kind<T> kind, NodeId node) {
      super(kind);
      this.node = node;
    }

    @Override
    public boolean isKnown() {
      return false;
    }

    @Override
    public T literal() {
      throw new IllegalStateException("Unknown value has no literal: " + this);
    }

    @Override
    public NodeId node() {
      return node;
    }

    @Override
    public <R> R accept(Visitor<T, R> visitor) {
      return visitor.visitUnknown(getKind(), node);
    }

    // Two unknowns are equal iff they reference the same node; the structure
    // below the node is the context's concern.
    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Unknown)) {
        return false;
      }
      return node.equals(((Unknown<?>) obj).node);
    }

    @Override
    public int hashCode() {
      return node.hashCode();
    }

    @Override
    public String toString() {
      return node.toString();
    }
  }
}
