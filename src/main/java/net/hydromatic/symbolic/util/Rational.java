/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.symbolic.util;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.math.BigInteger;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Exact rational number.
 *
 * <p>The numerator and denominator are coprime and the denominator is
 * positive, so two rationals are equal if and only if their fields are equal.
 */
public final class Rational implements Comparable<Rational> {
  public static final Rational ZERO = new Rational(BigInteger.ZERO);
  public static final Rational ONE = new Rational(BigInteger.ONE);
  public static final Rational MINUS_ONE =
      new Rational(BigInteger.ONE.negate());
  public static final Rational TWO = new Rational(BigInteger.valueOf(2));
  public static final Rational HALF = of(1, 2);

  public final BigInteger num;
  public final BigInteger den;

  private Rational(BigInteger num) {
    this.num = requireNonNull(num);
    this.den = BigInteger.ONE;
  }

  private Rational(BigInteger num, BigInteger den) {
    this.num = num;
    this.den = den;
  }

  public static Rational of(long n) {
    return of(BigInteger.valueOf(n));
  }

  public static Rational of(BigInteger n) {
    return new Rational(n);
  }

  public static Rational of(long num, long den) {
    return of(BigInteger.valueOf(num), BigInteger.valueOf(den));
  }

  /** Creates a rational, reducing to lowest terms. */
  public static Rational of(BigInteger num, BigInteger den) {
    if (den.signum() == 0) {
      throw new ArithmeticException("division by zero");
    }
    if (den.signum() < 0) {
      num = num.negate();
      den = den.negate();
    }
    final BigInteger g = num.gcd(den);
    if (!g.equals(BigInteger.ONE) && g.signum() != 0) {
      num = num.divide(g);
      den = den.divide(g);
    }
    if (num.signum() == 0) {
      den = BigInteger.ONE;
    }
    return new Rational(num, den);
  }

  @Override public int hashCode() {
    return num.hashCode() * 31 + den.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Rational
            && num.equals(((Rational) o).num)
            && den.equals(((Rational) o).den);
  }

  @Override public int compareTo(Rational o) {
    return num.multiply(o.den).compareTo(o.num.multiply(den));
  }

  @Override public String toString() {
    return isInteger() ? num.toString() : num + "/" + den;
  }

  public int signum() {
    return num.signum();
  }

  public boolean isZero() {
    return num.signum() == 0;
  }

  public boolean isOne() {
    return equals(ONE);
  }

  public boolean isInteger() {
    return den.equals(BigInteger.ONE);
  }

  /** Returns whether this is an integer that fits into an {@code int}. */
  public boolean isSmallInteger() {
    return isInteger() && num.bitLength() < 31;
  }

  /** Returns the value as an {@code int}; throws if not a small integer. */
  public int intValue() {
    checkArgument(isSmallInteger(), "not a small integer: %s", this);
    return num.intValue();
  }

  public double doubleValue() {
    return num.doubleValue() / den.doubleValue();
  }

  public Rational plus(Rational o) {
    if (isInteger() && o.isInteger()) {
      return of(num.add(o.num));
    }
    return of(num.multiply(o.den).add(o.num.multiply(den)),
        den.multiply(o.den));
  }

  public Rational minus(Rational o) {
    return plus(o.negate());
  }

  public Rational times(Rational o) {
    return of(num.multiply(o.num), den.multiply(o.den));
  }

  public Rational divide(Rational o) {
    return of(num.multiply(o.den), den.multiply(o.num));
  }

  public Rational negate() {
    return new Rational(num.negate(), den);
  }

  public Rational abs() {
    return signum() < 0 ? negate() : this;
  }

  public Rational reciprocal() {
    return of(den, num);
  }

  /** Raises to an integer power, which may be negative. */
  public Rational pow(int n) {
    if (n < 0) {
      return reciprocal().pow(-n);
    }
    return of(num.pow(n), den.pow(n));
  }

  /** Returns the exact {@code q}th root of this number, or null if the root
   * is not rational. */
  public @Nullable Rational root(int q) {
    checkArgument(q > 0);
    if (q == 1) {
      return this;
    }
    if (signum() < 0) {
      if (q % 2 == 0) {
        return null;
      }
      final Rational r = negate().root(q);
      return r == null ? null : r.negate();
    }
    final BigInteger n = integerRoot(num, q);
    final BigInteger d = integerRoot(den, q);
    return n == null || d == null ? null : of(n, d);
  }

  private static @Nullable BigInteger integerRoot(BigInteger a, int q) {
    if (a.signum() == 0 || a.equals(BigInteger.ONE)) {
      return a;
    }
    if (q == 2) {
      final BigInteger r = a.sqrt();
      return r.multiply(r).equals(a) ? r : null;
    }
    // binary search for r with r^q == a
    BigInteger lo = BigInteger.ONE;
    BigInteger hi = BigInteger.ONE.shiftLeft(a.bitLength() / q + 1);
    while (lo.compareTo(hi) <= 0) {
      final BigInteger mid = lo.add(hi).shiftRight(1);
      final int c = mid.pow(q).compareTo(a);
      if (c == 0) {
        return mid;
      } else if (c < 0) {
        lo = mid.add(BigInteger.ONE);
      } else {
        hi = mid.subtract(BigInteger.ONE);
      }
    }
    return null;
  }
}

// End Rational.java
