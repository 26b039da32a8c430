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
package net.hydromatic.symbolic.poly;

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * Quotient of two polynomials, in lowest terms, with monic denominator.
 *
 * <p>Because the representation is unique, {@link #equals} is equality of
 * rational functions.
 *
 * @param <E> Coefficient type
 */
public final class RationalFunction<E> {
  public final Poly<E> num;
  public final Poly<E> den;

  RationalFunction(Poly<E> num, Poly<E> den) {
    this.num = requireNonNull(num);
    this.den = requireNonNull(den);
  }

  /** Creates a rational function, reducing it to lowest terms. */
  public static <E> RationalFunction<E> of(Poly<E> num, Poly<E> den) {
    if (den.isZero()) {
      throw new ArithmeticException("division by zero polynomial");
    }
    if (num.isZero()) {
      return new RationalFunction<>(num, Poly.one(num.field));
    }
    if (!den.isConstant()) {
      final Poly<E> g = Polynomials.gcd(num, den);
      if (!g.isConstant()) {
        num = num.divide(g);
        den = den.divide(g);
      }
    }
    final E lc = den.lc();
    return new RationalFunction<>(num.scale(num.field.reciprocal(lc)),
        den.monic());
  }

  /** Creates a polynomial, as a rational function. */
  public static <E> RationalFunction<E> of(Poly<E> num) {
    return new RationalFunction<>(num, Poly.one(num.field));
  }

  @Override public int hashCode() {
    return Objects.hash(num, den);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof RationalFunction
        && num.equals(((RationalFunction<?>) o).num)
        && den.equals(((RationalFunction<?>) o).den);
  }

  @Override public String toString() {
    return den.isOne() ? num.toString() : "(" + num + ")/(" + den + ")";
  }

  public boolean isZero() {
    return num.isZero();
  }

  /** Returns whether the denominator is 1. */
  public boolean isPolynomial() {
    return den.isOne();
  }
}

// End RationalFunction.java
