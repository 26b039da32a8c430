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

import net.hydromatic.symbolic.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Field of rational functions {@code K(t)} over a coefficient field
 * {@code K}.
 *
 * @param <E> Coefficient type
 */
public class RationalFunctionField<E> implements Field<RationalFunction<E>> {
  public final Field<E> coefficientField;
  private final RationalFunction<E> zero;
  private final RationalFunction<E> one;

  public RationalFunctionField(Field<E> coefficientField) {
    this.coefficientField = requireNonNull(coefficientField);
    this.zero = RationalFunction.of(Poly.zero(coefficientField));
    this.one = RationalFunction.of(Poly.one(coefficientField));
  }

  @Override public String toString() {
    return coefficientField + "(t)";
  }

  /** Embeds a coefficient as a constant rational function. */
  public RationalFunction<E> constant(E c) {
    return RationalFunction.of(Poly.constant(coefficientField, c));
  }

  /** Embeds a polynomial. */
  public RationalFunction<E> polynomial(Poly<E> p) {
    return RationalFunction.of(p);
  }

  /** Returns the rational function {@code t}. */
  public RationalFunction<E> t() {
    return RationalFunction.of(Poly.t(coefficientField));
  }

  /** If an element is a constant, returns it as a coefficient; otherwise
   * returns null. */
  public @Nullable E toConstant(RationalFunction<E> a) {
    if (a.num.isConstant() && a.den.isConstant()) {
      return a.num.coefficient(0);
    }
    return null;
  }

  @Override public RationalFunction<E> zero() {
    return zero;
  }

  @Override public RationalFunction<E> one() {
    return one;
  }

  @Override public RationalFunction<E> add(RationalFunction<E> a,
      RationalFunction<E> b) {
    if (a.den.equals(b.den)) {
      return RationalFunction.of(a.num.plus(b.num), a.den);
    }
    return RationalFunction.of(a.num.times(b.den).plus(b.num.times(a.den)),
        a.den.times(b.den));
  }

  @Override public RationalFunction<E> subtract(RationalFunction<E> a,
      RationalFunction<E> b) {
    return add(a, negate(b));
  }

  @Override public RationalFunction<E> multiply(RationalFunction<E> a,
      RationalFunction<E> b) {
    if (a.isZero() || b.isZero()) {
      return zero;
    }
    return RationalFunction.of(a.num.times(b.num), a.den.times(b.den));
  }

  @Override public RationalFunction<E> divide(RationalFunction<E> a,
      RationalFunction<E> b) {
    if (b.isZero()) {
      throw new ArithmeticException("division by zero");
    }
    return RationalFunction.of(a.num.times(b.den), a.den.times(b.num));
  }

  @Override public RationalFunction<E> negate(RationalFunction<E> a) {
    return new RationalFunction<>(a.num.negate(), a.den);
  }

  @Override public boolean isZero(RationalFunction<E> a) {
    return a.isZero();
  }

  @Override public RationalFunction<E> fromRational(Rational r) {
    return constant(coefficientField.fromRational(r));
  }

  @Override public @Nullable Rational toRational(RationalFunction<E> a) {
    final E c = toConstant(a);
    return c == null ? null : coefficientField.toRational(c);
  }
}

// End RationalFunctionField.java
