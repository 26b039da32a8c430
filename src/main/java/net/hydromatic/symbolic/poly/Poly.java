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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Dense univariate polynomial with coefficients in a field.
 *
 * <p>Coefficients are stored from the constant term upwards, without
 * trailing zeros; the zero polynomial has no coefficients and degree -1.
 *
 * @param <E> Coefficient type
 */
public final class Poly<E> {
  public final Field<E> field;
  public final ImmutableList<E> coefficients;

  private Poly(Field<E> field, ImmutableList<E> coefficients) {
    this.field = requireNonNull(field);
    this.coefficients = requireNonNull(coefficients);
  }

  /** Creates a polynomial from its coefficients, constant term first. */
  public static <E> Poly<E> of(Field<E> field, List<E> coefficients) {
    int n = coefficients.size();
    while (n > 0 && field.isZero(coefficients.get(n - 1))) {
      --n;
    }
    return new Poly<>(field, ImmutableList.copyOf(coefficients.subList(0, n)));
  }

  @SafeVarargs
  public static <E> Poly<E> of(Field<E> field, E... coefficients) {
    return of(field, Arrays.asList(coefficients));
  }

  public static <E> Poly<E> zero(Field<E> field) {
    return new Poly<>(field, ImmutableList.of());
  }

  public static <E> Poly<E> constant(Field<E> field, E c) {
    return of(field, ImmutableList.of(c));
  }

  public static <E> Poly<E> one(Field<E> field) {
    return constant(field, field.one());
  }

  /** Returns {@code c t^n}. */
  public static <E> Poly<E> monomial(Field<E> field, E c, int n) {
    final List<E> list = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      list.add(field.zero());
    }
    list.add(c);
    return of(field, list);
  }

  /** Returns the polynomial {@code t}. */
  public static <E> Poly<E> t(Field<E> field) {
    return monomial(field, field.one(), 1);
  }

  @Override public int hashCode() {
    return coefficients.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Poly
        && coefficients.equals(((Poly<?>) o).coefficients);
  }

  @Override public String toString() {
    if (isZero()) {
      return "0";
    }
    final StringBuilder b = new StringBuilder();
    for (int i = degree(); i >= 0; i--) {
      final E c = coefficients.get(i);
      if (field.isZero(c)) {
        continue;
      }
      if (b.length() > 0) {
        b.append(" + ");
      }
      if (i == 0 || !field.isOne(c)) {
        b.append('(').append(c).append(')');
        if (i > 0) {
          b.append('*');
        }
      }
      if (i > 0) {
        b.append('t');
        if (i > 1) {
          b.append('^').append(i);
        }
      }
    }
    return b.toString();
  }

  /** Returns the degree; -1 for the zero polynomial. */
  public int degree() {
    return coefficients.size() - 1;
  }

  public boolean isZero() {
    return coefficients.isEmpty();
  }

  /** Returns whether this polynomial has degree 0 or is zero. */
  public boolean isConstant() {
    return coefficients.size() <= 1;
  }

  public boolean isOne() {
    return coefficients.size() == 1 && field.isOne(coefficients.get(0));
  }

  /** Returns the coefficient of {@code t^i}, zero if {@code i} is out of
   * range. */
  public E coefficient(int i) {
    return i >= 0 && i < coefficients.size()
        ? coefficients.get(i)
        : field.zero();
  }

  /** Returns the leading coefficient; zero for the zero polynomial. */
  public E lc() {
    return coefficient(degree());
  }

  public Poly<E> plus(Poly<E> o) {
    final int n = Math.max(coefficients.size(), o.coefficients.size());
    final List<E> list = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      list.add(field.add(coefficient(i), o.coefficient(i)));
    }
    return of(field, list);
  }

  public Poly<E> minus(Poly<E> o) {
    return plus(o.negate());
  }

  public Poly<E> negate() {
    return scale(field.negate(field.one()));
  }

  public Poly<E> times(Poly<E> o) {
    if (isZero() || o.isZero()) {
      return zero(field);
    }
    final List<E> list = new ArrayList<>();
    for (int i = 0; i <= degree() + o.degree(); i++) {
      list.add(field.zero());
    }
    for (int i = 0; i < coefficients.size(); i++) {
      final E a = coefficients.get(i);
      if (field.isZero(a)) {
        continue;
      }
      for (int j = 0; j < o.coefficients.size(); j++) {
        list.set(i + j,
            field.add(list.get(i + j),
                field.multiply(a, o.coefficients.get(j))));
      }
    }
    return of(field, list);
  }

  /** Multiplies every coefficient by a scalar. */
  public Poly<E> scale(E c) {
    final List<E> list = new ArrayList<>(coefficients.size());
    for (E a : coefficients) {
      list.add(field.multiply(a, c));
    }
    return of(field, list);
  }

  /** Multiplies by {@code t^n}. */
  public Poly<E> shift(int n) {
    return times(monomial(field, field.one(), n));
  }

  public Poly<E> pow(int n) {
    checkArgument(n >= 0);
    Poly<E> result = one(field);
    for (int i = 0; i < n; i++) {
      result = result.times(this);
    }
    return result;
  }

  /** Divides by a non-zero polynomial, returning quotient and
   * remainder. */
  public DivRem<E> divRem(Poly<E> divisor) {
    if (divisor.isZero()) {
      throw new ArithmeticException("division by zero polynomial");
    }
    final List<E> r = new ArrayList<>(coefficients);
    final int dd = divisor.degree();
    final int n = degree() - dd;
    if (n < 0) {
      return new DivRem<>(zero(field), this);
    }
    final List<E> q = new ArrayList<>();
    for (int i = 0; i <= n; i++) {
      q.add(field.zero());
    }
    final E lc = divisor.lc();
    for (int i = n; i >= 0; i--) {
      final E c = field.divide(r.get(i + dd), lc);
      q.set(i, c);
      if (field.isZero(c)) {
        continue;
      }
      for (int j = 0; j <= dd; j++) {
        r.set(i + j,
            field.subtract(r.get(i + j),
                field.multiply(c, divisor.coefficients.get(j))));
      }
    }
    return new DivRem<>(of(field, q), of(field, r));
  }

  /** Divides exactly; throws if the remainder is not zero. */
  public Poly<E> divide(Poly<E> divisor) {
    final DivRem<E> divRem = divRem(divisor);
    checkArgument(divRem.remainder.isZero(), "%s does not divide %s",
        divisor, this);
    return divRem.quotient;
  }

  public Poly<E> mod(Poly<E> divisor) {
    return divRem(divisor).remainder;
  }

  /** Returns this polynomial divided by its leading coefficient. */
  public Poly<E> monic() {
    if (isZero() || field.isOne(lc())) {
      return this;
    }
    return scale(field.reciprocal(lc()));
  }

  /** Returns the formal derivative with respect to {@code t}. */
  public Poly<E> derivative() {
    final List<E> list = new ArrayList<>();
    for (int i = 1; i < coefficients.size(); i++) {
      list.add(field.multiply(field.fromInteger(i), coefficients.get(i)));
    }
    return of(field, list);
  }

  /** Evaluates at a point, by Horner's rule. */
  public E evaluate(E t) {
    E result = field.zero();
    for (int i = degree(); i >= 0; i--) {
      result = field.add(field.multiply(result, t), coefficients.get(i));
    }
    return result;
  }

  /** Converts to a polynomial over another field, mapping each
   * coefficient. */
  public <F> Poly<F> map(Field<F> field2, Function<E, F> fn) {
    final List<F> list = new ArrayList<>(coefficients.size());
    for (E a : coefficients) {
      list.add(fn.apply(a));
    }
    return of(field2, list);
  }

  /** Quotient and remainder.
   *
   * @param <E> Coefficient type */
  public static class DivRem<E> {
    public final Poly<E> quotient;
    public final Poly<E> remainder;

    DivRem(Poly<E> quotient, Poly<E> remainder) {
      this.quotient = quotient;
      this.remainder = remainder;
    }
  }
}

// End Poly.java
