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
package net.hydromatic.symbolic.integrate.risch;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.symbolic.integrate.RecursionBudget;
import net.hydromatic.symbolic.poly.Field;
import net.hydromatic.symbolic.poly.LinearSystem;
import net.hydromatic.symbolic.poly.Poly;
import net.hydromatic.symbolic.poly.Polynomials;
import net.hydromatic.symbolic.poly.RationalField;
import net.hydromatic.symbolic.poly.RationalFunction;
import net.hydromatic.symbolic.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Solver for the Risch differential equation {@code D y + f y = g}.
 *
 * <p>Over {@code C(x)} the solver is complete: it weakly normalizes
 * {@code f}, bounds the denominator of {@code y}, bounds the degree of its
 * numerator, and solves for the coefficients. Over higher levels of a
 * tower it handles only the case without cancellation, where {@code f} and
 * {@code g} are polynomials in {@code t} and {@code deg f >= 1}; anything
 * else is {@link Outcome#UNKNOWN}.
 */
class RdeSolver {
  /** Largest degree bound for which the solver will build a linear
   * system. */
  static final int MAX_DEGREE = 200;

  private RdeSolver() {}

  /** Solves {@code D y + f y = g} in the field {@code ext}. */
  static <E> Rde<RationalFunction<E>> solve(Extension<E> ext,
      RationalFunction<E> f, RationalFunction<E> g, RecursionBudget budget) {
    budget.checkCancelled();
    final Rde<RationalFunction<E>> rde =
        ext.kind == Extension.Kind.X
            ? solveBase(ext, f, g, budget)
            : solveNoCancel(ext, f, g, budget);
    if (rde.outcome == Outcome.SOLVED) {
      final RationalFunction<E> y = requireNonNull(rde.y);
      final RationalFunction<E> lhs =
          ext.add(ext.derivative(y), ext.multiply(f, y));
      if (!lhs.equals(g)) {
        return Rde.unknown();
      }
    }
    return rde;
  }

  private static <E> Rde<RationalFunction<E>> solveBase(Extension<E> ext,
      RationalFunction<E> f, RationalFunction<E> g, RecursionBudget budget) {
    final Poly<E> q = weakNormalizer(ext, f);
    if (q == null) {
      return Rde.unknown();
    }
    // With y = z / q, solve D z + f1 z = g1
    final RationalFunction<E> qf = ext.polynomial(q);
    final RationalFunction<E> f1 =
        ext.subtract(f, ext.divide(ext.derivative(qf), qf));
    final RationalFunction<E> g1 = ext.multiply(qf, g);

    // Denominator bound: z = r / h, r a polynomial
    final Poly<E> dn = f1.den;
    final Poly<E> en = g1.den;
    final Poly<E> p = Polynomials.gcd(dn, en);
    final Poly.DivRem<E> hr =
        Polynomials.gcd(en, en.derivative())
            .divRem(Polynomials.gcd(p, p.derivative()));
    if (!hr.remainder.isZero()) {
      return Rde.unknown();
    }
    final Poly<E> h = hr.quotient;

    // a D r + b r = c
    final Poly<E> a = dn.times(h);
    final Poly<E> b = h.times(f1.num).minus(dn.times(ext.derivative(h)));
    final RationalFunction<E> c =
        ext.multiply(ext.polynomial(dn.times(h).times(h)), g1);
    if (!c.isPolynomial()) {
      return Rde.noSolution();
    }
    final Rde<Poly<E>> r = solvePolynomial(ext, a, b, c.num, budget);
    if (r.outcome != Outcome.SOLVED) {
      return r.outcome == Outcome.NO_SOLUTION
          ? Rde.noSolution() : Rde.unknown();
    }
    final RationalFunction<E> z =
        RationalFunction.of(requireNonNull(r.y), h);
    return Rde.solved(ext.divide(z, qf));
  }

  /** Returns {@code q} such that {@code f - D(q)/q} is weakly normalized,
   * that is, has no simple pole whose residue is a positive integer; or
   * null if the residues are not rational. */
  private static <E> @Nullable Poly<E> weakNormalizer(Extension<E> ext,
      RationalFunction<E> f) {
    final Field<E> c = ext.base;
    final Poly<E> fd = f.den;
    Poly<E> q = Poly.one(c);
    if (fd.isConstant()) {
      return q;
    }
    final Poly<E> g = Polynomials.gcd(fd, fd.derivative());
    final Poly<E> dStar = fd.divide(g);
    // d1 is the product of the simple poles
    final Poly<E> d1 = dStar.divide(Polynomials.gcd(dStar, g));
    if (d1.isConstant()) {
      return q;
    }
    final Poly<E> e = fd.divide(d1);
    final Poly<E> a =
        f.num.times(Polynomials.extendedGcd(e, d1).s).mod(d1);
    final Poly<E> dd1 = d1.derivative();
    final List<E> zs = new ArrayList<>();
    final List<E> values = new ArrayList<>();
    for (int i = 0; i <= d1.degree(); i++) {
      final E z = c.fromInteger(i);
      zs.add(z);
      values.add(Polynomials.resultant(d1, a.minus(dd1.scale(z))));
    }
    final Poly<E> r = Polynomials.interpolate(c, zs, values);
    if (r.isZero()) {
      return q;
    }
    final List<Rational> coefficients = new ArrayList<>();
    for (E coefficient : r.coefficients) {
      final Rational v = c.toRational(coefficient);
      if (v == null) {
        return null;
      }
      coefficients.add(v);
    }
    for (Rational n : Polynomials.rationalRoots(
        Poly.of(RationalField.INSTANCE, coefficients))) {
      if (n.isSmallInteger() && n.signum() > 0) {
        q = q.times(
            Polynomials.gcd(a.minus(dd1.scale(c.fromRational(n))), d1)
                .pow(n.intValue()));
      }
    }
    return q;
  }

  /** Solves {@code a D r + b r = c} for a polynomial {@code r} in
   * {@code C[x]}. */
  private static <E> Rde<Poly<E>> solvePolynomial(Extension<E> ext,
      Poly<E> a, Poly<E> b, Poly<E> c, RecursionBudget budget) {
    final Field<E> field = ext.base;
    final Poly<E> g = Polynomials.gcd(a, b);
    if (!c.mod(g).isZero()) {
      return Rde.noSolution();
    }
    a = a.divide(g);
    b = b.divide(g);
    c = c.divide(g);
    if (c.isZero()) {
      return Rde.solved(Poly.zero(field));
    }
    final int da = a.degree();
    final int db = b.degree();
    final int dc = c.degree();
    int n;
    if (b.isZero()) {
      n = dc - da + 1;
    } else {
      n = Math.max(0, dc - Math.max(db, da - 1));
      if (db == da - 1) {
        final Rational alpha =
            field.toRational(field.negate(field.divide(b.lc(), a.lc())));
        if (alpha != null && alpha.isSmallInteger() && alpha.signum() >= 0) {
          n = Math.max(n, alpha.intValue());
        }
      }
    }
    if (n < 0) {
      return Rde.noSolution();
    }
    if (n > MAX_DEGREE) {
      return Rde.unknown();
    }

    // Unknowns are the coefficients r_0 .. r_n; one equation per power
    final int rowCount = Math.max(dc, Math.max(da + n - 1, db + n)) + 1;
    final List<Poly<E>> columns = new ArrayList<>();
    for (int j = 0; j <= n; j++) {
      final Poly<E> xj = Poly.monomial(field, field.one(), j);
      columns.add(ext.derivative(xj).times(a).plus(xj.times(b)));
    }
    final List<List<E>> rows = new ArrayList<>();
    final List<E> rhs = new ArrayList<>();
    for (int k = 0; k < rowCount; k++) {
      final List<E> row = new ArrayList<>();
      for (Poly<E> column : columns) {
        row.add(column.coefficient(k));
      }
      rows.add(row);
      rhs.add(c.coefficient(k));
    }
    budget.checkCancelled();
    final List<E> solution = LinearSystem.solve(field, rows, rhs, n + 1);
    if (solution == null) {
      return Rde.noSolution();
    }
    return Rde.solved(Poly.of(field, solution));
  }

  /** Solves {@code D y + f y = g} at a level {@code K(t)} above
   * {@code C(x)}, for {@code f} and {@code g} in {@code K[t]} with
   * {@code deg f >= 1}. Then {@code deg y = deg g - deg f}, and the
   * leading coefficients of {@code y} are found one at a time. */
  private static <E> Rde<RationalFunction<E>> solveNoCancel(
      Extension<E> ext, RationalFunction<E> f, RationalFunction<E> g,
      RecursionBudget budget) {
    if (!f.isPolynomial() || !g.isPolynomial() || f.num.degree() < 1) {
      return Rde.unknown();
    }
    // If t is primitive, a solution must be a polynomial in t; if t is
    // an exponential, it might have a pole at t = 0.
    final Rde<RationalFunction<E>> none =
        ext.kind == Extension.Kind.LOG ? Rde.noSolution() : Rde.unknown();
    final Poly<E> b = f.num;
    Poly<E> c = g.num;
    Poly<E> q = Poly.zero(ext.base);
    int n = c.degree() - b.degree();
    while (!c.isZero()) {
      budget.checkCancelled();
      final int m = c.degree() - b.degree();
      if (n < 0 || m < 0 || m > n) {
        return none;
      }
      final Poly<E> p =
          Poly.monomial(ext.base, ext.base.divide(c.lc(), b.lc()), m);
      q = q.plus(p);
      n = m - 1;
      c = c.minus(ext.derivative(p)).minus(b.times(p));
    }
    return Rde.solved(ext.polynomial(q));
  }

  /** Outcome of solving a Risch differential equation. */
  enum Outcome {
    SOLVED,
    /** There is provably no solution in the field. */
    NO_SOLUTION,
    /** The solver could not decide. */
    UNKNOWN
  }

  /** Result of solving a Risch differential equation.
   *
   * @param <F> Type of the solution */
  static class Rde<F> {
    final Outcome outcome;
    final @Nullable F y;

    private Rde(Outcome outcome, @Nullable F y) {
      this.outcome = requireNonNull(outcome);
      this.y = y;
    }

    static <F> Rde<F> solved(F y) {
      return new Rde<>(Outcome.SOLVED, requireNonNull(y));
    }

    static <F> Rde<F> noSolution() {
      return new Rde<>(Outcome.NO_SOLUTION, null);
    }

    static <F> Rde<F> unknown() {
      return new Rde<>(Outcome.UNKNOWN, null);
    }
  }
}

// End RdeSolver.java
