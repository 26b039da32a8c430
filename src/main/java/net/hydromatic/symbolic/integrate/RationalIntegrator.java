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
package net.hydromatic.symbolic.integrate;

import static net.hydromatic.symbolic.ast.AlgBuilder.alg;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.poly.LinearSystem;
import net.hydromatic.symbolic.poly.Poly;
import net.hydromatic.symbolic.poly.Polynomials;
import net.hydromatic.symbolic.poly.RationalField;
import net.hydromatic.symbolic.poly.RationalFunction;
import net.hydromatic.symbolic.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Integrates rational functions of the variable by partial fractions.
 *
 * <p>The denominator must factor over the rationals into linear factors
 * and irreducible quadratics. Each quadratic {@code x^2 + p x + s} with
 * discriminant {@code D = p^2 - 4 s} gives an arctangent if {@code D < 0},
 * or a logarithm of a quotient if {@code D > 0}; {@code D = 0} cannot
 * occur, because then the root would be rational.
 */
public class RationalIntegrator {
  private static final RationalField Q = RationalField.INSTANCE;

  private RationalIntegrator() {}

  /** Tries partial fractions; for {@link Technique#RATIONAL}. */
  static @Nullable IntegrationResult attempt(Integrator integrator,
      Alg.Exp integrand, Alg.Sym x, Set<Technique> active) {
    final RationalFunction<Rational> f =
        Polynomials.asRationalFunction(integrand, x);
    if (f == null) {
      return null;
    }
    final Alg.Exp e = integrate(f, x, integrator.tracer());
    return e == null ? null : IntegrationResult.closedForm(e);
  }

  /** Integrates a rational function; returns null if its denominator does
   * not factor into linear and quadratic factors over the rationals. */
  public static Alg.@Nullable Exp integrate(RationalFunction<Rational> f,
      Alg.Sym x, Tracer tracer) {
    final Poly.DivRem<Rational> divRem = f.num.divRem(f.den);
    final List<Alg.Exp> terms = new ArrayList<>();
    terms.add(integratePolynomial(divRem.quotient, x));
    if (divRem.remainder.isZero()) {
      return alg.add(terms);
    }

    // Factor the denominator into (x - r)^k and q^k
    final List<Factor> factors = new ArrayList<>();
    Poly<Rational> rest = f.den;
    for (Rational r : Polynomials.rationalRoots(f.den)) {
      final Poly<Rational> linear = Poly.of(Q, r.negate(), Rational.ONE);
      final int k = Polynomials.multiplicity(f.den, r);
      factors.add(new Factor(linear, k));
      rest = rest.divide(linear.pow(k));
    }
    final List<Poly<Rational>> squareFree = Polynomials.squareFree(rest);
    for (int i = 0; i < squareFree.size(); i++) {
      final Poly<Rational> q = squareFree.get(i);
      if (q.isConstant()) {
        continue;
      }
      final List<Poly<Rational>> quadratics =
          q.degree() == 1 ? null : Polynomials.quadraticFactors(q);
      if (quadratics == null) {
        tracer.onStep(Technique.RATIONAL,
            "cannot factor denominator " + f.den);
        return null;
      }
      for (Poly<Rational> quadratic : quadratics) {
        factors.add(new Factor(quadratic, i + 1));
      }
    }

    // Solve for the numerators of the partial fractions
    final List<Poly<Rational>> basis = new ArrayList<>();
    for (Factor factor : factors) {
      for (int j = 1; j <= factor.multiplicity; j++) {
        final Poly<Rational> cofactor = f.den.divide(factor.poly.pow(j));
        if (factor.poly.degree() == 2) {
          basis.add(cofactor.shift(1));
        }
        basis.add(cofactor);
      }
    }
    final int n = basis.size();
    final List<List<Rational>> rows = new ArrayList<>();
    final List<Rational> rhs = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      final List<Rational> row = new ArrayList<>();
      for (Poly<Rational> b : basis) {
        row.add(b.coefficient(i));
      }
      rows.add(row);
      rhs.add(divRem.remainder.coefficient(i));
    }
    final List<Rational> solution = LinearSystem.solve(Q, rows, rhs, n);
    if (solution == null) {
      return null;
    }
    tracer.onStep(Technique.RATIONAL,
        "partial fractions over " + factors + ": " + solution);

    int u = 0;
    for (Factor factor : factors) {
      for (int j = 1; j <= factor.multiplicity; j++) {
        if (factor.poly.degree() == 1) {
          terms.add(linearTerm(solution.get(u++), factor.poly, j, x));
        } else {
          final Rational b = solution.get(u++);
          final Rational c = solution.get(u++);
          terms.add(quadraticTerm(b, c, factor.poly, j, x));
        }
      }
    }
    return alg.add(terms);
  }

  /** Integrates a polynomial termwise. */
  static Alg.Exp integratePolynomial(Poly<Rational> p, Alg.Exp x) {
    final List<Alg.Exp> terms = new ArrayList<>();
    for (int i = 0; i <= p.degree(); i++) {
      final Rational c = p.coefficient(i).divide(Rational.of(i + 1));
      terms.add(alg.mul(alg.num(c), alg.pow(x, i + 1)));
    }
    return alg.add(terms);
  }

  /** Integrates {@code a / (x - r)^j}. */
  private static Alg.Exp linearTerm(Rational a, Poly<Rational> linear, int j,
      Alg.Sym x) {
    final Alg.Exp v = Polynomials.toExp(linear, x);
    if (j == 1) {
      return alg.mul(alg.num(a), alg.ln(alg.abs(v)));
    }
    return alg.div(alg.num(a.negate().divide(Rational.of(j - 1))),
        alg.pow(v, j - 1));
  }

  /** Integrates {@code (b x + c) / q^j} where {@code q = x^2 + p x + s}
   * is irreducible. */
  private static Alg.Exp quadraticTerm(Rational b, Rational c,
      Poly<Rational> q, int j, Alg.Sym x) {
    final Rational p = q.coefficient(1);
    final Alg.Exp qe = Polynomials.toExp(q, x);
    // b x + c = (b/2) (2x + p) + (c - b p / 2)
    final Rational half = b.divide(Rational.TWO);
    final Rational rest = c.minus(half.times(p));
    final Alg.Exp logPart;
    if (j == 1) {
      logPart = alg.mul(alg.num(half), alg.ln(alg.abs(qe)));
    } else {
      logPart = alg.div(alg.num(half.divide(Rational.of(1 - j))),
          alg.pow(qe, j - 1));
    }
    if (rest.isZero()) {
      return logPart;
    }
    return alg.add(logPart,
        alg.mul(alg.num(rest), reciprocalPower(q, j, x)));
  }

  /** Returns the integral of {@code 1 / q^j}, by the reduction formula
   * {@code I(j) = u / (2 (j-1) a^2 q^(j-1)) + (2j-3) / (2 (j-1) a^2) I(j-1)}
   * where {@code u = x + p/2} and {@code a^2 = s - p^2/4}. */
  private static Alg.Exp reciprocalPower(Poly<Rational> q, int j, Alg.Sym x) {
    final Rational p = q.coefficient(1);
    final Rational s = q.coefficient(0);
    final Rational delta = p.times(p).minus(s.times(Rational.of(4)));
    final Alg.Exp twoXPlusP =
        alg.add(alg.mul(alg.num(2), x), alg.num(p));
    if (j == 1) {
      if (delta.signum() < 0) {
        final Alg.Exp root = alg.sqrt(alg.num(delta.negate()));
        return alg.mul(alg.div(alg.num(2), root),
            alg.atan(alg.div(twoXPlusP, root)));
      } else {
        final Alg.Exp root = alg.sqrt(alg.num(delta));
        return alg.div(
            alg.ln(
                alg.abs(
                    alg.div(alg.sub(twoXPlusP, root),
                        alg.add(twoXPlusP, root)))),
            root);
      }
    }
    final Rational a2 = s.minus(p.times(p).divide(Rational.of(4)));
    final Rational k = Rational.of(2L * (j - 1)).times(a2);
    final Alg.Exp u = alg.add(x, alg.num(p.divide(Rational.TWO)));
    return alg.add(
        alg.div(u,
            alg.mul(alg.num(k), alg.pow(Polynomials.toExp(q, x), j - 1))),
        alg.mul(alg.num(Rational.of(2L * j - 3).divide(k)),
            reciprocalPower(q, j - 1, x)));
  }

  /** Irreducible factor of a denominator, with its multiplicity. */
  private static class Factor {
    final Poly<Rational> poly;
    final int multiplicity;

    Factor(Poly<Rational> poly, int multiplicity) {
      this.poly = poly;
      this.multiplicity = multiplicity;
    }

    @Override public String toString() {
      return multiplicity == 1
          ? "(" + poly + ")"
          : "(" + poly + ")^" + multiplicity;
    }
  }
}

// End RationalIntegrator.java
