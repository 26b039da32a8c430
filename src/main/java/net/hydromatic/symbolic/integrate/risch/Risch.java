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
import static net.hydromatic.symbolic.ast.AlgBuilder.alg;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import net.hydromatic.symbolic.algebra.Simplifier;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.integrate.IntegrationResult;
import net.hydromatic.symbolic.integrate.Integrator;
import net.hydromatic.symbolic.integrate.RecursionBudget;
import net.hydromatic.symbolic.integrate.Technique;
import net.hydromatic.symbolic.integrate.Tracer;
import net.hydromatic.symbolic.poly.Poly;
import net.hydromatic.symbolic.poly.Polynomials;
import net.hydromatic.symbolic.poly.RationalFunction;
import net.hydromatic.symbolic.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Risch decision procedure for integrands in a tower of exponential and
 * logarithmic extensions of {@code Q(x)}.
 *
 * <p>At each level {@code K(t)}, the integrand is split into a normal part
 * and a polynomial part. Hermite reduction and the Rothstein-Trager
 * resultant integrate the normal part; the polynomial part is integrated
 * by the power rule (at {@code Q(x)}), by solving a Risch differential
 * equation per coefficient (if {@code t} is an exponential), or from the
 * leading coefficient down (if {@code t} is a logarithm).
 *
 * <p>The result is a closed form; {@link IntegrationResult.NonElementary}
 * if the procedure proves there is none; or null (decline) if the
 * integrand is outside the class handled, or if a step reaches a case that
 * is not implemented (such as a Risch differential equation with
 * cancellation).
 */
public class Risch {
  private final DifferentialExtensionTower tower;
  private final Tracer tracer;
  private final RecursionBudget budget;

  private Risch(DifferentialExtensionTower tower, Tracer tracer,
      RecursionBudget budget) {
    this.tower = requireNonNull(tower);
    this.tracer = requireNonNull(tracer);
    this.budget = requireNonNull(budget);
  }

  /** Integrates, or returns null to decline. Never dispatches to other
   * techniques. */
  public static @Nullable IntegrationResult attempt(Integrator integrator,
      Alg.Exp integrand, Alg.Sym x, Set<Technique> active) {
    final Tracer tracer = integrator.tracer();
    try {
      final IntegrationResult trig =
          TrigRisch.attempt(integrator, integrand, x);
      if (trig != null) {
        return trig;
      }
      final DifferentialExtensionTower tower =
          TowerBuilder.build(integrand, x);
      if (tower == null) {
        tracer.onStep(Technique.RISCH, "no tower for " + integrand);
        return null;
      }
      step(tracer, State.BUILD_TOWER, tower);
      final Object f = tower.toElement(integrand, tower.top());
      if (f == null) {
        return null;
      }
      step(tracer, State.EXPRESS_AS_RATIONAL, f);
      final Risch risch = new Risch(tower, tracer, integrator.budget());
      final Antiderivative<Object> antiderivative =
          risch.integrate(tower.top(), f);
      if (antiderivative == null) {
        return null;
      }
      final Alg.Exp result = risch.toExp(antiderivative);
      step(tracer, State.BACK_SUBSTITUTE, result);
      return IntegrationResult.closedForm(result);
    } catch (NonElementaryException e) {
      final String reason = String.valueOf(e.getMessage());
      tracer.onStep(Technique.RISCH, "not elementary: " + reason);
      return IntegrationResult.nonElementary(alg.integral(integrand, x),
          reason);
    }
  }

  private static void step(Tracer tracer, State state, Object detail) {
    tracer.onStep(Technique.RISCH, state + ": " + detail);
  }

  private void step(int level, State state, Object detail) {
    tracer.onStep(Technique.RISCH,
        state + " (level " + level + "): " + detail);
  }

  /** Converts an element of a level to an expression, for messages. */
  private Alg.Exp render(Object e, int level) {
    return Simplifier.simplify(tower.toExp(e, level));
  }

  /** Converts {@code g + Σ c ln(v)} at the top level to an expression. */
  private Alg.Exp toExp(Antiderivative<Object> antiderivative) {
    final int top = tower.top();
    final List<Alg.Exp> terms = new ArrayList<>();
    terms.add(tower.toExp(antiderivative.rational, top));
    for (LogarithmicPartTerm<Object> log : antiderivative.logs) {
      terms.add(
          alg.mul(alg.num(log.coefficient),
              alg.ln(alg.abs(tower.toExp(log.argument, top)))));
    }
    return alg.add(terms);
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  private @Nullable Antiderivative<Object> integrate(int level, Object f) {
    return (Antiderivative) integrate(level, (Extension) tower.level(level),
        (RationalFunction) f);
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  private RdeSolver.Rde<Object> solveRde(int level, Object f, Object g) {
    return (RdeSolver.Rde) RdeSolver.solve((Extension) tower.level(level),
        (RationalFunction) f, (RationalFunction) g, budget);
  }

  private <E> @Nullable Antiderivative<RationalFunction<E>> integrate(
      int level, Extension<E> ext, RationalFunction<E> f) {
    budget.checkCancelled();
    if (f.isZero()) {
      return new Antiderivative<>(ext.zero(), ImmutableList.of());
    }

    // If t is an exponential, t^m in the denominator is special; split
    // f = s/t^m + r/d0 with t coprime to d0
    final Poly<E> den = f.den;
    int m = 0;
    if (ext.kind == Extension.Kind.EXP) {
      while (ext.base.isZero(den.coefficient(m))) {
        ++m;
      }
    }
    final Poly<E> tm = Poly.monomial(ext.base, ext.base.one(), m);
    final Poly<E> d0 = den.divide(tm);
    Poly<E> normal = f.num;
    if (m > 0) {
      final Polynomials.Diophantine<E> split =
          Polynomials.solveDiophantine(d0, tm, f.num);
      if (split == null) {
        return null;
      }
      normal = split.t;
    }
    normal = normal.mod(d0);

    final HermiteReduction.Result<E> hermite =
        HermiteReduction.reduce(ext, normal, d0);
    if (hermite == null) {
      return null;
    }
    step(level, State.HERMITE_REDUCE, hermite.g);

    final List<LogarithmicPartTerm<RationalFunction<E>>> logs =
        LogarithmicPart.compute(ext, hermite.b, hermite.e,
            e -> render(e, level - 1));
    if (logs == null) {
      tracer.onStep(Technique.RISCH, "irrational residues");
      return null;
    }
    step(level, State.SOLVE_LOGARITHMIC_PART, logs);

    // What remains is a polynomial (a Laurent polynomial if t is an
    // exponential)
    RationalFunction<E> p = ext.subtract(f, ext.derivative(hermite.g));
    for (LogarithmicPartTerm<RationalFunction<E>> log : logs) {
      final RationalFunction<E> v = log.argument;
      p = ext.subtract(p,
          ext.multiply(ext.fromRational(log.coefficient),
              ext.divide(ext.derivative(v), v)));
    }
    final Antiderivative<RationalFunction<E>> polynomialPart;
    switch (ext.kind) {
    case X:
      polynomialPart = integratePolynomial(ext, p);
      break;
    case EXP:
      polynomialPart = integrateLaurentPolynomial(level, ext, p);
      break;
    case LOG:
      polynomialPart = integratePrimitivePolynomial(level, ext, p);
      break;
    default:
      throw new AssertionError("unknown kind " + ext.kind);
    }
    if (polynomialPart == null) {
      return null;
    }
    return new Antiderivative<>(
        ext.add(hermite.g, polynomialPart.rational),
        ImmutableList.<LogarithmicPartTerm<RationalFunction<E>>>builder()
            .addAll(logs).addAll(polynomialPart.logs).build());
  }

  /** Integrates a polynomial in {@code x} by the power rule. */
  private static <E> @Nullable Antiderivative<RationalFunction<E>>
      integratePolynomial(Extension<E> ext, RationalFunction<E> p) {
    if (!p.isPolynomial()) {
      return null;
    }
    final List<E> coefficients = new ArrayList<>();
    coefficients.add(ext.base.zero());
    for (int i = 0; i <= p.num.degree(); i++) {
      coefficients.add(
          ext.base.divide(p.num.coefficient(i), ext.base.fromInteger(i + 1)));
    }
    return new Antiderivative<>(
        ext.polynomial(Poly.of(ext.base, coefficients)), ImmutableList.of());
  }

  /** Integrates {@code Σ a_i t^i}, where {@code t = exp(η)}. The
   * coefficient of {@code t^0} is integrated in {@code K}; for
   * {@code i ≠ 0}, {@code ∫ a_i t^i = y_i t^i} where
   * {@code D y_i + i η' y_i = a_i}. */
  private <E> @Nullable Antiderivative<RationalFunction<E>>
      integrateLaurentPolynomial(int level, Extension<E> ext,
      RationalFunction<E> p) {
    final Poly<E> den = p.den;
    final int k = den.degree();
    if (!den.equals(Poly.monomial(ext.base, ext.base.one(), k))) {
      return null;
    }
    final E dEta = ext.dt.coefficient(1);
    RationalFunction<E> rational = ext.zero();
    final List<LogarithmicPartTerm<RationalFunction<E>>> logs =
        new ArrayList<>();
    for (int j = 0; j <= p.num.degree(); j++) {
      final E a = p.num.coefficient(j);
      if (ext.base.isZero(a)) {
        continue;
      }
      final int i = j - k;
      if (i == 0) {
        final Antiderivative<Object> lower = integrate(level - 1, a);
        if (lower == null) {
          return null;
        }
        final Antiderivative<RationalFunction<E>> lifted =
            lower.map(e -> ext.constant(this.<E>cast(e)));
        rational = ext.add(rational, lifted.rational);
        logs.addAll(lifted.logs);
        continue;
      }
      final E f = ext.base.multiply(ext.base.fromInteger(i), dEta);
      final RdeSolver.Rde<Object> rde = solveRde(level - 1, f, a);
      switch (rde.outcome) {
      case NO_SOLUTION:
        throw new NonElementaryException("Dy + "
            + alg.mul(render(f, level - 1), alg.sym("y")) + " = "
            + render(a, level - 1) + " has no solution, so the integral of "
            + alg.mul(render(a, level - 1), alg.pow(ext.kernel, i))
            + " is not elementary");
      case UNKNOWN:
        tracer.onStep(Technique.RISCH,
            "cannot solve Dy + "
                + alg.mul(render(f, level - 1), alg.sym("y")) + " = "
                + render(a, level - 1));
        return null;
      default:
        final E y = cast(requireNonNull(rde.y));
        rational = ext.add(rational,
            ext.multiply(ext.constant(y), ext.pow(ext.t(), i)));
      }
    }
    return new Antiderivative<>(rational, logs);
  }

  /** Integrates {@code Σ a_i t^i}, where {@code t = ln(η)}, from the
   * leading coefficient down. Each leading coefficient {@code a_n} must
   * integrate to {@code b + c t} with {@code b} in {@code K} and
   * {@code c} constant; then {@code c/(n+1) t^(n+1) + b t^n} accounts
   * for {@code a_n t^n}. */
  private <E> @Nullable Antiderivative<RationalFunction<E>>
      integratePrimitivePolynomial(int level, Extension<E> ext,
      RationalFunction<E> p) {
    if (!p.isPolynomial()) {
      return null;
    }
    final DiffField<E> base = ext.base;
    final E dt = ext.dt.coefficient(0);
    RationalFunction<E> rational = ext.zero();
    final List<LogarithmicPartTerm<RationalFunction<E>>> logs =
        new ArrayList<>();
    Poly<E> q = p.num;
    while (!q.isZero()) {
      budget.checkCancelled();
      final int n = q.degree();
      final Antiderivative<Object> lower = integrate(level - 1, q.lc());
      if (lower == null) {
        return null;
      }
      if (n == 0) {
        final Antiderivative<RationalFunction<E>> lifted =
            lower.map(e -> ext.constant(this.<E>cast(e)));
        rational = ext.add(rational, lifted.rational);
        logs.addAll(lifted.logs);
        break;
      }
      Rational c = Rational.ZERO;
      for (LogarithmicPartTerm<Object> log : lower.logs) {
        // c ln(v) is a multiple of t only if D(v)/v is a constant
        // multiple of D(t)
        final E v = cast(log.argument);
        final Rational ratio =
            base.toRational(
                base.divide(base.divide(base.derivative(v), v), dt));
        if (ratio == null) {
          final Alg.Exp lc = render(q.lc(), level - 1);
          throw new NonElementaryException("the integral of " + lc
              + " contains ln(" + render(v, level - 1)
              + "), so the integral of " + alg.mul(lc, alg.pow(ext.kernel, n))
              + " is not elementary");
        }
        c = c.plus(log.coefficient.times(ratio));
      }
      final E top = base.fromRational(c.divide(Rational.of(n + 1)));
      final Poly<E> term =
          Poly.monomial(base, top, n + 1)
              .plus(Poly.monomial(base, this.<E>cast(lower.rational), n));
      rational = ext.add(rational, ext.polynomial(term));
      final Poly<E> next = q.minus(ext.derivative(term));
      if (next.degree() >= n) {
        return null;
      }
      q = next;
    }
    return new Antiderivative<>(rational, logs);
  }

  @SuppressWarnings("unchecked")
  private <E> E cast(Object o) {
    return (E) o;
  }

  /** Stage of the procedure; each is reported to the tracer as it
   * completes. */
  public enum State {
    BUILD_TOWER,
    EXPRESS_AS_RATIONAL,
    HERMITE_REDUCE,
    SOLVE_LOGARITHMIC_PART,
    BACK_SUBSTITUTE
  }
}

// End Risch.java
