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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.symbolic.algebra.Expressions;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.ast.Fn;
import net.hydromatic.symbolic.integrate.IntegrationResult;
import net.hydromatic.symbolic.integrate.Integrator;
import net.hydromatic.symbolic.integrate.Technique;
import net.hydromatic.symbolic.poly.GaussianField;
import net.hydromatic.symbolic.poly.GaussianRational;
import net.hydromatic.symbolic.poly.Poly;
import net.hydromatic.symbolic.poly.Polynomials;
import net.hydromatic.symbolic.poly.RationalField;
import net.hydromatic.symbolic.poly.RationalFunction;
import net.hydromatic.symbolic.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Risch procedure for {@code ∫ R(x) cos(a x + b)} and
 * {@code ∫ R(x) sin(a x + b)}, with {@code R} in {@code Q(x)} and
 * {@code a}, {@code b} rational.
 *
 * <p>Writing {@code θ = a x + b}, {@code ∫ R e^(iθ) = y e^(iθ)} where
 * {@code y' + i a y = R} has a solution {@code y} in {@code Q(i)(x)};
 * if it has none, neither integral is elementary. With
 * {@code y = y_r + i y_i}, {@code ∫ R cos θ = y_r cos θ - y_i sin θ} and
 * {@code ∫ R sin θ = y_r sin θ + y_i cos θ}.
 */
class TrigRisch {
  private TrigRisch() {}

  /** Integrates if the integrand has the form {@code R(x) sin(θ)} or
   * {@code R(x) cos(θ)}; otherwise returns null. */
  @SuppressWarnings("unchecked")
  static @Nullable IntegrationResult attempt(Integrator integrator,
      Alg.Exp integrand, Alg.Sym x) {
    Alg.@Nullable Apply trig = null;
    final List<Alg.Exp> rest = new ArrayList<>();
    for (Alg.Exp factor : Expressions.factors(integrand)) {
      if ((factor.isCallTo(Fn.SIN) || factor.isCallTo(Fn.COS))
          && !Expressions.freeOf(factor, x)) {
        if (trig != null) {
          return null;
        }
        trig = (Alg.Apply) factor;
      } else {
        rest.add(factor);
      }
    }
    if (trig == null) {
      return null;
    }
    final Expressions.Linear linear = Expressions.linear(trig.arg, x);
    if (linear == null || !linear.a.isNumber() || !linear.b.isNumber()) {
      return null;
    }
    final RationalFunction<Rational> r =
        Polynomials.asRationalFunction(alg.mul(rest), x);
    if (r == null) {
      return null;
    }
    final Rational a = ((Alg.Num) linear.a).value;
    integrator.tracer().onStep(Technique.RISCH,
        "solving y' + " + a + " i y = " + r);

    final DifferentialExtensionTower tower =
        DifferentialExtensionTower.base(x, GaussianField.INSTANCE);
    final Extension<GaussianRational> ext =
        (Extension<GaussianRational>) tower.level(0);
    final RationalFunction<GaussianRational> f =
        ext.constant(GaussianRational.of(Rational.ZERO, a));
    final RationalFunction<GaussianRational> g =
        RationalFunction.of(complex(r.num), complex(r.den));
    final RdeSolver.Rde<RationalFunction<GaussianRational>> rde =
        RdeSolver.solve(ext, f, g, integrator.budget());
    switch (rde.outcome) {
    case NO_SOLUTION:
      final String reason = "y' + " + a + " i y = " + r
          + " has no rational solution";
      integrator.tracer().onStep(Technique.RISCH, "not elementary: " + reason);
      return IntegrationResult.nonElementary(alg.integral(integrand, x),
          reason);
    case UNKNOWN:
      return null;
    default:
      break;
    }

    // y = n / d = n conj(d) / (d conj(d)), whose denominator is real
    final RationalFunction<GaussianRational> y = requireNonNull(rde.y);
    final Poly<GaussianRational> conj =
        y.den.map(GaussianField.INSTANCE, GaussianRational::conjugate);
    final Poly<GaussianRational> num = y.num.times(conj);
    final Poly<Rational> den =
        y.den.times(conj).map(RationalField.INSTANCE, c -> c.re);
    final Alg.Exp yr =
        Polynomials.toExp(
            RationalFunction.of(num.map(RationalField.INSTANCE, c -> c.re),
                den), x);
    final Alg.Exp yi =
        Polynomials.toExp(
            RationalFunction.of(num.map(RationalField.INSTANCE, c -> c.im),
                den), x);
    final Alg.Exp sin = alg.sin(trig.arg);
    final Alg.Exp cos = alg.cos(trig.arg);
    final Alg.Exp result =
        trig.fn == Fn.COS
            ? alg.sub(alg.mul(yr, cos), alg.mul(yi, sin))
            : alg.add(alg.mul(yr, sin), alg.mul(yi, cos));
    return IntegrationResult.closedForm(result);
  }

  private static Poly<GaussianRational> complex(Poly<Rational> p) {
    return p.map(GaussianField.INSTANCE, GaussianRational::of);
  }
}

// End TrigRisch.java
