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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import net.hydromatic.symbolic.algebra.Differentiator;
import net.hydromatic.symbolic.algebra.Expressions;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.ast.Fn;
import net.hydromatic.symbolic.ast.Op;
import net.hydromatic.symbolic.poly.Poly;
import net.hydromatic.symbolic.poly.RationalField;
import net.hydromatic.symbolic.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Integrates {@code c sin(θ)^k cos(θ)^n}, where {@code θ = a x + b} and
 * {@code k} and {@code n} are integers.
 *
 * <p>If {@code k} is odd and positive, substitutes {@code u = cos θ} and
 * uses {@code sin^2 = 1 - cos^2}; if {@code n} is odd and positive,
 * substitutes {@code u = sin θ}. The result is then a Laurent polynomial in
 * {@code u}. If both are even and non-negative, expands using
 * {@code sin^2 = (1 - cos 2θ)/2} and {@code cos^2 = (1 + cos 2θ)/2}, and
 * integrates each power of {@code cos 2θ} by a nested dispatch.
 */
public class TrigIntegrator {
  private TrigIntegrator() {}

  /** Tries the sine-cosine reduction; for
   * {@link Technique#TRIGONOMETRIC}. */
  static @Nullable IntegrationResult attempt(Integrator integrator,
      Alg.Exp integrand, Alg.Sym x, Set<Technique> active) {
    final Expressions.Split split = Expressions.split(integrand, x);
    final SinCos sinCos = SinCos.of(split.dependent, x);
    if (sinCos == null) {
      return null;
    }
    final Alg.Exp a = Differentiator.derivative(sinCos.theta, x);
    final Alg.Exp sin = alg.sin(sinCos.theta);
    final Alg.Exp cos = alg.cos(sinCos.theta);
    final Alg.Exp result;
    if (sinCos.k > 0 && sinCos.k % 2 == 1) {
      // ∫sin^k cos^n = -1/a ∫(1 - u^2)^((k-1)/2) u^n du, u = cos θ
      integrator.tracer().onStep(Technique.TRIGONOMETRIC, "u = " + cos);
      result = alg.mul(alg.negate(alg.div(split.constant, a)),
          laurent((sinCos.k - 1) / 2, sinCos.n, cos));
    } else if (sinCos.n > 0 && sinCos.n % 2 == 1) {
      // ∫sin^k cos^n = 1/a ∫(1 - u^2)^((n-1)/2) u^k du, u = sin θ
      integrator.tracer().onStep(Technique.TRIGONOMETRIC, "u = " + sin);
      result = alg.mul(alg.div(split.constant, a),
          laurent((sinCos.n - 1) / 2, sinCos.k, sin));
    } else if (sinCos.k >= 0 && sinCos.n >= 0) {
      final Alg.Exp e = halfAngle(integrator, sinCos, x, active);
      if (e == null) {
        return null;
      }
      result = alg.mul(split.constant, e);
    } else {
      return null;
    }
    return IntegrationResult.closedForm(result);
  }

  /** Returns the antiderivative, with respect to {@code u}, of
   * {@code (1 - u^2)^m u^p}, with {@code u} replaced by an expression. */
  private static Alg.Exp laurent(int m, int p, Alg.Exp u) {
    // (1 - u^2)^m u^p = sum over j of C(m, j) (-1)^j u^(2j + p)
    final Map<Integer, Rational> terms = new TreeMap<>();
    BigInteger binomial = BigInteger.ONE;
    for (int j = 0; j <= m; j++) {
      final Rational c = Rational.of(j % 2 == 0 ? binomial : binomial.negate());
      terms.merge(2 * j + p, c, Rational::plus);
      binomial = binomial.multiply(BigInteger.valueOf(m - j))
          .divide(BigInteger.valueOf(j + 1));
    }
    final List<Alg.Exp> list = new ArrayList<>();
    terms.forEach((power, c) -> {
      if (power == -1) {
        list.add(alg.mul(alg.num(c), alg.ln(alg.abs(u))));
      } else {
        list.add(
            alg.mul(alg.num(c.divide(Rational.of(power + 1))),
                alg.pow(u, power + 1)));
      }
    });
    return alg.add(list);
  }

  /** Integrates {@code sin^k cos^n} with {@code k} and {@code n} even and
   * non-negative. */
  private static Alg.@Nullable Exp halfAngle(Integrator integrator,
      SinCos sinCos, Alg.Sym x, Set<Technique> active) {
    final RationalField q = RationalField.INSTANCE;
    // in terms of w = cos 2θ
    final Poly<Rational> sin2 =
        Poly.of(q, Rational.HALF, Rational.HALF.negate());
    final Poly<Rational> cos2 = Poly.of(q, Rational.HALF, Rational.HALF);
    final Poly<Rational> p =
        sin2.pow(sinCos.k / 2).times(cos2.pow(sinCos.n / 2));
    final Alg.Exp w =
        alg.cos(alg.mul(alg.num(2), sinCos.theta));
    integrator.tracer().onStep(Technique.TRIGONOMETRIC,
        "half-angle, w = " + w + ": " + p);
    final List<Alg.Exp> list = new ArrayList<>();
    for (int j = 0; j <= p.degree(); j++) {
      final Rational c = p.coefficient(j);
      if (c.isZero()) {
        continue;
      }
      if (j == 0) {
        list.add(alg.mul(alg.num(c), x));
        continue;
      }
      if (!integrator.budget().hasRemaining()) {
        return null;
      }
      final Alg.Exp e = integrator.closedForm(alg.pow(w, j), x, active);
      if (e == null) {
        return null;
      }
      list.add(alg.mul(alg.num(c), e));
    }
    return alg.add(list);
  }

  /** Integrand decomposed as {@code sin(θ)^k cos(θ)^n}. */
  static class SinCos {
    final Alg.Exp theta;
    final int k;
    final int n;

    SinCos(Alg.Exp theta, int k, int n) {
      this.theta = theta;
      this.k = k;
      this.n = n;
    }

    /** Decomposes an expression; returns null if it does not have the
     * form. */
    static @Nullable SinCos of(Alg.Exp e, Alg.Sym x) {
      Alg.Exp theta = null;
      int k = 0;
      int n = 0;
      for (Alg.Exp factor : Expressions.factors(e)) {
        Alg.Exp base = factor;
        int power = 1;
        if (factor.op == Op.POW) {
          final Integer i = Expressions.intValue(((Alg.Pow) factor).exponent);
          if (i == null) {
            return null;
          }
          base = ((Alg.Pow) factor).base;
          power = i;
        }
        if (!base.isCallTo(Fn.SIN) && !base.isCallTo(Fn.COS)) {
          return null;
        }
        final Alg.Exp arg = ((Alg.Apply) base).arg;
        if (theta == null) {
          if (Expressions.linear(arg, x) == null) {
            return null;
          }
          theta = arg;
        } else if (!theta.equals(arg)) {
          return null;
        }
        if (base.isCallTo(Fn.SIN)) {
          k += power;
        } else {
          n += power;
        }
      }
      return theta == null ? null : new SinCos(theta, k, n);
    }
  }
}

// End TrigIntegrator.java
