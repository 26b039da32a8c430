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

import static net.hydromatic.symbolic.algebra.Expressions.freeOf;
import static net.hydromatic.symbolic.ast.AlgBuilder.alg;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.symbolic.algebra.Differentiator;
import net.hydromatic.symbolic.algebra.Expressions;
import net.hydromatic.symbolic.algebra.Simplifier;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.ast.Op;
import net.hydromatic.symbolic.ast.Shuttle;
import net.hydromatic.symbolic.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Integration by substitution.
 *
 * <p>Looks for a sub-expression {@code g(x)} such that the integrand is
 * {@code f(g(x)) g'(x)}, up to a constant factor. If one is found, integrates
 * {@code f(u)} with respect to a fresh variable {@code u} and substitutes
 * {@code u = g(x)} back into the result.
 */
public class SubstitutionIntegrator {
  private SubstitutionIntegrator() {}

  /** Tries substitution; for {@link Technique#SUBSTITUTION}. */
  static @Nullable IntegrationResult attempt(Integrator integrator,
      Alg.Exp integrand, Alg.Sym x, Set<Technique> active) {
    final Alg.Sym u = freshSymbol(integrand, x);
    for (Alg.Exp g : candidates(integrand, x)) {
      if (!integrator.budget().hasRemaining()) {
        return null;
      }
      final Alg.Exp r = transform(integrand, x, g, u);
      if (r == null) {
        continue;
      }
      integrator.tracer().onStep(Technique.SUBSTITUTION,
          u + " = " + g + ", integrand " + r);
      final Alg.Exp result = integrator.closedForm(r, u, active);
      if (result != null) {
        return IntegrationResult.closedForm(
            Expressions.substitute(result, u, g));
      }
    }
    return null;
  }

  /** Rewrites {@code f / g'} in terms of {@code u = g}; returns null if the
   * result still contains {@code x}. */
  static Alg.@Nullable Exp transform(Alg.Exp f, Alg.Sym x, Alg.Exp g,
      Alg.Sym u) {
    final Alg.Exp dg = Differentiator.derivative(g, x);
    if (dg.isZero()) {
      return null;
    }
    final Alg.Exp r = Simplifier.simplify(alg.div(f, dg));
    Alg.Exp r2 = Expressions.replace(r, g, u);
    if (g.op == Op.POW
        && ((Alg.Pow) g).base.equals(x)
        && ((Alg.Pow) g).exponent.isNumber()) {
      // g = x^n, so x^m = u^(m/n)
      final Rational n = ((Alg.Num) ((Alg.Pow) g).exponent).value;
      r2 = new PowerShuttle(x, u, n).rewrite(r2);
    } else {
      final Expressions.Linear linear = Expressions.linear(g, x);
      if (linear != null) {
        // g = a x + b, so x = (u - b) / a
        r2 = Expressions.substitute(r2, x,
            alg.div(alg.sub(u, linear.b), linear.a));
      }
    }
    r2 = Simplifier.simplify(r2);
    return freeOf(r2, x) ? r2 : null;
  }

  /** Returns the candidates for {@code g}, most complex first. */
  static List<Alg.Exp> candidates(Alg.Exp f, Alg.Sym x) {
    final Set<Alg.Exp> set = new LinkedHashSet<>();
    for (Alg.Exp e : Expressions.subexpressions(f)) {
      switch (e.op) {
      case APPLY:
        set.add(((Alg.Apply) e).arg);
        set.add(e);
        break;
      case POW:
        set.add(((Alg.Pow) e).base);
        set.add(((Alg.Pow) e).exponent);
        break;
      default:
        break;
      }
    }
    final List<Alg.Exp> list = new ArrayList<>();
    for (Alg.Exp g : set) {
      if (!freeOf(g, x) && !g.equals(x) && !g.equals(f)) {
        list.add(g);
      }
    }
    list.sort(
        Comparator.comparingInt((Alg.Exp g) -> -Expressions.complexity(g))
            .thenComparing(Comparator.naturalOrder()));
    return list;
  }

  /** Returns a symbol that does not occur in an expression. */
  static Alg.Sym freshSymbol(Alg.Exp e, Alg.Sym x) {
    for (int i = 0;; i++) {
      final Alg.Sym u = alg.sym(i == 0 ? "u" : "u" + i);
      if (!u.equals(x) && freeOf(e, u)) {
        return u;
      }
    }
  }

  /** Shuttle that rewrites {@code x^m} as {@code u^(m/n)}, where
   * {@code u = x^n}, if {@code m/n} is an integer. */
  private static class PowerShuttle extends Shuttle {
    private final Alg.Sym x;
    private final Alg.Sym u;
    private final Rational n;

    PowerShuttle(Alg.Sym x, Alg.Sym u, Rational n) {
      this.x = x;
      this.u = u;
      this.n = n;
    }

    @Override protected Alg.Exp visit(Alg.Sym sym) {
      return sym.equals(x) ? power(Rational.ONE, sym) : sym;
    }

    @Override protected Alg.Exp visit(Alg.Pow pow) {
      if (pow.base.equals(x) && pow.exponent.isNumber()) {
        return power(((Alg.Num) pow.exponent).value, pow);
      }
      return super.visit(pow);
    }

    private Alg.Exp power(Rational m, Alg.Exp e) {
      final Rational k = m.divide(n);
      return k.isInteger() ? alg.pow(u, alg.num(k)) : e;
    }
  }
}

// End SubstitutionIntegrator.java
