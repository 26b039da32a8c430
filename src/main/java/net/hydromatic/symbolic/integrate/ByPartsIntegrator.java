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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import net.hydromatic.symbolic.algebra.Differentiator;
import net.hydromatic.symbolic.algebra.Expressions;
import net.hydromatic.symbolic.algebra.Simplifier;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.ast.Fn;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Integration by parts, {@code ∫u dv = u v - ∫v du}.
 *
 * <p>The factor {@code u} is chosen by the LIATE heuristic. Repeated
 * application builds a chain {@code I = acc + coeff ∫current}; if
 * {@code current} comes back to the original integrand, the chain is solved
 * as the linear equation {@code I = acc + coeff I}.
 */
public class ByPartsIntegrator {
  /** Maximum number of links in a chain. */
  private static final int MAX_CHAIN = 8;

  private ByPartsIntegrator() {}

  /** Tries integration by parts; for {@link Technique#BY_PARTS}. */
  static @Nullable IntegrationResult attempt(Integrator integrator,
      Alg.Exp integrand, Alg.Sym x, Set<Technique> active) {
    final Expressions.Split split = Expressions.split(integrand, x);
    final Alg.Exp f = Simplifier.simplify(split.dependent);
    if (f.isOne()) {
      return null;
    }
    // Nested dispatches do not use by-parts; the chain does the repetition.
    final Set<Technique> nested =
        Integrator.without(active, Technique.BY_PARTS);
    for (Candidate candidate : candidates(f, x)) {
      final Alg.Exp result = chain(integrator, f, x, candidate, nested);
      if (result != null) {
        return IntegrationResult.closedForm(alg.mul(split.constant, result));
      }
    }
    return null;
  }

  /** Follows a chain that starts with a given choice of {@code u}. */
  private static Alg.@Nullable Exp chain(Integrator integrator, Alg.Exp f,
      Alg.Sym x, Candidate candidate, Set<Technique> nested) {
    Step step = step(integrator, candidate, x, nested);
    if (step == null) {
      return null;
    }
    Alg.Exp acc = alg.num(0);
    // Free of x, but not necessarily a number; e.g. -1/a^2 for
    // exp(a*x)*sin(x)
    Alg.Exp coeff = alg.num(1);
    for (int i = 0; i < MAX_CHAIN; i++) {
      integrator.tracer().onStep(Technique.BY_PARTS,
          "u = " + step.u + ", dv = " + step.dv + ", v = " + step.v);
      // coeff * ∫(u dv) = coeff * u v - coeff * ∫(v du)
      acc = alg.add(acc, alg.mul(coeff, step.u, step.v));
      final Expressions.Split split =
          Expressions.split(
              Simplifier.simplify(
                  alg.mul(step.v, Differentiator.derivative(step.u, x))), x);
      coeff = Simplifier.simplify(alg.negate(alg.mul(coeff, split.constant)));
      final Alg.Exp current = split.dependent;
      if (coeff.isZero()) {
        return acc;
      }
      if (current.equals(f)) {
        // I = acc + coeff * I
        final Alg.Exp denominator =
            Simplifier.simplify(alg.sub(alg.num(1), coeff));
        if (denominator.isZero()) {
          return null;
        }
        integrator.tracer().onStep(Technique.BY_PARTS,
            "cyclic; solve I = " + acc + " + " + coeff + " * I");
        return alg.div(acc, denominator);
      }
      if (!integrator.budget().hasRemaining()) {
        return null;
      }
      final Alg.Exp rest = integrator.closedForm(current, x, nested);
      if (rest != null) {
        return alg.add(acc, alg.mul(coeff, rest));
      }
      step = null;
      for (Candidate next : candidates(current, x)) {
        step = step(integrator, next, x, nested);
        if (step != null) {
          break;
        }
      }
      if (step == null) {
        return null;
      }
    }
    return null;
  }

  /** Computes {@code v} for a choice of {@code u} and {@code dv}; returns
   * null if {@code dv} cannot be integrated or the choice makes no
   * progress. */
  private static @Nullable Step step(Integrator integrator,
      Candidate candidate, Alg.Sym x, Set<Technique> nested) {
    if (!integrator.budget().hasRemaining()) {
      return null;
    }
    final Alg.Exp v = integrator.closedForm(candidate.dv, x, nested);
    if (v == null) {
      return null;
    }
    if (candidate.liate == Fn.Liate.LOGARITHMIC && containsLn(v)) {
      // e.g. ∫ln(x)/x, which is a substitution
      return null;
    }
    return new Step(candidate.u, candidate.dv, v);
  }

  /** Returns the ways to split an integrand into {@code u dv}, best
   * first. */
  static List<Candidate> candidates(Alg.Exp f, Alg.Sym x) {
    final List<Alg.Exp> factors = Expressions.factors(f);
    if (factors.size() == 1) {
      final Fn.Liate liate = liate(f, x);
      if (liate == Fn.Liate.LOGARITHMIC || liate == Fn.Liate.INVERSE_TRIG) {
        return ImmutableList.of(new Candidate(f, alg.num(1), liate));
      }
      return ImmutableList.of();
    }
    final List<Candidate> list = new ArrayList<>();
    for (int i = 0; i < factors.size(); i++) {
      final Alg.Exp u = factors.get(i);
      final Fn.Liate liate = liate(u, x);
      if (liate == null) {
        continue;
      }
      final List<Alg.Exp> others = new ArrayList<>(factors);
      others.remove(i);
      final Alg.Exp dv = alg.mul(others);
      switch (liate) {
      case LOGARITHMIC:
      case INVERSE_TRIG:
      case ALGEBRAIC:
        list.add(new Candidate(u, dv, liate));
        break;
      case TRIGONOMETRIC:
        if (liate(dv, x) == Fn.Liate.EXPONENTIAL) {
          list.add(new Candidate(u, dv, liate));
        }
        break;
      default:
        break;
      }
    }
    list.sort(Comparator.comparing((Candidate c) -> c.liate));
    return list;
  }

  /** Returns the LIATE class of a factor, or null if it has none. */
  static Fn.@Nullable Liate liate(Alg.Exp e, Alg.Sym x) {
    if (Expressions.freeOf(e, x)) {
      return null;
    }
    switch (e.op) {
    case SYMBOL:
      return Fn.Liate.ALGEBRAIC;
    case POW:
      final Alg.Pow pow = (Alg.Pow) e;
      final Integer n = Expressions.intValue(pow.exponent);
      if (n == null || n <= 0) {
        return null;
      }
      if (pow.base.equals(x)) {
        return Fn.Liate.ALGEBRAIC;
      }
      if (pow.base.isCallTo(Fn.LN)) {
        return Fn.Liate.LOGARITHMIC;
      }
      return null;
    case APPLY:
      final Fn fn = ((Alg.Apply) e).fn;
      return fn == Fn.ABS ? null : fn.liate;
    default:
      return null;
    }
  }

  private static boolean containsLn(Alg.Exp e) {
    if (e.isCallTo(Fn.LN)) {
      return true;
    }
    for (Alg.Exp arg : e.args()) {
      if (containsLn(arg)) {
        return true;
      }
    }
    return false;
  }

  /** Choice of {@code u} and {@code dv}. */
  static class Candidate {
    final Alg.Exp u;
    final Alg.Exp dv;
    final Fn.Liate liate;

    Candidate(Alg.Exp u, Alg.Exp dv, Fn.Liate liate) {
      this.u = u;
      this.dv = dv;
      this.liate = liate;
    }

    @Override public String toString() {
      return "u = " + u + ", dv = " + dv;
    }
  }

  /** Candidate with {@code v = ∫dv}. */
  private static class Step {
    final Alg.Exp u;
    final Alg.Exp dv;
    final Alg.Exp v;

    Step(Alg.Exp u, Alg.Exp dv, Alg.Exp v) {
      this.u = u;
      this.dv = dv;
      this.v = v;
    }
  }
}

// End ByPartsIntegrator.java
