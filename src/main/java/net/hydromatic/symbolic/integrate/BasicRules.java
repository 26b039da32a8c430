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
import net.hydromatic.symbolic.algebra.Expressions;
import net.hydromatic.symbolic.algebra.Simplifier;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rules that reduce an integral to simpler integrals: linearity over sums,
 * constant multiples, and expansion of products and powers of sums.
 */
public class BasicRules {
  private BasicRules() {}

  /** Tries the basic rules; for {@link Technique#BASIC_RULES}. */
  static @Nullable IntegrationResult attempt(Integrator integrator,
      Alg.Exp integrand, Alg.Sym x, Set<Technique> active) {
    if (integrand.op == Op.ADD) {
      return sum(integrator, (Alg.Add) integrand, x, active);
    }
    final Expressions.Split split = Expressions.split(integrand, x);
    if (!split.constant.isOne() && !split.dependent.isOne()) {
      if (!integrator.budget().hasRemaining()) {
        return null;
      }
      final IntegrationResult result =
          integrator.dispatch(split.dependent, x, active);
      return scale(result, split.constant, integrand, x);
    }
    final Alg.Exp expanded = Simplifier.expand(integrand);
    if (!expanded.equals(integrand)
        && integrator.budget().hasRemaining()) {
      integrator.tracer().onStep(Technique.BASIC_RULES,
          "expand to " + expanded);
      final IntegrationResult result =
          integrator.dispatch(expanded, x, active);
      return scale(result, alg.num(1), integrand, x);
    }
    return null;
  }

  /** Integrates a sum term by term. */
  private static @Nullable IntegrationResult sum(Integrator integrator,
      Alg.Add add, Alg.Sym x, Set<Technique> active) {
    final List<Alg.Exp> terms = new ArrayList<>();
    IntegrationResult.NonElementary nonElementary = null;
    for (Alg.Exp term : add.terms) {
      if (!integrator.budget().hasRemaining()) {
        return null;
      }
      final IntegrationResult result = integrator.dispatch(term, x, active);
      switch (result.kind) {
      case CLOSED_FORM:
        terms.add(result.exp());
        break;
      case NON_ELEMENTARY:
        if (nonElementary != null) {
          // two non-elementary terms may cancel
          return null;
        }
        nonElementary = (IntegrationResult.NonElementary) result;
        break;
      default:
        return null;
      }
    }
    if (nonElementary != null) {
      return IntegrationResult.nonElementary(alg.integral(add, x),
          "term " + nonElementary.integral + " is non-elementary: "
              + nonElementary.reason);
    }
    return IntegrationResult.closedForm(alg.add(terms));
  }

  /** Converts the result of a sub-problem to a result for the original
   * integrand, which is {@code c} times the sub-problem's integrand. */
  private static @Nullable IntegrationResult scale(IntegrationResult result,
      Alg.Exp c, Alg.Exp integrand, Alg.Sym x) {
    switch (result.kind) {
    case CLOSED_FORM:
      return IntegrationResult.closedForm(alg.mul(c, result.exp()));
    case NON_ELEMENTARY:
      return IntegrationResult.nonElementary(alg.integral(integrand, x),
          ((IntegrationResult.NonElementary) result).reason);
    default:
      return null;
    }
  }
}

// End BasicRules.java
