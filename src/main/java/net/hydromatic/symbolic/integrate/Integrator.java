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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.symbolic.ast.AlgBuilder.alg;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import net.hydromatic.symbolic.algebra.Simplifier;
import net.hydromatic.symbolic.algebra.Verifier;
import net.hydromatic.symbolic.ast.Alg;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Symbolic integrator.
 *
 * <p>The static {@link #integrate} methods are the entry point. Each call
 * creates an {@code Integrator} that holds the state of that call: its
 * {@link RecursionBudget}, tracer and options. Techniques that need to
 * integrate a sub-problem call {@link #dispatch} on it.
 *
 * <p>No exception escapes from {@code integrate}. If a call is cancelled, or
 * something unexpected goes wrong, the result is the unevaluated integral.
 */
public class Integrator {
  /** All techniques, in the order they are tried. */
  public static final Set<Technique> ALL_TECHNIQUES =
      Sets.immutableEnumSet(EnumSet.allOf(Technique.class));

  private final RecursionBudget budget;
  private final Tracer tracer;
  private final boolean rischEnabled;
  private final boolean verify;

  private Integrator(Map<Prop, Object> options, Tracer tracer,
      CancellationToken token) {
    this.budget =
        new RecursionBudget(Prop.MAX_DEPTH.intValue(options),
            Prop.MAX_DISPATCHES.intValue(options), token);
    this.tracer = requireNonNull(tracer);
    this.rischEnabled = Prop.RISCH_ENABLED.booleanValue(options);
    this.verify = Prop.VERIFY.booleanValue(options);
  }

  /** Integrates an expression with respect to a variable, with default
   * options. */
  public static IntegrationResult integrate(Alg.Exp integrand, Alg.Sym x) {
    return integrate(integrand, x, ImmutableMap.of());
  }

  /** Integrates an expression with respect to a variable. */
  public static IntegrationResult integrate(Alg.Exp integrand, Alg.Sym x,
      Map<Prop, Object> options) {
    return integrate(integrand, x, options, Tracers.empty(),
        CancellationToken.create());
  }

  /** Integrates an expression with respect to a variable, reporting
   * progress to a tracer and giving up if a token is cancelled. */
  public static IntegrationResult integrate(Alg.Exp integrand, Alg.Sym x,
      Map<Prop, Object> options, Tracer tracer, CancellationToken token) {
    final Alg.Integral integral = alg.integral(integrand, x);
    try {
      final Map<Prop, Object> validOptions = Prop.validate(options);
      final int timeoutMillis = Prop.TIMEOUT_MILLIS.intValue(validOptions);
      final CancellationToken token2 =
          timeoutMillis > 0 ? token.orTimeout(timeoutMillis) : token;
      final Integrator integrator =
          new Integrator(validOptions, tracer, token2);
      final IntegrationResult result =
          integrator.dispatch(integrand, x, ALL_TECHNIQUES);
      if (result.isClosedForm()) {
        final IntegrationResult.ClosedForm closedForm =
            (IntegrationResult.ClosedForm) result;
        return closedForm.withAntiderivative(
            Simplifier.simplify(closedForm.antiderivative));
      }
      return result;
    } catch (IntegrationCancelledException e) {
      return IntegrationResult.fallback(integral, true);
    } catch (RuntimeException e) {
      tracer.onException(e);
      return IntegrationResult.fallback(integral, false);
    }
  }

  public Tracer tracer() {
    return tracer;
  }

  public RecursionBudget budget() {
    return budget;
  }

  /** Returns whether the Risch procedure may be used. */
  public boolean rischEnabled() {
    return rischEnabled;
  }

  /** Integrates an expression using the given techniques, in order.
   *
   * <p>Takes one unit of depth from the budget for the duration of the
   * call. If the budget is exhausted, no technique is tried and the result is
   * the unevaluated integral.
   *
   * @param integrand Expression to integrate
   * @param x Variable of integration
   * @param active Techniques that may be tried, usually those that were
   *   active in the calling dispatch
   */
  public IntegrationResult dispatch(Alg.Exp integrand, Alg.Sym x,
      Set<Technique> active) {
    budget.checkCancelled();
    if (!budget.enter()) {
      tracer.onBudgetExhausted(integrand, budget.depth());
      return IntegrationResult.fallback(alg.integral(integrand, x), false);
    }
    try {
      for (Technique technique : active) {
        if (technique == Technique.RISCH) {
          if (!rischEnabled) {
            continue;
          }
          budget.checkCancelled();
        }
        tracer.onAttempt(technique, integrand, budget.depth());
        IntegrationResult result =
            technique.attempt(this, integrand, x, active);
        if (result == null || result.isFallback()) {
          continue;
        }
        if (result.isClosedForm()) {
          final IntegrationResult.ClosedForm closedForm =
              ((IntegrationResult.ClosedForm) result).withTechnique(technique);
          if (verify
              && Verifier.check(closedForm.antiderivative, integrand, x)
                  == Verifier.Verdict.REFUTED) {
            tracer.onStep(technique, "refuted " + closedForm);
            continue;
          }
          result = closedForm;
        }
        tracer.onSuccess(technique, integrand, result);
        return result;
      }
      return IntegrationResult.fallback(alg.integral(integrand, x), false);
    } finally {
      budget.exit();
    }
  }

  /** Integrates a sub-problem and returns its antiderivative, or null if
   * the result is not a closed form. */
  public Alg.@Nullable Exp closedForm(Alg.Exp integrand, Alg.Sym x,
      Set<Technique> active) {
    final IntegrationResult result = dispatch(integrand, x, active);
    return result.isClosedForm()
        ? ((IntegrationResult.ClosedForm) result).antiderivative
        : null;
  }

  /** Returns a set of techniques without the given technique. */
  public static Set<Technique> without(Set<Technique> active,
      Technique technique) {
    if (!active.contains(technique)) {
      return active;
    }
    final EnumSet<Technique> set = EnumSet.noneOf(Technique.class);
    set.addAll(active);
    set.remove(technique);
    return Sets.immutableEnumSet(set);
  }
}

// End Integrator.java
