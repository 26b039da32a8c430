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

import com.google.common.base.CaseFormat;
import java.util.Set;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.integrate.risch.Risch;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Integration technique.
 *
 * <p>{@link Integrator} tries the techniques in declaration order, and the
 * first that produces a result wins. The order is part of the contract:
 * cheap, exact lookups come first, the decision procedure comes last.
 */
public enum Technique {
  /** Lookup in {@link IntegrationTable}. */
  TABLE(IntegrationTable::attempt),
  /** Partial fractions, for rational functions of the variable. */
  RATIONAL(RationalIntegrator::attempt),
  /** Integration by parts, with LIATE ordering and cyclic reduction. */
  BY_PARTS(ByPartsIntegrator::attempt),
  /** Substitution {@code u = g(x)}. */
  SUBSTITUTION(SubstitutionIntegrator::attempt),
  /** Products of powers of sine and cosine. */
  TRIGONOMETRIC(TrigIntegrator::attempt),
  /** Risch decision procedure, for exponential and logarithmic towers. */
  RISCH(Risch::attempt),
  /** Linearity, constant multiples, and expansion of products. */
  BASIC_RULES(BasicRules::attempt);

  /** Name in lower camel case, e.g. "byParts". */
  public final String camelName;
  private final Attempt attempt;

  Technique(Attempt attempt) {
    this.attempt = requireNonNull(attempt);
    this.camelName =
        CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL, name());
  }

  /** Tries this technique. Returns null if it does not apply. */
  @Nullable IntegrationResult attempt(Integrator integrator,
      Alg.Exp integrand, Alg.Sym x, Set<Technique> active) {
    return attempt.apply(integrator, integrand, x, active);
  }

  /** Function that tries to integrate an expression.
   *
   * <p>Returns a result, or null to decline. It may call
   * {@link Integrator#dispatch} on sub-problems; {@code active} is the set
   * of techniques allowed at this point of the call path. */
  @FunctionalInterface
  public interface Attempt {
    @Nullable IntegrationResult apply(Integrator integrator,
        Alg.Exp integrand, Alg.Sym x, Set<Technique> active);
  }
}

// End Technique.java
