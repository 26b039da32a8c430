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

import java.util.function.Function;
import java.util.function.Predicate;
import net.hydromatic.symbolic.ast.Alg;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Rule in the {@link IntegrationTable}: if an integrand matches
 * {@link #pattern} and the bindings satisfy {@link #condition}, its
 * antiderivative is {@link #template} applied to the bindings. */
public class IntegrationRule {
  public final String name;
  public final Pattern pattern;
  public final Predicate<Pattern.Bindings> condition;
  public final Function<Pattern.Bindings, Alg.Exp> template;
  /** An integrand in {@code x} that this rule matches. */
  public final Alg.Exp sample;

  IntegrationRule(String name, Pattern pattern,
      Predicate<Pattern.Bindings> condition,
      Function<Pattern.Bindings, Alg.Exp> template, Alg.Exp sample) {
    this.name = requireNonNull(name);
    this.pattern = requireNonNull(pattern);
    this.condition = requireNonNull(condition);
    this.template = requireNonNull(template);
    this.sample = requireNonNull(sample);
  }

  @Override public String toString() {
    return name;
  }

  /** Applies this rule to an integrand; returns the antiderivative, or null
   * if the rule does not match. */
  public Alg.@Nullable Exp apply(Alg.Exp integrand, Alg.Sym x) {
    final Pattern.Bindings bindings =
        pattern.match(integrand, Pattern.Bindings.of(x));
    if (bindings == null || !condition.test(bindings)) {
      return null;
    }
    return template.apply(bindings);
  }
}

// End IntegrationRule.java
