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

import static net.hydromatic.symbolic.Integrals.integral;
import static net.hydromatic.symbolic.ast.AlgBuilder.alg;
import static org.hamcrest.CoreMatchers.hasItems;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import java.util.List;
import net.hydromatic.symbolic.ExpParser;
import net.hydromatic.symbolic.ast.Alg;
import org.junit.jupiter.api.Test;

/** Tests {@link SubstitutionIntegrator}. */
public class SubstitutionIntegratorTest {
  private static final Alg.Sym X = alg.sym("x");
  private static final Alg.Sym U = alg.sym("u");

  private static Alg.Exp transform(String f, String g) {
    return SubstitutionIntegrator.transform(ExpParser.parse(f), X,
        ExpParser.parse(g), U);
  }

  @Test void testTransform() {
    assertThat(transform("2 * x * cos(x^2)", "x^2"), hasToString("cos(u)"));
    final Alg.Exp e = transform("exp(x) / (exp(x) + 1)", "exp(x)");
    assertThat(e, is(ExpParser.parse("1 / (u + 1)")));
    assertThat(transform("cos(3 * x + 1)", "3 * x + 1"),
        is(ExpParser.parse("cos(u) / 3")));

    // x remains, so the substitution fails
    assertThat(transform("exp(x^2)", "x^2"), nullValue());
    assertThat(transform("x", "5"), nullValue());
  }

  @Test void testCandidates() {
    final List<Alg.Exp> candidates =
        SubstitutionIntegrator.candidates(
            ExpParser.parse("sin(x)^3 * cos(x)"), X);
    assertThat(candidates,
        hasItems(ExpParser.parse("sin(x)"), ExpParser.parse("cos(x)")));
    for (Alg.Exp candidate : candidates) {
      assertThat(candidate.equals(X), is(false));
    }
  }

  @Test void testFreshSymbol() {
    assertThat(SubstitutionIntegrator.freshSymbol(ExpParser.parse("x^2"), X),
        hasToString("u"));
    assertThat(
        SubstitutionIntegrator.freshSymbol(ExpParser.parse("u * x"), X),
        hasToString("u1"));
    assertThat(SubstitutionIntegrator.freshSymbol(ExpParser.parse("u1"), U),
        hasToString("u2"));
  }

  @Test void testIntegrate() {
    integral("sin(x)^3 * cos(x)").assertClosedForm()
        .assertTechnique(Technique.SUBSTITUTION);
    integral("2 * x * cos(x^2)").assertClosedForm()
        .assertTechnique(Technique.SUBSTITUTION)
        .assertEquivalentTo("sin(x^2)");
    integral("x * exp(x^2)").assertClosedForm()
        .assertTechnique(Technique.SUBSTITUTION)
        .assertEquivalentTo("exp(x^2) / 2");
    integral("ln(x) / x").assertClosedForm()
        .assertEquivalentTo("ln(x)^2 / 2");
    integral("exp(x) / (exp(x) + 1)").assertClosedForm()
        .assertTechnique(Technique.SUBSTITUTION);
  }

  /** The integrand contains a symbol "u", so the substitution uses a
   * different variable. */
  @Test void testVariableClash() {
    integral("u * x * cos(x^2)").assertClosedForm()
        .assertEquivalentTo("u * sin(x^2) / 2");
  }
}

// End SubstitutionIntegratorTest.java
