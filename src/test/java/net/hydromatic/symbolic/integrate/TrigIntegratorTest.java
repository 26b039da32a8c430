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
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import net.hydromatic.symbolic.ExpParser;
import net.hydromatic.symbolic.ast.Alg;
import org.junit.jupiter.api.Test;

/** Tests {@link TrigIntegrator}. */
public class TrigIntegratorTest {
  private static final Alg.Sym X = alg.sym("x");

  private static TrigIntegrator.SinCos sinCos(String s) {
    return TrigIntegrator.SinCos.of(ExpParser.parse(s), X);
  }

  @Test void testSinCos() {
    final TrigIntegrator.SinCos sc = sinCos("sin(x)^3 * cos(x)^2");
    assertThat(sc, notNullValue());
    assertThat(sc.k, is(3));
    assertThat(sc.n, is(2));
    assertThat(sc.theta, hasToString("x"));

    final TrigIntegrator.SinCos sc2 = sinCos("cos(3 * x + 1)^4");
    assertThat(sc2, notNullValue());
    assertThat(sc2.k, is(0));
    assertThat(sc2.n, is(4));

    // Different arguments, a non-linear argument, other functions
    assertThat(sinCos("sin(x) * cos(2 * x)"), nullValue());
    assertThat(sinCos("sin(x^2)"), nullValue());
    assertThat(sinCos("exp(x) * sin(x)"), nullValue());
  }

  /** An odd power of sine or cosine is reduced by substituting the other
   * function. */
  @Test void testOddPower() {
    integral("sin(x)^3").assertClosedForm()
        .assertTechnique(Technique.TRIGONOMETRIC)
        .assertEquivalentTo("cos(x)^3 / 3 - cos(x)");
    integral("cos(x)^5").assertClosedForm()
        .assertTechnique(Technique.TRIGONOMETRIC);
    integral("sin(x)^3 * cos(x)^2").assertClosedForm();
    integral("sin(2 * x)^5 * cos(2 * x)^4").assertClosedForm();
  }

  /** Even powers use the half-angle identities. */
  @Test void testEvenPowers() {
    integral("sin(x)^2 * cos(x)^2").assertClosedForm()
        .assertTechnique(Technique.TRIGONOMETRIC)
        .assertEquivalentTo("x / 8 - sin(4 * x) / 32");
    integral("sin(x)^4").assertClosedForm()
        .assertTechnique(Technique.TRIGONOMETRIC);
    integral("cos(x)^6").assertClosedForm();
  }
}

// End TrigIntegratorTest.java
