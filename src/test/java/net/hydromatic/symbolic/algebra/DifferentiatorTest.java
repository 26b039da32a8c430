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
package net.hydromatic.symbolic.algebra;

import static net.hydromatic.symbolic.ExpParser.parse;
import static net.hydromatic.symbolic.ast.AlgBuilder.alg;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import net.hydromatic.symbolic.ast.Alg;
import org.junit.jupiter.api.Test;

/** Tests {@link Differentiator}. */
public class DifferentiatorTest {
  private static final Alg.Sym X = alg.sym("x");

  private static void check(String e, String expected) {
    assertThat(e, Differentiator.derivative(parse(e), X),
        hasToString(expected));
  }

  /** Checks a derivative numerically, for results whose printed form is
   * not interesting. */
  private static void checkValue(String e, String expected) {
    assertThat(e,
        Verifier.compare(Differentiator.derivative(parse(e), X),
            parse(expected), X),
        is(Verifier.Verdict.CONFIRMED));
  }

  @Test void testPolynomial() {
    check("5", "0");
    check("x", "1");
    check("x^3", "3*x^2");
    check("x^2 + 3*x + 2", "2*x + 3");
    check("1/x", "-1/x^2");
  }

  @Test void testChainRule() {
    check("sin(x^2)", "2*x*cos(x^2)");
    check("exp(2*x)", "2*exp(2*x)");
    check("ln(x)", "1/x");
    checkValue("cos(3*x + 1)", "-3*sin(3*x + 1)");
    checkValue("tan(x)", "sec(x)^2");
    checkValue("atan(x)", "1/(x^2 + 1)");
    checkValue("asin(x/2)", "1/sqrt(4 - x^2)");
    checkValue("sqrt(x^2 + 1)", "x/sqrt(x^2 + 1)");
    checkValue("tanh(x)", "1/cosh(x)^2");
  }

  @Test void testProductRule() {
    check("x*ln(x)", "ln(x) + 1");
    checkValue("x^2*exp(x)", "(x^2 + 2*x)*exp(x)");
    checkValue("sin(x)*cos(x)", "cos(x)^2 - sin(x)^2");
  }

  /** Tests powers whose exponent depends on the variable. */
  @Test void testVariableExponent() {
    checkValue("2^x", "2^x*ln(2)");
    checkValue("x^x", "x^x*(ln(x) + 1)");
  }

  @Test void testOtherVariable() {
    final Alg.Sym y = alg.sym("y");
    assertThat(Differentiator.derivative(parse("x^2 + sin(x)"), y).isZero(),
        is(true));
    assertThat(Differentiator.derivative(parse("x*y^2"), y),
        hasToString("2*x*y"));
  }

  @Test void testIntegral() {
    final Alg.Exp integral = alg.integral(parse("exp(x^2)"), X);
    assertThat(Differentiator.derivative(integral, X),
        is(parse("exp(x^2)")));
  }
}

// End DifferentiatorTest.java
