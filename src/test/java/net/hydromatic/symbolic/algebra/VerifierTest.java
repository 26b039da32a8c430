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
import static org.hamcrest.Matchers.closeTo;

import com.google.common.collect.ImmutableMap;
import net.hydromatic.symbolic.ast.Alg;
import org.junit.jupiter.api.Test;

/** Tests {@link Verifier} and {@link Evaluator}. */
public class VerifierTest {
  private static final Alg.Sym X = alg.sym("x");

  @Test void testCheck() {
    assertThat(Verifier.check(parse("x^3/3"), parse("x^2"), X),
        is(Verifier.Verdict.CONFIRMED));
    assertThat(Verifier.check(parse("x^3"), parse("x^2"), X),
        is(Verifier.Verdict.REFUTED));
    // differs from the true antiderivative by a constant
    assertThat(Verifier.check(parse("sin(x) + 7"), parse("cos(x)"), X),
        is(Verifier.Verdict.CONFIRMED));
  }

  /** Tests that symbols other than the variable are given values. */
  @Test void testParameter() {
    assertThat(Verifier.check(parse("a*x^2/2"), parse("a*x"), X),
        is(Verifier.Verdict.CONFIRMED));
    assertThat(Verifier.check(parse("a*x^2/2"), parse("b*x"), X),
        is(Verifier.Verdict.REFUTED));
  }

  /** Tests that points where an expression is undefined are skipped, and
   * that too few remaining points gives no verdict. */
  @Test void testUndefined() {
    assertThat(Verifier.check(parse("x*ln(x) - x"), parse("ln(x)"), X),
        is(Verifier.Verdict.CONFIRMED));
    assertThat(Verifier.compare(parse("ln(x - 10)"), parse("1"), X),
        is(Verifier.Verdict.UNDECIDED));
  }

  @Test void testEvaluate() {
    final ImmutableMap<String, Double> env = ImmutableMap.of("x", 2d);
    assertThat(Evaluator.evaluate(parse("x^2 + 1"), env), closeTo(5d, 1e-12));
    assertThat(Evaluator.evaluate(parse("|1 - x|"), env), closeTo(1d, 1e-12));
    assertThat(Evaluator.evaluate(parse("exp(ln(3)*x)"), env),
        closeTo(9d, 1e-9));
    assertThat(Double.isNaN(Evaluator.evaluate(parse("ln(-x)"), env)),
        is(true));
    assertThat(Double.isNaN(Evaluator.evaluate(parse("y"), env)), is(true));
  }

  /** Tests that an odd root of a negative number is real. */
  @Test void testOddRoot() {
    final ImmutableMap<String, Double> env = ImmutableMap.of("x", -8d);
    assertThat(Evaluator.evaluate(parse("x^(1/3)"), env),
        closeTo(-2d, 1e-9));
    assertThat(Double.isNaN(Evaluator.evaluate(parse("sqrt(x)"), env)),
        is(true));
  }
}

// End VerifierTest.java
