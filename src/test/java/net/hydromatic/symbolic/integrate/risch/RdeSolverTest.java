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
package net.hydromatic.symbolic.integrate.risch;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.symbolic.ast.AlgBuilder.alg;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.symbolic.ExpParser;
import net.hydromatic.symbolic.algebra.Differentiator;
import net.hydromatic.symbolic.algebra.Verifier;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.integrate.CancellationToken;
import net.hydromatic.symbolic.integrate.IntegrationCancelledException;
import net.hydromatic.symbolic.integrate.RecursionBudget;
import net.hydromatic.symbolic.poly.Polynomials;
import net.hydromatic.symbolic.poly.RationalField;
import net.hydromatic.symbolic.poly.RationalFunction;
import net.hydromatic.symbolic.util.Rational;
import org.junit.jupiter.api.Test;

/** Tests {@link RdeSolver}, which solves {@code D y + f y = g}. */
public class RdeSolverTest {
  private static final Alg.Sym X = alg.sym("x");

  @SuppressWarnings("unchecked")
  private static final Extension<Rational> BASE =
      (Extension<Rational>)
          DifferentialExtensionTower.base(X, RationalField.INSTANCE)
              .level(0);

  private static RationalFunction<Rational> rf(String s) {
    return requireNonNull(
        Polynomials.asRationalFunction(ExpParser.parse(s), X));
  }

  private static RdeSolver.Rde<RationalFunction<Rational>> solve(String f,
      String g) {
    return RdeSolver.solve(BASE, rf(f), rf(g),
        new RecursionBudget(10, 100, CancellationToken.create()));
  }

  /** Solves, and checks that the solution satisfies the equation. */
  private static void checkSolved(String f, String g) {
    final RdeSolver.Rde<RationalFunction<Rational>> rde = solve(f, g);
    assertThat(rde.outcome, is(RdeSolver.Outcome.SOLVED));
    final Alg.Exp y = Polynomials.toExp(requireNonNull(rde.y), X);
    final Alg.Exp lhs =
        alg.add(Differentiator.derivative(y, X),
            alg.mul(ExpParser.parse(f), y));
    assertThat(Verifier.compare(lhs, ExpParser.parse(g), X),
        is(Verifier.Verdict.CONFIRMED));
  }

  @Test void testPolynomial() {
    // y = x - 1
    checkSolved("1", "x");
    // y = x^2
    checkSolved("2 * x", "2 * x + 2 * x^3");
    checkSolved("3", "0");
  }

  /** The solution has a pole; the denominator bound finds it. */
  @Test void testRational() {
    // y = 1/x
    checkSolved("1", "(x - 1) / x^2");
    // f has a simple pole at 0 with residue -1; y = x^2
    checkSolved("-1 / x", "x");
  }

  /** The Gaussian, {@code ∫exp(x^2)}, and the exponential integral,
   * {@code ∫exp(x)/x}, have no elementary form. */
  @Test void testNoSolution() {
    assertThat(solve("2 * x", "1").outcome,
        is(RdeSolver.Outcome.NO_SOLUTION));
    assertThat(solve("1", "1 / x").outcome,
        is(RdeSolver.Outcome.NO_SOLUTION));
    assertThat(solve("-2 * x", "1").outcome,
        is(RdeSolver.Outcome.NO_SOLUTION));
  }

  @Test void testCancelled() {
    final CancellationToken token = CancellationToken.create();
    token.cancel();
    assertThrows(IntegrationCancelledException.class,
        () -> RdeSolver.solve(BASE, rf("1"), rf("x"),
            new RecursionBudget(10, 100, token)));
  }
}

// End RdeSolverTest.java
