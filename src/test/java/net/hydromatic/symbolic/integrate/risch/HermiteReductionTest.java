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
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;

import java.util.List;
import net.hydromatic.symbolic.ExpParser;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.poly.Polynomials;
import net.hydromatic.symbolic.poly.RationalField;
import net.hydromatic.symbolic.poly.RationalFunction;
import net.hydromatic.symbolic.util.Rational;
import org.junit.jupiter.api.Test;

/** Tests {@link HermiteReduction} and {@link LogarithmicPart}, the two
 * halves of the integration of the normal part. */
public class HermiteReductionTest {
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

  /** {@code 1/x^2 = D(-1/x)}, with nothing left over. */
  @Test void testReduce() {
    final RationalFunction<Rational> f = rf("1 / x^2");
    final HermiteReduction.Result<Rational> result =
        HermiteReduction.reduce(BASE, f.num, f.den);
    assertThat(result, notNullValue());
    assertThat(result.g, is(rf("-1 / x")));
    assertThat(result.b.isZero(), is(true));
  }

  /** {@code 1/(x (x+1)^2)} reduces to a square-free remainder. */
  @Test void testReduceMixed() {
    final RationalFunction<Rational> f = rf("1 / (x * (x + 1)^2)");
    final HermiteReduction.Result<Rational> result =
        HermiteReduction.reduce(BASE, f.num, f.den);
    assertThat(result, notNullValue());
    assertThat(result.g, is(rf("1 / (x + 1)")));
    assertThat(result.e, is(rf("x^2 + x").num));
    assertThat(result.b.degree() < result.e.degree(), is(true));
  }

  @Test void testLogarithmicPart() {
    final RationalFunction<Rational> f = rf("1 / (x^2 - 1)");
    final List<LogarithmicPartTerm<RationalFunction<Rational>>> terms =
        LogarithmicPart.compute(BASE, f.num, f.den, alg::num);
    assertThat(terms, notNullValue());
    assertThat(terms,
        containsInAnyOrder(
            new LogarithmicPartTerm<>(Rational.HALF, rf("x - 1")),
            new LogarithmicPartTerm<>(Rational.HALF.negate(), rf("x + 1"))));

    final RationalFunction<Rational> f2 = rf("x^2 + 1");
    assertThat(LogarithmicPart.compute(BASE, f2.num, f2.den, alg::num),
        empty());
  }

  /** Residues that are irrational or complex are not handled. */
  @Test void testIrrationalResidues() {
    final RationalFunction<Rational> f = rf("1 / (x^2 - 2)");
    assertThat(LogarithmicPart.compute(BASE, f.num, f.den, alg::num),
        nullValue());
    final RationalFunction<Rational> f2 = rf("1 / (x^2 + 1)");
    assertThat(LogarithmicPart.compute(BASE, f2.num, f2.den, alg::num),
        nullValue());
  }
}

// End HermiteReductionTest.java
