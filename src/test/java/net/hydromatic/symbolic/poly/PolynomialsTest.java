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
package net.hydromatic.symbolic.poly;

import static net.hydromatic.symbolic.ExpParser.parse;
import static net.hydromatic.symbolic.ast.AlgBuilder.alg;
import static net.hydromatic.symbolic.poly.PolyTest.p;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.util.Rational;
import org.junit.jupiter.api.Test;

/** Tests {@link Polynomials}. */
public class PolynomialsTest {
  private static final Alg.Sym X = alg.sym("x");

  @Test void testGcd() {
    // (t - 1)(t + 1) and (t - 1)(t - 2)
    assertThat(Polynomials.gcd(p(-1, 0, 1), p(2, -3, 1)), is(p(-1, 1)));
    assertThat(Polynomials.gcd(p(1, 1), p(2, 1)), is(p(1)));
    assertThat(Polynomials.gcd(p(0, 3), p()), is(p(0, 1)));
  }

  @Test void testExtendedGcd() {
    final Poly<Rational> a = p(-1, 0, 1);
    final Poly<Rational> b = p(2, -3, 1);
    final Polynomials.ExtendedGcd<Rational> eg =
        Polynomials.extendedGcd(a, b);
    assertThat(eg.gcd, is(p(-1, 1)));
    assertThat(eg.s.times(a).plus(eg.t.times(b)), is(eg.gcd));
  }

  @Test void testDiophantine() {
    final Poly<Rational> a = p(0, 0, 1);
    final Poly<Rational> b = p(1, 1);
    final Poly<Rational> c = p(3, 0, 0, 1);
    final Polynomials.Diophantine<Rational> d =
        Polynomials.solveDiophantine(a, b, c);
    assertThat(d, notNullValue());
    assertThat(d.s.times(a).plus(d.t.times(b)), is(c));
    assertThat(d.s.degree() < b.degree(), is(true));

    // gcd is t - 1, which does not divide 1
    assertThat(Polynomials.solveDiophantine(p(-1, 0, 1), p(-1, 1), p(1)),
        nullValue());
  }

  @Test void testSquareFree() {
    // (t - 1)^2 (t + 2)
    final List<Poly<Rational>> factors =
        Polynomials.squareFree(p(2, -3, 0, 1));
    assertThat(factors, contains(p(2, 1), p(-1, 1)));
    // t^3
    assertThat(Polynomials.squareFree(p(0, 0, 0, 2)),
        contains(p(1), p(1), p(0, 1)));
    assertThat(Polynomials.squareFree(p(7)), empty());
    // already square-free
    assertThat(Polynomials.squareFree(p(-1, 0, 1)), hasSize(1));
  }

  @Test void testResultant() {
    assertThat(Polynomials.resultant(p(-1, 0, 1), p(-2, 1)),
        is(Rational.of(3)));
    assertThat(Polynomials.resultant(p(1, 0, 1), p(-1, 0, 1)),
        is(Rational.of(4)));
    // common root 1
    assertThat(Polynomials.resultant(p(-1, 0, 1), p(-1, 1)),
        is(Rational.ZERO));
  }

  @Test void testInterpolate() {
    final List<Rational> xs =
        ImmutableList.of(Rational.ZERO, Rational.ONE, Rational.TWO);
    final List<Rational> ys =
        ImmutableList.of(Rational.ONE, Rational.TWO, Rational.of(5));
    assertThat(Polynomials.interpolate(RationalField.INSTANCE, xs, ys),
        is(p(1, 0, 1)));
  }

  @Test void testRationalRoots() {
    // (t - 2)(t - 1)(2t + 1)
    assertThat(Polynomials.rationalRoots(p(2, 1, -5, 2)),
        contains(Rational.of(-1, 2), Rational.ONE, Rational.TWO));
    assertThat(Polynomials.rationalRoots(p(0, -1, 0, 1)),
        contains(Rational.MINUS_ONE, Rational.ZERO, Rational.ONE));
    assertThat(Polynomials.rationalRoots(p(-2, 0, 1)), empty());
    assertThat(Polynomials.multiplicity(p(2, -3, 0, 1), Rational.ONE), is(2));
    assertThat(Polynomials.multiplicity(p(2, -3, 0, 1), Rational.TWO), is(0));
  }

  @Test void testQuadraticFactors() {
    // (t^2 + 1)(t^2 + 4)
    assertThat(Polynomials.quadraticFactors(p(4, 0, 5, 0, 1)),
        containsInAnyOrder(p(1, 0, 1), p(4, 0, 1)));
    // (t^2 - 2)(t^2 - 3)
    assertThat(Polynomials.quadraticFactors(p(6, 0, -5, 0, 1)),
        containsInAnyOrder(p(-2, 0, 1), p(-3, 0, 1)));
    // 2 (t^2 + t + 1)(t^2 + 2), not monic
    assertThat(Polynomials.quadraticFactors(p(4, 4, 6, 2, 2)),
        containsInAnyOrder(p(1, 1, 1), p(2, 0, 1)));
    // (t^2 + 1)(t^2 + 2)(t^2 + 3)
    assertThat(Polynomials.quadraticFactors(p(6, 0, 11, 0, 6, 0, 1)),
        hasSize(3));
    assertThat(Polynomials.quadraticFactors(p(2, 0, 1)),
        contains(p(2, 0, 1)));

    // irreducible of degree 4 and 3
    assertThat(Polynomials.quadraticFactors(p(1, 0, 0, 0, 1)), nullValue());
    assertThat(Polynomials.quadraticFactors(p(-2, 0, 0, 1)), nullValue());
  }

  @Test void testAsRationalFunction() {
    final RationalFunction<Rational> f =
        Polynomials.asRationalFunction(parse("(x^2 - 1)/(x - 1)"), X);
    assertThat(f, notNullValue());
    assertThat(f.isPolynomial(), is(true));
    assertThat(f.num, is(p(1, 1)));

    final RationalFunction<Rational> g =
        Polynomials.asRationalFunction(parse("1/x^2 + 1"), X);
    assertThat(g, is(RationalFunction.of(p(1, 0, 1), p(0, 0, 1))));

    assertThat(Polynomials.asRationalFunction(parse("sin(x)"), X),
        nullValue());
    assertThat(Polynomials.asRationalFunction(parse("sqrt(x)"), X),
        nullValue());
    assertThat(Polynomials.asRationalFunction(parse("a*x"), X), nullValue());
  }

  @Test void testToExp() {
    assertThat(Polynomials.toExp(p(1, 0, 3), X), hasToString("3*x^2 + 1"));
    assertThat(
        Polynomials.toExp(RationalFunction.of(p(1), p(1, 1)), X),
        hasToString("1/(x + 1)"));
    assertThat(Polynomials.toExp(p(), X).isZero(), is(true));
  }
}

// End PolynomialsTest.java
