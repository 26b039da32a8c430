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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.symbolic.util.Rational;
import org.junit.jupiter.api.Test;

/** Tests {@link Poly}, {@link RationalFunction} and the fields they are
 * built on. */
public class PolyTest {
  /** Creates a polynomial with integer coefficients, constant term
   * first. */
  static Poly<Rational> p(long... coefficients) {
    final List<Rational> list = new ArrayList<>();
    for (long c : coefficients) {
      list.add(Rational.of(c));
    }
    return Poly.of(RationalField.INSTANCE, list);
  }

  @Test void testCreate() {
    assertThat(p(1, 2, 0, 0).degree(), is(1));
    assertThat(p().degree(), is(-1));
    assertThat(p(0, 0).isZero(), is(true));
    assertThat(p(5).isConstant(), is(true));
    assertThat(p(1, 2, 1), hasToString("t^2 + (2)*t + (1)"));
    assertThat(p(0, -1, 0, 3), hasToString("(3)*t^3 + (-1)*t"));
    assertThat(p(3, 2).lc(), is(Rational.of(2)));
    assertThat(p(3, 2).coefficient(7), is(Rational.ZERO));
  }

  @Test void testArithmetic() {
    assertThat(p(1, 1).plus(p(-1, 1)), is(p(0, 2)));
    assertThat(p(1, 1).minus(p(1, 1)).isZero(), is(true));
    assertThat(p(1, 1).times(p(-1, 1)), is(p(-1, 0, 1)));
    assertThat(p(1, 1).pow(3), is(p(1, 3, 3, 1)));
    assertThat(p(1, 1).shift(2), is(p(0, 0, 1, 1)));
    assertThat(p(2, 4).monic(), is(Poly.of(RationalField.INSTANCE,
        Rational.HALF, Rational.ONE)));
    assertThat(p(1, 2, 3).derivative(), is(p(2, 6)));
    assertThat(p(1, 2, 3).evaluate(Rational.of(2)), is(Rational.of(17)));
  }

  @Test void testDivide() {
    final Poly.DivRem<Rational> qr = p(1, 0, 0, 1).divRem(p(1, 1));
    assertThat(qr.quotient, is(p(1, -1, 1)));
    assertThat(qr.remainder.isZero(), is(true));
    final Poly.DivRem<Rational> qr2 = p(3, 0, 1).divRem(p(-1, 1));
    assertThat(qr2.quotient, is(p(1, 1)));
    assertThat(qr2.remainder, is(p(4)));
    assertThat(p(1, 1).divRem(p(0, 0, 1)).quotient.isZero(), is(true));
    assertThat(p(-1, 0, 1).divide(p(1, 1)), is(p(-1, 1)));
    assertThrows(IllegalArgumentException.class,
        () -> p(1, 0, 1).divide(p(1, 1)));
    assertThrows(ArithmeticException.class, () -> p(1, 1).divRem(p()));
  }

  @Test void testMap() {
    final Poly<GaussianRational> g =
        p(1, 2).map(GaussianField.INSTANCE, GaussianRational::of);
    assertThat(g.coefficient(1), is(GaussianRational.of(Rational.of(2))));
    assertThat(g.evaluate(GaussianRational.I),
        is(GaussianRational.of(Rational.ONE, Rational.of(2))));
  }

  @Test void testGaussian() {
    final GaussianRational a =
        GaussianRational.of(Rational.ONE, Rational.of(2));
    final GaussianRational b =
        GaussianRational.of(Rational.of(3), Rational.MINUS_ONE);
    final GaussianRational product = a.times(b);
    assertThat(product,
        is(GaussianRational.of(Rational.of(5), Rational.of(5))));
    assertThat(product.divide(b), is(a));
    assertThat(a.conjugate(),
        is(GaussianRational.of(Rational.ONE, Rational.of(-2))));
    assertThat(GaussianRational.I.times(GaussianRational.I),
        is(GaussianRational.ONE.negate()));
    assertThat(a, hasToString("1+2i"));
    assertThat(b, hasToString("3-1i"));
    assertThat(GaussianField.INSTANCE.toRational(a) == null, is(true));
    assertThrows(ArithmeticException.class,
        () -> a.divide(GaussianRational.ZERO));
  }

  @Test void testRationalFunction() {
    final RationalFunction<Rational> f =
        RationalFunction.of(p(-1, 0, 1), p(-1, 1));
    assertThat(f.isPolynomial(), is(true));
    assertThat(f, is(RationalFunction.of(p(1, 1))));

    final RationalFunction<Rational> g = RationalFunction.of(p(2), p(4, 2));
    assertThat(g.num, is(p(1)));
    assertThat(g.den, is(p(2, 1)));
    assertThat(g, hasToString("((1))/(t + (2))"));
    assertThrows(ArithmeticException.class,
        () -> RationalFunction.of(p(1), p()));
  }

  @Test void testRationalFunctionField() {
    final RationalFunctionField<Rational> field =
        new RationalFunctionField<>(RationalField.INSTANCE);
    final RationalFunction<Rational> a = RationalFunction.of(p(1), p(0, 1));
    final RationalFunction<Rational> b = RationalFunction.of(p(1), p(1, 1));
    // 1/t + 1/(t + 1) = (2t + 1) / (t^2 + t)
    assertThat(field.add(a, b), is(RationalFunction.of(p(1, 2), p(0, 1, 1))));
    // 1/t - 1/(t + 1) = 1 / (t^2 + t)
    assertThat(field.subtract(a, b),
        is(RationalFunction.of(p(1), p(0, 1, 1))));
    assertThat(field.multiply(a, field.t()), is(field.one()));
    assertThat(field.divide(a, a), is(field.one()));
    assertThat(field.toRational(field.fromRational(Rational.HALF)),
        is(Rational.HALF));
    assertThat(field.toRational(a) == null, is(true));
    assertThat(field.pow(b, -2), is(RationalFunction.of(p(1, 2, 1))));
    assertThrows(ArithmeticException.class,
        () -> field.divide(a, field.zero()));
  }
}

// End PolyTest.java
