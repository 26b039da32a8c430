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
package net.hydromatic.symbolic.ast;

import static net.hydromatic.symbolic.ExpParser.parse;
import static net.hydromatic.symbolic.ast.AlgBuilder.alg;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests {@link AlgBuilder} and the printing of {@link Alg} expressions. */
public class AlgBuilderTest {
  private static void check(String s, String expected) {
    assertThat(s, parse(s), hasToString(expected));
  }

  /** Tests that sums combine like terms, put the constant last, and order
   * the other terms canonically. */
  @Test void testSum() {
    check("x + 1", "x + 1");
    check("1 + x", "x + 1");
    check("x + x", "2*x");
    check("x - x", "0");
    check("x - 1", "x - 1");
    check("x^2 + 3*x + 2", "3*x + x^2 + 2");
    check("sin(x) + x", "x + sin(x)");
    check("-(x + 1)", "-x - 1");
    check("2*(x + 1)", "2*x + 2");
    assertThat(parse("x + 1"), is(parse("1 + x")));
    assertThat(parse("x + 1").hashCode(), is(parse("1 + x").hashCode()));
  }

  @Test void testProduct() {
    check("x*x", "x^2");
    check("x*exp(x)", "x*exp(x)");
    check("exp(x)*x", "x*exp(x)");
    check("x*(x + 1)", "x*(x + 1)");
    check("-x", "-x");
    check("0*sin(x)", "0");
    check("(2*x)^2", "4*x^2");
    check("(x^2)^3", "x^6");
    check("(x + 1)^2", "(x + 1)^2");
  }

  /** Tests that negative powers print as fractions. */
  @Test void testQuotient() {
    check("1/x", "1/x");
    check("2/x", "2/x");
    check("x/2", "x/2");
    check("x/x", "1");
    check("-1/(x + 1)", "-1/(x + 1)");
  }

  @Test void testNumber() {
    check("4^(1/2)", "2");
    check("2^3", "8");
    check("2^-1", "1/2");
    check("6/4", "3/2");
    assertThrows(ArithmeticException.class,
        () -> alg.pow(alg.num(0), alg.num(-1)));
  }

  /** Tests that {@code exp} and {@code ln} cancel, and that products of
   * exponentials are merged. */
  @Test void testExpLn() {
    check("exp(ln(x))", "x");
    check("ln(exp(x))", "x");
    check("exp(2*ln(x))", "x^2");
    check("exp(x)*exp(x)", "exp(2*x)");
    check("exp(x)*exp(-x)", "1");
    check("exp(x)^3", "exp(3*x)");
    check("exp(0)", "1");
    check("ln(1)", "0");
  }

  @Test void testSymmetry() {
    check("sin(-x)", "-sin(x)");
    check("cos(-x)", "cos(x)");
    check("tan(-2*x)", "-tan(2*x)");
    check("sin(0)", "0");
    check("cos(0)", "1");
  }

  @Test void testAbs() {
    check("|exp(x) + 1|", "exp(x) + 1");
    check("|x^2|", "x^2");
    check("|-3|", "3");
    check("|-2*x|", "2*|x|");
    check("|x|^2", "x^2");
    check("|x|", "|x|");
  }

  @Test void testIsNonNegative() {
    assertThat(alg.isNonNegative(parse("x^2 + 1")), is(true));
    assertThat(alg.isNonNegative(parse("exp(x)*cosh(x)")), is(true));
    assertThat(alg.isNonNegative(parse("sqrt(x)")), is(true));
    assertThat(alg.isNonNegative(parse("x^3")), is(false));
    assertThat(alg.isNonNegative(parse("x - 1")), is(false));
    assertThat(alg.isNonNegative(parse("sin(x)")), is(false));
  }

  @Test void testIntegral() {
    final Alg.Sym x = alg.sym("x");
    final Alg.Integral integral = alg.integral(parse("x^2"), x);
    assertThat(integral, hasToString("integral(x^2, x)"));
    assertThat(integral, is(alg.integral(parse("x*x"), x)));
  }

  /** Tests that the canonical order sorts by node kind first. */
  @Test void testCompare() {
    assertThat(parse("3").compareTo(parse("x")) < 0, is(true));
    assertThat(parse("x").compareTo(parse("sin(x)")) < 0, is(true));
    assertThat(parse("sin(x)").compareTo(parse("x^2")) < 0, is(true));
    assertThat(parse("x^2").compareTo(parse("x^3")) < 0, is(true));
    assertThat(parse("a").compareTo(parse("b")) < 0, is(true));
    assertThat(parse("x + 1").compareTo(parse("1 + x")), is(0));
  }

  /** Atoms bind tighter than every operator, so are never
   * parenthesized. */
  @Test void testAtomPrecedence() {
    for (Op atom : new Op[] {Op.NUMBER, Op.SYMBOL, Op.APPLY, Op.INTEGRAL}) {
      assertThat(atom.padded, is(""));
      for (Op op : Op.values()) {
        if (!op.padded.isEmpty()) {
          assertThat(atom + " vs " + op, atom.left > op.right, is(true));
          assertThat(atom + " vs " + op, atom.right > op.left, is(true));
        }
      }
    }
    check("sin(x)^2", "sin(x)^2");
  }
}

// End AlgBuilderTest.java
