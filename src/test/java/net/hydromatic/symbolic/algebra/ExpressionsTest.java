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
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import net.hydromatic.symbolic.ast.Alg;
import org.junit.jupiter.api.Test;

/** Tests {@link Expressions}. */
public class ExpressionsTest {
  private static final Alg.Sym X = alg.sym("x");

  @Test void testFreeOf() {
    assertThat(Expressions.freeOf(parse("sin(a) + 2"), X), is(true));
    assertThat(Expressions.freeOf(parse("sin(a*x)"), X), is(false));
    assertThat(Expressions.contains(parse("sin(x^2) + 1"), parse("x^2")),
        is(true));
  }

  @Test void testSubstitute() {
    assertThat(
        Expressions.substitute(parse("x^2 + sin(x)"), X, parse("2*y")),
        hasToString("sin(2*y) + 4*y^2"));
    assertThat(
        Expressions.replace(parse("ln(x)^2 + ln(x)"), parse("ln(x)"),
            parse("u")),
        hasToString("u + u^2"));
  }

  @Test void testSplit() {
    final Expressions.Split split = Expressions.split(parse("3*a*x*sin(x)"), X);
    assertThat(split.constant, hasToString("3*a"));
    assertThat(split.dependent, hasToString("x*sin(x)"));
    final Expressions.Split split2 = Expressions.split(parse("a + 1"), X);
    assertThat(split2.dependent.isOne(), is(true));
  }

  @Test void testLinear() {
    final Expressions.Linear linear = Expressions.linear(parse("3*x + 2"), X);
    assertThat(linear, notNullValue());
    assertThat(linear.a, hasToString("3"));
    assertThat(linear.b, hasToString("2"));
    assertThat(Expressions.linear(parse("x"), X).isIdentity(), is(true));
    assertThat(Expressions.linear(parse("x^2 + 1"), X), nullValue());
    assertThat(Expressions.linear(parse("5"), X), nullValue());
  }

  @Test void testComplexity() {
    assertThat(Expressions.complexity(parse("x")), is(1));
    assertThat(Expressions.complexity(parse("sin(x) + 1")), is(4));
    assertThat(Expressions.intValue(parse("7")), is(7));
    assertThat(Expressions.intValue(parse("1/2")), nullValue());
  }
}

// End ExpressionsTest.java
