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

import static net.hydromatic.symbolic.Matchers.isAntiderivativeOf;
import static net.hydromatic.symbolic.ast.AlgBuilder.alg;
import static net.hydromatic.symbolic.integrate.Pattern.apply;
import static net.hydromatic.symbolic.integrate.Pattern.constant;
import static net.hydromatic.symbolic.integrate.Pattern.linear;
import static net.hydromatic.symbolic.integrate.Pattern.pow;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.Set;
import net.hydromatic.symbolic.ExpParser;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.ast.Fn;
import org.junit.jupiter.api.Test;

/** Tests {@link IntegrationTable} and {@link Pattern}. */
public class IntegrationTableTest {
  private static final Alg.Sym X = alg.sym("x");

  /** Every rule must match its own sample, and produce a correct
   * antiderivative. */
  @Test void testSamples() {
    final Set<String> names = new HashSet<>();
    for (IntegrationRule rule : IntegrationTable.INSTANCE.rules) {
      assertThat("duplicate rule " + rule, names.add(rule.name), is(true));
      final Alg.Exp e = rule.apply(rule.sample, X);
      assertThat(rule.name, e, notNullValue());
      assertThat(rule.name, e, isAntiderivativeOf(rule.sample, X));
    }
  }

  /** Every sample is integrated by the table as a whole, though not
   * necessarily by its own rule. */
  @Test void testLookupSamples() {
    for (IntegrationRule rule : IntegrationTable.INSTANCE.rules) {
      final Alg.Exp e = IntegrationTable.INSTANCE.lookup(rule.sample, X);
      assertThat(rule.name, e, notNullValue());
      assertThat(rule.name, e, isAntiderivativeOf(rule.sample, X));
    }
  }

  @Test void testLookup() {
    checkLookup("x^5");
    checkLookup("7 * cos(3 * x)");
    checkLookup("a * exp(x)");
    checkLookup("1 / (x^2 + 16)");
    checkLookup("sec(x) * tan(x)");
    checkLookup("x^3 * ln(x)");
    checkLookup("2^x");
    checkLookup("(1 - 2 * x)^(-1)");
    checkNoLookup("exp(x^2)");
    checkNoLookup("sin(x) * cos(x)");
    checkNoLookup("x * exp(x)");
  }

  /** Only the part that depends on x is matched; a constant factor is
   * carried over. */
  @Test void testConstantFactor() {
    final Alg.Exp e =
        IntegrationTable.INSTANCE.lookup(ExpParser.parse("y * x^2"), X);
    assertThat(e, notNullValue());
    assertThat(e, isAntiderivativeOf(ExpParser.parse("y * x^2"), X));

    final Alg.Exp e2 =
        IntegrationTable.INSTANCE.lookup(ExpParser.parse("3 * y"), X);
    assertThat(e2, notNullValue());
    assertThat(e2, hasToString("3*x*y"));
  }

  @Test void testReciprocalBeforePower() {
    final Alg.Exp e =
        IntegrationTable.INSTANCE.lookup(ExpParser.parse("1 / x"), X);
    assertThat(e, hasToString("ln(|x|)"));
  }

  /** The quadratic rules only apply for a constant of the right sign. */
  @Test void testConditions() {
    final IntegrationRule sumOfSquares = rule("inverseSumOfSquares");
    assertThat(sumOfSquares.apply(ExpParser.parse("1 / (x^2 + 4)"), X),
        notNullValue());
    assertThat(sumOfSquares.apply(ExpParser.parse("1 / (x^2 - 4)"), X),
        nullValue());
    final IntegrationRule differenceOfSquares =
        rule("inverseDifferenceOfSquares");
    assertThat(
        differenceOfSquares.apply(ExpParser.parse("1 / (x^2 - 4)"), X),
        notNullValue());
    assertThat(
        differenceOfSquares.apply(ExpParser.parse("1 / (x^2 + 4)"), X),
        nullValue());
  }

  /** A table with a single custom rule. */
  @Test void testCustomTable() {
    final IntegrationRule rule =
        new IntegrationRule("sinh", apply(Fn.SINH, linear("u")),
            bs -> true,
            bs -> alg.div(alg.cosh(bs.get("u")), bs.slope("u")),
            alg.sinh(X));
    final IntegrationTable table =
        new IntegrationTable(ImmutableList.of(rule));
    assertThat(table.rules, hasSize(1));
    final Alg.Exp integrand = ExpParser.parse("sinh(2 * x)");
    final Alg.Exp e = table.lookup(integrand, X);
    assertThat(e, notNullValue());
    assertThat(e, isAntiderivativeOf(integrand, X));
    assertThat(table.lookup(ExpParser.parse("sin(x)"), X), nullValue());
  }

  @Test void testPattern() {
    final Pattern p = pow(linear("u"), constant("n"));
    final Pattern.Bindings b0 = Pattern.Bindings.of(X);
    final Pattern.Bindings b =
        p.match(ExpParser.parse("(2 * x + 1)^k"), b0);
    assertThat(b, notNullValue());
    assertThat(b.get("n"), is(ExpParser.parse("k")));
    assertThat(b.slope("u"), hasToString("2"));
    assertThat(p.match(ExpParser.parse("(x^2 + 1)^3"), b0), nullValue());
    assertThat(p.match(ExpParser.parse("x^x"), b0), nullValue());

    // A name bound twice must be bound to the same expression
    final Pattern q = Pattern.sum(constant("c"), constant("c"));
    assertThat(q.match(ExpParser.parse("a + b"), b0), nullValue());
  }

  private static IntegrationRule rule(String name) {
    for (IntegrationRule rule : IntegrationTable.INSTANCE.rules) {
      if (rule.name.equals(name)) {
        return rule;
      }
    }
    throw new AssertionError("rule not found: " + name);
  }

  private static void checkLookup(String s) {
    final Alg.Exp integrand = ExpParser.parse(s);
    final Alg.Exp e = IntegrationTable.INSTANCE.lookup(integrand, X);
    assertThat(s, e, notNullValue());
    assertThat(s, e, isAntiderivativeOf(integrand, X));
  }

  private static void checkNoLookup(String s) {
    assertThat(s,
        IntegrationTable.INSTANCE.lookup(ExpParser.parse(s), X),
        nullValue());
  }
}

// End IntegrationTableTest.java
