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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import org.junit.jupiter.api.Test;

/** Tests {@link Simplifier}. */
public class SimplifierTest {
  @Test void testPythagoras() {
    assertThat(Simplifier.simplify(parse("sin(x)^2 + cos(x)^2")),
        hasToString("1"));
    assertThat(
        Simplifier.simplify(parse("3*sin(x)^2 + 3*cos(x)^2 + x")),
        hasToString("x + 3"));
    assertThat(Simplifier.simplify(parse("sin(2*x)^2 + cos(2*x)^2 - 1")),
        hasToString("0"));
    // coefficients differ, so the identity does not apply
    assertThat(Simplifier.simplify(parse("sin(x)^2 + 2*cos(x)^2")),
        hasToString("sin(x)^2 + 2*cos(x)^2"));
  }

  @Test void testSimplifyDoesNotExpand() {
    assertThat(Simplifier.simplify(parse("(x + 1)^2")),
        hasToString("(x + 1)^2"));
  }

  @Test void testExpand() {
    assertThat(Simplifier.expand(parse("(x + 1)^2")),
        hasToString("2*x + x^2 + 1"));
    assertThat(Simplifier.expand(parse("x*(x + 1)")),
        hasToString("x + x^2"));
    assertThat(Simplifier.expand(parse("(x + 1)*(x - 1)")),
        hasToString("x^2 - 1"));
    assertThat(Simplifier.expand(parse("exp(x)*(exp(x) + 1)")),
        hasToString("exp(x) + exp(2*x)"));
  }
}

// End SimplifierTest.java
