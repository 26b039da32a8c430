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
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.symbolic.util.Rational;
import org.junit.jupiter.api.Test;

/** Tests {@link LinearSystem}. */
public class LinearSystemTest {
  private static List<Rational> row(long... values) {
    final ImmutableList.Builder<Rational> b = ImmutableList.builder();
    for (long value : values) {
      b.add(Rational.of(value));
    }
    return b.build();
  }

  @Test void testUnique() {
    // 2x + y = 5, x - y = 1
    final List<Rational> solution =
        LinearSystem.solve(RationalField.INSTANCE,
            ImmutableList.of(row(2, 1), row(1, -1)), row(5, 1), 2);
    assertThat(solution, is(row(2, 1)));
  }

  /** Tests a system with more equations than unknowns, which is consistent;
   * and one that is not. */
  @Test void testOverdetermined() {
    final List<List<Rational>> rows =
        ImmutableList.of(row(1, 1), row(1, -1), row(2, 0));
    assertThat(
        LinearSystem.solve(RationalField.INSTANCE, rows, row(3, 1, 4), 2),
        is(row(2, 1)));
    assertThat(
        LinearSystem.solve(RationalField.INSTANCE, rows, row(3, 1, 5), 2),
        nullValue());
  }

  /** Tests that free variables are set to zero. */
  @Test void testUnderdetermined() {
    assertThat(
        LinearSystem.solve(RationalField.INSTANCE,
            ImmutableList.of(row(0, 1, 1)), row(2), 3),
        is(row(0, 2, 0)));
  }

  @Test void testFractions() {
    // 3x = 1
    assertThat(
        LinearSystem.solve(RationalField.INSTANCE,
            ImmutableList.of(row(3)), row(1), 1),
        contains(Rational.of(1, 3)));
  }

  @Test void testGaussian() {
    // i z = 1
    final List<GaussianRational> solution =
        LinearSystem.solve(GaussianField.INSTANCE,
            ImmutableList.of(ImmutableList.of(GaussianRational.I)),
            ImmutableList.of(GaussianRational.ONE), 1);
    assertThat(solution, contains(GaussianRational.I.negate()));
  }

  @Test void testBadShape() {
    assertThrows(IllegalArgumentException.class,
        () -> LinearSystem.solve(RationalField.INSTANCE,
            ImmutableList.of(row(1, 2)), row(1, 2), 2));
  }
}

// End LinearSystemTest.java
