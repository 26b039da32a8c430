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

import net.hydromatic.symbolic.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Field of characteristic zero, with exact arithmetic.
 *
 * <p>Elements must have value semantics: two elements are equal if and only
 * if {@link Object#equals} says so.
 *
 * @param <E> Element type
 */
public interface Field<E> {
  E zero();

  E one();

  E add(E a, E b);

  E subtract(E a, E b);

  E multiply(E a, E b);

  /** Divides; throws {@link ArithmeticException} if {@code b} is zero. */
  E divide(E a, E b);

  E negate(E a);

  boolean isZero(E a);

  /** Returns the image of a rational number in this field. */
  E fromRational(Rational r);

  /** If an element is the image of a rational number, returns that number;
   * otherwise returns null. */
  @Nullable Rational toRational(E a);

  default E fromInteger(long n) {
    return fromRational(Rational.of(n));
  }

  default boolean isOne(E a) {
    return a.equals(one());
  }

  default E reciprocal(E a) {
    return divide(one(), a);
  }

  /** Raises to an integer power, which may be negative. */
  default E pow(E a, int n) {
    if (n < 0) {
      return reciprocal(pow(a, -n));
    }
    E result = one();
    for (int i = 0; i < n; i++) {
      result = multiply(result, a);
    }
    return result;
  }
}

// End Field.java
