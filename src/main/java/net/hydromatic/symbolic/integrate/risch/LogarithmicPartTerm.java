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

import java.util.Objects;
import java.util.function.Function;
import net.hydromatic.symbolic.util.Rational;

/**
 * Term {@code c ln(v)} of the logarithmic part of an antiderivative.
 *
 * @param <E> Type of the argument {@code v}, an element of a differential
 * field
 */
public class LogarithmicPartTerm<E> {
  public final Rational coefficient;
  public final E argument;

  public LogarithmicPartTerm(Rational coefficient, E argument) {
    this.coefficient = requireNonNull(coefficient);
    this.argument = requireNonNull(argument);
  }

  @Override public int hashCode() {
    return Objects.hash(coefficient, argument);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof LogarithmicPartTerm
        && coefficient.equals(((LogarithmicPartTerm) o).coefficient)
        && argument.equals(((LogarithmicPartTerm) o).argument);
  }

  @Override public String toString() {
    return coefficient + " * ln(" + argument + ")";
  }

  /** Converts the argument, keeping the coefficient. */
  public <F> LogarithmicPartTerm<F> map(Function<E, F> fn) {
    return new LogarithmicPartTerm<>(coefficient, fn.apply(argument));
  }
}

// End LogarithmicPartTerm.java
