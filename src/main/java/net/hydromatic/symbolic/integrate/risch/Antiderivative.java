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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Function;

/**
 * Antiderivative within a differential field: a rational part plus a sum of
 * logarithms, {@code g + Σ c_i ln(v_i)}.
 *
 * @param <E> Element type
 */
class Antiderivative<E> {
  final E rational;
  final ImmutableList<LogarithmicPartTerm<E>> logs;

  Antiderivative(E rational, List<LogarithmicPartTerm<E>> logs) {
    this.rational = requireNonNull(rational);
    this.logs = ImmutableList.copyOf(logs);
  }

  @Override public String toString() {
    return logs.isEmpty() ? rational.toString() : rational + " + " + logs;
  }

  /** Converts every element, for instance to embed them in an
   * extension. */
  <F> Antiderivative<F> map(Function<E, F> fn) {
    final ImmutableList.Builder<LogarithmicPartTerm<F>> list =
        ImmutableList.builder();
    for (LogarithmicPartTerm<E> log : logs) {
      list.add(log.map(fn));
    }
    return new Antiderivative<>(fn.apply(rational), list.build());
  }
}

// End Antiderivative.java
