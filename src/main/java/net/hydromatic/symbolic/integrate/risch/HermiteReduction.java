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

import java.util.List;
import net.hydromatic.symbolic.poly.Poly;
import net.hydromatic.symbolic.poly.Polynomials;
import net.hydromatic.symbolic.poly.RationalFunction;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Hermite reduction in {@code K(t)}.
 *
 * <p>Given {@code a/d} with {@code d} normal, finds {@code g} and
 * {@code h = b/e} such that {@code a/d = D(g) + h}, {@code e} square-free
 * and {@code deg b < deg e}. Works one square-free factor at a time: while
 * {@code d = U V^k} with {@code k > 1}, solves
 * {@code a = (1 - k) B U D(V) + C V}, adds {@code B / V^(k-1)} to
 * {@code g}, and continues with {@code (C - U D(B)) / (U V^(k-1))}.
 */
class HermiteReduction {
  private HermiteReduction() {}

  /** Reduces {@code a/d}; {@code d} must be monic and normal. Returns null
   * only if a Diophantine equation unexpectedly has no solution. */
  static <E> @Nullable Result<E> reduce(Extension<E> ext, Poly<E> a,
      Poly<E> d) {
    final List<Poly<E>> factors = Polynomials.squareFree(d);
    RationalFunction<E> g = ext.zero();
    Poly<E> num = a;
    Poly<E> den = d;
    for (int k = factors.size(); k >= 2; k--) {
      final Poly<E> v = factors.get(k - 1);
      if (v.isConstant()) {
        continue;
      }
      final Poly<E> dv = ext.derivative(v);
      for (int j = k; j >= 2; j--) {
        final Poly<E> u = den.divide(v.pow(j));
        final Polynomials.Diophantine<E> solution =
            Polynomials.solveDiophantine(
                u.times(dv).scale(ext.base.fromInteger(1 - j)), v, num);
        if (solution == null) {
          return null;
        }
        final Poly<E> b = solution.s;
        g = ext.add(g, RationalFunction.of(b, v.pow(j - 1)));
        num = solution.t.minus(u.times(ext.derivative(b)));
        den = u.times(v.pow(j - 1));
      }
    }
    return new Result<>(g, num.mod(den), den);
  }

  /** Result of Hermite reduction: {@code a/d = D(g) + q + b/e} where
   * {@code q} is a polynomial that the caller recovers by subtraction. */
  static class Result<E> {
    final RationalFunction<E> g;
    /** Numerator of the reduced part. */
    final Poly<E> b;
    /** Square-free denominator of the reduced part. */
    final Poly<E> e;

    Result(RationalFunction<E> g, Poly<E> b, Poly<E> e) {
      this.g = requireNonNull(g);
      this.b = requireNonNull(b);
      this.e = requireNonNull(e);
    }
  }
}

// End HermiteReduction.java
