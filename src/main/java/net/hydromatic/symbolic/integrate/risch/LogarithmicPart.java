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

import static net.hydromatic.symbolic.ast.AlgBuilder.alg;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.poly.Poly;
import net.hydromatic.symbolic.poly.Polynomials;
import net.hydromatic.symbolic.poly.RationalField;
import net.hydromatic.symbolic.poly.RationalFunction;
import net.hydromatic.symbolic.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rothstein-Trager computation of the logarithmic part of
 * {@code ∫ a/d}, where {@code d} is monic, square-free and normal, and
 * {@code deg a < deg d}.
 *
 * <p>The residues are the roots {@code c} of
 * {@code R(z) = res_t(d, a - z D(d))}, and the logarithmic part is
 * {@code Σ c ln(gcd(d, a - c D(d)))}. If {@code R}, made monic, has a
 * coefficient that is not constant, the integral is not elementary.
 */
class LogarithmicPart {
  private LogarithmicPart() {}

  /** Returns the terms of the logarithmic part; or null if the residues
   * are not all rational. Throws {@link NonElementaryException} if the
   * residues are not constant; {@code toExp} renders coefficients in its
   * message. */
  static <E> @Nullable List<LogarithmicPartTerm<RationalFunction<E>>>
      compute(Extension<E> ext, Poly<E> a, Poly<E> d,
      Function<? super E, Alg.Exp> toExp) {
    if (a.isZero() || d.isConstant()) {
      return ImmutableList.of();
    }
    final DiffField<E> base = ext.base;
    final Poly<E> dd = ext.derivative(d);

    // R has degree at most deg d in z; find it from deg d + 1 values
    final List<E> zs = new ArrayList<>();
    final List<E> values = new ArrayList<>();
    for (int i = 0; i <= d.degree(); i++) {
      final E z = base.fromInteger(i);
      zs.add(z);
      values.add(Polynomials.resultant(d, a.minus(dd.scale(z))));
    }
    final Poly<E> r = Polynomials.interpolate(base, zs, values);
    if (r.isZero()) {
      return null;
    }
    final Poly<E> monic = r.monic();
    final List<Rational> coefficients = new ArrayList<>();
    for (E c : monic.coefficients) {
      final Rational q = base.toRational(c);
      if (q == null) {
        throw new NonElementaryException("residue polynomial "
            + render(monic, toExp) + " has non-constant coefficients");
      }
      coefficients.add(q);
    }
    final Poly<Rational> rz = Poly.of(RationalField.INSTANCE, coefficients);
    final List<Rational> roots = Polynomials.rationalRoots(rz);
    int distinct = 0;
    for (Poly<Rational> factor : Polynomials.squareFree(rz)) {
      distinct += factor.degree();
    }
    if (roots.size() != distinct) {
      // some residues are irrational
      return null;
    }

    final ImmutableList.Builder<LogarithmicPartTerm<RationalFunction<E>>>
        terms = ImmutableList.builder();
    for (Rational c : roots) {
      final Poly<E> v =
          Polynomials.gcd(d, a.minus(dd.scale(base.fromRational(c))));
      if (!v.isConstant()) {
        terms.add(new LogarithmicPartTerm<>(c, ext.polynomial(v)));
      }
    }
    return terms.build();
  }

  /** Renders a polynomial in the residue variable {@code z}. */
  private static <E> Alg.Exp render(Poly<E> p,
      Function<? super E, Alg.Exp> toExp) {
    final Alg.Exp z = alg.sym("z");
    final List<Alg.Exp> terms = new ArrayList<>();
    for (int i = 0; i <= p.degree(); i++) {
      terms.add(alg.mul(toExp.apply(p.coefficient(i)), alg.pow(z, i)));
    }
    return alg.add(terms);
  }
}

// End LogarithmicPart.java
