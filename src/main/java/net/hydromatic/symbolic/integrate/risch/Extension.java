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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.poly.Poly;
import net.hydromatic.symbolic.poly.RationalFunction;
import net.hydromatic.symbolic.poly.RationalFunctionField;

/**
 * Differential field {@code K(t)}, a simple transcendental extension of a
 * differential field {@code K}.
 *
 * <p>The derivation extends that of {@code K} by giving {@code D t} as a
 * polynomial in {@code t}: {@code 1} if {@code t} is the variable of
 * integration, {@code η' t} if {@code t = exp(η)}, and {@code η'/η} if
 * {@code t = ln(η)}.
 *
 * @param <C> Type of elements of {@code K}
 */
public class Extension<C> extends RationalFunctionField<C>
    implements DiffField<RationalFunction<C>> {
  public final DiffField<C> base;
  public final Kind kind;
  /** Derivative of {@code t}, as a polynomial in {@code t}. */
  public final Poly<C> dt;
  /** The expression that {@code t} stands for: {@code x},
   * {@code exp(η)} or {@code ln(η)}. */
  public final Alg.Exp kernel;
  /** {@code η}; for {@link Kind#X}, the variable. */
  public final Alg.Exp argument;

  Extension(DiffField<C> base, Kind kind, Poly<C> dt, Alg.Exp kernel,
      Alg.Exp argument) {
    super(base);
    this.base = requireNonNull(base);
    this.kind = requireNonNull(kind);
    this.dt = requireNonNull(dt);
    this.kernel = requireNonNull(kernel);
    this.argument = requireNonNull(argument);
  }

  @Override public String toString() {
    return base + "(" + kernel + ")";
  }

  /** Returns the derivative of a polynomial in {@code t}:
   * {@code D(Σ a_i t^i) = Σ D(a_i) t^i + (d/dt Σ a_i t^i) D t}. */
  public Poly<C> derivative(Poly<C> p) {
    final List<C> list = new ArrayList<>();
    for (C a : p.coefficients) {
      list.add(base.derivative(a));
    }
    return Poly.of(base, list).plus(p.derivative().times(dt));
  }

  @Override public RationalFunction<C> derivative(RationalFunction<C> f) {
    if (f.isPolynomial()) {
      return polynomial(derivative(f.num));
    }
    // (n/d)' = (n' d - n d') / d^2
    final Poly<C> num =
        derivative(f.num).times(f.den).minus(f.num.times(derivative(f.den)));
    return RationalFunction.of(num, f.den.times(f.den));
  }

  /** Kind of extension. */
  public enum Kind {
    /** {@code t} is the variable of integration; {@code D t = 1}. */
    X,
    /** {@code t = exp(η)}; {@code D t = η' t}. */
    EXP,
    /** {@code t = ln(η)}; {@code D t = η'/η}. */
    LOG
  }
}

// End Extension.java
