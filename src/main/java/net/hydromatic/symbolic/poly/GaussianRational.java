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

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.symbolic.util.Rational;

/** Complex number {@code re + im i} with rational parts. */
public final class GaussianRational {
  public static final GaussianRational ZERO =
      new GaussianRational(Rational.ZERO, Rational.ZERO);
  public static final GaussianRational ONE =
      new GaussianRational(Rational.ONE, Rational.ZERO);
  public static final GaussianRational I =
      new GaussianRational(Rational.ZERO, Rational.ONE);

  public final Rational re;
  public final Rational im;

  private GaussianRational(Rational re, Rational im) {
    this.re = requireNonNull(re);
    this.im = requireNonNull(im);
  }

  public static GaussianRational of(Rational re, Rational im) {
    return new GaussianRational(re, im);
  }

  public static GaussianRational of(Rational re) {
    return new GaussianRational(re, Rational.ZERO);
  }

  @Override public int hashCode() {
    return Objects.hash(re, im);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof GaussianRational
        && re.equals(((GaussianRational) o).re)
        && im.equals(((GaussianRational) o).im);
  }

  @Override public String toString() {
    if (im.isZero()) {
      return re.toString();
    }
    return re.isZero()
        ? im + "i"
        : re + (im.signum() < 0 ? "" : "+") + im + "i";
  }

  public boolean isZero() {
    return re.isZero() && im.isZero();
  }

  public GaussianRational plus(GaussianRational o) {
    return of(re.plus(o.re), im.plus(o.im));
  }

  public GaussianRational minus(GaussianRational o) {
    return of(re.minus(o.re), im.minus(o.im));
  }

  public GaussianRational times(GaussianRational o) {
    return of(re.times(o.re).minus(im.times(o.im)),
        re.times(o.im).plus(im.times(o.re)));
  }

  public GaussianRational conjugate() {
    return of(re, im.negate());
  }

  public GaussianRational divide(GaussianRational o) {
    final Rational norm = o.re.times(o.re).plus(o.im.times(o.im));
    if (norm.isZero()) {
      throw new ArithmeticException("division by zero");
    }
    final GaussianRational p = times(o.conjugate());
    return of(p.re.divide(norm), p.im.divide(norm));
  }

  public GaussianRational negate() {
    return of(re.negate(), im.negate());
  }
}

// End GaussianRational.java
