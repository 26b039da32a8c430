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

/** The field Q(i) of Gaussian rationals. */
public enum GaussianField implements Field<GaussianRational> {
  INSTANCE;

  @Override public GaussianRational zero() {
    return GaussianRational.ZERO;
  }

  @Override public GaussianRational one() {
    return GaussianRational.ONE;
  }

  @Override public GaussianRational add(GaussianRational a,
      GaussianRational b) {
    return a.plus(b);
  }

  @Override public GaussianRational subtract(GaussianRational a,
      GaussianRational b) {
    return a.minus(b);
  }

  @Override public GaussianRational multiply(GaussianRational a,
      GaussianRational b) {
    return a.times(b);
  }

  @Override public GaussianRational divide(GaussianRational a,
      GaussianRational b) {
    return a.divide(b);
  }

  @Override public GaussianRational negate(GaussianRational a) {
    return a.negate();
  }

  @Override public boolean isZero(GaussianRational a) {
    return a.isZero();
  }

  @Override public GaussianRational fromRational(Rational r) {
    return GaussianRational.of(r);
  }

  @Override public @Nullable Rational toRational(GaussianRational a) {
    return a.im.isZero() ? a.re : null;
  }

  @Override public String toString() {
    return "Q(i)";
  }
}

// End GaussianField.java
