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

/** The field of rational numbers. */
public enum RationalField implements Field<Rational> {
  INSTANCE;

  @Override public Rational zero() {
    return Rational.ZERO;
  }

  @Override public Rational one() {
    return Rational.ONE;
  }

  @Override public Rational add(Rational a, Rational b) {
    return a.plus(b);
  }

  @Override public Rational subtract(Rational a, Rational b) {
    return a.minus(b);
  }

  @Override public Rational multiply(Rational a, Rational b) {
    return a.times(b);
  }

  @Override public Rational divide(Rational a, Rational b) {
    return a.divide(b);
  }

  @Override public Rational negate(Rational a) {
    return a.negate();
  }

  @Override public boolean isZero(Rational a) {
    return a.isZero();
  }

  @Override public Rational fromRational(Rational r) {
    return r;
  }

  @Override public Rational toRational(Rational a) {
    return a;
  }

  @Override public String toString() {
    return "Q";
  }
}

// End RationalField.java
