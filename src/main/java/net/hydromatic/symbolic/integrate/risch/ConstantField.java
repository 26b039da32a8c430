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

import net.hydromatic.symbolic.poly.Field;
import net.hydromatic.symbolic.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Field of constants, whose derivation is zero; the bottom of a
 * {@link DifferentialExtensionTower}.
 *
 * @param <C> Element type
 */
public class ConstantField<C> implements DiffField<C> {
  private final Field<C> field;

  public ConstantField(Field<C> field) {
    this.field = requireNonNull(field);
  }

  @Override public String toString() {
    return field.toString();
  }

  @Override public C derivative(C a) {
    return field.zero();
  }

  @Override public C zero() {
    return field.zero();
  }

  @Override public C one() {
    return field.one();
  }

  @Override public C add(C a, C b) {
    return field.add(a, b);
  }

  @Override public C subtract(C a, C b) {
    return field.subtract(a, b);
  }

  @Override public C multiply(C a, C b) {
    return field.multiply(a, b);
  }

  @Override public C divide(C a, C b) {
    return field.divide(a, b);
  }

  @Override public C negate(C a) {
    return field.negate(a);
  }

  @Override public boolean isZero(C a) {
    return field.isZero(a);
  }

  @Override public C fromRational(Rational r) {
    return field.fromRational(r);
  }

  @Override public @Nullable Rational toRational(C a) {
    return field.toRational(a);
  }
}

// End ConstantField.java
