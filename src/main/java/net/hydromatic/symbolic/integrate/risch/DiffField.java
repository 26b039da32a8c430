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

import net.hydromatic.symbolic.poly.Field;

/**
 * Differential field: a field with a derivation {@code D}.
 *
 * <p>{@code D} is additive and satisfies the product rule,
 * {@code D(a b) = D(a) b + a D(b)}.
 *
 * @param <E> Element type
 */
public interface DiffField<E> extends Field<E> {
  /** Returns the derivative of an element. */
  E derivative(E a);
}

// End DiffField.java
