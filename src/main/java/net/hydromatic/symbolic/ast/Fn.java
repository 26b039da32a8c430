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
package net.hydromatic.symbolic.ast;

import com.google.common.collect.ImmutableMap;
import net.hydromatic.symbolic.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Elementary function that can be applied to an expression. */
public enum Fn {
  SIN("sin", Liate.TRIGONOMETRIC, Symmetry.ODD, Rational.ZERO),
  COS("cos", Liate.TRIGONOMETRIC, Symmetry.EVEN, Rational.ONE),
  TAN("tan", Liate.TRIGONOMETRIC, Symmetry.ODD, Rational.ZERO),
  COT("cot", Liate.TRIGONOMETRIC, Symmetry.ODD, null),
  SEC("sec", Liate.TRIGONOMETRIC, Symmetry.EVEN, Rational.ONE),
  CSC("csc", Liate.TRIGONOMETRIC, Symmetry.ODD, null),
  ASIN("asin", Liate.INVERSE_TRIG, Symmetry.ODD, Rational.ZERO),
  ACOS("acos", Liate.INVERSE_TRIG, Symmetry.NONE, null),
  ATAN("atan", Liate.INVERSE_TRIG, Symmetry.ODD, Rational.ZERO),
  SINH("sinh", Liate.EXPONENTIAL, Symmetry.ODD, Rational.ZERO),
  COSH("cosh", Liate.EXPONENTIAL, Symmetry.EVEN, Rational.ONE),
  TANH("tanh", Liate.EXPONENTIAL, Symmetry.ODD, Rational.ZERO),
  EXP("exp", Liate.EXPONENTIAL, Symmetry.NONE, Rational.ONE),
  LN("ln", Liate.LOGARITHMIC, Symmetry.NONE, null),
  ABS("abs", Liate.ALGEBRAIC, Symmetry.EVEN, Rational.ZERO);

  /** Name, as it appears in expressions, e.g. "sin". */
  public final String fnName;
  /** Class of this function in the LIATE ordering. */
  public final Liate liate;
  /** Whether {@code f(-u)} can be rewritten in terms of {@code f(u)}. */
  public final Symmetry symmetry;
  /** Value at zero, or null if undefined or irrational. */
  public final @Nullable Rational zeroValue;

  /** Map from {@link #fnName} to function. */
  public static final ImmutableMap<String, Fn> BY_NAME;

  static {
    final ImmutableMap.Builder<String, Fn> b = ImmutableMap.builder();
    for (Fn fn : values()) {
      b.put(fn.fnName, fn);
    }
    BY_NAME = b.build();
  }

  Fn(String fnName, Liate liate, Symmetry symmetry,
      @Nullable Rational zeroValue) {
    this.fnName = fnName;
    this.liate = liate;
    this.symmetry = symmetry;
    this.zeroValue = zeroValue;
  }

  /** Returns whether this is one of the six circular trigonometric
   * functions. */
  public boolean isTrig() {
    return liate == Liate.TRIGONOMETRIC;
  }

  /** Class of a factor in the LIATE heuristic for integration by parts.
   * Earlier classes are preferred as "u". */
  public enum Liate {
    LOGARITHMIC,
    INVERSE_TRIG,
    ALGEBRAIC,
    TRIGONOMETRIC,
    EXPONENTIAL
  }

  /** Behavior of a function under negation of its argument. */
  public enum Symmetry {
    /** {@code f(-u) = -f(u)}. */
    ODD,
    /** {@code f(-u) = f(u)}. */
    EVEN,
    NONE
  }
}

// End Fn.java
