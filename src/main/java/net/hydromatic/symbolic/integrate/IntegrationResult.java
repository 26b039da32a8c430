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
package net.hydromatic.symbolic.integrate;

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.symbolic.ast.Alg;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Result of integrating an expression.
 *
 * <p>There are exactly three kinds: {@link ClosedForm}, an antiderivative;
 * {@link SymbolicFallback}, the unevaluated integral, returned when no
 * technique succeeded; and {@link NonElementary}, returned when it has been
 * proven that there is no elementary antiderivative.
 */
public abstract class IntegrationResult {
  public final Kind kind;

  private IntegrationResult(Kind kind) {
    this.kind = requireNonNull(kind);
  }

  /** Creates a closed form that has not yet been attributed to a
   * technique. */
  public static ClosedForm closedForm(Alg.Exp antiderivative) {
    return new ClosedForm(antiderivative, null);
  }

  public static SymbolicFallback fallback(Alg.Integral integral,
      boolean cancelled) {
    return new SymbolicFallback(integral, cancelled);
  }

  public static NonElementary nonElementary(Alg.Integral integral,
      String reason) {
    return new NonElementary(integral, reason);
  }

  public boolean isClosedForm() {
    return kind == Kind.CLOSED_FORM;
  }

  public boolean isFallback() {
    return kind == Kind.SYMBOLIC_FALLBACK;
  }

  public boolean isNonElementary() {
    return kind == Kind.NON_ELEMENTARY;
  }

  /** Returns the expression that represents this result: the
   * antiderivative, or the unevaluated integral. */
  public abstract Alg.Exp exp();

  /** Kind of result. */
  public enum Kind {
    CLOSED_FORM,
    SYMBOLIC_FALLBACK,
    NON_ELEMENTARY
  }

  /** An antiderivative. */
  public static class ClosedForm extends IntegrationResult {
    public final Alg.Exp antiderivative;
    /** Technique that produced the antiderivative at the outermost level;
     * null until the dispatcher accepts it. */
    public final @Nullable Technique technique;

    ClosedForm(Alg.Exp antiderivative, @Nullable Technique technique) {
      super(Kind.CLOSED_FORM);
      this.antiderivative = requireNonNull(antiderivative);
      this.technique = technique;
    }

    @Override public Alg.Exp exp() {
      return antiderivative;
    }

    @Override public int hashCode() {
      return antiderivative.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ClosedForm
          && antiderivative.equals(((ClosedForm) o).antiderivative)
          && technique == ((ClosedForm) o).technique;
    }

    @Override public String toString() {
      return antiderivative.toString();
    }

    /** Returns a copy attributed to a technique. */
    public ClosedForm withTechnique(Technique technique) {
      return technique == this.technique
          ? this
          : new ClosedForm(antiderivative, requireNonNull(technique));
    }

    /** Returns a copy with a different antiderivative. */
    public ClosedForm withAntiderivative(Alg.Exp antiderivative) {
      return antiderivative.equals(this.antiderivative)
          ? this
          : new ClosedForm(antiderivative, technique);
    }
  }

  /** The unevaluated integral. Always a correct answer. */
  public static class SymbolicFallback extends IntegrationResult {
    public final Alg.Integral integral;
    /** Whether the call was abandoned because it was cancelled or timed
     * out. */
    public final boolean cancelled;

    SymbolicFallback(Alg.Integral integral, boolean cancelled) {
      super(Kind.SYMBOLIC_FALLBACK);
      this.integral = requireNonNull(integral);
      this.cancelled = cancelled;
    }

    @Override public Alg.Exp exp() {
      return integral;
    }

    @Override public int hashCode() {
      return Objects.hash(integral, cancelled);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof SymbolicFallback
          && integral.equals(((SymbolicFallback) o).integral)
          && cancelled == ((SymbolicFallback) o).cancelled;
    }

    @Override public String toString() {
      return cancelled ? integral + " (cancelled)" : integral.toString();
    }
  }

  /** Proof that an integral has no elementary antiderivative. */
  public static class NonElementary extends IntegrationResult {
    public final Alg.Integral integral;
    public final String reason;

    NonElementary(Alg.Integral integral, String reason) {
      super(Kind.NON_ELEMENTARY);
      this.integral = requireNonNull(integral);
      this.reason = requireNonNull(reason);
    }

    @Override public Alg.Exp exp() {
      return integral;
    }

    @Override public int hashCode() {
      return Objects.hash(integral, reason);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof NonElementary
          && integral.equals(((NonElementary) o).integral)
          && reason.equals(((NonElementary) o).reason);
    }

    @Override public String toString() {
      return "non-elementary " + integral + ": " + reason;
    }
  }
}

// End IntegrationResult.java
