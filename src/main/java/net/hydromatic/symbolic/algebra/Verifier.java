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
package net.hydromatic.symbolic.algebra;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.ast.Visitor;

/**
 * Checks that one expression is an antiderivative of another.
 *
 * <p>The check differentiates the candidate antiderivative symbolically and
 * compares the derivative with the integrand at fixed sample points. Points
 * where either side is undefined are skipped. Symbols other than the
 * variable are bound to fixed values.
 */
public class Verifier {
  private Verifier() {}

  /** Sample values of the variable. */
  static final ImmutableList<Double> POINTS =
      ImmutableList.of(0.37, 0.83, 1.21, 1.67, 2.39, -0.59, -1.43, 0.11);

  /** Minimum number of valid sample points for a confirmation. */
  static final int MIN_POINTS = 2;

  private static final double TOLERANCE = 1e-7;

  /** Returns whether {@code antiderivative} is an antiderivative of
   * {@code integrand} with respect to {@code x}. */
  public static Verdict check(Alg.Exp antiderivative, Alg.Exp integrand,
      Alg.Sym x) {
    final Alg.Exp derivative =
        Differentiator.derivative(antiderivative, x);
    return compare(derivative, integrand, x);
  }

  /** Returns whether two expressions agree at the sample points. */
  public static Verdict compare(Alg.Exp e0, Alg.Exp e1, Alg.Sym x) {
    final Map<String, Double> env = new HashMap<>();
    final TreeSet<String> parameters = new TreeSet<>();
    collectSymbols(e0, parameters);
    collectSymbols(e1, parameters);
    parameters.remove(x.name);
    double p = 1.3;
    for (String parameter : parameters) {
      env.put(parameter, p);
      p += 0.4;
    }
    int valid = 0;
    for (double point : POINTS) {
      env.put(x.name, point);
      final double v0 = Evaluator.evaluate(e0, env);
      final double v1 = Evaluator.evaluate(e1, env);
      if (!isFinite(v0) || !isFinite(v1)) {
        continue;
      }
      final double scale = Math.max(1d, Math.max(Math.abs(v0), Math.abs(v1)));
      if (Math.abs(v0 - v1) > TOLERANCE * scale) {
        return Verdict.REFUTED;
      }
      ++valid;
    }
    return valid >= MIN_POINTS ? Verdict.CONFIRMED : Verdict.UNDECIDED;
  }

  private static boolean isFinite(double v) {
    return !Double.isNaN(v) && !Double.isInfinite(v) && Math.abs(v) < 1e10;
  }

  private static void collectSymbols(Alg.Exp e, TreeSet<String> names) {
    e.accept(
        new Visitor() {
          @Override protected void visit(Alg.Sym sym) {
            names.add(sym.name);
          }
        });
  }

  /** Result of a check. */
  public enum Verdict {
    /** The expressions agree at enough sample points. */
    CONFIRMED,
    /** The expressions disagree at some sample point. */
    REFUTED,
    /** There were too few points where both expressions are defined. */
    UNDECIDED
  }
}

// End Verifier.java
