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

import java.util.Map;
import net.hydromatic.symbolic.ast.Alg;

/**
 * Evaluates algebraic expressions in double precision.
 *
 * <p>Points where an expression is undefined over the reals, such as the
 * logarithm of a negative number, evaluate to NaN.
 */
public class Evaluator {
  private Evaluator() {}

  /** Evaluates an expression, looking up symbols in an environment. */
  public static double evaluate(Alg.Exp e, Map<String, Double> env) {
    switch (e.op) {
    case NUMBER:
      return ((Alg.Num) e).value.doubleValue();

    case SYMBOL:
      final Double value = env.get(((Alg.Sym) e).name);
      return value == null ? Double.NaN : value;

    case ADD:
      double sum = 0;
      for (Alg.Exp term : ((Alg.Add) e).terms) {
        sum += evaluate(term, env);
      }
      return sum;

    case MUL:
      double product = 1;
      for (Alg.Exp factor : ((Alg.Mul) e).factors) {
        product *= evaluate(factor, env);
      }
      return product;

    case POW:
      final Alg.Pow pow = (Alg.Pow) e;
      return power(evaluate(pow.base, env), pow.exponent, env);

    case APPLY:
      final Alg.Apply apply = (Alg.Apply) e;
      final double u = evaluate(apply.arg, env);
      switch (apply.fn) {
      case SIN:
        return Math.sin(u);
      case COS:
        return Math.cos(u);
      case TAN:
        return Math.tan(u);
      case COT:
        return 1d / Math.tan(u);
      case SEC:
        return 1d / Math.cos(u);
      case CSC:
        return 1d / Math.sin(u);
      case ASIN:
        return Math.asin(u);
      case ACOS:
        return Math.acos(u);
      case ATAN:
        return Math.atan(u);
      case SINH:
        return Math.sinh(u);
      case COSH:
        return Math.cosh(u);
      case TANH:
        return Math.tanh(u);
      case EXP:
        return Math.exp(u);
      case LN:
        return u > 0 ? Math.log(u) : Double.NaN;
      case ABS:
        return Math.abs(u);
      default:
        throw new AssertionError("unexpected " + apply.fn);
      }

    default:
      // an unevaluated integral has no numeric value
      return Double.NaN;
    }
  }

  /** Raises to a power; a negative base with a rational exponent of odd
   * denominator takes the real root. */
  private static double power(double base, Alg.Exp exponent,
      Map<String, Double> env) {
    if (base < 0 && exponent.isNumber()) {
      final Alg.Num n = (Alg.Num) exponent;
      if (!n.value.isInteger() && n.value.den.testBit(0)) {
        final double r = Math.pow(-base, n.value.doubleValue());
        return n.value.num.testBit(0) ? -r : r;
      }
    }
    return Math.pow(base, evaluate(exponent, env));
  }
}

// End Evaluator.java
