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

import static net.hydromatic.symbolic.algebra.Expressions.freeOf;
import static net.hydromatic.symbolic.ast.AlgBuilder.alg;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.symbolic.ast.Alg;

/** Symbolic differentiation. */
public class Differentiator {
  private Differentiator() {}

  /** Returns the derivative of an expression with respect to a symbol. */
  public static Alg.Exp derivative(Alg.Exp e, Alg.Sym x) {
    if (freeOf(e, x)) {
      return alg.num(0);
    }
    switch (e.op) {
    case SYMBOL:
      return alg.num(1);

    case ADD:
      final List<Alg.Exp> terms = new ArrayList<>();
      for (Alg.Exp term : ((Alg.Add) e).terms) {
        terms.add(derivative(term, x));
      }
      return alg.add(terms);

    case MUL:
      // product rule: sum over i of f_i' times the other factors
      final List<Alg.Exp> factors = ((Alg.Mul) e).factors;
      final List<Alg.Exp> sum = new ArrayList<>();
      for (int i = 0; i < factors.size(); i++) {
        final Alg.Exp d = derivative(factors.get(i), x);
        if (d.isZero()) {
          continue;
        }
        final List<Alg.Exp> product = new ArrayList<>(factors);
        product.set(i, d);
        sum.add(alg.mul(product));
      }
      return alg.add(sum);

    case POW:
      return powDerivative((Alg.Pow) e, x);

    case APPLY:
      final Alg.Apply apply = (Alg.Apply) e;
      return alg.mul(outerDerivative(apply), derivative(apply.arg, x));

    case INTEGRAL:
      final Alg.Integral integral = (Alg.Integral) e;
      if (integral.var.equals(x)) {
        return integral.integrand;
      }
      return alg.integral(derivative(integral.integrand, x), integral.var);

    default:
      throw new AssertionError("unexpected " + e.op);
    }
  }

  private static Alg.Exp powDerivative(Alg.Pow pow, Alg.Sym x) {
    final Alg.Exp b = pow.base;
    final Alg.Exp n = pow.exponent;
    if (freeOf(n, x)) {
      // d(b^n) = n b^(n-1) b'
      return alg.mul(n, alg.pow(b, alg.sub(n, alg.num(1))),
          derivative(b, x));
    }
    if (freeOf(b, x)) {
      // d(b^n) = b^n ln(b) n'
      return alg.mul(pow, alg.ln(b), derivative(n, x));
    }
    // d(b^n) = b^n (n' ln(b) + n b' / b)
    return alg.mul(pow,
        alg.add(alg.mul(derivative(n, x), alg.ln(b)),
            alg.mul(n, derivative(b, x), alg.pow(b, -1))));
  }

  /** Returns {@code f'(u)} for {@code f(u)}. */
  private static Alg.Exp outerDerivative(Alg.Apply apply) {
    final Alg.Exp u = apply.arg;
    switch (apply.fn) {
    case SIN:
      return alg.cos(u);
    case COS:
      return alg.negate(alg.sin(u));
    case TAN:
      return alg.pow(alg.sec(u), 2);
    case COT:
      return alg.negate(alg.pow(alg.csc(u), 2));
    case SEC:
      return alg.mul(alg.sec(u), alg.tan(u));
    case CSC:
      return alg.negate(alg.mul(alg.csc(u), alg.cot(u)));
    case ASIN:
      return alg.pow(alg.sub(alg.num(1), alg.pow(u, 2)), alg.num(-1, 2));
    case ACOS:
      return alg.negate(
          alg.pow(alg.sub(alg.num(1), alg.pow(u, 2)), alg.num(-1, 2)));
    case ATAN:
      return alg.pow(alg.add(alg.pow(u, 2), alg.num(1)), -1);
    case SINH:
      return alg.cosh(u);
    case COSH:
      return alg.sinh(u);
    case TANH:
      return alg.pow(alg.cosh(u), -2);
    case EXP:
      return apply;
    case LN:
      return alg.pow(u, -1);
    case ABS:
      // d|u| = u / |u|
      return alg.mul(u, alg.pow(apply, -1));
    default:
      throw new AssertionError("unexpected " + apply.fn);
    }
  }
}

// End Differentiator.java
