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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import net.hydromatic.symbolic.util.Rational;

/**
 * Builds algebraic expressions in canonical form.
 *
 * <p>Canonical form means:
 *
 * <ul>
 *   <li>sums and products are flat, and have at least two operands;
 *   <li>numbers are folded; a sum has at most one numeric term, which is
 *       last; a product has at most one numeric factor, which is first;
 *   <li>like terms of a sum are collected ({@code 2x + 3x = 5x}), and like
 *       bases of a product are collected ({@code x * x^2 = x^3});
 *   <li>the other operands of a sum or product are sorted in canonical order;
 *   <li>a number times a single sum is distributed ({@code 2(x + 1) = 2x +
 *       2}).
 * </ul>
 *
 * <p>In addition, the builder applies a few identities that always hold for
 * real arguments, such as {@code exp(ln u) = u}, {@code (u v)^n = u^n v^n}
 * for integer {@code n}, and {@code |u| = u} if {@code u} is provably
 * non-negative.
 */
public enum AlgBuilder {
  /** The singleton instance of the builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  alg;

  private final Alg.Num zero = new Alg.Num(Rational.ZERO);
  private final Alg.Num one = new Alg.Num(Rational.ONE);
  private final Alg.Num minusOne = new Alg.Num(Rational.MINUS_ONE);
  private final Alg.Num half = new Alg.Num(Rational.HALF);

  /** Creates a number. */
  public Alg.Num num(Rational value) {
    if (value.isZero()) {
      return zero;
    } else if (value.isOne()) {
      return one;
    } else {
      return new Alg.Num(value);
    }
  }

  /** Creates an integer. */
  public Alg.Num num(long value) {
    return num(Rational.of(value));
  }

  /** Creates a fraction. */
  public Alg.Num num(long num, long den) {
    return num(Rational.of(num, den));
  }

  /** Creates a symbol. */
  public Alg.Sym sym(String name) {
    return new Alg.Sym(name);
  }

  /** Creates a sum. */
  public Alg.Exp add(Alg.Exp... terms) {
    return add(Arrays.asList(terms));
  }

  /** Creates a sum of a list of terms. */
  public Alg.Exp add(Iterable<? extends Alg.Exp> terms) {
    final List<Alg.Exp> flat = new ArrayList<>();
    flatten(Op.ADD, terms, flat);
    Rational constant = Rational.ZERO;
    final Map<Alg.Exp, Rational> coefficients = new TreeMap<>();
    for (Alg.Exp term : flat) {
      if (term.isNumber()) {
        constant = constant.plus(((Alg.Num) term).value);
        continue;
      }
      Rational c = Rational.ONE;
      Alg.Exp rest = term;
      if (term.op == Op.MUL) {
        final Alg.Mul mul = (Alg.Mul) term;
        if (mul.factors.get(0).isNumber()) {
          c = mul.coefficient();
          rest = withoutCoefficient(mul);
        }
      }
      coefficients.merge(rest, c, Rational::plus);
    }
    final List<Alg.Exp> list = new ArrayList<>();
    coefficients.forEach((rest, c) -> {
      if (!c.isZero()) {
        list.add(scale(c, rest));
      }
    });
    if (!constant.isZero()) {
      list.add(num(constant));
    }
    switch (list.size()) {
    case 0:
      return zero;
    case 1:
      return list.get(0);
    default:
      return new Alg.Add(ImmutableList.copyOf(list));
    }
  }

  /** Returns a product without its numeric coefficient. */
  private Alg.Exp withoutCoefficient(Alg.Mul mul) {
    if (mul.factors.size() == 2) {
      return mul.factors.get(1);
    }
    return new Alg.Mul(mul.factors.subList(1, mul.factors.size()));
  }

  /** Multiplies a canonical non-numeric, non-sum expression by a number. */
  private Alg.Exp scale(Rational c, Alg.Exp e) {
    if (c.isOne()) {
      return e;
    }
    final ImmutableList.Builder<Alg.Exp> b = ImmutableList.builder();
    b.add(num(c));
    if (e.op == Op.MUL) {
      b.addAll(((Alg.Mul) e).factors);
    } else {
      b.add(e);
    }
    return new Alg.Mul(b.build());
  }

  /** Creates a difference. */
  public Alg.Exp sub(Alg.Exp a, Alg.Exp b) {
    return add(a, negate(b));
  }

  /** Creates the negation of an expression. */
  public Alg.Exp negate(Alg.Exp e) {
    return mul(minusOne, e);
  }

  /** Creates a product. */
  public Alg.Exp mul(Alg.Exp... factors) {
    return mul(Arrays.asList(factors));
  }

  /** Creates a product of a list of factors. */
  public Alg.Exp mul(Iterable<? extends Alg.Exp> factors) {
    final List<Alg.Exp> flat = new ArrayList<>();
    flatten(Op.MUL, factors, flat);
    Rational coefficient = Rational.ONE;
    final Map<Alg.Exp, List<Alg.Exp>> exponents = new TreeMap<>();
    final List<Alg.Exp> expArgs = new ArrayList<>();
    for (Alg.Exp factor : flat) {
      if (factor.isNumber()) {
        coefficient = coefficient.times(((Alg.Num) factor).value);
      } else if (factor.isCallTo(Fn.EXP)) {
        expArgs.add(((Alg.Apply) factor).arg);
      } else if (factor.op == Op.POW) {
        final Alg.Pow pow = (Alg.Pow) factor;
        exponents.computeIfAbsent(pow.base, b -> new ArrayList<>())
            .add(pow.exponent);
      } else {
        exponents.computeIfAbsent(factor, b -> new ArrayList<>()).add(one);
      }
    }
    if (coefficient.isZero()) {
      return zero;
    }
    final List<Alg.Exp> list = new ArrayList<>();
    boolean again = false;
    for (Map.Entry<Alg.Exp, List<Alg.Exp>> entry : exponents.entrySet()) {
      final Alg.Exp p = pow(entry.getKey(), add(entry.getValue()));
      if (p.op == Op.NUMBER || p.op == Op.MUL || p.isCallTo(Fn.EXP)) {
        again = true;
      }
      list.add(p);
    }
    if (expArgs.size() == 1) {
      list.add(exp(expArgs.get(0)));
    } else if (expArgs.size() > 1) {
      final Alg.Exp e = exp(add(expArgs));
      if (!e.isCallTo(Fn.EXP)) {
        again = true;
      }
      list.add(e);
    }
    if (again) {
      list.add(num(coefficient));
      return mul(list);
    }
    Collections.sort(list);
    if (list.isEmpty()) {
      return num(coefficient);
    }
    if (list.size() == 1) {
      final Alg.Exp e = list.get(0);
      if (coefficient.isOne()) {
        return e;
      }
      if (e.op == Op.ADD) {
        final List<Alg.Exp> terms = new ArrayList<>();
        for (Alg.Exp term : ((Alg.Add) e).terms) {
          terms.add(mul(num(coefficient), term));
        }
        return add(terms);
      }
    }
    if (!coefficient.isOne()) {
      list.add(0, num(coefficient));
    }
    return new Alg.Mul(ImmutableList.copyOf(list));
  }

  /** Creates a quotient. */
  public Alg.Exp div(Alg.Exp a, Alg.Exp b) {
    return mul(a, pow(b, minusOne));
  }

  /** Creates a power with an integer exponent. */
  public Alg.Exp pow(Alg.Exp base, long exponent) {
    return pow(base, num(exponent));
  }

  /** Creates a square root. */
  public Alg.Exp sqrt(Alg.Exp e) {
    return pow(e, half);
  }

  /** Creates a power. */
  public Alg.Exp pow(Alg.Exp base, Alg.Exp exponent) {
    if (exponent.isZero() || base.isOne()) {
      return one;
    }
    if (exponent.isOne()) {
      return base;
    }
    if (base.isZero()) {
      if (exponent.isNumber()) {
        if (((Alg.Num) exponent).value.signum() < 0) {
          throw new ArithmeticException("division by zero");
        }
        return zero;
      }
      return new Alg.Pow(base, exponent);
    }
    final Rational n =
        exponent.isNumber() ? ((Alg.Num) exponent).value : null;
    switch (base.op) {
    case NUMBER:
      if (n != null) {
        final Rational b = ((Alg.Num) base).value;
        if (n.isSmallInteger()) {
          return num(b.pow(n.intValue()));
        }
        if (n.den.bitLength() < 31 && n.num.bitLength() < 31) {
          final Rational root = b.root(n.den.intValue());
          if (root != null) {
            return num(root.pow(n.num.intValue()));
          }
        }
      }
      break;
    case POW:
      if (n != null && n.isInteger()) {
        final Alg.Pow pow = (Alg.Pow) base;
        return pow(pow.base, mul(pow.exponent, exponent));
      }
      break;
    case MUL:
      if (n != null && n.isInteger()) {
        final List<Alg.Exp> factors = new ArrayList<>();
        for (Alg.Exp factor : ((Alg.Mul) base).factors) {
          factors.add(pow(factor, exponent));
        }
        return mul(factors);
      }
      break;
    case APPLY:
      final Alg.Apply apply = (Alg.Apply) base;
      if (apply.fn == Fn.EXP) {
        return exp(mul(apply.arg, exponent));
      }
      if (apply.fn == Fn.ABS
          && n != null
          && n.isInteger()
          && !n.num.testBit(0)) {
        return pow(apply.arg, exponent);
      }
      break;
    default:
      break;
    }
    return new Alg.Pow(base, exponent);
  }

  /** Creates an application of a function to an argument. */
  public Alg.Exp apply(Fn fn, Alg.Exp arg) {
    if (arg.isZero() && fn.zeroValue != null) {
      return num(fn.zeroValue);
    }
    switch (fn) {
    case EXP:
      if (arg.isCallTo(Fn.LN)) {
        return ((Alg.Apply) arg).arg;
      }
      if (arg.op == Op.MUL) {
        // exp(a * ln(u)) = u^a
        final List<Alg.Exp> factors = ((Alg.Mul) arg).factors;
        for (int i = 0; i < factors.size(); i++) {
          if (factors.get(i).isCallTo(Fn.LN)) {
            final List<Alg.Exp> rest = new ArrayList<>(factors);
            rest.remove(i);
            return pow(((Alg.Apply) factors.get(i)).arg, mul(rest));
          }
        }
      }
      break;
    case LN:
      if (arg.isOne()) {
        return zero;
      }
      if (arg.isCallTo(Fn.EXP)) {
        return ((Alg.Apply) arg).arg;
      }
      break;
    case ABS:
      if (isNonNegative(arg)) {
        return arg;
      }
      if (arg.isNumber()) {
        return num(((Alg.Num) arg).value.abs());
      }
      if (arg.op == Op.MUL) {
        final Alg.Mul mul = (Alg.Mul) arg;
        final Rational c = mul.coefficient();
        if (!c.isOne()) {
          return mul(num(c.abs()), abs(withoutCoefficient(mul)));
        }
      }
      break;
    default:
      if (Alg.isNegative(arg)) {
        switch (fn.symmetry) {
        case ODD:
          return negate(apply(fn, negate(arg)));
        case EVEN:
          return apply(fn, negate(arg));
        default:
          break;
        }
      }
    }
    return new Alg.Apply(fn, arg);
  }

  /** Returns whether an expression is provably non-negative for every real
   * value of its symbols (where it is defined). */
  public boolean isNonNegative(Alg.Exp e) {
    switch (e.op) {
    case NUMBER:
      return ((Alg.Num) e).value.signum() >= 0;
    case APPLY:
      final Fn fn = ((Alg.Apply) e).fn;
      return fn == Fn.EXP || fn == Fn.COSH || fn == Fn.ABS;
    case POW:
      final Alg.Pow pow = (Alg.Pow) e;
      if (pow.exponent.isNumber()) {
        final Rational n = ((Alg.Num) pow.exponent).value;
        if (n.isInteger() ? !n.num.testBit(0) : !n.den.testBit(0)) {
          // even power, or a root with even index
          return true;
        }
      }
      return isNonNegative(pow.base);
    case ADD:
      for (Alg.Exp term : ((Alg.Add) e).terms) {
        if (!isNonNegative(term)) {
          return false;
        }
      }
      return true;
    case MUL:
      for (Alg.Exp factor : ((Alg.Mul) e).factors) {
        if (!isNonNegative(factor)) {
          return false;
        }
      }
      return true;
    default:
      return false;
    }
  }

  /** Creates an unevaluated integral. */
  public Alg.Integral integral(Alg.Exp integrand, Alg.Sym var) {
    return new Alg.Integral(integrand, var);
  }

  public Alg.Exp exp(Alg.Exp arg) {
    return apply(Fn.EXP, arg);
  }

  public Alg.Exp ln(Alg.Exp arg) {
    return apply(Fn.LN, arg);
  }

  public Alg.Exp abs(Alg.Exp arg) {
    return apply(Fn.ABS, arg);
  }

  public Alg.Exp sin(Alg.Exp arg) {
    return apply(Fn.SIN, arg);
  }

  public Alg.Exp cos(Alg.Exp arg) {
    return apply(Fn.COS, arg);
  }

  public Alg.Exp tan(Alg.Exp arg) {
    return apply(Fn.TAN, arg);
  }

  public Alg.Exp cot(Alg.Exp arg) {
    return apply(Fn.COT, arg);
  }

  public Alg.Exp sec(Alg.Exp arg) {
    return apply(Fn.SEC, arg);
  }

  public Alg.Exp csc(Alg.Exp arg) {
    return apply(Fn.CSC, arg);
  }

  public Alg.Exp asin(Alg.Exp arg) {
    return apply(Fn.ASIN, arg);
  }

  public Alg.Exp acos(Alg.Exp arg) {
    return apply(Fn.ACOS, arg);
  }

  public Alg.Exp atan(Alg.Exp arg) {
    return apply(Fn.ATAN, arg);
  }

  public Alg.Exp sinh(Alg.Exp arg) {
    return apply(Fn.SINH, arg);
  }

  public Alg.Exp cosh(Alg.Exp arg) {
    return apply(Fn.COSH, arg);
  }

  public Alg.Exp tanh(Alg.Exp arg) {
    return apply(Fn.TANH, arg);
  }

  private static void flatten(Op op, Iterable<? extends Alg.Exp> exps,
      List<Alg.Exp> list) {
    for (Alg.Exp exp : exps) {
      if (exp.op == op) {
        list.addAll(exp.args());
      } else {
        list.add(exp);
      }
    }
  }
}

// End AlgBuilder.java
