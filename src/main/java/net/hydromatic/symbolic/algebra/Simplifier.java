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

import static net.hydromatic.symbolic.ast.AlgBuilder.alg;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.ast.Fn;
import net.hydromatic.symbolic.ast.Op;
import net.hydromatic.symbolic.ast.Shuttle;
import net.hydromatic.symbolic.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Simplifies algebraic expressions.
 *
 * <p>{@link #simplify} rebuilds an expression through the builder and
 * applies the Pythagorean identity; {@link #expand} also multiplies out
 * products and integer powers of sums.
 */
public class Simplifier {
  private Simplifier() {}

  /** Maximum power of a sum that {@link #expand} will multiply out. */
  private static final int MAX_EXPAND_POWER = 12;

  /** Returns a simplified expression. */
  public static Alg.Exp simplify(Alg.Exp e) {
    return new SimplifyShuttle(false).rewrite(e);
  }

  /** Returns an expanded, simplified expression. */
  public static Alg.Exp expand(Alg.Exp e) {
    return new SimplifyShuttle(true).rewrite(e);
  }

  /** Multiplies a list of expanded factors, distributing over sums. */
  static Alg.Exp distribute(List<Alg.Exp> factors) {
    List<Alg.Exp> products = new ArrayList<>();
    products.add(alg.num(1));
    for (Alg.Exp factor : factors) {
      final List<Alg.Exp> next = new ArrayList<>();
      for (Alg.Exp product : products) {
        for (Alg.Exp term : Expressions.terms(factor)) {
          next.add(alg.mul(product, term));
        }
      }
      products = next;
    }
    return alg.add(products);
  }

  /** Replaces {@code c sin(u)^2 + c cos(u)^2} in a sum with {@code c}. */
  static Alg.Exp pythagoras(Alg.Exp e) {
    if (e.op != Op.ADD) {
      return e;
    }
    final List<Alg.Exp> terms = new ArrayList<>(((Alg.Add) e).terms);
    boolean changed = false;
    for (int i = 0; i < terms.size(); i++) {
      final Alg.Exp arg = squaredArg(terms.get(i), Fn.SIN);
      if (arg == null) {
        continue;
      }
      final Rational c = coefficient(terms.get(i));
      for (int j = 0; j < terms.size(); j++) {
        final Alg.Exp arg2 = squaredArg(terms.get(j), Fn.COS);
        if (arg.equals(arg2) && c.equals(coefficient(terms.get(j)))) {
          terms.set(i, alg.num(c));
          terms.remove(j);
          changed = true;
          break;
        }
      }
    }
    return changed ? alg.add(terms) : e;
  }

  private static Rational coefficient(Alg.Exp term) {
    return term.op == Op.MUL ? ((Alg.Mul) term).coefficient() : Rational.ONE;
  }

  /** If {@code term} is {@code c fn(u)^2}, returns u; otherwise null. */
  private static Alg.@Nullable Exp squaredArg(Alg.Exp term, Fn fn) {
    Alg.Exp rest = term;
    if (term.op == Op.MUL) {
      final List<Alg.Exp> factors = ((Alg.Mul) term).factors;
      if (factors.size() != 2 || !factors.get(0).isNumber()) {
        return null;
      }
      rest = factors.get(1);
    }
    if (rest.op == Op.POW) {
      final Alg.Pow pow = (Alg.Pow) rest;
      if (pow.exponent.isNumber(Rational.TWO) && pow.base.isCallTo(fn)) {
        return ((Alg.Apply) pow.base).arg;
      }
    }
    return null;
  }

  /** Shuttle that rebuilds every node, optionally expanding. */
  private static class SimplifyShuttle extends Shuttle {
    private final boolean expand;

    SimplifyShuttle(boolean expand) {
      this.expand = expand;
    }

    @Override protected Alg.Exp visit(Alg.Add add) {
      return pythagoras(alg.add(rewriteList(add.terms)));
    }

    @Override protected Alg.Exp visit(Alg.Mul mul) {
      final List<Alg.Exp> factors = rewriteList(mul.factors);
      return expand ? distribute(factors) : alg.mul(factors);
    }

    @Override protected Alg.Exp visit(Alg.Pow pow) {
      final Alg.Exp base = rewrite(pow.base);
      final Alg.Exp exponent = rewrite(pow.exponent);
      final Integer n = Expressions.intValue(exponent);
      if (expand
          && base.op == Op.ADD
          && n != null
          && n > 1
          && n <= MAX_EXPAND_POWER) {
        final List<Alg.Exp> factors = new ArrayList<>();
        for (int i = 0; i < n; i++) {
          factors.add(base);
        }
        return distribute(factors);
      }
      return alg.pow(base, exponent);
    }

    @Override protected Alg.Exp visit(Alg.Apply apply) {
      return alg.apply(apply.fn, rewrite(apply.arg));
    }
  }
}

// End Simplifier.java
