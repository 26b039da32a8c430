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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.ast.Op;
import net.hydromatic.symbolic.ast.Shuttle;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Structural utilities for algebraic expressions. */
public class Expressions {
  private Expressions() {}

  /** Returns whether an expression does not contain a given symbol. */
  public static boolean freeOf(Alg.Exp e, Alg.Sym x) {
    return !contains(e, x);
  }

  /** Returns whether an expression contains a given sub-expression. */
  public static boolean contains(Alg.Exp e, Alg.Exp sub) {
    if (e.equals(sub)) {
      return true;
    }
    for (Alg.Exp arg : e.args()) {
      if (contains(arg, sub)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the number of nodes in an expression. */
  public static int complexity(Alg.Exp e) {
    int n = 1;
    for (Alg.Exp arg : e.args()) {
      n += complexity(arg);
    }
    return n;
  }

  /** Returns every node of an expression, in pre-order. */
  public static List<Alg.Exp> subexpressions(Alg.Exp e) {
    final List<Alg.Exp> list = new ArrayList<>();
    collect(e, list);
    return list;
  }

  private static void collect(Alg.Exp e, List<Alg.Exp> list) {
    list.add(e);
    for (Alg.Exp arg : e.args()) {
      collect(arg, list);
    }
  }

  /** Replaces every occurrence of a symbol with a value. */
  public static Alg.Exp substitute(Alg.Exp e, Alg.Sym var, Alg.Exp value) {
    return replace(e, var, value);
  }

  /** Replaces every occurrence of a sub-expression with another
   * expression. */
  public static Alg.Exp replace(Alg.Exp e, Alg.Exp from, Alg.Exp to) {
    return Shuttle.replacer(ImmutableMap.of(from, to)).rewrite(e);
  }

  /** Splits an expression into a factor that is free of {@code x} and a
   * factor that depends on it. */
  public static Split split(Alg.Exp e, Alg.Sym x) {
    if (e.op == Op.MUL) {
      final List<Alg.Exp> constants = new ArrayList<>();
      final List<Alg.Exp> dependents = new ArrayList<>();
      for (Alg.Exp factor : ((Alg.Mul) e).factors) {
        (freeOf(factor, x) ? constants : dependents).add(factor);
      }
      return new Split(alg.mul(constants), alg.mul(dependents));
    }
    return freeOf(e, x)
        ? new Split(e, alg.num(1))
        : new Split(alg.num(1), e);
  }

  /** Returns the factors of an expression; a product yields its factors,
   * any other expression yields itself. */
  public static List<Alg.Exp> factors(Alg.Exp e) {
    return e.op == Op.MUL ? ((Alg.Mul) e).factors : ImmutableList.of(e);
  }

  /** Returns the terms of an expression; a sum yields its terms, any other
   * expression yields itself. */
  public static List<Alg.Exp> terms(Alg.Exp e) {
    return e.op == Op.ADD ? ((Alg.Add) e).terms : ImmutableList.of(e);
  }

  /** If {@code e} has the form {@code a * x + b} with {@code a} and
   * {@code b} free of {@code x} and {@code a} not zero, returns
   * {@code a} and {@code b}; otherwise null. */
  public static @Nullable Linear linear(Alg.Exp e, Alg.Sym x) {
    final List<Alg.Exp> as = new ArrayList<>();
    final List<Alg.Exp> bs = new ArrayList<>();
    for (Alg.Exp term : terms(e)) {
      final Split split = split(term, x);
      if (split.dependent.isOne()) {
        bs.add(term);
      } else if (split.dependent.equals(x)) {
        as.add(split.constant);
      } else {
        return null;
      }
    }
    final Alg.Exp a = alg.add(as);
    if (a.isZero()) {
      return null;
    }
    return new Linear(a, alg.add(bs));
  }

  /** Returns the integer value of a number expression, or null if the
   * expression is not a small integer. */
  public static @Nullable Integer intValue(Alg.Exp e) {
    if (e.isNumber() && ((Alg.Num) e).value.isSmallInteger()) {
      return ((Alg.Num) e).value.intValue();
    }
    return null;
  }

  /** Result of {@link #split}: {@code constant * dependent}. */
  public static class Split {
    /** Product of the factors that are free of the variable. */
    public final Alg.Exp constant;
    /** Product of the factors that contain the variable; 1 if there are
     * none. */
    public final Alg.Exp dependent;

    Split(Alg.Exp constant, Alg.Exp dependent) {
      this.constant = constant;
      this.dependent = dependent;
    }
  }

  /** Result of {@link #linear}: {@code a * x + b}. */
  public static class Linear {
    public final Alg.Exp a;
    public final Alg.Exp b;

    Linear(Alg.Exp a, Alg.Exp b) {
      this.a = a;
      this.b = b;
    }

    /** Returns whether this is {@code x} itself. */
    public boolean isIdentity() {
      return a.isOne() && b.isZero();
    }
  }
}

// End Expressions.java
