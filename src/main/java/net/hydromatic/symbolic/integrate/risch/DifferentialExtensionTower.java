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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.symbolic.ast.AlgBuilder.alg;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.symbolic.algebra.Expressions;
import net.hydromatic.symbolic.algebra.Simplifier;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.ast.Fn;
import net.hydromatic.symbolic.poly.Field;
import net.hydromatic.symbolic.poly.Poly;
import net.hydromatic.symbolic.poly.RationalFunction;
import net.hydromatic.symbolic.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Tower of differential fields {@code C(x)(t_1)...(t_n)}.
 *
 * <p>Level 0 is {@code C(x)}; level {@code i} is level {@code i - 1}
 * extended by {@code t_i}. An element of level {@code i} is a
 * {@link RationalFunction} whose coefficients are elements of level
 * {@code i - 1}; the coefficients of level 0 are constants. Because the
 * element type differs at each level, methods that work on an arbitrary
 * level take and return {@code Object}.
 */
public class DifferentialExtensionTower {
  public final Alg.Sym x;
  public final DiffField<?> constants;
  public final ImmutableList<Extension<?>> levels;

  private DifferentialExtensionTower(Alg.Sym x, DiffField<?> constants,
      ImmutableList<Extension<?>> levels) {
    this.x = requireNonNull(x);
    this.constants = requireNonNull(constants);
    this.levels = requireNonNull(levels);
    checkArgument(!levels.isEmpty());
  }

  /** Creates a tower that has just level 0, {@code C(x)}. */
  static <C> DifferentialExtensionTower base(Alg.Sym x,
      Field<C> constantField) {
    final ConstantField<C> constants = new ConstantField<>(constantField);
    final Extension<C> level0 =
        new Extension<>(constants, Extension.Kind.X,
            Poly.one(constants), x, x);
    return new DifferentialExtensionTower(x, constants,
        ImmutableList.of(level0));
  }

  @Override public String toString() {
    final StringBuilder b = new StringBuilder("Q(").append(x).append(')');
    for (Extension<?> level : levels.subList(1, levels.size())) {
      b.append('(').append(level.kernel).append(')');
    }
    return b.toString();
  }

  /** Returns the index of the top level. */
  public int top() {
    return levels.size() - 1;
  }

  public Extension<?> level(int i) {
    return levels.get(i);
  }

  /** Returns a tower with one more level. */
  DifferentialExtensionTower extend(Extension<?> extension) {
    return new DifferentialExtensionTower(x, constants,
        ImmutableList.<Extension<?>>builder().addAll(levels).add(extension)
            .build());
  }

  /** Returns the field of level {@code i}; level -1 is the constants. */
  @SuppressWarnings("unchecked")
  DiffField<Object> field(int i) {
    return (DiffField<Object>) (i < 0 ? constants : levels.get(i));
  }

  /** Converts an element of level {@code from} into an element of level
   * {@code to}. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  Object embed(Object e, int from, int to) {
    checkArgument(from <= to);
    for (int i = from + 1; i <= to; i++) {
      e = ((Extension) levels.get(i)).constant(e);
    }
    return e;
  }

  /** Converts an expression into an element of level {@code level}, or
   * returns null if it contains a kernel that is not in levels
   * {@code 0 .. level}. */
  public @Nullable Object toElement(Alg.Exp e, int level) {
    final DiffField<Object> field = field(level);
    switch (e.op) {
    case NUMBER:
      return field.fromRational(((Alg.Num) e).value);
    case SYMBOL:
      return e.equals(x) ? embed(levels.get(0).t(), 0, level) : null;
    case ADD:
      Object sum = field.zero();
      for (Alg.Exp term : ((Alg.Add) e).terms) {
        final Object o = toElement(term, level);
        if (o == null) {
          return null;
        }
        sum = field.add(sum, o);
      }
      return sum;
    case MUL:
      Object product = field.one();
      for (Alg.Exp factor : ((Alg.Mul) e).factors) {
        final Object o = toElement(factor, level);
        if (o == null) {
          return null;
        }
        product = field.multiply(product, o);
      }
      return product;
    case POW:
      final Alg.Pow pow = (Alg.Pow) e;
      if (!Expressions.freeOf(pow.exponent, x)) {
        return expElement(alg.mul(pow.exponent, alg.ln(pow.base)), level);
      }
      final Integer n = Expressions.intValue(pow.exponent);
      if (n == null) {
        return null;
      }
      final Object base = toElement(pow.base, level);
      if (base == null || n < 0 && field.isZero(base)) {
        return null;
      }
      return field.pow(base, n);
    case APPLY:
      final Alg.Apply apply = (Alg.Apply) e;
      if (apply.fn == Fn.EXP) {
        return expElement(apply.arg, level);
      }
      if (apply.fn == Fn.LN) {
        for (int i = 1; i <= level; i++) {
          final Extension<?> ext = levels.get(i);
          if (ext.kind == Extension.Kind.LOG
              && ext.argument.equals(apply.arg)) {
            return embed(ext.t(), i, level);
          }
        }
      }
      return null;
    default:
      return null;
    }
  }

  /** Converts {@code exp(u)} to an element; it must be an integer power of
   * the generator of some exponential level. */
  private @Nullable Object expElement(Alg.Exp u, int level) {
    for (int i = 1; i <= level; i++) {
      final Extension<?> ext = levels.get(i);
      if (ext.kind != Extension.Kind.EXP) {
        continue;
      }
      final Alg.Exp ratio = Simplifier.simplify(alg.div(u, ext.argument));
      final Integer m = Expressions.intValue(ratio);
      if (m != null) {
        final DiffField<Object> field = field(i);
        return embed(field.pow(ext.t(), m), i, level);
      }
    }
    return null;
  }

  /** Converts an element of level {@code level} back to an expression. */
  public Alg.Exp toExp(Object e, int level) {
    if (level < 0) {
      final Rational r = constants.toRational(castConstant(e));
      checkState(r != null, "not a rational constant: %s", e);
      return alg.num(r);
    }
    final RationalFunction<?> f = (RationalFunction<?>) e;
    return alg.div(toExp(f.num, level), toExp(f.den, level));
  }

  @SuppressWarnings("unchecked")
  private static <C> C castConstant(Object e) {
    return (C) e;
  }

  private Alg.Exp toExp(Poly<?> p, int level) {
    final Alg.Exp t = levels.get(level).kernel;
    final List<Alg.Exp> terms = new ArrayList<>();
    for (int i = 0; i <= p.degree(); i++) {
      final Object c = p.coefficient(i);
      if (!field(level - 1).isZero(c)) {
        terms.add(alg.mul(toExp(c, level - 1), alg.pow(t, i)));
      }
    }
    return alg.add(terms);
  }
}

// End DifferentialExtensionTower.java
