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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.symbolic.ast.AlgBuilder.alg;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import net.hydromatic.symbolic.algebra.Differentiator;
import net.hydromatic.symbolic.algebra.Expressions;
import net.hydromatic.symbolic.algebra.Simplifier;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.ast.Fn;
import net.hydromatic.symbolic.poly.Poly;
import net.hydromatic.symbolic.poly.RationalField;
import net.hydromatic.symbolic.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds the {@link DifferentialExtensionTower} in which an integrand lives.
 *
 * <p>Kernels {@code exp(u)} and {@code ln(u)} become levels, innermost
 * first. Exponentials whose arguments are rational multiples of each other
 * share a generator, so {@code exp(x)} and {@code exp(2 x)} are {@code t}
 * and {@code t^2}. A power {@code a^u} whose exponent depends on {@code x}
 * is treated as {@code exp(u ln a)}.
 *
 * <p>Returns null (and the Risch procedure declines) if the integrand has
 * a function other than {@code exp} and {@code ln}, a non-integer power of
 * an expression in {@code x}, a transcendental constant such as
 * {@code exp(1)}, a symbol other than {@code x}, or kernels that are
 * algebraically dependent in a way this builder does not resolve.
 */
class TowerBuilder {
  private final Alg.Sym x;
  /** Kernels in the order they must be added: arguments before the
   * kernels that use them. */
  private final Set<Kernel> kernels = new LinkedHashSet<>();

  private TowerBuilder(Alg.Sym x) {
    this.x = requireNonNull(x);
  }

  /** Builds a tower for an integrand, or returns null. */
  static @Nullable DifferentialExtensionTower build(Alg.Exp integrand,
      Alg.Sym x) {
    final TowerBuilder builder = new TowerBuilder(x);
    if (!builder.collect(integrand)) {
      return null;
    }
    return builder.tower();
  }

  private boolean collect(Alg.Exp e) {
    switch (e.op) {
    case NUMBER:
      return true;
    case SYMBOL:
      return e.equals(x);
    case ADD:
    case MUL:
      for (Alg.Exp arg : e.args()) {
        if (!collect(arg)) {
          return false;
        }
      }
      return true;
    case POW:
      final Alg.Pow pow = (Alg.Pow) e;
      if (!collect(pow.base)) {
        return false;
      }
      if (Expressions.freeOf(pow.exponent, x)) {
        return Expressions.intValue(pow.exponent) != null;
      }
      if (Expressions.freeOf(pow.base, x) || !collect(pow.exponent)) {
        // 2^x would need the constant ln 2
        return false;
      }
      kernels.add(new Kernel(Extension.Kind.LOG, pow.base));
      return addExp(alg.mul(pow.exponent, alg.ln(pow.base)));
    case APPLY:
      final Alg.Apply apply = (Alg.Apply) e;
      if (Expressions.freeOf(apply, x) || !collect(apply.arg)) {
        return false;
      }
      switch (apply.fn) {
      case EXP:
        return addExp(apply.arg);
      case LN:
        for (Alg.Exp factor : Expressions.factors(apply.arg)) {
          if (factor.isCallTo(Fn.EXP)) {
            return false;
          }
        }
        kernels.add(new Kernel(Extension.Kind.LOG, apply.arg));
        return true;
      default:
        return false;
      }
    default:
      return false;
    }
  }

  /** Records {@code exp(u)}. Declines if {@code u} has a term
   * {@code c ln(v)}, since then {@code exp(u)} is algebraic over the
   * logarithms. */
  private boolean addExp(Alg.Exp u) {
    for (Alg.Exp term : Expressions.terms(u)) {
      if (Expressions.split(term, x).dependent.isCallTo(Fn.LN)) {
        return false;
      }
    }
    kernels.add(new Kernel(Extension.Kind.EXP, u));
    return true;
  }

  private @Nullable DifferentialExtensionTower tower() {
    final List<Group> groups = new ArrayList<>();
    final List<Alg.Exp> logs = new ArrayList<>();
    final Map<Kernel, Group> groupByKernel = new HashMap<>();
    for (Kernel kernel : kernels) {
      final Alg.Exp arg = kernel.arg;
      if (kernel.kind == Extension.Kind.LOG) {
        final Alg.Exp logDerivative = logDerivative(arg);
        for (Alg.Exp log : logs) {
          if (isNumber(alg.div(logDerivative, logDerivative(log)))) {
            // ln(u) - r ln(v) would be a new constant
            return null;
          }
        }
        logs.add(arg);
        continue;
      }
      Group group = null;
      for (Group g : groups) {
        final Alg.Exp ratio = Simplifier.simplify(alg.div(arg, g.first));
        if (ratio.isNumber()) {
          group = g;
          group.add(((Alg.Num) ratio).value);
          break;
        }
        if (isNumber(alg.div(derivative(arg), derivative(g.first)))) {
          // exp(u) / exp(r v) would be a transcendental constant
          return null;
        }
      }
      if (group == null) {
        group = new Group(arg);
        groups.add(group);
      }
      groupByKernel.put(kernel, group);
    }

    DifferentialExtensionTower tower =
        DifferentialExtensionTower.base(x, RationalField.INSTANCE);
    for (Kernel kernel : kernels) {
      final Extension<?> extension;
      if (kernel.kind == Extension.Kind.LOG) {
        extension = logExtension(tower, kernel.arg);
      } else {
        final Group group = requireNonNull(groupByKernel.get(kernel));
        if (group.added) {
          continue;
        }
        group.added = true;
        extension = expExtension(tower, group.generator());
      }
      if (extension == null) {
        return null;
      }
      tower = tower.extend(extension);
    }
    return tower;
  }

  /** Creates the level {@code t = ln(u)}, with {@code D t = D(u) / u}. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  private static @Nullable Extension<?> logExtension(
      DifferentialExtensionTower tower, Alg.Exp u) {
    final int top = tower.top();
    final Object e = tower.toElement(u, top);
    final DiffField<Object> field = tower.field(top);
    if (e == null || field.isZero(e)) {
      return null;
    }
    final Object dt = field.divide(field.derivative(e), e);
    return new Extension(field, Extension.Kind.LOG, Poly.constant(field, dt),
        alg.ln(u), u);
  }

  /** Creates the level {@code t = exp(g)}, with {@code D t = D(g) t}. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  private static @Nullable Extension<?> expExtension(
      DifferentialExtensionTower tower, Alg.Exp g) {
    final int top = tower.top();
    final Object e = tower.toElement(g, top);
    if (e == null) {
      return null;
    }
    final DiffField<Object> field = tower.field(top);
    final Object dg = field.derivative(e);
    if (field.isZero(dg)) {
      return null;
    }
    return new Extension(field, Extension.Kind.EXP,
        Poly.of(field, field.zero(), dg), alg.exp(g), g);
  }

  private Alg.Exp derivative(Alg.Exp e) {
    return Differentiator.derivative(e, x);
  }

  private Alg.Exp logDerivative(Alg.Exp e) {
    return alg.div(derivative(e), e);
  }

  private static boolean isNumber(Alg.Exp e) {
    return Simplifier.simplify(e).isNumber();
  }

  /** Kernel {@code exp(arg)} or {@code ln(arg)}. */
  private static class Kernel {
    final Extension.Kind kind;
    final Alg.Exp arg;

    Kernel(Extension.Kind kind, Alg.Exp arg) {
      this.kind = kind;
      this.arg = arg;
    }

    @Override public int hashCode() {
      return Objects.hash(kind, arg);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Kernel
          && kind == ((Kernel) o).kind
          && arg.equals(((Kernel) o).arg);
    }
  }

  /** Exponential kernels whose arguments are rational multiples of
   * {@link #first}. */
  private static class Group {
    final Alg.Exp first;
    BigInteger lcm = BigInteger.ONE;
    boolean added;

    Group(Alg.Exp first) {
      this.first = first;
    }

    void add(Rational ratio) {
      lcm = lcm.divide(lcm.gcd(ratio.den)).multiply(ratio.den);
    }

    /** Returns the argument of the generator; every member's argument is
     * an integer multiple of it. */
    Alg.Exp generator() {
      return Simplifier.simplify(
          alg.div(first, alg.num(Rational.of(lcm))));
    }
  }
}

// End TowerBuilder.java
