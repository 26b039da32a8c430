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
import static net.hydromatic.symbolic.algebra.Expressions.freeOf;
import static net.hydromatic.symbolic.ast.AlgBuilder.alg;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.symbolic.algebra.Differentiator;
import net.hydromatic.symbolic.algebra.Expressions;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.ast.Fn;
import net.hydromatic.symbolic.ast.Op;
import net.hydromatic.symbolic.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Pattern that matches an integrand, binding named wildcards.
 *
 * <p>Patterns are matched structurally against canonical expressions. A
 * wildcard that occurs twice must bind to equal expressions both times.
 */
public abstract class Pattern {
  private Pattern() {}

  /** Matches an expression, returning the extended bindings, or null. */
  abstract @Nullable Bindings match(Alg.Exp e, Bindings bindings);

  /** Matches the variable of integration. */
  public static Pattern var() {
    return VarPattern.INSTANCE;
  }

  /** Matches an expression free of the variable, binding it to
   * {@code name}. */
  public static Pattern constant(String name) {
    return new ConstantPattern(name);
  }

  /** Matches an exact number. */
  public static Pattern number(Rational value) {
    return new NumberPattern(value);
  }

  public static Pattern number(long value) {
    return number(Rational.of(value));
  }

  /** Matches {@code a * x + b}, with {@code a} non-zero, binding the whole
   * expression to {@code name}; see {@link Bindings#slope}. */
  public static Pattern linear(String name) {
    return new LinearPattern(name);
  }

  /** Matches {@code x} or {@code x^n} with {@code n} free of the variable,
   * binding {@code n} to {@code name}. */
  public static Pattern varPower(String name) {
    return new VarPowerPattern(name);
  }

  /** Matches a function application. */
  public static Pattern apply(Fn fn, Pattern arg) {
    return new ApplyPattern(fn, arg);
  }

  /** Matches a power. */
  public static Pattern pow(Pattern base, Pattern exponent) {
    return new PowPattern(base, exponent);
  }

  /** Matches a sum of exactly two terms, in either order. */
  public static Pattern sum(Pattern p0, Pattern p1) {
    return new PairPattern(Op.ADD, p0, p1);
  }

  /** Matches a product of exactly two factors, in either order. */
  public static Pattern product(Pattern p0, Pattern p1) {
    return new PairPattern(Op.MUL, p0, p1);
  }

  /** Assignment of expressions to wildcard names. Immutable. */
  public static class Bindings {
    /** Variable of integration. */
    public final Alg.Sym x;
    private final ImmutableMap<String, Alg.Exp> map;

    private Bindings(Alg.Sym x, ImmutableMap<String, Alg.Exp> map) {
      this.x = requireNonNull(x);
      this.map = requireNonNull(map);
    }

    /** Creates empty bindings for a given variable. */
    public static Bindings of(Alg.Sym x) {
      return new Bindings(x, ImmutableMap.of());
    }

    @Override public String toString() {
      return map.toString();
    }

    /** Returns the expression bound to a name; throws if unbound. */
    public Alg.Exp get(String name) {
      final Alg.Exp e = map.get(name);
      if (e == null) {
        throw new IllegalArgumentException("unbound: " + name);
      }
      return e;
    }

    /** Returns the number bound to a name, or null if the expression bound
     * to it is not a number. */
    public @Nullable Rational number(String name) {
      final Alg.Exp e = get(name);
      return e.isNumber() ? ((Alg.Num) e).value : null;
    }

    /** Returns the derivative of the linear expression bound to a name,
     * that is, {@code a} in {@code a * x + b}. */
    public Alg.Exp slope(String name) {
      return Differentiator.derivative(get(name), x);
    }

    /** Returns bindings with an additional name, or null if the name is
     * already bound to a different expression. */
    @Nullable Bindings with(String name, Alg.Exp e) {
      final Alg.Exp e0 = map.get(name);
      if (e0 != null) {
        return e0.equals(e) ? this : null;
      }
      final Map<String, Alg.Exp> map2 = new LinkedHashMap<>(map);
      map2.put(name, e);
      return new Bindings(x, ImmutableMap.copyOf(map2));
    }
  }

  /** Pattern that matches the variable. */
  private static class VarPattern extends Pattern {
    static final VarPattern INSTANCE = new VarPattern();

    @Override @Nullable Bindings match(Alg.Exp e, Bindings bindings) {
      return e.equals(bindings.x) ? bindings : null;
    }
  }

  /** Pattern that matches any expression free of the variable. */
  private static class ConstantPattern extends Pattern {
    final String name;

    ConstantPattern(String name) {
      this.name = requireNonNull(name);
    }

    @Override @Nullable Bindings match(Alg.Exp e, Bindings bindings) {
      return freeOf(e, bindings.x) ? bindings.with(name, e) : null;
    }
  }

  /** Pattern that matches a given number. */
  private static class NumberPattern extends Pattern {
    final Rational value;

    NumberPattern(Rational value) {
      this.value = requireNonNull(value);
    }

    @Override @Nullable Bindings match(Alg.Exp e, Bindings bindings) {
      return e.isNumber(value) ? bindings : null;
    }
  }

  /** Pattern that matches a linear expression. */
  private static class LinearPattern extends Pattern {
    final String name;

    LinearPattern(String name) {
      this.name = requireNonNull(name);
    }

    @Override @Nullable Bindings match(Alg.Exp e, Bindings bindings) {
      return Expressions.linear(e, bindings.x) != null
          ? bindings.with(name, e)
          : null;
    }
  }

  /** Pattern that matches a power of the variable. */
  private static class VarPowerPattern extends Pattern {
    final String name;

    VarPowerPattern(String name) {
      this.name = requireNonNull(name);
    }

    @Override @Nullable Bindings match(Alg.Exp e, Bindings bindings) {
      if (e.equals(bindings.x)) {
        return bindings.with(name, alg.num(1));
      }
      if (e.op == Op.POW) {
        final Alg.Pow pow = (Alg.Pow) e;
        if (pow.base.equals(bindings.x) && freeOf(pow.exponent, bindings.x)) {
          return bindings.with(name, pow.exponent);
        }
      }
      return null;
    }
  }

  /** Pattern that matches a function application. */
  private static class ApplyPattern extends Pattern {
    final Fn fn;
    final Pattern arg;

    ApplyPattern(Fn fn, Pattern arg) {
      this.fn = requireNonNull(fn);
      this.arg = requireNonNull(arg);
    }

    @Override @Nullable Bindings match(Alg.Exp e, Bindings bindings) {
      return e.isCallTo(fn)
          ? arg.match(((Alg.Apply) e).arg, bindings)
          : null;
    }
  }

  /** Pattern that matches a power. */
  private static class PowPattern extends Pattern {
    final Pattern base;
    final Pattern exponent;

    PowPattern(Pattern base, Pattern exponent) {
      this.base = requireNonNull(base);
      this.exponent = requireNonNull(exponent);
    }

    @Override @Nullable Bindings match(Alg.Exp e, Bindings bindings) {
      if (e.op != Op.POW) {
        return null;
      }
      final Alg.Pow pow = (Alg.Pow) e;
      final Bindings b = base.match(pow.base, bindings);
      return b == null ? null : exponent.match(pow.exponent, b);
    }
  }

  /** Pattern that matches a commutative operator with two operands. */
  private static class PairPattern extends Pattern {
    final Op op;
    final Pattern p0;
    final Pattern p1;

    PairPattern(Op op, Pattern p0, Pattern p1) {
      this.op = requireNonNull(op);
      this.p0 = requireNonNull(p0);
      this.p1 = requireNonNull(p1);
    }

    @Override @Nullable Bindings match(Alg.Exp e, Bindings bindings) {
      if (e.op != op) {
        return null;
      }
      final List<Alg.Exp> args = e.args();
      if (args.size() != 2) {
        return null;
      }
      final Bindings b = match2(args.get(0), args.get(1), bindings);
      return b != null ? b : match2(args.get(1), args.get(0), bindings);
    }

    private @Nullable Bindings match2(Alg.Exp e0, Alg.Exp e1,
        Bindings bindings) {
      final Bindings b = p0.match(e0, bindings);
      return b == null ? null : p1.match(e1, b);
    }
  }
}

// End Pattern.java
