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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.symbolic.ast.AlgBuilder.alg;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.symbolic.util.Rational;

/**
 * Algebraic expressions.
 *
 * <p>Nodes are immutable and are created only by {@link AlgBuilder}, which
 * keeps every tree in canonical form. Because of canonical form, two
 * expressions that the builder considers equal are structurally equal, and
 * {@link Exp#equals} is structural.
 */
public class Alg {
  private Alg() {}

  /** Abstract base class of algebraic expressions. */
  public abstract static class Exp implements Comparable<Exp> {
    public final Op op;

    Exp(Op op) {
      this.op = requireNonNull(op);
    }

    @Override public String toString() {
      return unparse(new StringBuilder(), 0, 0).toString();
    }

    /** Accepts a shuttle, returning the rewritten expression. */
    public abstract Exp accept(Shuttle shuttle);

    /** Accepts a visitor. */
    public abstract void accept(Visitor visitor);

    abstract StringBuilder unparse(StringBuilder buf, int left, int right);

    /** Returns the immediate sub-expressions. */
    public abstract List<Exp> args();

    /** Compares two expressions of the same {@link Op}. */
    abstract int compareSameOp(Exp o);

    /**
     * Canonical total order, consistent with {@link #equals}.
     *
     * <p>Expressions are ordered first by {@link Op}, then by content.
     */
    @Override public int compareTo(Exp o) {
      if (this == o) {
        return 0;
      }
      final int c = op.compareTo(o.op);
      return c != 0 ? c : compareSameOp(o);
    }

    /** Returns whether this expression is a number. */
    public boolean isNumber() {
      return op == Op.NUMBER;
    }

    /** Returns whether this expression is a given number. */
    public boolean isNumber(Rational value) {
      return op == Op.NUMBER && ((Num) this).value.equals(value);
    }

    public boolean isZero() {
      return isNumber(Rational.ZERO);
    }

    public boolean isOne() {
      return isNumber(Rational.ONE);
    }

    /** Returns whether this is a call to a given function. */
    public boolean isCallTo(Fn fn) {
      return op == Op.APPLY && ((Apply) this).fn == fn;
    }
  }

  /** Rational number. */
  public static class Num extends Exp {
    public final Rational value;

    Num(Rational value) {
      super(Op.NUMBER);
      this.value = requireNonNull(value);
    }

    @Override public int hashCode() {
      return value.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Num
          && value.equals(((Num) o).value);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of();
    }

    @Override int compareSameOp(Exp o) {
      return value.compareTo(((Num) o).value);
    }

    @Override StringBuilder unparse(StringBuilder buf, int left, int right) {
      if (value.signum() < 0) {
        return unparseNegate(buf, alg.num(value.negate()), left, right);
      }
      if (value.isInteger()) {
        return buf.append(value.num);
      }
      if (left > Op.DIVIDE.left || right > Op.DIVIDE.right) {
        return buf.append('(').append(value).append(')');
      }
      return buf.append(value);
    }
  }

  /** Symbol, such as the variable of integration or a parameter. */
  public static class Sym extends Exp {
    public final String name;

    Sym(String name) {
      super(Op.SYMBOL);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Sym
          && name.equals(((Sym) o).name);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of();
    }

    @Override int compareSameOp(Exp o) {
      return name.compareTo(((Sym) o).name);
    }

    @Override StringBuilder unparse(StringBuilder buf, int left, int right) {
      return buf.append(name);
    }
  }

  /** Sum of two or more terms. */
  public static class Add extends Exp {
    public final ImmutableList<Exp> terms;

    Add(ImmutableList<Exp> terms) {
      super(Op.ADD);
      this.terms = requireNonNull(terms);
    }

    @Override public int hashCode() {
      return terms.hashCode() + 1;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Add
          && terms.equals(((Add) o).terms);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public List<Exp> args() {
      return terms;
    }

    @Override int compareSameOp(Exp o) {
      return compareLists(terms, ((Add) o).terms);
    }

    @Override StringBuilder unparse(StringBuilder buf, int left, int right) {
      if (left > op.left || right > op.right) {
        return unparse(buf.append('('), 0, 0).append(')');
      }
      for (int i = 0; i < terms.size(); i++) {
        final Exp term = terms.get(i);
        final int right2 = i == terms.size() - 1 ? right : op.left;
        if (i == 0) {
          term.unparse(buf, left, right2);
        } else if (isNegative(term)) {
          buf.append(Op.MINUS.padded);
          alg.negate(term).unparse(buf, Op.MINUS.right, right2);
        } else {
          buf.append(op.padded);
          term.unparse(buf, op.right, right2);
        }
      }
      return buf;
    }

    /** Creates a copy of this sum with different terms. */
    public Exp copy(List<Exp> terms) {
      return terms.equals(this.terms) ? this : alg.add(terms);
    }
  }

  /** Product of two or more factors. If there is a numeric coefficient, it
   * is the first factor. */
  public static class Mul extends Exp {
    public final ImmutableList<Exp> factors;

    Mul(ImmutableList<Exp> factors) {
      super(Op.MUL);
      this.factors = requireNonNull(factors);
    }

    @Override public int hashCode() {
      return factors.hashCode() + 2;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Mul
          && factors.equals(((Mul) o).factors);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public List<Exp> args() {
      return factors;
    }

    @Override int compareSameOp(Exp o) {
      return compareLists(factors, ((Mul) o).factors);
    }

    /** Returns the numeric coefficient, 1 if there is none. */
    public Rational coefficient() {
      final Exp first = factors.get(0);
      return first.isNumber() ? ((Num) first).value : Rational.ONE;
    }

    @Override StringBuilder unparse(StringBuilder buf, int left, int right) {
      final Exp first = factors.get(0);
      return first.isNumber()
          ? unparseProduct(buf, ((Num) first).value,
              factors.subList(1, factors.size()), left, right)
          : unparseProduct(buf, Rational.ONE, factors, left, right);
    }

    /** Creates a copy of this product with different factors. */
    public Exp copy(List<Exp> factors) {
      return factors.equals(this.factors) ? this : alg.mul(factors);
    }
  }

  /** Power. */
  public static class Pow extends Exp {
    public final Exp base;
    public final Exp exponent;

    Pow(Exp base, Exp exponent) {
      super(Op.POW);
      this.base = requireNonNull(base);
      this.exponent = requireNonNull(exponent);
    }

    @Override public int hashCode() {
      return Objects.hash(base, exponent);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Pow
          && base.equals(((Pow) o).base)
          && exponent.equals(((Pow) o).exponent);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of(base, exponent);
    }

    @Override int compareSameOp(Exp o) {
      final Pow pow = (Pow) o;
      final int c = base.compareTo(pow.base);
      return c != 0 ? c : exponent.compareTo(pow.exponent);
    }

    /** Returns whether the exponent is a negative number; such a power
     * prints as a fraction. */
    boolean isReciprocal() {
      return exponent.isNumber() && ((Num) exponent).value.signum() < 0;
    }

    @Override StringBuilder unparse(StringBuilder buf, int left, int right) {
      if (isReciprocal()) {
        return unparseProduct(buf, Rational.ONE, ImmutableList.of(this), left,
            right);
      }
      if (left > op.left || right > op.right) {
        return unparse(buf.append('('), 0, 0).append(')');
      }
      base.unparse(buf, left, op.left);
      buf.append(op.padded);
      return exponent.unparse(buf, op.right, right);
    }

    /** Creates a copy of this power with a different base and exponent. */
    public Exp copy(Exp base, Exp exponent) {
      return base == this.base && exponent == this.exponent ? this
          : alg.pow(base, exponent);
    }
  }

  /** Application of an elementary function to an argument. */
  public static class Apply extends Exp {
    public final Fn fn;
    public final Exp arg;

    Apply(Fn fn, Exp arg) {
      super(Op.APPLY);
      this.fn = requireNonNull(fn);
      this.arg = requireNonNull(arg);
    }

    @Override public int hashCode() {
      return Objects.hash(fn, arg);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Apply
          && fn == ((Apply) o).fn
          && arg.equals(((Apply) o).arg);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of(arg);
    }

    @Override int compareSameOp(Exp o) {
      final Apply apply = (Apply) o;
      final int c = fn.compareTo(apply.fn);
      return c != 0 ? c : arg.compareTo(apply.arg);
    }

    @Override StringBuilder unparse(StringBuilder buf, int left, int right) {
      if (fn == Fn.ABS) {
        return arg.unparse(buf.append('|'), 0, 0).append('|');
      }
      return arg.unparse(buf.append(fn.fnName).append('('), 0, 0)
          .append(')');
    }

    /** Creates a copy of this application with a different argument. */
    public Exp copy(Exp arg) {
      return arg == this.arg ? this : alg.apply(fn, arg);
    }
  }

  /** Unevaluated integral of an expression with respect to a symbol. */
  public static class Integral extends Exp {
    public final Exp integrand;
    public final Sym var;

    Integral(Exp integrand, Sym var) {
      super(Op.INTEGRAL);
      this.integrand = requireNonNull(integrand);
      this.var = requireNonNull(var);
    }

    @Override public int hashCode() {
      return Objects.hash(integrand, var) + 3;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Integral
          && integrand.equals(((Integral) o).integrand)
          && var.equals(((Integral) o).var);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of(integrand, var);
    }

    @Override int compareSameOp(Exp o) {
      final Integral integral = (Integral) o;
      final int c = var.compareTo(integral.var);
      return c != 0 ? c : integrand.compareTo(integral.integrand);
    }

    @Override StringBuilder unparse(StringBuilder buf, int left, int right) {
      buf.append("integral(");
      integrand.unparse(buf, 0, 0);
      return buf.append(", ").append(var.name).append(')');
    }

    /** Creates a copy of this integral with a different integrand. */
    public Exp copy(Exp integrand) {
      return integrand == this.integrand ? this
          : alg.integral(integrand, var);
    }
  }

  /** Returns whether an expression prints with a leading minus sign. */
  static boolean isNegative(Exp e) {
    switch (e.op) {
    case NUMBER:
      return ((Num) e).value.signum() < 0;
    case MUL:
      return ((Mul) e).coefficient().signum() < 0;
    default:
      return false;
    }
  }

  static int compareLists(List<Exp> list0, List<Exp> list1) {
    final int n = Math.min(list0.size(), list1.size());
    for (int i = 0; i < n; i++) {
      final int c = list0.get(i).compareTo(list1.get(i));
      if (c != 0) {
        return c;
      }
    }
    return Integer.compare(list0.size(), list1.size());
  }

  static StringBuilder unparseNegate(StringBuilder buf, Exp e, int left,
      int right) {
    if (left > Op.NEGATE.left || right > Op.NEGATE.right) {
      buf.append('(');
      unparseNegate(buf, e, 0, 0);
      return buf.append(')');
    }
    buf.append(Op.NEGATE.padded);
    return e.unparse(buf, Op.NEGATE.right, right);
  }

  /** Prints {@code coefficient * factors} as a product, moving factors with
   * negative exponents into a denominator. */
  static StringBuilder unparseProduct(StringBuilder buf, Rational coefficient,
      List<Exp> factors, int left, int right) {
    if (coefficient.signum() < 0) {
      if (left > Op.NEGATE.left || right > Op.NEGATE.right) {
        buf.append('(');
        unparseProduct(buf, coefficient, factors, 0, 0);
        return buf.append(')');
      }
      buf.append(Op.NEGATE.padded);
      return unparseProduct(buf, coefficient.negate(), factors,
          Op.NEGATE.right, right);
    }
    final List<Exp> nums = new ArrayList<>();
    final List<Exp> dens = new ArrayList<>();
    if (!coefficient.num.equals(BigInteger.ONE)) {
      nums.add(alg.num(Rational.of(coefficient.num)));
    }
    if (!coefficient.isInteger()) {
      dens.add(alg.num(Rational.of(coefficient.den)));
    }
    for (Exp factor : factors) {
      if (factor instanceof Pow && ((Pow) factor).isReciprocal()) {
        final Pow pow = (Pow) factor;
        dens.add(alg.pow(pow.base, alg.negate(pow.exponent)));
      } else {
        nums.add(factor);
      }
    }
    if (dens.isEmpty()) {
      return unparseList(buf, Op.MUL, nums, left, right);
    }
    if (left > Op.DIVIDE.left || right > Op.DIVIDE.right) {
      buf.append('(');
      unparseProduct(buf, coefficient, factors, 0, 0);
      return buf.append(')');
    }
    if (nums.isEmpty()) {
      buf.append('1');
    } else {
      unparseList(buf, Op.MUL, nums, left, Op.DIVIDE.left);
    }
    buf.append(Op.DIVIDE.padded);
    return unparseList(buf, Op.MUL, dens, Op.DIVIDE.right, right);
  }

  private static StringBuilder unparseList(StringBuilder buf, Op op,
      List<Exp> list, int left, int right) {
    if (list.size() == 1) {
      return list.get(0).unparse(buf, left, right);
    }
    if (left > op.left || right > op.right) {
      return unparseList(buf.append('('), op, list, 0, 0).append(')');
    }
    for (int i = 0; i < list.size(); i++) {
      if (i > 0) {
        buf.append(op.padded);
      }
      list.get(i).unparse(buf,
          i == 0 ? left : op.right,
          i == list.size() - 1 ? right : op.left);
    }
    return buf;
  }
}

// End Alg.java
