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
package net.hydromatic.symbolic.poly;

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.symbolic.ast.AlgBuilder.alg;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Algorithms on univariate polynomials. */
public class Polynomials {
  /** Largest absolute value whose divisors {@link #rationalRoots} will
   * enumerate. */
  private static final BigInteger DIVISOR_LIMIT =
      BigInteger.valueOf(1_000_000_000_000L);

  /** Maximum number of candidate divisors tried by
   * {@link #quadraticFactors}, before signs. */
  private static final long QUADRATIC_SEARCH_LIMIT = 20_000L;

  private Polynomials() {}

  /** Returns the monic greatest common divisor of two polynomials; zero if
   * both are zero. */
  public static <E> Poly<E> gcd(Poly<E> a, Poly<E> b) {
    while (!b.isZero()) {
      final Poly<E> r = a.mod(b);
      a = b;
      b = r;
    }
    return a.monic();
  }

  /** Returns {@code s}, {@code t} and {@code g} such that
   * {@code s * a + t * b = g}, where {@code g} is the monic gcd of
   * {@code a} and {@code b}. */
  public static <E> ExtendedGcd<E> extendedGcd(Poly<E> a, Poly<E> b) {
    final Field<E> field = a.field;
    Poly<E> r0 = a;
    Poly<E> r1 = b;
    Poly<E> s0 = Poly.one(field);
    Poly<E> s1 = Poly.zero(field);
    Poly<E> t0 = Poly.zero(field);
    Poly<E> t1 = Poly.one(field);
    while (!r1.isZero()) {
      final Poly.DivRem<E> qr = r0.divRem(r1);
      final Poly<E> r2 = qr.remainder;
      final Poly<E> s2 = s0.minus(qr.quotient.times(s1));
      final Poly<E> t2 = t0.minus(qr.quotient.times(t1));
      r0 = r1;
      r1 = r2;
      s0 = s1;
      s1 = s2;
      t0 = t1;
      t1 = t2;
    }
    if (r0.isZero()) {
      return new ExtendedGcd<>(s0, t0, r0);
    }
    final E inv = field.reciprocal(r0.lc());
    return new ExtendedGcd<>(s0.scale(inv), t0.scale(inv), r0.scale(inv));
  }

  /** Solves {@code s * a + t * b = c} for {@code s} and {@code t} with
   * {@code deg s < deg b}; returns null if {@code gcd(a, b)} does not divide
   * {@code c}. */
  public static <E> @Nullable Diophantine<E> solveDiophantine(Poly<E> a,
      Poly<E> b, Poly<E> c) {
    final ExtendedGcd<E> eg = extendedGcd(a, b);
    if (eg.gcd.isZero()) {
      return c.isZero() ? new Diophantine<>(c, c) : null;
    }
    final Poly.DivRem<E> qr = c.divRem(eg.gcd);
    if (!qr.remainder.isZero()) {
      return null;
    }
    Poly<E> s = eg.s.times(qr.quotient);
    if (!b.isZero()) {
      s = s.mod(b);
    }
    final Poly<E> rest = c.minus(s.times(a));
    final Poly<E> t = b.isZero() ? Poly.zero(a.field) : rest.divide(b);
    return new Diophantine<>(s, t);
  }

  /** Returns the square-free factorization of a polynomial, by Yun's
   * algorithm.
   *
   * <p>Element {@code i} of the result is the monic product of the
   * irreducible factors of multiplicity {@code i + 1}; the product of
   * {@code result[i]^(i + 1)} is {@code p} up to a constant factor. A
   * constant polynomial yields an empty list. */
  public static <E> List<Poly<E>> squareFree(Poly<E> p) {
    final List<Poly<E>> factors = new ArrayList<>();
    if (p.isConstant()) {
      return factors;
    }
    final Poly<E> f = p.monic();
    final Poly<E> df = f.derivative();
    final Poly<E> a = gcd(f, df);
    Poly<E> b = f.divide(a);
    Poly<E> c = df.divide(a);
    Poly<E> d = c.minus(b.derivative());
    while (!b.isConstant()) {
      final Poly<E> ai = gcd(b, d);
      factors.add(ai);
      b = b.divide(ai);
      c = d.divide(ai);
      d = c.minus(b.derivative());
    }
    // drop trailing unit factors
    int n = factors.size();
    while (n > 0 && factors.get(n - 1).isConstant()) {
      --n;
    }
    return new ArrayList<>(factors.subList(0, n));
  }

  /** Returns the resultant of two polynomials, by the Euclidean
   * algorithm. */
  public static <E> E resultant(Poly<E> a, Poly<E> b) {
    final Field<E> field = a.field;
    if (a.isZero() || b.isZero()) {
      return field.zero();
    }
    final int m = a.degree();
    final int n = b.degree();
    if (n == 0) {
      return field.pow(b.lc(), m);
    }
    if (m == 0) {
      return field.pow(a.lc(), n);
    }
    final Poly<E> r = a.mod(b);
    if (r.isZero()) {
      return field.zero();
    }
    E res = field.multiply(field.pow(b.lc(), m - r.degree()),
        resultant(b, r));
    if (m % 2 == 1 && n % 2 == 1) {
      res = field.negate(res);
    }
    return res;
  }

  /** Returns the polynomial of least degree that takes values {@code ys} at
   * the distinct points {@code xs}, by Lagrange interpolation. */
  public static <E> Poly<E> interpolate(Field<E> field, List<E> xs,
      List<E> ys) {
    checkArgument(xs.size() == ys.size(), "%s points but %s values",
        xs.size(), ys.size());
    Poly<E> result = Poly.zero(field);
    for (int i = 0; i < xs.size(); i++) {
      Poly<E> basis = Poly.one(field);
      E den = field.one();
      for (int j = 0; j < xs.size(); j++) {
        if (i == j) {
          continue;
        }
        basis = basis.times(Poly.of(field, field.negate(xs.get(j)),
            field.one()));
        den = field.multiply(den, field.subtract(xs.get(i), xs.get(j)));
      }
      result = result.plus(basis.scale(field.divide(ys.get(i), den)));
    }
    return result;
  }

  /** Returns the distinct rational roots of a polynomial, in ascending
   * order.
   *
   * <p>Uses the rational root theorem; if the constant or leading
   * coefficient is too large to enumerate its divisors, roots other than
   * 0 are not found. */
  public static List<Rational> rationalRoots(Poly<Rational> p) {
    final TreeSet<Rational> roots = new TreeSet<>();
    if (p.isConstant()) {
      return ImmutableList.of();
    }
    // strip factors of t
    int k = 0;
    while (p.coefficient(k).isZero()) {
      ++k;
    }
    if (k > 0) {
      roots.add(Rational.ZERO);
    }
    final List<BigInteger> ints = integerCoefficients(p);
    final BigInteger a0 = ints.get(k).abs();
    final BigInteger an = ints.get(ints.size() - 1).abs();
    if (ints.size() - 1 > k
        && a0.compareTo(DIVISOR_LIMIT) <= 0
        && an.compareTo(DIVISOR_LIMIT) <= 0) {
      for (BigInteger num : divisors(a0)) {
        for (BigInteger den : divisors(an)) {
          for (int sign = 1; sign >= -1; sign -= 2) {
            final Rational r =
                Rational.of(num.multiply(BigInteger.valueOf(sign)), den);
            if (!roots.contains(r) && p.evaluate(r).isZero()) {
              roots.add(r);
            }
          }
        }
      }
    }
    return ImmutableList.copyOf(roots);
  }

  /** Returns the multiplicity of {@code r} as a root of {@code p}. */
  public static int multiplicity(Poly<Rational> p, Rational r) {
    final Poly<Rational> linear =
        Poly.of(RationalField.INSTANCE, r.negate(), Rational.ONE);
    int m = 0;
    while (!p.isZero()) {
      final Poly.DivRem<Rational> qr = p.divRem(linear);
      if (!qr.remainder.isZero()) {
        break;
      }
      p = qr.quotient;
      ++m;
    }
    return m;
  }

  /** Splits a polynomial that has no rational roots into monic quadratic
   * factors with rational coefficients; returns null if some factor is
   * irreducible of degree greater than 2, or has coefficients too large to
   * search.
   *
   * <p>By Gauss's lemma, an integer polynomial with a quadratic factor has
   * one of the form {@code c t^2 + d t + e} with integer coefficients, where
   * {@code c} divides the leading coefficient, {@code e} divides the
   * constant, and {@code c + d + e} divides the value at 1. */
  public static @Nullable List<Poly<Rational>> quadraticFactors(
      Poly<Rational> p) {
    checkArgument(p.degree() >= 2, "degree must be at least 2: %s", p);
    final List<Poly<Rational>> factors = new ArrayList<>();
    Poly<Rational> rest = p.monic();
    while (rest.degree() > 2) {
      final Poly<Rational> q = quadraticDivisor(rest);
      if (q == null) {
        return null;
      }
      factors.add(q);
      rest = rest.divide(q);
    }
    if (rest.degree() != 2) {
      return null;
    }
    factors.add(rest.monic());
    return factors;
  }

  private static @Nullable Poly<Rational> quadraticDivisor(Poly<Rational> p) {
    final List<BigInteger> ints = integerCoefficients(p);
    final BigInteger a0 = ints.get(0).abs();
    final BigInteger an = ints.get(ints.size() - 1).abs();
    BigInteger sum = BigInteger.ZERO;
    for (BigInteger i : ints) {
      sum = sum.add(i);
    }
    final BigInteger a1 = sum.abs();
    if (a0.signum() == 0 || a1.signum() == 0
        || a0.compareTo(DIVISOR_LIMIT) > 0
        || an.compareTo(DIVISOR_LIMIT) > 0
        || a1.compareTo(DIVISOR_LIMIT) > 0) {
      // a zero at 0 or 1 is a rational root
      return null;
    }
    final List<BigInteger> cs = divisors(an);
    final List<BigInteger> es = divisors(a0);
    final List<BigInteger> ts = divisors(a1);
    if ((long) cs.size() * es.size() * ts.size() > QUADRATIC_SEARCH_LIMIT) {
      return null;
    }
    final RationalField field = RationalField.INSTANCE;
    for (BigInteger c : cs) {
      for (BigInteger e0 : es) {
        for (BigInteger t0 : ts) {
          for (int signs = 0; signs < 4; signs++) {
            final BigInteger e = (signs & 1) == 0 ? e0 : e0.negate();
            final BigInteger t = (signs & 2) == 0 ? t0 : t0.negate();
            final BigInteger d = t.subtract(c).subtract(e);
            final Poly<Rational> q =
                Poly.of(field, Rational.of(e), Rational.of(d), Rational.of(c));
            if (p.mod(q).isZero()) {
              return q.monic();
            }
          }
        }
      }
    }
    return null;
  }

  /** Scales a polynomial so that its coefficients are integers. */
  private static List<BigInteger> integerCoefficients(Poly<Rational> p) {
    BigInteger lcm = BigInteger.ONE;
    for (Rational c : p.coefficients) {
      lcm = lcm.divide(lcm.gcd(c.den)).multiply(c.den);
    }
    final List<BigInteger> list = new ArrayList<>();
    for (Rational c : p.coefficients) {
      list.add(c.num.multiply(lcm.divide(c.den)));
    }
    return list;
  }

  private static List<BigInteger> divisors(BigInteger n) {
    final List<BigInteger> list = new ArrayList<>();
    final long v = n.longValueExact();
    for (long d = 1; d * d <= v; d++) {
      if (v % d == 0) {
        list.add(BigInteger.valueOf(d));
        if (d * d != v) {
          list.add(BigInteger.valueOf(v / d));
        }
      }
    }
    return list;
  }

  /** Converts an expression to a rational function of {@code x} with
   * rational coefficients; returns null if the expression contains other
   * symbols, functions, or non-integer powers. */
  public static @Nullable RationalFunction<Rational> asRationalFunction(
      Alg.Exp e, Alg.Sym x) {
    final RationalFunctionField<Rational> field =
        new RationalFunctionField<>(RationalField.INSTANCE);
    return toRational(field, e, x);
  }

  private static @Nullable RationalFunction<Rational> toRational(
      RationalFunctionField<Rational> field, Alg.Exp e, Alg.Sym x) {
    switch (e.op) {
    case NUMBER:
      return field.constant(((Alg.Num) e).value);
    case SYMBOL:
      return e.equals(x) ? field.t() : null;
    case ADD:
      RationalFunction<Rational> sum = field.zero();
      for (Alg.Exp term : ((Alg.Add) e).terms) {
        final RationalFunction<Rational> f = toRational(field, term, x);
        if (f == null) {
          return null;
        }
        sum = field.add(sum, f);
      }
      return sum;
    case MUL:
      RationalFunction<Rational> product = field.one();
      for (Alg.Exp factor : ((Alg.Mul) e).factors) {
        final RationalFunction<Rational> f = toRational(field, factor, x);
        if (f == null) {
          return null;
        }
        product = field.multiply(product, f);
      }
      return product;
    case POW:
      final Alg.Pow pow = (Alg.Pow) e;
      if (!pow.exponent.isNumber()) {
        return null;
      }
      final Rational n = ((Alg.Num) pow.exponent).value;
      if (!n.isSmallInteger()) {
        return null;
      }
      final RationalFunction<Rational> base = toRational(field, pow.base, x);
      if (base == null || base.isZero() && n.signum() < 0) {
        return null;
      }
      return field.pow(base, n.intValue());
    default:
      return null;
    }
  }

  /** Converts a polynomial to an expression in {@code var}. */
  public static Alg.Exp toExp(Poly<Rational> p, Alg.Exp var) {
    final List<Alg.Exp> terms = new ArrayList<>();
    for (int i = 0; i <= p.degree(); i++) {
      final Rational c = p.coefficient(i);
      if (!c.isZero()) {
        terms.add(alg.mul(alg.num(c), alg.pow(var, i)));
      }
    }
    return alg.add(terms);
  }

  /** Converts a rational function to an expression in {@code var}. */
  public static Alg.Exp toExp(RationalFunction<Rational> f, Alg.Exp var) {
    return alg.div(toExp(f.num, var), toExp(f.den, var));
  }

  /** Result of {@link #extendedGcd}.
   *
   * @param <E> Coefficient type */
  public static class ExtendedGcd<E> {
    public final Poly<E> s;
    public final Poly<E> t;
    public final Poly<E> gcd;

    ExtendedGcd(Poly<E> s, Poly<E> t, Poly<E> gcd) {
      this.s = s;
      this.t = t;
      this.gcd = gcd;
    }
  }

  /** Result of {@link #solveDiophantine}.
   *
   * @param <E> Coefficient type */
  public static class Diophantine<E> {
    public final Poly<E> s;
    public final Poly<E> t;

    Diophantine(Poly<E> s, Poly<E> t) {
      this.s = s;
      this.t = t;
    }
  }
}

// End Polynomials.java
