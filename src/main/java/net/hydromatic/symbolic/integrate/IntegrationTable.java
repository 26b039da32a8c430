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

import static net.hydromatic.symbolic.ast.AlgBuilder.alg;
import static net.hydromatic.symbolic.integrate.Pattern.apply;
import static net.hydromatic.symbolic.integrate.Pattern.constant;
import static net.hydromatic.symbolic.integrate.Pattern.linear;
import static net.hydromatic.symbolic.integrate.Pattern.number;
import static net.hydromatic.symbolic.integrate.Pattern.pow;
import static net.hydromatic.symbolic.integrate.Pattern.product;
import static net.hydromatic.symbolic.integrate.Pattern.sum;
import static net.hydromatic.symbolic.integrate.Pattern.var;
import static net.hydromatic.symbolic.integrate.Pattern.varPower;

import com.google.common.collect.ImmutableList;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import net.hydromatic.symbolic.algebra.Expressions;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.ast.Fn;
import net.hydromatic.symbolic.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Table of standard integrals.
 *
 * <p>Rules are tried in declaration order, and the first rule that matches
 * wins. Before matching, the integrand is split into a factor free of the
 * variable and a dependent factor; only the dependent factor is matched.
 *
 * <p>The table is immutable, and may be shared between threads.
 */
public class IntegrationTable {
  /** The standard table. */
  public static final IntegrationTable INSTANCE =
      new IntegrationTable(standardRules());

  public final ImmutableList<IntegrationRule> rules;

  public IntegrationTable(Iterable<IntegrationRule> rules) {
    this.rules = ImmutableList.copyOf(rules);
  }

  /** Tries the standard table; for {@link Technique#TABLE}. */
  static @Nullable IntegrationResult attempt(Integrator integrator,
      Alg.Exp integrand, Alg.Sym x, Set<Technique> active) {
    final Expressions.Split split = Expressions.split(integrand, x);
    if (split.dependent.isOne()) {
      return IntegrationResult.closedForm(alg.mul(integrand, x));
    }
    for (IntegrationRule rule : INSTANCE.rules) {
      final Alg.Exp e = rule.apply(split.dependent, x);
      if (e != null) {
        integrator.tracer().onStep(Technique.TABLE, "rule " + rule.name);
        return IntegrationResult.closedForm(alg.mul(split.constant, e));
      }
    }
    return null;
  }

  /** Returns the antiderivative of an integrand, or null if no rule
   * matches. */
  public Alg.@Nullable Exp lookup(Alg.Exp integrand, Alg.Sym x) {
    final Expressions.Split split = Expressions.split(integrand, x);
    if (split.dependent.isOne()) {
      return alg.mul(integrand, x);
    }
    for (IntegrationRule rule : rules) {
      final Alg.Exp e = rule.apply(split.dependent, x);
      if (e != null) {
        return alg.mul(split.constant, e);
      }
    }
    return null;
  }

  private static ImmutableList<IntegrationRule> standardRules() {
    final Alg.Sym x = alg.sym("x");
    final RuleListBuilder b = new RuleListBuilder();

    // Powers and logarithms of a linear expression "u"

    b.add("power", pow(linear("u"), constant("n")),
        bs -> !bs.get("n").isNumber(Rational.MINUS_ONE),
        bs -> {
          final Alg.Exp n1 = alg.add(bs.get("n"), alg.num(1));
          return alg.div(alg.pow(bs.get("u"), n1),
              alg.mul(bs.slope("u"), n1));
        },
        alg.pow(alg.add(alg.mul(alg.num(2), x), alg.num(1)), 3));
    b.add("reciprocal", pow(linear("u"), number(-1)),
        bs -> alg.div(alg.ln(alg.abs(bs.get("u"))), bs.slope("u")),
        alg.pow(alg.add(alg.mul(alg.num(3), x), alg.num(-2)), -1));
    b.add("linear", linear("u"),
        bs -> alg.div(alg.pow(bs.get("u"), 2),
            alg.mul(alg.num(2), bs.slope("u"))),
        alg.add(alg.mul(alg.num(3), x), alg.num(2)));
    b.add("exp", apply(Fn.EXP, linear("u")),
        bs -> alg.div(alg.exp(bs.get("u")), bs.slope("u")),
        alg.exp(alg.add(alg.mul(alg.num(2), x), alg.num(1))));
    b.add("constantPower", pow(constant("c"), linear("u")),
        bs -> {
          final Alg.Exp c = bs.get("c");
          return !c.isZero() && !c.isOne() && alg.isNonNegative(c);
        },
        bs -> alg.div(alg.pow(bs.get("c"), bs.get("u")),
            alg.mul(bs.slope("u"), alg.ln(bs.get("c")))),
        alg.pow(alg.num(2), alg.mul(alg.num(3), x)));
    b.add("ln", apply(Fn.LN, linear("u")),
        bs -> alg.sub(
            alg.div(alg.mul(bs.get("u"), alg.ln(bs.get("u"))),
                bs.slope("u")),
            bs.x),
        alg.ln(alg.add(alg.mul(alg.num(2), x), alg.num(3))));

    // Trigonometric and hyperbolic functions of a linear expression

    b.add("sin", apply(Fn.SIN, linear("u")),
        bs -> alg.negate(alg.div(alg.cos(bs.get("u")), bs.slope("u"))),
        alg.sin(alg.add(alg.mul(alg.num(2), x), alg.num(1))));
    b.add("cos", apply(Fn.COS, linear("u")),
        bs -> alg.div(alg.sin(bs.get("u")), bs.slope("u")),
        alg.cos(alg.mul(alg.num(3), x)));
    b.add("tan", apply(Fn.TAN, linear("u")),
        bs -> alg.negate(
            alg.div(alg.ln(alg.abs(alg.cos(bs.get("u")))), bs.slope("u"))),
        alg.tan(alg.mul(alg.num(2), x)));
    b.add("cot", apply(Fn.COT, linear("u")),
        bs -> alg.div(alg.ln(alg.abs(alg.sin(bs.get("u")))), bs.slope("u")),
        alg.cot(x));
    b.add("sec", apply(Fn.SEC, linear("u")),
        bs -> alg.div(
            alg.ln(
                alg.abs(alg.add(alg.sec(bs.get("u")), alg.tan(bs.get("u"))))),
            bs.slope("u")),
        alg.sec(x));
    b.add("csc", apply(Fn.CSC, linear("u")),
        bs -> alg.negate(
            alg.div(
                alg.ln(
                    alg.abs(
                        alg.add(alg.csc(bs.get("u")), alg.cot(bs.get("u"))))),
                bs.slope("u"))),
        alg.csc(alg.mul(alg.num(2), x)));
    b.add("secSquared", pow(apply(Fn.SEC, linear("u")), number(2)),
        bs -> alg.div(alg.tan(bs.get("u")), bs.slope("u")),
        alg.pow(alg.sec(alg.mul(alg.num(3), x)), 2));
    b.add("cscSquared", pow(apply(Fn.CSC, linear("u")), number(2)),
        bs -> alg.negate(alg.div(alg.cot(bs.get("u")), bs.slope("u"))),
        alg.pow(alg.csc(x), 2));
    b.add("secTan",
        product(apply(Fn.SEC, linear("u")), apply(Fn.TAN, linear("u"))),
        bs -> alg.div(alg.sec(bs.get("u")), bs.slope("u")),
        alg.mul(alg.sec(alg.mul(alg.num(2), x)),
            alg.tan(alg.mul(alg.num(2), x))));
    b.add("cscCot",
        product(apply(Fn.CSC, linear("u")), apply(Fn.COT, linear("u"))),
        bs -> alg.negate(alg.div(alg.csc(bs.get("u")), bs.slope("u"))),
        alg.mul(alg.csc(x), alg.cot(x)));
    b.add("sinSquared", pow(apply(Fn.SIN, linear("u")), number(2)),
        bs -> alg.sub(alg.div(bs.x, alg.num(2)),
            alg.div(alg.sin(alg.mul(alg.num(2), bs.get("u"))),
                alg.mul(alg.num(4), bs.slope("u")))),
        alg.pow(alg.sin(alg.mul(alg.num(3), x)), 2));
    b.add("cosSquared", pow(apply(Fn.COS, linear("u")), number(2)),
        bs -> alg.add(alg.div(bs.x, alg.num(2)),
            alg.div(alg.sin(alg.mul(alg.num(2), bs.get("u"))),
                alg.mul(alg.num(4), bs.slope("u")))),
        alg.pow(alg.cos(alg.add(x, alg.num(1))), 2));
    b.add("sinh", apply(Fn.SINH, linear("u")),
        bs -> alg.div(alg.cosh(bs.get("u")), bs.slope("u")),
        alg.sinh(alg.mul(alg.num(2), x)));
    b.add("cosh", apply(Fn.COSH, linear("u")),
        bs -> alg.div(alg.sinh(bs.get("u")), bs.slope("u")),
        alg.cosh(x));
    b.add("tanh", apply(Fn.TANH, linear("u")),
        bs -> alg.div(alg.ln(alg.cosh(bs.get("u"))), bs.slope("u")),
        alg.tanh(alg.mul(alg.num(3), x)));

    // Quadratics; "c" is the constant term

    b.add("inverseSumOfSquares",
        pow(sum(pow(var(), number(2)), constant("c")), number(-1)),
        bs -> isPositive(bs.get("c")),
        bs -> {
          final Alg.Exp s = alg.sqrt(bs.get("c"));
          return alg.div(alg.atan(alg.div(bs.x, s)), s);
        },
        alg.pow(alg.add(alg.pow(x, 2), alg.num(4)), -1));
    b.add("inverseDifferenceOfSquares",
        pow(sum(pow(var(), number(2)), constant("c")), number(-1)),
        bs -> isPositive(alg.negate(bs.get("c"))),
        bs -> {
          final Alg.Exp s = alg.sqrt(alg.negate(bs.get("c")));
          return alg.div(
              alg.ln(alg.abs(alg.div(alg.sub(bs.x, s), alg.add(bs.x, s)))),
              alg.mul(alg.num(2), s));
        },
        alg.pow(alg.add(alg.pow(x, 2), alg.num(-9)), -1));
    b.add("inverseSqrtDifference",
        pow(sum(constant("c"), product(number(-1), pow(var(), number(2)))),
            number(Rational.of(-1, 2))),
        bs -> isPositive(bs.get("c")),
        bs -> alg.asin(alg.div(bs.x, alg.sqrt(bs.get("c")))),
        alg.pow(alg.sub(alg.num(4), alg.pow(x, 2)), alg.num(-1, 2)));
    b.add("inverseSqrtSum",
        pow(sum(pow(var(), number(2)), constant("c")),
            number(Rational.of(-1, 2))),
        bs -> !bs.get("c").isZero(),
        bs -> alg.ln(
            alg.abs(
                alg.add(bs.x,
                    alg.sqrt(alg.add(alg.pow(bs.x, 2), bs.get("c")))))),
        alg.pow(alg.add(alg.pow(x, 2), alg.num(1)), alg.num(-1, 2)));
    b.add("sqrtDifference",
        pow(sum(constant("c"), product(number(-1), pow(var(), number(2)))),
            number(Rational.HALF)),
        bs -> isPositive(bs.get("c")),
        bs -> {
          final Alg.Exp c = bs.get("c");
          final Alg.Exp root = alg.sqrt(alg.sub(c, alg.pow(bs.x, 2)));
          return alg.add(alg.div(alg.mul(bs.x, root), alg.num(2)),
              alg.mul(alg.div(c, alg.num(2)),
                  alg.asin(alg.div(bs.x, alg.sqrt(c)))));
        },
        alg.sqrt(alg.sub(alg.num(9), alg.pow(x, 2))));

    // Inverse trigonometric functions

    b.add("asin", apply(Fn.ASIN, linear("u")),
        bs -> {
          final Alg.Exp u = bs.get("u");
          return alg.div(
              alg.add(alg.mul(u, alg.asin(u)),
                  alg.sqrt(alg.sub(alg.num(1), alg.pow(u, 2)))),
              bs.slope("u"));
        },
        alg.asin(alg.div(x, alg.num(2))));
    b.add("acos", apply(Fn.ACOS, linear("u")),
        bs -> {
          final Alg.Exp u = bs.get("u");
          return alg.div(
              alg.sub(alg.mul(u, alg.acos(u)),
                  alg.sqrt(alg.sub(alg.num(1), alg.pow(u, 2)))),
              bs.slope("u"));
        },
        alg.acos(alg.div(x, alg.num(3))));
    b.add("atan", apply(Fn.ATAN, linear("u")),
        bs -> {
          final Alg.Exp u = bs.get("u");
          return alg.div(
              alg.sub(alg.mul(u, alg.atan(u)),
                  alg.div(alg.ln(alg.add(alg.num(1), alg.pow(u, 2))),
                      alg.num(2))),
              bs.slope("u"));
        },
        alg.atan(alg.add(alg.mul(alg.num(2), x), alg.num(1))));

    // x^n ln(x)

    b.add("powerTimesLn", product(varPower("n"), apply(Fn.LN, var())),
        bs -> !bs.get("n").isNumber(Rational.MINUS_ONE),
        bs -> {
          final Alg.Exp m = alg.add(bs.get("n"), alg.num(1));
          final Alg.Exp xm = alg.pow(bs.x, m);
          return alg.sub(alg.div(alg.mul(xm, alg.ln(bs.x)), m),
              alg.div(xm, alg.pow(m, 2)));
        },
        alg.mul(alg.pow(x, 2), alg.ln(x)));
    return b.build();
  }

  /** Returns whether an expression is provably positive. */
  private static boolean isPositive(Alg.Exp e) {
    return !e.isZero() && alg.isNonNegative(e);
  }

  /** Accumulates rules. */
  private static class RuleListBuilder {
    final ImmutableList.Builder<IntegrationRule> rules =
        ImmutableList.builder();

    void add(String name, Pattern pattern,
        Function<Pattern.Bindings, Alg.Exp> template, Alg.Exp sample) {
      add(name, pattern, bs -> true, template, sample);
    }

    void add(String name, Pattern pattern,
        Predicate<Pattern.Bindings> condition,
        Function<Pattern.Bindings, Alg.Exp> template, Alg.Exp sample) {
      rules.add(
          new IntegrationRule(name, pattern, condition, template, sample));
    }

    ImmutableList<IntegrationRule> build() {
      return rules.build();
    }
  }
}

// End IntegrationTable.java
