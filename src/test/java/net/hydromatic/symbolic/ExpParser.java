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
package net.hydromatic.symbolic;

import static net.hydromatic.symbolic.ast.AlgBuilder.alg;

import java.math.BigInteger;
import net.hydromatic.symbolic.ast.Alg;
import net.hydromatic.symbolic.ast.Fn;
import net.hydromatic.symbolic.util.Rational;

/**
 * Parser for expressions in tests.
 *
 * <p>Grammar, loosest first: sums ({@code +}, {@code -}), products
 * ({@code *}, {@code /}), unary minus, powers ({@code ^}, right
 * associative), then atoms: integers, symbols, function calls such as
 * {@code sin(x)} or {@code sqrt(x)}, {@code |u|}, and parenthesized
 * expressions. All nodes are created by the builder, so the result is in
 * canonical form.
 */
public class ExpParser {
  private final String s;
  private int i;

  private ExpParser(String s) {
    this.s = s;
  }

  /** Parses a string. */
  public static Alg.Exp parse(String s) {
    final ExpParser parser = new ExpParser(s);
    final Alg.Exp e = parser.sum();
    parser.skipSpace();
    if (parser.i < s.length()) {
      throw parser.error("unexpected '" + s.charAt(parser.i) + "'");
    }
    return e;
  }

  private IllegalArgumentException error(String message) {
    return new IllegalArgumentException(message + " at " + i + " in '" + s
        + "'");
  }

  private void skipSpace() {
    while (i < s.length() && s.charAt(i) == ' ') {
      ++i;
    }
  }

  private boolean accept(char c) {
    skipSpace();
    if (i < s.length() && s.charAt(i) == c) {
      ++i;
      return true;
    }
    return false;
  }

  private void expect(char c) {
    if (!accept(c)) {
      throw error("expected '" + c + "'");
    }
  }

  private Alg.Exp sum() {
    Alg.Exp e = product();
    for (;;) {
      if (accept('+')) {
        e = alg.add(e, product());
      } else if (accept('-')) {
        e = alg.sub(e, product());
      } else {
        return e;
      }
    }
  }

  private Alg.Exp product() {
    Alg.Exp e = unary();
    for (;;) {
      if (accept('*')) {
        e = alg.mul(e, unary());
      } else if (accept('/')) {
        e = alg.div(e, unary());
      } else {
        return e;
      }
    }
  }

  private Alg.Exp unary() {
    if (accept('-')) {
      return alg.negate(unary());
    }
    return power();
  }

  private Alg.Exp power() {
    final Alg.Exp base = atom();
    if (accept('^')) {
      return alg.pow(base, unary());
    }
    return base;
  }

  private Alg.Exp atom() {
    skipSpace();
    if (i >= s.length()) {
      throw error("unexpected end");
    }
    final char c = s.charAt(i);
    if (accept('(')) {
      final Alg.Exp e = sum();
      expect(')');
      return e;
    }
    if (accept('|')) {
      final Alg.Exp e = sum();
      expect('|');
      return alg.abs(e);
    }
    if (Character.isDigit(c)) {
      final int start = i;
      while (i < s.length() && Character.isDigit(s.charAt(i))) {
        ++i;
      }
      return alg.num(Rational.of(new BigInteger(s.substring(start, i))));
    }
    if (Character.isLetter(c)) {
      final int start = i;
      while (i < s.length() && Character.isLetterOrDigit(s.charAt(i))) {
        ++i;
      }
      final String name = s.substring(start, i);
      if (accept('(')) {
        final Alg.Exp arg = sum();
        expect(')');
        if (name.equals("sqrt")) {
          return alg.sqrt(arg);
        }
        final Fn fn = Fn.BY_NAME.get(name);
        if (fn == null) {
          throw error("unknown function '" + name + "'");
        }
        return alg.apply(fn, arg);
      }
      return alg.sym(name);
    }
    throw error("unexpected '" + c + "'");
  }
}

// End ExpParser.java
