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

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Visits and transforms algebraic expressions.
 *
 * <p>Nodes are rebuilt bottom-up through {@link AlgBuilder}, so the result
 * is in canonical form even if a replacement makes an identity applicable
 * (for example, replacing {@code u} by {@code exp(x) + 1} in {@code ln|u|}
 * gives {@code ln(exp(x) + 1)}).
 */
public class Shuttle {

  /** Returns a shuttle that replaces sub-expressions that are equal to keys
   * of the map by the corresponding values. */
  public static Shuttle replacer(Map<Alg.Exp, Alg.Exp> map) {
    final ImmutableMap<Alg.Exp, Alg.Exp> map2 = ImmutableMap.copyOf(map);
    return new Shuttle() {
      @Override public Alg.Exp rewrite(Alg.Exp e) {
        final Alg.Exp e2 = map2.get(e);
        return e2 != null ? e2 : e.accept(this);
      }
    };
  }

  /** Rewrites an expression. Override this method to intercept a node before
   * its children are visited. */
  public Alg.Exp rewrite(Alg.Exp e) {
    return e.accept(this);
  }

  protected List<Alg.Exp> rewriteList(List<Alg.Exp> list) {
    final List<Alg.Exp> list2 = new ArrayList<>(list.size());
    for (Alg.Exp e : list) {
      list2.add(rewrite(e));
    }
    return list2;
  }

  protected Alg.Exp visit(Alg.Num num) {
    return num;
  }

  protected Alg.Exp visit(Alg.Sym sym) {
    return sym;
  }

  protected Alg.Exp visit(Alg.Add add) {
    return add.copy(rewriteList(add.terms));
  }

  protected Alg.Exp visit(Alg.Mul mul) {
    return mul.copy(rewriteList(mul.factors));
  }

  protected Alg.Exp visit(Alg.Pow pow) {
    return pow.copy(rewrite(pow.base), rewrite(pow.exponent));
  }

  protected Alg.Exp visit(Alg.Apply apply) {
    return apply.copy(rewrite(apply.arg));
  }

  protected Alg.Exp visit(Alg.Integral integral) {
    // the variable of integration is bound, so it is not rewritten
    return integral.copy(rewrite(integral.integrand));
  }
}

// End Shuttle.java
