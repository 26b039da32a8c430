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

/** Visits algebraic expressions. */
public class Visitor {

  /** For use as a method reference. */
  protected void accept(Alg.Exp e) {
    e.accept(this);
  }

  protected void visit(Alg.Num num) {}

  protected void visit(Alg.Sym sym) {}

  protected void visit(Alg.Add add) {
    add.terms.forEach(this::accept);
  }

  protected void visit(Alg.Mul mul) {
    mul.factors.forEach(this::accept);
  }

  protected void visit(Alg.Pow pow) {
    pow.base.accept(this);
    pow.exponent.accept(this);
  }

  protected void visit(Alg.Apply apply) {
    apply.arg.accept(this);
  }

  protected void visit(Alg.Integral integral) {
    integral.integrand.accept(this);
  }
}

// End Visitor.java
