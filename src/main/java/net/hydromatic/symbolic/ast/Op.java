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

/**
 * Sub-types of {@link Alg.Exp}, and the operators used when unparsing them.
 *
 * <p>The declaration order of the node kinds is the first key of the
 * canonical order of expressions; see {@link Alg.Exp#compareTo}.
 */
public enum Op {
  // atoms
  NUMBER,
  SYMBOL,
  APPLY,

  // compound nodes
  POW("^", 3, false),
  MUL("*", 2, true),
  ADD(" + ", 1, true),
  INTEGRAL,

  // operators that occur only when unparsing
  DIVIDE("/", 2, true),
  MINUS(" - ", 1, true),
  NEGATE("-", 4, 4);

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence. */
  public final int left;
  /** Right precedence. */
  public final int right;

  /** Creates a node kind that binds tighter than any operator, so is
   * never parenthesized. */
  Op() {
    this("", 99, 99);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }
}

// End Op.java
