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

import net.hydromatic.symbolic.ast.Alg;

/** Called on various events during integration.
 *
 * <p>A tracer observes; it never changes the result. */
public interface Tracer {
  /** Called before a technique is tried on an integrand. */
  void onAttempt(Technique technique, Alg.Exp integrand, int depth);

  /** Called when a technique produces a result that is accepted. */
  void onSuccess(Technique technique, Alg.Exp integrand,
      IntegrationResult result);

  /** Called on a major sub-step of a technique, such as the substitution
   * chosen or the differential field built. */
  void onStep(Technique technique, String message);

  /** Called when a dispatch is refused because the recursion budget is
   * spent. */
  void onBudgetExhausted(Alg.Exp integrand, int depth);

  /** Called with an unexpected exception, just before the call returns an
   * unevaluated integral. */
  void onException(RuntimeException e);
}

// End Tracer.java
