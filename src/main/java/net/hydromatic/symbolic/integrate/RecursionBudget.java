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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Limits the work done by one top-level integration.
 *
 * <p>A budget is created for each call to {@link Integrator#integrate} and
 * shared by every nested dispatch in that call; it is never shared between
 * calls. It bounds the depth of nesting and the total number of dispatches,
 * and carries the caller's cancellation token.
 */
public class RecursionBudget {
  private final int maxDepth;
  private final int maxDispatches;
  private final CancellationToken token;
  private int depth;
  private int dispatches;

  public RecursionBudget(int maxDepth, int maxDispatches,
      CancellationToken token) {
    checkArgument(maxDepth > 0, "maxDepth must be positive");
    checkArgument(maxDispatches > 0, "maxDispatches must be positive");
    this.maxDepth = maxDepth;
    this.maxDispatches = maxDispatches;
    this.token = requireNonNull(token);
  }

  /** Tries to enter a dispatch. Returns false, and changes nothing, if the
   * depth or dispatch limit would be exceeded; otherwise the caller must call
   * {@link #exit()} when the dispatch completes. */
  @CanIgnoreReturnValue
  public boolean enter() {
    if (depth >= maxDepth || dispatches >= maxDispatches) {
      return false;
    }
    ++depth;
    ++dispatches;
    return true;
  }

  public void exit() {
    checkState(depth > 0, "exit without enter");
    --depth;
  }

  /** Returns the current depth; 1 inside the top-level dispatch. */
  public int depth() {
    return depth;
  }

  /** Returns whether another nested dispatch could be entered. */
  public boolean hasRemaining() {
    return depth < maxDepth && dispatches < maxDispatches;
  }

  public int dispatches() {
    return dispatches;
  }

  /** Throws {@link IntegrationCancelledException} if the call has been
   * cancelled. */
  public void checkCancelled() {
    token.check();
  }
}

// End RecursionBudget.java
