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

import java.util.concurrent.TimeUnit;

/**
 * Signal, set by a caller, that an integration should be abandoned.
 *
 * <p>A token is cancelled explicitly by {@link #cancel()}, or implicitly
 * when its deadline passes. It may be cancelled from any thread; the
 * integration checks it at coarse boundaries.
 */
public class CancellationToken {
  private static final long NO_DEADLINE = Long.MAX_VALUE;

  private final long deadlineNanos;
  private volatile boolean cancelled;

  private CancellationToken(long deadlineNanos) {
    this.deadlineNanos = deadlineNanos;
  }

  /** Creates a token that is cancelled only when {@link #cancel()} is
   * called. */
  public static CancellationToken create() {
    return new CancellationToken(NO_DEADLINE);
  }

  /** Creates a token that is cancelled after a given time, or when
   * {@link #cancel()} is called. */
  public static CancellationToken withTimeout(long time, TimeUnit unit) {
    return new CancellationToken(System.nanoTime() + unit.toNanos(time));
  }

  public void cancel() {
    cancelled = true;
  }

  public boolean isCancelled() {
    if (cancelled) {
      return true;
    }
    if (deadlineNanos != NO_DEADLINE
        && System.nanoTime() - deadlineNanos >= 0) {
      cancelled = true;
    }
    return cancelled;
  }

  /** Returns a token that is cancelled when either this token is cancelled
   * or a timeout expires. */
  CancellationToken orTimeout(long millis) {
    final CancellationToken parent = this;
    return new CancellationToken(System.nanoTime()
        + TimeUnit.MILLISECONDS.toNanos(millis)) {
      @Override public boolean isCancelled() {
        return parent.isCancelled() || super.isCancelled();
      }
    };
  }

  /** Throws {@link IntegrationCancelledException} if cancelled. */
  void check() {
    if (isCancelled()) {
      throw new IntegrationCancelledException();
    }
  }
}

// End CancellationToken.java
