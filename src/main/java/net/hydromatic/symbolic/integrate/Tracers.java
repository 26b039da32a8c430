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

import static java.util.Objects.requireNonNull;

import java.io.PrintWriter;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.symbolic.ast.Alg;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that writes each event, one per line, to a
   * writer. */
  public static Tracer printTracer(PrintWriter pw) {
    return new PrintTracer(pw);
  }

  /** Returns a tracer that performs the given action when a technique
   * succeeds, then calls the underlying tracer. */
  public static Tracer withOnSuccess(Tracer tracer,
      BiConsumer<Technique, IntegrationResult> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onSuccess(Technique technique,
          Alg.Exp integrand, IntegrationResult result) {
        consumer.accept(technique, result);
        super.onSuccess(technique, integrand, result);
      }
    };
  }

  /** Returns a tracer that performs the given action on each attempt,
   * then calls the underlying tracer. */
  public static Tracer withOnAttempt(Tracer tracer,
      Consumer<Technique> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onAttempt(Technique technique, Alg.Exp integrand,
          int depth) {
        consumer.accept(technique);
        super.onAttempt(technique, integrand, depth);
      }
    };
  }

  /** Returns a tracer that performs the given action on each step message,
   * then calls the underlying tracer. */
  public static Tracer withOnStep(Tracer tracer, Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onStep(Technique technique, String message) {
        consumer.accept(message);
        super.onStep(technique, message);
      }
    };
  }

  public static Tracer withOnBudgetExhausted(Tracer tracer,
      Consumer<Alg.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onBudgetExhausted(Alg.Exp integrand, int depth) {
        consumer.accept(integrand);
        super.onBudgetExhausted(integrand, depth);
      }
    };
  }

  public static Tracer withOnException(Tracer tracer,
      Consumer<RuntimeException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onException(RuntimeException e) {
        consumer.accept(e);
        super.onException(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onAttempt(Technique technique, Alg.Exp integrand,
        int depth) {
    }

    @Override public void onSuccess(Technique technique, Alg.Exp integrand,
        IntegrationResult result) {
    }

    @Override public void onStep(Technique technique, String message) {
    }

    @Override public void onBudgetExhausted(Alg.Exp integrand, int depth) {
    }

    @Override public void onException(RuntimeException e) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  public static class DelegatingTracer implements Tracer {
    private final Tracer tracer;

    protected DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override public void onAttempt(Technique technique, Alg.Exp integrand,
        int depth) {
      tracer.onAttempt(technique, integrand, depth);
    }

    @Override public void onSuccess(Technique technique, Alg.Exp integrand,
        IntegrationResult result) {
      tracer.onSuccess(technique, integrand, result);
    }

    @Override public void onStep(Technique technique, String message) {
      tracer.onStep(technique, message);
    }

    @Override public void onBudgetExhausted(Alg.Exp integrand, int depth) {
      tracer.onBudgetExhausted(integrand, depth);
    }

    @Override public void onException(RuntimeException e) {
      tracer.onException(e);
    }
  }

  /** Tracer that prints events. */
  private static class PrintTracer implements Tracer {
    private final PrintWriter pw;

    PrintTracer(PrintWriter pw) {
      this.pw = requireNonNull(pw);
    }

    @Override public void onAttempt(Technique technique, Alg.Exp integrand,
        int depth) {
      pw.println("attempt " + technique.camelName + " at depth " + depth
          + ": " + integrand);
      pw.flush();
    }

    @Override public void onSuccess(Technique technique, Alg.Exp integrand,
        IntegrationResult result) {
      pw.println("success " + technique.camelName + ": " + integrand
          + " => " + result);
      pw.flush();
    }

    @Override public void onStep(Technique technique, String message) {
      pw.println("  " + technique.camelName + ": " + message);
      pw.flush();
    }

    @Override public void onBudgetExhausted(Alg.Exp integrand, int depth) {
      pw.println("budget exhausted at depth " + depth + ": " + integrand);
      pw.flush();
    }

    @Override public void onException(RuntimeException e) {
      pw.println("exception: " + e);
      pw.flush();
    }
  }
}

// End Tracers.java
