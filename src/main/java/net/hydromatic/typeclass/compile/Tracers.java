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
package net.hydromatic.typeclass.compile;

import static java.util.Objects.requireNonNull;

import java.io.PrintWriter;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.typeclass.decl.Constraint;
import net.hydromatic.typeclass.decl.InstanceDecl;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that writes a line to a writer for each event. */
  public static Tracer printTracer(PrintWriter w) {
    return new PrintTracer(w);
  }

  /**
   * Returns a tracer that performs the given action on each candidate
   * instance, then calls the underlying tracer.
   */
  public static Tracer withOnCandidate(
      Tracer tracer, BiConsumer<InstanceDecl, MatchResult> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCandidate(
          Constraint constraint, InstanceDecl instance, MatchResult result) {
        consumer.accept(instance, result);
        super.onCandidate(constraint, instance, result);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action when a chain stops on an
   * ambiguous instance, then calls the underlying tracer.
   */
  public static Tracer withOnChainStop(
      Tracer tracer, Consumer<InstanceDecl> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onChainStop(Constraint constraint, InstanceDecl instance) {
        consumer.accept(instance);
        super.onChainStop(constraint, instance);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each resolved
   * instance, then calls the underlying tracer.
   */
  public static Tracer withOnResolved(
      Tracer tracer, Consumer<InstanceDecl> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onResolved(Constraint constraint, InstanceDecl instance) {
        consumer.accept(instance);
        super.onResolved(constraint, instance);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each constraint
   * discharged by given evidence, then calls the underlying tracer.
   */
  public static Tracer withOnDischarge(
      Tracer tracer, BiConsumer<Constraint, List<String>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onDischarge(
          Constraint constraint, Constraint given, List<String> path) {
        consumer.accept(given, path);
        super.onDischarge(constraint, given, path);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each load-time
   * rejection, then calls the underlying tracer.
   */
  public static Tracer withOnReject(
      Tracer tracer, Consumer<LoadException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onReject(LoadException e) {
        consumer.accept(e);
        super.onReject(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onCandidate(
        Constraint constraint, InstanceDecl instance, MatchResult result) {}

    @Override
    public void onChainStop(Constraint constraint, InstanceDecl instance) {}

    @Override
    public void onResolved(Constraint constraint, InstanceDecl instance) {}

    @Override
    public void onDischarge(
        Constraint constraint, Constraint given, List<String> path) {}

    @Override
    public void onReject(LoadException e) {}
  }

  /** Tracer that writes to a given {@link PrintWriter}. */
  private static class PrintTracer implements Tracer {
    private final PrintWriter w;

    PrintTracer(PrintWriter w) {
      this.w = requireNonNull(w);
    }

    private void flush(StringBuilder b) {
      w.println(b);
      w.flush();
    }

    @Override
    public void onCandidate(
        Constraint constraint, InstanceDecl instance, MatchResult result) {
      flush(
          new StringBuilder("candidate ")
              .append(instance.name)
              .append(" for ")
              .append(constraint)
              .append(": ")
              .append(result));
    }

    @Override
    public void onChainStop(Constraint constraint, InstanceDecl instance) {
      flush(
          new StringBuilder("stop ")
              .append(instance.chainName)
              .append(" at ")
              .append(instance.name)
              .append(" for ")
              .append(constraint));
    }

    @Override
    public void onResolved(Constraint constraint, InstanceDecl instance) {
      flush(
          new StringBuilder("resolved ")
              .append(constraint)
              .append(" to ")
              .append(instance.name));
    }

    @Override
    public void onDischarge(
        Constraint constraint, Constraint given, List<String> path) {
      flush(
          new StringBuilder("discharged ")
              .append(constraint)
              .append(" by given ")
              .append(given)
              .append(" via ")
              .append(String.join(" => ", path)));
    }

    @Override
    public void onReject(LoadException e) {
      flush(new StringBuilder("reject ").append(e.getMessage()));
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override
    public void onCandidate(
        Constraint constraint, InstanceDecl instance, MatchResult result) {
      tracer.onCandidate(constraint, instance, result);
    }

    @Override
    public void onChainStop(Constraint constraint, InstanceDecl instance) {
      tracer.onChainStop(constraint, instance);
    }

    @Override
    public void onResolved(Constraint constraint, InstanceDecl instance) {
      tracer.onResolved(constraint, instance);
    }

    @Override
    public void onDischarge(
        Constraint constraint, Constraint given, List<String> path) {
      tracer.onDischarge(constraint, given, path);
    }

    @Override
    public void onReject(LoadException e) {
      tracer.onReject(e);
    }
  }
}

// End Tracers.java
