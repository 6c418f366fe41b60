/*
 * Copyright (C) 2017-2019 Dremio Corporation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.dremio.diagnostics.common.tracing;

import com.google.common.base.Preconditions;
import io.opentracing.Scope;
import io.opentracing.Span;
import io.opentracing.Tracer;
import io.opentracing.noop.NoopSpan;
import io.opentracing.noop.NoopSpanBuilder;
import io.opentracing.tag.Tags;
import java.util.function.Supplier;

/** Common functions for tracing. */
public final class TracingUtils {

  private TracingUtils() {}

  /**
   * Creates a builder for a child of the active span.
   *
   * @param tracer current tracer
   * @param spanName the desired name of the child span
   * @param tags an even length list of tags on the span.
   * @return A noop builder if there is no traced active span. Otherwise, a real span builder.
   */
  public static Tracer.SpanBuilder childSpanBuilder(
      Tracer tracer, String spanName, String... tags) {
    Preconditions.checkArgument(tags.length % 2 == 0);
    Span parent = tracer.activeSpan();
    if (parent == null || parent.equals(NoopSpan.INSTANCE)) {
      return NoopSpanBuilder.INSTANCE;
    }

    Tracer.SpanBuilder builder = tracer.buildSpan(spanName);
    for (int i = 0; i < tags.length; i += 2) {
      builder.withTag(tags[i], tags[i + 1]);
    }
    return builder;
  }

  /**
   * Runs the work inside an active child span. Failures are tagged on the span and rethrown.
   *
   * @param work some work that returns R
   * @param tracer the tracer
   * @param operation operation name
   * @param tags an even length list of tags.
   * @param <R> return type
   * @return work.get()
   */
  public static <R> R trace(Supplier<R> work, Tracer tracer, String operation, String... tags) {
    Span span = childSpanBuilder(tracer, operation, tags).start();
    try (Scope ignored = tracer.activateSpan(span)) {
      return work.get();
    } catch (RuntimeException e) {
      Tags.ERROR.set(span, true);
      span.log(e.toString());
      throw e;
    } finally {
      span.finish();
    }
  }

  /** Runnable flavour of {@link #trace(Supplier, Tracer, String, String...)}. */
  public static void trace(Runnable work, Tracer tracer, String operation, String... tags) {
    trace(
        () -> {
          work.run();
          return null;
        },
        tracer,
        operation,
        tags);
  }
}
