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
package com.dremio.diagnostics.stmt.trace;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.opentracing.mock.MockSpan;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Adapters from tracer recordings to {@link RecordedSpan}s. */
public final class RecordedSpans {

  private RecordedSpans() {}

  /**
   * Converts spans recorded by a {@code MockTracer}. The tracer reports spans in the order they
   * finished, so the result is reordered: spans whose parent was not recorded come first, then
   * everything else by start time.
   */
  public static List<RecordedSpan> fromMockSpans(List<MockSpan> spans) {
    final Set<Long> recorded = new HashSet<>();
    for (MockSpan span : spans) {
      recorded.add(span.context().spanId());
    }

    final List<MockSpan> ordered = new ArrayList<>(spans);
    ordered.sort(
        Comparator.comparing((MockSpan span) -> recorded.contains(span.parentId()))
            .thenComparingLong(MockSpan::startMicros));

    final ImmutableList.Builder<RecordedSpan> result = ImmutableList.builder();
    for (MockSpan span : ordered) {
      result.add(
          new RecordedSpan(
              span.operationName(),
              fromMicros(span.startMicros()),
              Duration.of(span.finishMicros() - span.startMicros(), ChronoUnit.MICROS),
              stringify(span.tags()),
              logs(span.logEntries()),
              span.context().spanId(),
              recorded.contains(span.parentId()) ? span.parentId() : RecordedSpan.NO_PARENT));
    }
    return result.build();
  }

  private static List<RecordedSpan.LogRecord> logs(List<MockSpan.LogEntry> entries) {
    final ImmutableList.Builder<RecordedSpan.LogRecord> logs = ImmutableList.builder();
    for (MockSpan.LogEntry entry : entries) {
      logs.add(
          new RecordedSpan.LogRecord(
              fromMicros(entry.timestampMicros()), stringify(entry.fields())));
    }
    return logs.build();
  }

  private static Map<String, String> stringify(Map<String, ?> values) {
    final ImmutableMap.Builder<String, String> result = ImmutableMap.builder();
    for (Map.Entry<String, ?> entry : values.entrySet()) {
      result.put(entry.getKey(), String.valueOf(entry.getValue()));
    }
    return result.build();
  }

  private static Instant fromMicros(long micros) {
    return Instant.EPOCH.plus(micros, ChronoUnit.MICROS);
  }
}
