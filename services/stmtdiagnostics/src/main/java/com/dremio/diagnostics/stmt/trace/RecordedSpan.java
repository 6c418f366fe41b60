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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** One span of a statement execution's recording, as handed over by the tracer. */
public final class RecordedSpan {

  /** Parent id of a span that has no parent. */
  public static final long NO_PARENT = 0;

  private final String operation;
  private final Instant startTime;
  private final Duration duration;
  private final Map<String, String> tags;
  private final List<LogRecord> logs;
  private final long spanId;
  private final long parentId;

  public RecordedSpan(
      String operation,
      Instant startTime,
      Duration duration,
      Map<String, String> tags,
      List<LogRecord> logs,
      long spanId,
      long parentId) {
    this.operation = Preconditions.checkNotNull(operation, "operation required");
    this.startTime = Preconditions.checkNotNull(startTime, "start time required");
    this.duration = Preconditions.checkNotNull(duration, "duration required");
    this.tags = ImmutableMap.copyOf(tags);
    this.logs = ImmutableList.copyOf(logs);
    this.spanId = spanId;
    this.parentId = parentId;
  }

  public String getOperation() {
    return operation;
  }

  public Instant getStartTime() {
    return startTime;
  }

  public Duration getDuration() {
    return duration;
  }

  public Map<String, String> getTags() {
    return tags;
  }

  public List<LogRecord> getLogs() {
    return logs;
  }

  public long getSpanId() {
    return spanId;
  }

  public long getParentId() {
    return parentId;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("operation", operation)
        .add("spanId", spanId)
        .add("parentId", parentId)
        .toString();
  }

  /** A timestamped set of fields logged on a span. */
  public static final class LogRecord {
    private final Instant time;
    private final Map<String, String> fields;

    public LogRecord(Instant time, Map<String, String> fields) {
      this.time = Preconditions.checkNotNull(time);
      this.fields = ImmutableMap.copyOf(fields);
    }

    public Instant getTime() {
      return time;
    }

    public Map<String, String> getFields() {
      return fields;
    }
  }
}
