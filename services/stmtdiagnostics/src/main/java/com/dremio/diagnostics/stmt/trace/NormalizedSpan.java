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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;

/** A span and its descendants, in the form stored in the trace column. */
@JsonPropertyOrder({"operation", "startTime", "duration", "tags", "logs", "children"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class NormalizedSpan {

  private final String operation;
  private final String startTime;
  private final String duration;
  private final Map<String, String> tags;
  private final List<Log> logs;
  private final List<NormalizedSpan> children;

  NormalizedSpan(RecordedSpan span, List<NormalizedSpan> children) {
    this.operation = span.getOperation();
    this.startTime = span.getStartTime().toString();
    this.duration = span.getDuration().toString();
    this.tags = span.getTags();
    final ImmutableList.Builder<Log> logs = ImmutableList.builder();
    for (RecordedSpan.LogRecord record : span.getLogs()) {
      logs.add(new Log(record.getTime().toString(), record.getFields()));
    }
    this.logs = logs.build();
    this.children = ImmutableList.copyOf(children);
  }

  @JsonProperty
  public String getOperation() {
    return operation;
  }

  /** ISO-8601 instant. */
  @JsonProperty
  public String getStartTime() {
    return startTime;
  }

  /** ISO-8601 duration. */
  @JsonProperty
  public String getDuration() {
    return duration;
  }

  @JsonProperty
  public Map<String, String> getTags() {
    return tags;
  }

  @JsonProperty
  public List<Log> getLogs() {
    return logs;
  }

  @JsonProperty
  public List<NormalizedSpan> getChildren() {
    return children;
  }

  /** A serialized span log. */
  @JsonPropertyOrder({"time", "fields"})
  public static final class Log {
    private final String time;
    private final Map<String, String> fields;

    Log(String time, Map<String, String> fields) {
      this.time = time;
      this.fields = ImmutableMap.copyOf(fields);
    }

    @JsonProperty
    public String getTime() {
      return time;
    }

    @JsonProperty
    public Map<String, String> getFields() {
      return fields;
    }
  }
}
