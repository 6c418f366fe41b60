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
package com.dremio.diagnostics.stmt.rest;

import com.dremio.diagnostics.datastore.DiagnosticsTrace;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** A collected trace, or the reason it is missing. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiagnosticsTraceInfo {
  private final long id;
  private final String fingerprint;
  private final String statement;
  private final String collectedAt;
  private final String trace;
  private final String error;

  @JsonCreator
  public DiagnosticsTraceInfo(
      @JsonProperty("id") long id,
      @JsonProperty("fingerprint") String fingerprint,
      @JsonProperty("statement") String statement,
      @JsonProperty("collectedAt") String collectedAt,
      @JsonProperty("trace") String trace,
      @JsonProperty("error") String error) {
    this.id = id;
    this.fingerprint = fingerprint;
    this.statement = statement;
    this.collectedAt = collectedAt;
    this.trace = trace;
    this.error = error;
  }

  public static DiagnosticsTraceInfo of(DiagnosticsTrace trace) {
    return new DiagnosticsTraceInfo(
        trace.getId(),
        trace.getFingerprint(),
        trace.getStatement(),
        trace.getCollectedAt().toString(),
        trace.getTrace(),
        trace.getError());
  }

  public long getId() {
    return id;
  }

  public String getFingerprint() {
    return fingerprint;
  }

  public String getStatement() {
    return statement;
  }

  public String getCollectedAt() {
    return collectedAt;
  }

  /** JSON span tree. */
  public String getTrace() {
    return trace;
  }

  public String getError() {
    return error;
  }
}
