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

import com.dremio.diagnostics.datastore.DiagnosticsRequest;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** A diagnostics request as returned by the REST API. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiagnosticsRequestInfo {
  private final long id;
  private final String fingerprint;
  private final String requestedAt;
  private final boolean completed;
  private final Long traceId;

  @JsonCreator
  public DiagnosticsRequestInfo(
      @JsonProperty("id") long id,
      @JsonProperty("fingerprint") String fingerprint,
      @JsonProperty("requestedAt") String requestedAt,
      @JsonProperty("completed") boolean completed,
      @JsonProperty("traceId") Long traceId) {
    this.id = id;
    this.fingerprint = fingerprint;
    this.requestedAt = requestedAt;
    this.completed = completed;
    this.traceId = traceId;
  }

  public static DiagnosticsRequestInfo of(DiagnosticsRequest request) {
    return new DiagnosticsRequestInfo(
        request.getId(),
        request.getFingerprint(),
        request.getRequestedAt().toString(),
        request.isCompleted(),
        request.getTraceId());
  }

  public long getId() {
    return id;
  }

  public String getFingerprint() {
    return fingerprint;
  }

  public String getRequestedAt() {
    return requestedAt;
  }

  public boolean isCompleted() {
    return completed;
  }

  public Long getTraceId() {
    return traceId;
  }
}
