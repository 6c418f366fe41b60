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
package com.dremio.diagnostics.datastore;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import java.time.Instant;
import java.util.Objects;

/**
 * A row of statement_diagnostics_requests: a request to collect diagnostics for the next execution
 * of a statement fingerprint.
 */
public final class DiagnosticsRequest {

  private final long id;
  private final String fingerprint;
  private final Instant requestedAt;
  private final boolean completed;
  private final Long traceId;

  public DiagnosticsRequest(
      long id, String fingerprint, Instant requestedAt, boolean completed, Long traceId) {
    Preconditions.checkArgument(id != 0, "request id must not be zero");
    Preconditions.checkArgument(
        traceId == null || completed, "only a completed request can reference a trace");
    this.id = id;
    this.fingerprint = Preconditions.checkNotNull(fingerprint);
    this.requestedAt = requestedAt;
    this.completed = completed;
    this.traceId = traceId;
  }

  /** A request that is still waiting for a matching execution. */
  public static DiagnosticsRequest outstanding(long id, String fingerprint, Instant requestedAt) {
    return new DiagnosticsRequest(id, fingerprint, requestedAt, false, null);
  }

  public long getId() {
    return id;
  }

  public String getFingerprint() {
    return fingerprint;
  }

  public Instant getRequestedAt() {
    return requestedAt;
  }

  public boolean isCompleted() {
    return completed;
  }

  /** Id of the collected trace, null until the request is completed. */
  public Long getTraceId() {
    return traceId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DiagnosticsRequest)) {
      return false;
    }
    DiagnosticsRequest that = (DiagnosticsRequest) o;
    return id == that.id
        && completed == that.completed
        && fingerprint.equals(that.fingerprint)
        && Objects.equals(requestedAt, that.requestedAt)
        && Objects.equals(traceId, that.traceId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, fingerprint, requestedAt, completed, traceId);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("fingerprint", fingerprint)
        .add("requestedAt", requestedAt)
        .add("completed", completed)
        .add("traceId", traceId)
        .toString();
  }
}
