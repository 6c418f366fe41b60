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

/**
 * A row of statement_diagnostics. Holds either the serialized trace of a statement execution or the
 * error that prevented the trace from being serialized, never both.
 */
public final class DiagnosticsTrace {

  private final long id;
  private final String fingerprint;
  private final String statement;
  private final Instant collectedAt;
  private final String trace;
  private final String error;

  public DiagnosticsTrace(
      long id,
      String fingerprint,
      String statement,
      Instant collectedAt,
      String trace,
      String error) {
    Preconditions.checkArgument(
        (trace == null) != (error == null), "exactly one of trace and error must be set");
    this.id = id;
    this.fingerprint = fingerprint;
    this.statement = statement;
    this.collectedAt = collectedAt;
    this.trace = trace;
    this.error = error;
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

  public Instant getCollectedAt() {
    return collectedAt;
  }

  /** Serialized span tree, null if collection failed. */
  public String getTrace() {
    return trace;
  }

  /** Why no trace was recorded, null on success. */
  public String getError() {
    return error;
  }

  public boolean hasError() {
    return error != null;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("fingerprint", fingerprint)
        .add("collectedAt", collectedAt)
        .add("error", error)
        .toString();
  }
}
