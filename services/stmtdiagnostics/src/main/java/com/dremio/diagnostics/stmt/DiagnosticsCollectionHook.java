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
package com.dremio.diagnostics.stmt;

import com.dremio.diagnostics.stmt.trace.RecordedSpan;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handed to the executor of a statement that was claimed for diagnostics. Once the statement has
 * run, {@link #complete(List)} must be called exactly once with its recording.
 */
public final class DiagnosticsCollectionHook {

  private final StmtDiagnosticsRequestRegistry registry;
  private final long requestId;
  private final String fingerprint;
  private final String statement;
  private final AtomicBoolean used = new AtomicBoolean();

  DiagnosticsCollectionHook(
      StmtDiagnosticsRequestRegistry registry,
      long requestId,
      String fingerprint,
      String statement) {
    this.registry = registry;
    this.requestId = requestId;
    this.fingerprint = fingerprint;
    this.statement = statement;
  }

  public long getRequestId() {
    return requestId;
  }

  public String getFingerprint() {
    return fingerprint;
  }

  public String getStatement() {
    return statement;
  }

  /**
   * Records the trace. Store failures are logged, never thrown.
   *
   * @throws IllegalStateException if the hook was already used
   */
  public void complete(List<RecordedSpan> recording) {
    Preconditions.checkState(
        used.compareAndSet(false, true),
        "diagnostics for request %s were already collected",
        requestId);
    registry.completeClaimed(this, recording);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("requestId", requestId)
        .add("fingerprint", fingerprint)
        .toString();
  }
}
