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

import com.dremio.diagnostics.common.tracing.TracingUtils;
import io.opentracing.Tracer;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/** Traces calls to an underlying diagnostics store, including the statements of a transaction. */
public class TracingDiagnosticsStore implements DiagnosticsStore {

  public static final String METHOD_TAG = "method";
  public static final String TABLE_TAG = "table";
  public static final String OPERATION_NAME = "diagnostics_store_request";

  private final Tracer tracer;
  private final DiagnosticsStore delegate;

  public TracingDiagnosticsStore(Tracer tracer, DiagnosticsStore delegate) {
    this.tracer = tracer;
    this.delegate = delegate;
  }

  public static TracingDiagnosticsStore of(Tracer tracer, DiagnosticsStore delegate) {
    return new TracingDiagnosticsStore(tracer, delegate);
  }

  private <R> R trace(String methodName, String table, Supplier<R> method) {
    return TracingUtils.trace(
        method, tracer, OPERATION_NAME, METHOD_TAG, methodName, TABLE_TAG, table);
  }

  @Override
  public <T> T inTransaction(TransactionBody<T> body) {
    return trace(
        "inTransaction",
        JdbcDiagnosticsStore.REQUESTS_TABLE,
        () -> delegate.inTransaction(txn -> body.run(new TracingTransaction(txn))));
  }

  @Override
  public List<DiagnosticsRequest> findOutstandingRequests() {
    return trace(
        "findOutstandingRequests",
        JdbcDiagnosticsStore.REQUESTS_TABLE,
        delegate::findOutstandingRequests);
  }

  @Override
  public List<DiagnosticsRequest> getRequests() {
    return trace("getRequests", JdbcDiagnosticsStore.REQUESTS_TABLE, delegate::getRequests);
  }

  @Override
  public Optional<DiagnosticsTrace> getTrace(long traceId) {
    return trace("getTrace", JdbcDiagnosticsStore.TRACES_TABLE, () -> delegate.getTrace(traceId));
  }

  private final class TracingTransaction implements StoreTransaction {
    private final StoreTransaction txn;

    private TracingTransaction(StoreTransaction txn) {
      this.txn = txn;
    }

    @Override
    public long countPendingRequests(String fingerprint) {
      return trace(
          "countPendingRequests",
          JdbcDiagnosticsStore.REQUESTS_TABLE,
          () -> txn.countPendingRequests(fingerprint));
    }

    @Override
    public long insertRequest(String fingerprint, Instant requestedAt) {
      return trace(
          "insertRequest",
          JdbcDiagnosticsStore.REQUESTS_TABLE,
          () -> txn.insertRequest(fingerprint, requestedAt));
    }

    @Override
    public boolean isRequestPending(long requestId) {
      return trace(
          "isRequestPending",
          JdbcDiagnosticsStore.REQUESTS_TABLE,
          () -> txn.isRequestPending(requestId));
    }

    @Override
    public long insertTrace(
        String fingerprint, String statement, Instant collectedAt, String trace) {
      return trace(
          "insertTrace",
          JdbcDiagnosticsStore.TRACES_TABLE,
          () -> txn.insertTrace(fingerprint, statement, collectedAt, trace));
    }

    @Override
    public long insertTraceError(
        String fingerprint, String statement, Instant collectedAt, String error) {
      return trace(
          "insertTraceError",
          JdbcDiagnosticsStore.TRACES_TABLE,
          () -> txn.insertTraceError(fingerprint, statement, collectedAt, error));
    }

    @Override
    public void markRequestCompleted(long requestId, long traceId) {
      trace(
          "markRequestCompleted",
          JdbcDiagnosticsStore.REQUESTS_TABLE,
          () -> {
            txn.markRequestCompleted(requestId, traceId);
            return null;
          });
    }
  }
}
