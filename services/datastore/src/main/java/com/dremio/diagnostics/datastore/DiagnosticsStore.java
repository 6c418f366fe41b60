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

import java.util.List;
import java.util.Optional;

/**
 * Durable store of diagnostics requests and collected traces, shared by every node of the cluster.
 *
 * <p>The store is the only arbiter of races between nodes: everything that must be atomic runs
 * inside {@link #inTransaction(TransactionBody)}. Implementations execute with the store's own
 * administrative credentials, never those of the user running a query.
 *
 * <p>All methods throw {@link DatastoreException} when the store fails.
 */
public interface DiagnosticsStore {

  /**
   * Runs the body in a single transaction. The transaction commits when the body returns and rolls
   * back when it throws; the body's exception is rethrown as is. A body aborted by a conflict
   * with a concurrent transaction may be run again, so it must not have effects outside the
   * transaction.
   */
  <T> T inTransaction(TransactionBody<T> body);

  /** Snapshot of every request that is not completed, read outside of any transaction. */
  List<DiagnosticsRequest> findOutstandingRequests();

  /** All requests, completed or not, newest first. */
  List<DiagnosticsRequest> getRequests();

  Optional<DiagnosticsTrace> getTrace(long traceId);

  /**
   * Work executed inside a store transaction.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  interface TransactionBody<T> {
    T run(StoreTransaction transaction);
  }
}
