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

import java.time.Instant;

/** Reads and writes available inside {@link DiagnosticsStore#inTransaction}. */
public interface StoreTransaction {

  /** Number of requests for exactly this fingerprint that are not completed. */
  long countPendingRequests(String fingerprint);

  /**
   * Inserts a request that is not completed. At most one request per fingerprint may be pending,
   * across every transaction of the store.
   *
   * @return the store-assigned id, never zero
   * @throws UniqueConstraintViolationException if a request for the fingerprint is already pending
   */
  long insertRequest(String fingerprint, Instant requestedAt);

  /**
   * Whether the request exists and is not completed. The request row stays locked until the
   * transaction ends so that concurrent completions serialize on it.
   */
  boolean isRequestPending(long requestId);

  /** @return id of the new statement_diagnostics row */
  long insertTrace(String fingerprint, String statement, Instant collectedAt, String trace);

  /** Records a collection attempt that produced no usable trace. */
  long insertTraceError(String fingerprint, String statement, Instant collectedAt, String error);

  void markRequestCompleted(long requestId, long traceId);
}
