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

import com.dremio.diagnostics.datastore.DiagnosticsRequest;
import com.dremio.diagnostics.datastore.DiagnosticsStore;
import com.dremio.diagnostics.datastore.DiagnosticsTrace;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/** Store that forwards to another, counting reads of outstanding requests. */
class ForwardingDiagnosticsStore implements DiagnosticsStore {
  private final DiagnosticsStore delegate;
  private final AtomicInteger outstandingReads = new AtomicInteger();

  ForwardingDiagnosticsStore(DiagnosticsStore delegate) {
    this.delegate = delegate;
  }

  int getOutstandingReads() {
    return outstandingReads.get();
  }

  @Override
  public <T> T inTransaction(TransactionBody<T> body) {
    return delegate.inTransaction(body);
  }

  @Override
  public List<DiagnosticsRequest> findOutstandingRequests() {
    outstandingReads.incrementAndGet();
    return delegate.findOutstandingRequests();
  }

  @Override
  public List<DiagnosticsRequest> getRequests() {
    return delegate.getRequests();
  }

  @Override
  public Optional<DiagnosticsTrace> getTrace(long traceId) {
    return delegate.getTrace(traceId);
  }
}
