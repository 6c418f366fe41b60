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

import static org.assertj.core.api.Assertions.assertThat;

import com.dremio.diagnostics.broadcast.LocalClusterBroadcast;
import com.dremio.diagnostics.common.config.DiagnosticsConfig;
import com.dremio.diagnostics.datastore.DiagnosticsRequest;
import com.google.common.util.concurrent.MoreExecutors;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

/** An insert landing between the snapshot read of a poll and its epoch check. */
public class TestStmtDiagnosticsRequestRegistryPollRace {

  @Test
  public void testPollRetriesWhenInsertRacesSnapshot() {
    final AtomicLong racedId = new AtomicLong();
    final StmtDiagnosticsRequestRegistry[] registry = new StmtDiagnosticsRequestRegistry[1];
    final ForwardingDiagnosticsStore store =
        new ForwardingDiagnosticsStore(InMemoryStores.newStore()) {
          @Override
          public List<DiagnosticsRequest> findOutstandingRequests() {
            final List<DiagnosticsRequest> snapshot = super.findOutstandingRequests();
            if (getOutstandingReads() == 1) {
              racedId.set(registry[0].insertRequest("SELECT _"));
            }
            return snapshot;
          }
        };
    registry[0] =
        new StmtDiagnosticsRequestRegistry(
            store,
            new LocalClusterBroadcast(MoreExecutors.directExecutor()),
            DiagnosticsConfig.create());

    registry[0].pollRequests();

    assertThat(store.getOutstandingReads()).isEqualTo(2);
    assertThat(registry[0].pendingRequests()).containsOnlyKeys(racedId.get());
  }
}
