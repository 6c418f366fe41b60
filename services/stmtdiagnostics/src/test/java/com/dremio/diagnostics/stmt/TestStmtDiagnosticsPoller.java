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

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

import com.dremio.diagnostics.common.config.DiagnosticsConfig;
import com.dremio.diagnostics.datastore.DatastoreException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Tests for {@link StmtDiagnosticsPoller}. */
@ExtendWith(MockitoExtension.class)
public class TestStmtDiagnosticsPoller {

  @Mock private StmtDiagnosticsRequestRegistry registry;

  private static DiagnosticsConfig config(long intervalMillis, long initialDelayMillis) {
    return DiagnosticsConfig.create()
        .withValue(DiagnosticsConfig.POLL_INTERVAL_MS, intervalMillis)
        .withValue(DiagnosticsConfig.POLL_INITIAL_DELAY_MS, initialDelayMillis);
  }

  @Test
  public void testPollsRepeatedly() throws Exception {
    try (StmtDiagnosticsPoller poller = new StmtDiagnosticsPoller(registry, config(20, 0))) {
      poller.start();

      verify(registry, timeout(10_000).atLeast(3)).pollRequests();
    }
  }

  @Test
  public void testSurvivesFailingPoll() throws Exception {
    doThrow(new DatastoreException("store is down")).doNothing().when(registry).pollRequests();

    try (StmtDiagnosticsPoller poller = new StmtDiagnosticsPoller(registry, config(20, 0))) {
      poller.start();

      verify(registry, timeout(10_000).atLeast(2)).pollRequests();
    }
  }

  @Test
  public void testWakeupPollsImmediately() throws Exception {
    doNothing().when(registry).pollRequests();

    try (StmtDiagnosticsPoller poller =
        new StmtDiagnosticsPoller(registry, config(TimeUnit.HOURS.toMillis(1), 0))) {
      poller.wakeup("request inserted").get(10, TimeUnit.SECONDS);

      verify(registry).pollRequests();
    }
  }

  @Test
  public void testRejectsNonPositiveInterval() {
    assertThatThrownBy(() -> new StmtDiagnosticsPoller(registry, config(0, 0)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
