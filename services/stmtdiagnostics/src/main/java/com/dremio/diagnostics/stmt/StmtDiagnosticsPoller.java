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

import com.dremio.diagnostics.common.concurrent.CloseableSchedulerThreadPool;
import com.dremio.diagnostics.common.concurrent.WakeupHandler;
import com.dremio.diagnostics.common.config.DiagnosticsConfig;
import com.google.common.base.Preconditions;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Periodically reconciles a registry with the durable store. */
public class StmtDiagnosticsPoller implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(StmtDiagnosticsPoller.class);

  private static final String NAME = "stmt-diagnostics-poller";

  private final StmtDiagnosticsRequestRegistry registry;
  private final long intervalMillis;
  private final long initialDelayMillis;
  private final CloseableSchedulerThreadPool pool;
  private final WakeupHandler wakeupHandler;

  public StmtDiagnosticsPoller(StmtDiagnosticsRequestRegistry registry, DiagnosticsConfig config) {
    this.registry = Preconditions.checkNotNull(registry);
    this.intervalMillis = config.getLong(DiagnosticsConfig.POLL_INTERVAL_MS);
    this.initialDelayMillis = config.getLong(DiagnosticsConfig.POLL_INITIAL_DELAY_MS);
    Preconditions.checkArgument(intervalMillis > 0, "poll interval must be positive");
    this.pool =
        new CloseableSchedulerThreadPool(NAME, config.getInt(DiagnosticsConfig.POLL_THREADS));
    this.wakeupHandler = new WakeupHandler(NAME, pool, this::poll);
  }

  public void start() {
    logger.info(
        "Scheduling statement diagnostics polls every {} ms, first in {} ms",
        intervalMillis,
        initialDelayMillis);
    pool.scheduleWithFixedDelay(
        () -> wakeupHandler.handle("scheduled poll"),
        initialDelayMillis,
        intervalMillis,
        TimeUnit.MILLISECONDS);
  }

  /** Requests an immediate poll. Coalesces with a poll that is already queued. */
  public Future<?> wakeup(String reason) {
    return wakeupHandler.handle(reason);
  }

  private void poll() {
    try {
      registry.pollRequests();
    } catch (RuntimeException e) {
      logger.warn("Failed to poll for statement diagnostics requests", e);
    }
  }

  @Override
  public void close() throws InterruptedException {
    logger.info("Stopping statement diagnostics polls");
    pool.close();
  }
}
