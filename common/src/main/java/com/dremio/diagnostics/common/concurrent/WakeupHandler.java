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
package com.dremio.diagnostics.common.concurrent;

import com.google.common.base.Preconditions;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coalesces wake-up events for a background task.
 *
 * <p>At most one instance of the task runs at a time. A wake-up that arrives while the task is
 * running is not lost: the task runs once more after the current run finishes. Several wake-ups
 * that arrive during one run collapse into a single extra run.
 */
public class WakeupHandler {
  private static final Logger logger = LoggerFactory.getLogger(WakeupHandler.class);

  private final AtomicBoolean wakeup = new AtomicBoolean();
  private final AtomicBoolean running = new AtomicBoolean();

  private final String name;
  private final Runnable task;
  private final ExecutorService executor;

  public WakeupHandler(String name, ExecutorService executor, Runnable task) {
    this.name = Preconditions.checkNotNull(name, "name required");
    this.executor = Preconditions.checkNotNull(executor, "executor service required");
    this.task = Preconditions.checkNotNull(task, "task required");
  }

  public Future<?> handle(String reason) {
    logger.trace("waking up {}, reason: {}", name, reason);
    if (!wakeup.compareAndSet(false, true)) {
      // a run is already requested
      return CompletableFuture.completedFuture(null);
    }
    if (running.get()) {
      // the running loop will observe the flag
      return CompletableFuture.completedFuture(null);
    }
    return executor.submit(this::drain);
  }

  private void drain() {
    // exit only once both flags are clear, so no wake-up is missed
    while (wakeup.get()) {
      if (!running.compareAndSet(false, true)) {
        return;
      }
      try {
        wakeup.set(false);
        task.run();
      } finally {
        running.set(false);
      }
    }
  }
}
