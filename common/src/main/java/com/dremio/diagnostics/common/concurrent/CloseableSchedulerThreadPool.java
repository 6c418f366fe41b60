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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AutoCloseable {@link ScheduledThreadPoolExecutor} with daemon threads named after the pool. Tasks
 * that leak an exception are logged instead of disappearing into their future.
 */
public class CloseableSchedulerThreadPool extends ScheduledThreadPoolExecutor
    implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(CloseableSchedulerThreadPool.class);

  private static final long SHUTDOWN_WAIT_SECONDS = 5;

  private final String name;

  public CloseableSchedulerThreadPool(String name, int corePoolSize) {
    super(
        corePoolSize,
        new ThreadFactoryBuilder().setNameFormat(name + "-%d").setDaemon(true).build());
    this.name = name;
  }

  @Override
  protected void afterExecute(final Runnable r, final Throwable t) {
    super.afterExecute(r, t);
    Throwable leaked = t;
    // scheduled tasks are wrapped in futures which capture the exception
    if (leaked == null && r instanceof Future<?> && ((Future<?>) r).isDone()) {
      try {
        ((Future<?>) r).get();
      } catch (CancellationException e) {
        // cancelled on close
      } catch (ExecutionException e) {
        leaked = e.getCause();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    if (leaked != null) {
      logger.error("{}: {}.run() leaked an exception.", name, r.getClass().getName(), leaked);
    }
  }

  @Override
  public void close() throws InterruptedException {
    shutdownNow();
    if (!awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
      logger.warn("Pool {} did not terminate within {} seconds", name, SHUTDOWN_WAIT_SECONDS);
    }
  }
}
