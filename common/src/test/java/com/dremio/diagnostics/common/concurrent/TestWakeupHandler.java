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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public class TestWakeupHandler {

  private final ExecutorService executor = Executors.newFixedThreadPool(2);

  @AfterEach
  public void tearDown() throws Exception {
    executor.shutdownNow();
    executor.awaitTermination(5, TimeUnit.SECONDS);
  }

  @Test
  public void testSingleWakeupRunsTaskOnce() throws Exception {
    AtomicInteger runs = new AtomicInteger();
    WakeupHandler handler = new WakeupHandler("test", executor, runs::incrementAndGet);

    handler.handle("first").get(5, TimeUnit.SECONDS);

    assertThat(runs.get()).isEqualTo(1);
  }

  @Test
  public void testWakeupsDuringRunCollapseIntoOneExtraRun() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    AtomicInteger runs = new AtomicInteger();
    WakeupHandler handler =
        new WakeupHandler(
            "test",
            executor,
            () -> {
              if (runs.incrementAndGet() == 1) {
                started.countDown();
                try {
                  release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                  Thread.currentThread().interrupt();
                }
              }
            });

    Future<?> first = handler.handle("first");
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

    // the task is blocked in its first run, these must not be lost nor run concurrently
    handler.handle("second");
    handler.handle("third");
    handler.handle("fourth");
    release.countDown();

    first.get(5, TimeUnit.SECONDS);
    assertThat(runs.get()).isEqualTo(2);
  }
}
