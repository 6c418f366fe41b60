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
import java.util.concurrent.locks.ReentrantLock;

/**
 * Wraps a {@link ReentrantLock} so that it can be held for the duration of a try-with-resources
 * block:
 *
 * <pre>
 * try (AutoCloseableLock ignored = lock.open()) {
 *   ...
 * }
 * </pre>
 *
 * The lock is released on every exit path of the block, exceptional ones included.
 */
public class AutoCloseableLock implements AutoCloseable {

  private final ReentrantLock lock;

  public AutoCloseableLock(ReentrantLock lock) {
    this.lock = Preconditions.checkNotNull(lock, "lock required");
  }

  public static AutoCloseableLock ofReentrant() {
    return new AutoCloseableLock(new ReentrantLock());
  }

  public AutoCloseableLock open() {
    lock.lock();
    return this;
  }

  /** Used by callers to assert that a "locked" helper is invoked with the lock held. */
  public boolean isHeldByCurrentThread() {
    return lock.isHeldByCurrentThread();
  }

  @Override
  public void close() {
    lock.unlock();
  }
}
