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
package com.dremio.diagnostics.broadcast;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process {@link ClusterBroadcast}. Every registry sharing an instance behaves like a node of
 * the same cluster.
 *
 * <p>Payloads travel encoded, and each subscriber decodes them with its own topic's codec. The
 * last value of each topic is retained, until its TTL runs out, and replayed to later subscribers.
 * A subscriber that throws is logged and does not affect the others.
 */
public class LocalClusterBroadcast implements ClusterBroadcast {
  private static final Logger logger = LoggerFactory.getLogger(LocalClusterBroadcast.class);

  private final Executor executor;
  private final Clock clock;
  private final Map<String, List<Registration<?>>> subscribers = new ConcurrentHashMap<>();
  private final Map<String, Retained> retained = new ConcurrentHashMap<>();

  public LocalClusterBroadcast(Executor executor) {
    this(executor, Clock.systemUTC());
  }

  public LocalClusterBroadcast(Executor executor, Clock clock) {
    this.executor = Preconditions.checkNotNull(executor);
    this.clock = Preconditions.checkNotNull(clock);
  }

  @Override
  public <T> void publish(BroadcastTopic<T> topic, T value, long ttlMillis) {
    Preconditions.checkArgument(ttlMillis >= 0, "ttl must not be negative");
    final byte[] payload = topic.getCodec().encode(value);
    final Instant expiresAt = ttlMillis == 0 ? null : clock.instant().plusMillis(ttlMillis);
    retained.put(topic.getName(), new Retained(payload, expiresAt));

    final List<Registration<?>> registrations =
        subscribers.getOrDefault(topic.getName(), ImmutableList.of());
    for (Registration<?> registration : registrations) {
      dispatch(registration, payload);
    }
  }

  @Override
  public <T> BroadcastSubscription subscribe(
      BroadcastTopic<T> topic, BroadcastSubscriber<T> subscriber) {
    final Registration<T> registration = new Registration<>(topic, subscriber);
    subscribers
        .computeIfAbsent(topic.getName(), k -> new CopyOnWriteArrayList<>())
        .add(registration);

    final Retained last = retained.get(topic.getName());
    if (last != null) {
      if (last.isExpired(clock.instant())) {
        retained.remove(topic.getName(), last);
      } else {
        dispatch(registration, last.payload);
      }
    }

    return () -> {
      if (registration.active.compareAndSet(true, false)) {
        final List<Registration<?>> registrations = subscribers.get(topic.getName());
        if (registrations != null) {
          registrations.remove(registration);
        }
      }
    };
  }

  private void dispatch(Registration<?> registration, byte[] payload) {
    try {
      executor.execute(() -> registration.deliver(payload));
    } catch (RejectedExecutionException e) {
      throw new BroadcastException(
          "Unable to dispatch message on topic " + registration.topic.getName(), e);
    }
  }

  private static final class Registration<T> {
    private final BroadcastTopic<T> topic;
    private final BroadcastSubscriber<T> subscriber;
    private final AtomicBoolean active = new AtomicBoolean(true);

    private Registration(BroadcastTopic<T> topic, BroadcastSubscriber<T> subscriber) {
      this.topic = topic;
      this.subscriber = subscriber;
    }

    private void deliver(byte[] payload) {
      if (!active.get()) {
        return;
      }
      try {
        subscriber.onMessage(topic.getCodec().decode(payload));
      } catch (RuntimeException e) {
        logger.warn("Subscriber of topic {} failed to handle a message", topic.getName(), e);
      }
    }
  }

  private static final class Retained {
    private final byte[] payload;
    private final Instant expiresAt;

    private Retained(byte[] payload, Instant expiresAt) {
      this.payload = payload;
      this.expiresAt = expiresAt;
    }

    private boolean isExpired(Instant now) {
      return expiresAt != null && !now.isBefore(expiresAt);
    }
  }
}
