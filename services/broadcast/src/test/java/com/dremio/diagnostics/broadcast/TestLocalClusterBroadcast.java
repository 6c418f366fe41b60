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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.google.common.util.concurrent.MoreExecutors;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for {@link LocalClusterBroadcast}. */
public class TestLocalClusterBroadcast {

  private static final BroadcastTopic<Long> REQUESTS =
      BroadcastTopic.of("diagnostics-request", BroadcastCodecs.LITTLE_ENDIAN_LONG);
  private static final BroadcastTopic<Long> SIBLING =
      BroadcastTopic.of("diagnostics-request-sibling", BroadcastCodecs.LITTLE_ENDIAN_LONG);
  private static final BroadcastTopic<String> RAW =
      BroadcastTopic.of(
          "diagnostics-request",
          new BroadcastCodec<String>() {
            @Override
            public byte[] encode(String value) {
              return value.getBytes(StandardCharsets.UTF_8);
            }

            @Override
            public String decode(byte[] bytes) {
              return new String(bytes, StandardCharsets.UTF_8);
            }
          });

  private final Instant start = Instant.parse("2024-01-15T10:00:00Z");
  private Clock clock;
  private LocalClusterBroadcast broadcast;

  @BeforeEach
  public void setup() {
    clock = mock(Clock.class);
    when(clock.instant()).thenReturn(start);
    broadcast = new LocalClusterBroadcast(MoreExecutors.directExecutor(), clock);
  }

  @Test
  public void testDeliversToEverySubscriberOfTopic() {
    List<Long> first = new ArrayList<>();
    List<Long> second = new ArrayList<>();
    broadcast.subscribe(REQUESTS, first::add);
    broadcast.subscribe(REQUESTS, second::add);

    broadcast.publish(REQUESTS, 7L, 0);

    assertThat(first).containsExactly(7L);
    assertThat(second).containsExactly(7L);
  }

  @Test
  public void testTopicsMatchOnExactName() {
    List<Long> received = new ArrayList<>();
    broadcast.subscribe(REQUESTS, received::add);

    broadcast.publish(SIBLING, 9L, 0);

    assertThat(received).isEmpty();
  }

  @Test
  public void testSubscriberDecodesWithItsOwnCodec() {
    List<String> received = new ArrayList<>();
    broadcast.subscribe(RAW, received::add);

    broadcast.publish(RAW, "hello", 0);

    assertThat(received).containsExactly("hello");
  }

  @Test
  public void testFailingSubscriberDoesNotAffectOthers() {
    List<Long> received = new ArrayList<>();
    broadcast.subscribe(
        REQUESTS,
        id -> {
          throw new IllegalStateException("cannot handle " + id);
        });
    broadcast.subscribe(REQUESTS, received::add);

    broadcast.publish(REQUESTS, 3L, 0);

    assertThat(received).containsExactly(3L);
  }

  @Test
  public void testUndecodablePayloadIsIsolated() {
    List<Long> received = new ArrayList<>();
    broadcast.subscribe(REQUESTS, received::add);

    // three bytes are not a valid long
    broadcast.publish(RAW, "abc", 0);

    assertThat(received).isEmpty();
  }

  @Test
  public void testRetainedValueReplayedToLateSubscriber() {
    broadcast.publish(REQUESTS, 1L, 0);
    broadcast.publish(REQUESTS, 2L, 0);

    List<Long> received = new ArrayList<>();
    broadcast.subscribe(REQUESTS, received::add);

    assertThat(received).containsExactly(2L);
  }

  @Test
  public void testExpiredValueIsNotReplayed() {
    broadcast.publish(REQUESTS, 1L, 1_000);
    when(clock.instant()).thenReturn(start.plusMillis(1_000));

    List<Long> received = new ArrayList<>();
    broadcast.subscribe(REQUESTS, received::add);

    assertThat(received).isEmpty();
  }

  @Test
  public void testUnexpiredValueIsReplayed() {
    broadcast.publish(REQUESTS, 1L, 1_000);
    when(clock.instant()).thenReturn(start.plusMillis(999));

    List<Long> received = new ArrayList<>();
    broadcast.subscribe(REQUESTS, received::add);

    assertThat(received).containsExactly(1L);
  }

  @Test
  public void testClosedSubscriptionStopsDelivery() {
    List<Long> received = new ArrayList<>();
    BroadcastSubscription subscription = broadcast.subscribe(REQUESTS, received::add);

    broadcast.publish(REQUESTS, 1L, 0);
    subscription.close();
    subscription.close();
    broadcast.publish(REQUESTS, 2L, 0);

    assertThat(received).containsExactly(1L);
  }

  @Test
  public void testRejectedDispatchFailsPublish() {
    LocalClusterBroadcast rejecting =
        new LocalClusterBroadcast(
            command -> {
              throw new RejectedExecutionException("shut down");
            });
    rejecting.subscribe(REQUESTS, id -> {});

    assertThatThrownBy(() -> rejecting.publish(REQUESTS, 1L, 0))
        .isInstanceOf(BroadcastException.class)
        .hasCauseInstanceOf(RejectedExecutionException.class);
  }

  @Test
  public void testNegativeTtlRejected() {
    assertThatThrownBy(() -> broadcast.publish(REQUESTS, 1L, -1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
