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

/**
 * Best-effort publish/subscribe between the nodes of a cluster.
 *
 * <p>Delivery is at least once and unordered, and a message may be lost. Receivers must not rely
 * on a broadcast for correctness; it only shortens the time until they notice a change.
 */
public interface ClusterBroadcast {

  /**
   * Publishes a value to every subscriber of the topic, including those on this node.
   *
   * @param ttlMillis how long the value stays retained for late subscribers, 0 for no expiry
   * @throws BroadcastException if the value could not be handed to the transport
   */
  <T> void publish(BroadcastTopic<T> topic, T value, long ttlMillis);

  <T> BroadcastSubscription subscribe(BroadcastTopic<T> topic, BroadcastSubscriber<T> subscriber);
}
