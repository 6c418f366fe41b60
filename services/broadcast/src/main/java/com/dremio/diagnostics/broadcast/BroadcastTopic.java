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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * A named channel and the codec of its payloads. Topics are matched on the exact name.
 *
 * @param <T> payload type
 */
public final class BroadcastTopic<T> {
  private final String name;
  private final BroadcastCodec<T> codec;

  private BroadcastTopic(String name, BroadcastCodec<T> codec) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "topic name required");
    this.name = name;
    this.codec = Preconditions.checkNotNull(codec, "codec required");
  }

  public static <T> BroadcastTopic<T> of(String name, BroadcastCodec<T> codec) {
    return new BroadcastTopic<>(name, codec);
  }

  public String getName() {
    return name;
  }

  public BroadcastCodec<T> getCodec() {
    return codec;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("name", name).add("codec", codec).toString();
  }
}
