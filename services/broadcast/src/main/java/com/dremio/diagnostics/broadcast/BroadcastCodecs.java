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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/** Codecs for common payload types. */
public final class BroadcastCodecs {

  /** A signed 64-bit integer as exactly 8 little-endian bytes. */
  public static final BroadcastCodec<Long> LITTLE_ENDIAN_LONG =
      new BroadcastCodec<Long>() {
        @Override
        public byte[] encode(Long value) {
          return ByteBuffer.allocate(Long.BYTES)
              .order(ByteOrder.LITTLE_ENDIAN)
              .putLong(value)
              .array();
        }

        @Override
        public Long decode(byte[] bytes) {
          if (bytes == null || bytes.length != Long.BYTES) {
            throw new BroadcastException(
                String.format(
                    "expected %d bytes, got %d", Long.BYTES, bytes == null ? 0 : bytes.length));
          }
          return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).getLong();
        }

        @Override
        public String toString() {
          return "LITTLE_ENDIAN_LONG";
        }
      };

  private BroadcastCodecs() {}
}
