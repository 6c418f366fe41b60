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

import org.junit.jupiter.api.Test;

/** Tests for {@link BroadcastCodecs}. */
public class TestBroadcastCodecs {

  @Test
  public void testLongIsLittleEndian() {
    assertThat(BroadcastCodecs.LITTLE_ENDIAN_LONG.encode(0x0102L))
        .containsExactly(0x02, 0x01, 0, 0, 0, 0, 0, 0);
  }

  @Test
  public void testDecodeLong() {
    byte[] bytes = {(byte) 0xff, 0, 0, 0, 0, 0, 0, 0};
    assertThat(BroadcastCodecs.LITTLE_ENDIAN_LONG.decode(bytes)).isEqualTo(255L);
    assertThat(BroadcastCodecs.LITTLE_ENDIAN_LONG.encode(-1L))
        .containsOnly((byte) 0xff)
        .hasSize(8);
  }

  @Test
  public void testDecodeRejectsWrongLength() {
    assertThatThrownBy(() -> BroadcastCodecs.LITTLE_ENDIAN_LONG.decode(new byte[] {1, 2, 3}))
        .isInstanceOf(BroadcastException.class)
        .hasMessageContaining("expected 8 bytes, got 3");
  }
}
