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
package com.dremio.diagnostics.common.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URL;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public class TestDiagnosticsConfig {

  @AfterEach
  public void clearProperties() {
    System.clearProperty(DiagnosticsConfig.POLL_INTERVAL_MS);
  }

  @Test
  public void testReferenceDefaults() {
    DiagnosticsConfig config = DiagnosticsConfig.create();

    assertThat(config.getLong(DiagnosticsConfig.POLL_INTERVAL_MS)).isEqualTo(10_000L);
    assertThat(config.getInt(DiagnosticsConfig.POLL_THREADS)).isEqualTo(1);
    assertThat(config.getLong(DiagnosticsConfig.BROADCAST_TTL_MS)).isEqualTo(0L);
    assertThat(config.getString(DiagnosticsConfig.STORE_ISOLATION)).isEqualTo("SERIALIZABLE");
    assertThat(config.getBoolean(DiagnosticsConfig.STORE_CREATE_SCHEMA_BOOL)).isTrue();
    assertThat(config.getInt(DiagnosticsConfig.STORE_MAX_ATTEMPTS)).isEqualTo(10);
    assertThat(config.getLong(DiagnosticsConfig.STORE_RETRY_BASE_MS)).isEqualTo(20L);
  }

  @Test
  public void testFileOverride() {
    DiagnosticsConfig config =
        DiagnosticsConfig.create(getClass().getResource("/test-stmt-diagnostics.conf"));

    assertThat(config.getLong(DiagnosticsConfig.POLL_INTERVAL_MS)).isEqualTo(250L);
    assertThat(config.getString(DiagnosticsConfig.STORE_ISOLATION)).isEqualTo("READ_COMMITTED");
    // not in the user file
    assertThat(config.getInt(DiagnosticsConfig.POLL_THREADS)).isEqualTo(1);
  }

  @Test
  public void testSystemPropertyOverridesFile() {
    System.setProperty(DiagnosticsConfig.POLL_INTERVAL_MS, "42");

    DiagnosticsConfig config =
        DiagnosticsConfig.create(getClass().getResource("/test-stmt-diagnostics.conf"));

    assertThat(config.getLong(DiagnosticsConfig.POLL_INTERVAL_MS)).isEqualTo(42L);
  }

  @Test
  public void testUnknownKeyRejected() {
    URL typo = getClass().getResource("/test-stmt-diagnostics-typo.conf");

    assertThatThrownBy(() -> DiagnosticsConfig.create(typo))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("diagnostics.poll.intervall_ms");
  }

  @Test
  public void testWithValue() {
    DiagnosticsConfig config =
        DiagnosticsConfig.create().withValue(DiagnosticsConfig.POLL_THREADS, 3);

    assertThat(config.getInt(DiagnosticsConfig.POLL_THREADS)).isEqualTo(3);
  }
}
