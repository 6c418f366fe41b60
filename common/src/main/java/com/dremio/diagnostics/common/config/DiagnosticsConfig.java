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

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueFactory;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import java.util.Map.Entry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Statement diagnostics configuration, merged with and validated against the
 * stmt-diagnostics-reference.conf configuration.
 *
 * <p>Layering, from lowest to highest precedence: the reference file, the user file (either the
 * given URL or stmt-diagnostics.conf on the classpath), then system properties named after a
 * reference key.
 */
public final class DiagnosticsConfig {
  private static final Logger logger = LoggerFactory.getLogger(DiagnosticsConfig.class);

  private static final String REFERENCE_CONFIG = "stmt-diagnostics-reference.conf";
  private static final String DEFAULT_USER_CONFIG = "stmt-diagnostics.conf";

  public static final String POLL_INTERVAL_MS = "diagnostics.poll.interval_ms";
  public static final String POLL_INITIAL_DELAY_MS = "diagnostics.poll.initial_delay_ms";
  public static final String POLL_THREADS = "diagnostics.poll.threads";
  public static final String BROADCAST_TTL_MS = "diagnostics.broadcast.ttl_ms";
  public static final String STORE_ISOLATION = "diagnostics.store.isolation";
  public static final String STORE_CREATE_SCHEMA_BOOL = "diagnostics.store.create_schema";
  public static final String STORE_MAX_ATTEMPTS = "diagnostics.store.max_attempts";
  public static final String STORE_RETRY_BASE_MS = "diagnostics.store.retry_base_ms";

  private final Config unresolved;
  private final Config reference;
  private final Config config;

  private DiagnosticsConfig(Config unresolved, Config reference) {
    this.unresolved = unresolved;
    this.reference = reference;
    this.config = unresolved.withFallback(reference).resolve();
    check();
  }

  private void check() {
    final Config ref = reference.resolve();

    // make sure types are right
    config.checkValid(ref);

    // extra paths are typically typos
    List<String> invalidPaths = new ArrayList<>();
    for (Entry<String, ConfigValue> entry : config.entrySet()) {
      if (!ref.hasPath(entry.getKey())) {
        invalidPaths.add(entry.getKey());
      }
    }

    if (!invalidPaths.isEmpty()) {
      StringBuilder sb = new StringBuilder();
      sb.append("Failure reading configuration file. The following properties were invalid:\n");
      for (String s : invalidPaths) {
        sb.append("\t").append(s).append("\n");
      }
      throw new IllegalArgumentException(sb.toString());
    }
  }

  public static DiagnosticsConfig create() {
    return create(null);
  }

  public static DiagnosticsConfig create(final URL userConfigPath) {
    final ClassLoader classLoader = DiagnosticsConfig.class.getClassLoader();
    Preconditions.checkNotNull(
        classLoader.getResource(REFERENCE_CONFIG), "Unable to find the reference configuration.");
    final Config reference = ConfigFactory.parseResources(classLoader, REFERENCE_CONFIG);

    final Config userConfig;
    if (userConfigPath != null) {
      userConfig =
          ConfigFactory.parseURL(
              userConfigPath, ConfigParseOptions.defaults().setAllowMissing(false));
    } else if (classLoader.getResource(DEFAULT_USER_CONFIG) != null) {
      userConfig = ConfigFactory.parseResources(classLoader, DEFAULT_USER_CONFIG);
    } else {
      userConfig = ConfigFactory.empty();
    }

    return new DiagnosticsConfig(applySystemProperties(userConfig, reference), reference);
  }

  private static Config applySystemProperties(Config config, Config reference) {
    for (Entry<String, ConfigValue> entry : reference.entrySet()) {
      String property = System.getProperty(entry.getKey());
      if (property != null && !property.isEmpty()) {
        config = config.withValue(entry.getKey(), ConfigValueFactory.fromAnyRef(property));
        logger.info(
            "Applying provided system property to config: -D{}={}", entry.getKey(), property);
      }
    }
    return config;
  }

  public DiagnosticsConfig withValue(String path, Object value) {
    return new DiagnosticsConfig(
        unresolved.withValue(path, ConfigValueFactory.fromAnyRef(value)), reference);
  }

  public long getLong(String path) {
    return config.getLong(path);
  }

  public int getInt(String path) {
    return config.getInt(path);
  }

  public boolean getBoolean(String path) {
    return config.getBoolean(path);
  }

  public String getString(String path) {
    return config.getString(path);
  }
}
