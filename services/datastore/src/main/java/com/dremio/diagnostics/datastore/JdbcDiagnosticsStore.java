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
package com.dremio.diagnostics.datastore;

import com.dremio.diagnostics.common.config.DiagnosticsConfig;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DiagnosticsStore} backed by two relational tables reached through a {@link DataSource}.
 *
 * <p>The data source must connect as the administrative principal that owns the tables.
 */
public class JdbcDiagnosticsStore implements DiagnosticsStore {
  private static final Logger logger = LoggerFactory.getLogger(JdbcDiagnosticsStore.class);

  public static final String REQUESTS_TABLE = "statement_diagnostics_requests";
  public static final String TRACES_TABLE = "statement_diagnostics";

  private static final Map<String, Integer> ISOLATION_LEVELS =
      ImmutableMap.of(
          "READ_COMMITTED", Connection.TRANSACTION_READ_COMMITTED,
          "REPEATABLE_READ", Connection.TRANSACTION_REPEATABLE_READ,
          "SERIALIZABLE", Connection.TRANSACTION_SERIALIZABLE);

  private static final List<String> SCHEMA =
      ImmutableList.of(
          "CREATE TABLE IF NOT EXISTS "
              + TRACES_TABLE
              + " ("
              + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
              + "statement_fingerprint VARCHAR NOT NULL, "
              + "statement VARCHAR NOT NULL, "
              + "collected_at TIMESTAMP NOT NULL, "
              + "trace CLOB, "
              + "error VARCHAR)",
          "CREATE TABLE IF NOT EXISTS "
              + REQUESTS_TABLE
              + " ("
              + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
              + "statement_fingerprint VARCHAR NOT NULL, "
              + "requested_at TIMESTAMP NOT NULL, "
              + "completed BOOLEAN DEFAULT FALSE NOT NULL, "
              + "statement_diagnostics_id BIGINT REFERENCES "
              + TRACES_TABLE
              + "(id), "
              + "pending_fingerprint VARCHAR)",
          "CREATE INDEX IF NOT EXISTS "
              + REQUESTS_TABLE
              + "_completed_idx ON "
              + REQUESTS_TABLE
              + " (completed, statement_fingerprint)",
          // set only while the request is pending, so the index holds one pending row per
          // fingerprint and any number of completed ones
          "CREATE UNIQUE INDEX IF NOT EXISTS "
              + REQUESTS_TABLE
              + "_pending_idx ON "
              + REQUESTS_TABLE
              + " (pending_fingerprint)");

  private static final String COUNT_PENDING =
      "SELECT count(1) FROM "
          + REQUESTS_TABLE
          + " WHERE completed = false AND statement_fingerprint = ?";
  private static final String INSERT_REQUEST =
      "INSERT INTO "
          + REQUESTS_TABLE
          + " (statement_fingerprint, pending_fingerprint, requested_at) VALUES (?, ?, ?)";
  private static final String CHECK_PENDING =
      "SELECT completed FROM " + REQUESTS_TABLE + " WHERE id = ? FOR UPDATE";
  private static final String INSERT_TRACE =
      "INSERT INTO "
          + TRACES_TABLE
          + " (statement_fingerprint, statement, collected_at, trace) VALUES (?, ?, ?, ?)";
  private static final String INSERT_TRACE_ERROR =
      "INSERT INTO "
          + TRACES_TABLE
          + " (statement_fingerprint, statement, collected_at, error) VALUES (?, ?, ?, ?)";
  private static final String MARK_COMPLETED =
      "UPDATE "
          + REQUESTS_TABLE
          + " SET completed = true, pending_fingerprint = NULL, statement_diagnostics_id = ?"
          + " WHERE id = ?";
  private static final String SELECT_OUTSTANDING =
      "SELECT id, statement_fingerprint, requested_at FROM "
          + REQUESTS_TABLE
          + " WHERE completed = false";
  private static final String SELECT_ALL =
      "SELECT id, statement_fingerprint, requested_at, completed, statement_diagnostics_id FROM "
          + REQUESTS_TABLE
          + " ORDER BY id DESC";
  private static final String SELECT_TRACE =
      "SELECT id, statement_fingerprint, statement, collected_at, trace, error FROM "
          + TRACES_TABLE
          + " WHERE id = ?";

  private static final String UNIQUE_VIOLATION = "23505";
  // serialization failure, deadlock, H2 lock timeout, H2 concurrent update
  private static final Set<String> RETRYABLE_STATES =
      ImmutableSet.of("40001", "40P01", "HYT00", "90131");

  static final int DEFAULT_MAX_ATTEMPTS = 10;
  static final long DEFAULT_RETRY_BASE_MILLIS = 20;

  private final DataSource dataSource;
  private final int isolationLevel;
  private final int maxAttempts;
  private final long retryBaseMillis;

  public JdbcDiagnosticsStore(DataSource dataSource, int isolationLevel) {
    this(dataSource, isolationLevel, DEFAULT_MAX_ATTEMPTS, DEFAULT_RETRY_BASE_MILLIS);
  }

  public JdbcDiagnosticsStore(
      DataSource dataSource, int isolationLevel, int maxAttempts, long retryBaseMillis) {
    this.dataSource = Preconditions.checkNotNull(dataSource, "data source required");
    Preconditions.checkArgument(
        ISOLATION_LEVELS.containsValue(isolationLevel),
        "unsupported isolation level %s",
        isolationLevel);
    Preconditions.checkArgument(maxAttempts > 0, "at least one attempt required");
    Preconditions.checkArgument(retryBaseMillis >= 0, "retry delay must not be negative");
    this.isolationLevel = isolationLevel;
    this.maxAttempts = maxAttempts;
    this.retryBaseMillis = retryBaseMillis;
  }

  /** Creates a store configured from {@link DiagnosticsConfig}, creating tables if asked to. */
  public static JdbcDiagnosticsStore create(DataSource dataSource, DiagnosticsConfig config) {
    final JdbcDiagnosticsStore store =
        new JdbcDiagnosticsStore(
            dataSource,
            parseIsolationLevel(config.getString(DiagnosticsConfig.STORE_ISOLATION)),
            config.getInt(DiagnosticsConfig.STORE_MAX_ATTEMPTS),
            config.getLong(DiagnosticsConfig.STORE_RETRY_BASE_MS));
    if (config.getBoolean(DiagnosticsConfig.STORE_CREATE_SCHEMA_BOOL)) {
      store.createSchemaIfNecessary();
    }
    return store;
  }

  static int parseIsolationLevel(String name) {
    Integer level = ISOLATION_LEVELS.get(name);
    Preconditions.checkArgument(
        level != null,
        "unknown isolation level %s, expected one of %s",
        name,
        ISOLATION_LEVELS.keySet());
    return level;
  }

  public void createSchemaIfNecessary() {
    try (Connection connection = dataSource.getConnection();
        Statement statement = connection.createStatement()) {
      for (String ddl : SCHEMA) {
        statement.execute(ddl);
      }
      logger.debug("Diagnostics tables are present");
    } catch (SQLException e) {
      throw new DatastoreException("Unable to create diagnostics tables", e);
    }
  }

  /**
   * Runs the body in a transaction, running it again when the store aborts it on a conflict with a
   * concurrent transaction, up to the configured number of attempts.
   */
  @Override
  public <T> T inTransaction(TransactionBody<T> body) {
    for (int attempt = 1; ; attempt++) {
      try {
        return runTransaction(body);
      } catch (DatastoreException e) {
        if (attempt >= maxAttempts || !isRetryable(e)) {
          throw e;
        }
        logger.debug(
            "Diagnostics store transaction aborted by a conflict, attempt {} of {}: {}",
            attempt,
            maxAttempts,
            e.getMessage());
        backoff(attempt, e);
      }
    }
  }

  @VisibleForTesting
  static boolean isRetryable(Throwable failure) {
    return Throwables.getCausalChain(failure).stream()
        .filter(SQLException.class::isInstance)
        .map(t -> ((SQLException) t).getSQLState())
        .anyMatch(RETRYABLE_STATES::contains);
  }

  private void backoff(int attempt, DatastoreException failure) {
    final long delay =
        retryBaseMillis * attempt + ThreadLocalRandom.current().nextLong(retryBaseMillis + 1);
    try {
      Thread.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      failure.addSuppressed(e);
      throw failure;
    }
  }

  private <T> T runTransaction(TransactionBody<T> body) {
    try (Connection connection = dataSource.getConnection()) {
      connection.setAutoCommit(false);
      connection.setTransactionIsolation(isolationLevel);
      try {
        final T result = body.run(new JdbcTransaction(connection));
        connection.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        rollback(connection, e);
        throw e;
      }
    } catch (SQLException e) {
      throw new DatastoreException("Diagnostics store transaction failed", e);
    }
  }

  private static void rollback(Connection connection, Exception cause) {
    try {
      connection.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  @Override
  public List<DiagnosticsRequest> findOutstandingRequests() {
    try (Connection connection = dataSource.getConnection();
        PreparedStatement statement = connection.prepareStatement(SELECT_OUTSTANDING);
        ResultSet rs = statement.executeQuery()) {
      final ImmutableList.Builder<DiagnosticsRequest> requests = ImmutableList.builder();
      while (rs.next()) {
        requests.add(
            DiagnosticsRequest.outstanding(
                rs.getLong(1), rs.getString(2), rs.getTimestamp(3).toInstant()));
      }
      return requests.build();
    } catch (SQLException e) {
      throw new DatastoreException("Unable to read outstanding diagnostics requests", e);
    }
  }

  @Override
  public List<DiagnosticsRequest> getRequests() {
    try (Connection connection = dataSource.getConnection();
        PreparedStatement statement = connection.prepareStatement(SELECT_ALL);
        ResultSet rs = statement.executeQuery()) {
      final ImmutableList.Builder<DiagnosticsRequest> requests = ImmutableList.builder();
      while (rs.next()) {
        requests.add(
            new DiagnosticsRequest(
                rs.getLong(1),
                rs.getString(2),
                rs.getTimestamp(3).toInstant(),
                rs.getBoolean(4),
                rs.getObject(5, Long.class)));
      }
      return requests.build();
    } catch (SQLException e) {
      throw new DatastoreException("Unable to list diagnostics requests", e);
    }
  }

  @Override
  public Optional<DiagnosticsTrace> getTrace(long traceId) {
    try (Connection connection = dataSource.getConnection();
        PreparedStatement statement = connection.prepareStatement(SELECT_TRACE)) {
      statement.setLong(1, traceId);
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        return Optional.of(
            new DiagnosticsTrace(
                rs.getLong(1),
                rs.getString(2),
                rs.getString(3),
                rs.getTimestamp(4).toInstant(),
                rs.getString(5),
                rs.getString(6)));
      }
    } catch (SQLException e) {
      throw new DatastoreException("Unable to read diagnostics trace " + traceId, e);
    }
  }

  /** Statements of one transaction, all on the same connection. */
  private static final class JdbcTransaction implements StoreTransaction {
    private final Connection connection;

    private JdbcTransaction(Connection connection) {
      this.connection = connection;
    }

    @Override
    public long countPendingRequests(String fingerprint) {
      try (PreparedStatement statement = connection.prepareStatement(COUNT_PENDING)) {
        statement.setString(1, fingerprint);
        try (ResultSet rs = statement.executeQuery()) {
          rs.next();
          return rs.getLong(1);
        }
      } catch (SQLException e) {
        throw new DatastoreException("Unable to check for pending requests", e);
      }
    }

    @Override
    public long insertRequest(String fingerprint, Instant requestedAt) {
      try (PreparedStatement statement =
          connection.prepareStatement(INSERT_REQUEST, Statement.RETURN_GENERATED_KEYS)) {
        statement.setString(1, fingerprint);
        statement.setString(2, fingerprint);
        statement.setTimestamp(3, Timestamp.from(requestedAt));
        statement.executeUpdate();
        return generatedId(statement);
      } catch (SQLException e) {
        if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
          throw new UniqueConstraintViolationException(
              "A pending diagnostics request already exists for " + fingerprint, e);
        }
        throw new DatastoreException("Unable to insert diagnostics request", e);
      }
    }

    @Override
    public boolean isRequestPending(long requestId) {
      try (PreparedStatement statement = connection.prepareStatement(CHECK_PENDING)) {
        statement.setLong(1, requestId);
        try (ResultSet rs = statement.executeQuery()) {
          return rs.next() && !rs.getBoolean(1);
        }
      } catch (SQLException e) {
        throw new DatastoreException("Unable to check diagnostics request " + requestId, e);
      }
    }

    @Override
    public long insertTrace(
        String fingerprint, String statement, Instant collectedAt, String trace) {
      return insertTraceRow(INSERT_TRACE, fingerprint, statement, collectedAt, trace);
    }

    @Override
    public long insertTraceError(
        String fingerprint, String statement, Instant collectedAt, String error) {
      return insertTraceRow(INSERT_TRACE_ERROR, fingerprint, statement, collectedAt, error);
    }

    private long insertTraceRow(
        String sql, String fingerprint, String stmt, Instant collectedAt, String payload) {
      try (PreparedStatement statement =
          connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
        statement.setString(1, fingerprint);
        statement.setString(2, stmt);
        statement.setTimestamp(3, Timestamp.from(collectedAt));
        statement.setString(4, payload);
        statement.executeUpdate();
        return generatedId(statement);
      } catch (SQLException e) {
        throw new DatastoreException("Unable to insert diagnostics trace", e);
      }
    }

    @Override
    public void markRequestCompleted(long requestId, long traceId) {
      try (PreparedStatement statement = connection.prepareStatement(MARK_COMPLETED)) {
        statement.setLong(1, traceId);
        statement.setLong(2, requestId);
        if (statement.executeUpdate() != 1) {
          throw new DatastoreException("Diagnostics request " + requestId + " does not exist");
        }
      } catch (SQLException e) {
        throw new DatastoreException("Unable to complete diagnostics request " + requestId, e);
      }
    }

    private static long generatedId(PreparedStatement statement) throws SQLException {
      try (ResultSet keys = statement.getGeneratedKeys()) {
        if (!keys.next()) {
          throw new DatastoreException("Store did not return a generated id");
        }
        return keys.getLong(1);
      }
    }
  }
}
