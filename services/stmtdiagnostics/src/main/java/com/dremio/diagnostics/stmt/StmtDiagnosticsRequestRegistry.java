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
package com.dremio.diagnostics.stmt;

import com.dremio.diagnostics.broadcast.BroadcastCodecs;
import com.dremio.diagnostics.broadcast.BroadcastSubscription;
import com.dremio.diagnostics.broadcast.BroadcastTopic;
import com.dremio.diagnostics.broadcast.ClusterBroadcast;
import com.dremio.diagnostics.common.concurrent.AutoCloseableLock;
import com.dremio.diagnostics.common.config.DiagnosticsConfig;
import com.dremio.diagnostics.common.exceptions.UserException;
import com.dremio.diagnostics.datastore.DiagnosticsRequest;
import com.dremio.diagnostics.datastore.DiagnosticsStore;
import com.dremio.diagnostics.datastore.UniqueConstraintViolationException;
import com.dremio.diagnostics.stmt.trace.RecordedSpan;
import com.dremio.diagnostics.stmt.trace.TraceSerializationException;
import com.dremio.diagnostics.stmt.trace.TraceSerializer;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-node cache of the outstanding statement diagnostics requests, and the protocols that keep it
 * in step with the durable store.
 *
 * <p>The cache holds {@code pending} requests, which the next matching execution on this node may
 * claim, and {@code ongoing} ones, which were claimed here and are being collected. It is lossy:
 * the store decides every race between nodes, and {@link #pollRequests()} reconciles the cache
 * with it. A request announced over the broadcast topic is picked up without waiting for the next
 * poll.
 *
 * <p>The mutex only guards in-memory state. It is never held across store or broadcast calls.
 */
public class StmtDiagnosticsRequestRegistry implements StmtDiagnosticsRequester, AutoCloseable {
  private static final Logger logger =
      LoggerFactory.getLogger(StmtDiagnosticsRequestRegistry.class);

  /** Carries the id of each new request. */
  public static final BroadcastTopic<Long> REQUEST_TOPIC =
      BroadcastTopic.of("stmt-diagnostics-request", BroadcastCodecs.LITTLE_ENDIAN_LONG);

  private final DiagnosticsStore store;
  private final ClusterBroadcast broadcast;
  private final StatementFingerprinter fingerprinter;
  private final TraceSerializer serializer;
  private final Clock clock;
  private final long broadcastTtlMillis;

  private final AutoCloseableLock lock = AutoCloseableLock.ofReentrant();
  // guarded by lock
  private final Map<Long, String> pending = new HashMap<>();
  private final Set<Long> ongoing = new HashSet<>();
  private long epoch;

  private volatile BroadcastSubscription subscription;

  public StmtDiagnosticsRequestRegistry(
      DiagnosticsStore store, ClusterBroadcast broadcast, DiagnosticsConfig config) {
    this(
        store,
        broadcast,
        new LiteralMaskingFingerprinter(),
        new TraceSerializer(),
        Clock.systemUTC(),
        config.getLong(DiagnosticsConfig.BROADCAST_TTL_MS));
  }

  public StmtDiagnosticsRequestRegistry(
      DiagnosticsStore store,
      ClusterBroadcast broadcast,
      StatementFingerprinter fingerprinter,
      TraceSerializer serializer,
      Clock clock,
      long broadcastTtlMillis) {
    this.store = Preconditions.checkNotNull(store, "store required");
    this.broadcast = Preconditions.checkNotNull(broadcast, "broadcast required");
    this.fingerprinter = Preconditions.checkNotNull(fingerprinter);
    this.serializer = Preconditions.checkNotNull(serializer);
    this.clock = Preconditions.checkNotNull(clock);
    this.broadcastTtlMillis = broadcastTtlMillis;
  }

  /** Subscribes to request notifications from other nodes. */
  public void start() {
    Preconditions.checkState(subscription == null, "registry already started");
    subscription = broadcast.subscribe(REQUEST_TOPIC, this::handleNotification);
  }

  @Override
  public void close() {
    final BroadcastSubscription current = subscription;
    if (current != null) {
      current.close();
      subscription = null;
    }
  }

  @Override
  public long insertRequest(String fingerprint) {
    if (fingerprint == null || CharMatcher.whitespace().matchesAllOf(fingerprint)) {
      throw UserException.validationError()
          .message("a statement fingerprint is required")
          .build(logger);
    }
    final String normalized = fingerprinter.fingerprint(fingerprint);

    final long requestId;
    try {
      requestId =
          store.inTransaction(
              txn -> {
                if (txn.countPendingRequests(normalized) > 0) {
                  throw duplicateRequest(normalized, null);
                }
                return txn.insertRequest(normalized, clock.instant());
              });
    } catch (UniqueConstraintViolationException e) {
      // a concurrent insert, possibly on another node, committed first
      throw duplicateRequest(normalized, e);
    }

    try (AutoCloseableLock ignored = lock.open()) {
      epoch++;
      addPendingLocked(requestId, normalized);
    }
    logger.debug("Inserted diagnostics request {} for fingerprint {}", requestId, normalized);

    try {
      broadcast.publish(REQUEST_TOPIC, requestId, broadcastTtlMillis);
    } catch (RuntimeException e) {
      logger.warn("Failed to broadcast diagnostics request {}", requestId, e);
    }
    return requestId;
  }

  private static UserException duplicateRequest(String fingerprint, Throwable cause) {
    return UserException.concurrentModificationError(cause)
        .message("a pending request for the requested fingerprint already exists")
        .addContext("fingerprint", fingerprint)
        .build(logger);
  }

  /**
   * Claims a pending request, if any, whose fingerprint matches the statement.
   * Never touches the store.
   *
   * @return the hook to complete once the statement ran, empty if diagnostics are not wanted
   */
  public Optional<DiagnosticsCollectionHook> shouldCollectDiagnostics(String statement) {
    try (AutoCloseableLock ignored = lock.open()) {
      if (pending.isEmpty()) {
        return Optional.empty();
      }
    }

    final String fingerprint = fingerprinter.fingerprint(statement);
    final long requestId;
    try (AutoCloseableLock ignored = lock.open()) {
      final Optional<Long> match = findPendingLocked(fingerprint);
      if (!match.isPresent()) {
        return Optional.empty();
      }
      requestId = match.get();
      pending.remove(requestId);
      ongoing.add(requestId);
    }
    logger.debug("Claimed diagnostics request {} for fingerprint {}", requestId, fingerprint);
    return Optional.of(new DiagnosticsCollectionHook(this, requestId, fingerprint, statement));
  }

  void completeClaimed(DiagnosticsCollectionHook hook, List<RecordedSpan> recording) {
    try {
      insertDiagnostics(
          hook.getRequestId(), hook.getFingerprint(), hook.getStatement(), recording);
    } catch (RuntimeException e) {
      logger.warn("Failed to record diagnostics for request {}", hook.getRequestId(), e);
    } finally {
      try (AutoCloseableLock ignored = lock.open()) {
        ongoing.remove(hook.getRequestId());
      }
    }
  }

  /**
   * Records the trace of a request and marks the request completed, atomically.
   *
   * <p>A request that is already completed, by this or another node, or that the store does not
   * know, is left alone.
   *
   * @return true if this call recorded the trace
   */
  public boolean insertDiagnostics(
      long requestId, String fingerprint, String statement, List<RecordedSpan> recording) {
    final Instant collectedAt = clock.instant();
    return store.inTransaction(
        txn -> {
          if (!txn.isRequestPending(requestId)) {
            logger.debug("Diagnostics request {} is no longer pending", requestId);
            return false;
          }

          long traceId;
          try {
            traceId =
                txn.insertTrace(
                    fingerprint, statement, collectedAt, serializer.toJson(recording));
          } catch (TraceSerializationException e) {
            logger.warn("Unable to serialize trace of diagnostics request {}", requestId, e);
            traceId = txn.insertTraceError(fingerprint, statement, collectedAt, e.getMessage());
          }
          txn.markRequestCompleted(requestId, traceId);
          return true;
        });
  }

  /**
   * Makes {@code pending} match the store's outstanding requests, leaving requests claimed on this
   * node alone.
   *
   * <p>The store is read without the mutex. If a local insert happened meanwhile the snapshot may
   * miss it, so the read is retried. There is no bound on the retries: inserts are rare,
   * operator-driven events.
   */
  public void pollRequests() {
    int attempt = 0;
    while (true) {
      attempt++;
      final long observedEpoch;
      try (AutoCloseableLock ignored = lock.open()) {
        observedEpoch = epoch;
      }

      final List<DiagnosticsRequest> outstanding = store.findOutstandingRequests();

      try (AutoCloseableLock ignored = lock.open()) {
        if (epoch != observedEpoch) {
          logger.debug("Diagnostics requests changed during poll attempt {}, retrying", attempt);
          continue;
        }
        final Set<Long> ids = new HashSet<>();
        for (DiagnosticsRequest request : outstanding) {
          ids.add(request.getId());
          addPendingLocked(request.getId(), request.getFingerprint());
        }
        pending.keySet().retainAll(ids);
        logger.debug(
            "Polled {} outstanding diagnostics requests, {} pending here",
            outstanding.size(),
            pending.size());
        return;
      }
    }
  }

  @VisibleForTesting
  void handleNotification(Long requestId) {
    try (AutoCloseableLock ignored = lock.open()) {
      if (isKnownLocked(requestId)) {
        logger.debug("Diagnostics request {} is already known", requestId);
        return;
      }
    }
    try {
      pollRequests();
    } catch (RuntimeException e) {
      logger.warn("Failed to poll for diagnostics requests after notification", e);
    }
  }

  private void addPendingLocked(long requestId, String fingerprint) {
    Preconditions.checkState(lock.isHeldByCurrentThread());
    if (!ongoing.contains(requestId)) {
      pending.putIfAbsent(requestId, fingerprint);
    }
  }

  // any match will do when several requests share a fingerprint
  private Optional<Long> findPendingLocked(String fingerprint) {
    Preconditions.checkState(lock.isHeldByCurrentThread());
    for (Map.Entry<Long, String> entry : pending.entrySet()) {
      if (entry.getValue().equals(fingerprint)) {
        return Optional.of(entry.getKey());
      }
    }
    return Optional.empty();
  }

  private boolean isKnownLocked(long requestId) {
    Preconditions.checkState(lock.isHeldByCurrentThread());
    return pending.containsKey(requestId) || ongoing.contains(requestId);
  }

  @VisibleForTesting
  Map<Long, String> pendingRequests() {
    try (AutoCloseableLock ignored = lock.open()) {
      return ImmutableMap.copyOf(pending);
    }
  }

  @VisibleForTesting
  Set<Long> ongoingRequests() {
    try (AutoCloseableLock ignored = lock.open()) {
      return ImmutableSet.copyOf(ongoing);
    }
  }
}
