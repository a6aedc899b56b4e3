/*
 * Where: ledger service layer
 * What: captures audit events, links them into per-tenant hash chains and flushes them in batches
 * Why: callers never wait on storage, and a clean stop drains every accepted event
 */
package com.auditledger.ledger.service;

import com.auditledger.common.Ids;
import com.auditledger.ledger.config.LedgerCaptureProperties;
import com.auditledger.ledger.model.AuditEvent;
import com.auditledger.ledger.model.AuditEventFilter;
import com.auditledger.ledger.model.CaptureRequest;
import com.auditledger.ledger.repository.AuditStorage;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.SmartLifecycle;

/**
 * The ledger's write path.
 *
 * <p>Three pieces of state are guarded independently: each tenant's chain tip by that tenant's
 * lock, the pending batch by {@code queueLock}, and the dedup index by {@code dedupLock}. The
 * tenant lock is held from timestamp assignment until the event is enqueued, so events of one
 * tenant enter the batch in chain order with strictly increasing timestamps.
 */
public class AuditCaptureService implements SmartLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(AuditCaptureService.class);
  private static final String MDC_TENANT_ID = "tenant_id";
  private static final String MDC_REQUEST_ID = "request_id";

  private final AuditStorage storage;
  private final LedgerCaptureProperties properties;
  private final LedgerMetrics metrics;
  private final FlushFailureHandler flushFailureHandler;
  private final Clock clock;

  private final List<AuditEventEnricher> enrichers = new CopyOnWriteArrayList<>();
  private final ConcurrentMap<String, TenantChain> chains = new ConcurrentHashMap<>();
  private final Object queueLock = new Object();
  private final Object dedupLock = new Object();
  private final ReentrantLock flushLock = new ReentrantLock();
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicBoolean flushQueued = new AtomicBoolean(false);

  private List<AuditEvent> pending = new ArrayList<>();
  // insertion order equals last-seen order, so expired keys are always at the head
  private final LinkedHashMap<String, Instant> recentKeys = new LinkedHashMap<>();
  private volatile ScheduledExecutorService scheduler;
  private volatile ExecutorService flushExecutor;

  public AuditCaptureService(
      AuditStorage storage,
      LedgerCaptureProperties properties,
      LedgerMetrics metrics,
      FlushFailureHandler flushFailureHandler,
      Clock clock) {
    this.storage = storage;
    this.properties = properties;
    this.metrics = metrics;
    this.flushFailureHandler = flushFailureHandler;
    this.clock = clock;
  }

  public void addEnricher(AuditEventEnricher enricher) {
    enrichers.add(enricher);
  }

  /**
   * Captures one event and returns its id. Duplicates inside the dedup window return the id of
   * a fresh event that is never stored. Only invalid requests throw, at {@link CaptureRequest}
   * construction.
   */
  public String capture(CaptureRequest request) {
    final TenantChain chain =
        chains.computeIfAbsent(request.tenantId(), ignored -> new TenantChain());
    final AuditEvent accepted;
    final int queued;
    chain.lock.lock();
    try {
      final Instant timestamp = resolveTimestamp(request, chain);
      final AuditEvent sealed = toEvent(request, timestamp, chain.tipHash).seal();
      final Instant now = Instant.now(clock);
      if (properties.deduplicationEnabled() && isDuplicate(sealed, now)) {
        metrics.recordCapture("duplicate");
        logger.debug(
            "audit event deduplicated tenantId={} key={}",
            sealed.tenantId(),
            sealed.deduplicationKey());
        return sealed.id();
      }
      accepted = enrich(sealed);
      chain.advance(accepted);
      queued = enqueue(accepted);
      if (properties.deduplicationEnabled()) {
        remember(sealed, now);
      }
    } finally {
      chain.lock.unlock();
    }
    metrics.recordCapture("accepted");
    if (queued >= properties.batchSize()) {
      requestFlush();
    }
    return accepted.id();
  }

  /** Writes everything pending to storage. Never throws; failures go to the handler. */
  public int flush() {
    flushLock.lock();
    try {
      final List<AuditEvent> batch;
      synchronized (queueLock) {
        if (pending.isEmpty()) {
          return 0;
        }
        batch = pending;
        pending = new ArrayList<>();
      }
      metrics.updateQueuePending(pendingCount());
      final long startedAt = System.nanoTime();
      final int written;
      try {
        written = storage.writeBatch(batch);
      } catch (RuntimeException ex) {
        metrics.recordFlush(0, batch.size(), Duration.ofNanos(System.nanoTime() - startedAt));
        metrics.recordFlushFailure();
        handleRejected(batch, ex);
        return 0;
      }
      metrics.recordFlush(
          written, batch.size() - written, Duration.ofNanos(System.nanoTime() - startedAt));
      if (written < batch.size()) {
        metrics.recordFlushFailure();
        handleRejected(batch, null);
      } else {
        logger.debug("audit flush wrote written={} submitted={}", written, batch.size());
      }
      return written;
    } finally {
      flushLock.unlock();
    }
  }

  @Override
  public void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    properties.recoverTenants().forEach(this::recoverChainTip);
    scheduler =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder()
                .setNameFormat("ledger-flush-timer-%d")
                .setDaemon(true)
                .build());
    flushExecutor =
        Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder().setNameFormat("ledger-flush-%d").setDaemon(true).build());
    final long intervalMillis = properties.batchInterval().toMillis();
    scheduler.scheduleWithFixedDelay(
        this::flushQuietly, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    logger.info(
        "audit capture started batchSize={} batchInterval={} deduplicationWindow={}",
        properties.batchSize(),
        properties.batchInterval(),
        properties.deduplicationWindow());
  }

  /** Stops the flush loop, waits for a running flush and drains what is still pending. */
  @Override
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    scheduler.shutdown();
    flushExecutor.shutdown();
    final long timeoutMillis = properties.shutdownTimeout().toMillis();
    try {
      if (!scheduler.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)
          || !flushExecutor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
        logger.warn(
            "audit flush workers did not finish within timeout={}", properties.shutdownTimeout());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn("interrupted while waiting for audit flush workers", ex);
    }
    final int drained = flush();
    logger.info("audit capture stopped drained={} pending={}", drained, pendingCount());
  }

  @Override
  public boolean isRunning() {
    return running.get();
  }

  /** Last hash of the tenant's chain, or {@code ""} before its first event. */
  public String chainTip(String tenantId) {
    final TenantChain chain = chains.get(tenantId);
    if (chain == null) {
      return "";
    }
    chain.lock.lock();
    try {
      return chain.tipHash;
    } finally {
      chain.lock.unlock();
    }
  }

  /** Seeds the tenant's tip from a persisted event unless a newer one is already known. */
  public void restoreChainTip(AuditEvent latest) {
    final TenantChain chain =
        chains.computeIfAbsent(latest.tenantId(), ignored -> new TenantChain());
    chain.lock.lock();
    try {
      if (chain.tipTimestamp == null || latest.timestamp().isAfter(chain.tipTimestamp)) {
        chain.advance(latest);
      }
    } finally {
      chain.lock.unlock();
    }
  }

  @VisibleForTesting
  int pendingCount() {
    synchronized (queueLock) {
      return pending.size();
    }
  }

  private void recoverChainTip(String tenantId) {
    try {
      storage
          .query(AuditEventFilter.builder().tenantId(tenantId).limit(1).build())
          .stream()
          .findFirst()
          .ifPresent(this::restoreChainTip);
      logger.info("audit chain tip recovered tenantId={} tip={}", tenantId, chainTip(tenantId));
    } catch (RuntimeException ex) {
      logger.warn("audit chain tip recovery failed tenantId={}", tenantId, ex);
    }
  }

  // Supplied and generated timestamps alike must sort after the tip, or the chain would not
  // follow timestamp order.
  private Instant resolveTimestamp(CaptureRequest request, TenantChain chain) {
    final Instant candidate =
        (request.timestamp() != null ? request.timestamp() : Instant.now(clock))
            .truncatedTo(ChronoUnit.MICROS);
    if (chain.tipTimestamp != null && !candidate.isAfter(chain.tipTimestamp)) {
      final Instant bumped = chain.tipTimestamp.plus(1, ChronoUnit.MICROS);
      if (request.timestamp() != null) {
        logger.debug(
            "audit timestamp moved past chain tip tenantId={} supplied={} assigned={}",
            request.tenantId(),
            request.timestamp(),
            bumped);
      }
      return bumped;
    }
    return candidate;
  }

  private static AuditEvent toEvent(
      CaptureRequest request, Instant timestamp, String previousHash) {
    return AuditEvent.builder()
        .id(request.id() != null ? request.id() : Ids.newEventId())
        .timestamp(timestamp)
        .tenantId(request.tenantId())
        .projectId(request.projectId())
        .actorType(request.actorType())
        .actorId(request.actorId())
        .actorEmail(request.actorEmail())
        .actorIp(request.actorIp())
        .actorUserAgent(request.actorUserAgent())
        .category(request.category())
        .eventType(request.eventType())
        .severity(request.severity())
        .resourceType(request.resourceType())
        .resourceId(request.resourceId())
        .resourceName(request.resourceName())
        .action(request.action())
        .previousState(request.previousState())
        .newState(request.newState())
        .requestId(request.requestId() != null ? request.requestId() : Ids.newRequestId())
        .sessionId(request.sessionId())
        .previousHash(previousHash)
        .build();
  }

  private boolean isDuplicate(AuditEvent event, Instant now) {
    synchronized (dedupLock) {
      final Instant seen = recentKeys.get(event.deduplicationKey());
      return seen != null && now.isBefore(seen.plus(properties.deduplicationWindow()));
    }
  }

  private void remember(AuditEvent event, Instant now) {
    synchronized (dedupLock) {
      recentKeys.remove(event.deduplicationKey());
      recentKeys.put(event.deduplicationKey(), now);
      final Instant cutoff = now.minus(properties.deduplicationWindow());
      final Iterator<Map.Entry<String, Instant>> oldest = recentKeys.entrySet().iterator();
      while (oldest.hasNext() && !oldest.next().getValue().isAfter(cutoff)) {
        oldest.remove();
      }
    }
  }

  private AuditEvent enrich(AuditEvent event) {
    if (enrichers.isEmpty()) {
      return event;
    }
    final String previousTenant = MDC.get(MDC_TENANT_ID);
    final String previousRequest = MDC.get(MDC_REQUEST_ID);
    MDC.put(MDC_TENANT_ID, event.tenantId());
    MDC.put(MDC_REQUEST_ID, event.requestId());
    try {
      AuditEvent current = event;
      for (AuditEventEnricher enricher : enrichers) {
        try {
          final AuditEvent enriched = enricher.enrich(current);
          if (enriched != null && !enriched.equals(current)) {
            current = reseal(current, enriched);
          }
        } catch (RuntimeException ex) {
          metrics.recordEnrichmentFailure();
          logger.warn(
              "audit enrichment failed eventId={} enricher={}",
              event.id(),
              enricher.getClass().getName(),
              ex);
        }
      }
      return current;
    } finally {
      restoreMdc(MDC_TENANT_ID, previousTenant);
      restoreMdc(MDC_REQUEST_ID, previousRequest);
    }
  }

  // Identity, time and chain position belong to the pipeline, not to enrichers.
  private static AuditEvent reseal(AuditEvent original, AuditEvent enriched) {
    return enriched.toBuilder()
        .id(original.id())
        .timestamp(original.timestamp())
        .tenantId(original.tenantId())
        .previousHash(original.previousHash())
        .build()
        .seal();
  }

  private static void restoreMdc(String key, String value) {
    if (value == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, value);
    }
  }

  private int enqueue(AuditEvent event) {
    final int size;
    synchronized (queueLock) {
      pending.add(event);
      size = pending.size();
    }
    metrics.updateQueuePending(size);
    return size;
  }

  private void requestFlush() {
    final ExecutorService executor = flushExecutor;
    if (!running.get() || executor == null || !flushQueued.compareAndSet(false, true)) {
      return;
    }
    try {
      executor.execute(
          () -> {
            flushQueued.set(false);
            flushQuietly();
          });
    } catch (RejectedExecutionException ex) {
      // stopping; the final drain in stop() picks the batch up
      flushQueued.set(false);
    }
  }

  private void flushQuietly() {
    try {
      flush();
    } catch (RuntimeException ex) {
      logger.error("audit background flush failed", ex);
    }
  }

  private void handleRejected(List<AuditEvent> batch, Throwable cause) {
    final List<AuditEvent> rejected = findRejected(batch);
    final Map<String, List<AuditEvent>> byTenant = new LinkedHashMap<>();
    for (AuditEvent event : batch) {
      byTenant.computeIfAbsent(event.tenantId(), ignored -> new ArrayList<>()).add(event);
    }
    final Set<String> rejectedIds =
        rejected.stream().map(AuditEvent::id).collect(Collectors.toSet());
    byTenant.forEach((tenantId, events) -> rewindChainTip(tenantId, events, rejectedIds));
    notifyFailure(batch, rejected, cause);
  }

  // Persisted means storage holds the id with the same hash; a foreign event under a reused id
  // does not count.
  private List<AuditEvent> findRejected(List<AuditEvent> batch) {
    final List<AuditEvent> rejected = new ArrayList<>();
    for (AuditEvent event : batch) {
      try {
        final boolean persisted =
            storage
                .readEvent(event.id())
                .map(stored -> event.hash().equals(stored.hash()))
                .orElse(false);
        if (!persisted) {
          rejected.add(event);
        }
      } catch (RuntimeException ex) {
        logger.warn("audit flush could not confirm event eventId={}", event.id(), ex);
        rejected.add(event);
      }
    }
    return rejected;
  }

  /**
   * Moves the tenant's tip back before a trailing run of rejected events, so the next capture
   * links to the last persisted event. Not possible once a later event was chained onto a
   * rejected one: that fork stays in storage and is reported.
   */
  private void rewindChainTip(String tenantId, List<AuditEvent> events, Set<String> rejectedIds) {
    final List<String> tenantRejected =
        events.stream()
            .map(AuditEvent::id)
            .filter(rejectedIds::contains)
            .collect(Collectors.toList());
    if (tenantRejected.isEmpty()) {
      return;
    }
    int firstTrailing = events.size();
    while (firstTrailing > 0 && rejectedIds.contains(events.get(firstTrailing - 1).id())) {
      firstTrailing--;
    }
    final boolean onlyTrailing = events.size() - firstTrailing == tenantRejected.size();
    final TenantChain chain = chains.get(tenantId);
    if (onlyTrailing && chain != null) {
      chain.lock.lock();
      try {
        if (chain.tipHash.equals(events.get(events.size() - 1).hash())) {
          chain.tipHash = events.get(firstTrailing).previousHash();
          logger.warn(
              "audit chain tip rewound past rejected events tenantId={} rejectedEventIds={}",
              tenantId,
              tenantRejected);
          return;
        }
      } finally {
        chain.lock.unlock();
      }
    }
    logger.error(
        "audit chain forked, later events link to rejected ones tenantId={} rejectedEventIds={}",
        tenantId,
        tenantRejected);
  }

  private void notifyFailure(List<AuditEvent> batch, List<AuditEvent> rejected, Throwable cause) {
    try {
      flushFailureHandler.onFlushFailure(List.copyOf(batch), List.copyOf(rejected), cause);
    } catch (RuntimeException ex) {
      logger.error(
          "flush failure handler threw submitted={} rejected={}",
          batch.size(),
          rejected.size(),
          ex);
    }
  }

  private static final class TenantChain {
    private final ReentrantLock lock = new ReentrantLock();
    private String tipHash = "";
    private Instant tipTimestamp;

    private void advance(AuditEvent event) {
      tipHash = event.hash();
      tipTimestamp = event.timestamp();
    }
  }
}
