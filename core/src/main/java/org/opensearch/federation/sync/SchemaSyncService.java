/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.sync;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.Closeable;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.federation.exception.SyncException;
import org.opensearch.federation.planner.Planner;

/**
 * Keeps a {@link Planner} over the latest backend schemas published.
 *
 * <p>{@link #start()} syncs once and fails if that first sync fails. Afterwards the service
 * re-schedules itself, reading the interval before every run. A successful sync replaces the
 * published planner with one reference write; a failed sync is logged and the previous planner
 * stays in place. Syncs never overlap, so planners are published in the order they were
 * fetched. Queries keep the planner they obtained from {@link #getPlanner()}.
 */
public class SchemaSyncService implements PlannerSupplier, Closeable {

  private static final Logger LOG = LogManager.getLogger(SchemaSyncService.class);

  private final SchemaSyncer syncer;

  private final Supplier<Duration> interval;

  private final ScheduledExecutorService scheduler;

  private final AtomicReference<Planner> planner = new AtomicReference<>();

  /** Held for a whole fetch and publish, so at most one sync writes at a time. */
  private final Object syncLock = new Object();

  private volatile boolean closed;

  public SchemaSyncService(SchemaSyncer syncer, Supplier<Duration> interval) {
    this(
        syncer,
        interval,
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder()
                .setNameFormat("federation-schema-sync-%d")
                .setDaemon(true)
                .build()));
  }

  SchemaSyncService(
      SchemaSyncer syncer, Supplier<Duration> interval, ScheduledExecutorService scheduler) {
    this.syncer = syncer;
    this.interval = interval;
    this.scheduler = scheduler;
  }

  /**
   * Runs the first sync and schedules the following ones.
   *
   * @throws SyncException if the first sync fails; nothing is published and nothing is scheduled
   */
  public void start() throws SyncException {
    Preconditions.checkState(!closed, "Schema sync service is closed");
    synchronized (syncLock) {
      publish(syncer.fetchPlanner());
    }
    scheduleNext();
  }

  /**
   * Syncs now. Waits for a sync that is already running, scheduled or not, to publish first.
   *
   * @return true if a new planner was published
   */
  public boolean refresh() {
    synchronized (syncLock) {
      try {
        publish(syncer.fetchPlanner());
        return true;
      } catch (SyncException | RuntimeException e) {
        LOG.warn("Schema sync failed, keeping registry version {}", currentVersion(), e);
        return false;
      }
    }
  }

  /**
   * Returns the published planner.
   *
   * @throws IllegalStateException if no sync has succeeded yet
   */
  @Override
  public Planner getPlanner() {
    Planner current = planner.get();
    Preconditions.checkState(current != null, "No schema has been synced yet");
    return current;
  }

  @Override
  public void close() {
    closed = true;
    scheduler.shutdownNow();
  }

  private void publish(Planner next) {
    planner.set(next);
    LOG.info("Published registry version {}", next.getRegistry().getVersion());
  }

  private void scheduleNext() {
    if (closed) {
      return;
    }
    Duration delay = interval.get();
    scheduler.schedule(this::runScheduled, delay.toMillis(), TimeUnit.MILLISECONDS);
  }

  private void runScheduled() {
    if (closed) {
      return;
    }
    refresh();
    scheduleNext();
  }

  private String currentVersion() {
    Planner current = planner.get();
    return current == null ? "none" : String.valueOf(current.getRegistry().getVersion());
  }
}
