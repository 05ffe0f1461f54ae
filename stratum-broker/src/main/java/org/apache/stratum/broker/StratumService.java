/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.apache.stratum.broker;

import static org.apache.stratum.common.util.Runnables.catchingAndLoggingThrowables;
import com.google.common.annotations.VisibleForTesting;
import io.netty.util.concurrent.DefaultThreadFactory;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import lombok.AccessLevel;
import lombok.Getter;
import org.apache.stratum.broker.alert.AlertRegistry;
import org.apache.stratum.broker.lifecycle.LifecycleEventProcessor;
import org.apache.stratum.broker.lifecycle.LifecycleEventSubmitter;
import org.apache.stratum.broker.monitoring.MonitoringClient;
import org.apache.stratum.broker.monitoring.SampleIngestionService;
import org.apache.stratum.broker.monitoring.UsageSampleStore;
import org.apache.stratum.broker.quota.QuotaHistory;
import org.apache.stratum.broker.quota.QuotaLedger;
import org.apache.stratum.broker.quota.QuotaThresholdAlertHandler;
import org.apache.stratum.broker.reconciliation.ReconciliationJob;
import org.apache.stratum.broker.stats.AggregationQueryEngine;
import org.apache.stratum.broker.structure.StructureRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the quota accounting components together and runs their periodic tasks: reconciliation, sample
 * ingestion, and purging of expired samples, history and alerts.
 * <p>
 * The reconciliation and ingestion periods are dynamic; each run checks the configured period and re-schedules
 * itself when it changed.
 */
@Getter
public class StratumService implements AutoCloseable {

    private static final long PURGE_PERIOD_SECONDS = TimeUnit.HOURS.toSeconds(1);

    private final ServiceConfiguration config;
    private final Clock clock;
    private final QuotaLedger ledger;
    private final QuotaHistory quotaHistory;
    private final AlertRegistry alertRegistry;
    private final StructureRegistry structureRegistry;
    private final ReconciliationJob reconciliationJob;
    private final LifecycleEventProcessor lifecycleEventProcessor;
    private final LifecycleEventSubmitter lifecycleEventSubmitter;
    private final UsageSampleStore sampleStore;
    private final SampleIngestionService sampleIngestionService;
    private final AggregationQueryEngine queryEngine;

    @Getter(AccessLevel.NONE)
    private final ScheduledExecutorService executor;

    @Getter(AccessLevel.NONE)
    private final Object reconciliationLock = new Object();
    @Getter(AccessLevel.NONE)
    private final Object ingestionLock = new Object();
    @Getter(AccessLevel.NONE)
    private boolean started;
    @Getter(AccessLevel.NONE)
    private ScheduledFuture<?> reconciliationTask;
    @Getter(AccessLevel.NONE)
    private long reconciliationPeriodInSeconds;
    @Getter(AccessLevel.NONE)
    private ScheduledFuture<?> ingestionTask;
    @Getter(AccessLevel.NONE)
    private long ingestionPeriodInSeconds;
    @Getter(AccessLevel.NONE)
    private ScheduledFuture<?> maintenanceTask;

    public StratumService(ServiceConfiguration config, MonitoringClient monitoringClient) {
        this(config, monitoringClient, Clock.systemUTC());
    }

    public StratumService(ServiceConfiguration config, MonitoringClient monitoringClient, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.executor = Executors.newScheduledThreadPool(config.getNumSchedulerThreads(),
                new DefaultThreadFactory("stratum-scheduler"));

        this.ledger = new QuotaLedger(clock);
        this.quotaHistory = new QuotaHistory();
        this.alertRegistry = new AlertRegistry(clock);
        this.ledger.addListener(quotaHistory);
        this.ledger.addListener(new QuotaThresholdAlertHandler(alertRegistry, config::getQuotaUsageAlertThreshold));

        this.structureRegistry = new StructureRegistry(ledger);
        this.reconciliationJob = new ReconciliationJob(structureRegistry, ledger);
        this.structureRegistry.addMembershipListener(reconciliationJob);

        this.lifecycleEventProcessor = new LifecycleEventProcessor(structureRegistry, ledger, config);
        this.lifecycleEventSubmitter = new LifecycleEventSubmitter(lifecycleEventProcessor, config, executor);

        this.sampleStore = new UsageSampleStore();
        this.sampleIngestionService = new SampleIngestionService(monitoringClient, sampleStore, structureRegistry,
                config, clock);
        this.queryEngine = new AggregationQueryEngine(structureRegistry, ledger, quotaHistory,
                sampleIngestionService, alertRegistry, config, clock);
    }

    /**
     * Start the periodic tasks.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        synchronized (reconciliationLock) {
            reconciliationPeriodInSeconds = config.getReconciliationIntervalSeconds();
            reconciliationTask = executor.scheduleAtFixedRate(catchingAndLoggingThrowables(this::reconcile),
                    reconciliationPeriodInSeconds, reconciliationPeriodInSeconds, TimeUnit.SECONDS);
        }
        synchronized (ingestionLock) {
            ingestionPeriodInSeconds = config.getSampleIngestionIntervalSeconds();
            ingestionTask = executor.scheduleAtFixedRate(catchingAndLoggingThrowables(this::ingestSamples),
                    ingestionPeriodInSeconds, ingestionPeriodInSeconds, TimeUnit.SECONDS);
        }
        maintenanceTask = executor.scheduleAtFixedRate(catchingAndLoggingThrowables(this::purgeExpired),
                PURGE_PERIOD_SECONDS, PURGE_PERIOD_SECONDS, TimeUnit.SECONDS);
        log.info("Started stratum service: reconciliation every {}s, sample ingestion every {}s",
                config.getReconciliationIntervalSeconds(), config.getSampleIngestionIntervalSeconds());
    }

    // Visibility for testing.
    void reconcile() {
        reconciliationJob.reconcileAll();

        // cancel and re-schedule this task if the period of execution has changed.
        synchronized (reconciliationLock) {
            long newPeriodInSeconds = config.getReconciliationIntervalSeconds();
            if (newPeriodInSeconds != reconciliationPeriodInSeconds && reconciliationTask != null
                    && !executor.isShutdown()) {
                boolean cancelStatus = reconciliationTask.cancel(false);
                log.info("reconcile: Got status={} in cancel of periodic when period changed from {} to {} seconds",
                        cancelStatus, reconciliationPeriodInSeconds, newPeriodInSeconds);
                reconciliationTask = executor.scheduleAtFixedRate(catchingAndLoggingThrowables(this::reconcile),
                        newPeriodInSeconds, newPeriodInSeconds, TimeUnit.SECONDS);
                reconciliationPeriodInSeconds = newPeriodInSeconds;
            }
        }
    }

    // Visibility for testing.
    void ingestSamples() {
        sampleIngestionService.ingestRecent();

        synchronized (ingestionLock) {
            long newPeriodInSeconds = config.getSampleIngestionIntervalSeconds();
            if (newPeriodInSeconds != ingestionPeriodInSeconds && ingestionTask != null
                    && !executor.isShutdown()) {
                boolean cancelStatus = ingestionTask.cancel(false);
                log.info("ingestSamples: Got status={} in cancel of periodic when period changed from {} to {}"
                        + " seconds", cancelStatus, ingestionPeriodInSeconds, newPeriodInSeconds);
                ingestionTask = executor.scheduleAtFixedRate(catchingAndLoggingThrowables(this::ingestSamples),
                        newPeriodInSeconds, newPeriodInSeconds, TimeUnit.SECONDS);
                ingestionPeriodInSeconds = newPeriodInSeconds;
            }
        }
    }

    // Visibility for testing.
    void purgeExpired() {
        long now = clock.millis() / 1000;
        sampleIngestionService.purgeExpired();
        quotaHistory.purge(now - TimeUnit.DAYS.toSeconds(config.getQuotaHistoryRetentionDays()));
        alertRegistry.closeAlertsWithoutScope(structureRegistry::exists);
        alertRegistry.purgeClosedBefore(now - TimeUnit.DAYS.toSeconds(config.getClosedAlertRetentionDays()));
    }

    @VisibleForTesting
    long getReconciliationPeriodInSeconds() {
        synchronized (reconciliationLock) {
            return reconciliationPeriodInSeconds;
        }
    }

    @VisibleForTesting
    long getIngestionPeriodInSeconds() {
        synchronized (ingestionLock) {
            return ingestionPeriodInSeconds;
        }
    }

    @Override
    public synchronized void close() {
        // Holds both task locks so that no run re-schedules itself on the terminated executor.
        synchronized (reconciliationLock) {
            synchronized (ingestionLock) {
                executor.shutdownNow();
                if (reconciliationTask != null) {
                    reconciliationTask.cancel(true);
                }
                if (ingestionTask != null) {
                    ingestionTask.cancel(true);
                }
            }
        }
        if (maintenanceTask != null) {
            maintenanceTask.cancel(true);
        }
        log.info("Closed stratum service");
    }

    private static final Logger log = LoggerFactory.getLogger(StratumService.class);
}
