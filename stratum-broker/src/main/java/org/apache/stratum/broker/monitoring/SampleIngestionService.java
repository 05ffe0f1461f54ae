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
package org.apache.stratum.broker.monitoring;

import io.prometheus.client.Counter;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.apache.stratum.broker.ServiceConfiguration;
import org.apache.stratum.broker.StratumServiceException.BackendUnavailableException;
import org.apache.stratum.broker.StratumServiceException.PartialResultException;
import org.apache.stratum.broker.stats.QueryDeadline;
import org.apache.stratum.broker.structure.Resource;
import org.apache.stratum.broker.structure.StructureRegistry;
import org.apache.stratum.common.policies.data.MonitoringItem;
import org.apache.stratum.common.util.FutureUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls utilization samples from the monitoring backend, normalizes them and appends them to the sample store.
 * <p>
 * Every resource is fetched on its own with a timeout, so that a backend failing for some resources does not
 * fail the others. When configured to fail silently, a failed resource falls back to the samples already held
 * by the store, usually none, and the failure is logged and counted.
 */
public class SampleIngestionService {

    private final MonitoringClient client;
    private final UsageSampleStore store;
    private final StructureRegistry registry;
    private final ServiceConfiguration config;
    private final Clock clock;

    public SampleIngestionService(MonitoringClient client, UsageSampleStore store, StructureRegistry registry,
                                  ServiceConfiguration config, Clock clock) {
        this.client = client;
        this.store = store;
        this.registry = registry;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Fetch and store the samples of an item for the given resources in {@code [from, to)}.
     *
     * @return the samples of every resource, in time order
     * @throws BackendUnavailableException if a resource could not be fetched and the service is not configured to
     *                                     fail silently
     * @throws PartialResultException if the deadline passes first; carries the samples fetched so far
     */
    public Map<String, List<UsageSample>> fetch(Collection<String> resourceIds, MonitoringItem item, long from,
                                                long to, QueryDeadline deadline)
            throws BackendUnavailableException, PartialResultException {
        return fetch(resourceIds, item, from, to, deadline, config.isMonitoringFailSilently());
    }

    private Map<String, List<UsageSample>> fetch(Collection<String> resourceIds, MonitoringItem item, long from,
                                                 long to, QueryDeadline deadline, boolean failSilently)
            throws BackendUnavailableException, PartialResultException {
        Map<String, CompletableFuture<List<RawSample>>> futures = new LinkedHashMap<>();
        for (String resourceId : new LinkedHashSet<>(resourceIds)) {
            futures.put(resourceId, fetchOne(resourceId, item, from, to)
                    .orTimeout(config.getMonitoringFetchTimeoutMillis(), TimeUnit.MILLISECONDS));
        }

        Map<String, List<UsageSample>> result = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, CompletableFuture<List<RawSample>>> entry : futures.entrySet()) {
                String resourceId = entry.getKey();
                deadline.check("Sample fetch", result);
                List<RawSample> raw;
                try {
                    raw = entry.getValue().get(deadline.remainingMillis(), TimeUnit.MILLISECONDS);
                } catch (ExecutionException e) {
                    Throwable cause = FutureUtil.unwrapCompletionException(e);
                    fetchFailures.labels(item.name()).inc();
                    if (!failSilently) {
                        throw new BackendUnavailableException("Failed to fetch " + item + " samples of resource "
                                + resourceId, cause);
                    }
                    log.warn("Failed to fetch {} samples of resource {}, using stored samples only: {}", item,
                            resourceId, cause.toString());
                    raw = Collections.emptyList();
                } catch (TimeoutException e) {
                    throw new PartialResultException("Sample fetch exceeded its deadline", result);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new PartialResultException("Sample fetch was interrupted", result);
                }
                int added = store.append(normalize(resourceId, item, from, to, raw));
                samplesIngested.inc(added);
                result.put(resourceId, store.query(resourceId, item, from, to));
            }
        } finally {
            futures.values().forEach(future -> future.cancel(false));
        }
        return result;
    }

    private CompletableFuture<List<RawSample>> fetchOne(String resourceId, MonitoringItem item, long from, long to) {
        try {
            CompletableFuture<List<RawSample>> future =
                    client.fetchSamples(Collections.singletonList(resourceId), item, from, to);
            return future != null ? future : FutureUtil.failedFuture(
                    new IllegalStateException("Monitoring client returned no future"));
        } catch (Exception e) {
            return FutureUtil.failedFuture(e);
        }
    }

    private List<UsageSample> normalize(String resourceId, MonitoringItem item, long from, long to,
                                        List<RawSample> raw) {
        List<UsageSample> samples = new ArrayList<>(raw.size());
        for (RawSample sample : raw) {
            if (!resourceId.equals(sample.getResourceId()) || sample.getItem() != item
                    || sample.getTimestamp() < from || sample.getTimestamp() >= to) {
                continue;
            }
            try {
                samples.add(UnitNormalizer.normalize(sample));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring sample {}: {}", sample, e.getMessage());
            }
        }
        return samples;
    }

    /**
     * Pull the samples of the last ingestion interval for every live resource. Failures are logged, never
     * propagated.
     */
    public void ingestRecent() {
        long now = clock.millis() / 1000;
        long from = now - config.getSampleIngestionIntervalSeconds();
        List<String> resourceIds = registry.getResources().stream()
                .filter(Resource::isLive)
                .map(Resource::getUuid)
                .collect(Collectors.toList());
        if (resourceIds.isEmpty()) {
            return;
        }
        for (MonitoringItem item : MonitoringItem.values()) {
            QueryDeadline deadline = QueryDeadline.after(
                    2 * config.getMonitoringFetchTimeoutMillis(), TimeUnit.MILLISECONDS);
            try {
                fetch(resourceIds, item, from, now, deadline, true);
            } catch (BackendUnavailableException | PartialResultException e) {
                log.warn("Periodic ingestion of {} samples for {} resources failed: {}", item, resourceIds.size(),
                        e.getMessage());
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Ingested samples of {} resources for [{}, {})", resourceIds.size(), from, now);
        }
    }

    /**
     * Drop samples older than the retention window.
     */
    public int purgeExpired() {
        long cutoff = clock.millis() / 1000 - TimeUnit.HOURS.toSeconds(config.getSampleRetentionHours());
        int purged = store.purge(cutoff);
        if (purged > 0) {
            log.info("Purged {} usage samples older than {}", purged, cutoff);
        }
        return purged;
    }

    private static final Logger log = LoggerFactory.getLogger(SampleIngestionService.class);

    private static final Counter fetchFailures = Counter.build()
            .name("stratum_monitoring_fetch_failures")
            .help("Number of per-resource sample fetches that failed or timed out")
            .labelNames("item")
            .register();
    private static final Counter samplesIngested = Counter.build()
            .name("stratum_monitoring_samples_ingested")
            .help("Number of usage samples appended to the store")
            .register();
}
