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
package org.apache.stratum.broker.stats;

import com.google.common.collect.ImmutableList;
import io.prometheus.client.Summary;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;
import org.apache.stratum.broker.ServiceConfiguration;
import org.apache.stratum.broker.StratumServiceException;
import org.apache.stratum.broker.StratumServiceException.PartialResultException;
import org.apache.stratum.broker.StratumServiceException.ValidationException;
import org.apache.stratum.broker.alert.Alert;
import org.apache.stratum.broker.alert.AlertRegistry;
import org.apache.stratum.broker.monitoring.Bucket;
import org.apache.stratum.broker.monitoring.Bucketizer;
import org.apache.stratum.broker.monitoring.SampleIngestionService;
import org.apache.stratum.broker.monitoring.UsageSample;
import org.apache.stratum.broker.quota.LedgerSnapshot;
import org.apache.stratum.broker.quota.QuotaHistory;
import org.apache.stratum.broker.quota.QuotaHistoryEntry;
import org.apache.stratum.broker.quota.QuotaKey;
import org.apache.stratum.broker.quota.QuotaLedger;
import org.apache.stratum.broker.structure.Customer;
import org.apache.stratum.broker.structure.HierarchyNode;
import org.apache.stratum.broker.structure.Project;
import org.apache.stratum.broker.structure.ProjectGroup;
import org.apache.stratum.broker.structure.Resource;
import org.apache.stratum.broker.structure.StructureRegistry;
import org.apache.stratum.common.naming.ScopeName;
import org.apache.stratum.common.naming.ScopeType;
import org.apache.stratum.common.policies.data.AlertSeverity;
import org.apache.stratum.common.policies.data.MonitoringItem;
import org.apache.stratum.common.policies.data.ResourceKind;
import org.apache.stratum.common.policies.data.ResourceState;
import org.apache.stratum.common.policies.data.ResourceType;
import org.apache.stratum.common.policies.data.TimelineInterval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers the statistics queries over the hierarchy, the quota ledger, the quota history, the usage samples and
 * the alerts.
 * <p>
 * Queries are read-only and take no lock shared with writers. Null arguments take their documented defaults:
 * aggregate {@code customer}, the configured bucket count, and a window ending now of one hour for usage
 * statistics, thirty days for creation time statistics and one day for the quota timeline. Every query honours
 * its {@link QueryDeadline} and fails with a {@link PartialResultException} holding the part computed in time.
 */
public class AggregationQueryEngine {

    static final long DEFAULT_USAGE_WINDOW_SECONDS = TimeUnit.HOURS.toSeconds(1);
    static final long DEFAULT_CREATION_TIME_WINDOW_SECONDS = TimeUnit.DAYS.toSeconds(30);
    static final long DEFAULT_TIMELINE_WINDOW_SECONDS = TimeUnit.DAYS.toSeconds(1);

    private final StructureRegistry registry;
    private final QuotaLedger ledger;
    private final QuotaHistory history;
    private final SampleIngestionService ingestion;
    private final AlertRegistry alertRegistry;
    private final ServiceConfiguration config;
    private final Clock clock;

    public AggregationQueryEngine(StructureRegistry registry, QuotaLedger ledger, QuotaHistory history,
                                  SampleIngestionService ingestion, AlertRegistry alertRegistry,
                                  ServiceConfiguration config, Clock clock) {
        this.registry = registry;
        this.ledger = ledger;
        this.history = history;
        this.ingestion = ingestion;
        this.alertRegistry = alertRegistry;
        this.config = config;
        this.clock = clock;
    }

    public QueryDeadline defaultDeadline() {
        return QueryDeadline.after(config.getStatisticsQueryTimeoutMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Utilization of an item per scope instance. Each resource's samples are averaged per bucket, then the
     * resource averages are summed across the resources of the scope.
     */
    public List<ScopeUsageStatistics> usageStatistics(ScopeType aggregate, String scopeUuid, MonitoringItem item,
                                                      Long from, Long to, Integer buckets, QueryDeadline deadline)
            throws StratumServiceException {
        if (item == null) {
            throw new ValidationException("Monitoring item is required, one of "
                    + Arrays.toString(MonitoringItem.values()));
        }
        final Summary.Timer timer = queryLatency.labels("usage").startTimer();
        long end = to != null ? to : now();
        long start = from != null ? from : end - DEFAULT_USAGE_WINDOW_SECONDS;
        int n = buckets != null ? buckets : config.getStatisticsDefaultBucketCount();
        long[] bounds = Bucketizer.boundaries(start, end, n);

        List<HierarchyNode> nodes = registry.getNodes(defaultAggregate(aggregate), scopeUuid);
        Map<ScopeName, List<String>> resourcesByScope = new LinkedHashMap<>();
        Set<String> resourceIds = new LinkedHashSet<>();
        for (HierarchyNode node : nodes) {
            List<String> ids = registry.resourcesUnder(node.getScopeName()).stream()
                    .filter(r -> r.getStatus().getState() != null
                            && r.getStatus().getState() != ResourceState.DELETED)
                    .map(Resource::getUuid)
                    .collect(Collectors.toList());
            resourcesByScope.put(node.getScopeName(), ids);
            resourceIds.addAll(ids);
        }

        List<ScopeUsageStatistics> result = new ArrayList<>();
        Map<String, List<UsageSample>> samples;
        try {
            samples = ingestion.fetch(resourceIds, item, start, end, deadline);
        } catch (PartialResultException e) {
            throw new PartialResultException(e.getMessage(), result);
        }
        if (log.isDebugEnabled()) {
            log.debug("Aggregating {} samples of {} resources into {} buckets for {} scopes", item,
                    resourceIds.size(), n, nodes.size());
        }
        for (HierarchyNode node : nodes) {
            deadline.check("Usage statistics query", result);
            double[] sums = new double[n];
            for (String resourceId : resourcesByScope.get(node.getScopeName())) {
                List<Bucket> resourceBuckets = Bucketizer.bucketize(
                        samples.getOrDefault(resourceId, Collections.emptyList()), start, end, n);
                for (int i = 0; i < n; i++) {
                    sums[i] += resourceBuckets.get(i).getValue();
                }
            }
            List<Bucket> scopeBuckets = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                scopeBuckets.add(new Bucket(bounds[i], bounds[i + 1], sums[i]));
            }
            result.add(new ScopeUsageStatistics(node.getScopeName(), node.getName(), scopeBuckets));
        }
        timer.observeDuration();
        return result;
    }

    /**
     * Sum of the quotas of a scope instance, or of every instance of the scope type when no uuid is given, read
     * from a single ledger snapshot.
     */
    public Map<String, Long> quotaStatistics(ScopeType aggregate, String scopeUuid) throws StratumServiceException {
        List<ScopeName> scopes = scopeNames(registry.getNodes(defaultAggregate(aggregate), scopeUuid));
        return snapshotOf(scopes).sumOfQuotas(scopes, Arrays.asList(ResourceType.values()));
    }

    /**
     * Quota limits and usages over time. Windows are aligned on the interval in UTC, the first one starting at
     * {@code from} and the last one truncated at {@code to}. Within a window each scope contributes the average
     * of the values in effect, the value at the window start and every change inside the window, and the
     * contributions are summed across scopes.
     */
    public List<QuotaTimelineBucket> quotaTimeline(Long from, Long to, TimelineInterval interval,
                                                   Collection<ResourceType> items, ScopeType aggregate,
                                                   String scopeUuid, QueryDeadline deadline)
            throws StratumServiceException {
        final Summary.Timer timer = queryLatency.labels("quota_timeline").startTimer();
        long end = to != null ? to : now();
        long start = from != null ? from : end - DEFAULT_TIMELINE_WINDOW_SECONDS;
        TimelineInterval unit = interval != null ? interval : TimelineInterval.day;
        if (start >= end) {
            throw new ValidationException("Invalid time range: from " + start + " must be before to " + end);
        }
        Collection<ResourceType> types = items == null || items.isEmpty()
                ? Arrays.asList(ResourceType.values()) : items;
        List<ScopeName> scopes = scopeNames(registry.getNodes(defaultAggregate(aggregate), scopeUuid));

        List<QuotaTimelineBucket> result = new ArrayList<>();
        long bucketStart = start;
        while (bucketStart < end) {
            deadline.check("Quota timeline query", result);
            long bucketEnd = Math.min(end, unit.next(unit.floor(bucketStart)));
            Map<String, Double> values = new LinkedHashMap<>();
            for (ResourceType type : types) {
                double limit = 0;
                boolean limited = false;
                double usage = 0;
                for (ScopeName scope : scopes) {
                    List<QuotaHistoryEntry> inEffect = valuesInEffect(QuotaKey.of(scope, type), bucketStart,
                            bucketEnd);
                    usage += inEffect.stream().mapToLong(QuotaHistoryEntry::getUsage).average().orElse(0);
                    List<Long> limits = inEffect.stream()
                            .map(QuotaHistoryEntry::getLimit)
                            .filter(l -> l != null)
                            .collect(Collectors.toList());
                    if (!limits.isEmpty()) {
                        limit += limits.stream().mapToLong(Long::longValue).average().orElse(0);
                        limited = true;
                    }
                }
                values.put(type.name(), limited ? limit : -1.0);
                values.put(type.usageName(), usage);
            }
            result.add(new QuotaTimelineBucket(bucketStart, bucketEnd, values));
            bucketStart = bucketEnd;
        }
        timer.observeDuration();
        return result;
    }

    private List<QuotaHistoryEntry> valuesInEffect(QuotaKey key, long from, long to) {
        List<QuotaHistoryEntry> values = new ArrayList<>();
        QuotaHistoryEntry atStart = history.valueAt(key, from);
        values.add(atStart != null ? atStart : new QuotaHistoryEntry(from, null, 0, 0));
        values.addAll(history.changesBetween(key, from, to));
        return values;
    }

    /**
     * Number of scopes of a type created in each bucket.
     */
    public List<Bucket> creationTimeStatistics(ScopeType type, Long from, Long to, Integer buckets)
            throws StratumServiceException {
        long end = to != null ? to : now();
        long start = from != null ? from : end - DEFAULT_CREATION_TIME_WINDOW_SECONDS;
        int n = buckets != null ? buckets : config.getStatisticsDefaultBucketCount();
        List<Long> createdAt = registry.getNodes(defaultAggregate(type)).stream()
                .map(HierarchyNode::getCreatedAt)
                .collect(Collectors.toList());
        return Bucketizer.count(createdAt, start, end, n);
    }

    /**
     * Number of matching alerts per severity; every severity is present.
     */
    public Map<AlertSeverity, Long> alertStatistics(AlertStatisticsQuery query) throws StratumServiceException {
        Set<ScopeName> scopes = null;
        if (query.getAggregate() != null && StringUtils.isNotBlank(query.getScopeUuid())) {
            scopes = scopeAndDescendants(ScopeName.get(query.getAggregate(), query.getScopeUuid()));
        } else if (query.getAggregate() != null || StringUtils.isNotBlank(query.getScopeUuid())) {
            throw new ValidationException("Alert scope filter needs both an aggregate and a uuid");
        }
        Map<AlertSeverity, Long> counts = new EnumMap<>(AlertSeverity.class);
        for (AlertSeverity severity : AlertSeverity.values()) {
            counts.put(severity, 0L);
        }
        for (Alert alert : alertRegistry.getAlerts()) {
            if (matches(alert, query, scopes)) {
                counts.merge(alert.getSeverity(), 1L, Long::sum);
            }
        }
        return counts;
    }

    private static boolean matches(Alert alert, AlertStatisticsQuery query, Set<ScopeName> scopes) {
        if (query.getOpenedFrom() != null && alert.getOpenedAt() < query.getOpenedFrom()) {
            return false;
        }
        if (query.getOpenedTo() != null && alert.getOpenedAt() >= query.getOpenedTo()) {
            return false;
        }
        if (scopes != null && !scopes.contains(alert.getScope())) {
            return false;
        }
        if (query.getTypes() != null && !query.getTypes().isEmpty() && !query.getTypes().contains(alert.getType())) {
            return false;
        }
        if (query.getAcknowledged() != null && alert.isAcknowledged() != query.getAcknowledged()) {
            return false;
        }
        return query.getOpened() == null || alert.isClosed() != query.getOpened();
    }

    private Set<ScopeName> scopeAndDescendants(ScopeName scope) throws StratumServiceException {
        registry.getNode(scope);
        Set<ScopeName> scopes = new HashSet<>();
        scopes.add(scope);
        if (scope.getType() == ScopeType.Customer) {
            for (ProjectGroup group : registry.projectGroupsOf(scope.getUuid())) {
                scopes.add(group.getScopeName());
            }
        }
        for (Project project : registry.projectsUnder(scope)) {
            scopes.add(project.getScopeName());
        }
        return scopes;
    }

    /**
     * Per customer: its projects, project groups, live resources and quota statistics.
     */
    public List<CustomerSummary> customerSummary(QueryDeadline deadline) throws StratumServiceException {
        List<CustomerSummary> result = new ArrayList<>();
        LedgerSnapshot snapshot = ledger.snapshot();
        List<ResourceType> types = Arrays.asList(ResourceType.values());
        for (Customer customer : registry.getCustomers()) {
            deadline.check("Customer summary query", result);
            ScopeName scope = customer.getScopeName();
            int liveResources = (int) registry.resourcesUnder(scope).stream().filter(Resource::isLive).count();
            result.add(new CustomerSummary(customer.getUuid(), customer.getName(),
                    registry.projectsUnder(scope).size(), registry.projectGroupsOf(customer.getUuid()).size(),
                    liveResources, snapshot.sumOfQuotas(ImmutableList.of(scope), types)));
        }
        return result;
    }

    /**
     * Consumption of the live resources provisioned on a backend.
     */
    public ResourceBackendStatistics resourceStatistics(String backendRef) throws ValidationException {
        if (StringUtils.isBlank(backendRef)) {
            throw new ValidationException("Backend reference is required");
        }
        long vcpu = 0;
        long ram = 0;
        long storage = 0;
        long instances = 0;
        long volumes = 0;
        for (Resource resource : registry.getResources()) {
            if (!backendRef.equals(resource.getBackendRef()) || !resource.isLive()) {
                continue;
            }
            Map<ResourceType, Long> consumption = resource.consumptions();
            vcpu += consumption.get(ResourceType.vcpu);
            ram += consumption.get(ResourceType.ram);
            storage += consumption.get(ResourceType.storage);
            if (resource.getKind() == ResourceKind.INSTANCE) {
                instances++;
            } else {
                volumes++;
            }
        }
        return new ResourceBackendStatistics(backendRef, vcpu, ram, storage, instances, volumes);
    }

    private LedgerSnapshot snapshotOf(List<ScopeName> scopes) {
        List<QuotaKey> keys = new ArrayList<>();
        for (ScopeName scope : scopes) {
            for (ResourceType type : ResourceType.values()) {
                keys.add(QuotaKey.of(scope, type));
            }
        }
        return ledger.snapshot(keys);
    }

    private static List<ScopeName> scopeNames(List<HierarchyNode> nodes) {
        return nodes.stream().map(HierarchyNode::getScopeName).collect(Collectors.toList());
    }

    private static ScopeType defaultAggregate(ScopeType aggregate) {
        return aggregate != null ? aggregate : ScopeType.Customer;
    }

    private long now() {
        return clock.millis() / 1000;
    }

    private static final Logger log = LoggerFactory.getLogger(AggregationQueryEngine.class);

    private static final Summary queryLatency = Summary.build()
            .name("stratum_query_latency_seconds")
            .help("Latency of statistics queries")
            .labelNames("query")
            .quantile(0.5, 0.05)
            .quantile(0.99, 0.001)
            .register();
}
