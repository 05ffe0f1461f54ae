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
package org.apache.stratum.broker.reconciliation;

import io.prometheus.client.Counter;
import io.prometheus.client.Summary;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.stratum.broker.StratumServiceException.QuotaRecordMissingException;
import org.apache.stratum.broker.quota.LedgerSnapshot;
import org.apache.stratum.broker.quota.Quota;
import org.apache.stratum.broker.quota.QuotaKey;
import org.apache.stratum.broker.quota.QuotaLedger;
import org.apache.stratum.broker.structure.HierarchyNode;
import org.apache.stratum.broker.structure.MembershipListener;
import org.apache.stratum.broker.structure.Project;
import org.apache.stratum.broker.structure.Resource;
import org.apache.stratum.broker.structure.StructureRegistry;
import org.apache.stratum.common.naming.ScopeName;
import org.apache.stratum.common.naming.ScopeType;
import org.apache.stratum.common.policies.data.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recomputes the usage of every scope from the resources that currently count toward it and overwrites the
 * ledger where the two disagree.
 * <p>
 * The ledger versions are read before the resources are scanned, and each correction is a compare-and-set on
 * the version read: a quota changed by a lifecycle event during the pass is left for the next pass. A resource
 * that transitions while the pass runs may be counted with its old or its new figures, an error of at most one
 * event that the next pass corrects. Drift is never an error, only counted.
 */
public class ReconciliationJob implements MembershipListener {

    private final StructureRegistry registry;
    private final QuotaLedger ledger;

    public ReconciliationJob(StructureRegistry registry, QuotaLedger ledger) {
        this.registry = registry;
        this.ledger = ledger;
    }

    /**
     * Reconcile every scope of the hierarchy.
     */
    public ReconciliationResult reconcileAll() {
        final Summary.Timer timer = reconciliationLatency.startTimer();
        List<ScopeName> scopes = new ArrayList<>();
        for (ScopeType type : ScopeType.values()) {
            for (HierarchyNode node : registry.getNodes(type)) {
                scopes.add(node.getScopeName());
            }
        }
        ReconciliationResult result = reconcile(scopes);
        double seconds = timer.observeDuration();
        if (result.getCorrections().isEmpty()) {
            if (log.isDebugEnabled()) {
                log.debug("Reconciled {} quotas in {} ms, no drift", result.getQuotasChecked(), seconds * 1000);
            }
        } else {
            log.info("Reconciled {} quotas in {} ms, corrected {}, skipped {}", result.getQuotasChecked(),
                    seconds * 1000, result.getCorrections().size(), result.getSkipped());
        }
        return result;
    }

    /**
     * Reconcile a single scope.
     */
    public ReconciliationResult reconcileScope(ScopeName scope) {
        return reconcile(Collections.singletonList(scope));
    }

    @Override
    public void onMembershipChanged(ScopeName projectGroup, ScopeName project) {
        ReconciliationResult result = reconcileScope(projectGroup);
        if (!result.getCorrections().isEmpty()) {
            log.info("Corrected {} after {} membership change: {}", projectGroup, project, result.getCorrections());
        }
    }

    private ReconciliationResult reconcile(Collection<ScopeName> scopes) {
        List<QuotaKey> keys = new ArrayList<>();
        for (ScopeName scope : scopes) {
            for (ResourceType type : ResourceType.values()) {
                keys.add(QuotaKey.of(scope, type));
            }
        }
        LedgerSnapshot snapshot = ledger.snapshot(keys);

        Map<String, List<Resource>> resourcesByProject = new HashMap<>();
        for (Resource resource : registry.getResources()) {
            resourcesByProject.computeIfAbsent(resource.getProjectUuid(), p -> new ArrayList<>()).add(resource);
        }

        ReconciliationResult result = new ReconciliationResult();
        for (ScopeName scope : scopes) {
            Map<ResourceType, Long> trueUsage = new EnumMap<>(ResourceType.class);
            for (ResourceType type : ResourceType.values()) {
                trueUsage.put(type, 0L);
            }
            for (Project project : registry.projectsUnder(scope)) {
                for (Resource resource : resourcesByProject.getOrDefault(project.getUuid(),
                        Collections.emptyList())) {
                    resource.consumptions().forEach((type, value) -> trueUsage.merge(type, value, Long::sum));
                }
            }
            for (ResourceType type : ResourceType.values()) {
                Quota quota = snapshot.get(scope, type);
                if (quota == null) {
                    // Scope created or removed concurrently.
                    continue;
                }
                result.checked();
                long expected = trueUsage.get(type);
                if (quota.getUsage() != expected) {
                    correct(quota, expected, result);
                }
            }
        }
        return result;
    }

    private void correct(Quota quota, long trueUsage, ReconciliationResult result) {
        QuotaKey key = quota.getKey();
        try {
            if (!ledger.reconcile(key, quota.getVersion(), trueUsage)) {
                if (log.isDebugEnabled()) {
                    log.debug("Quota {} changed during reconciliation, leaving it for the next pass", key);
                }
                result.skipped();
                return;
            }
        } catch (QuotaRecordMissingException e) {
            log.info("Quota {} was removed during reconciliation", key);
            result.skipped();
            return;
        }
        ReconciliationResult.Correction correction =
                new ReconciliationResult.Correction(key, quota.getUsage(), trueUsage);
        result.corrected(correction);
        String type = key.getResourceType().name();
        reconciliationCorrections.labels(type).inc();
        reconciliationDrift.labels(type).inc(Math.abs(correction.getDrift()));
        log.warn("Corrected usage of {} from {} to {}", key, quota.getUsage(), trueUsage);
    }

    private static final Logger log = LoggerFactory.getLogger(ReconciliationJob.class);

    private static final Counter reconciliationCorrections = Counter.build()
            .name("stratum_reconciliation_corrections")
            .help("Number of quota usages corrected by reconciliation")
            .labelNames("resource_type")
            .register();
    private static final Counter reconciliationDrift = Counter.build()
            .name("stratum_reconciliation_drift")
            .help("Sum of absolute usage drift corrected by reconciliation")
            .labelNames("resource_type")
            .register();
    private static final Summary reconciliationLatency = Summary.build()
            .name("stratum_reconciliation_latency_seconds")
            .help("Duration of a full reconciliation pass")
            .quantile(0.5, 0.05)
            .quantile(0.9, 0.01)
            .quantile(0.99, 0.001)
            .register();
}
