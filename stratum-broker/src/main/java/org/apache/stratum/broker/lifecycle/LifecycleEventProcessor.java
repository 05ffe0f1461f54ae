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
package org.apache.stratum.broker.lifecycle;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Striped;
import io.prometheus.client.Counter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import org.apache.commons.lang3.StringUtils;
import org.apache.stratum.broker.ServiceConfiguration;
import org.apache.stratum.broker.StratumServiceException;
import org.apache.stratum.broker.StratumServiceException.OutOfOrderEventException;
import org.apache.stratum.broker.StratumServiceException.QuotaRecordMissingException;
import org.apache.stratum.broker.StratumServiceException.ScopeNotFoundException;
import org.apache.stratum.broker.StratumServiceException.ValidationException;
import org.apache.stratum.broker.quota.QuotaAdjustment;
import org.apache.stratum.broker.quota.QuotaLedger;
import org.apache.stratum.broker.structure.Resource;
import org.apache.stratum.broker.structure.StructureRegistry;
import org.apache.stratum.common.naming.ScopeName;
import org.apache.stratum.common.policies.data.ResourceFigures;
import org.apache.stratum.common.policies.data.ResourceState;
import org.apache.stratum.common.policies.data.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates resource lifecycle events into quota ledger adjustments, exactly once per event.
 * <p>
 * Events of one resource are applied one at a time and strictly in sequence order; events of different
 * resources proceed in parallel. An event ahead of the expected sequence is parked until its predecessors
 * arrive and is still reported to the caller as out of order. A failed ledger adjustment leaves the sequence
 * number unconsumed so that the event can be retried.
 */
public class LifecycleEventProcessor {

    private final StructureRegistry registry;
    private final QuotaLedger ledger;
    private final ServiceConfiguration config;
    private final Ticker ticker;

    private final Striped<Lock> resourceLocks = Striped.lock(256);
    private final Cache<String, ParkedEvents> parkedEvents;

    public LifecycleEventProcessor(StructureRegistry registry, QuotaLedger ledger, ServiceConfiguration config) {
        this(registry, ledger, config, Ticker.systemTicker());
    }

    // Visibility for testing.
    LifecycleEventProcessor(StructureRegistry registry, QuotaLedger ledger, ServiceConfiguration config,
                            Ticker ticker) {
        this.registry = registry;
        this.ledger = ledger;
        this.config = config;
        this.ticker = ticker;
        this.parkedEvents = Caffeine.newBuilder()
                .ticker(ticker)
                .expireAfterAccess(config.getLifecycleParkedEventTtlSeconds(), TimeUnit.SECONDS)
                .build();
    }

    /**
     * Apply a lifecycle event to the ledger.
     *
     * @throws OutOfOrderEventException if the event is not the next one of its resource; a duplicate was
     *                                  already applied, a later event is parked and retryable
     * @throws QuotaRecordMissingException if a scope of the resource has no quota record; retryable
     * @throws ValidationException if the event is malformed or the transition is not allowed
     */
    public void applyEvent(LifecycleEvent event) throws StratumServiceException {
        validate(event);
        Lock lock = resourceLocks.get(event.getResourceId());
        lock.lock();
        try {
            try {
                applyInOrder(event);
            } catch (OutOfOrderEventException e) {
                if (!e.isDuplicate()) {
                    park(event);
                }
                eventsRejected.labels(e.isDuplicate() ? "duplicate" : "out_of_order").inc();
                throw e;
            } catch (StratumServiceException e) {
                eventsRejected.labels(e instanceof ValidationException ? "invalid" : "ledger").inc();
                throw e;
            }
            drainParked(event.getResourceId());
        } finally {
            lock.unlock();
        }
    }

    private void applyInOrder(LifecycleEvent event) throws StratumServiceException {
        Resource resource = registry.getResource(event.getResourceId());
        long expected = resource == null ? 1 : resource.getStatus().getLastSequence() + 1;
        if (event.getSequenceNumber() != expected) {
            throw new OutOfOrderEventException(event.getResourceId(), expected, event.getSequenceNumber());
        }
        if (resource == null) {
            if (!event.getTransition().isCreating()) {
                throw new ValidationException("Resource " + event.getResourceId() + " is unknown, its first event "
                        + "must be PROVISIONING or ACTIVE but was " + event.getTransition());
            }
            try {
                resource = registry.registerResource(event.getResourceId(), event.getProjectId(), event.getKind(),
                        event.getBackendRef(), event.getTimestamp());
            } catch (ScopeNotFoundException e) {
                // Retryable, the project may not be created yet.
                throw new QuotaRecordMissingException("Project " + event.getProjectId() + " of resource "
                        + event.getResourceId() + " has no quota records yet");
            }
        }
        if (!resource.getProjectUuid().equals(event.getProjectId())) {
            throw new ValidationException("Resource " + event.getResourceId() + " belongs to project "
                    + resource.getProjectUuid() + ", not " + event.getProjectId());
        }

        Resource.Status status = resource.getStatus();
        ResourceState from = status.getState();
        ResourceState to = event.getTransition();
        if (from == null ? !to.isCreating() : !from.canTransitionTo(to)) {
            throw new ValidationException("Invalid transition of resource " + event.getResourceId() + " from "
                    + from + " to " + to);
        }

        ResourceFigures newFigures = from == null ? event.getFigures() : status.getFigures();
        boolean released = status.isReleased();
        List<QuotaAdjustment> adjustments = new ArrayList<>();
        if (released) {
            // The figures were already given back by an earlier releasing transition.
            if (log.isDebugEnabled()) {
                log.debug("Resource {} is already released, {} applies nothing", resource.getUuid(), to);
            }
        } else if (to.isReleasing()) {
            addAdjustments(adjustments, resource, status.getFigures(), null);
            released = true;
        } else {
            if (event.getFigures() != null) {
                newFigures = event.getFigures();
            }
            addAdjustments(adjustments, resource, from == null ? null : status.getFigures(), newFigures);
        }

        if (!adjustments.isEmpty()) {
            ledger.adjust(adjustments);
        }
        resource.setStatus(new Resource.Status(to, newFigures, event.getSequenceNumber(), released));
        eventsApplied.labels(to.name()).inc();
        if (log.isDebugEnabled()) {
            log.debug("Applied {} to {} with {} adjustments", event, resource, adjustments.size());
        }
    }

    /**
     * Adds, for every ancestor of the resource, the per resource type difference between the new and the old
     * consumption. Null figures do not count toward usage.
     */
    private static void addAdjustments(List<QuotaAdjustment> adjustments, Resource resource,
                                       ResourceFigures oldFigures, ResourceFigures newFigures) {
        Map<ResourceType, Long> deltas = new TreeMap<>();
        for (ResourceType type : ResourceType.values()) {
            long oldValue = oldFigures == null ? 0 : type.consumptionOf(oldFigures, resource.getKind());
            long newValue = newFigures == null ? 0 : type.consumptionOf(newFigures, resource.getKind());
            if (newValue != oldValue) {
                deltas.put(type, newValue - oldValue);
            }
        }
        for (ScopeName scope : resource.getAncestors()) {
            deltas.forEach((type, delta) -> adjustments.add(QuotaAdjustment.of(scope, type, delta)));
        }
    }

    private void park(LifecycleEvent event) {
        int maxParked = config.getLifecycleMaxParkedEventsPerResource();
        ParkedEvents parked = parkedEvents.get(event.getResourceId(), id -> new ParkedEvents());
        if (!parked.park(event, ticker.read(), maxParked)) {
            log.warn("Not parking out of order event {}: {} events already parked for the resource", event,
                    maxParked);
        }
    }

    private void drainParked(String resourceId) {
        ParkedEvents parked = parkedEvents.getIfPresent(resourceId);
        if (parked == null) {
            return;
        }
        long ttlNanos = TimeUnit.SECONDS.toNanos(config.getLifecycleParkedEventTtlSeconds());
        while (true) {
            Resource resource = registry.getResource(resourceId);
            long expected = resource == null ? 1 : resource.getStatus().getLastSequence() + 1;
            LifecycleEvent next = parked.poll(expected, ticker.read() - ttlNanos);
            if (next == null) {
                break;
            }
            try {
                applyInOrder(next);
                log.info("Applied parked event {}", next);
            } catch (StratumServiceException e) {
                if (StratumServiceException.isRetryable(e)) {
                    parked.park(next, ticker.read(), Integer.MAX_VALUE);
                    log.warn("Parked event {} could not be applied yet: {}", next, e.getMessage());
                } else {
                    log.error("Dropping parked event {}, it will be rejected when resubmitted", next, e);
                }
                break;
            }
        }
        if (parked.isEmpty()) {
            parkedEvents.asMap().remove(resourceId, parked);
        }
    }

    @VisibleForTesting
    int getParkedEventCount(String resourceId) {
        ParkedEvents parked = parkedEvents.getIfPresent(resourceId);
        return parked == null ? 0 : parked.size();
    }

    private static void validate(LifecycleEvent event) throws ValidationException {
        if (event == null || StringUtils.isBlank(event.getResourceId()) || StringUtils.isBlank(event.getProjectId())
                || event.getTransition() == null || event.getKind() == null) {
            throw new ValidationException("Malformed lifecycle event " + event);
        }
        if (event.getSequenceNumber() < 1) {
            throw new ValidationException("Invalid sequence number " + event.getSequenceNumber() + " of event "
                    + event);
        }
        if (event.getTransition().isCreating() && event.getFigures() == null) {
            throw new ValidationException("Event " + event + " carries no consumption figures");
        }
    }

    /**
     * Out of order events of one resource, keyed by sequence number. Guarded by the resource lock.
     */
    private static final class ParkedEvents {
        private final TreeMap<Long, LifecycleEvent> events = new TreeMap<>();
        private final TreeMap<Long, Long> parkedAt = new TreeMap<>();

        synchronized boolean park(LifecycleEvent event, long now, int maxParked) {
            if (!events.containsKey(event.getSequenceNumber()) && events.size() >= maxParked) {
                return false;
            }
            events.put(event.getSequenceNumber(), event);
            parkedAt.put(event.getSequenceNumber(), now);
            return true;
        }

        /**
         * Removes and returns the event with the given sequence number, unless it was parked before the expiry
         * time. Expired events are dropped.
         */
        synchronized LifecycleEvent poll(long sequence, long expiredBefore) {
            Iterator<Map.Entry<Long, Long>> it = parkedAt.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<Long, Long> entry = it.next();
                if (entry.getValue() < expiredBefore) {
                    it.remove();
                    log.warn("Parked event {} expired before its predecessors arrived", events.remove(entry.getKey()));
                }
            }
            LifecycleEvent event = events.remove(sequence);
            if (event != null) {
                parkedAt.remove(sequence);
            }
            return event;
        }

        synchronized boolean isEmpty() {
            return events.isEmpty();
        }

        synchronized int size() {
            return events.size();
        }
    }

    private static final Logger log = LoggerFactory.getLogger(LifecycleEventProcessor.class);

    private static final Counter eventsApplied = Counter.build()
            .name("stratum_lifecycle_events_applied")
            .help("Number of lifecycle events applied to the quota ledger")
            .labelNames("transition")
            .register();
    private static final Counter eventsRejected = Counter.build()
            .name("stratum_lifecycle_events_rejected")
            .help("Number of lifecycle events rejected")
            .labelNames("reason")
            .register();
}
