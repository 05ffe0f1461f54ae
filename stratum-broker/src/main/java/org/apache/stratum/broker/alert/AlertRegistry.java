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
package org.apache.stratum.broker.alert;

import com.google.common.collect.ImmutableList;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.apache.stratum.broker.StratumServiceException.ValidationException;
import org.apache.stratum.common.naming.ScopeName;
import org.apache.stratum.common.policies.data.AlertSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds alerts raised by monitoring rules and by the quota threshold handler. At most one alert of a given type
 * is open for a scope and subject at a time.
 */
public class AlertRegistry {

    private final ConcurrentHashMap<String, Alert> alerts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<OpenAlertKey, String> openAlerts = new ConcurrentHashMap<>();
    private final Clock clock;

    public AlertRegistry() {
        this(Clock.systemUTC());
    }

    public AlertRegistry(Clock clock) {
        this.clock = clock;
    }

    @ToString
    @EqualsAndHashCode
    private static final class OpenAlertKey {
        private final ScopeName scope;
        private final String subject;
        private final String type;

        private OpenAlertKey(ScopeName scope, String subject, String type) {
            this.scope = scope;
            this.subject = subject;
            this.type = type;
        }
    }

    /**
     * Open an alert, or return the alert of the same type already open for the scope and subject.
     */
    public Alert open(ScopeName scope, String subject, AlertSeverity severity, String type, String message) {
        Objects.requireNonNull(scope);
        Objects.requireNonNull(type);
        OpenAlertKey key = new OpenAlertKey(scope, subject, type);
        String uuid = openAlerts.computeIfAbsent(key, k -> {
            Alert alert = new Alert(UUID.randomUUID().toString(), scope, subject, severity, type, message,
                    now(), null, false);
            alerts.put(alert.getUuid(), alert);
            log.info("Opened alert {}", alert);
            return alert.getUuid();
        });
        return alerts.get(uuid);
    }

    /**
     * Close the open alert of the given type for the scope and subject, if any.
     */
    public Optional<Alert> close(ScopeName scope, String subject, String type) {
        String uuid = openAlerts.remove(new OpenAlertKey(scope, subject, type));
        if (uuid == null) {
            return Optional.empty();
        }
        Alert closed = alerts.computeIfPresent(uuid, (id, alert) -> alert.isClosed() ? alert : alert.closedAt(now()));
        if (log.isDebugEnabled()) {
            log.debug("Closed alert {}", closed);
        }
        return Optional.ofNullable(closed);
    }

    public Alert acknowledge(String uuid) throws ValidationException {
        return setAcknowledged(uuid, true);
    }

    public Alert cancelAcknowledgment(String uuid) throws ValidationException {
        return setAcknowledged(uuid, false);
    }

    private Alert setAcknowledged(String uuid, boolean acknowledged) throws ValidationException {
        Alert alert = alerts.get(uuid);
        if (alert == null) {
            throw new ValidationException("Alert " + uuid + " does not exist");
        }
        if (alert.isAcknowledged() == acknowledged) {
            throw new ValidationException(acknowledged
                    ? "Alert " + uuid + " is already acknowledged" : "Alert " + uuid + " is not acknowledged");
        }
        return alerts.computeIfPresent(uuid, (id, current) -> current.withAcknowledged(acknowledged));
    }

    public Optional<Alert> get(String uuid) {
        return Optional.ofNullable(alerts.get(uuid));
    }

    public Collection<Alert> getAlerts() {
        return ImmutableList.copyOf(alerts.values());
    }

    /**
     * Close every open alert whose scope no longer exists.
     *
     * @return the closed alerts
     */
    public List<Alert> closeAlertsWithoutScope(Predicate<ScopeName> scopeExists) {
        List<Alert> closed = new ArrayList<>();
        for (OpenAlertKey key : ImmutableList.copyOf(openAlerts.keySet())) {
            if (!scopeExists.test(key.scope)) {
                close(key.scope, key.subject, key.type).ifPresent(alert -> {
                    log.error("Closed alert {} of type {}: its scope {} does not exist", alert.getUuid(),
                            alert.getType(), alert.getScope());
                    closed.add(alert);
                });
            }
        }
        return closed;
    }

    /**
     * Remove the alerts closed before the cutoff, in epoch seconds. Open alerts are kept whatever their age.
     *
     * @return the number of removed alerts
     */
    public int purgeClosedBefore(long cutoffTimestamp) {
        int purged = 0;
        for (Alert alert : ImmutableList.copyOf(alerts.values())) {
            if (alert.isClosed() && alert.getClosedAt() < cutoffTimestamp
                    && alerts.remove(alert.getUuid(), alert)) {
                purged++;
            }
        }
        if (purged > 0) {
            log.info("Purged {} alerts closed before {}", purged, cutoffTimestamp);
        }
        return purged;
    }

    private long now() {
        return clock.millis() / 1000;
    }

    private static final Logger log = LoggerFactory.getLogger(AlertRegistry.class);
}
