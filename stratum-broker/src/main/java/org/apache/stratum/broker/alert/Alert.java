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

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.apache.stratum.common.naming.ScopeName;
import org.apache.stratum.common.policies.data.AlertSeverity;

/**
 * An alert raised against a scope. The subject narrows it to something inside the scope, a resource or a
 * quota, and is null for alerts about the scope itself. Instances are immutable; the registry replaces them on
 * acknowledgment and closing.
 */
@Getter
@ToString
@AllArgsConstructor
public final class Alert {
    private final String uuid;
    private final ScopeName scope;
    private final String subject;
    private final AlertSeverity severity;
    private final String type;
    private final String message;
    /** Epoch seconds. */
    private final long openedAt;
    /** Epoch seconds, null while the alert is open. */
    private final Long closedAt;
    private final boolean acknowledged;

    public boolean isClosed() {
        return closedAt != null;
    }

    Alert withAcknowledged(boolean acknowledged) {
        return new Alert(uuid, scope, subject, severity, type, message, openedAt, closedAt, acknowledged);
    }

    Alert closedAt(long timestamp) {
        return new Alert(uuid, scope, subject, severity, type, message, openedAt, timestamp, acknowledged);
    }
}
