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
package org.apache.stratum.broker.quota;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotNull;
import static org.testng.Assert.assertTrue;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.apache.stratum.broker.alert.Alert;
import org.apache.stratum.broker.alert.AlertRegistry;
import org.apache.stratum.common.naming.ScopeName;
import org.apache.stratum.common.policies.data.AlertSeverity;
import org.apache.stratum.common.policies.data.ResourceType;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class QuotaThresholdAlertHandlerTest {

    private final ScopeName customer = ScopeName.customer("c1");
    private final AtomicReference<Double> threshold = new AtomicReference<>(0.8);

    private QuotaLedger ledger;
    private AlertRegistry alertRegistry;

    @BeforeMethod
    public void setup() throws Exception {
        threshold.set(0.8);
        ledger = new QuotaLedger();
        alertRegistry = new AlertRegistry();
        ledger.addListener(new QuotaThresholdAlertHandler(alertRegistry, threshold::get));
        ledger.createScope(customer);
        ledger.setLimit(customer, ResourceType.vcpu, 10L);
    }

    private List<Alert> openAlerts() {
        return alertRegistry.getAlerts().stream()
                .filter(alert -> !alert.isClosed())
                .collect(Collectors.toList());
    }

    @Test
    public void testOpensAndClosesAlert() throws Exception {
        ledger.adjust(customer, ResourceType.vcpu, 8);
        assertTrue(openAlerts().isEmpty());

        ledger.adjust(customer, ResourceType.vcpu, 1);
        List<Alert> open = openAlerts();
        assertEquals(open.size(), 1);
        Alert alert = open.get(0);
        assertEquals(alert.getType(), QuotaThresholdAlertHandler.ALERT_TYPE);
        assertEquals(alert.getSubject(), "vcpu");
        assertEquals(alert.getScope(), customer);
        assertEquals(alert.getSeverity(), AlertSeverity.Warning);

        // Still over threshold, no second alert.
        ledger.adjust(customer, ResourceType.vcpu, 1);
        assertEquals(openAlerts().size(), 1);
        assertEquals(alertRegistry.getAlerts().size(), 1);

        ledger.adjust(customer, ResourceType.vcpu, -5);
        assertTrue(openAlerts().isEmpty());
        Alert closed = alertRegistry.get(alert.getUuid()).get();
        assertTrue(closed.isClosed());
        assertNotNull(closed.getClosedAt());
    }

    @Test
    public void testLiftingTheLimitClosesAlert() throws Exception {
        ledger.adjust(customer, ResourceType.vcpu, 9);
        assertEquals(openAlerts().size(), 1);

        ledger.setLimit(customer, ResourceType.vcpu, null);
        assertTrue(openAlerts().isEmpty());
    }

    @Test
    public void testThresholdIsReadOnEveryChange() throws Exception {
        ledger.adjust(customer, ResourceType.vcpu, 6);
        assertTrue(openAlerts().isEmpty());

        threshold.set(0.5);
        ledger.adjust(customer, ResourceType.ram, 100);
        assertTrue(openAlerts().isEmpty());

        ledger.adjust(customer, ResourceType.vcpu, 1);
        assertEquals(openAlerts().size(), 1);
        assertFalse(openAlerts().get(0).isAcknowledged());
    }
}
