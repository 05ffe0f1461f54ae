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

import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.apache.stratum.broker.alert.Alert;
import org.apache.stratum.broker.alert.AlertRegistry;
import org.apache.stratum.broker.lifecycle.LifecycleEvent;
import org.apache.stratum.broker.monitoring.MonitoringClient;
import org.apache.stratum.broker.quota.QuotaKey;
import org.apache.stratum.broker.quota.QuotaThresholdAlertHandler;
import org.apache.stratum.broker.structure.StructureRegistry;
import org.apache.stratum.common.naming.ScopeName;
import org.apache.stratum.common.policies.data.AlertSeverity;
import org.apache.stratum.common.policies.data.MonitoringItem;
import org.apache.stratum.common.policies.data.ResourceFigures;
import org.apache.stratum.common.policies.data.ResourceState;
import org.apache.stratum.common.policies.data.ResourceType;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class StratumServiceTest {

    private final ScopeName customer = ScopeName.customer("c1");
    private final ScopeName project = ScopeName.project("p1");

    private ServiceConfiguration config;
    private MonitoringClient client;
    private StratumService service;

    @BeforeMethod
    public void setup() throws Exception {
        config = new ServiceConfiguration();
        config.setReconciliationIntervalSeconds(1);
        config.setSampleIngestionIntervalSeconds(1);
        config.setLifecycleRetryInitialBackoffMillis(5);
        client = mock(MonitoringClient.class);
        when(client.fetchSamples(any(), any(), anyLong(), anyLong()))
                .thenReturn(CompletableFuture.completedFuture(Collections.emptyList()));
        service = new StratumService(config, client);

        StructureRegistry registry = service.getStructureRegistry();
        registry.createCustomer("c1", "acme", 0);
        registry.createProject("p1", "api", "c1", 0);
    }

    @AfterMethod(alwaysRun = true)
    public void cleanup() {
        service.close();
    }

    private LifecycleEvent event(String resourceId, ResourceState transition, long sequence,
                                 ResourceFigures figures) {
        return LifecycleEvent.builder()
                .resourceId(resourceId)
                .projectId("p1")
                .transition(transition)
                .sequenceNumber(sequence)
                .figures(figures)
                .build();
    }

    private List<Alert> openAlerts() {
        return service.getAlertRegistry().getAlerts().stream()
                .filter(alert -> !alert.isClosed())
                .collect(Collectors.toList());
    }

    @Test
    public void testSubmittedEventsReachLedgerAndAlerts() throws Exception {
        service.getLedger().setLimit(customer, ResourceType.vcpu, 4L);

        // Submitted out of order; the submitter retries until the first event arrives.
        CompletableFuture<Void> second = service.getLifecycleEventSubmitter()
                .submit(event("r1", ResourceState.RESIZING, 2, ResourceFigures.of(4, 0, 0)));
        service.getLifecycleEventSubmitter()
                .submit(event("r1", ResourceState.ACTIVE, 1, ResourceFigures.of(2, 0, 0)))
                .get(10, TimeUnit.SECONDS);
        second.get(10, TimeUnit.SECONDS);

        assertEquals(service.getLedger().get(customer, ResourceType.vcpu).getUsage(), 4);
        List<Alert> open = openAlerts();
        assertEquals(open.size(), 1);
        assertEquals(open.get(0).getType(), QuotaThresholdAlertHandler.ALERT_TYPE);
        assertEquals(open.get(0).getSeverity(), AlertSeverity.Warning);

        service.getLifecycleEventSubmitter()
                .submit(event("r1", ResourceState.DELETING, 3, null))
                .get(10, TimeUnit.SECONDS);
        assertTrue(openAlerts().isEmpty());
        assertEquals(service.getQuotaHistory().getHistory(QuotaKey.of(customer, ResourceType.vcpu)).size(), 4);
    }

    @Test
    public void testPeriodicTasks() throws Exception {
        service.getLifecycleEventProcessor().applyEvent(event("r1", ResourceState.ACTIVE, 1,
                ResourceFigures.of(2, 1024, 0)));
        service.getLedger().adjust(project, ResourceType.vcpu, 3);

        service.start();
        await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
                assertEquals(service.getLedger().get(project, ResourceType.vcpu).getUsage(), 2));
        await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
                verify(client, atLeastOnce()).fetchSamples(eq(Collections.singletonList("r1")),
                        eq(MonitoringItem.cpu), anyLong(), anyLong()));
    }

    @Test
    public void testReconciliationIsRescheduledWhenPeriodChanges() {
        config.setReconciliationIntervalSeconds(600);
        config.setSampleIngestionIntervalSeconds(600);
        service.start();
        assertEquals(service.getReconciliationPeriodInSeconds(), 600);

        config.setReconciliationIntervalSeconds(300);
        config.setSampleIngestionIntervalSeconds(120);
        service.reconcile();
        service.ingestSamples();
        assertEquals(service.getReconciliationPeriodInSeconds(), 300);
        assertEquals(service.getIngestionPeriodInSeconds(), 120);
    }

    @Test
    public void testPurgeClosesAlertsOfDeletedScopes() throws Exception {
        service.getAlertRegistry().open(project, "cpu", AlertSeverity.Error, "cpu_usage_is_high", "cpu at 99%");
        service.purgeExpired();
        assertEquals(openAlerts().size(), 1);

        service.getStructureRegistry().deleteProject("p1");
        service.purgeExpired();
        assertTrue(openAlerts().isEmpty());
        assertFalse(service.getLedger().hasScope(project));
    }

    @Test
    public void testPurgeRemovesAlertsClosedBeforeRetention() {
        Clock clock = mock(Clock.class);
        when(clock.millis()).thenReturn(TimeUnit.DAYS.toMillis(1));
        config.setClosedAlertRetentionDays(30);
        try (StratumService clocked = new StratumService(config, client, clock)) {
            AlertRegistry alerts = clocked.getAlertRegistry();
            alerts.open(customer, "vcpu", AlertSeverity.Warning, "quota_usage_is_over_threshold", "m");
            alerts.close(customer, "vcpu", "quota_usage_is_over_threshold");

            when(clock.millis()).thenReturn(TimeUnit.DAYS.toMillis(30));
            clocked.purgeExpired();
            assertEquals(alerts.getAlerts().size(), 1);

            when(clock.millis()).thenReturn(TimeUnit.DAYS.toMillis(32));
            clocked.purgeExpired();
            assertTrue(alerts.getAlerts().isEmpty());
        }
    }

    @Test
    public void testSlowIngestionDoesNotBlockReconciliation() throws Exception {
        CountDownLatch fetching = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(client.fetchSamples(any(), any(), anyLong(), anyLong())).thenAnswer(invocation -> {
            fetching.countDown();
            release.await(30, TimeUnit.SECONDS);
            return CompletableFuture.completedFuture(Collections.emptyList());
        });
        service.getLifecycleEventProcessor().applyEvent(event("r1", ResourceState.ACTIVE, 1,
                ResourceFigures.of(2, 0, 0)));
        service.getLedger().adjust(project, ResourceType.vcpu, 3);

        ExecutorService ingestion = Executors.newSingleThreadExecutor();
        try {
            Future<?> pass = ingestion.submit(service::ingestSamples);
            assertTrue(fetching.await(10, TimeUnit.SECONDS));

            CompletableFuture.runAsync(service::reconcile).get(10, TimeUnit.SECONDS);
            assertEquals(service.getLedger().get(project, ResourceType.vcpu).getUsage(), 2);
            assertEquals(service.getReconciliationPeriodInSeconds(), 0);

            release.countDown();
            pass.get(10, TimeUnit.SECONDS);
        } finally {
            release.countDown();
            ingestion.shutdownNow();
        }
    }
}
