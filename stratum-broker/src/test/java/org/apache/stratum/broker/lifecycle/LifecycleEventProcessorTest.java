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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.stratum.broker.ServiceConfiguration;
import org.apache.stratum.broker.StratumServiceException;
import org.apache.stratum.broker.StratumServiceException.OutOfOrderEventException;
import org.apache.stratum.broker.StratumServiceException.QuotaRecordMissingException;
import org.apache.stratum.broker.StratumServiceException.ValidationException;
import org.apache.stratum.broker.quota.QuotaLedger;
import org.apache.stratum.broker.structure.Resource;
import org.apache.stratum.broker.structure.StructureRegistry;
import org.apache.stratum.common.naming.ScopeName;
import org.apache.stratum.common.policies.data.ResourceFigures;
import org.apache.stratum.common.policies.data.ResourceKind;
import org.apache.stratum.common.policies.data.ResourceState;
import org.apache.stratum.common.policies.data.ResourceType;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class LifecycleEventProcessorTest {

    private final ScopeName customer = ScopeName.customer("c1");
    private final ScopeName group = ScopeName.projectGroup("g1");
    private final ScopeName project = ScopeName.project("p1");

    private final AtomicLong nanos = new AtomicLong();
    private ServiceConfiguration config;
    private QuotaLedger ledger;
    private StructureRegistry registry;
    private LifecycleEventProcessor processor;

    @BeforeMethod
    public void setup() throws Exception {
        nanos.set(0);
        config = new ServiceConfiguration();
        config.setLifecycleMaxParkedEventsPerResource(2);
        config.setLifecycleParkedEventTtlSeconds(60);
        ledger = new QuotaLedger();
        registry = new StructureRegistry(ledger);
        registry.createCustomer("c1", "acme", 0);
        registry.createProjectGroup("g1", "backend", "c1", 0);
        registry.createProject("p1", "api", "c1", 0);
        registry.createProject("p2", "web", "c1", 0);
        processor = new LifecycleEventProcessor(registry, ledger, config, nanos::get);
    }

    private static LifecycleEvent event(String resourceId, ResourceState transition, long sequence,
                                        ResourceFigures figures) {
        return LifecycleEvent.builder()
                .resourceId(resourceId)
                .projectId("p1")
                .backendRef("kvm-1")
                .transition(transition)
                .sequenceNumber(sequence)
                .figures(figures)
                .timestamp(1000 + sequence)
                .build();
    }

    private long usage(ScopeName scope, ResourceType type) throws Exception {
        return ledger.get(scope, type).getUsage();
    }

    @Test
    public void testCustomerUsageFollowsInstances() throws Exception {
        processor.applyEvent(event("r1", ResourceState.ACTIVE, 1, ResourceFigures.of(1, 1024, 10240)));
        processor.applyEvent(event("r2", ResourceState.PROVISIONING, 1, ResourceFigures.of(3, 2048, 0)));
        processor.applyEvent(event("r2", ResourceState.ACTIVE, 2, null));

        assertEquals(usage(customer, ResourceType.vcpu), 4);
        assertEquals(usage(project, ResourceType.vcpu), 4);
        assertEquals(usage(customer, ResourceType.ram), 3072);
        assertEquals(usage(customer, ResourceType.max_instances), 2);

        processor.applyEvent(event("r2", ResourceState.DELETING, 3, null));
        assertEquals(usage(customer, ResourceType.vcpu), 1);
        assertEquals(usage(customer, ResourceType.max_instances), 1);

        // Already released, the final deletion gives back nothing more.
        processor.applyEvent(event("r2", ResourceState.DELETED, 4, null));
        assertEquals(usage(customer, ResourceType.vcpu), 1);
        assertEquals(usage(project, ResourceType.ram), 1024);
    }

    @Test
    public void testResizeAppliesTheDifference() throws Exception {
        registry.addProjectToGroup("p1", "g1");
        processor.applyEvent(event("r1", ResourceState.ACTIVE, 1, ResourceFigures.of(2, 2048, 0)));
        processor.applyEvent(event("r1", ResourceState.RESIZING, 2, ResourceFigures.of(4, 1024, 0)));
        processor.applyEvent(event("r1", ResourceState.ACTIVE, 3, null));

        assertEquals(usage(group, ResourceType.vcpu), 4);
        assertEquals(usage(group, ResourceType.ram), 1024);
        assertEquals(usage(customer, ResourceType.max_instances), 1);
        Resource resource = registry.getResource("r1");
        assertEquals(resource.getStatus().getState(), ResourceState.ACTIVE);
        assertEquals(resource.getStatus().getFigures(), ResourceFigures.of(4, 1024, 0));
    }

    @Test
    public void testVolumesDoNotCountAsInstances() throws Exception {
        processor.applyEvent(LifecycleEvent.builder()
                .resourceId("v1")
                .projectId("p1")
                .kind(ResourceKind.VOLUME)
                .transition(ResourceState.ACTIVE)
                .sequenceNumber(1)
                .figures(ResourceFigures.of(0, 0, 51200))
                .build());
        assertEquals(usage(project, ResourceType.storage), 51200);
        assertEquals(usage(project, ResourceType.max_instances), 0);
    }

    @Test
    public void testReplayIsIdempotent() throws Exception {
        LifecycleEvent active = event("r1", ResourceState.ACTIVE, 1, ResourceFigures.of(2, 512, 0));
        LifecycleEvent deleting = event("r1", ResourceState.DELETING, 2, null);
        processor.applyEvent(active);
        processor.applyEvent(deleting);
        long sequence = ledger.getCommitSequence();

        OutOfOrderEventException e = expectThrows(OutOfOrderEventException.class, () -> processor.applyEvent(active));
        assertTrue(e.isDuplicate());
        e = expectThrows(OutOfOrderEventException.class, () -> processor.applyEvent(deleting));
        assertTrue(e.isDuplicate());

        assertEquals(ledger.getCommitSequence(), sequence);
        assertEquals(usage(customer, ResourceType.vcpu), 0);
        assertEquals(processor.getParkedEventCount("r1"), 0);
    }

    @Test
    public void testParkedEventsAreAppliedInOrder() throws Exception {
        LifecycleEvent third = event("r1", ResourceState.DELETING, 3, null);
        LifecycleEvent second = event("r1", ResourceState.RESIZING, 2, ResourceFigures.of(8, 0, 0));

        OutOfOrderEventException e = expectThrows(OutOfOrderEventException.class,
                () -> processor.applyEvent(third));
        assertFalse(e.isDuplicate());
        expectThrows(OutOfOrderEventException.class, () -> processor.applyEvent(second));
        assertEquals(processor.getParkedEventCount("r1"), 2);
        assertNull(registry.getResource("r1"));
        assertEquals(usage(customer, ResourceType.vcpu), 0);

        processor.applyEvent(event("r1", ResourceState.ACTIVE, 1, ResourceFigures.of(2, 0, 0)));
        assertEquals(processor.getParkedEventCount("r1"), 0);
        assertEquals(registry.getResource("r1").getStatus().getLastSequence(), 3);
        assertEquals(registry.getResource("r1").getStatus().getState(), ResourceState.DELETING);
        assertEquals(usage(customer, ResourceType.vcpu), 0);

        // Resubmitting a drained event is a duplicate.
        assertTrue(expectThrows(OutOfOrderEventException.class, () -> processor.applyEvent(second)).isDuplicate());
    }

    @Test
    public void testParkingIsBounded() throws Exception {
        for (long sequence = 3; sequence <= 5; sequence++) {
            LifecycleEvent e = event("r1", ResourceState.ACTIVE, sequence, ResourceFigures.of(1, 0, 0));
            expectThrows(OutOfOrderEventException.class, () -> processor.applyEvent(e));
        }
        assertEquals(processor.getParkedEventCount("r1"), 2);
    }

    @Test
    public void testParkedEventsExpire() throws Exception {
        LifecycleEvent second = event("r1", ResourceState.RESIZING, 2, ResourceFigures.of(8, 0, 0));
        expectThrows(OutOfOrderEventException.class, () -> processor.applyEvent(second));
        assertEquals(processor.getParkedEventCount("r1"), 1);

        nanos.addAndGet(TimeUnit.SECONDS.toNanos(61));
        processor.applyEvent(event("r1", ResourceState.ACTIVE, 1, ResourceFigures.of(2, 0, 0)));
        assertEquals(registry.getResource("r1").getStatus().getLastSequence(), 1);
        assertEquals(processor.getParkedEventCount("r1"), 0);
        assertEquals(usage(customer, ResourceType.vcpu), 2);

        processor.applyEvent(second);
        assertEquals(usage(customer, ResourceType.vcpu), 8);
    }

    @Test
    public void testInvalidEvents() throws Exception {
        expectThrows(ValidationException.class,
                () -> processor.applyEvent(event("r1", ResourceState.DELETING, 1, null)));
        expectThrows(ValidationException.class,
                () -> processor.applyEvent(event("r1", ResourceState.ACTIVE, 0, ResourceFigures.of(1, 0, 0))));
        expectThrows(ValidationException.class,
                () -> processor.applyEvent(event("r1", ResourceState.ACTIVE, 1, null)));

        processor.applyEvent(event("r1", ResourceState.ACTIVE, 1, ResourceFigures.of(1, 0, 0)));
        processor.applyEvent(event("r1", ResourceState.DELETED, 2, null));
        expectThrows(ValidationException.class,
                () -> processor.applyEvent(event("r1", ResourceState.ACTIVE, 3, ResourceFigures.of(1, 0, 0))));
        assertEquals(registry.getResource("r1").getStatus().getLastSequence(), 2);
    }

    @Test
    public void testEventFromAnotherProjectIsRejected() throws Exception {
        processor.applyEvent(event("r1", ResourceState.ACTIVE, 1, ResourceFigures.of(1, 0, 0)));
        expectThrows(ValidationException.class, () -> processor.applyEvent(LifecycleEvent.builder()
                .resourceId("r1")
                .projectId("p2")
                .transition(ResourceState.DELETING)
                .sequenceNumber(2)
                .build()));
        assertEquals(usage(customer, ResourceType.vcpu), 1);
    }

    @Test
    public void testLedgerFailureLeavesSequenceUnconsumed() throws Exception {
        ledger.removeScope(customer);
        LifecycleEvent active = event("r1", ResourceState.ACTIVE, 1, ResourceFigures.of(2, 0, 0));
        expectThrows(QuotaRecordMissingException.class, () -> processor.applyEvent(active));
        assertEquals(usage(project, ResourceType.vcpu), 0);
        assertEquals(registry.getResource("r1").getStatus().getLastSequence(), 0);

        ledger.createScope(customer);
        processor.applyEvent(active);
        assertEquals(usage(project, ResourceType.vcpu), 2);
        assertEquals(usage(customer, ResourceType.vcpu), 2);
    }

    @Test
    public void testEventForProjectNotCreatedYetIsRetryable() throws Exception {
        LifecycleEvent active = LifecycleEvent.builder()
                .resourceId("r9")
                .projectId("p9")
                .transition(ResourceState.ACTIVE)
                .sequenceNumber(1)
                .figures(ResourceFigures.of(2, 0, 0))
                .build();
        QuotaRecordMissingException e = expectThrows(QuotaRecordMissingException.class,
                () -> processor.applyEvent(active));
        assertTrue(StratumServiceException.isRetryable(e));
        assertNull(registry.getResource("r9"));

        registry.createProject("p9", "batch", "c1", 0);
        processor.applyEvent(active);
        assertEquals(usage(ScopeName.project("p9"), ResourceType.vcpu), 2);
        assertEquals(usage(customer, ResourceType.vcpu), 2);
        assertEquals(registry.getResource("r9").getStatus().getLastSequence(), 1);
    }
}
