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
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;
import static org.testng.Assert.fail;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.stratum.broker.StratumServiceException.QuotaExceededException;
import org.apache.stratum.broker.StratumServiceException.QuotaRecordMissingException;
import org.apache.stratum.common.naming.ScopeName;
import org.apache.stratum.common.policies.data.ResourceType;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class QuotaLedgerTest {

    private final ScopeName customer = ScopeName.customer("c1");
    private final ScopeName group = ScopeName.projectGroup("g1");
    private final ScopeName project = ScopeName.project("p1");

    private QuotaLedger ledger;

    @BeforeMethod
    public void setup() {
        ledger = new QuotaLedger();
        ledger.createScope(customer);
        ledger.createScope(group);
        ledger.createScope(project);
    }

    @Test
    public void testCreateScope() throws Exception {
        assertEquals(ledger.getRecordCount(), 3 * ResourceType.values().length);
        Quota quota = ledger.get(customer, ResourceType.vcpu);
        assertEquals(quota.getUsage(), 0);
        assertNull(quota.getLimit());
        assertTrue(quota.isUnlimited());

        // Creating again leaves existing records alone.
        ledger.adjust(customer, ResourceType.vcpu, 3);
        ledger.createScope(customer);
        assertEquals(ledger.get(customer, ResourceType.vcpu).getUsage(), 3);
    }

    @Test
    public void testAdjust() throws Exception {
        assertEquals(ledger.adjust(project, ResourceType.ram, 2048), 2048);
        assertEquals(ledger.adjust(project, ResourceType.ram, -1024), 1024);
        assertEquals(ledger.get(project, ResourceType.ram).getUsage(), 1024);
        assertEquals(ledger.get(customer, ResourceType.ram).getUsage(), 0);
    }

    @Test
    public void testAdjustClampsAtZero() throws Exception {
        ledger.adjust(project, ResourceType.vcpu, 2);
        assertEquals(ledger.adjust(project, ResourceType.vcpu, -5), 0);
        assertEquals(ledger.get(project, ResourceType.vcpu).getUsage(), 0);
    }

    @Test
    public void testAdjustUnknownScope() {
        expectThrows(QuotaRecordMissingException.class,
                () -> ledger.adjust(ScopeName.project("unknown"), ResourceType.vcpu, 1));
    }

    @Test
    public void testBatchAppliesToEveryScope() throws Exception {
        Map<QuotaKey, Long> result = ledger.adjust(ImmutableList.of(
                QuotaAdjustment.of(project, ResourceType.vcpu, 2),
                QuotaAdjustment.of(customer, ResourceType.vcpu, 2),
                QuotaAdjustment.of(group, ResourceType.vcpu, 2),
                QuotaAdjustment.of(project, ResourceType.vcpu, 1)));
        assertEquals(result.size(), 3);
        assertEquals(result.get(QuotaKey.of(project, ResourceType.vcpu)).longValue(), 3);
        assertEquals(ledger.get(customer, ResourceType.vcpu).getUsage(), 2);
        assertEquals(ledger.get(group, ResourceType.vcpu).getUsage(), 2);
        assertEquals(ledger.get(project, ResourceType.vcpu).getUsage(), 3);
    }

    @Test
    public void testBatchRollsBackWhenARecordIsMissing() throws Exception {
        ledger.adjust(customer, ResourceType.vcpu, 1);
        long sequence = ledger.getCommitSequence();
        long version = ledger.get(customer, ResourceType.vcpu).getVersion();

        // Keys are installed in scope order, the missing project comes after the customer and the group.
        try {
            ledger.adjust(ImmutableList.of(
                    QuotaAdjustment.of(customer, ResourceType.vcpu, 4),
                    QuotaAdjustment.of(group, ResourceType.vcpu, 4),
                    QuotaAdjustment.of(ScopeName.project("p9"), ResourceType.vcpu, 4)));
            fail("should have failed");
        } catch (QuotaRecordMissingException e) {
            // Ok
        }

        assertEquals(ledger.getCommitSequence(), sequence);
        Quota quota = ledger.get(customer, ResourceType.vcpu);
        assertEquals(quota.getUsage(), 1);
        assertEquals(quota.getVersion(), version);
        assertEquals(ledger.get(group, ResourceType.vcpu).getUsage(), 0);

        // The rolled back keys accept new batches.
        ledger.adjust(group, ResourceType.vcpu, 2);
        assertEquals(ledger.get(group, ResourceType.vcpu).getUsage(), 2);
    }

    @DataProvider(name = "checks")
    public Object[][] checks() {
        return new Object[][] {
                // limit, usage, requested delta, allowed
                {null, 5L, 1000L, true},
                {10L, 5L, 5L, true},
                {10L, 5L, 6L, false},
                {10L, 5L, -3L, true},
                {10L, 12L, -1L, false},
                {10L, 12L, -2L, true},
                {0L, 0L, 0L, true},
                {0L, 0L, 1L, false},
        };
    }

    @Test(dataProvider = "checks")
    public void testCheck(Long limit, long usage, long delta, boolean allowed) throws Exception {
        ledger.adjust(project, ResourceType.storage, usage);
        ledger.setLimit(project, ResourceType.storage, limit);
        assertEquals(ledger.check(project, ResourceType.storage, delta), allowed);
    }

    @Test
    public void testSetLimit() throws Exception {
        ledger.setLimit(customer, ResourceType.max_instances, 10L);
        long sequence = ledger.getCommitSequence();
        assertEquals(ledger.get(customer, ResourceType.max_instances).getLimit().longValue(), 10);

        ledger.setLimit(customer, ResourceType.max_instances, 10L);
        assertEquals(ledger.getCommitSequence(), sequence);

        ledger.setLimit(customer, ResourceType.max_instances, null);
        assertTrue(ledger.get(customer, ResourceType.max_instances).isUnlimited());

        expectThrows(IllegalArgumentException.class, () -> ledger.setLimit(customer, ResourceType.vcpu, -1L));
    }

    @Test
    public void testIsExceeded() throws Exception {
        ledger.setLimit(customer, ResourceType.vcpu, 10L);
        ledger.adjust(customer, ResourceType.vcpu, 8);
        assertFalse(ledger.isExceeded(customer, ResourceType.vcpu, 0, 0.8));
        assertTrue(ledger.isExceeded(customer, ResourceType.vcpu, 1, 0.8));
        assertFalse(ledger.isExceeded(project, ResourceType.vcpu, 1000, 0.8));
    }

    @Test
    public void testValidateQuotaChange() throws Exception {
        ledger.setLimit(customer, ResourceType.vcpu, 4L);
        ledger.setLimit(project, ResourceType.ram, 1024L);
        ledger.adjust(customer, ResourceType.vcpu, 3);

        List<ScopeName> scopes = ImmutableList.of(project, customer, ScopeName.projectGroup("unknown"));
        List<String> errors = ledger.validateQuotaChange(scopes,
                ImmutableMap.of(ResourceType.vcpu, 2L, ResourceType.ram, 512L), false);
        assertEquals(errors, ImmutableList.of("vcpu quota limit: 4, requires 5 (customer://c1)"));

        assertTrue(ledger.validateQuotaChange(scopes, ImmutableMap.of(ResourceType.vcpu, 1L), true).isEmpty());

        QuotaExceededException e = expectThrows(QuotaExceededException.class,
                () -> ledger.validateQuotaChange(scopes, ImmutableMap.of(ResourceType.ram, 2048L), true));
        assertEquals(e.getErrors(), ImmutableList.of("ram quota limit: 1024, requires 2048 (project://p1)"));
    }

    @Test
    public void testReconcileComparesVersion() throws Exception {
        ledger.adjust(project, ResourceType.vcpu, 5);
        Quota read = ledger.get(project, ResourceType.vcpu);
        QuotaKey key = QuotaKey.of(project, ResourceType.vcpu);

        ledger.adjust(project, ResourceType.vcpu, 1);
        assertFalse(ledger.reconcile(key, read.getVersion(), 2));
        assertEquals(ledger.get(project, ResourceType.vcpu).getUsage(), 6);

        Quota current = ledger.get(project, ResourceType.vcpu);
        assertTrue(ledger.reconcile(key, current.getVersion(), 2));
        assertEquals(ledger.get(project, ResourceType.vcpu).getUsage(), 2);
    }

    @Test
    public void testRemoveScope() throws Exception {
        List<QuotaChange> changes = new ArrayList<>();
        ledger.adjust(project, ResourceType.vcpu, 3);
        ledger.addListener(changes::add);

        ledger.removeScope(project);
        assertFalse(ledger.hasScope(project));
        assertTrue(ledger.hasScope(customer));
        assertEquals(changes.size(), ResourceType.values().length);
        QuotaChange vcpu = changes.stream()
                .filter(c -> c.getKey().getResourceType() == ResourceType.vcpu)
                .findFirst().get();
        assertEquals(vcpu.getPreviousUsage(), 3);
        assertEquals(vcpu.getUsage(), 0);
        expectThrows(QuotaRecordMissingException.class, () -> ledger.get(project, ResourceType.vcpu));
    }

    @Test
    public void testListenersSeeCommittedChanges() throws Exception {
        List<QuotaChange> changes = new ArrayList<>();
        ledger.addListener(changes::add);
        ledger.addListener(change -> {
            throw new IllegalStateException("failing listener");
        });

        ledger.adjust(ImmutableList.of(QuotaAdjustment.of(project, ResourceType.vcpu, 2),
                QuotaAdjustment.of(customer, ResourceType.vcpu, 2)));
        assertEquals(changes.size(), 2);
        assertEquals(changes.get(0).getVersion(), changes.get(1).getVersion());
        assertEquals(changes.get(0).getVersion(), ledger.getCommitSequence());
    }

    @Test
    public void testSnapshotSumOfQuotas() throws Exception {
        ledger.setLimit(customer, ResourceType.vcpu, 8L);
        ledger.adjust(customer, ResourceType.vcpu, 3);
        ledger.adjust(project, ResourceType.vcpu, 3);

        LedgerSnapshot snapshot = ledger.snapshot();
        Map<String, Long> sums = snapshot.sumOfQuotas(ImmutableList.of(customer, project),
                ImmutableList.of(ResourceType.vcpu, ResourceType.ram));
        assertEquals(sums.get("vcpu").longValue(), 8);
        assertEquals(sums.get("vcpu_usage").longValue(), 6);
        assertEquals(sums.get("ram").longValue(), -1);
        assertEquals(sums.get("ram_usage").longValue(), 0);
        assertTrue(snapshot.sumOfQuotas(ImmutableList.of(), ImmutableList.of(ResourceType.vcpu)).isEmpty());

        // Later changes are not visible to an earlier snapshot.
        ledger.adjust(customer, ResourceType.vcpu, 1);
        assertEquals(snapshot.get(customer, ResourceType.vcpu).getUsage(), 3);
    }

    @Test
    public void testSnapshotNeverMixesSequences() throws Exception {
        QuotaKey customerKey = QuotaKey.of(customer, ResourceType.vcpu);
        QuotaKey projectKey = QuotaKey.of(project, ResourceType.vcpu);
        List<QuotaKey> keys = ImmutableList.of(customerKey, projectKey);
        long readSeq = ledger.getCommitSequence();

        ledger.adjust(ImmutableList.of(QuotaAdjustment.of(customer, ResourceType.vcpu, 1),
                QuotaAdjustment.of(project, ResourceType.vcpu, 1)));
        for (int i = 0; i < QuotaRecord.RETAINED_VERSIONS + 1; i++) {
            ledger.adjust(customer, ResourceType.vcpu, 1);
        }

        // The customer version at readSeq is gone, the project one is still retained.
        assertNull(ledger.readAt(readSeq, keys));
        assertEquals(ledger.readAt(readSeq, ImmutableList.of(projectKey)).get(projectKey).getUsage(), 0);

        LedgerSnapshot snapshot = ledger.snapshot(keys);
        assertEquals(snapshot.getReadSequence(), ledger.getCommitSequence());
        assertEquals(snapshot.get(customerKey).getUsage(), QuotaRecord.RETAINED_VERSIONS + 2);
        assertEquals(snapshot.get(projectKey).getUsage(), 1);
    }

    @Test
    public void testSnapshotSeesBatchesAtomically() throws Exception {
        ScopeName other = ScopeName.project("p2");
        ledger.createScope(other);
        List<QuotaKey> keys = ImmutableList.of(QuotaKey.of(customer, ResourceType.vcpu),
                QuotaKey.of(project, ResourceType.vcpu), QuotaKey.of(other, ResourceType.vcpu));

        int writers = 2;
        int batchesPerWriter = 2000;
        ExecutorService executor = Executors.newFixedThreadPool(writers + 1);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean done = new AtomicBoolean();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                ScopeName scope = w % 2 == 0 ? project : other;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < batchesPerWriter; i++) {
                        ledger.adjust(ImmutableList.of(QuotaAdjustment.of(customer, ResourceType.vcpu, 1),
                                QuotaAdjustment.of(scope, ResourceType.vcpu, 1)));
                    }
                    return null;
                }));
            }
            Future<Integer> reader = executor.submit(() -> {
                start.await();
                int snapshots = 0;
                while (!done.get()) {
                    LedgerSnapshot snapshot = ledger.snapshot(keys);
                    long customerUsage = snapshot.get(keys.get(0)).getUsage();
                    long projectsUsage = snapshot.get(keys.get(1)).getUsage() + snapshot.get(keys.get(2)).getUsage();
                    assertEquals(customerUsage, projectsUsage);
                    snapshots++;
                }
                return snapshots;
            });

            start.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
            done.set(true);
            assertTrue(reader.get(60, TimeUnit.SECONDS) > 0);
        } finally {
            executor.shutdownNow();
        }

        assertEquals(ledger.get(customer, ResourceType.vcpu).getUsage(), writers * batchesPerWriter);
        assertEquals(ledger.get(project, ResourceType.vcpu).getUsage(), writers / 2 * batchesPerWriter);
        assertEquals(ledger.get(other, ResourceType.vcpu).getUsage(), writers / 2 * batchesPerWriter);
    }
}
