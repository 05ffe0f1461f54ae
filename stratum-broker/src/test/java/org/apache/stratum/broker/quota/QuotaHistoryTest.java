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
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;
import java.util.List;
import org.apache.stratum.common.naming.ScopeName;
import org.apache.stratum.common.policies.data.ResourceType;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class QuotaHistoryTest {

    private final QuotaKey key = QuotaKey.of(ScopeName.customer("c1"), ResourceType.vcpu);
    private final QuotaKey other = QuotaKey.of(ScopeName.customer("c2"), ResourceType.vcpu);

    private QuotaHistory history;

    @BeforeMethod
    public void setup() {
        history = new QuotaHistory();
        history.record(key, new QuotaHistoryEntry(100, null, 2, 1));
        history.record(key, new QuotaHistoryEntry(200, 10L, 2, 2));
        history.record(key, new QuotaHistoryEntry(300, 10L, 6, 5));
    }

    @Test
    public void testValueAt() {
        assertNull(history.valueAt(key, 99));
        assertEquals(history.valueAt(key, 100).getVersion(), 1);
        assertEquals(history.valueAt(key, 250).getVersion(), 2);
        assertEquals(history.valueAt(key, 1000).getUsage(), 6);
        assertNull(history.valueAt(other, 1000));
    }

    @Test
    public void testChangesBetween() {
        List<QuotaHistoryEntry> changes = history.changesBetween(key, 100, 300);
        assertEquals(changes.size(), 1);
        assertEquals(changes.get(0).getVersion(), 2);
        assertEquals(history.changesBetween(key, 0, 1000).size(), 3);
        assertTrue(history.changesBetween(other, 0, 1000).isEmpty());
    }

    @Test
    public void testRecordsLedgerChanges() throws Exception {
        QuotaLedger ledger = new QuotaLedger();
        QuotaHistory ledgerHistory = new QuotaHistory();
        ledger.addListener(ledgerHistory);
        ScopeName scope = ScopeName.project("p1");
        ledger.createScope(scope);

        ledger.adjust(scope, ResourceType.ram, 512);
        ledger.setLimit(scope, ResourceType.ram, 1024L);
        List<QuotaHistoryEntry> entries = ledgerHistory.getHistory(QuotaKey.of(scope, ResourceType.ram));
        assertEquals(entries.size(), 2);
        assertEquals(entries.get(0).getUsage(), 512);
        assertNull(entries.get(0).getLimit());
        assertEquals(entries.get(1).getLimit().longValue(), 1024);
        assertEquals(entries.get(1).getVersion(), ledger.getCommitSequence());
    }

    @Test
    public void testPurgeKeepsValueInEffect() {
        assertEquals(history.purge(250), 1);
        List<QuotaHistoryEntry> entries = history.getHistory(key);
        assertEquals(entries.size(), 2);
        assertEquals(entries.get(0).getVersion(), 2);

        // The value in effect at the cutoff is still answered.
        assertEquals(history.valueAt(key, 260).getLimit().longValue(), 10);
    }

    @Test
    public void testPurgeDropsKeysBackAtInitialValue() {
        history.record(other, new QuotaHistoryEntry(100, null, 3, 3));
        history.record(other, new QuotaHistoryEntry(150, null, 0, 4));

        history.purge(200);
        assertTrue(history.getHistory(other).isEmpty());
        assertEquals(history.getHistory(key).size(), 3);
    }
}
