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

import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps every committed value of every quota, ordered by commit sequence, for the quota timeline.
 * A key without history is at its initial value: no usage and no limit.
 */
@Slf4j
public class QuotaHistory implements QuotaLedgerListener {

    private final Map<QuotaKey, NavigableMap<Long, QuotaHistoryEntry>> history = new ConcurrentHashMap<>();

    @Override
    public void onQuotaChanged(QuotaChange change) {
        record(change.getKey(),
                new QuotaHistoryEntry(change.getTimestamp(), change.getLimit(), change.getUsage(), change.getVersion()));
    }

    public void record(QuotaKey key, QuotaHistoryEntry entry) {
        history.computeIfAbsent(key, k -> new ConcurrentSkipListMap<>()).put(entry.getVersion(), entry);
    }

    public List<QuotaHistoryEntry> getHistory(QuotaKey key) {
        NavigableMap<Long, QuotaHistoryEntry> entries = history.get(key);
        return entries == null ? ImmutableList.of() : ImmutableList.copyOf(entries.values());
    }

    /**
     * The entry in effect at the given time, or null when the quota had not changed yet.
     */
    public QuotaHistoryEntry valueAt(QuotaKey key, long timestamp) {
        QuotaHistoryEntry result = null;
        for (QuotaHistoryEntry entry : getHistory(key)) {
            if (entry.getTimestamp() > timestamp) {
                break;
            }
            result = entry;
        }
        return result;
    }

    /**
     * Entries recorded strictly after {@code from} and strictly before {@code to}.
     */
    public List<QuotaHistoryEntry> changesBetween(QuotaKey key, long from, long to) {
        ImmutableList.Builder<QuotaHistoryEntry> result = ImmutableList.builder();
        for (QuotaHistoryEntry entry : getHistory(key)) {
            if (entry.getTimestamp() >= to) {
                break;
            }
            if (entry.getTimestamp() > from) {
                result.add(entry);
            }
        }
        return result.build();
    }

    /**
     * Drop entries older than the cutoff, keeping for each key the newest of them as the value in effect at the
     * cutoff. A key whose only remaining entry is back at the initial value is dropped entirely.
     *
     * @return number of entries dropped
     */
    public int purge(long cutoffTimestamp) {
        int purged = 0;
        Iterator<Map.Entry<QuotaKey, NavigableMap<Long, QuotaHistoryEntry>>> it = history.entrySet().iterator();
        while (it.hasNext()) {
            NavigableMap<Long, QuotaHistoryEntry> entries = it.next().getValue();
            QuotaHistoryEntry baseline = null;
            Iterator<QuotaHistoryEntry> entryIt = entries.values().iterator();
            while (entryIt.hasNext()) {
                QuotaHistoryEntry entry = entryIt.next();
                if (entry.getTimestamp() >= cutoffTimestamp) {
                    break;
                }
                if (baseline != null) {
                    entries.remove(baseline.getVersion());
                    purged++;
                }
                baseline = entry;
            }
            if (baseline != null && entries.size() == 1 && baseline.getUsage() == 0 && baseline.getLimit() == null) {
                it.remove();
                purged++;
            }
        }
        if (purged > 0) {
            log.info("Purged {} quota history entries older than {}", purged, cutoffTimestamp);
        }
        return purged;
    }
}
