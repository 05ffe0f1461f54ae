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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.prometheus.client.Counter;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.LockSupport;
import org.apache.stratum.broker.StratumServiceException.QuotaExceededException;
import org.apache.stratum.broker.StratumServiceException.QuotaRecordMissingException;
import org.apache.stratum.common.naming.ScopeName;
import org.apache.stratum.common.policies.data.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The <code>QuotaLedger</code> owns the limit/usage counters of every (scope, resource type) pair.
 * <p>
 * Every change, from a single-key adjustment to a multi-scope batch, goes through the same protocol: the batch
 * installs a pending entry on each of its keys in canonical key order with a compare-and-swap, then commits by
 * drawing a sequence number from the ledger clock. A failure before the commit rolls every installed entry
 * back. Readers take the current clock value as their snapshot and walk each record's version chain to the
 * newest entry committed at or before it, so they never block writers and observe a batch entirely or not at
 * all. Writers touching the same key are serialized by the pending entry; writers on different keys never
 * contend.
 */
public class QuotaLedger {

    private static final int MAX_SNAPSHOT_ATTEMPTS = 16;
    private static final long SNAPSHOT_BACKOFF_NANOS = TimeUnit.MICROSECONDS.toNanos(10);

    private final ConcurrentHashMap<QuotaKey, QuotaRecord> records = new ConcurrentHashMap<>();
    private final AtomicLong commitClock = new AtomicLong();
    private final List<QuotaLedgerListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public QuotaLedger() {
        this(Clock.systemUTC());
    }

    public QuotaLedger(Clock clock) {
        this.clock = clock;
    }

    @FunctionalInterface
    private interface EntryUpdate {
        /**
         * @return the pending entry to install, or null to abandon the batch
         */
        QuotaEntry apply(QuotaEntry current, LedgerBatch batch);
    }

    public void addListener(QuotaLedgerListener listener) {
        listeners.add(listener);
    }

    public void removeListener(QuotaLedgerListener listener) {
        listeners.remove(listener);
    }

    /**
     * Create the quota records of a scope, with zero usage and no limit. Existing records are left alone.
     */
    public void createScope(ScopeName scope) {
        for (ResourceType type : ResourceType.values()) {
            QuotaKey key = QuotaKey.of(scope, type);
            records.computeIfAbsent(key, QuotaRecord::new);
        }
        if (log.isDebugEnabled()) {
            log.debug("Created quota records of {}", scope);
        }
    }

    /**
     * Zero the usage of a scope's quotas, so that listeners observe the release, then drop its records.
     */
    public void removeScope(ScopeName scope) {
        SortedMap<QuotaKey, EntryUpdate> updates = new TreeMap<>();
        for (ResourceType type : ResourceType.values()) {
            QuotaKey key = QuotaKey.of(scope, type);
            if (records.containsKey(key)) {
                updates.put(key, (current, batch) -> current.pending(batch, current.getLimit(), 0));
            }
        }
        try {
            commit(updates);
        } catch (QuotaRecordMissingException e) {
            // Concurrently removed.
            log.info("Quota records of {} were already removed: {}", scope, e.getMessage());
        }
        for (QuotaKey key : updates.keySet()) {
            records.remove(key);
        }
        log.info("Removed quota records of {}", scope);
    }

    public boolean hasScope(ScopeName scope) {
        return records.containsKey(QuotaKey.of(scope, ResourceType.vcpu));
    }

    /**
     * Atomically add a signed delta to the usage of one quota.
     *
     * @return the usage after the adjustment
     * @throws QuotaRecordMissingException if the scope has no quota record
     */
    public long adjust(ScopeName scope, ResourceType resourceType, long delta) throws QuotaRecordMissingException {
        QuotaKey key = QuotaKey.of(scope, resourceType);
        return adjust(Collections.singletonList(QuotaAdjustment.of(key, delta))).get(key);
    }

    /**
     * Apply a batch of adjustments all-or-nothing. Adjustments of the same key are merged. If any key has no
     * record the ledger is left unchanged.
     *
     * @return the usage of every adjusted key after the batch
     * @throws QuotaRecordMissingException if one of the keys has no quota record
     */
    public Map<QuotaKey, Long> adjust(Collection<QuotaAdjustment> adjustments) throws QuotaRecordMissingException {
        SortedMap<QuotaKey, Long> deltas = new TreeMap<>();
        for (QuotaAdjustment adjustment : adjustments) {
            deltas.merge(adjustment.getKey(), adjustment.getDelta(), Long::sum);
        }
        SortedMap<QuotaKey, EntryUpdate> updates = new TreeMap<>();
        deltas.forEach((key, delta) -> updates.put(key, (current, batch) ->
                current.pending(batch, current.getLimit(), Math.max(0, current.getUsage() + delta))));

        Map<QuotaKey, QuotaChange> changes = commit(updates);
        Map<QuotaKey, Long> result = new LinkedHashMap<>();
        changes.forEach((key, change) -> {
            long unclamped = change.getPreviousUsage() + deltas.get(key);
            if (unclamped < 0) {
                ledgerUsageClamped.inc();
                log.warn("Usage of {} would drop to {}, clamped to 0; left for reconciliation to correct",
                        key, unclamped);
            }
            result.put(key, change.getUsage());
        });
        return result;
    }

    /**
     * Set the limit of a quota; null means unlimited. Setting the current limit again is a no-op.
     */
    public void setLimit(ScopeName scope, ResourceType resourceType, Long limit) throws QuotaRecordMissingException {
        Preconditions.checkArgument(limit == null || limit >= 0, "Invalid quota limit %s", limit);
        QuotaKey key = QuotaKey.of(scope, resourceType);
        SortedMap<QuotaKey, EntryUpdate> updates = new TreeMap<>();
        updates.put(key, (current, batch) -> Objects.equals(current.getLimit(), limit)
                ? null : current.pending(batch, limit, current.getUsage()));
        commit(updates);
    }

    public Quota get(ScopeName scope, ResourceType resourceType) throws QuotaRecordMissingException {
        return getRecord(QuotaKey.of(scope, resourceType)).latest();
    }

    /**
     * Advisory check of whether a usage change fits in the limit. It takes no lock: the answer may be stale by
     * the time the caller acts on it.
     *
     * @return false exactly when the limit is set and {@code usage + requestedDelta > limit}
     */
    public boolean check(ScopeName scope, ResourceType resourceType, long requestedDelta)
            throws QuotaRecordMissingException {
        Quota quota = get(scope, resourceType);
        return quota.isUnlimited() || quota.getUsage() + requestedDelta <= quota.getLimit();
    }

    /**
     * Whether usage plus delta goes over {@code threshold * limit}. An unlimited quota is never exceeded.
     */
    public boolean isExceeded(ScopeName scope, ResourceType resourceType, long delta, double threshold)
            throws QuotaRecordMissingException {
        return isExceeded(get(scope, resourceType), delta, threshold);
    }

    static boolean isExceeded(Quota quota, long delta, double threshold) {
        if (quota.isUnlimited()) {
            return false;
        }
        return quota.getUsage() + delta > threshold * quota.getLimit();
    }

    /**
     * Collect a message for every quota of the given scopes the deltas would exceed. Scopes are usually a scope
     * followed by its ancestors; scopes without records are skipped.
     *
     * @throws QuotaExceededException if {@code raiseException} is set and a quota would be exceeded
     */
    public List<String> validateQuotaChange(List<ScopeName> scopes, Map<ResourceType, Long> deltas,
                                            boolean raiseException) throws QuotaExceededException {
        List<QuotaKey> keys = new ArrayList<>();
        for (ScopeName scope : scopes) {
            for (ResourceType type : deltas.keySet()) {
                keys.add(QuotaKey.of(scope, type));
            }
        }
        LedgerSnapshot snapshot = snapshot(keys);
        List<String> errors = new ArrayList<>();
        for (QuotaKey key : keys) {
            Quota quota = snapshot.get(key);
            long delta = deltas.get(key.getResourceType());
            if (quota != null && isExceeded(quota, delta, 1.0)) {
                errors.add(String.format("%s quota limit: %d, requires %d (%s)", key.getResourceType(),
                        quota.getLimit(), quota.getUsage() + delta, key.getScope()));
            }
        }
        if (raiseException && !errors.isEmpty()) {
            throw new QuotaExceededException(errors);
        }
        return errors;
    }

    /**
     * Overwrite the usage of a quota, provided it is still at the expected version.
     *
     * @return false when the quota changed after the expected version was read
     */
    public boolean reconcile(QuotaKey key, long expectedVersion, long usage) throws QuotaRecordMissingException {
        Preconditions.checkArgument(usage >= 0, "Invalid usage %s", usage);
        SortedMap<QuotaKey, EntryUpdate> updates = new TreeMap<>();
        updates.put(key, (current, batch) -> current.getCommitSeq() != expectedVersion
                ? null : current.pending(batch, current.getLimit(), usage));
        return !commit(updates).isEmpty();
    }

    public LedgerSnapshot snapshot() {
        return snapshot(new ArrayList<>(records.keySet()));
    }

    /**
     * Consistent view of the given keys. Keys without a record are absent from the view.
     * <p>
     * Every attempt reads all keys at one commit sequence. An attempt fails when a key was changed so often since
     * that sequence that its version is no longer retained; the next attempt starts from a fresh sequence, and
     * after a bounded number of attempts the reader backs off between attempts.
     */
    public LedgerSnapshot snapshot(Collection<QuotaKey> keys) {
        for (int attempt = 1; ; attempt++) {
            LedgerSnapshot snapshot = readAt(commitClock.get(), keys);
            if (snapshot != null) {
                return snapshot;
            }
            snapshotRetries.inc();
            if (attempt == MAX_SNAPSHOT_ATTEMPTS) {
                log.warn("Could not read a consistent snapshot of {} quotas after {} attempts, backing off",
                        keys.size(), attempt);
            }
            if (attempt >= MAX_SNAPSHOT_ATTEMPTS) {
                LockSupport.parkNanos(Math.min(attempt - MAX_SNAPSHOT_ATTEMPTS + 1, 100) * SNAPSHOT_BACKOFF_NANOS);
            }
        }
    }

    /**
     * View of the given keys as of the commit sequence, or null when a version visible at that sequence is no
     * longer retained.
     */
    @VisibleForTesting
    LedgerSnapshot readAt(long readSeq, Collection<QuotaKey> keys) {
        Map<QuotaKey, Quota> quotas = new HashMap<>();
        for (QuotaKey key : keys) {
            QuotaRecord record = records.get(key);
            if (record == null) {
                continue;
            }
            Quota quota = record.readAt(readSeq);
            if (quota == null) {
                return null;
            }
            quotas.put(key, quota);
        }
        return new LedgerSnapshot(readSeq, quotas);
    }

    /**
     * Current value of the ledger clock; every committed change draws the next value.
     */
    public long getCommitSequence() {
        return commitClock.get();
    }

    private QuotaRecord getRecord(QuotaKey key) throws QuotaRecordMissingException {
        QuotaRecord record = records.get(key);
        if (record == null) {
            throw new QuotaRecordMissingException("No quota record for " + key);
        }
        return record;
    }

    /**
     * Install, commit and finalize a batch.
     *
     * @return the committed changes, empty when an update abandoned the batch
     */
    private Map<QuotaKey, QuotaChange> commit(SortedMap<QuotaKey, EntryUpdate> updates)
            throws QuotaRecordMissingException {
        if (updates.isEmpty()) {
            return Collections.emptyMap();
        }
        LedgerBatch batch = new LedgerBatch();
        List<QuotaRecord> installedRecords = new ArrayList<>(updates.size());
        List<QuotaEntry> installedEntries = new ArrayList<>(updates.size());
        boolean committed = false;
        long seq;
        try {
            for (Map.Entry<QuotaKey, EntryUpdate> update : updates.entrySet()) {
                QuotaRecord record = getRecord(update.getKey());
                QuotaEntry pending = install(record, batch, update.getValue());
                if (pending == null) {
                    return Collections.emptyMap();
                }
                installedRecords.add(record);
                installedEntries.add(pending);
            }
            seq = batch.commit(commitClock);
            committed = true;
        } finally {
            if (!committed) {
                batch.abort();
                for (int i = installedRecords.size() - 1; i >= 0; i--) {
                    installedRecords.get(i).rollback(installedEntries.get(i));
                }
                if (!installedRecords.isEmpty()) {
                    ledgerBatchesRolledBack.inc();
                }
            }
        }
        ledgerBatchesCommitted.inc();

        long timestamp = clock.millis() / 1000;
        Map<QuotaKey, QuotaChange> changes = new LinkedHashMap<>();
        for (int i = 0; i < installedRecords.size(); i++) {
            QuotaRecord record = installedRecords.get(i);
            QuotaEntry pending = installedEntries.get(i);
            QuotaEntry finalized = record.finalizeEntry(pending, seq);
            QuotaEntry previous = pending.getPrevious();
            changes.put(record.getKey(), new QuotaChange(record.getKey(), previous.getLimit(), previous.getUsage(),
                    finalized.getLimit(), finalized.getUsage(), seq, timestamp));
        }
        for (QuotaChange change : changes.values()) {
            notifyListeners(change);
        }
        return changes;
    }

    private QuotaEntry install(QuotaRecord record, LedgerBatch batch, EntryUpdate update) {
        while (true) {
            QuotaEntry current = record.settledHead();
            if (current == null) {
                // Another batch holds the key.
                Thread.yield();
                continue;
            }
            QuotaEntry pending = update.apply(current, batch);
            if (pending == null) {
                return null;
            }
            if (record.install(current, pending)) {
                return pending;
            }
        }
    }

    private void notifyListeners(QuotaChange change) {
        for (QuotaLedgerListener listener : listeners) {
            try {
                listener.onQuotaChanged(change);
            } catch (Exception e) {
                log.error("Quota listener {} failed on {}", listener, change, e);
            }
        }
    }

    @VisibleForTesting
    int getRecordCount() {
        return records.size();
    }

    private static final Logger log = LoggerFactory.getLogger(QuotaLedger.class);

    private static final Counter ledgerBatchesCommitted = Counter.build()
            .name("stratum_ledger_batches_committed")
            .help("Number of quota ledger batches committed")
            .register();
    private static final Counter ledgerBatchesRolledBack = Counter.build()
            .name("stratum_ledger_batches_rolled_back")
            .help("Number of quota ledger batches rolled back after a partial install")
            .register();
    private static final Counter ledgerUsageClamped = Counter.build()
            .name("stratum_ledger_usage_clamped")
            .help("Number of adjustments whose resulting usage was clamped to zero")
            .register();
    private static final Counter snapshotRetries = Counter.build()
            .name("stratum_ledger_snapshot_retries")
            .help("Number of snapshot attempts restarted because a version was no longer retained")
            .register();
}
