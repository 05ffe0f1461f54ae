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

import java.util.concurrent.atomic.AtomicReference;
import lombok.Getter;

/**
 * Mutable cell of one quota key. All changes are compare-and-swap replacements of the head entry.
 */
final class QuotaRecord {
    static final int RETAINED_VERSIONS = 4;

    @Getter
    private final QuotaKey key;
    private final AtomicReference<QuotaEntry> head;

    QuotaRecord(QuotaKey key) {
        this.key = key;
        this.head = new AtomicReference<>(QuotaEntry.initial());
    }

    /**
     * Head entry with no unfinished batch on it. Finishes the work of a committed or aborted batch found on the
     * head, and returns null while another batch holds the key.
     */
    QuotaEntry settledHead() {
        QuotaEntry current = head.get();
        LedgerBatch owner = current.getBatch();
        if (owner == null) {
            return current;
        }
        switch (owner.getState()) {
            case COMMITTED:
                head.compareAndSet(current, current.finalized(owner.getCommitSeq(), RETAINED_VERSIONS));
                return null;
            case ABORTED:
                head.compareAndSet(current, current.getPrevious());
                return null;
            default:
                return null;
        }
    }

    boolean install(QuotaEntry expected, QuotaEntry pending) {
        return head.compareAndSet(expected, pending);
    }

    QuotaEntry finalizeEntry(QuotaEntry pending, long seq) {
        QuotaEntry finalized = pending.finalized(seq, RETAINED_VERSIONS);
        // Losing the race means a reader or writer already finalized it.
        head.compareAndSet(pending, finalized);
        return finalized;
    }

    void rollback(QuotaEntry pending) {
        head.compareAndSet(pending, pending.getPrevious());
    }

    /**
     * The version visible to a reader at the given commit sequence, or null when that version is no longer
     * retained.
     */
    Quota readAt(long readSeq) {
        QuotaEntry entry = head.get();
        while (entry != null) {
            LedgerBatch owner = entry.getBatch();
            if (owner == null) {
                if (entry.getCommitSeq() <= readSeq) {
                    return new Quota(key, entry.getLimit(), entry.getUsage(), entry.getCommitSeq());
                }
            } else {
                LedgerBatch.State state = owner.getState();
                while (state == LedgerBatch.State.COMMITTING) {
                    Thread.yield();
                    state = owner.getState();
                }
                if (state == LedgerBatch.State.COMMITTED && owner.getCommitSeq() <= readSeq) {
                    return new Quota(key, entry.getLimit(), entry.getUsage(), owner.getCommitSeq());
                }
            }
            entry = entry.getPrevious();
        }
        return null;
    }

    Quota latest() {
        return readAt(Long.MAX_VALUE);
    }
}
