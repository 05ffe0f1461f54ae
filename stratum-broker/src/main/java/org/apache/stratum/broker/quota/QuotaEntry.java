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

/**
 * Immutable version of a quota record. An entry installed by a batch that has not been finalized yet carries
 * the batch descriptor; its visibility is decided by the descriptor's state.
 */
final class QuotaEntry {
    static final long UNCOMMITTED = -1;

    private final Long limit;
    private final long usage;
    private final long commitSeq;
    private final LedgerBatch batch;
    private final QuotaEntry previous;

    private QuotaEntry(Long limit, long usage, long commitSeq, LedgerBatch batch, QuotaEntry previous) {
        this.limit = limit;
        this.usage = usage;
        this.commitSeq = commitSeq;
        this.batch = batch;
        this.previous = previous;
    }

    static QuotaEntry initial() {
        return new QuotaEntry(null, 0, 0, null, null);
    }

    Long getLimit() {
        return limit;
    }

    long getUsage() {
        return usage;
    }

    long getCommitSeq() {
        return commitSeq;
    }

    LedgerBatch getBatch() {
        return batch;
    }

    QuotaEntry getPrevious() {
        return previous;
    }

    QuotaEntry pending(LedgerBatch owner, Long newLimit, long newUsage) {
        return new QuotaEntry(newLimit, newUsage, UNCOMMITTED, owner, this);
    }

    /**
     * The committed form of a pending entry, keeping at most {@code retainedVersions} older versions for
     * readers holding an older snapshot.
     */
    QuotaEntry finalized(long seq, int retainedVersions) {
        return new QuotaEntry(limit, usage, seq, null, trim(previous, retainedVersions));
    }

    private static QuotaEntry trim(QuotaEntry entry, int depth) {
        if (entry == null || depth <= 0) {
            return null;
        }
        return new QuotaEntry(entry.limit, entry.usage, entry.commitSeq, null, trim(entry.previous, depth - 1));
    }
}
