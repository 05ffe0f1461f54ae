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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Descriptor shared by every entry a batch installs. Flipping its state publishes or discards all of them
 * at once.
 */
final class LedgerBatch {

    enum State {
        PENDING,
        COMMITTING,
        COMMITTED,
        ABORTED
    }

    // Only the owning thread moves the state forward; other threads read it to decide visibility.
    private volatile State state = State.PENDING;
    private volatile long commitSeq = -1;

    State getState() {
        return state;
    }

    long getCommitSeq() {
        return commitSeq;
    }

    /**
     * Draws the commit sequence from the ledger clock. The state is COMMITTING while the sequence is drawn,
     * so a reader either sees a sequence that can be compared to its snapshot or waits for it.
     */
    long commit(AtomicLong clock) {
        state = State.COMMITTING;
        long seq = clock.incrementAndGet();
        commitSeq = seq;
        state = State.COMMITTED;
        return seq;
    }

    void abort() {
        if (state == State.PENDING) {
            state = State.ABORTED;
        }
    }
}
