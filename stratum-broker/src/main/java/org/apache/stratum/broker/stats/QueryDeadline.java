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
package org.apache.stratum.broker.stats;

import java.util.concurrent.TimeUnit;
import org.apache.stratum.broker.StratumServiceException.PartialResultException;

/**
 * Deadline and cancellation signal of a statistics query. Long running queries check it between units of work
 * and give up with a {@link PartialResultException} carrying what they computed so far.
 */
public class QueryDeadline {

    private final long deadlineNanos;
    private volatile boolean cancelled;

    private QueryDeadline(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static QueryDeadline after(long timeout, TimeUnit unit) {
        return new QueryDeadline(System.nanoTime() + unit.toNanos(timeout));
    }

    public static QueryDeadline none() {
        return new QueryDeadline(Long.MAX_VALUE);
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isExpired() {
        if (cancelled) {
            return true;
        }
        return deadlineNanos != Long.MAX_VALUE && System.nanoTime() - deadlineNanos >= 0;
    }

    public long remainingMillis() {
        if (cancelled) {
            return 0;
        }
        if (deadlineNanos == Long.MAX_VALUE) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
    }

    /**
     * @throws PartialResultException if the deadline passed or the query was cancelled
     */
    public void check(String query, Object partialResult) throws PartialResultException {
        if (isExpired()) {
            throw new PartialResultException(
                    query + (cancelled ? " was cancelled" : " exceeded its deadline"), partialResult);
        }
    }
}
