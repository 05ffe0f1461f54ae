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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.stratum.broker.ServiceConfiguration;
import org.apache.stratum.broker.StratumServiceException;
import org.apache.stratum.broker.StratumServiceException.OutOfOrderEventException;
import org.apache.stratum.common.util.Backoff;

/**
 * Caller side of the lifecycle event processor: submits an event and retries retryable failures with an
 * exponential backoff, giving up after a bounded number of attempts.
 */
@Slf4j
public class LifecycleEventSubmitter {

    private final LifecycleEventProcessor processor;
    private final ServiceConfiguration config;
    private final ScheduledExecutorService executor;

    public LifecycleEventSubmitter(LifecycleEventProcessor processor, ServiceConfiguration config,
                                   ScheduledExecutorService executor) {
        this.processor = processor;
        this.config = config;
        this.executor = executor;
    }

    /**
     * Submit an event. The future completes once the event is applied, or was already applied before, and
     * completes exceptionally with the last failure when the event is rejected for good or the retries are
     * exhausted.
     */
    public CompletableFuture<Void> submit(LifecycleEvent event) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        Backoff backoff = new Backoff(config.getLifecycleRetryInitialBackoffMillis(), TimeUnit.MILLISECONDS,
                config.getLifecycleRetryMaxBackoffMillis(), TimeUnit.MILLISECONDS, 0, TimeUnit.MILLISECONDS);
        executor.execute(() -> attempt(event, 0, backoff, future));
        return future;
    }

    private void attempt(LifecycleEvent event, int retries, Backoff backoff, CompletableFuture<Void> future) {
        try {
            processor.applyEvent(event);
            future.complete(null);
        } catch (OutOfOrderEventException e) {
            if (e.isDuplicate()) {
                log.info("Event {} was already applied", event);
                future.complete(null);
            } else {
                retryOrFail(event, retries, backoff, future, e);
            }
        } catch (StratumServiceException e) {
            if (StratumServiceException.isRetryable(e)) {
                retryOrFail(event, retries, backoff, future, e);
            } else {
                log.error("Event {} was rejected: {}", event, e.getMessage());
                future.completeExceptionally(e);
            }
        } catch (Throwable t) {
            log.error("Unexpected failure applying event {}", event, t);
            future.completeExceptionally(t);
        }
    }

    private void retryOrFail(LifecycleEvent event, int retries, Backoff backoff, CompletableFuture<Void> future,
                             StratumServiceException e) {
        if (retries >= config.getLifecycleMaxRetries()) {
            log.error("Giving up on event {} after {} retries: {}", event, retries, e.getMessage());
            future.completeExceptionally(e);
            return;
        }
        long delayMillis = backoff.next();
        log.warn("Event {} failed with {}, retrying in {} ms", event, e.getMessage(), delayMillis);
        executor.schedule(() -> attempt(event, retries + 1, backoff, future), delayMillis, TimeUnit.MILLISECONDS);
    }
}
