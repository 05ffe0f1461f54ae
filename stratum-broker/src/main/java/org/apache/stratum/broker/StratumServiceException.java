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
package org.apache.stratum.broker;

import java.util.List;
import lombok.Getter;
import org.apache.stratum.common.util.FutureUtil;

/**
 * Base type of exception thrown by the Stratum service.
 */
@SuppressWarnings("serial")
public class StratumServiceException extends Exception {
    public StratumServiceException(String msg) {
        super(msg);
    }

    public StratumServiceException(Throwable t) {
        super(t);
    }

    public StratumServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Malformed request parameters or an invalid lifecycle transition. Not retryable.
     */
    public static class ValidationException extends StratumServiceException {
        public ValidationException(String msg) {
            super(msg);
        }

        public ValidationException(String msg, Throwable t) {
            super(msg, t);
        }
    }

    public static class ScopeNotFoundException extends ValidationException {
        public ScopeNotFoundException(String msg) {
            super(msg);
        }
    }

    /**
     * The ledger has no quota record for a key an adjustment refers to, typically because the scope is being
     * created or destroyed concurrently.
     */
    public static class QuotaRecordMissingException extends StratumServiceException {
        public QuotaRecordMissingException(String msg) {
            super(msg);
        }
    }

    /**
     * A lifecycle event whose sequence number is not the next one expected for its resource.
     */
    @Getter
    public static class OutOfOrderEventException extends StratumServiceException {
        private final String resourceId;
        private final long expectedSequence;
        private final long receivedSequence;

        public OutOfOrderEventException(String resourceId, long expectedSequence, long receivedSequence) {
            super(String.format("Out of order event for resource %s: expected sequence %d, received %d",
                    resourceId, expectedSequence, receivedSequence));
            this.resourceId = resourceId;
            this.expectedSequence = expectedSequence;
            this.receivedSequence = receivedSequence;
        }

        /**
         * The event was already applied. Retrying it is pointless.
         */
        public boolean isDuplicate() {
            return receivedSequence < expectedSequence;
        }
    }

    @Getter
    public static class QuotaExceededException extends StratumServiceException {
        private final List<String> errors;

        public QuotaExceededException(List<String> errors) {
            super("One or more quotas are over limit: " + String.join(", ", errors));
            this.errors = errors;
        }
    }

    public static class BackendUnavailableException extends StratumServiceException {
        public BackendUnavailableException(String msg) {
            super(msg);
        }

        public BackendUnavailableException(String msg, Throwable t) {
            super(msg, t);
        }
    }

    /**
     * A statistics query hit its deadline or was cancelled. Carries what was computed so far.
     */
    public static class PartialResultException extends StratumServiceException {
        private final Object partialResult;

        public PartialResultException(String msg, Object partialResult) {
            super(msg);
            this.partialResult = partialResult;
        }

        @SuppressWarnings("unchecked")
        public <T> T getPartialResult() {
            return (T) partialResult;
        }
    }

    /**
     * Whether a caller should retry the failed operation after a backoff.
     */
    public static boolean isRetryable(Throwable t) {
        Throwable cause = FutureUtil.unwrapCompletionException(t);
        if (cause instanceof OutOfOrderEventException) {
            return !((OutOfOrderEventException) cause).isDuplicate();
        }
        return cause instanceof QuotaRecordMissingException || cause instanceof BackendUnavailableException;
    }
}
