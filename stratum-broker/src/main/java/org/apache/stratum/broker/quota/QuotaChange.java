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

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A committed change of one quota record, as delivered to {@link QuotaLedgerListener}s.
 */
@Getter
@ToString
@AllArgsConstructor
public final class QuotaChange {
    private final QuotaKey key;
    private final Long previousLimit;
    private final long previousUsage;
    private final Long limit;
    private final long usage;
    private final long version;
    /** Epoch seconds. */
    private final long timestamp;
}
