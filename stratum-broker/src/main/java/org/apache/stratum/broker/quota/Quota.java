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
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A committed limit/usage pair. The version is the commit sequence that produced it and is what
 * {@link QuotaLedger#reconcile(QuotaKey, long, long)} compares against.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class Quota {
    private final QuotaKey key;
    /** Null when unlimited. */
    private final Long limit;
    private final long usage;
    private final long version;

    public boolean isUnlimited() {
        return limit == null;
    }
}
