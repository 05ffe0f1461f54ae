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
package org.apache.stratum.broker.reconciliation;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.apache.stratum.broker.quota.QuotaKey;

/**
 * Outcome of a reconciliation pass.
 */
@ToString
public class ReconciliationResult {

    @Getter
    @ToString
    @AllArgsConstructor
    public static final class Correction {
        private final QuotaKey key;
        private final long ledgerUsage;
        private final long trueUsage;

        public long getDrift() {
            return trueUsage - ledgerUsage;
        }
    }

    @Getter
    private int quotasChecked;
    @Getter
    private int skipped;
    private final List<Correction> corrections = new ArrayList<>();

    void checked() {
        quotasChecked++;
    }

    void skipped() {
        skipped++;
    }

    void corrected(Correction correction) {
        corrections.add(correction);
    }

    public List<Correction> getCorrections() {
        return ImmutableList.copyOf(corrections);
    }
}
