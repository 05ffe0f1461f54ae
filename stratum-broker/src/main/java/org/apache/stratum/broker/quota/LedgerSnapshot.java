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

import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import org.apache.stratum.common.naming.ScopeName;
import org.apache.stratum.common.policies.data.ResourceType;

/**
 * Read view of the ledger at one commit sequence. A batch is either entirely reflected in it or not at all.
 */
public class LedgerSnapshot {
    @Getter
    private final long readSequence;
    private final Map<QuotaKey, Quota> quotas;

    LedgerSnapshot(long readSequence, Map<QuotaKey, Quota> quotas) {
        this.readSequence = readSequence;
        this.quotas = ImmutableMap.copyOf(quotas);
    }

    /**
     * @return the quota, or null when the snapshot holds no record for the key
     */
    public Quota get(QuotaKey key) {
        return quotas.get(key);
    }

    public Quota get(ScopeName scope, ResourceType resourceType) {
        return quotas.get(QuotaKey.of(scope, resourceType));
    }

    public Map<QuotaKey, Quota> getQuotas() {
        return quotas;
    }

    /**
     * Sums the quotas of the given scopes. For every resource type the result holds the sum of usages under
     * {@code <type>_usage} and the sum of limits under {@code <type>}; unlimited quotas are left out of the
     * limit sum, which is -1 when every quota is unlimited. Scopes without records are ignored.
     */
    public Map<String, Long> sumOfQuotas(Collection<ScopeName> scopes, Collection<ResourceType> resourceTypes) {
        Map<String, Long> result = new LinkedHashMap<>();
        if (scopes.isEmpty()) {
            return result;
        }
        for (ResourceType type : resourceTypes) {
            long usage = 0;
            long limit = 0;
            boolean limited = false;
            for (ScopeName scope : scopes) {
                Quota quota = get(scope, type);
                if (quota == null) {
                    continue;
                }
                usage += quota.getUsage();
                if (!quota.isUnlimited()) {
                    limit += quota.getLimit();
                    limited = true;
                }
            }
            result.put(type.name(), limited ? limit : -1L);
            result.put(type.usageName(), usage);
        }
        return result;
    }
}
