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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.stratum.common.naming.ScopeName;
import org.apache.stratum.common.policies.data.ResourceType;

/**
 * Identifies a quota record: one resource type within one scope. The natural ordering is the canonical order
 * in which a batch installs its changes.
 */
@Getter
@EqualsAndHashCode
public final class QuotaKey implements Comparable<QuotaKey> {
    private final ScopeName scope;
    private final ResourceType resourceType;

    private QuotaKey(ScopeName scope, ResourceType resourceType) {
        this.scope = scope;
        this.resourceType = resourceType;
    }

    public static QuotaKey of(ScopeName scope, ResourceType resourceType) {
        if (scope == null || resourceType == null) {
            throw new IllegalArgumentException("Invalid quota key: scope=" + scope + " type=" + resourceType);
        }
        return new QuotaKey(scope, resourceType);
    }

    @Override
    public int compareTo(QuotaKey other) {
        int cmp = scope.compareTo(other.scope);
        return cmp != 0 ? cmp : resourceType.compareTo(other.resourceType);
    }

    @Override
    public String toString() {
        return resourceType + "@" + scope;
    }
}
