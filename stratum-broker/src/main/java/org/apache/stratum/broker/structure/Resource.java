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
package org.apache.stratum.broker.structure;

import com.google.common.collect.ImmutableList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.apache.stratum.common.naming.ScopeName;
import org.apache.stratum.common.policies.data.ResourceFigures;
import org.apache.stratum.common.policies.data.ResourceKind;
import org.apache.stratum.common.policies.data.ResourceState;
import org.apache.stratum.common.policies.data.ResourceType;

/**
 * A cloud resource (instance or volume) owned by a project.
 * <p>
 * The lifecycle status is replaced as a whole so that readers always observe a consistent
 * state/figures/sequence triple. The ancestor scope list is computed when the resource is registered and
 * refreshed by the registry when the project's group membership changes.
 */
@Getter
public class Resource {
    private final String uuid;
    private final String projectUuid;
    private final ResourceKind kind;
    private final String backendRef;
    private final long createdAt;

    private volatile Status status;
    private volatile List<ScopeName> ancestors;

    public Resource(String uuid, String projectUuid, ResourceKind kind, String backendRef, long createdAt,
                    List<ScopeName> ancestors) {
        this.uuid = uuid;
        this.projectUuid = projectUuid;
        this.kind = kind;
        this.backendRef = backendRef;
        this.createdAt = createdAt;
        this.ancestors = ImmutableList.copyOf(ancestors);
        this.status = new Status(null, ResourceFigures.ZERO, 0, false);
    }

    /**
     * Lifecycle bookkeeping of a resource.
     */
    @Getter
    @ToString
    @AllArgsConstructor
    public static final class Status {
        /** Null until the first lifecycle event is applied. */
        private final ResourceState state;
        private final ResourceFigures figures;
        private final long lastSequence;
        /** Whether the figures were already released from the ledger. */
        private final boolean released;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    void setAncestors(List<ScopeName> ancestors) {
        this.ancestors = ImmutableList.copyOf(ancestors);
    }

    /**
     * Whether the resource currently counts toward the usage of its scopes.
     */
    public boolean isLive() {
        Status current = status;
        return current.getState() != null && !current.isReleased();
    }

    /**
     * Current consumption per resource type, read from a single status; all zero when the resource does not
     * count toward usage.
     */
    public Map<ResourceType, Long> consumptions() {
        Status current = status;
        Map<ResourceType, Long> result = new EnumMap<>(ResourceType.class);
        boolean counted = current.getState() != null && !current.isReleased();
        for (ResourceType type : ResourceType.values()) {
            result.put(type, counted ? type.consumptionOf(current.getFigures(), kind) : 0L);
        }
        return result;
    }

    @Override
    public String toString() {
        return "resource " + uuid + " (" + kind + ", project " + projectUuid + ")";
    }
}
