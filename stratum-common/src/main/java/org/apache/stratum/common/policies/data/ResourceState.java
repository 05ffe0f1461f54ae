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
package org.apache.stratum.common.policies.data;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a resource. A lifecycle event names the state the resource moves to.
 */
public enum ResourceState {
    PROVISIONING,
    ACTIVE,
    RESIZING,
    DELETING,
    DELETED,
    ERRED;

    /**
     * States whose figures no longer count toward usage once entered.
     */
    public boolean isReleasing() {
        return this == DELETING || this == DELETED || this == ERRED;
    }

    /**
     * A resource in a terminal state no longer contributes to usage.
     */
    public boolean isTerminal() {
        return this == DELETED || this == ERRED;
    }

    /**
     * Whether a resource that does not exist yet may be registered by a transition to this state.
     */
    public boolean isCreating() {
        return this == PROVISIONING || this == ACTIVE;
    }

    public boolean canTransitionTo(ResourceState target) {
        return allowedTargets(this).contains(target);
    }

    private static Set<ResourceState> allowedTargets(ResourceState from) {
        switch (from) {
            case PROVISIONING:
            case ACTIVE:
            case RESIZING:
                return EnumSet.of(ACTIVE, RESIZING, DELETING, DELETED, ERRED);
            case DELETING:
                return EnumSet.of(DELETING, DELETED, ERRED);
            case DELETED:
                return EnumSet.of(DELETED);
            case ERRED:
                return EnumSet.of(DELETING, DELETED, ERRED);
            default:
                return EnumSet.noneOf(ResourceState.class);
        }
    }
}
