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

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.apache.stratum.common.policies.data.ResourceFigures;
import org.apache.stratum.common.policies.data.ResourceKind;
import org.apache.stratum.common.policies.data.ResourceState;

/**
 * A resource lifecycle transition reported by a resource backend. Sequence numbers start at 1 and grow by one
 * per event of the same resource.
 */
@Getter
@Builder
@ToString
public final class LifecycleEvent {
    private final String resourceId;
    private final String projectId;
    @Builder.Default
    private final ResourceKind kind = ResourceKind.INSTANCE;
    /** Reference of the backend settings the resource is provisioned on, may be null. */
    private final String backendRef;
    /** Figures after the transition; ignored by releasing transitions. */
    private final ResourceFigures figures;
    /** State the resource moves to. */
    private final ResourceState transition;
    private final long sequenceNumber;
    /** Epoch seconds. */
    private final long timestamp;
}
