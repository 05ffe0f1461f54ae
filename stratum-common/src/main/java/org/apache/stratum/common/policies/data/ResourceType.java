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

/**
 * Quota'd resource types. The enum constant names are the names quotas are reported under.
 */
public enum ResourceType {
    vcpu,
    ram,
    storage,
    max_instances;

    /**
     * Consumption of a resource of the given kind for this resource type.
     */
    public long consumptionOf(ResourceFigures figures, ResourceKind kind) {
        switch (this) {
            case vcpu:
                return figures.getVcpu();
            case ram:
                return figures.getRamMb();
            case storage:
                return figures.getStorageMb();
            case max_instances:
                return kind == ResourceKind.INSTANCE ? 1 : 0;
            default:
                throw new IllegalStateException("Unknown resource type " + this);
        }
    }

    public String usageName() {
        return name() + "_usage";
    }

    public static ResourceType fromName(String name) {
        for (ResourceType type : values()) {
            if (type.name().equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid resource type '" + name + "'");
    }
}
