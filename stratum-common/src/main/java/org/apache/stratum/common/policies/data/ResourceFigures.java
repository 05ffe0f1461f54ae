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

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Consumption figures of a resource.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ResourceFigures {
    public static final ResourceFigures ZERO = new ResourceFigures(0, 0, 0);

    private final long vcpu;
    private final long ramMb;
    private final long storageMb;

    public ResourceFigures(long vcpu, long ramMb, long storageMb) {
        Preconditions.checkArgument(vcpu >= 0 && ramMb >= 0 && storageMb >= 0,
                "Consumption figures must be non-negative: vcpu=%s ram_mb=%s storage_mb=%s", vcpu, ramMb, storageMb);
        this.vcpu = vcpu;
        this.ramMb = ramMb;
        this.storageMb = storageMb;
    }

    public static ResourceFigures of(long vcpu, long ramMb, long storageMb) {
        return new ResourceFigures(vcpu, ramMb, storageMb);
    }
}
