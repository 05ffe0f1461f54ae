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
import org.apache.stratum.common.naming.ScopeName;
import org.apache.stratum.common.policies.data.ResourceType;

@Getter
@ToString
@AllArgsConstructor(staticName = "of")
public final class QuotaAdjustment {
    private final QuotaKey key;
    private final long delta;

    public static QuotaAdjustment of(ScopeName scope, ResourceType resourceType, long delta) {
        return of(QuotaKey.of(scope, resourceType), delta);
    }
}
