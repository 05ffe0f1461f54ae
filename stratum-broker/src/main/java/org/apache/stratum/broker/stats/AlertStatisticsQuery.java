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
package org.apache.stratum.broker.stats;

import java.util.Set;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.apache.stratum.common.naming.ScopeType;

/**
 * Filters of an alert statistics query. Unset filters match every alert.
 */
@Getter
@Builder
@ToString
public final class AlertStatisticsQuery {
    /** Alerts opened at or after this epoch second. */
    private final Long openedFrom;
    /** Alerts opened before this epoch second. */
    private final Long openedTo;
    /** Together with the uuid, restricts to alerts on the scope or anything under it. */
    private final ScopeType aggregate;
    private final String scopeUuid;
    private final Set<String> types;
    private final Boolean acknowledged;
    /** True for open alerts only, false for closed alerts only. */
    private final Boolean opened;
}
