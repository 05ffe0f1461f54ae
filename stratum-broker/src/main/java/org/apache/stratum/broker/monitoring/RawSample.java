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
package org.apache.stratum.broker.monitoring;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.apache.stratum.common.policies.data.MonitoringItem;
import org.apache.stratum.common.policies.data.SampleUnit;

/**
 * A sample as reported by the monitoring backend, in the backend's unit.
 */
@Getter
@ToString
@AllArgsConstructor
public final class RawSample {
    private final String resourceId;
    /** Epoch seconds. */
    private final long timestamp;
    private final MonitoringItem item;
    private final double value;
    private final SampleUnit unit;
}
