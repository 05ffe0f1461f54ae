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

import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * One window of a quota timeline. Values hold, per resource type, the summed average limit under
 * {@code <type>} (-1 when every scope is unlimited) and the summed average usage under {@code <type>_usage}.
 */
@Getter
@ToString
@AllArgsConstructor
public final class QuotaTimelineBucket {
    /** Epoch seconds, inclusive. */
    private final long from;
    /** Epoch seconds, exclusive. */
    private final long to;
    private final Map<String, Double> values;
}
