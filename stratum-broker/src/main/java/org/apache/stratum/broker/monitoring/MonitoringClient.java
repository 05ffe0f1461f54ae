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

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.apache.stratum.common.policies.data.MonitoringItem;

/**
 * Pull interface of the monitoring backend that stores raw per-resource utilization samples.
 */
public interface MonitoringClient {

    /**
     * Fetch the samples of an item for the given resources with timestamps in {@code [from, to)}.
     *
     * @param from epoch seconds, inclusive
     * @param to epoch seconds, exclusive
     * @return a future completed with the samples, or exceptionally when the backend can't be reached
     */
    CompletableFuture<List<RawSample>> fetchSamples(Collection<String> resourceIds, MonitoringItem item,
                                                    long from, long to);
}
