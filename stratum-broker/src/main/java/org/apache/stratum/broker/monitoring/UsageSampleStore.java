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

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import lombok.EqualsAndHashCode;
import org.apache.stratum.common.policies.data.MonitoringItem;

/**
 * Append-only store of normalized samples, one time series per resource and item. A sample is identified by
 * its resource, item and timestamp; appending it again is a no-op.
 */
public class UsageSampleStore {

    @EqualsAndHashCode
    private static final class SeriesKey {
        private final String resourceId;
        private final MonitoringItem item;

        private SeriesKey(String resourceId, MonitoringItem item) {
            this.resourceId = resourceId;
            this.item = item;
        }
    }

    private final Map<SeriesKey, NavigableMap<Long, UsageSample>> series = new ConcurrentHashMap<>();

    /**
     * @return number of samples that were not stored yet
     */
    public int append(Collection<UsageSample> samples) {
        int added = 0;
        for (UsageSample sample : samples) {
            NavigableMap<Long, UsageSample> timeSeries = series.computeIfAbsent(
                    new SeriesKey(sample.getResourceId(), sample.getItem()), k -> new ConcurrentSkipListMap<>());
            if (timeSeries.putIfAbsent(sample.getTimestamp(), sample) == null) {
                added++;
            }
        }
        return added;
    }

    /**
     * Samples of a resource and item with timestamps in {@code [from, to)}, in time order.
     */
    public List<UsageSample> query(String resourceId, MonitoringItem item, long from, long to) {
        NavigableMap<Long, UsageSample> timeSeries = series.get(new SeriesKey(resourceId, item));
        if (timeSeries == null || from >= to) {
            return ImmutableList.of();
        }
        return ImmutableList.copyOf(timeSeries.subMap(from, true, to, false).values());
    }

    /**
     * Drop samples older than the cutoff.
     *
     * @return number of samples dropped
     */
    public int purge(long cutoffTimestamp) {
        int purged = 0;
        for (Map.Entry<SeriesKey, NavigableMap<Long, UsageSample>> entry : series.entrySet()) {
            NavigableMap<Long, UsageSample> expired = entry.getValue().headMap(cutoffTimestamp, false);
            purged += expired.size();
            expired.clear();
            if (entry.getValue().isEmpty()) {
                series.remove(entry.getKey(), entry.getValue());
            }
        }
        return purged;
    }

    public int size() {
        return series.values().stream().mapToInt(Map::size).sum();
    }
}
