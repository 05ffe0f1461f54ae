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

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Calendar unit used to align quota timeline buckets. Buckets are aligned in UTC.
 */
public enum TimelineInterval {
    hour,
    day,
    week,
    month;

    /**
     * Start of the interval containing the given epoch second.
     */
    public long floor(long epochSeconds) {
        ZonedDateTime time = ZonedDateTime.ofInstant(Instant.ofEpochSecond(epochSeconds), ZoneOffset.UTC);
        switch (this) {
            case hour:
                time = time.truncatedTo(ChronoUnit.HOURS);
                break;
            case day:
                time = time.truncatedTo(ChronoUnit.DAYS);
                break;
            case week:
                time = time.truncatedTo(ChronoUnit.DAYS).minusDays(time.getDayOfWeek().getValue() - 1);
                break;
            case month:
                time = time.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1);
                break;
            default:
                throw new IllegalStateException("Unknown interval " + this);
        }
        return time.toEpochSecond();
    }

    /**
     * Start of the interval following the one that starts at the given epoch second.
     */
    public long next(long intervalStart) {
        ZonedDateTime time = ZonedDateTime.ofInstant(Instant.ofEpochSecond(intervalStart), ZoneOffset.UTC);
        switch (this) {
            case hour:
                return time.plusHours(1).toEpochSecond();
            case day:
                return time.plusDays(1).toEpochSecond();
            case week:
                return time.plusWeeks(1).toEpochSecond();
            case month:
                return time.plusMonths(1).toEpochSecond();
            default:
                throw new IllegalStateException("Unknown interval " + this);
        }
    }

    public static TimelineInterval fromName(String name) {
        for (TimelineInterval interval : values()) {
            if (interval.name().equals(name)) {
                return interval;
            }
        }
        throw new IllegalArgumentException("Invalid interval '" + name + "'");
    }
}
