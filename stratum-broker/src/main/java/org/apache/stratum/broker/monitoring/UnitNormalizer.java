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

import org.apache.stratum.common.policies.data.MonitoringItem;
import org.apache.stratum.common.policies.data.SampleUnit;

/**
 * Converts raw samples to the units statistics are reported in: cpu to a 0-100 percentage, memory and storage
 * to MiB.
 */
public class UnitNormalizer {

    private static final double KIB = 1024;

    private UnitNormalizer() {}

    public static UsageSample normalize(RawSample raw) {
        return new UsageSample(raw.getResourceId(), raw.getTimestamp(), raw.getItem(),
                normalize(raw.getItem(), raw.getValue(), raw.getUnit()));
    }

    /**
     * @throws IllegalArgumentException if the value is negative or not a number, or the unit does not apply to
     *                                  the item
     */
    public static double normalize(MonitoringItem item, double value, SampleUnit unit) {
        if (Double.isNaN(value) || value < 0) {
            throw new IllegalArgumentException("Invalid " + item + " sample value " + value);
        }
        switch (item) {
            case cpu:
                if (unit == SampleUnit.RATIO) {
                    return Math.min(100.0, value * 100.0);
                } else if (unit == SampleUnit.PERCENT) {
                    return Math.min(100.0, value);
                }
                break;
            case memory:
            case storage:
                switch (unit) {
                    case BYTES:
                        return value / KIB / KIB;
                    case KIB:
                        return value / KIB;
                    case MIB:
                        return value;
                    case GIB:
                        return value * KIB;
                    default:
                        break;
                }
                break;
            default:
                break;
        }
        throw new IllegalArgumentException("Unit " + unit + " does not apply to " + item);
    }
}
