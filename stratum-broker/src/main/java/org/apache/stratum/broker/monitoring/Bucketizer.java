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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import org.apache.stratum.broker.StratumServiceException.ValidationException;

/**
 * Aligns timestamped values onto equal-width windows.
 * <p>
 * {@code [from, to)} is divided into exactly {@code n} contiguous windows in ascending order; the boundary of
 * window {@code i} is {@code from + (to - from) * i / n} in integer arithmetic, so the windows cover the range
 * without gaps or overlaps even when the width does not divide evenly. A window without values has value 0.
 */
public class Bucketizer {

    private Bucketizer() {}

    /**
     * Mean of the sample values falling in each window.
     */
    public static List<Bucket> bucketize(Collection<UsageSample> samples, long from, long to, int buckets)
            throws ValidationException {
        long[] timestamps = new long[samples.size()];
        double[] values = new double[samples.size()];
        int i = 0;
        for (UsageSample sample : samples) {
            timestamps[i] = sample.getTimestamp();
            values[i] = sample.getValue();
            i++;
        }
        return aggregate(timestamps, values, boundaries(from, to, buckets), true);
    }

    /**
     * Number of timestamps falling in each window.
     */
    public static List<Bucket> count(Collection<Long> timestamps, long from, long to, int buckets)
            throws ValidationException {
        long[] points = timestamps.stream().mapToLong(Long::longValue).toArray();
        double[] ones = new double[points.length];
        Arrays.fill(ones, 1.0);
        return aggregate(points, ones, boundaries(from, to, buckets), false);
    }

    /**
     * The {@code n + 1} window boundaries of {@code [from, to)}.
     */
    public static long[] boundaries(long from, long to, int buckets) throws ValidationException {
        if (from >= to) {
            throw new ValidationException("Invalid time range: from " + from + " must be before to " + to);
        }
        if (buckets <= 0) {
            throw new ValidationException("Invalid number of buckets " + buckets);
        }
        long[] bounds = new long[buckets + 1];
        long width = to - from;
        try {
            for (int i = 0; i <= buckets; i++) {
                bounds[i] = from + Math.multiplyExact(width, (long) i) / buckets;
            }
        } catch (ArithmeticException e) {
            throw new ValidationException("Time range [" + from + ", " + to + ") is too wide for " + buckets
                    + " buckets", e);
        }
        return bounds;
    }

    private static List<Bucket> aggregate(long[] timestamps, double[] values, long[] bounds, boolean average) {
        Integer[] order = new Integer[timestamps.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingLong(i -> timestamps[i]));

        int buckets = bounds.length - 1;
        List<Bucket> result = new ArrayList<>(buckets);
        int next = 0;
        while (next < order.length && timestamps[order[next]] < bounds[0]) {
            next++;
        }
        for (int b = 0; b < buckets; b++) {
            double sum = 0;
            int count = 0;
            while (next < order.length && timestamps[order[next]] < bounds[b + 1]) {
                sum += values[order[next]];
                count++;
                next++;
            }
            double value = average && count > 0 ? sum / count : sum;
            result.add(new Bucket(bounds[b], bounds[b + 1], value));
        }
        return result;
    }
}
