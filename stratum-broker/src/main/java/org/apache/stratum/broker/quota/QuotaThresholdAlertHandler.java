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

import java.util.function.DoubleSupplier;
import org.apache.stratum.broker.alert.AlertRegistry;
import org.apache.stratum.common.policies.data.AlertSeverity;

/**
 * Opens a warning alert when a committed usage goes over the configured share of its limit, and closes it when
 * the usage falls back or the limit is lifted.
 */
public class QuotaThresholdAlertHandler implements QuotaLedgerListener {
    public static final String ALERT_TYPE = "quota_usage_is_over_threshold";

    private final AlertRegistry alertRegistry;
    private final DoubleSupplier threshold;

    public QuotaThresholdAlertHandler(AlertRegistry alertRegistry, DoubleSupplier threshold) {
        this.alertRegistry = alertRegistry;
        this.threshold = threshold;
    }

    @Override
    public void onQuotaChanged(QuotaChange change) {
        QuotaKey key = change.getKey();
        String subject = key.getResourceType().name();
        Quota quota = new Quota(key, change.getLimit(), change.getUsage(), change.getVersion());
        double ratio = threshold.getAsDouble();
        if (QuotaLedger.isExceeded(quota, 0, ratio)) {
            alertRegistry.open(key.getScope(), subject, AlertSeverity.Warning, ALERT_TYPE,
                    String.format("%s quota usage %d is over %.0f%% of limit %d for %s", subject, change.getUsage(),
                            ratio * 100, change.getLimit(), key.getScope()));
        } else {
            alertRegistry.close(key.getScope(), subject, ALERT_TYPE);
        }
    }
}
