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
package org.apache.stratum.broker;

import java.util.Properties;
import lombok.ToString;
import org.apache.stratum.common.configuration.Category;
import org.apache.stratum.common.configuration.FieldContext;
import org.apache.stratum.common.configuration.StratumConfiguration;

/**
 * Stratum service configuration object.
 * Settings marked dynamic are re-read by the periodic tasks on every run.
 */
@ToString
public class ServiceConfiguration implements StratumConfiguration {

    @Category
    private static final String CATEGORY_SERVER = "Server";
    @Category
    private static final String CATEGORY_QUOTA = "Quota";
    @Category
    private static final String CATEGORY_LIFECYCLE = "Lifecycle";
    @Category
    private static final String CATEGORY_RECONCILIATION = "Reconciliation";
    @Category
    private static final String CATEGORY_MONITORING = "Monitoring";
    @Category
    private static final String CATEGORY_STATISTICS = "Statistics";

    /***** --- properties --- *****/
    private Properties properties = new Properties();

    @FieldContext(
            dynamic = true,
            minValue = 1,
            category = CATEGORY_RECONCILIATION,
            doc = "Interval, in seconds, between two reconciliation passes that recompute usage from the live"
                    + " resources and correct ledger drift."
    )
    private int reconciliationIntervalSeconds = 600;

    @FieldContext(
            dynamic = true,
            minValue = 1,
            category = CATEGORY_MONITORING,
            doc = "Interval, in seconds, between two pulls of utilization samples from the monitoring backend."
    )
    private int sampleIngestionIntervalSeconds = 60;

    @FieldContext(
            minValue = 1,
            category = CATEGORY_MONITORING,
            doc = "Usage samples older than this many hours are purged."
    )
    private int sampleRetentionHours = 720;

    @FieldContext(
            minValue = 1,
            category = CATEGORY_QUOTA,
            doc = "Quota history entries older than this many days are purged."
    )
    private int quotaHistoryRetentionDays = 400;

    @FieldContext(
            minValue = 1,
            category = CATEGORY_MONITORING,
            doc = "Timeout, in milliseconds, of a sample fetch for a single resource."
    )
    private long monitoringFetchTimeoutMillis = 5000;

    @FieldContext(
            category = CATEGORY_MONITORING,
            doc = "When a sample fetch fails, degrade the resource to zero data and log a warning instead of"
                    + " failing the query."
    )
    private boolean monitoringFailSilently = true;

    @FieldContext(
            dynamic = true,
            minValue = 0,
            category = CATEGORY_QUOTA,
            doc = "Ratio of the limit above which a quota_usage_is_over_threshold alert is opened."
    )
    private double quotaUsageAlertThreshold = 0.8;

    @FieldContext(
            minValue = 1,
            category = CATEGORY_QUOTA,
            doc = "Closed alerts are purged this many days after they were closed."
    )
    private int closedAlertRetentionDays = 90;

    @FieldContext(
            minValue = 0,
            category = CATEGORY_LIFECYCLE,
            doc = "Maximum number of out-of-order lifecycle events held per resource until their predecessors arrive."
    )
    private int lifecycleMaxParkedEventsPerResource = 64;

    @FieldContext(
            minValue = 1,
            category = CATEGORY_LIFECYCLE,
            doc = "Parked lifecycle events expire after this many seconds."
    )
    private int lifecycleParkedEventTtlSeconds = 300;

    @FieldContext(
            minValue = 0,
            category = CATEGORY_LIFECYCLE,
            doc = "Number of times a lifecycle event submission is retried on a retryable failure."
    )
    private int lifecycleMaxRetries = 5;

    @FieldContext(
            minValue = 1,
            category = CATEGORY_LIFECYCLE,
            doc = "Initial backoff, in milliseconds, between lifecycle event submission retries."
    )
    private long lifecycleRetryInitialBackoffMillis = 100;

    @FieldContext(
            minValue = 1,
            category = CATEGORY_LIFECYCLE,
            doc = "Maximum backoff, in milliseconds, between lifecycle event submission retries."
    )
    private long lifecycleRetryMaxBackoffMillis = 5000;

    @FieldContext(
            minValue = 1,
            category = CATEGORY_STATISTICS,
            doc = "Number of buckets of a statistics query that does not ask for one."
    )
    private int statisticsDefaultBucketCount = 6;

    @FieldContext(
            minValue = 1,
            category = CATEGORY_STATISTICS,
            doc = "Deadline, in milliseconds, of a statistics query that does not carry one."
    )
    private long statisticsQueryTimeoutMillis = 30000;

    @FieldContext(
            minValue = 1,
            category = CATEGORY_SERVER,
            doc = "Number of threads of the scheduler that runs the periodic tasks."
    )
    private int numSchedulerThreads = 2;

    @Override
    public Properties getProperties() {
        return properties;
    }

    @Override
    public void setProperties(Properties properties) {
        this.properties = properties;
    }

    public int getReconciliationIntervalSeconds() {
        return reconciliationIntervalSeconds;
    }

    public void setReconciliationIntervalSeconds(int reconciliationIntervalSeconds) {
        this.reconciliationIntervalSeconds = reconciliationIntervalSeconds;
    }

    public int getSampleIngestionIntervalSeconds() {
        return sampleIngestionIntervalSeconds;
    }

    public void setSampleIngestionIntervalSeconds(int sampleIngestionIntervalSeconds) {
        this.sampleIngestionIntervalSeconds = sampleIngestionIntervalSeconds;
    }

    public int getSampleRetentionHours() {
        return sampleRetentionHours;
    }

    public void setSampleRetentionHours(int sampleRetentionHours) {
        this.sampleRetentionHours = sampleRetentionHours;
    }

    public int getQuotaHistoryRetentionDays() {
        return quotaHistoryRetentionDays;
    }

    public void setQuotaHistoryRetentionDays(int quotaHistoryRetentionDays) {
        this.quotaHistoryRetentionDays = quotaHistoryRetentionDays;
    }

    public long getMonitoringFetchTimeoutMillis() {
        return monitoringFetchTimeoutMillis;
    }

    public void setMonitoringFetchTimeoutMillis(long monitoringFetchTimeoutMillis) {
        this.monitoringFetchTimeoutMillis = monitoringFetchTimeoutMillis;
    }

    public boolean isMonitoringFailSilently() {
        return monitoringFailSilently;
    }

    public void setMonitoringFailSilently(boolean monitoringFailSilently) {
        this.monitoringFailSilently = monitoringFailSilently;
    }

    public double getQuotaUsageAlertThreshold() {
        return quotaUsageAlertThreshold;
    }

    public void setQuotaUsageAlertThreshold(double quotaUsageAlertThreshold) {
        this.quotaUsageAlertThreshold = quotaUsageAlertThreshold;
    }

    public int getClosedAlertRetentionDays() {
        return closedAlertRetentionDays;
    }

    public void setClosedAlertRetentionDays(int closedAlertRetentionDays) {
        this.closedAlertRetentionDays = closedAlertRetentionDays;
    }

    public int getLifecycleMaxParkedEventsPerResource() {
        return lifecycleMaxParkedEventsPerResource;
    }

    public void setLifecycleMaxParkedEventsPerResource(int lifecycleMaxParkedEventsPerResource) {
        this.lifecycleMaxParkedEventsPerResource = lifecycleMaxParkedEventsPerResource;
    }

    public int getLifecycleParkedEventTtlSeconds() {
        return lifecycleParkedEventTtlSeconds;
    }

    public void setLifecycleParkedEventTtlSeconds(int lifecycleParkedEventTtlSeconds) {
        this.lifecycleParkedEventTtlSeconds = lifecycleParkedEventTtlSeconds;
    }

    public int getLifecycleMaxRetries() {
        return lifecycleMaxRetries;
    }

    public void setLifecycleMaxRetries(int lifecycleMaxRetries) {
        this.lifecycleMaxRetries = lifecycleMaxRetries;
    }

    public long getLifecycleRetryInitialBackoffMillis() {
        return lifecycleRetryInitialBackoffMillis;
    }

    public void setLifecycleRetryInitialBackoffMillis(long lifecycleRetryInitialBackoffMillis) {
        this.lifecycleRetryInitialBackoffMillis = lifecycleRetryInitialBackoffMillis;
    }

    public long getLifecycleRetryMaxBackoffMillis() {
        return lifecycleRetryMaxBackoffMillis;
    }

    public void setLifecycleRetryMaxBackoffMillis(long lifecycleRetryMaxBackoffMillis) {
        this.lifecycleRetryMaxBackoffMillis = lifecycleRetryMaxBackoffMillis;
    }

    public int getStatisticsDefaultBucketCount() {
        return statisticsDefaultBucketCount;
    }

    public void setStatisticsDefaultBucketCount(int statisticsDefaultBucketCount) {
        this.statisticsDefaultBucketCount = statisticsDefaultBucketCount;
    }

    public long getStatisticsQueryTimeoutMillis() {
        return statisticsQueryTimeoutMillis;
    }

    public void setStatisticsQueryTimeoutMillis(long statisticsQueryTimeoutMillis) {
        this.statisticsQueryTimeoutMillis = statisticsQueryTimeoutMillis;
    }

    public int getNumSchedulerThreads() {
        return numSchedulerThreads;
    }

    public void setNumSchedulerThreads(int numSchedulerThreads) {
        this.numSchedulerThreads = numSchedulerThreads;
    }
}
