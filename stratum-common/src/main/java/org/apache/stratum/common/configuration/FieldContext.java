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
package org.apache.stratum.common.configuration;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Describes a configuration setting: its bounds, its category and whether it may change at runtime.
 * {@link StratumConfigurationLoader#isComplete(Object)} validates settings against these constraints.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface FieldContext {

    /**
     * Whether the setting must carry a non-empty value.
     *
     * @return true if the setting is required
     */
    boolean required() default false;

    /**
     * Lower bound of a numeric setting.
     *
     * @return minimum value of the setting
     */
    long minValue() default Long.MIN_VALUE;

    /**
     * Upper bound of a numeric setting.
     *
     * @return maximum value of the setting
     */
    long maxValue() default Long.MAX_VALUE;

    /**
     * Whether the setting is re-read by the periodic tasks, so that changing it takes effect without a restart.
     */
    boolean dynamic() default false;

    /**
     * Category to group settings.
     *
     * @return category name
     */
    String category() default "";

    /**
     * Documentation of the setting.
     */
    String doc() default "";
}
