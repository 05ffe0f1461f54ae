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
package org.apache.stratum.common.naming;

/**
 * Level of the tenant hierarchy a quota or a statistic is reported against.
 */
public enum ScopeType {
    Customer("customer"),
    ProjectGroup("project_group"),
    Project("project");

    private final String name;

    ScopeType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static ScopeType fromName(String name) {
        for (ScopeType type : values()) {
            if (type.name.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid scope type '" + name + "'");
    }

    @Override
    public String toString() {
        return name;
    }
}
