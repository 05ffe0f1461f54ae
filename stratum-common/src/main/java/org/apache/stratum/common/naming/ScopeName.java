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

import com.google.common.base.Splitter;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.StringUtils;

/**
 * Fully qualified name of a scope, in the form {@code <scope_type>://<uuid>}.
 * Instances are interned so that they can be compared cheaply and used as map keys.
 */
public class ScopeName implements Comparable<ScopeName> {

    private final ScopeType type;
    private final String uuid;
    private final String completeName;

    private static final LoadingCache<String, ScopeName> cache = CacheBuilder.newBuilder().maximumSize(100000)
            .expireAfterAccess(30, TimeUnit.MINUTES).build(new CacheLoader<String, ScopeName>() {
                @Override
                public ScopeName load(String name) throws Exception {
                    return new ScopeName(name);
                }
            });

    public static ScopeName get(ScopeType type, String uuid) {
        if (type == null || StringUtils.isBlank(uuid)) {
            throw new IllegalArgumentException("Invalid scope name: type=" + type + " uuid=" + uuid);
        }
        return get(type.getName() + "://" + uuid);
    }

    public static ScopeName customer(String uuid) {
        return get(ScopeType.Customer, uuid);
    }

    public static ScopeName projectGroup(String uuid) {
        return get(ScopeType.ProjectGroup, uuid);
    }

    public static ScopeName project(String uuid) {
        return get(ScopeType.Project, uuid);
    }

    public static ScopeName get(String scopeName) {
        try {
            return cache.getUnchecked(scopeName);
        } catch (UncheckedExecutionException e) {
            throw (RuntimeException) e.getCause();
        }
    }

    private ScopeName(String scopeName) {
        if (scopeName == null || !scopeName.contains("://")) {
            throw new IllegalArgumentException("Invalid scope name '" + scopeName + "'");
        }
        List<String> parts = Splitter.on("://").limit(2).splitToList(scopeName);
        this.type = ScopeType.fromName(parts.get(0));
        if (StringUtils.isBlank(parts.get(1)) || parts.get(1).contains("/")) {
            throw new IllegalArgumentException("Invalid scope name '" + scopeName + "'");
        }
        this.uuid = parts.get(1);
        this.completeName = scopeName;
    }

    public ScopeType getType() {
        return type;
    }

    public String getUuid() {
        return uuid;
    }

    @Override
    public int compareTo(ScopeName other) {
        int cmp = type.compareTo(other.type);
        return cmp != 0 ? cmp : uuid.compareTo(other.uuid);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof ScopeName) {
            return completeName.equals(((ScopeName) obj).completeName);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return completeName.hashCode();
    }

    @Override
    public String toString() {
        return completeName;
    }
}
