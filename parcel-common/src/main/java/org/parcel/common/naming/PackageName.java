/**
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
package org.parcel.common.naming;

import com.google.common.base.Splitter;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import org.parcel.common.version.Version;

/**
 * A validated package coordinate: a package name, optionally pinned to a version ({@code name@version}).
 */
public class PackageName {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z][a-z0-9_-]*$");

    private static final LoadingCache<String, PackageName> cache = CacheBuilder.newBuilder().maximumSize(100000)
            .expireAfterAccess(30, TimeUnit.MINUTES)
            .build(new CacheLoader<String, PackageName>() {
                @Override
                public PackageName load(String name) throws Exception {
                    return new PackageName(name);
                }
            });

    private final String name;
    private final String version;
    private final String completeName;

    public static PackageName get(String name, String version) {
        return get(name + "@" + version);
    }

    public static PackageName get(String packageName) {
        try {
            return cache.getUnchecked(packageName);
        } catch (UncheckedExecutionException e) {
            throw (RuntimeException) e.getCause();
        }
    }

    public static boolean isValidName(String name) {
        return name != null && NAME_PATTERN.matcher(name).matches();
    }

    public static void validateName(String name) {
        if (!isValidName(name)) {
            throw new IllegalArgumentException("Invalid package name '" + name + "'. Must start with lowercase letter"
                    + " and contain only lowercase letters, numbers, underscores, and hyphens.");
        }
    }

    private PackageName(String packageName) {
        List<String> parts = Splitter.on('@').splitToList(packageName);
        if (parts.size() > 2) {
            throw new IllegalArgumentException("Invalid package coordinate '" + packageName + "'");
        }
        validateName(parts.get(0));
        this.name = parts.get(0);
        if (parts.size() == 2) {
            // validates the version grammar, the original string is kept as the canonical form
            Version.parse(parts.get(1));
            this.version = parts.get(1);
            this.completeName = name + "@" + version;
        } else {
            this.version = null;
            this.completeName = name;
        }
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public boolean hasVersion() {
        return version != null;
    }

    public PackageName withoutVersion() {
        return hasVersion() ? get(name) : this;
    }

    /**
     * The key under which the artifact of this version is stored: {@code name/version}.
     */
    public String getBlobPath() {
        if (!hasVersion()) {
            throw new IllegalStateException("Package coordinate '" + completeName + "' has no version");
        }
        return String.format("%s/%s", name, version);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PackageName)) {
            return false;
        }
        return completeName.equals(((PackageName) o).completeName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(completeName);
    }

    @Override
    public String toString() {
        return completeName;
    }
}
