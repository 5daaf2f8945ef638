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
package org.parcel.registry.data;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Metadata of a package and all of its published versions, newest first.
 */
@Data
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
public class PackageRecord {
    private String name;
    /**
     * Identity that created the package, written together with its first version.
     */
    private String owner;
    private String description;
    @Builder.Default
    private List<String> authors = new ArrayList<>();
    private String license;
    private String repository;
    private String homepage;
    @Builder.Default
    private List<String> keywords = new ArrayList<>();
    private long downloads;
    @Builder.Default
    private List<VersionRecord> versions = new ArrayList<>();
    private long createdAt;
    private long updatedAt;

    public Optional<VersionRecord> findVersion(String version) {
        return versions.stream().filter(v -> v.getVersion().equals(version)).findFirst();
    }

    public boolean hasVersion(String version) {
        return findVersion(version).isPresent();
    }

    /**
     * @return the newest version that is not yanked
     */
    public Optional<VersionRecord> latestVersion() {
        return versions.stream().filter(v -> !v.isYanked()).findFirst();
    }

    /**
     * Deep copy, so that a record handed out by a cache can be modified safely.
     */
    public PackageRecord copy() {
        return toBuilder()
                .authors(new ArrayList<>(authors))
                .keywords(new ArrayList<>(keywords))
                .versions(versions.stream().map(VersionRecord::copy).collect(Collectors.toCollection(ArrayList::new)))
                .build();
    }
}
