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

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of the package listing.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class PackageSummary {
    public static final String NO_VERSION = "none";

    private String name;
    private String description;
    // newest non-yanked version, NO_VERSION when every version is yanked
    private String latest;
    private long downloads;
    private long updatedAt;

    public static PackageSummary of(PackageRecord record) {
        String latest = record.latestVersion().map(VersionRecord::getVersion).orElse(NO_VERSION);
        return new PackageSummary(record.getName(), record.getDescription(), latest, record.getDownloads(),
                record.getUpdatedAt());
    }
}
