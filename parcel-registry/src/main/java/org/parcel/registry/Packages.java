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
package org.parcel.registry;

import java.io.OutputStream;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.parcel.registry.authentication.Identity;
import org.parcel.registry.data.DescriptiveUpdate;
import org.parcel.registry.data.DownloadResult;
import org.parcel.registry.data.PackageInfo;
import org.parcel.registry.data.PackageRecord;
import org.parcel.registry.data.PackageSummary;
import org.parcel.registry.data.PublishRequest;
import org.parcel.registry.data.PublishResult;
import org.parcel.registry.data.RegistryStats;
import org.parcel.registry.data.VersionRecord;

/**
 * Packages is the registry surface a transport layer calls into. Every future fails with a
 * {@link org.parcel.registry.exception.RegistryException} whose kind maps to a response status.
 */
public interface Packages {

    /**
     * Get a package with a download locator for each of its versions. Counts as one download of the package.
     *
     * @param name package name
     * @return the package, or a future failed with {@code PackageNotFoundException}
     */
    CompletableFuture<PackageInfo> getPackage(String name);

    /**
     * Get a single version of a package, yanked or not.
     *
     * @param name package name
     * @param version version string
     * @return the version record
     */
    CompletableFuture<VersionRecord> getVersion(String name, String version);

    /**
     * Resolve the newest version that is not yanked.
     *
     * @param name package name
     * @return the version, empty when every version is yanked
     */
    CompletableFuture<Optional<VersionRecord>> latestVersion(String name);

    /**
     * Read the artifact of a version.
     *
     * @param name package name
     * @param version version string
     * @return the artifact, or a future failed with {@code NotFoundException} for an unknown version,
     *         {@code GoneException} for a yanked one
     */
    CompletableFuture<DownloadResult> download(String name, String version);

    /**
     * Stream the artifact of a version, with the same checks as {@link #download(String, String)}.
     *
     * @param name package name
     * @param version version string
     * @param outputStream where the artifact is written
     * @return the version that was streamed
     */
    CompletableFuture<VersionRecord> download(String name, String version, OutputStream outputStream);

    /**
     * Publish a new version.
     *
     * @param credential credential presented by the client
     * @param request publish request
     * @return the published version
     */
    CompletableFuture<PublishResult> publish(String credential, PublishRequest request);

    CompletableFuture<PublishResult> publish(Identity identity, PublishRequest request);

    /**
     * Mark a version as yanked. Yanked versions stay listed but can no longer be downloaded.
     *
     * @return the version record after the change
     */
    CompletableFuture<VersionRecord> yank(String credential, String name, String version);

    CompletableFuture<VersionRecord> yank(Identity identity, String name, String version);

    /**
     * Clear the yanked flag of a version.
     *
     * @return the version record after the change
     */
    CompletableFuture<VersionRecord> unyank(String credential, String name, String version);

    CompletableFuture<VersionRecord> unyank(Identity identity, String name, String version);

    /**
     * Update the descriptive fields of a package.
     *
     * @param identity identity doing the change, must own the package or be a super-user
     * @param name package name
     * @param update the fields to change
     * @return the record after the change
     */
    CompletableFuture<PackageRecord> updateMetadata(Identity identity, String name, DescriptiveUpdate update);

    /**
     * List all packages, most recently updated first.
     */
    CompletableFuture<List<PackageSummary>> list();

    /**
     * Search package names, descriptions and keywords.
     *
     * @param query case-insensitive substring, blank matches everything
     */
    CompletableFuture<List<PackageRecord>> search(String query);

    /**
     * List the names of the packages an identity owns.
     */
    CompletableFuture<List<String>> ownedPackages(Identity identity);

    /**
     * Totals over all packages.
     */
    CompletableFuture<RegistryStats> stats();
}
