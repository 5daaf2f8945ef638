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
package org.parcel.registry.store;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.parcel.registry.data.DescriptiveUpdate;
import org.parcel.registry.data.PackageDefaults;
import org.parcel.registry.data.PackageRecord;
import org.parcel.registry.data.Reservation;
import org.parcel.registry.data.VersionRecord;

/**
 * The single authority over package and version records.
 *
 * <p>Mutations are serialized per package name; operations on different names never contend. Names are expected to
 * be validated by the caller. Futures fail with a {@link org.parcel.registry.exception.RegistryException}.
 */
public interface PackageStore {

    /**
     * Get the record of a package.
     *
     * @param name package name
     * @return the record, or a future failed with {@code PackageNotFoundException}
     */
    CompletableFuture<PackageRecord> get(String name);

    /**
     * Get the record of a package if it exists.
     *
     * @param name package name
     * @return the record, empty when the package does not exist
     */
    CompletableFuture<Optional<PackageRecord>> find(String name);

    /**
     * List all packages, most recently updated first.
     *
     * @return a snapshot of all records
     */
    CompletableFuture<List<PackageRecord>> list();

    /**
     * Insert a version, creating the package from {@code defaults} if it does not exist yet. The duplicate check and
     * the insert are atomic with respect to every other writer of the same package.
     *
     * @param name package name
     * @param version the new version record
     * @param defaults descriptive fields of a new package, ignored when the package exists
     * @return the reservation, or a future failed with {@code VersionAlreadyExistsException}
     */
    CompletableFuture<Reservation> createOrAppendVersion(String name, VersionRecord version,
                                                         PackageDefaults defaults);

    /**
     * Set the yanked flag of a version. Setting the flag to its current value is a no-op.
     *
     * @return the version record after the change
     */
    CompletableFuture<VersionRecord> setYanked(String name, String version, boolean yanked);

    /**
     * Increment the download counter of a package.
     */
    CompletableFuture<Void> incrementDownloads(String name);

    /**
     * Update the provided subset of the descriptive fields, keeping the others.
     *
     * @return the record after the change
     */
    CompletableFuture<PackageRecord> updateDescriptiveFields(String name, DescriptiveUpdate update);

    /**
     * Remove a version that was reserved but never committed. The package record is removed too when that version
     * was its only one. Removing an absent version is a no-op.
     */
    CompletableFuture<Void> removeVersion(String name, String version);
}
