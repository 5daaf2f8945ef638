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
package org.parcel.registry.authorization;

import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.common.util.FutureUtil;
import org.parcel.registry.authentication.Identity;
import org.parcel.registry.authentication.Role;
import org.parcel.registry.data.PackageRecord;
import org.parcel.registry.exception.RegistryException.ForbiddenException;
import org.parcel.registry.exception.RegistryException.UnauthenticatedException;
import org.parcel.registry.ownership.OwnershipRegistry;

/**
 * Decides whether an identity may mutate a package: super-users always, owners for the packages they own.
 */
@Slf4j
public class AuthorizationService {

    private final OwnershipRegistry ownershipRegistry;

    public AuthorizationService(OwnershipRegistry ownershipRegistry) {
        this.ownershipRegistry = ownershipRegistry;
    }

    public CompletableFuture<Boolean> canMutateAsync(Identity identity, String name) {
        if (identity == null) {
            return CompletableFuture.completedFuture(false);
        }
        if (identity.isSuperUser()) {
            return CompletableFuture.completedFuture(true);
        }
        return ownershipRegistry.ownsAny(identity.getOwnerId(), name)
                .thenApply(owns -> isAuthorized(identity.getRole(), owns));
    }

    /**
     * Like {@link #canMutateAsync(Identity, String)}, also accepting the creator recorded on the package. The
     * creator is stored with the first version, before the ownership grant of its publish is committed.
     */
    public CompletableFuture<Boolean> canMutateAsync(Identity identity, PackageRecord record) {
        if (identity != null && !identity.isSuperUser() && identity.getOwnerId() != null
                && identity.getOwnerId().equals(record.getOwner())) {
            return CompletableFuture.completedFuture(true);
        }
        return canMutateAsync(identity, record.getName());
    }

    /**
     * Same as {@link #canMutateAsync(Identity, String)}, failing with {@link ForbiddenException} on denial.
     */
    public CompletableFuture<Void> checkCanMutateAsync(Identity identity, String name) {
        if (identity == null) {
            return FutureUtil.failedFuture(new UnauthenticatedException("Authentication required"));
        }
        return checkAllowed(identity, name, canMutateAsync(identity, name));
    }

    /**
     * Same as {@link #canMutateAsync(Identity, PackageRecord)}, failing with {@link ForbiddenException} on denial.
     */
    public CompletableFuture<Void> checkCanMutateAsync(Identity identity, PackageRecord record) {
        if (identity == null) {
            return FutureUtil.failedFuture(new UnauthenticatedException("Authentication required"));
        }
        return checkAllowed(identity, record.getName(), canMutateAsync(identity, record));
    }

    private static CompletableFuture<Void> checkAllowed(Identity identity, String name,
                                                        CompletableFuture<Boolean> decision) {
        return decision.thenAccept(allowed -> {
            if (!allowed) {
                log.info("[{}] Denied modification by {}", name, identity.getOwnerId());
                throw FutureUtil.wrapToCompletionException(
                        new ForbiddenException("Not authorized to modify this package"));
            }
        });
    }

    public static boolean isAuthorized(Role role, boolean owns) {
        return role == Role.SUPER_USER || owns;
    }
}
