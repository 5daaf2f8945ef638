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
package org.parcel.registry.authentication;

import static org.apache.pulsar.common.util.FutureUtil.wrapToCompletionException;
import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.pulsar.common.util.FutureUtil;
import org.apache.pulsar.metadata.api.MetadataCache;
import org.apache.pulsar.metadata.api.MetadataStore;
import org.apache.pulsar.metadata.api.MetadataStoreException;
import org.parcel.common.checksum.ChecksumEngine;
import org.parcel.registry.exception.RegistryException;
import org.parcel.registry.exception.RegistryException.ConflictException;
import org.parcel.registry.exception.RegistryException.InvalidInputException;
import org.parcel.registry.exception.RegistryException.StorageException;
import org.parcel.registry.store.BaseResources;
import org.parcel.registry.store.RecordSerde;

/**
 * Registered users and their API tokens.
 *
 * <p>Users live at {@code /parcel/users/<digest(email)>}, which makes the email unique. Tokens live at
 * {@code /parcel/tokens/<digest(token)>}.
 */
@Slf4j
public class IdentityRegistry extends BaseResources<UserRecord> {

    static final String USERS_PATH = BASE_PATH + "/users";
    static final String TOKENS_PATH = BASE_PATH + "/tokens";

    static final int MAX_NAME_LENGTH = 100;

    private final MetadataCache<TokenRecord> tokenCache;
    private final Clock clock;

    public IdentityRegistry(MetadataStore store, Clock clock) {
        super(store, new RecordSerde<>(UserRecord.class, IdentityRegistry::validateUser));
        this.tokenCache = store.getMetadataCache(new RecordSerde<>(TokenRecord.class, IdentityRegistry::validateToken));
        this.clock = clock;
    }

    /**
     * Register a user and issue its API token.
     *
     * @return the new identity, or a future failed with {@link ConflictException} if the email is taken
     */
    public CompletableFuture<RegisteredIdentity> register(String email, String name) {
        if (StringUtils.isBlank(email) || StringUtils.isBlank(name)) {
            return FutureUtil.failedFuture(new InvalidInputException("Email and name are required"));
        }
        String normalizedEmail = email.trim().toLowerCase(Locale.ROOT);
        if (!normalizedEmail.contains("@")) {
            return FutureUtil.failedFuture(new InvalidInputException("Invalid email address"));
        }
        if (name.trim().length() > MAX_NAME_LENGTH) {
            return FutureUtil.failedFuture(
                    new InvalidInputException("Name must be at most " + MAX_NAME_LENGTH + " characters"));
        }
        long now = clock.millis();
        String userKey = ChecksumEngine.digest(normalizedEmail);
        UserRecord user = new UserRecord(UUID.randomUUID().toString(), normalizedEmail, name.trim(), now);
        String token = UUID.randomUUID().toString();

        return createAsync(userPath(userKey), user)
                .exceptionally(ex -> {
                    Throwable cause = FutureUtil.unwrapCompletionException(ex);
                    if (cause instanceof MetadataStoreException.AlreadyExistsException) {
                        throw wrapToCompletionException(new ConflictException("Email already registered"));
                    }
                    throw wrapToCompletionException(translate(cause));
                })
                .thenCompose(__ -> tokenCache.create(tokenPath(token), new TokenRecord(user.getId(), userKey, now))
                        .exceptionally(ex -> {
                            throw wrapToCompletionException(translate(FutureUtil.unwrapCompletionException(ex)));
                        }))
                .thenApply(__ -> {
                    log.info("Registered user {}", user.getId());
                    return new RegisteredIdentity(user.getId(), user.getName(), token);
                });
    }

    /**
     * Look up the user an API token was issued to.
     */
    public CompletableFuture<Optional<UserRecord>> resolveToken(String token) {
        if (StringUtils.isBlank(token)) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return tokenCache.get(tokenPath(token))
                .thenCompose(tokenRecord -> {
                    if (tokenRecord.isEmpty()) {
                        return CompletableFuture.completedFuture(Optional.<UserRecord>empty());
                    }
                    return getAsync(userPath(tokenRecord.get().getUserKey()));
                })
                .exceptionally(ex -> {
                    throw wrapToCompletionException(translate(FutureUtil.unwrapCompletionException(ex)));
                });
    }

    private static RegistryException translate(Throwable cause) {
        if (cause instanceof RegistryException) {
            return (RegistryException) cause;
        }
        log.warn("Identity store operation failed", cause);
        return new StorageException(cause);
    }

    static String userPath(String userKey) {
        return joinPath(USERS_PATH, userKey);
    }

    static String tokenPath(String token) {
        return joinPath(TOKENS_PATH, ChecksumEngine.digest(token));
    }

    static void validateUser(UserRecord user) {
        if (StringUtils.isBlank(user.getId()) || StringUtils.isBlank(user.getName())
                || StringUtils.isBlank(user.getEmail())) {
            throw new IllegalArgumentException("Incomplete user record");
        }
    }

    static void validateToken(TokenRecord token) {
        if (StringUtils.isBlank(token.getOwnerId()) || !ChecksumEngine.isChecksum(token.getUserKey())) {
            throw new IllegalArgumentException("Incomplete token record");
        }
    }
}
