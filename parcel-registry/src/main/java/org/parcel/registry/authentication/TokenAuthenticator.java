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

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.pulsar.common.util.FutureUtil;
import org.parcel.registry.exception.RegistryException.UnauthenticatedException;

/**
 * Authenticates API tokens issued by the {@link IdentityRegistry}. Accepts the bare token or an
 * {@code Authorization} header value ({@code Bearer <token>}).
 */
@Slf4j
public class TokenAuthenticator implements Authenticator {

    static final String HTTP_HEADER_VALUE_PREFIX = "Bearer ";

    private final IdentityRegistry identityRegistry;
    private final Set<String> superUserRoles;

    public TokenAuthenticator(IdentityRegistry identityRegistry, Set<String> superUserRoles) {
        this.identityRegistry = identityRegistry;
        this.superUserRoles = Set.copyOf(superUserRoles);
    }

    @Override
    public CompletableFuture<Identity> authenticateAsync(String credential) {
        String token = getToken(credential);
        if (StringUtils.isBlank(token)) {
            return FutureUtil.failedFuture(new UnauthenticatedException("Authentication required"));
        }
        return identityRegistry.resolveToken(token).thenApply(user -> {
            if (user.isEmpty()) {
                if (log.isDebugEnabled()) {
                    log.debug("Rejected unknown API token");
                }
                throw FutureUtil.wrapToCompletionException(
                        new UnauthenticatedException("Invalid authentication token"));
            }
            Role role = superUserRoles.contains(user.get().getId()) ? Role.SUPER_USER : Role.OWNER;
            return new Identity(user.get().getId(), user.get().getName(), role);
        });
    }

    static String getToken(String credential) {
        if (credential == null) {
            return null;
        }
        String value = credential.trim();
        if (value.startsWith(HTTP_HEADER_VALUE_PREFIX)) {
            value = value.substring(HTTP_HEADER_VALUE_PREFIX.length()).trim();
        }
        return value;
    }
}
