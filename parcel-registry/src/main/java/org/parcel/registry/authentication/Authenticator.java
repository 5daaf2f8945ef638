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

import java.util.concurrent.CompletableFuture;

/**
 * Resolves a credential presented by a client into an {@link Identity}.
 */
public interface Authenticator {

    /**
     * Authenticate a credential.
     *
     * @param credential the credential as presented by the client, may be {@code null}
     * @return the identity, or a future failed with
     *         {@link org.parcel.registry.exception.RegistryException.UnauthenticatedException}
     */
    CompletableFuture<Identity> authenticateAsync(String credential);
}
