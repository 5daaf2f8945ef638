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
package org.parcel.registry.publish;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.parcel.common.naming.PackageName;
import org.parcel.registry.authentication.Identity;
import org.parcel.registry.data.PublishRequest;
import org.parcel.registry.data.VersionRecord;

/**
 * State of one publish as it moves through the pipeline.
 */
@Slf4j
@Getter
class PublishContext {

    private final PublishRequest request;
    private volatile PublishState state = PublishState.RECEIVED;
    @Setter
    private volatile Identity identity;
    @Setter
    private volatile boolean packageExisted;
    @Setter
    private volatile VersionRecord versionRecord;
    @Setter
    private volatile boolean packageCreated;
    @Setter
    private volatile String packageOwner;

    PublishContext(PublishRequest request) {
        this.request = request;
    }

    void transition(PublishState next) {
        if (next.ordinal() != state.ordinal() + 1) {
            throw new IllegalStateException("Illegal publish transition " + state + " -> " + next);
        }
        if (log.isDebugEnabled()) {
            log.debug("[{}] Publish {} -> {}", this, state, next);
        }
        state = next;
    }

    String getName() {
        return request.getName();
    }

    String getVersion() {
        return request.getVersion();
    }

    String getBlobKey() {
        return PackageName.get(getName(), getVersion()).getBlobPath();
    }

    @Override
    public String toString() {
        return getName() + "@" + getVersion();
    }
}
