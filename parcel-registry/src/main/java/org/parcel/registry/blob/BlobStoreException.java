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
package org.parcel.registry.blob;

import java.io.IOException;

/**
 * Generic blob store exception.
 */
@SuppressWarnings("serial")
public class BlobStoreException extends IOException {

    public BlobStoreException(String msg) {
        super(msg);
    }

    public BlobStoreException(String msg, Throwable cause) {
        super(msg, cause);
    }

    public BlobStoreException(Throwable cause) {
        super(cause);
    }

    /**
     * The key does not exist.
     */
    public static class NotFoundException extends BlobStoreException {
        public NotFoundException(String key) {
            super("Blob not found: " + key);
        }
    }

    /**
     * The key was already written.
     */
    public static class AlreadyExistsException extends BlobStoreException {
        public AlreadyExistsException(String key) {
            super("Blob already exists: " + key);
        }
    }

    /**
     * The key does not map to a location inside the store.
     */
    public static class InvalidKeyException extends BlobStoreException {
        public InvalidKeyException(String key) {
            super("Invalid blob key: " + key);
        }
    }
}
