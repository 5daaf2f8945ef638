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
package org.parcel.registry.exception;

import org.apache.pulsar.common.util.FutureUtil;

/**
 * Generic registry exception. Every failure surfaced by the registry core is one of the nested subclasses,
 * each bound to an {@link ErrorKind}.
 */
@SuppressWarnings("serial")
public class RegistryException extends Exception {

    private final ErrorKind kind;

    public RegistryException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RegistryException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public ErrorData toErrorData() {
        return new ErrorData(kind, getMessage());
    }

    /**
     * Malformed name, version or artifact. No state was changed.
     */
    public static class InvalidInputException extends RegistryException {
        public InvalidInputException(String message) {
            super(ErrorKind.INVALID_INPUT, message);
        }
    }

    /**
     * Missing or unknown credential.
     */
    public static class UnauthenticatedException extends RegistryException {
        public UnauthenticatedException(String message) {
            super(ErrorKind.UNAUTHENTICATED, message);
        }
    }

    /**
     * The identity is known but may not mutate the package.
     */
    public static class ForbiddenException extends RegistryException {
        public ForbiddenException(String message) {
            super(ErrorKind.FORBIDDEN, message);
        }
    }

    public static class NotFoundException extends RegistryException {
        public NotFoundException(String message) {
            super(ErrorKind.NOT_FOUND, message);
        }
    }

    public static class PackageNotFoundException extends NotFoundException {
        public PackageNotFoundException(String name) {
            super("Package '" + name + "' not found");
        }
    }

    public static class VersionNotFoundException extends NotFoundException {
        public VersionNotFoundException(String name, String version) {
            super("Version '" + version + "' not found for '" + name + "'");
        }
    }

    public static class ConflictException extends RegistryException {
        public ConflictException(String message) {
            super(ErrorKind.CONFLICT, message);
        }
    }

    public static class VersionAlreadyExistsException extends ConflictException {
        public VersionAlreadyExistsException(String name, String version) {
            super("Version " + version + " of '" + name + "' already exists");
        }
    }

    /**
     * A yanked version was requested for download.
     */
    public static class GoneException extends RegistryException {
        public GoneException(String name, String version) {
            super(ErrorKind.GONE, "Version '" + version + "' of '" + name + "' has been yanked");
        }
    }

    /**
     * Underlying blob or metadata I/O failed. The message is safe to show, details stay in the cause.
     */
    public static class StorageException extends RegistryException {
        public StorageException(String message) {
            super(ErrorKind.STORAGE_FAILURE, message);
        }

        public StorageException(String message, Throwable cause) {
            super(ErrorKind.STORAGE_FAILURE, message, cause);
        }

        public StorageException(Throwable cause) {
            super(ErrorKind.STORAGE_FAILURE, "Internal storage failure", cause);
        }
    }

    /**
     * Metadata claims the version exists but its artifact is missing from the blob store.
     */
    public static class ArtifactMissingException extends StorageException {
        public ArtifactMissingException(String name, String version) {
            super("Package artifact for '" + name + "@" + version + "' is missing");
        }
    }

    /**
     * Convert any failure observed on a future into a registry exception.
     */
    public static RegistryException unwrap(Throwable t) {
        Throwable cause = FutureUtil.unwrapCompletionException(t);
        if (cause instanceof RegistryException) {
            return (RegistryException) cause;
        }
        return new StorageException(cause);
    }
}
