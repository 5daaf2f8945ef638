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

import io.netty.util.concurrent.DefaultThreadFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.common.util.FutureUtil;

/**
 * Blob store writing each artifact to {@code <root>/<name>/<version>.tgz} with its attributes in a
 * {@code <version>.properties} file next to it. File I/O runs on a dedicated executor.
 *
 * <p>Artifacts are written to a temporary file and published with a hard link, so the root directory must be on a
 * file system that supports hard links.
 */
@Slf4j
public class FileSystemBlobStore implements BlobStore {

    static final String DATA_SUFFIX = ".tgz";
    static final String METADATA_SUFFIX = ".properties";

    private final Path root;
    private final ExecutorService executor;

    public FileSystemBlobStore(Path root, int ioThreads) throws IOException {
        this.root = root.toAbsolutePath().normalize();
        Files.createDirectories(this.root);
        this.executor = Executors.newFixedThreadPool(ioThreads, new DefaultThreadFactory("parcel-blob-store-io"));
        log.info("Initialized file system blob store at {} with {} I/O threads", this.root, ioThreads);
    }

    @Override
    public CompletableFuture<Void> write(String key, byte[] data, Map<String, String> metadata) {
        return runAsync(() -> {
            Path target = resolve(key, DATA_SUFFIX);
            Files.createDirectories(target.getParent());
            Path tmp = target.resolveSibling("." + target.getFileName() + "." + UUID.randomUUID() + ".tmp");
            try {
                Files.write(tmp, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                // creating the link fails atomically when the target exists, an artifact is never replaced
                Files.createLink(target, tmp);
            } catch (FileAlreadyExistsException e) {
                throw new BlobStoreException.AlreadyExistsException(key);
            } finally {
                Files.deleteIfExists(tmp);
            }
            Properties properties = new Properties();
            if (metadata != null) {
                properties.putAll(metadata);
            }
            try (OutputStream out = Files.newOutputStream(resolve(key, METADATA_SUFFIX))) {
                properties.store(out, null);
            }
            if (log.isDebugEnabled()) {
                log.debug("[{}] Wrote {} bytes to {}", key, data.length, target);
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<byte[]> read(String key) {
        return supplyAsync(() -> {
            try {
                return Files.readAllBytes(resolve(key, DATA_SUFFIX));
            } catch (NoSuchFileException e) {
                throw new BlobStoreException.NotFoundException(key);
            }
        });
    }

    @Override
    public CompletableFuture<Void> read(String key, OutputStream outputStream) {
        return runAsync(() -> {
            try (InputStream in = Files.newInputStream(resolve(key, DATA_SUFFIX))) {
                in.transferTo(outputStream);
                outputStream.flush();
            } catch (NoSuchFileException e) {
                throw new BlobStoreException.NotFoundException(key);
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<Map<String, String>> readMetadata(String key) {
        return supplyAsync(() -> {
            if (!Files.exists(resolve(key, DATA_SUFFIX))) {
                throw new BlobStoreException.NotFoundException(key);
            }
            Properties properties = new Properties();
            try (InputStream in = Files.newInputStream(resolve(key, METADATA_SUFFIX))) {
                properties.load(in);
            } catch (NoSuchFileException e) {
                return Map.of();
            }
            Map<String, String> metadata = new HashMap<>();
            properties.stringPropertyNames().forEach(k -> metadata.put(k, properties.getProperty(k)));
            return metadata;
        });
    }

    @Override
    public CompletableFuture<Boolean> exists(String key) {
        return supplyAsync(() -> Files.exists(resolve(key, DATA_SUFFIX)));
    }

    @Override
    public CompletableFuture<Void> delete(String key) {
        return runAsync(() -> {
            Files.deleteIfExists(resolve(key, DATA_SUFFIX));
            Files.deleteIfExists(resolve(key, METADATA_SUFFIX));
            if (log.isDebugEnabled()) {
                log.debug("[{}] Deleted blob", key);
            }
            return null;
        });
    }

    @Override
    public void close() throws IOException {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Blob store I/O executor did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    /**
     * Map a key to a file under the root, rejecting keys that would escape it.
     */
    Path resolve(String key, String suffix) throws BlobStoreException {
        if (key == null || key.isEmpty() || key.startsWith("/") || key.contains("\\") || key.endsWith("/")) {
            throw new BlobStoreException.InvalidKeyException(key);
        }
        Path path = root.resolve(Paths.get(key + suffix)).normalize();
        if (!path.startsWith(root) || path.equals(root)) {
            throw new BlobStoreException.InvalidKeyException(key);
        }
        for (Path part : root.relativize(path)) {
            if (part.toString().startsWith(".")) {
                throw new BlobStoreException.InvalidKeyException(key);
            }
        }
        return path;
    }

    private <T> CompletableFuture<T> supplyAsync(IOSupplier<T> supplier) {
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    future.complete(supplier.get());
                } catch (Throwable t) {
                    future.completeExceptionally(t);
                }
            });
        } catch (Exception e) {
            return FutureUtil.failedFuture(new BlobStoreException("Blob store is closed", e));
        }
        return future;
    }

    private CompletableFuture<Void> runAsync(IOSupplier<Void> action) {
        return supplyAsync(action);
    }

    @FunctionalInterface
    private interface IOSupplier<T> {
        T get() throws IOException;
    }
}
