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
package org.parcel.registry.impl;

import io.netty.util.concurrent.DefaultThreadFactory;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.pulsar.common.util.FutureUtil;
import org.parcel.registry.exception.RegistryException;
import org.parcel.registry.store.PackageStore;

/**
 * Counts package downloads off the request path. Increments are eventually applied; one that keeps failing is
 * logged and dropped.
 */
@Slf4j
public class DownloadCounter implements AutoCloseable {

    private final PackageStore packageStore;
    private final int maxRetries;
    private final ExecutorService executor;

    public DownloadCounter(PackageStore packageStore, int maxRetries) {
        this.packageStore = packageStore;
        this.maxRetries = maxRetries;
        this.executor = Executors.newSingleThreadExecutor(new DefaultThreadFactory("parcel-download-counter"));
    }

    /**
     * Schedule an increment of the download counter of {@code name}.
     */
    public void record(String name) {
        submit(name, 0);
    }

    private void submit(String name, int attempt) {
        try {
            executor.execute(() -> increment(name, attempt));
        } catch (RejectedExecutionException e) {
            log.warn("[{}] Download counter is closed, dropping increment", name);
        }
    }

    private void increment(String name, int attempt) {
        packageStore.incrementDownloads(name).whenComplete((__, ex) -> {
            if (ex == null) {
                return;
            }
            RegistryException cause = RegistryException.unwrap(FutureUtil.unwrapCompletionException(ex));
            if (cause instanceof RegistryException.NotFoundException) {
                if (log.isDebugEnabled()) {
                    log.debug("[{}] Package is gone, dropping download increment", name);
                }
            } else if (attempt < maxRetries) {
                log.warn("[{}] Failed to increment download counter (attempt {}/{}), retrying: {}", name,
                        attempt + 1, maxRetries + 1, cause.getMessage());
                submit(name, attempt + 1);
            } else {
                log.error("[{}] Failed to increment download counter after {} attempts, dropping increment", name,
                        attempt + 1, cause);
            }
        });
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Download counter did not drain in time");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
