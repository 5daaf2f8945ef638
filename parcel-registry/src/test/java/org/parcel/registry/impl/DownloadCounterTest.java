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

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import lombok.Cleanup;
import org.apache.pulsar.common.util.FutureUtil;
import org.awaitility.Awaitility;
import org.parcel.registry.exception.RegistryException.PackageNotFoundException;
import org.parcel.registry.exception.RegistryException.StorageException;
import org.parcel.registry.store.PackageStore;
import org.testng.annotations.Test;

public class DownloadCounterTest {

    @Test
    public void testRetriesTransientFailures() {
        PackageStore store = mock(PackageStore.class);
        when(store.incrementDownloads("json-lib"))
                .thenReturn(FutureUtil.failedFuture(new StorageException("busy")))
                .thenReturn(FutureUtil.failedFuture(new StorageException("busy")))
                .thenReturn(CompletableFuture.completedFuture(null));
        @Cleanup
        DownloadCounter counter = new DownloadCounter(store, 3);
        counter.record("json-lib");
        Awaitility.await().untilAsserted(() -> verify(store, times(3)).incrementDownloads("json-lib"));
    }

    @Test
    public void testGivesUpAfterMaxRetries() throws Exception {
        PackageStore store = mock(PackageStore.class);
        when(store.incrementDownloads("json-lib"))
                .thenReturn(FutureUtil.failedFuture(new StorageException("down")));
        @Cleanup
        DownloadCounter counter = new DownloadCounter(store, 2);
        counter.record("json-lib");
        Awaitility.await().untilAsserted(() -> verify(store, times(3)).incrementDownloads("json-lib"));
        Thread.sleep(200);
        verify(store, times(3)).incrementDownloads("json-lib");
    }

    @Test
    public void testUnknownPackageIsNotRetried() throws Exception {
        PackageStore store = mock(PackageStore.class);
        when(store.incrementDownloads("gone"))
                .thenReturn(FutureUtil.failedFuture(new PackageNotFoundException("gone")));
        @Cleanup
        DownloadCounter counter = new DownloadCounter(store, 5);
        counter.record("gone");
        Awaitility.await().untilAsserted(() -> verify(store, times(1)).incrementDownloads("gone"));
        Thread.sleep(200);
        verify(store, times(1)).incrementDownloads("gone");
    }

    @Test
    public void testClosedCounterDropsIncrements() {
        PackageStore store = mock(PackageStore.class);
        DownloadCounter counter = new DownloadCounter(store, 1);
        counter.close();
        counter.record("json-lib");
        Awaitility.await().during(200, TimeUnit.MILLISECONDS).atMost(1, TimeUnit.SECONDS)
                .untilAsserted(() -> verify(store, times(0)).incrementDownloads("json-lib"));
    }
}
