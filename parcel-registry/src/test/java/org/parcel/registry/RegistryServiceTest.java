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
package org.parcel.registry;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.Set;
import java.util.UUID;
import lombok.Cleanup;
import org.parcel.common.configuration.ConfigurationLoader;
import org.parcel.registry.authentication.RegisteredIdentity;
import org.parcel.registry.blob.FileSystemBlobStore;
import org.parcel.registry.blob.MemoryBlobStore;
import org.parcel.registry.data.PublishRequest;
import org.parcel.registry.data.PublishResult;
import org.testng.annotations.Test;

public class RegistryServiceTest {

    @Test
    public void testDefaults() {
        RegistryConfiguration config = new RegistryConfiguration();
        assertEquals(config.getMetadataStoreUrl(), "memory:local");
        assertEquals(config.getBlobStoreType(), RegistryConfiguration.BLOB_STORE_MEMORY);
        assertEquals(config.getDownloadPathPrefix(), "/api/v1/packages");
        assertEquals(config.getDefaultLicense(), "MIT");
        assertTrue(config.getSuperUserRoles().isEmpty());
        assertTrue(ConfigurationLoader.isComplete(config));
    }

    @Test
    public void testLoadConfiguration() throws Exception {
        InputStream stream = getClass().getClassLoader().getResourceAsStream("registry-test.conf");
        RegistryConfiguration config = ConfigurationLoader.create(stream, RegistryConfiguration.class);
        assertEquals(config.getMetadataStoreUrl(), "memory:registry-service-test");
        assertEquals(config.getBlobStoreType(), RegistryConfiguration.BLOB_STORE_FILESYSTEM);
        assertEquals(config.getBlobStoreIoThreads(), 2);
        assertEquals(config.getSuperUserRoles(), Set.of("admin-1", "admin-2"));
        assertEquals(config.getDefaultLicense(), "Apache-2.0");
        assertEquals(config.getMaxPackageSizeBytes(), 2048L);
        assertEquals(config.getDownloadCounterMaxRetries(), 5);
        // untouched fields keep their defaults
        assertEquals(config.getBlobStoreDirectory(), "data/packages");
    }

    @Test
    public void testInvalidConfiguration() throws Exception {
        Properties properties = new Properties();
        properties.setProperty("blobStoreIoThreads", "0");
        RegistryConfiguration config = ConfigurationLoader.create(properties, RegistryConfiguration.class);
        @Cleanup
        RegistryService service = new RegistryService(config);
        try {
            service.start();
            fail("should have failed");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("blobStoreIoThreads"));
        }

        config.setBlobStoreIoThreads(1);
        config.setBlobStoreType("tape");
        config.setMetadataStoreUrl("memory:" + UUID.randomUUID());
        @Cleanup
        RegistryService other = new RegistryService(config);
        try {
            other.start();
            fail("should have failed");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("tape"));
        }
    }

    @Test
    public void testFileSystemBackedRegistry() throws Exception {
        Path blobs = Files.createTempDirectory("parcel-registry");
        RegistryConfiguration config = new RegistryConfiguration();
        config.setMetadataStoreUrl("memory:" + UUID.randomUUID());
        config.setBlobStoreType(RegistryConfiguration.BLOB_STORE_FILESYSTEM);
        config.setBlobStoreDirectory(blobs.toString());
        config.setDownloadPathPrefix("/dl/");

        @Cleanup
        RegistryService service = new RegistryService(config, new MockClock(1_000L));
        service.start();
        assertTrue(service.getBlobStore() instanceof FileSystemBlobStore);

        RegisteredIdentity alice = service.getIdentityRegistry().register("alice@example.com", "Alice").join();
        PublishResult result = service.getPackages().publish(alice.getApiToken(), PublishRequest.builder()
                .name("json-lib").version("1.0.0").body("body".getBytes(StandardCharsets.UTF_8)).build()).join();
        assertEquals(result.getDownloadUrl(), "/dl/json-lib/1.0.0/download");
        assertTrue(Files.exists(blobs.resolve("json-lib").resolve("1.0.0.tgz")));
        assertEquals(new String(service.getPackages().download("json-lib", "1.0.0").join().getData(),
                StandardCharsets.UTF_8), "body");
    }

    @Test
    public void testLifecycle() throws Exception {
        RegistryConfiguration config = new RegistryConfiguration();
        config.setMetadataStoreUrl("memory:" + UUID.randomUUID());
        RegistryService service = new RegistryService(config);
        assertEquals(service.getState(), RegistryService.State.Init);
        service.start();
        assertEquals(service.getState(), RegistryService.State.Started);
        assertTrue(service.getBlobStore() instanceof MemoryBlobStore);
        try {
            service.start();
            fail("should have failed");
        } catch (IllegalStateException e) {
            // already started
        }
        service.close();
        service.close();
        assertEquals(service.getState(), RegistryService.State.Closed);
    }
}
