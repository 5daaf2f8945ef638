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

import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.apache.pulsar.common.util.FutureUtil;
import org.apache.pulsar.metadata.api.MetadataStore;
import org.apache.pulsar.metadata.api.MetadataStoreConfig;
import org.apache.pulsar.metadata.api.MetadataStoreFactory;
import org.parcel.common.checksum.ChecksumEngine;
import org.parcel.registry.DownloadLocator;
import org.parcel.registry.MockClock;
import org.parcel.registry.RegistryConfiguration;
import org.parcel.registry.authentication.Identity;
import org.parcel.registry.authentication.IdentityRegistry;
import org.parcel.registry.authentication.RegisteredIdentity;
import org.parcel.registry.authentication.Role;
import org.parcel.registry.authentication.TokenAuthenticator;
import org.parcel.registry.authorization.AuthorizationService;
import org.parcel.registry.blob.MemoryBlobStore;
import org.parcel.registry.data.PackageRecord;
import org.parcel.registry.data.PublishRequest;
import org.parcel.registry.data.PublishResult;
import org.parcel.registry.data.VersionRecord;
import org.parcel.registry.exception.RegistryException.ForbiddenException;
import org.parcel.registry.exception.RegistryException.InvalidInputException;
import org.parcel.registry.exception.RegistryException.StorageException;
import org.parcel.registry.exception.RegistryException.UnauthenticatedException;
import org.parcel.registry.exception.RegistryException.VersionAlreadyExistsException;
import org.parcel.registry.ownership.OwnershipRegistry;
import org.parcel.registry.store.MetadataPackageStore;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class PublishPipelineTest {

    private static final Identity ALICE = new Identity("alice", "Alice", Role.OWNER);
    private static final Identity BOB = new Identity("bob", "Bob", Role.OWNER);
    private static final Identity ADMIN = new Identity("admin", "Admin", Role.SUPER_USER);

    private MetadataStore metadataStore;
    private MockClock clock;
    private MetadataPackageStore packageStore;
    private MemoryBlobStore blobStore;
    private OwnershipRegistry ownershipRegistry;
    private IdentityRegistry identityRegistry;
    private RegistryConfiguration config;
    private PublishPipeline pipeline;

    @BeforeMethod
    public void setup() throws Exception {
        metadataStore = MetadataStoreFactory.create("memory:" + UUID.randomUUID(),
                MetadataStoreConfig.builder().build());
        clock = new MockClock(1_000L);
        packageStore = spy(new MetadataPackageStore(metadataStore, clock));
        blobStore = spy(new MemoryBlobStore());
        ownershipRegistry = spy(new OwnershipRegistry(metadataStore, clock));
        identityRegistry = new IdentityRegistry(metadataStore, clock);
        config = new RegistryConfiguration();
        config.setMaxPackageSizeBytes(1024);
        pipeline = createPipeline();
    }

    private PublishPipeline createPipeline() {
        return new PublishPipeline(packageStore, blobStore, ownershipRegistry,
                new AuthorizationService(ownershipRegistry), new TokenAuthenticator(identityRegistry, Set.of()),
                new DownloadLocator(config.getDownloadPathPrefix()), config, clock);
    }

    @AfterMethod(alwaysRun = true)
    public void cleanup() throws Exception {
        metadataStore.close();
    }

    private static PublishRequest request(String name, String version, String body) {
        return PublishRequest.builder()
                .name(name)
                .version(version)
                .description("A package")
                .body(body == null ? null : body.getBytes(StandardCharsets.UTF_8))
                .build();
    }

    private PackageRecord freshRecord(String name) {
        return new MetadataPackageStore(metadataStore, clock).find(name).join().orElse(null);
    }

    @Test
    public void testPublish() {
        byte[] body = "tarball-contents!".getBytes(StandardCharsets.UTF_8);
        assertEquals(body.length, 17);
        PublishRequest request = request("json-lib", "1.0.0", null);
        request.setBody(body);
        request.setSignature("sig");
        request.setFingerprint("fp");

        PublishResult result = pipeline.publish(ALICE, request).join();
        assertEquals(result.getName(), "json-lib");
        assertEquals(result.getVersion(), "1.0.0");
        assertEquals(result.getChecksum(), ChecksumEngine.digest(body));
        assertTrue(ChecksumEngine.isChecksum(result.getChecksum()));
        assertEquals(result.getSize(), 17);
        assertEquals(result.getDownloadUrl(), "/api/v1/packages/json-lib/1.0.0/download");
        assertEquals(result.getMessage(), "Published json-lib@1.0.0");

        PackageRecord record = freshRecord("json-lib");
        assertEquals(record.getDownloads(), 0);
        assertEquals(record.getDescription(), "A package");
        assertEquals(record.getAuthors(), List.of("Alice"));
        assertEquals(record.getLicense(), "MIT");
        VersionRecord version = record.findVersion("1.0.0").get();
        assertEquals(version.getChecksum(), result.getChecksum());
        assertEquals(version.getSize(), 17);
        assertEquals(version.getPublishedAt(), 1_000L);
        assertEquals(version.getSignature(), "sig");
        assertEquals(version.getPublisherFingerprint(), "fp");
        assertFalse(version.isYanked());

        assertEquals(blobStore.read("json-lib/1.0.0").join(), body);
        assertEquals(blobStore.readMetadata("json-lib/1.0.0").join().get("checksum"), result.getChecksum());
        assertTrue(ownershipRegistry.ownsAny("alice", "json-lib").join());
    }

    @Test
    public void testPackageDefaultsFromRequest() {
        PublishRequest request = request("json-lib", "1.0.0", "body");
        request.setAuthors(List.of("Alice", "Carol"));
        request.setLicense("Apache-2.0");
        request.setKeywords(List.of("json"));
        request.setHomepage("https://example.com");
        pipeline.publish(ALICE, request).join();

        PackageRecord record = freshRecord("json-lib");
        assertEquals(record.getAuthors(), List.of("Alice", "Carol"));
        assertEquals(record.getLicense(), "Apache-2.0");
        assertEquals(record.getKeywords(), List.of("json"));
        assertEquals(record.getHomepage(), "https://example.com");
        assertNull(record.getRepository());
    }

    @Test
    public void testDuplicateKeepsFirstArtifact() {
        pipeline.publish(ALICE, request("json-lib", "1.0.0", "first")).join();
        try {
            pipeline.publish(ALICE, request("json-lib", "1.0.0", "second")).join();
            fail("should have failed");
        } catch (CompletionException e) {
            assertEquals(e.getCause().getClass(), VersionAlreadyExistsException.class);
        }
        assertEquals(new String(blobStore.read("json-lib/1.0.0").join(), StandardCharsets.UTF_8), "first");
        assertEquals(freshRecord("json-lib").findVersion("1.0.0").get().getChecksum(),
                ChecksumEngine.digest("first"));
        verify(blobStore, times(1)).write(eq("json-lib/1.0.0"), any(), any());
    }

    @Test
    public void testAppendByOwner() {
        pipeline.publish(ALICE, request("json-lib", "1.0.0", "one")).join();
        clock.advance(10);
        PublishRequest second = request("json-lib", "1.1.0", "two");
        second.setLicense("GPL-3.0");
        pipeline.publish(ALICE, second).join();

        PackageRecord record = freshRecord("json-lib");
        assertEquals(record.getVersions().stream().map(VersionRecord::getVersion).collect(Collectors.toList()),
                List.of("1.1.0", "1.0.0"));
        // descriptive fields of an existing package are not touched by a publish
        assertEquals(record.getLicense(), "MIT");
        assertEquals(record.getUpdatedAt(), 1_010L);
    }

    @Test
    public void testForbiddenForNonOwner() {
        pipeline.publish(ALICE, request("json-lib", "1.0.0", "one")).join();
        try {
            pipeline.publish(BOB, request("json-lib", "1.1.0", "evil")).join();
            fail("should have failed");
        } catch (CompletionException e) {
            assertEquals(e.getCause().getClass(), ForbiddenException.class);
        }
        assertFalse(freshRecord("json-lib").hasVersion("1.1.0"));
        verify(blobStore, never()).write(eq("json-lib/1.1.0"), any(), any());
    }

    @Test
    public void testSuperUserPublishesAnywhere() {
        pipeline.publish(ALICE, request("json-lib", "1.0.0", "one")).join();
        pipeline.publish(ADMIN, request("json-lib", "1.0.1", "fix")).join();
        assertTrue(freshRecord("json-lib").hasVersion("1.0.1"));
        // only the first publisher becomes owner
        assertFalse(ownershipRegistry.ownsAny("admin", "json-lib").join());
    }

    @DataProvider(name = "invalidRequests")
    public static Object[][] invalidRequests() {
        return new Object[][]{
            {request("json-lib", "1.0.0", "")},
            {request("json-lib", "1.0.0", null)},
            {request("Json-Lib", "1.0.0", "body")},
            {request("json lib", "1.0.0", "body")},
            {request("json-lib", "1.0", "body")},
            {request("json-lib", "v1.0.0", "body")},
            {request(null, "1.0.0", "body")},
            {request("json-lib", null, "body")},
            {request("json-lib", "1.0.0", "x".repeat(1025))},
        };
    }

    @Test(dataProvider = "invalidRequests")
    public void testInvalidInput(PublishRequest request) {
        try {
            pipeline.publish(ALICE, request).join();
            fail("should have failed");
        } catch (CompletionException e) {
            assertEquals(e.getCause().getClass(), InvalidInputException.class);
        }
        assertTrue(new MetadataPackageStore(metadataStore, clock).list().join().isEmpty());
        verify(blobStore, never()).write(anyString(), any(), any());
    }

    @Test
    public void testUnauthenticated() {
        try {
            pipeline.publish((Identity) null, request("json-lib", "1.0.0", "body")).join();
            fail("should have failed");
        } catch (CompletionException e) {
            assertEquals(e.getCause().getClass(), UnauthenticatedException.class);
        }
        try {
            pipeline.publish("Bearer unknown", request("json-lib", "1.0.0", "body")).join();
            fail("should have failed");
        } catch (CompletionException e) {
            assertEquals(e.getCause().getClass(), UnauthenticatedException.class);
        }
    }

    @Test
    public void testPublishWithCredential() {
        RegisteredIdentity alice = identityRegistry.register("alice@example.com", "Alice Liddell").join();
        pipeline.publish("Bearer " + alice.getApiToken(), request("json-lib", "1.0.0", "body")).join();
        assertEquals(freshRecord("json-lib").getAuthors(), List.of("Alice Liddell"));
        assertTrue(ownershipRegistry.ownsAny(alice.getOwnerId(), "json-lib").join());
    }

    @Test
    public void testBlobFailureOnNewPackage() {
        doReturn(FutureUtil.failedFuture(new IOException("disk full")))
                .when(blobStore).write(anyString(), any(), any());
        try {
            pipeline.publish(ALICE, request("json-lib", "1.0.0", "body")).join();
            fail("should have failed");
        } catch (CompletionException e) {
            assertEquals(e.getCause().getClass(), StorageException.class);
        }
        // the reservation is rolled back, the name is free again
        assertNull(freshRecord("json-lib"));
        assertFalse(ownershipRegistry.ownsAny("alice", "json-lib").join());
    }

    @Test
    public void testBlobFailureOnExistingPackage() {
        pipeline.publish(ALICE, request("json-lib", "1.0.0", "one")).join();
        doReturn(FutureUtil.failedFuture(new IOException("disk full")))
                .when(blobStore).write(eq("json-lib/1.1.0"), any(), any());
        try {
            pipeline.publish(ALICE, request("json-lib", "1.1.0", "two")).join();
            fail("should have failed");
        } catch (CompletionException e) {
            assertEquals(e.getCause().getClass(), StorageException.class);
        }
        PackageRecord record = freshRecord("json-lib");
        assertFalse(record.hasVersion("1.1.0"));
        assertTrue(record.hasVersion("1.0.0"));

        // the version can be published once storage recovers
        doReturn(CompletableFuture.completedFuture(null)).when(blobStore).write(eq("json-lib/1.1.0"), any(), any());
        pipeline.publish(ALICE, request("json-lib", "1.1.0", "two")).join();
    }

    @Test
    public void testOwnershipFailureRollsBack() {
        doReturn(FutureUtil.failedFuture(new StorageException("metadata store down")))
                .when(ownershipRegistry).grant(anyString(), anyString());
        try {
            pipeline.publish(ALICE, request("json-lib", "1.0.0", "body")).join();
            fail("should have failed");
        } catch (CompletionException e) {
            assertEquals(e.getCause().getClass(), StorageException.class);
        }
        assertNull(freshRecord("json-lib"));
        assertFalse(blobStore.exists("json-lib/1.0.0").join());
    }

    @Test
    public void testPackageCreatedConcurrentlyByAnotherOwner() {
        pipeline.publish(ALICE, request("json-lib", "1.0.0", "one")).join();
        // bob's pipeline checked before alice's package existed
        doReturn(CompletableFuture.completedFuture(Optional.empty())).when(packageStore).find("json-lib");
        try {
            pipeline.publish(BOB, request("json-lib", "2.0.0", "evil")).join();
            fail("should have failed");
        } catch (CompletionException e) {
            assertEquals(e.getCause().getClass(), ForbiddenException.class);
        }
        PackageRecord record = freshRecord("json-lib");
        assertFalse(record.hasVersion("2.0.0"));
        assertTrue(record.hasVersion("1.0.0"));
        verify(blobStore, never()).write(eq("json-lib/2.0.0"), any(), any());
    }

    @Test
    public void testRollbackDeletesArtifactBeforeFreeingVersion() {
        doReturn(FutureUtil.failedFuture(new IOException("disk full")))
                .when(blobStore).write(anyString(), any(), any());
        CompletableFuture<Void> pendingDelete = new CompletableFuture<>();
        doReturn(pendingDelete).when(blobStore).delete("json-lib/1.0.0");

        CompletableFuture<PublishResult> publish = pipeline.publish(ALICE, request("json-lib", "1.0.0", "body"));
        await().untilAsserted(() -> verify(blobStore).delete("json-lib/1.0.0"));
        // the version stays reserved until the artifact is gone
        verify(packageStore, never()).removeVersion(anyString(), anyString());
        assertTrue(freshRecord("json-lib").hasVersion("1.0.0"));
        assertFalse(publish.isDone());

        pendingDelete.complete(null);
        try {
            publish.join();
            fail("should have failed");
        } catch (CompletionException e) {
            assertEquals(e.getCause().getClass(), StorageException.class);
        }
        assertNull(freshRecord("json-lib"));
    }

    @Test
    public void testAppendWhileCreatingPublishInFlight() {
        CompletableFuture<Void> pendingWrite = new CompletableFuture<>();
        doReturn(pendingWrite).when(blobStore).write(eq("json-lib/1.0.0"), any(), any());
        CompletableFuture<PublishResult> first = pipeline.publish(ALICE, request("json-lib", "1.0.0", "one"));
        await().untilAsserted(() -> verify(blobStore).write(eq("json-lib/1.0.0"), any(), any()));
        assertFalse(ownershipRegistry.ownsAny("alice", "json-lib").join());

        // sees the package created by the first publish
        pipeline.publish(ALICE, request("json-lib", "1.1.0", "two")).join();
        // checked before the package existed and appended to it
        doReturn(CompletableFuture.completedFuture(Optional.empty())).when(packageStore).find("json-lib");
        pipeline.publish(ALICE, request("json-lib", "1.2.0", "three")).join();
        try {
            pipeline.publish(BOB, request("json-lib", "1.3.0", "evil")).join();
            fail("should have failed");
        } catch (CompletionException e) {
            assertEquals(e.getCause().getClass(), ForbiddenException.class);
        }

        pendingWrite.complete(null);
        first.join();
        assertEquals(versions(freshRecord("json-lib")), List.of("1.2.0", "1.1.0", "1.0.0"));
        assertEquals(freshRecord("json-lib").getOwner(), "alice");
        assertTrue(ownershipRegistry.ownsAny("alice", "json-lib").join());
        assertFalse(ownershipRegistry.ownsAny("bob", "json-lib").join());
    }

    @DataProvider(name = "packageExists")
    public static Object[][] packageExists() {
        return new Object[][]{{false}, {true}};
    }

    @Test(dataProvider = "packageExists")
    public void testConcurrentDistinctVersions(boolean packageExists) {
        if (packageExists) {
            pipeline.publish(ALICE, request("json-lib", "0.1.0", "initial")).join();
        }
        List<CompletableFuture<PublishResult>> futures = IntStream.range(0, 6)
                .mapToObj(i -> pipeline.publish(ALICE, request("json-lib", "1." + i + ".0", "body-" + i)))
                .collect(Collectors.toList());
        futures.forEach(CompletableFuture::join);

        List<String> expected = new ArrayList<>(List.of("1.5.0", "1.4.0", "1.3.0", "1.2.0", "1.1.0", "1.0.0"));
        if (packageExists) {
            expected.add("0.1.0");
        }
        PackageRecord record = freshRecord("json-lib");
        assertEquals(versions(record), expected);
        for (String version : expected) {
            assertTrue(blobStore.exists("json-lib/" + version).join(), version);
        }
        assertEquals(record.getOwner(), "alice");
        assertTrue(ownershipRegistry.ownsAny("alice", "json-lib").join());
    }

    private static List<String> versions(PackageRecord record) {
        return record.getVersions().stream().map(VersionRecord::getVersion).collect(Collectors.toList());
    }

    @Test
    public void testConcurrentIdenticalPublishes() {
        List<CompletableFuture<PublishResult>> futures = IntStream.range(0, 8)
                .mapToObj(i -> pipeline.publish(ALICE, request("json-lib", "1.0.0", "body-" + i)))
                .collect(Collectors.toList());
        int succeeded = 0;
        for (CompletableFuture<PublishResult> future : futures) {
            try {
                future.join();
                succeeded++;
            } catch (CompletionException e) {
                assertEquals(e.getCause().getClass(), VersionAlreadyExistsException.class);
            }
        }
        assertEquals(succeeded, 1);
        String stored = ChecksumEngine.digest(blobStore.read("json-lib/1.0.0").join());
        assertEquals(freshRecord("json-lib").findVersion("1.0.0").get().getChecksum(), stored);
    }
}
