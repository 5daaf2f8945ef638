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

import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import lombok.ToString;
import org.parcel.common.configuration.FieldContext;
import org.parcel.common.configuration.ParcelConfiguration;

/**
 * Registry configuration object.
 * Note: Don't use lombok's @Getter and @Setter annotations, which slow the IDE completion speed significantly.
 */
@ToString
public class RegistryConfiguration implements ParcelConfiguration {

    private static final String CATEGORY_METADATA = "Metadata Store";
    private static final String CATEGORY_BLOB = "Blob Store";
    private static final String CATEGORY_AUTHORIZATION = "Authorization";
    private static final String CATEGORY_PACKAGES = "Packages";

    public static final String BLOB_STORE_MEMORY = "memory";
    public static final String BLOB_STORE_FILESYSTEM = "filesystem";

    @FieldContext(
            category = CATEGORY_METADATA,
            required = true,
            doc = "The metadata store URL. \n"
                    + " Examples: \n"
                    + "  * memory:local (in process, not persisted)\n"
                    + "  * rocksdb:/var/lib/parcel/metadata\n"
                    + "  * zk:my-zk-1:2181,my-zk-2:2181,my-zk-3:2181\n"
    )
    private String metadataStoreUrl = "memory:local";

    @FieldContext(
            category = CATEGORY_METADATA,
            minValue = 1,
            doc = "Metadata store session timeout in milliseconds"
    )
    private int metadataStoreSessionTimeoutMillis = 30_000;

    @FieldContext(
            category = CATEGORY_BLOB,
            required = true,
            doc = "Where package artifacts are stored: `memory` or `filesystem`"
    )
    private String blobStoreType = BLOB_STORE_MEMORY;

    @FieldContext(
            category = CATEGORY_BLOB,
            doc = "Root directory of the `filesystem` blob store"
    )
    private String blobStoreDirectory = "data/packages";

    @FieldContext(
            category = CATEGORY_BLOB,
            minValue = 1,
            maxValue = 256,
            doc = "Number of threads doing blocking I/O for the `filesystem` blob store"
    )
    private int blobStoreIoThreads = 4;

    @FieldContext(
            category = CATEGORY_AUTHORIZATION,
            doc = "Owner ids of the identities allowed to mutate every package"
    )
    private Set<String> superUserRoles = new TreeSet<>();

    @FieldContext(
            category = CATEGORY_PACKAGES,
            required = true,
            doc = "Path prefix of the download locators handed out to clients"
    )
    private String downloadPathPrefix = "/api/v1/packages";

    @FieldContext(
            category = CATEGORY_PACKAGES,
            required = true,
            doc = "License of a new package whose publisher did not provide one"
    )
    private String defaultLicense = "MIT";

    @FieldContext(
            category = CATEGORY_PACKAGES,
            minValue = 1,
            doc = "Maximum size of a package artifact in bytes"
    )
    private long maxPackageSizeBytes = 50L * 1024 * 1024;

    @FieldContext(
            category = CATEGORY_PACKAGES,
            minValue = 0,
            maxValue = 100,
            doc = "How many times a failed download counter increment is retried before it is dropped"
    )
    private int downloadCounterMaxRetries = 3;

    private Properties properties = new Properties();

    @Override
    public Properties getProperties() {
        return properties;
    }

    @Override
    public void setProperties(Properties properties) {
        this.properties = properties;
    }

    public String getMetadataStoreUrl() {
        return metadataStoreUrl;
    }

    public void setMetadataStoreUrl(String metadataStoreUrl) {
        this.metadataStoreUrl = metadataStoreUrl;
    }

    public int getMetadataStoreSessionTimeoutMillis() {
        return metadataStoreSessionTimeoutMillis;
    }

    public void setMetadataStoreSessionTimeoutMillis(int metadataStoreSessionTimeoutMillis) {
        this.metadataStoreSessionTimeoutMillis = metadataStoreSessionTimeoutMillis;
    }

    public String getBlobStoreType() {
        return blobStoreType;
    }

    public void setBlobStoreType(String blobStoreType) {
        this.blobStoreType = blobStoreType;
    }

    public String getBlobStoreDirectory() {
        return blobStoreDirectory;
    }

    public void setBlobStoreDirectory(String blobStoreDirectory) {
        this.blobStoreDirectory = blobStoreDirectory;
    }

    public int getBlobStoreIoThreads() {
        return blobStoreIoThreads;
    }

    public void setBlobStoreIoThreads(int blobStoreIoThreads) {
        this.blobStoreIoThreads = blobStoreIoThreads;
    }

    public Set<String> getSuperUserRoles() {
        return superUserRoles;
    }

    public void setSuperUserRoles(Set<String> superUserRoles) {
        this.superUserRoles = superUserRoles;
    }

    public String getDownloadPathPrefix() {
        return downloadPathPrefix;
    }

    public void setDownloadPathPrefix(String downloadPathPrefix) {
        this.downloadPathPrefix = downloadPathPrefix;
    }

    public String getDefaultLicense() {
        return defaultLicense;
    }

    public void setDefaultLicense(String defaultLicense) {
        this.defaultLicense = defaultLicense;
    }

    public long getMaxPackageSizeBytes() {
        return maxPackageSizeBytes;
    }

    public void setMaxPackageSizeBytes(long maxPackageSizeBytes) {
        this.maxPackageSizeBytes = maxPackageSizeBytes;
    }

    public int getDownloadCounterMaxRetries() {
        return downloadCounterMaxRetries;
    }

    public void setDownloadCounterMaxRetries(int downloadCounterMaxRetries) {
        this.downloadCounterMaxRetries = downloadCounterMaxRetries;
    }
}
