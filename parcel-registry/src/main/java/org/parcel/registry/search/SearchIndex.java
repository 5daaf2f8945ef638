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
package org.parcel.registry.search;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;
import org.parcel.registry.data.PackageRecord;
import org.parcel.registry.store.PackageStore;

/**
 * Case-insensitive substring search over package names, descriptions and keywords. Results keep the order of
 * {@link PackageStore#list()}.
 */
public class SearchIndex {

    private final PackageStore packageStore;

    public SearchIndex(PackageStore packageStore) {
        this.packageStore = packageStore;
    }

    /**
     * @param query the text to look for, matched literally; an empty query matches every package
     */
    public CompletableFuture<List<PackageRecord>> search(String query) {
        return packageStore.list().thenApply(records -> {
            if (StringUtils.isEmpty(query)) {
                return records;
            }
            String needle = query.toLowerCase(Locale.ROOT);
            return records.stream().filter(record -> matches(record, needle)).collect(Collectors.toList());
        });
    }

    static boolean matches(PackageRecord record, String needle) {
        if (contains(record.getName(), needle) || contains(record.getDescription(), needle)) {
            return true;
        }
        return record.getKeywords() != null && record.getKeywords().stream().anyMatch(k -> contains(k, needle));
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
