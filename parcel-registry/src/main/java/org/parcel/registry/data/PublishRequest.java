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
package org.parcel.registry.data;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A publish request: the artifact body plus the side-channel fields sent with it.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class PublishRequest {
    private String name;
    private String version;
    private String description;
    private String signature;
    private String fingerprint;
    @ToString.Exclude
    private byte[] body;

    // optional package defaults, only used when the first version of a package is published
    private List<String> authors;
    private String license;
    private String repository;
    private String homepage;
    private List<String> keywords;
}
