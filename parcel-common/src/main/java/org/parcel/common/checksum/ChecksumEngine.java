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
package org.parcel.common.checksum;

import java.io.IOException;
import java.io.InputStream;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.codec.digest.MessageDigestAlgorithms;

/**
 * Computes the integrity digest of package artifacts: lowercase hex SHA-256.
 */
public final class ChecksumEngine {

    public static final String ALGORITHM = MessageDigestAlgorithms.SHA_256;

    /**
     * Length in characters of a hex encoded digest.
     */
    public static final int HEX_LENGTH = 64;

    private ChecksumEngine() {
    }

    public static String digest(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("Cannot compute checksum of null data");
        }
        return DigestUtils.sha256Hex(data);
    }

    public static String digest(String data) {
        if (data == null) {
            throw new IllegalArgumentException("Cannot compute checksum of null data");
        }
        return DigestUtils.sha256Hex(data);
    }

    public static String digest(InputStream inputStream) throws IOException {
        return DigestUtils.sha256Hex(inputStream);
    }

    public static boolean isChecksum(String value) {
        if (value == null || value.length() != HEX_LENGTH) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
                return false;
            }
        }
        return true;
    }
}
