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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.assertTrue;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import org.testng.annotations.Test;

public class ChecksumEngineTest {

    @Test
    public void testKnownDigest() {
        assertEquals(ChecksumEngine.digest("abc".getBytes(StandardCharsets.UTF_8)),
                "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertEquals(ChecksumEngine.digest(new byte[0]),
                "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }

    @Test
    public void testDigestForms() throws Exception {
        byte[] data = "tarball-contents!".getBytes(StandardCharsets.UTF_8);
        String digest = ChecksumEngine.digest(data);
        assertEquals(digest.length(), ChecksumEngine.HEX_LENGTH);
        assertTrue(ChecksumEngine.isChecksum(digest));
        assertEquals(ChecksumEngine.digest(new ByteArrayInputStream(data)), digest);
        assertEquals(ChecksumEngine.digest("tarball-contents!"), digest);
        assertNotEquals(ChecksumEngine.digest("tarball-contents?"), digest);
    }

    @Test
    public void testIsChecksum() {
        assertFalse(ChecksumEngine.isChecksum(null));
        assertFalse(ChecksumEngine.isChecksum("abc"));
        assertFalse(ChecksumEngine.isChecksum(
                "BA7816BF8F01CFEA414140DE5DAE2223B00361A396177A9CB410FF61F20015AD"));
        assertFalse(ChecksumEngine.isChecksum(
                "zz7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad"));
    }
}
