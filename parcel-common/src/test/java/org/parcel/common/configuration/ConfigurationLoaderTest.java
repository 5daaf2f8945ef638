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
package org.parcel.common.configuration;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;
import java.io.InputStream;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import org.testng.annotations.Test;

public class ConfigurationLoaderTest {

    public static class TestConfiguration implements ParcelConfiguration {

        @FieldContext(required = true)
        private String name;

        @FieldContext(minValue = 1, maxValue = 65535)
        private int port = 8080;

        private double ratio;

        private boolean enabled;

        private Set<String> roles = new TreeSet<>();

        private Properties properties = new Properties();

        @Override
        public Properties getProperties() {
            return properties;
        }

        @Override
        public void setProperties(Properties properties) {
            this.properties = properties;
        }

        public void setPort(int port) {
            this.port = port;
        }
    }

    @Test
    public void testLoadFromStream() throws Exception {
        InputStream stream = getClass().getClassLoader().getResourceAsStream("test_registry.conf");
        TestConfiguration config = ConfigurationLoader.create(stream, TestConfiguration.class);
        assertEquals(config.name, "fixture");
        assertEquals(config.port, 8443);
        assertEquals(config.ratio, 0.5);
        assertTrue(config.enabled);
        assertEquals(config.roles, Set.of("alice", "bob"));
        assertEquals(config.getProperties().getProperty("port"), "8443");
        assertTrue(ConfigurationLoader.isComplete(config));
    }

    @Test
    public void testDefaultsKept() {
        Properties properties = new Properties();
        properties.setProperty("name", "only-name");
        TestConfiguration config = ConfigurationLoader.create(properties, TestConfiguration.class);
        assertEquals(config.port, 8080);
        assertTrue(config.roles.isEmpty());
    }

    @Test
    public void testIncomplete() {
        TestConfiguration config = ConfigurationLoader.create(new Properties(), TestConfiguration.class);
        try {
            ConfigurationLoader.isComplete(config);
            fail("should have failed");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("name"));
        }

        config.name = "set";
        config.setPort(0);
        try {
            ConfigurationLoader.isComplete(config);
            fail("should have failed");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("port"));
        }
    }

    @Test
    public void testBadValue() {
        Properties properties = new Properties();
        properties.setProperty("port", "not-a-number");
        try {
            ConfigurationLoader.create(properties, TestConfiguration.class);
            fail("should have failed");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }
}
