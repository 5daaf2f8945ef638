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

import static java.util.Objects.requireNonNull;
import static org.apache.pulsar.common.util.FieldParser.update;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.util.Map;
import java.util.Properties;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads configuration objects from properties files.
 */
public class ConfigurationLoader {

    /**
     * Creates a configuration and loads it with attribute values read from the provided property file.
     *
     * @param configFile path of the property file
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file contains an incorrect value type
     */
    public static <T extends ParcelConfiguration> T create(String configFile,
            Class<T> clazz) throws IOException, IllegalArgumentException {
        requireNonNull(configFile);
        try (InputStream inputStream = new FileInputStream(configFile)) {
            return create(inputStream, clazz);
        }
    }

    /**
     * Creates a configuration and loads it with attribute values read from the provided input stream.
     *
     * @param inStream property file contents, closed on return
     * @throws IOException
     *             if an error occurred when reading from the input stream.
     * @throws IllegalArgumentException
     *             if the input stream contains incorrect value type
     */
    public static <T extends ParcelConfiguration> T create(InputStream inStream,
            Class<T> clazz) throws IOException, IllegalArgumentException {
        requireNonNull(inStream);
        try (inStream) {
            Properties properties = new Properties();
            properties.load(inStream);
            return create(properties, clazz);
        }
    }

    /**
     * Creates a configuration and loads it with attribute values from the provided Properties object.
     *
     * @param properties The properties to populate the attributes from
     * @throws IllegalArgumentException if a value cannot be converted to the field type
     */
    @SuppressWarnings({ "rawtypes", "unchecked" })
    public static <T extends ParcelConfiguration> T create(Properties properties,
            Class<T> clazz) throws IllegalArgumentException {
        requireNonNull(properties);
        T configuration;
        try {
            configuration = clazz.getDeclaredConstructor().newInstance();
        } catch (InstantiationException | IllegalAccessException
                | NoSuchMethodException | InvocationTargetException e) {
            throw new IllegalArgumentException("Failed to instantiate " + clazz.getName(), e);
        }
        configuration.setProperties(properties);
        update((Map) properties, configuration);
        return configuration;
    }

    /**
     * Validates {@link FieldContext} annotation on each field of the class element. If element is annotated required
     * and value of the element is null or number value is not in a provided (min,max) range then consider as incomplete
     * object and throws exception with incomplete parameters.
     *
     * @param obj configuration to check
     * @return true when every constraint holds
     * @throws IllegalArgumentException
     *             if object is field values are not completed according to {@link FieldContext} constraints.
     */
    public static boolean isComplete(Object obj) throws IllegalArgumentException {
        requireNonNull(obj);
        Field[] fields = obj.getClass().getDeclaredFields();
        StringBuilder error = new StringBuilder();
        for (Field field : fields) {
            if (field.isAnnotationPresent(FieldContext.class)) {
                field.setAccessible(true);
                Object value;

                try {
                    value = field.get(obj);
                } catch (IllegalAccessException e) {
                    throw new RuntimeException(e);
                }

                if (log.isDebugEnabled()) {
                    log.debug("Validating configuration field '{}' = '{}'", field.getName(), value);
                }
                FieldContext context = field.getAnnotation(FieldContext.class);
                if (context.required() && isEmpty(value)) {
                    error.append(String.format("Required %s is null,", field.getName()));
                }

                if (value != null && Number.class.isAssignableFrom(value.getClass())) {
                    long fieldVal = ((Number) value).longValue();
                    boolean valid = fieldVal >= context.minValue() && fieldVal <= context.maxValue();
                    if (!valid) {
                        error.append(String.format("%s value %d doesn't fit in given range (%d, %d),",
                                field.getName(), fieldVal, context.minValue(), context.maxValue()));
                    }
                }
            }
        }
        if (error.length() > 0) {
            throw new IllegalArgumentException(error.substring(0, error.length() - 1));
        }
        return true;
    }

    private static boolean isEmpty(Object obj) {
        if (obj == null) {
            return true;
        } else if (obj instanceof String) {
            return StringUtils.isBlank((String) obj);
        } else {
            return false;
        }
    }

    private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);
}
