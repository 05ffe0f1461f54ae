/*
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
package org.apache.stratum.common.configuration;

import static java.util.Objects.requireNonNull;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Properties;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a {@link StratumConfiguration} from a properties file, a stream or a {@link Properties} object.
 */
public class StratumConfigurationLoader {

    /**
     * Creates a configuration of the given class and populates it from the property file.
     *
     * @param configFile path of the property file
     * @throws IOException if the file can't be read
     * @throws IllegalArgumentException if a property has a value of the wrong type
     */
    public static <T extends StratumConfiguration> T create(String configFile, Class<T> clazz)
            throws IOException, IllegalArgumentException {
        requireNonNull(configFile);
        try (InputStream inputStream = new FileInputStream(configFile)) {
            return create(inputStream, clazz);
        }
    }

    /**
     * Creates a configuration of the given class and populates it from a property stream. The stream is closed.
     */
    public static <T extends StratumConfiguration> T create(InputStream inStream, Class<T> clazz)
            throws IOException, IllegalArgumentException {
        requireNonNull(inStream);
        try (InputStream in = inStream) {
            Properties properties = new Properties();
            properties.load(in);
            return create(properties, clazz);
        }
    }

    /**
     * Creates a configuration of the given class and populates the fields whose names match a property key.
     * Blank values leave the field at its default.
     */
    public static <T extends StratumConfiguration> T create(Properties properties, Class<T> clazz)
            throws IllegalArgumentException {
        requireNonNull(properties);
        T configuration;
        try {
            configuration = clazz.getDeclaredConstructor().newInstance();
        } catch (InstantiationException | IllegalAccessException
                | NoSuchMethodException | InvocationTargetException e) {
            throw new IllegalArgumentException("Failed to instantiate " + clazz.getName(), e);
        }
        configuration.setProperties(properties);
        update(properties, configuration);
        return configuration;
    }

    /**
     * Validates each {@link FieldContext} annotated field: required fields must not be empty and numeric
     * fields must fit in their (min, max) range.
     *
     * @throws IllegalArgumentException listing every field that failed validation
     */
    public static boolean isComplete(Object obj) throws IllegalArgumentException {
        requireNonNull(obj);
        StringBuilder error = new StringBuilder();
        for (Field field : obj.getClass().getDeclaredFields()) {
            FieldContext context = field.getAnnotation(FieldContext.class);
            if (context == null) {
                continue;
            }
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
            if (context.required() && isEmpty(value)) {
                error.append(String.format("Required %s is null,", field.getName()));
            }

            if (value instanceof Number) {
                long fieldVal = ((Number) value).longValue();
                if (fieldVal < context.minValue() || fieldVal > context.maxValue()) {
                    error.append(String.format("%s value %d doesn't fit in given range (%d, %d),", field.getName(),
                            fieldVal, context.minValue(), context.maxValue()));
                }
            }
        }
        if (error.length() > 0) {
            throw new IllegalArgumentException(error.substring(0, error.length() - 1));
        }
        return true;
    }

    private static void update(Properties properties, Object configuration) {
        for (Field field : configuration.getClass().getDeclaredFields()) {
            if (Modifier.isStatic(field.getModifiers())) {
                continue;
            }
            String value = properties.getProperty(field.getName());
            if (StringUtils.isBlank(value)) {
                continue;
            }
            field.setAccessible(true);
            try {
                field.set(configuration, convert(field.getName(), value.trim(), field.getType()));
            } catch (IllegalAccessException e) {
                throw new IllegalArgumentException("Failed to set " + field.getName(), e);
            }
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object convert(String name, String value, Class<?> type) {
        try {
            if (type == String.class) {
                return value;
            } else if (type == int.class || type == Integer.class) {
                return Integer.parseInt(value);
            } else if (type == long.class || type == Long.class) {
                return Long.parseLong(value);
            } else if (type == double.class || type == Double.class) {
                return Double.parseDouble(value);
            } else if (type == float.class || type == Float.class) {
                return Float.parseFloat(value);
            } else if (type == boolean.class || type == Boolean.class) {
                if (!"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
                    throw new IllegalArgumentException("not a boolean");
                }
                return Boolean.parseBoolean(value);
            } else if (type.isEnum()) {
                return Enum.valueOf((Class<? extends Enum>) type, value);
            }
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    String.format("Invalid value '%s' for %s of type %s", value, name, type.getSimpleName()), e);
        }
        throw new IllegalArgumentException("Unsupported configuration type " + type.getName() + " for " + name);
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

    private static final Logger log = LoggerFactory.getLogger(StratumConfigurationLoader.class);
}
