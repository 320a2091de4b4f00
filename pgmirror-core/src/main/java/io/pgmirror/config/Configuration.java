/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.config;

import java.time.Duration;
import java.time.temporal.TemporalUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.IntSupplier;
import java.util.function.LongSupplier;
import java.util.regex.Pattern;

import org.apache.kafka.common.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgmirror.annotation.Immutable;
import io.pgmirror.config.Field.ValidationOutput;

/**
 * An immutable set of string properties with typed accessors keyed by {@link Field}. Instances are
 * obtained {@link #from(Properties) from Properties}, {@link #from(Map) from a Map} or built with a
 * {@link #create() builder}.
 */
@Immutable
public interface Configuration {

    Logger CONFIGURATION_LOGGER = LoggerFactory.getLogger(Configuration.class);

    Pattern PASSWORD_PATTERN = Pattern.compile(".*password$", Pattern.CASE_INSENSITIVE);

    /**
     * A builder of Configuration objects.
     */
    class Builder {
        private final Properties props = new Properties();

        protected Builder() {
        }

        protected Builder(Properties props) {
            this.props.putAll(props);
        }

        public Builder with(String key, String value) {
            if (value == null) {
                props.remove(key);
            }
            else {
                props.setProperty(key, value);
            }
            return this;
        }

        public Builder with(String key, Object value) {
            return with(key, value != null ? value.toString() : null);
        }

        public Builder with(Field field, String value) {
            return with(field.name(), value);
        }

        public Builder with(Field field, Object value) {
            return with(field.name(), value);
        }

        public Builder withDefault(Field field, Object value) {
            if (!props.containsKey(field.name())) {
                with(field, value);
            }
            return this;
        }

        public Configuration build() {
            return Configuration.from(props);
        }
    }

    static Builder create() {
        return new Builder();
    }

    /**
     * Create a new {@link Builder configuration builder} that starts with a copy of the supplied configuration.
     *
     * @param config the configuration to copy; may be null
     * @return the configuration builder
     */
    static Builder copy(Configuration config) {
        return config != null ? new Builder(config.asProperties()) : new Builder();
    }

    static Configuration empty() {
        return from(new Properties());
    }

    /**
     * Obtain a configuration instance by copying the supplied Properties object.
     *
     * @param properties the properties; may be null or empty
     * @return the configuration; never null
     */
    static Configuration from(Properties properties) {
        Properties props = new Properties();
        if (properties != null) {
            props.putAll(properties);
        }
        return new Configuration() {
            @Override
            public String getString(String key) {
                return props.getProperty(key);
            }

            @Override
            public Set<String> keys() {
                return props.stringPropertyNames();
            }

            @Override
            public String toString() {
                return withMaskedPasswords().toString();
            }
        };
    }

    /**
     * Obtain a configuration instance by copying the supplied map of string keys and object values.
     *
     * @param properties the properties; may be null or empty
     * @return the configuration; never null
     */
    static Configuration from(Map<String, ?> properties) {
        Properties props = new Properties();
        if (properties != null) {
            properties.forEach((key, value) -> {
                if (value != null) {
                    props.setProperty(key, value.toString());
                }
            });
        }
        return from(props);
    }

    /**
     * Get the string value associated with the given key.
     *
     * @param key the key for the configuration property
     * @return the value, or null if the key is null or there is no such key-value pair in the configuration
     */
    String getString(String key);

    /**
     * Get the set of keys in this configuration.
     *
     * @return the set of keys; never null but possibly empty
     */
    Set<String> keys();

    default boolean hasKey(Field field) {
        return getString(field.name()) != null;
    }

    default Builder edit() {
        return copy(this);
    }

    /**
     * Get the string value associated with the given field, returning the field's default value if there is no
     * such key-value pair in this configuration.
     *
     * @param field the field; may not be null
     * @return the configured value or the field's default value
     */
    default String getString(Field field) {
        String value = getString(field.name());
        return value != null ? value : field.defaultValueAsString();
    }

    /**
     * Get the comma separated values of the given field as trimmed, non-empty strings.
     *
     * @param field the field; may not be null
     * @return the values; never null but possibly empty
     */
    default List<String> getList(Field field) {
        String value = getString(field);
        if (value == null || value.trim().isEmpty()) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        for (String item : value.split(",")) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    default Integer getInteger(String key, IntSupplier defaultValueSupplier) {
        String value = getString(key);
        if (value != null) {
            try {
                return Integer.valueOf(value.trim());
            }
            catch (NumberFormatException e) {
                throw new ConfigException(key, value, "An integer is expected");
            }
        }
        return defaultValueSupplier != null ? defaultValueSupplier.getAsInt() : null;
    }

    default Long getLong(String key, LongSupplier defaultValueSupplier) {
        String value = getString(key);
        if (value != null) {
            try {
                return Long.valueOf(value.trim());
            }
            catch (NumberFormatException e) {
                throw new ConfigException(key, value, "A long value is expected");
            }
        }
        return defaultValueSupplier != null ? defaultValueSupplier.getAsLong() : null;
    }

    default int getInteger(Field field) {
        return getInteger(field.name(), () -> Integer.parseInt(field.defaultValueAsString()));
    }

    default long getLong(Field field) {
        return getLong(field.name(), () -> Long.parseLong(field.defaultValueAsString()));
    }

    default boolean getBoolean(Field field) {
        String value = getString(field);
        return value != null && Boolean.parseBoolean(value.trim());
    }

    /**
     * Gets the duration value associated with the given field.
     *
     * @param field the field
     * @param unit the temporal unit of the configured value
     * @return the duration; never null
     */
    default Duration getDuration(Field field, TemporalUnit unit) {
        return Duration.of(getLong(field), unit);
    }

    default Properties asProperties() {
        Properties props = new Properties();
        keys().forEach(key -> {
            String value = getString(key);
            if (value != null) {
                props.setProperty(key, value);
            }
        });
        return props;
    }

    /**
     * Return a copy of this configuration's properties with every password value replaced by asterisks.
     *
     * @return the masked properties; never null
     */
    default Properties withMaskedPasswords() {
        Properties props = asProperties();
        props.stringPropertyNames().forEach(key -> {
            if (PASSWORD_PATTERN.matcher(key).matches()) {
                props.setProperty(key, "********");
            }
        });
        return props;
    }

    /**
     * Validate the supplied fields in this configuration.
     *
     * @param fields the fields
     * @param problems the consumer to be called with each problem; never null
     * @return {@code true} if the value is considered valid, or {@code false} if it is not valid
     */
    default boolean validate(Iterable<Field> fields, ValidationOutput problems) {
        boolean valid = true;
        for (Field field : fields) {
            if (!field.validate(this, problems)) {
                valid = false;
            }
        }
        return valid;
    }

    /**
     * Validate the supplied fields, passing each problem message to the consumer with passwords masked.
     *
     * @param fields the fields
     * @param problems the consumer to be called with each problem message; never null
     * @return {@code true} if all values are valid
     */
    default boolean validateAndRecord(Iterable<Field> fields, Consumer<String> problems) {
        return validate(fields, (f, v, problem) -> {
            if (v == null) {
                problems.accept("The '" + f.name() + "' value is invalid: " + problem);
            }
            else {
                String value = PASSWORD_PATTERN.matcher(f.name()).matches() ? "********" : v.toString();
                problems.accept("The '" + f.name() + "' value '" + value + "' is invalid: " + problem);
            }
        });
    }
}
