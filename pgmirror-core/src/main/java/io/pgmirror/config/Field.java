/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgmirror.config;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigDef.Width;

import io.pgmirror.annotation.Immutable;

/**
 * An immutable definition of a field that may appear within a {@link Configuration} instance.
 */
@Immutable
public final class Field {

    /**
     * Create a set of fields.
     * @param fields the fields to include
     * @return the field set; never null
     */
    public static Set setOf(Field... fields) {
        return new Set().with(fields);
    }

    /**
     * A set of fields, kept in declaration order.
     */
    @Immutable
    public static final class Set implements Iterable<Field> {
        private final Map<String, Field> fieldsByName;

        private Set() {
            this.fieldsByName = Collections.emptyMap();
        }

        private Set(Collection<Field> fields) {
            Map<String, Field> all = new LinkedHashMap<>();
            fields.forEach(field -> {
                if (field != null) {
                    all.put(field.name(), field);
                }
            });
            this.fieldsByName = Collections.unmodifiableMap(all);
        }

        @Override
        public Iterator<Field> iterator() {
            return fieldsByName.values().iterator();
        }

        public Set with(Field... fields) {
            if (fields.length == 0) {
                return this;
            }
            LinkedHashSet<Field> all = new LinkedHashSet<>(this.fieldsByName.values());
            for (Field f : fields) {
                if (f != null) {
                    all.add(f);
                }
            }
            return new Set(all);
        }
    }

    /**
     * A functional interface that accepts validation results.
     */
    @FunctionalInterface
    public interface ValidationOutput {
        /**
         * Accept a problem with the given value for the field.
         * @param field the field with the value; may not be null
         * @param value the value that is not valid
         * @param problemMessage the message describing the problem; may not be null
         */
        void accept(Field field, Object value, String problemMessage);
    }

    /**
     * A functional interface that can be used to validate field values.
     */
    @FunctionalInterface
    public interface Validator {

        /**
         * Validate the supplied value for the field, and report any problems to the designated consumer.
         *
         * @param config the configuration containing the field to be validated; may not be null
         * @param field the {@link Field} being validated; never null
         * @param problems the consumer to be called with each problem; never null
         * @return the number of problems that were found, or 0 if the value is valid
         */
        int validate(Configuration config, Field field, ValidationOutput problems);

        default Validator and(Validator other) {
            if (other == null || other == this) {
                return this;
            }
            return (config, field, problems) -> validate(config, field, problems) + other.validate(config, field, problems);
        }
    }

    /**
     * Create an immutable {@link Field} instance with the given property name.
     * @param name the name of the field; may not be null
     * @return the field; never null
     */
    public static Field create(String name) {
        return new Field(name, null, null, null, null, null, null, null);
    }

    private final String name;
    private final String displayName;
    private final String desc;
    private final Supplier<Object> defaultValueGenerator;
    private final Validator validator;
    private final Width width;
    private final Type type;
    private final Importance importance;

    private Field(String name, String displayName, Type type, Width width, String description, Importance importance,
                  Supplier<Object> defaultValueGenerator, Validator validator) {
        Objects.requireNonNull(name, "The field name is required");
        this.name = name;
        this.displayName = displayName;
        this.desc = description;
        this.defaultValueGenerator = defaultValueGenerator != null ? defaultValueGenerator : () -> null;
        this.validator = validator;
        this.type = type != null ? type : Type.STRING;
        this.width = width != null ? width : Width.NONE;
        this.importance = importance != null ? importance : Importance.MEDIUM;
    }

    public String name() {
        return name;
    }

    /**
     * Get the default value of the field.
     * @return the default value, or {@code null} if there is no default value
     */
    public Object defaultValue() {
        return defaultValueGenerator.get();
    }

    public String defaultValueAsString() {
        Object defaultValue = defaultValue();
        return defaultValue != null ? defaultValue.toString() : null;
    }

    public String description() {
        return desc;
    }

    public String displayName() {
        return displayName;
    }

    public Width width() {
        return width;
    }

    public Type type() {
        return type;
    }

    public Importance importance() {
        return importance;
    }

    public Validator validator() {
        return validator;
    }

    /**
     * Validate the supplied value for this field, and report any problems to the designated consumer.
     * @param config the field values keyed by their name; may not be null
     * @param problems the consumer to be called with each problem; never null
     * @return {@code true} if the value is considered valid, or {@code false} if it is not valid
     */
    public boolean validate(Configuration config, ValidationOutput problems) {
        Validator typeValidator = validatorForType(type);
        int errors = 0;
        if (typeValidator != null) {
            errors += typeValidator.validate(config, this, problems);
        }
        if (validator != null) {
            errors += validator.validate(config, this, problems);
        }
        return errors == 0;
    }

    public Field withDescription(String description) {
        return new Field(name, displayName, type, width, description, importance, defaultValueGenerator, validator);
    }

    public Field withDisplayName(String displayName) {
        return new Field(name, displayName, type, width, desc, importance, defaultValueGenerator, validator);
    }

    public Field withWidth(Width width) {
        return new Field(name, displayName, type, width, desc, importance, defaultValueGenerator, validator);
    }

    public Field withType(Type type) {
        return new Field(name, displayName, type, width, desc, importance, defaultValueGenerator, validator);
    }

    public Field withImportance(Importance importance) {
        return new Field(name, displayName, type, width, desc, importance, defaultValueGenerator, validator);
    }

    public Field withDefault(String defaultValue) {
        return new Field(name, displayName, type, width, desc, importance, () -> defaultValue, validator);
    }

    public Field withDefault(boolean defaultValue) {
        return new Field(name, displayName, type, width, desc, importance, () -> Boolean.valueOf(defaultValue), validator);
    }

    public Field withDefault(int defaultValue) {
        return new Field(name, displayName, type, width, desc, importance, () -> defaultValue, validator);
    }

    public Field withDefault(long defaultValue) {
        return new Field(name, displayName, type, width, desc, importance, () -> defaultValue, validator);
    }

    /**
     * Create and return a new Field instance that is a copy of this field but that uses the supplied validators
     * in addition to the existing one.
     *
     * @param validators the additional validators
     * @return the new field; never null
     */
    public Field withValidation(Validator... validators) {
        Validator actualValidator = validator;
        for (Validator v : validators) {
            if (v != null) {
                actualValidator = v.and(actualValidator);
            }
        }
        return new Field(name, displayName, type, width, desc, importance, defaultValueGenerator, actualValidator);
    }

    public Field required() {
        return withValidation(Field::isRequired).withImportance(Importance.HIGH);
    }

    /**
     * Add this field to the supplied Kafka {@link ConfigDef}, so that tooling built on Kafka's configuration
     * support can describe it.
     *
     * @param configDef the definition to extend; may not be null
     * @param groupName the name of the group
     * @param orderInGroup the position within the group
     * @return the supplied definition
     */
    public ConfigDef addTo(ConfigDef configDef, String groupName, int orderInGroup) {
        return configDef.define(name, type, defaultValue(), importance, desc, groupName, orderInGroup, width,
                displayName != null ? displayName : name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Field) {
            Field that = (Field) obj;
            return this.name().equals(that.name());
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }

    public static Validator validatorForType(Type type) {
        switch (type) {
            case BOOLEAN:
                return Field::isBoolean;
            case INT:
                return Field::isInteger;
            case LONG:
                return Field::isLong;
            default:
                return null;
        }
    }

    public static int isRequired(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value != null && value.trim().length() > 0) {
            return 0;
        }
        problems.accept(field, value, "A value is required");
        return 1;
    }

    public static int isBoolean(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null ||
                value.trim().equalsIgnoreCase(Boolean.TRUE.toString()) ||
                value.trim().equalsIgnoreCase(Boolean.FALSE.toString())) {
            return 0;
        }
        problems.accept(field, value, "Either 'true' or 'false' is expected");
        return 1;
    }

    public static int isInteger(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null) {
            return 0;
        }
        try {
            Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            problems.accept(field, value, "An integer is expected");
            return 1;
        }
        return 0;
    }

    public static int isPositiveInteger(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null) {
            return 0;
        }
        try {
            if (Integer.parseInt(value.trim()) > 0) {
                return 0;
            }
        }
        catch (NumberFormatException e) {
            // reported below
        }
        problems.accept(field, value, "A positive, non-zero integer value is expected");
        return 1;
    }

    public static int isNonNegativeInteger(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null) {
            return 0;
        }
        try {
            if (Integer.parseInt(value.trim()) >= 0) {
                return 0;
            }
        }
        catch (NumberFormatException e) {
            // reported below
        }
        problems.accept(field, value, "A non-negative integer is expected");
        return 1;
    }

    public static int isLong(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null) {
            return 0;
        }
        try {
            Long.parseLong(value.trim());
        }
        catch (NumberFormatException e) {
            problems.accept(field, value, "A long value is expected");
            return 1;
        }
        return 0;
    }

    public static int isPositiveLong(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null) {
            return 0;
        }
        try {
            if (Long.parseLong(value.trim()) > 0) {
                return 0;
            }
        }
        catch (NumberFormatException e) {
            // reported below
        }
        problems.accept(field, value, "A positive, non-zero long value is expected");
        return 1;
    }
}
