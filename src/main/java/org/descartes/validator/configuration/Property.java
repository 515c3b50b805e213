package org.descartes.validator.configuration;

import java.util.Objects;
import java.util.function.Supplier;

import net.jcip.annotations.Immutable;

/**
 * A named configuration key with a display name, a description and a default value.
 *
 * @since 1.0
 */
@Immutable
public final class Property {

    private final String name;
    private final String displayName;
    private final String description;
    private final Supplier<Object> defaultValue;

    public Property(String name, String displayName, String description, Supplier<Object> defaultValue) {
        this.name = name;
        this.displayName = displayName;
        this.description = description;
        this.defaultValue = defaultValue != null ? defaultValue : () -> null;
    }

    /**
     * Starts a property under the given key.
     */
    public static Builder create(String name) {
        return new Builder(name);
    }

    /**
     * The key looked up in {@link RuntimeProperties}, by convention under {@link RuntimeProperties#PROPERTY_PREFIX}.
     * @return the key; never null
     */
    public String name() {
        return name;
    }

    /**
     * The value used when the key is missing from the configuration.
     * @return the default, or {@code null} if the property has none
     */
    public Object defaultValue() {
        return defaultValue.get();
    }

    /**
     * The default in the textual form the typed accessors of {@link RuntimeProperties} parse.
     * @return the default as a string, or {@code null} if the property has none
     */
    public String defaultValueAsString() {
        Object value = defaultValue();
        return value != null ? value.toString() : null;
    }

    /**
     * What the property controls and which values it accepts.
     * @return the description, may be null
     */
    public String description() {
        return description;
    }

    /**
     * A short human readable label, the key itself when the builder got no label.
     * @return the display name; never null
     */
    public String displayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return name + "=" + defaultValueAsString();
    }

    public static final class Builder {
        private final String name;
        private String displayName;
        private String description;
        private Supplier<Object> defaultValue;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "property name can not be null");
        }

        public Builder withDisplayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder withDescription(String description) {
            this.description = description;
            return this;
        }

        public Builder withDefaultValue(Object value) {
            this.defaultValue = () -> value;
            return this;
        }

        public Builder withDefaultValue(Supplier<Object> provider) {
            this.defaultValue = provider;
            return this;
        }

        public Property build() {
            return new Property(name, displayName != null ? displayName : name, description, defaultValue);
        }
    }
}
