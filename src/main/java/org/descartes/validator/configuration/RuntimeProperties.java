package org.descartes.validator.configuration;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

import net.jcip.annotations.Immutable;

/**
 * Immutable string key/value configuration with typed accessors.
 *
 * <p>
 * Values are looked up by key or through a {@link Property}, in which case the property default applies when the key
 * is absent or cannot be parsed. All keys share the {@link #PROPERTY_PREFIX}.
 * </p>
 *
 * @since 1.0
 */
@Immutable
public interface RuntimeProperties {

    String PROPERTY_PREFIX = "descartes";

    /**
     * Create a new {@link Builder configuration builder}.
     *
     * @return the configuration builder
     */
    static Builder create() {
        return new Builder();
    }

    /**
     * Create a new {@link Builder configuration builder} that starts with a copy of the supplied configuration.
     *
     * @param config the configuration to copy; may be null
     * @return the configuration builder
     */
    static Builder copy(RuntimeProperties config) {
        return config != null ? new Builder(config.asProperties()) : new Builder();
    }

    /**
     * A configuration without any key, every {@link Property} resolves to its default.
     */
    static RuntimeProperties empty() {
        return from(new Properties());
    }

    /**
     * Obtain a configuration instance by copying the supplied Properties object. The supplied {@link Properties} object is
     * copied so that the resulting configuration cannot be modified.
     *
     * @param properties the properties; may be null or empty
     * @return the configuration; never null
     */
    static RuntimeProperties from(Properties properties) {
        Properties props = new Properties();
        if (properties != null) {
            properties.stringPropertyNames().forEach(key -> props.setProperty(key.trim(), properties.getProperty(key)));
        }
        return new RuntimeProperties() {
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
                return asProperties().toString();
            }
        };
    }

    /**
     * Obtain a configuration instance by copying the supplied map. Values are converted with {@link Object#toString()}
     * and null values are dropped.
     *
     * @param properties the properties; may be null or empty
     * @return the configuration; never null
     */
    static RuntimeProperties from(Map<String, ?> properties) {
        Properties props = new Properties();
        if (properties != null) {
            properties.forEach((k, v) -> {
                if (k != null && v != null)
                    props.setProperty(k, v.toString());
            });
        }
        return from(props);
    }

    /**
     * Obtain a configuration instance by loading the Properties from the supplied URL.
     *
     * @param url the URL to the stream containing the configuration properties; may not be null
     * @return the configuration; never null
     * @throws IOException if there is an error reading the stream
     */
    static RuntimeProperties load(URL url) throws IOException {
        try (InputStream stream = url.openStream()) {
            return load(stream);
        }
    }

    /**
     * Obtain a configuration instance by loading the Properties from the supplied file.
     *
     * @param file the file containing the configuration properties; may not be null
     * @return the configuration; never null
     * @throws IOException if there is an error reading the stream
     */
    static RuntimeProperties load(File file) throws IOException {
        try (InputStream stream = new FileInputStream(file)) {
            return load(stream);
        }
    }

    /**
     * Obtain a configuration instance by loading the Properties from the supplied stream. The stream is closed.
     *
     * @param stream the stream containing the properties; may not be null
     * @return the configuration; never null
     * @throws IOException if there is an error reading the stream
     */
    static RuntimeProperties load(InputStream stream) throws IOException {
        try (stream) {
            Properties properties = new Properties();
            properties.load(stream);
            return from(properties);
        }
    }

    /**
     * Get the set of keys in this configuration.
     *
     * @return the set of keys; never null but possibly empty
     */
    Set<String> keys();

    /**
     * Get the string value associated with the given key.
     *
     * @param key the key for the configuration property
     * @return the value, or null if there is no such key-value pair in the configuration
     */
    String getString(String key);

    /**
     * Get the string value of the property, or its default.
     */
    default String getString(Property property) {
        String value = getString(property.name());
        return value != null ? value : property.defaultValueAsString();
    }

    /**
     * Get the boolean value associated with the given property, or its default when the key is absent.
     *
     * @param property the property
     * @return the boolean value
     */
    default boolean getBoolean(Property property) {
        return getBoolean(property.name(), () -> Boolean.parseBoolean(property.defaultValueAsString()));
    }

    /**
     * Get the boolean value associated with the given key, using the given supplier to obtain a default value if there is no such
     * key-value pair or the value is neither {@code true} nor {@code false}.
     *
     * @param key the key for the configuration property
     * @param defaultValueSupplier the supplier for the default value; may be null
     * @return the boolean value, or null if there is no value and no default supplier
     */
    default Boolean getBoolean(String key, BooleanSupplier defaultValueSupplier) {
        String value = getString(key);
        if (value != null) {
            value = value.trim().toLowerCase(Locale.ROOT);
            if (value.equals("true")) {
                return Boolean.TRUE;
            }
            if (value.equals("false")) {
                return Boolean.FALSE;
            }
        }
        return defaultValueSupplier != null ? defaultValueSupplier.getAsBoolean() : null;
    }

    /**
     * Get the long value associated with the given property, or its default when the key is absent or not a number.
     *
     * @param property the property
     * @return the long value
     * @throws NumberFormatException if neither the configured value nor the default can be parsed
     */
    default long getLong(Property property) {
        return getLong(property.name(), () -> Long.parseLong(property.defaultValueAsString()));
    }

    /**
     * Get the long value associated with the given key, falling back to the supplier.
     *
     * @param key the key for the configuration property
     * @param defaultValueSupplier the supplier for the default value; may be null
     * @return the long value, or null if there is no value and no default supplier
     */
    default Long getLong(String key, LongSupplier defaultValueSupplier) {
        String value = getString(key);
        if (value != null) {
            try {
                return Long.valueOf(value.trim());
            } catch (NumberFormatException ignore) {
                // fall through to the default
            }
        }
        return defaultValueSupplier != null ? defaultValueSupplier.getAsLong() : null;
    }

    /**
     * Get the enum constant named by the given property, matched ignoring case, or the default constant.
     *
     * @param property the property
     * @param type the enum class
     * @return the constant
     * @throws IllegalArgumentException if the configured value names no constant of {@code type}
     */
    default <E extends Enum<E>> E getEnum(Property property, Class<E> type) {
        String value = getString(property);
        if (value == null)
            return null;
        return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }

    /**
     * Get a copy of these configuration properties as a Properties object.
     *
     * @return the properties object; never null
     */
    default Properties asProperties() {
        Properties props = new Properties();
        keys().forEach(key -> {
            String value = getString(key);
            if (key != null && value != null) {
                props.setProperty(key, value);
            }
        });
        return props;
    }

    /**
     * Get a copy of these configuration properties as a map.
     *
     * @return the map; never null
     */
    default Map<String, String> asMap() {
        Map<String, String> props = new HashMap<>();
        keys().forEach(key -> {
            String value = getString(key);
            if (key != null && value != null) {
                props.put(key, value);
            }
        });
        return props;
    }

    class Builder {
        private final Properties properties = new Properties();

        private Builder() { }

        private Builder(Properties properties) {
            this.properties.putAll(properties);
        }

        /**
         * Associate the given value with the specified key, replacing any previous value.
         */
        public Builder with(String key, Object value) {
            properties.setProperty(key, String.valueOf(value));
            return this;
        }

        public Builder with(Property property, Object value) {
            return with(property.name(), value);
        }

        public Builder without(String key) {
            properties.remove(key);
            return this;
        }

        public Builder apply(Consumer<Builder> function) {
            function.accept(this);
            return this;
        }

        public RuntimeProperties build() {
            return RuntimeProperties.from(properties);
        }
    }
}
