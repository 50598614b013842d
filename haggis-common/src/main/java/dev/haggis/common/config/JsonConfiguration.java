package dev.haggis.common.config;

import com.google.common.base.Preconditions;
import com.google.gson.FormattingStyle;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberStrategy;
import com.google.gson.reflect.TypeToken;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class JsonConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonConfiguration.class);
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");

    // Integers stay exact, decimals become doubles unless they overflow one
    private static final ToNumberStrategy NUMBERS = reader -> {
        final var text = reader.nextString();
        if (INTEGER.matcher(text).matches()) {
            final var integer = new BigInteger(text);
            return integer.bitLength() < Long.SIZE ? (Number) integer.longValue() : integer;
        }
        final var value = Double.parseDouble(text);
        return Double.isFinite(value) ? (Number) value : new BigDecimal(text);
    };

    private static final Gson READER =
            new GsonBuilder().setObjectToNumberStrategy(NUMBERS).create();

    public static final int DEFAULT_INDENT = 4;

    private final Map<String, Object> data = new LinkedHashMap<>();
    private Object source;

    private JsonConfiguration(final Object source) {
        this.source = source;
    }

    public static JsonConfiguration load(final Path file) throws ConfigurationException {
        Preconditions.checkNotNull(file, "file");
        final var config = new JsonConfiguration(file);
        config.reload();
        return config;
    }

    public static JsonConfiguration of(final Map<String, Object> source) {
        Preconditions.checkNotNull(source, "source");
        final var config = new JsonConfiguration(source);
        config.emplace(source);
        return config;
    }

    public Map<String, Object> data() {
        return this.data;
    }

    public void reload() throws ConfigurationException {
        if (this.source instanceof Path file) {
            this.emplace(read(file));
        } else {
            this.emplace(asMap(this.source));
        }
    }

    public void reload(final Object source) throws ConfigurationException {
        Preconditions.checkArgument(
                source instanceof Path || source instanceof Map<?, ?>, "Unsupported configuration source: %s", source);
        this.source = source;
        this.reload();
    }

    public @Nullable Object get(final String... keys) {
        Object current = this.data;
        for (final var key : keys) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(key);
        }
        return current;
    }

    public void set(final @Nullable Object value, final String... keys) {
        Preconditions.checkArgument(keys.length > 0, "At least one key is required");
        final var parent = this.checkPath(Arrays.copyOf(keys, keys.length - 1));
        parent.put(keys[keys.length - 1], value);
    }

    public Map<String, Object> checkPath(final String... keys) {
        var current = this.data;
        for (final var key : keys) {
            final var next = current.computeIfAbsent(key, ignored -> new LinkedHashMap<String, Object>());
            Preconditions.checkArgument(next instanceof Map<?, ?>, "The value of %s is not a nested object", key);
            current = asMap(next);
        }
        return current;
    }

    public void update(final Object... exclude) throws ConfigurationException {
        if (this.source instanceof Path file) {
            this.updateTo(file, exclude);
        } else {
            this.updateTo(asMap(this.source), exclude);
        }
    }

    public void updateTo(final Map<String, Object> target, final Object... exclude) {
        Preconditions.checkNotNull(target, "target");
        final var filtered = this.filter(KeyExclusions.of(exclude));
        target.clear();
        target.putAll(filtered);
        LOGGER.debug("Updated configuration map with {} keys", filtered.size());
    }

    public void updateTo(final Path file, final Object... exclude) throws ConfigurationException {
        Preconditions.checkNotNull(file, "file");
        // Serialized before touching the file, a failure leaves the previous configuration in place
        final var json = this.serialize(DEFAULT_INDENT, exclude);
        try {
            if (Files.isRegularFile(file)) {
                final var backup = file.resolveSibling(file.getFileName() + ".bak");
                Files.move(file, backup, StandardCopyOption.REPLACE_EXISTING);
                LOGGER.info("Moved previous configuration {} to {}", file, backup);
            }
            Files.writeString(file, json, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new ConfigurationException("Failed to write configuration to " + file, e);
        }
        LOGGER.debug("Wrote configuration to {}", file);
    }

    public void write(final Appendable output, final int indent, final Object... exclude)
            throws ConfigurationException {
        Preconditions.checkNotNull(output, "output");
        final var json = this.serialize(indent, exclude);
        try {
            output.append(json);
        } catch (final IOException e) {
            throw new ConfigurationException("Failed to write configuration", e);
        }
    }

    @Override
    public String toString() {
        return gson(DEFAULT_INDENT).toJson(this.data);
    }

    private String serialize(final int indent, final Object... exclude) throws ConfigurationException {
        try {
            return gson(indent).toJson(this.filter(KeyExclusions.of(exclude)));
        } catch (final IllegalArgumentException | JsonIOException e) {
            throw new ConfigurationException("Failed to serialize configuration", e);
        }
    }

    private void emplace(final Map<String, ?> source) {
        this.data.clear();
        this.data.putAll(copy(source));
    }

    private Map<String, Object> filter(final KeyExclusions exclusions) {
        return this.filter(new ArrayList<>(), this.data, exclusions);
    }

    private Map<String, Object> filter(
            final List<String> prefix, final Map<String, Object> source, final KeyExclusions exclusions) {
        final Map<String, Object> result = new LinkedHashMap<>();
        for (final var entry : source.entrySet()) {
            prefix.add(entry.getKey());
            if (!exclusions.excludes(prefix)) {
                final var value = entry.getValue();
                result.put(
                        entry.getKey(), value instanceof Map<?, ?> ? this.filter(prefix, asMap(value), exclusions) : value);
            }
            prefix.remove(prefix.size() - 1);
        }
        return result;
    }

    private static Map<String, Object> read(final Path file) throws ConfigurationException {
        final Map<String, Object> root;
        try (final var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            root = READER.fromJson(reader, new TypeToken<Map<String, Object>>() {});
        } catch (final IOException | JsonParseException e) {
            throw new ConfigurationException("Failed to read configuration from " + file, e);
        }
        if (root == null) {
            throw new ConfigurationException("The configuration in " + file + " is empty");
        }
        LOGGER.debug("Loaded configuration from {}", file);
        return root;
    }

    private static Map<String, Object> copy(final Map<?, ?> source) {
        final Map<String, Object> copy = new LinkedHashMap<>();
        for (final var entry : source.entrySet()) {
            final var value = entry.getValue();
            copy.put(String.valueOf(entry.getKey()), value instanceof Map<?, ?> map ? copy(map) : value);
        }
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(final Object value) {
        return (Map<String, Object>) value;
    }

    private static Gson gson(final int indent) {
        Preconditions.checkArgument(indent >= 0, "indent must not be negative");
        return new GsonBuilder()
                .serializeNulls()
                .disableHtmlEscaping()
                .setFormattingStyle(FormattingStyle.PRETTY.withIndent(" ".repeat(indent)))
                .create();
    }
}
