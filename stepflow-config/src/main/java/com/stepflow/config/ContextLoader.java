package com.stepflow.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.stepflow.core.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Builds a {@link Context} from an ordered list of sources. Sources are merged in the order they were added, the
 * later one winning key by key, so the usual layering is files first, then environment, then explicit overrides.
 *
 * <pre>{@code
 * Context ctx = ContextLoader.builder()
 *     .yaml(Path.of("etl.yaml"))
 *     .environment("ETL")
 *     .overrides(Map.of("run.date", "2024-06-01"))
 *     .build()
 *     .load();
 * }</pre>
 */
public final class ContextLoader {
    private static final Logger log = LoggerFactory.getLogger(ContextLoader.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

    enum Format { JSON, YAML, TOML }

    private final List<Source> sources;

    private ContextLoader(List<Source> sources) {
        this.sources = List.copyOf(sources);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Shorthand for a loader with a single file source, format chosen by extension. */
    public static Context load(Path file) throws ContextLoadException {
        return builder().file(file).build().load();
    }

    public Context load() throws ContextLoadException {
        Context result = Context.empty();
        for (Source source : sources) {
            Map<String, Object> values = source.read();
            try {
                result = result.merge(Context.of(values));
            } catch (IllegalArgumentException e) {
                throw new ContextLoadException(source.describe(), e.getMessage(), e);
            }
            log.debug("context.source loaded={} keys={}", source.describe(), values.keySet());
        }
        return result;
    }

    static Format formatOf(String name) throws ContextLoadException {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".json")) return Format.JSON;
        if (lower.endsWith(".yaml") || lower.endsWith(".yml")) return Format.YAML;
        if (lower.endsWith(".toml")) return Format.TOML;
        throw new ContextLoadException(name, "unsupported configuration format (expected .json, .yaml, .yml or .toml)");
    }

    static Map<String, Object> parse(String description, Format format, String text) throws ContextLoadException {
        if (format == Format.TOML) {
            return parseToml(description, text);
        }
        ObjectMapper mapper = format == Format.YAML ? YAML_MAPPER : JSON_MAPPER;
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ContextLoadException(description, "malformed " + format.name().toLowerCase(Locale.ROOT)
                + ": " + e.getOriginalMessage(), e);
        }
        // empty or comment-only documents
        if (root == null || root.isMissingNode() || root.isNull()) {
            return Map.of();
        }
        if (!root.isObject()) {
            throw new ContextLoadException(description, format.name().toLowerCase(Locale.ROOT)
                + " document must be a mapping at the top level, found " + root.getNodeType());
        }
        return mapper.convertValue(root, MAP);
    }

    private static Map<String, Object> parseToml(String description, String text) throws ContextLoadException {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new ContextLoadException(description, "malformed toml: " + result.errors().get(0));
        }
        return tomlTable(result);
    }

    private static Map<String, Object> tomlTable(TomlTable table) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String key : table.keySet()) {
            out.put(key, tomlValue(table.get(List.of(key))));
        }
        return out;
    }

    private static Object tomlValue(Object value) {
        if (value instanceof TomlTable table) return tomlTable(table);
        if (value instanceof TomlArray array) {
            List<Object> items = new ArrayList<>(array.size());
            for (int i = 0; i < array.size(); i++) items.add(tomlValue(array.get(i)));
            return items;
        }
        // dates and times are kept in their TOML text form
        if (value instanceof TemporalAccessor temporal) return temporal.toString();
        return value;
    }

    /**
     * Maps {@code PREFIX_A__B=v} to {@code a.b = "v"}: the prefix and its underscore are stripped, a double underscore
     * separates namespaces, and names are lower-cased. Variables that do not yield a valid path are skipped.
     */
    static Map<String, Object> fromEnvironment(String prefix, Map<String, String> env) {
        String head = prefix.toUpperCase(Locale.ROOT) + "_";
        Map<String, Object> out = new LinkedHashMap<>();
        env.forEach((name, value) -> {
            if (!name.startsWith(head) || name.length() == head.length()) return;
            String path = name.substring(head.length()).toLowerCase(Locale.ROOT).replace("__", ".");
            if (path.startsWith(".") || path.endsWith(".") || path.contains("..")) {
                log.warn("context.env skipped={} reason=invalid path '{}'", name, path);
                return;
            }
            out.put(path, value);
        });
        return out;
    }

    static Map<String, Object> fromProperties(String prefix, Properties properties) {
        String head = prefix + ".";
        Map<String, Object> out = new LinkedHashMap<>();
        for (String name : properties.stringPropertyNames()) {
            if (name.startsWith(head) && name.length() > head.length()) {
                out.put(name.substring(head.length()), properties.getProperty(name));
            }
        }
        return out;
    }

    private interface Source {
        String describe();

        Map<String, Object> read() throws ContextLoadException;
    }

    private record FileSource(Path path, Format format) implements Source {
        @Override
        public String describe() {
            return path.toString();
        }

        @Override
        public Map<String, Object> read() throws ContextLoadException {
            String text;
            try {
                text = Files.readString(path, StandardCharsets.UTF_8);
            } catch (NoSuchFileException e) {
                throw new ContextLoadException(describe(), "file not found", e);
            } catch (IOException e) {
                throw new ContextLoadException(describe(), "cannot read: " + e.getMessage(), e);
            }
            return parse(describe(), format, text);
        }
    }

    private record ResourceSource(String name, Format format, ClassLoader loader) implements Source {
        @Override
        public String describe() {
            return "classpath:" + name;
        }

        @Override
        public Map<String, Object> read() throws ContextLoadException {
            try (InputStream in = loader.getResourceAsStream(name)) {
                if (in == null) throw new ContextLoadException(describe(), "resource not found");
                return parse(describe(), format, new String(in.readAllBytes(), StandardCharsets.UTF_8));
            } catch (ContextLoadException e) {
                throw e;
            } catch (IOException e) {
                throw new ContextLoadException(describe(), "cannot read: " + e.getMessage(), e);
            }
        }
    }

    private record MapSource(String describe, Map<String, Object> values) implements Source {
        @Override
        public Map<String, Object> read() {
            return values;
        }
    }

    public static final class Builder {
        private final List<Source> sources = new ArrayList<>();

        private Builder() {}

        public Builder json(Path path) {
            sources.add(new FileSource(Objects.requireNonNull(path, "path"), Format.JSON));
            return this;
        }

        public Builder yaml(Path path) {
            sources.add(new FileSource(Objects.requireNonNull(path, "path"), Format.YAML));
            return this;
        }

        public Builder toml(Path path) {
            sources.add(new FileSource(Objects.requireNonNull(path, "path"), Format.TOML));
            return this;
        }

        /** File whose format is chosen by its extension. */
        public Builder file(Path path) throws ContextLoadException {
            Objects.requireNonNull(path, "path");
            sources.add(new FileSource(path, formatOf(path.getFileName().toString())));
            return this;
        }

        /** Classpath resource, format chosen by extension, read with the context class loader. */
        public Builder resource(String name) throws ContextLoadException {
            Objects.requireNonNull(name, "name");
            ClassLoader loader = Thread.currentThread().getContextClassLoader();
            sources.add(new ResourceSource(name, formatOf(name),
                loader != null ? loader : ContextLoader.class.getClassLoader()));
            return this;
        }

        public Builder environment(String prefix) {
            return environment(prefix, System.getenv());
        }

        /** Environment-style variables from {@code env}, e.g. a captured or test environment. */
        public Builder environment(String prefix, Map<String, String> env) {
            Objects.requireNonNull(prefix, "prefix");
            sources.add(new MapSource("env:" + prefix, fromEnvironment(prefix, Map.copyOf(env))));
            return this;
        }

        /** System properties named {@code prefix.a.b}, exposed as {@code a.b}. Read when added. */
        public Builder systemProperties(String prefix) {
            Objects.requireNonNull(prefix, "prefix");
            sources.add(new MapSource("sys:" + prefix, fromProperties(prefix, System.getProperties())));
            return this;
        }

        public Builder overrides(Map<String, ?> overrides) {
            sources.add(new MapSource("overrides", new LinkedHashMap<>(Objects.requireNonNull(overrides, "overrides"))));
            return this;
        }

        public ContextLoader build() {
            return new ContextLoader(sources);
        }
    }
}
