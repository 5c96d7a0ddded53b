package com.stepflow.core;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Hierarchical, immutable configuration tree shared by steps and tasks.
 *
 * <p>Each namespace maps keys to scalars, sequences or nested namespaces (themselves {@code Context} instances).
 * Values are addressed by dotted paths ({@code "source.options.header"}). Every operation that derives a
 * configuration ({@link #merge}, {@link #withOverrides}, {@link #with}, {@link #namespace}) returns a new instance;
 * an instance handed to a step is never edited, so one instance can be read by concurrent runs without locking.
 *
 * <p>Merging is key-by-key with the later source winning. Two namespaces under the same key are merged
 * recursively; when a namespace meets a scalar the later value replaces the earlier one outright.
 *
 * <p>Keys containing dots in source mappings are expanded into nested namespaces, so {@code {"a.b": 1}} and
 * {@code {"a": {"b": 1}}} build the same context.
 */
public final class Context {
    private static final Context EMPTY = new Context(Map.of());

    private final Map<String, Object> values;

    private Context(Map<String, Object> values) {
        this.values = values;
    }

    public static Context empty() {
        return EMPTY;
    }

    public static Context of(Map<String, ?> source) {
        Objects.requireNonNull(source, "source");
        Map<String, Object> acc = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            String key = Objects.requireNonNull(entry.getKey(), "context key");
            String[] segments = split(key);
            Object value = normalize(entry.getValue());
            for (int i = segments.length - 1; i > 0; i--) {
                Map<String, Object> wrapper = new LinkedHashMap<>();
                wrapper.put(segments[i], value);
                value = new Context(Collections.unmodifiableMap(wrapper));
            }
            put(acc, segments[0], value);
        }
        return acc.isEmpty() ? EMPTY : new Context(Collections.unmodifiableMap(acc));
    }

    /** Merges the sources in order; later sources take precedence. */
    public static Context merged(List<Context> sources) {
        Context result = EMPTY;
        for (Context source : Objects.requireNonNull(sources, "sources")) {
            result = result.merge(Objects.requireNonNull(source, "source"));
        }
        return result;
    }

    public static Context merged(Context... sources) {
        return merged(List.of(sources));
    }

    /**
     * Resolves a dotted path through nested namespaces.
     *
     * @throws PathNotFoundException if any segment is absent or an intermediate value is not a namespace
     */
    public Object resolve(String path) {
        String[] segments = split(path);
        Object current = this;
        for (int i = 0; i < segments.length; i++) {
            if (!(current instanceof Context namespace) || !namespace.values.containsKey(segments[i])) {
                throw new PathNotFoundException(path, segments[i], join(segments, i));
            }
            current = namespace.values.get(segments[i]);
        }
        return current;
    }

    /**
     * Resolves a path and converts the value to {@code type}. Numeric, boolean and {@link Secret} targets also accept
     * their textual form.
     *
     * @throws PathNotFoundException if the path does not resolve
     * @throws ValueTypeException if the value cannot be read as {@code type}
     */
    public <T> T resolve(String path, Class<T> type) {
        return Values.convert(path, resolve(path), Objects.requireNonNull(type, "type"));
    }

    public Optional<Object> find(String path) {
        return contains(path) ? Optional.ofNullable(resolve(path)) : Optional.empty();
    }

    public boolean contains(String path) {
        String[] segments = split(path);
        Object current = this;
        for (String segment : segments) {
            if (!(current instanceof Context namespace) || !namespace.values.containsKey(segment)) {
                return false;
            }
            current = namespace.values.get(segment);
        }
        return true;
    }

    /** Returns true when the path resolves to a value readable as {@code type}. */
    public boolean accepts(String path, Class<?> type) {
        return contains(path) && Values.conforms(resolve(path), type);
    }

    /**
     * Reads {@code path} as the kind of value {@code defaultValue} is, or returns the default when the path is
     * absent. List defaults read any list, context defaults read a namespace and map defaults read a namespace as
     * nested maps, whatever the default's concrete class.
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String path, T defaultValue) {
        Objects.requireNonNull(defaultValue, "defaultValue");
        if (defaultValue instanceof Map) {
            return contains(path) ? (T) namespace(path).toMap() : defaultValue;
        }
        return get(path, (Class<T>) valueTypeOf(defaultValue), defaultValue);
    }

    public <T> T get(String path, Class<T> type, T defaultValue) {
        Objects.requireNonNull(type, "type");
        return contains(path) ? resolve(path, type) : defaultValue;
    }

    private static Class<?> valueTypeOf(Object value) {
        if (value instanceof List) return List.class;
        if (value instanceof Context) return Context.class;
        return value.getClass();
    }

    public String getString(String path) {
        Object value = resolve(path);
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        throw new ValueTypeException(path, String.class, value == null ? null : value.getClass());
    }

    public int getInt(String path) {
        return resolve(path, Integer.class);
    }

    public long getLong(String path) {
        return resolve(path, Long.class);
    }

    public boolean getBoolean(String path) {
        return resolve(path, Boolean.class);
    }

    public List<?> getList(String path) {
        return resolve(path, List.class);
    }

    /** Narrowed view rooted at the namespace {@code path}. */
    public Context namespace(String path) {
        return resolve(path, Context.class);
    }

    /** Pure merge: {@code other} wins key by key, namespaces are merged recursively. */
    public Context merge(Context other) {
        Objects.requireNonNull(other, "other");
        if (other.values.isEmpty()) return this;
        if (values.isEmpty()) return other;
        Map<String, Object> merged = new LinkedHashMap<>(values);
        for (Map.Entry<String, Object> entry : other.values.entrySet()) {
            put(merged, entry.getKey(), entry.getValue());
        }
        return new Context(Collections.unmodifiableMap(merged));
    }

    /** Merge with {@code overrides} as the highest-precedence source. */
    public Context withOverrides(Map<String, ?> overrides) {
        return merge(Context.of(overrides));
    }

    /**
     * Returns a copy with {@code value} stored at {@code path}, creating namespaces along the way. Unlike
     * {@link #withOverrides}, a namespace value replaces whatever was stored at the path.
     */
    public Context with(String path, Object value) {
        return with(split(path), 0, normalize(value));
    }

    private Context with(String[] segments, int index, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        String key = segments[index];
        if (index == segments.length - 1) {
            copy.put(key, value);
        } else {
            Object existing = values.get(key);
            Context namespace = existing instanceof Context c ? c : EMPTY;
            copy.put(key, namespace.with(segments, index + 1, value));
        }
        return new Context(Collections.unmodifiableMap(copy));
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Deep copy as plain maps and lists, in insertion order. */
    @JsonValue
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        values.forEach((key, value) -> out.put(key, plain(value)));
        return out;
    }

    /** Leaf values keyed by their full dotted path. */
    public Map<String, Object> flatten() {
        Map<String, Object> out = new LinkedHashMap<>();
        flattenInto("", out);
        return out;
    }

    private void flattenInto(String prefix, Map<String, Object> out) {
        values.forEach((key, value) -> {
            String path = prefix.isEmpty() ? key : prefix + "." + key;
            if (value instanceof Context namespace) {
                namespace.flattenInto(path, out);
            } else {
                out.put(path, plain(value));
            }
        });
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Context other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Context" + toMap();
    }

    private static void put(Map<String, Object> target, String key, Object value) {
        if (target.containsKey(key)) {
            Object existing = target.get(key);
            if (existing instanceof Context left && value instanceof Context right) {
                value = left.merge(right);
            }
        }
        target.put(key, value);
    }

    private static Object normalize(Object value) {
        if (value instanceof Context) return value;
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return Context.of(copy);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object item : collection) copy.add(normalize(item));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    private static Object plain(Object value) {
        if (value instanceof Context namespace) return namespace.toMap();
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) copy.add(plain(item));
            return copy;
        }
        return value;
    }

    /** Rejects malformed dotted paths up front, before any lookup. */
    static void checkPath(String path) {
        split(path);
    }

    private static String[] split(String path) {
        Objects.requireNonNull(path, "path");
        String[] segments = path.split("\\.", -1);
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new IllegalArgumentException("Invalid context path: '" + path + "'");
            }
        }
        return segments;
    }

    private static String join(String[] segments, int count) {
        return String.join(".", List.of(segments).subList(0, count));
    }
}
