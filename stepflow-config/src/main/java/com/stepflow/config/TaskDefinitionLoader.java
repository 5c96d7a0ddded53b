package com.stepflow.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.stepflow.core.Aggregation;
import com.stepflow.core.Context;
import com.stepflow.core.ContextMapping;
import com.stepflow.core.InputMapping;
import com.stepflow.core.Secret;
import com.stepflow.core.Step;
import com.stepflow.core.Steps;
import com.stepflow.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a {@link Task} from a JSON or YAML definition.
 *
 * <pre>
 * {
 *   "task": "daily_etl",
 *   "aggregation": "last_wins",
 *   "preflight": true,
 *   "requires": { "run.date": "string" },
 *   "steps": [
 *     { "$ref": "read_csv", "namespace": "reader" },
 *     { "$class": "com.acme.Dedupe", "select": ["dataset"] },
 *     { "$task": { "task": "publish", "steps": [ ... ] }, "overrides": { "target.format": "jsonl" } }
 *   ]
 * }
 * </pre>
 *
 * {@code "$ref"} names a step in the {@link StepRegistry} (the built-in {@code identity} passes its input through);
 * {@code "$class"} instantiates a {@link Step} with a no-args constructor unless reflection is disabled;
 * {@code "$task"} nests another definition. Per entry, {@code "select"} and {@code "rename"} shape the input and
 * {@code "namespace"} and {@code "overrides"} shape the context the step sees.
 */
public final class TaskDefinitionLoader {
    private static final Logger log = LoggerFactory.getLogger(TaskDefinitionLoader.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};
    private static final String IDENTITY = "identity";

    private TaskDefinitionLoader() {}

    public static Task load(Path filePath, StepRegistry registry) throws IOException {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(registry, "registry");
        ContextLoader.Format format = ContextLoader.formatOf(filePath.getFileName().toString());
        if (format == ContextLoader.Format.TOML) {
            throw new IOException("Task definitions must be JSON or YAML: " + filePath);
        }
        try (InputStream in = Files.newInputStream(filePath)) {
            return format == ContextLoader.Format.YAML ? loadYaml(in, registry) : loadJson(in, registry);
        }
    }

    public static Task loadJson(InputStream in, StepRegistry registry) throws IOException {
        return fromTree(read(JSON_MAPPER, in), registry);
    }

    public static Task loadYaml(InputStream in, StepRegistry registry) throws IOException {
        return fromTree(read(YAML_MAPPER, in), registry);
    }

    public static Task fromTree(JsonNode root, StepRegistry registry) throws IOException {
        Objects.requireNonNull(registry, "registry");
        if (root == null || !root.isObject()) throw new IOException("Task definition must be an object");

        String name = req(root, "task").asText();
        Task.Builder builder = Task.builder(name)
            .aggregation(parseAggregation(root.get("aggregation")))
            .preflight(root.path("preflight").asBoolean(false));

        JsonNode requires = root.get("requires");
        if (requires != null && !requires.isNull()) {
            if (!requires.isObject()) throw new IOException("'requires' must be an object of path to type");
            for (Iterator<Map.Entry<String, JsonNode>> it = requires.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> entry = it.next();
                builder.requires(entry.getKey(), parseType(entry.getValue().asText()));
            }
        }

        JsonNode steps = req(root, "steps");
        if (!steps.isArray() || steps.isEmpty()) {
            throw new IOException("Task '" + name + "' must declare a non-empty 'steps' array");
        }
        for (JsonNode stepNode : steps) {
            addStepNode(stepNode, builder, registry);
        }
        Task task = builder.build();
        log.debug("task.loaded name={} steps={}", name, task.size());
        return task;
    }

    private static void addStepNode(JsonNode stepNode, Task.Builder builder, StepRegistry registry) throws IOException {
        if (stepNode == null || !stepNode.isObject()) {
            throw new IOException("Each step must be a JSON object");
        }
        Step step;
        if (stepNode.has("$ref")) {
            step = resolveRef(text(stepNode, "$ref"), registry);
        } else if (stepNode.has("$class")) {
            step = instantiate(text(stepNode, "$class"), registry);
        } else if (stepNode.has("$task")) {
            step = fromTree(stepNode.get("$task"), registry);
        } else {
            throw new IOException("Unsupported step: " + stepNode);
        }
        builder.add(step, parseInputMapping(stepNode), parseContextMapping(stepNode));
    }

    private static Step resolveRef(String ref, StepRegistry registry) throws IOException {
        if (registry.has(ref)) {
            try {
                return registry.create(ref);
            } catch (RuntimeException e) {
                throw new IOException("Failed to create step '" + ref + "'", e);
            }
        }
        if (IDENTITY.equals(ref)) {
            return Steps.step(IDENTITY).idempotent(true).execute((ctx, input, output) -> output.putAll(input));
        }
        throw new IOException("Unknown step reference: " + ref);
    }

    private static Step instantiate(String fqcn, StepRegistry registry) throws IOException {
        if (!registry.reflectionEnabled()) {
            throw new IOException("Reflection is disabled. Register the step in the StepRegistry and use $ref: " + fqcn);
        }
        Class<?> stepClass;
        try {
            stepClass = Class.forName(fqcn);
        } catch (Exception exception) {
            throw new IOException("Failed to load class " + fqcn, exception);
        }
        if (!Step.class.isAssignableFrom(stepClass)) {
            throw new IOException("Class does not implement Step: " + fqcn);
        }
        Constructor<? extends Step> constructor;
        try {
            constructor = stepClass.asSubclass(Step.class).getDeclaredConstructor();
            constructor.setAccessible(true);
        } catch (Exception exception) {
            throw new IOException("Failed to resolve no-args constructor for " + fqcn, exception);
        }
        try {
            return constructor.newInstance();
        } catch (InvocationTargetException e) {
            throw new IOException("Failed to instantiate step: " + fqcn, e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new IOException("Failed to instantiate step: " + fqcn, e);
        }
    }

    private static InputMapping parseInputMapping(JsonNode stepNode) throws IOException {
        InputMapping mapping = InputMapping.identity();
        JsonNode select = stepNode.get("select");
        if (select != null && !select.isNull()) {
            if (!select.isArray()) throw new IOException("'select' must be an array of field names");
            List<String> names = new ArrayList<>();
            for (JsonNode n : select) names.add(n.asText());
            mapping = mapping.andThen(InputMapping.select(names.toArray(new String[0])));
        }
        JsonNode rename = stepNode.get("rename");
        if (rename != null && !rename.isNull()) {
            if (!rename.isObject()) throw new IOException("'rename' must be an object of old to new field name");
            for (Iterator<Map.Entry<String, JsonNode>> it = rename.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> entry = it.next();
                mapping = mapping.andThen(InputMapping.rename(entry.getKey(), entry.getValue().asText()));
            }
        }
        return mapping;
    }

    private static ContextMapping parseContextMapping(JsonNode stepNode) throws IOException {
        ContextMapping mapping = ContextMapping.identity();
        JsonNode namespace = stepNode.get("namespace");
        if (namespace != null && !namespace.isNull()) {
            if (!namespace.isTextual()) throw new IOException("'namespace' must be a string");
            try {
                mapping = mapping.andThen(ContextMapping.namespace(namespace.asText()));
            } catch (IllegalArgumentException e) {
                throw new IOException("Invalid namespace: " + e.getMessage(), e);
            }
        }
        JsonNode overrides = stepNode.get("overrides");
        if (overrides != null && !overrides.isNull()) {
            if (!overrides.isObject()) throw new IOException("'overrides' must be an object");
            Map<String, Object> values = JSON_MAPPER.convertValue(overrides, MAP);
            try {
                mapping = mapping.andThen(ContextMapping.overrides(values));
            } catch (IllegalArgumentException e) {
                throw new IOException("Invalid overrides: " + e.getMessage(), e);
            }
        }
        return mapping;
    }

    private static Aggregation parseAggregation(JsonNode node) throws IOException {
        if (node == null || node.isNull()) return Aggregation.LAST_WINS;
        String raw = node.asText("").trim().toLowerCase(Locale.ROOT);
        return switch (raw) {
            case "last_wins", "last-wins", "last" -> Aggregation.LAST_WINS;
            case "merge_all", "merge-all", "merge" -> Aggregation.MERGE_ALL;
            default -> throw new IOException("Unsupported aggregation: " + raw);
        };
    }

    static Class<?> parseType(String raw) throws IOException {
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "string" -> String.class;
            case "int", "integer" -> Integer.class;
            case "long" -> Long.class;
            case "double" -> Double.class;
            case "number" -> Number.class;
            case "boolean", "bool" -> Boolean.class;
            case "list" -> List.class;
            case "namespace" -> Context.class;
            case "secret" -> Secret.class;
            default -> throw new IOException("Unsupported requirement type: " + raw);
        };
    }

    private static JsonNode read(ObjectMapper mapper, InputStream in) throws IOException {
        try {
            return mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed task definition: " + e.getOriginalMessage(), e);
        }
    }

    private static String text(JsonNode node, String field) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) throw new IOException(field + " must be a string");
        return value.asText();
    }

    private static JsonNode req(JsonNode n, String field) throws IOException {
        if (!n.has(field)) throw new IOException("Missing required field: " + field);
        return n.get(field);
    }
}
