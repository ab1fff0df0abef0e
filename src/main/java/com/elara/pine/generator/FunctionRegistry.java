package com.elara.pine.generator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup from source call names ({@code ta.sma}) to {@link FunctionMapping}s.
 * Built once and shared read-only by every transpile.
 *
 * JSON form, as in the bundled {@code default-mappings.json}:
 * <pre>
 * { "ta.sma": { "target": "Std.sma", "needsSeries": true, "context": "append", "arity": 2 } }
 * </pre>
 */
public final class FunctionRegistry {
    static final String DEFAULT_RESOURCE = "/com/elara/pine/generator/default-mappings.json";

    private static volatile FunctionRegistry defaults;

    private final Map<String, FunctionMapping> mappings;

    private FunctionRegistry(Map<String, FunctionMapping> mappings) {
        this.mappings = Collections.unmodifiableMap(new LinkedHashMap<>(mappings));
    }

    public static FunctionRegistry empty() {
        return new FunctionRegistry(Collections.<String, FunctionMapping>emptyMap());
    }

    public static FunctionRegistry of(Map<String, FunctionMapping> mappings) {
        return new FunctionRegistry(mappings);
    }

    /** The bundled registry (loaded once from the classpath). */
    public static FunctionRegistry defaults() {
        FunctionRegistry r = defaults;
        if (r == null) {
            synchronized (FunctionRegistry.class) {
                r = defaults;
                if (r == null) {
                    try (InputStream in = FunctionRegistry.class.getResourceAsStream(DEFAULT_RESOURCE)) {
                        if (in == null) throw new IllegalStateException("Missing resource " + DEFAULT_RESOURCE);
                        r = fromJson(new ObjectMapper(), in);
                    } catch (IOException e) {
                        throw new UncheckedIOException("Cannot read " + DEFAULT_RESOURCE, e);
                    }
                    defaults = r;
                }
            }
        }
        return r;
    }

    public static FunctionRegistry fromJson(ObjectMapper om, InputStream in) throws IOException {
        JsonNode root = om.readTree(in);
        if (root == null || !root.isObject()) {
            throw new IOException("Function mappings must be a JSON object keyed by source name.");
        }
        Map<String, FunctionMapping> map = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            JsonNode n = e.getValue();
            String target = n.path("target").asText(null);
            if (target == null || target.isEmpty()) throw new IOException("Mapping '" + e.getKey() + "' has no target.");
            String contextName = n.path("context").asText("none");
            FunctionMapping.ContextArg context;
            try {
                context = FunctionMapping.ContextArg.valueOf(contextName.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IOException("Mapping '" + e.getKey() + "' has unknown context '" + contextName
                        + "'; expected none, prepend or append.", ex);
            }
            map.put(e.getKey(), new FunctionMapping(
                    target,
                    n.path("needsSeries").asBoolean(false),
                    context,
                    n.path("arity").asInt(FunctionMapping.ANY_ARITY),
                    n.path("description").asText("")));
        }
        return new FunctionRegistry(map);
    }

    public Optional<FunctionMapping> lookup(String name) {
        return (name == null) ? Optional.empty() : Optional.ofNullable(mappings.get(name));
    }

    public int size() {
        return mappings.size();
    }
}
