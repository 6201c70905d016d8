package com.slate.kernel.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Immutable, ordered key/value set of form compiler parameters.
 *
 * <p>
 * The kernel builder treats the content as opaque and forwards it unchanged
 * to the {@link TerminalFormCompiler}. Typed getters are provided for the
 * collaborators that do interpret it.
 */
public final class CompilerParameters {
    private static final Logger log = LogManager.getLogger(CompilerParameters.class);

    /** Classpath resource holding the default parameter set. */
    public static final String DEFAULTS_RESOURCE = "/slate-compiler-defaults.json";

    private static final CompilerParameters EMPTY = new CompilerParameters(Collections.emptyMap());

    private final Map<String, Object> values;

    private CompilerParameters(Map<String, Object> values) {
        this.values = values;
    }

    public static CompilerParameters empty() {
        return EMPTY;
    }

    public static CompilerParameters of(Map<String, ?> values) {
        if (values == null || values.isEmpty())
            return EMPTY;
        return new CompilerParameters(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /**
     * Loads the default parameter set from {@value #DEFAULTS_RESOURCE}.
     *
     * @throws IllegalStateException if the resource is missing or malformed.
     */
    public static CompilerParameters defaults() {
        try (InputStream in = CompilerParameters.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null)
                throw new IllegalStateException("Missing classpath resource " + DEFAULTS_RESOURCE);
            Map<String, Object> map = new ObjectMapper().readValue(in, new TypeReference<LinkedHashMap<String, Object>>() {
            });
            log.debug("Loaded {} default form compiler parameters", map.size());
            return of(map);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + DEFAULTS_RESOURCE, e);
        }
    }

    /**
     * Returns a new parameter set holding this set's entries overridden by
     * {@code overrides}. Key order: this set first, new keys appended.
     */
    public CompilerParameters merge(CompilerParameters overrides) {
        if (overrides == null || overrides.isEmpty())
            return this;
        if (isEmpty())
            return overrides;
        Map<String, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(overrides.values);
        return new CompilerParameters(Collections.unmodifiableMap(merged));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public String getString(String key, String defaultValue) {
        Object v = values.get(key);
        return v == null ? defaultValue : v.toString();
    }

    public int getInt(String key, int defaultValue) {
        Object v = values.get(key);
        if (v instanceof Number n)
            return n.intValue();
        if (v instanceof String s)
            return Integer.parseInt(s.trim());
        return defaultValue;
    }

    public double getDouble(String key, double defaultValue) {
        Object v = values.get(key);
        if (v instanceof Number n)
            return n.doubleValue();
        if (v instanceof String s)
            return Double.parseDouble(s.trim());
        return defaultValue;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object v = values.get(key);
        if (v instanceof Boolean b)
            return b;
        if (v instanceof String s)
            return Boolean.parseBoolean(s.trim());
        return defaultValue;
    }

    /** Unmodifiable view of all entries in insertion order. */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CompilerParameters other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "CompilerParameters" + values;
    }
}
