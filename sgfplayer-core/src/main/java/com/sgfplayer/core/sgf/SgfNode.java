package com.sgfplayer.core.sgf;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A single SGF node: an ordered mapping from upper-case property identifiers to their raw values.
 */
public final class SgfNode {

    private final Map<String, List<String>> properties;

    public SgfNode(Map<String, List<String>> properties) {
        Objects.requireNonNull(properties, "properties");
        Map<String, List<String>> copy = new LinkedHashMap<>();
        properties.forEach((key, values) -> copy.put(key, List.copyOf(values)));
        this.properties = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the property identifiers in the order they first appeared in the node.
     */
    public Set<String> keys() {
        return properties.keySet();
    }

    public boolean has(String key) {
        return properties.containsKey(key);
    }

    /**
     * Returns all values of a property, or an empty list if the node does not carry it.
     */
    public List<String> values(String key) {
        return properties.getOrDefault(key, List.of());
    }

    /**
     * Returns the first value of a property, or {@code null} if the node does not carry it.
     */
    public String first(String key) {
        List<String> values = properties.get(key);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    public Map<String, List<String>> properties() {
        return properties;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof SgfNode that && properties.equals(that.properties);
    }

    @Override
    public int hashCode() {
        return properties.hashCode();
    }

    @Override
    public String toString() {
        return "SgfNode" + properties;
    }
}
