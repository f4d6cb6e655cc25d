package com.keyforge.node.bootstrap;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Configuration of a single node: operator-provided overrides plus the node's own local values.
 * The bootstrap writes key material and credentials into the local values only.
 * <p>
 * The shared credential database is read from {@value #DATABASE_URL}, a JDBC URL; loaders that used to
 * pass {@code mongoUrl} must supply it under this key instead. Entries with null values are dropped.
 */
public class NodeConfig {

    public static final String CERT_PUBLIC = "certPublic";
    public static final String CERT_PRIVATE = "certPrivate";
    public static final String USER_KEY = "userKey";
    public static final String USER_SECRET = "userSecret";
    public static final String DATABASE_URL = "databaseUrl";

    private final Map<String, Object> local;
    private final Map<String, Object> provided;

    public NodeConfig(Map<String, ?> local, Map<String, ?> provided) {
        this.local = new ConcurrentHashMap<>(withoutNulls(local));
        this.provided = Map.copyOf(withoutNulls(provided));
    }

    public static NodeConfig empty() {
        return new NodeConfig(Map.of(), Map.of());
    }

    public static NodeConfig provided(Map<String, ?> provided) {
        return new NodeConfig(Map.of(), provided);
    }

    /**
     * Mutable local values.
     */
    public Map<String, Object> local() {
        return local;
    }

    /**
     * Read-only operator overrides.
     */
    public Map<String, Object> provided() {
        return provided;
    }

    public Optional<String> providedString(String key) {
        return text(provided.get(key));
    }

    public Optional<String> localString(String key) {
        return text(local.get(key));
    }

    /**
     * Provided override if present, otherwise the local value.
     */
    public Optional<String> effectiveString(String key) {
        return providedString(key).or(() -> localString(key));
    }

    public void putLocal(String key, Object value) {
        if (key == null || value == null) {
            throw new IllegalArgumentException("Key and value cannot be null");
        }
        local.put(key, value);
    }

    private static Map<String, Object> withoutNulls(Map<String, ?> values) {
        Map<String, Object> copy = new HashMap<>();
        if (values != null) {
            values.forEach((key, value) -> {
                if (key != null && value != null) {
                    copy.put(key, value);
                }
            });
        }
        return copy;
    }

    private static Optional<String> text(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        String s = value.toString();
        return s.isBlank() ? Optional.empty() : Optional.of(s);
    }
}
