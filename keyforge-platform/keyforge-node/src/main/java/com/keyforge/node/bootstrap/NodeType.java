package com.keyforge.node.bootstrap;

import java.util.Locale;

/**
 * Node roles known to the bootstrap.
 */
public enum NodeType {
    API,
    AUTH,
    CORE,
    VIEW;

    /**
     * Parses a loader type name such as {@code "api"}.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static NodeType of(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Node type cannot be null or blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown node type: " + name, e);
        }
    }

    /**
     * Whether nodes of this type sign or verify tokens with the shared keypair.
     */
    public boolean consumesSigningKeys() {
        return this == API || this == AUTH;
    }

    /**
     * Whether nodes of this type receive root credentials.
     */
    public boolean receivesRootCredentials() {
        return this == CORE;
    }
}
