package com.keyforge.node.bootstrap;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings of the node bootstrap.
 *
 * @param certDirectory directory holding the signing keys and the credential cache
 * @param authDatabaseNodeId ID of the node that supplies the shared database target
 * @param databaseTargetTimeout how long credential issuance waits for the database target;
 *                              zero or negative waits indefinitely
 */
public record BootstrapSettings(
        Path certDirectory,
        String authDatabaseNodeId,
        Duration databaseTargetTimeout
) {

    public static final String DEFAULT_AUTH_DATABASE_NODE_ID = "auth_core";
    public static final Duration DEFAULT_DATABASE_TARGET_TIMEOUT = Duration.ofSeconds(60);

    public BootstrapSettings {
        if (certDirectory == null) {
            throw new IllegalArgumentException("Certificate directory cannot be null");
        }
        if (authDatabaseNodeId == null || authDatabaseNodeId.isBlank()) {
            authDatabaseNodeId = DEFAULT_AUTH_DATABASE_NODE_ID;
        }
        if (databaseTargetTimeout == null) {
            databaseTargetTimeout = DEFAULT_DATABASE_TARGET_TIMEOUT;
        }
    }

    public static BootstrapSettings in(Path certDirectory) {
        return new BootstrapSettings(certDirectory, null, null);
    }

    public boolean waitsIndefinitely() {
        return databaseTargetTimeout.isZero() || databaseTargetTimeout.isNegative();
    }
}
