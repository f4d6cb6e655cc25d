package com.keyforge.node.bootstrap;

/**
 * No node supplied the shared database target that credential issuance waits for.
 */
public class MissingDatabaseTargetException extends BootstrapException {

    public MissingDatabaseTargetException(String message) {
        super(message);
    }
}
