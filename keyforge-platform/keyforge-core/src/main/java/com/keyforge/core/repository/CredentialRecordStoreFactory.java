package com.keyforge.core.repository;

/**
 * Opens the shared credential store behind a database target.
 */
@FunctionalInterface
public interface CredentialRecordStoreFactory {

    /**
     * @param target connection target, e.g. a JDBC URL
     * @return an open store; the caller owns it and must close it
     */
    CredentialRecordStore open(String target);
}
