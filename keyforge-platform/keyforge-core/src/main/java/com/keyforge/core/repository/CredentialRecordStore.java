package com.keyforge.core.repository;

import com.keyforge.core.domain.CredentialRecord;

import java.util.Optional;

/**
 * Shared store of node credential records, keyed by user ID.
 * Holds at most one record per user ID.
 */
public interface CredentialRecordStore extends AutoCloseable {

    /**
     * Replaces whatever record exists for the record's user ID with the given one.
     * <p>
     * This is a delete followed by an insert and is not transactional: a crash between the two
     * steps leaves no record for the user ID until the node is bootstrapped again.
     *
     * @param record the newly issued record
     */
    default void supersede(CredentialRecord record) {
        deleteByUserId(record.getUserId());
        insert(record);
    }

    /**
     * Deletes the record for a user ID.
     *
     * @return true if a record was removed
     */
    boolean deleteByUserId(String userId);

    /**
     * Inserts a new record. Fails if a record for the same user ID already exists.
     */
    void insert(CredentialRecord record);

    Optional<CredentialRecord> findByUserId(String userId);

    long count();

    /**
     * Releases the connections held by this store.
     */
    @Override
    void close();
}
