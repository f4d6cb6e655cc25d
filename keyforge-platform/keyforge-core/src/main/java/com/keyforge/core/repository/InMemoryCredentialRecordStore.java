package com.keyforge.core.repository;

import com.keyforge.core.domain.CredentialRecord;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of CredentialRecordStore for testing and development.
 * Production deployments use {@link JdbcCredentialRecordStore}.
 */
public class InMemoryCredentialRecordStore implements CredentialRecordStore {

    private final Map<String, CredentialRecord> records = new ConcurrentHashMap<>();
    private final AtomicInteger deletes = new AtomicInteger();
    private final AtomicInteger inserts = new AtomicInteger();
    private volatile boolean closed;

    @Override
    public boolean deleteByUserId(String userId) {
        deletes.incrementAndGet();
        return records.remove(userId) != null;
    }

    @Override
    public void insert(CredentialRecord record) {
        if (records.putIfAbsent(record.getUserId(), record) != null) {
            throw new IllegalStateException("Record already exists for " + record.getUserId());
        }
        inserts.incrementAndGet();
    }

    @Override
    public Optional<CredentialRecord> findByUserId(String userId) {
        return Optional.ofNullable(records.get(userId));
    }

    @Override
    public long count() {
        return records.size();
    }

    @Override
    public void close() {
        closed = true;
    }

    /**
     * Gets the number of delete calls (for testing).
     */
    public int getDeleteCount() {
        return deletes.get();
    }

    /**
     * Gets the number of successful inserts (for testing).
     */
    public int getInsertCount() {
        return inserts.get();
    }

    public boolean isClosed() {
        return closed;
    }
}
