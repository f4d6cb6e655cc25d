package com.keyforge.core.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keyforge.core.domain.CredentialRecord;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * Credential store backed by the shared relational database.
 * The {@code node_users} table is created by the Flyway migrations under
 * {@code classpath:db/migration/credentials} when the store is opened.
 * <p>
 * The shared database usually holds other tables, so migrations are tracked in a separate
 * {@code keyforge_schema_history} table and an existing schema is baselined below the first migration.
 */
public class JdbcCredentialRecordStore implements CredentialRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcCredentialRecordStore.class);

    static final String MIGRATION_LOCATION = "classpath:db/migration/credentials";
    static final String HISTORY_TABLE = "keyforge_schema_history";

    private static final TypeReference<List<String>> IP_LIST = new TypeReference<>() {};

    private static final String INSERT = "INSERT INTO node_users "
            + "(user_id, user_key, user_secret_hash, last_ip, scope, refresh_token, created_at) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final AutoCloseable pool;

    private final RowMapper<CredentialRecord> rowMapper = this::mapRow;

    /**
     * Wraps an existing data source. The caller keeps ownership of the data source.
     */
    public JdbcCredentialRecordStore(DataSource dataSource, ObjectMapper objectMapper) {
        this(dataSource, objectMapper, null);
    }

    private JdbcCredentialRecordStore(DataSource dataSource, ObjectMapper objectMapper, AutoCloseable pool) {
        if (dataSource == null) {
            throw new IllegalArgumentException("DataSource cannot be null");
        }
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.pool = pool;
        migrate(dataSource);
    }

    /**
     * Opens a pooled connection to the database at the given JDBC URL and applies migrations.
     *
     * @param jdbcUrl JDBC URL of the shared database, credentials included
     * @return an open store that owns its connection pool
     */
    public static JdbcCredentialRecordStore connect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or blank");
        }
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setPoolName("keyforge-credentials");
        config.setMaximumPoolSize(2);
        HikariDataSource dataSource = new HikariDataSource(config);
        try {
            return new JdbcCredentialRecordStore(dataSource, new ObjectMapper(), dataSource);
        } catch (RuntimeException e) {
            dataSource.close();
            throw e;
        }
    }

    private static void migrate(DataSource dataSource) {
        Flyway.configure()
                .dataSource(dataSource)
                .locations(MIGRATION_LOCATION)
                .table(HISTORY_TABLE)
                .baselineOnMigrate(true)
                .baselineVersion("0")
                .load()
                .migrate();
    }

    @Override
    public boolean deleteByUserId(String userId) {
        int removed = jdbcTemplate.update("DELETE FROM node_users WHERE user_id = ?", userId);
        if (removed > 0) {
            log.info("Removed stale credential record for {}", userId);
        }
        return removed > 0;
    }

    @Override
    public void insert(CredentialRecord record) {
        jdbcTemplate.update(INSERT,
                record.getUserId(),
                record.getUserKey(),
                record.getHashedSecret(),
                writeIps(record.getLastIp()),
                record.getScope(),
                record.getRefreshToken(),
                Timestamp.from(record.getCreatedAt()));
    }

    @Override
    public Optional<CredentialRecord> findByUserId(String userId) {
        List<CredentialRecord> rows = jdbcTemplate.query(
                "SELECT * FROM node_users WHERE user_id = ?", rowMapper, userId);
        return rows.stream().findFirst();
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM node_users", Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public void close() {
        if (pool == null) {
            return;
        }
        try {
            pool.close();
        } catch (Exception e) {
            throw new IllegalStateException("Failed to close credential store connections", e);
        }
    }

    private CredentialRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        return CredentialRecord.restore(
                rs.getString("user_id"),
                rs.getString("user_key"),
                rs.getString("user_secret_hash"),
                readIps(rs.getString("last_ip")),
                rs.getString("scope"),
                rs.getString("refresh_token"),
                rs.getTimestamp("created_at").toInstant());
    }

    private String writeIps(List<String> ips) {
        try {
            return objectMapper.writeValueAsString(ips);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize address list", e);
        }
    }

    private List<String> readIps(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, IP_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed address list in credential record", e);
        }
    }
}
