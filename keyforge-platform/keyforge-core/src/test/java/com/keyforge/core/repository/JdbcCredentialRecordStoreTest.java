package com.keyforge.core.repository;

import com.keyforge.core.domain.CredentialRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for JdbcCredentialRecordStore against an in-memory H2 database.
 * Each test gets its own database.
 */
class JdbcCredentialRecordStoreTest {

    private JdbcCredentialRecordStore store;

    @BeforeEach
    void setUp() {
        store = JdbcCredentialRecordStore.connect(
                "jdbc:h2:mem:credentials-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private static CredentialRecord record(String userId, String userKey) {
        return CredentialRecord.issue(userId, userKey, "$2a$10$" + userKey, userKey + "refresh");
    }

    @Test
    void insertAndFindRoundTripsAllColumns() {
        CredentialRecord issued = record("jobs_core", "key-1");

        store.insert(issued);

        CredentialRecord found = store.findByUserId("jobs_core").orElseThrow();
        assertThat(found.getUserKey()).isEqualTo("key-1");
        assertThat(found.getHashedSecret()).isEqualTo("$2a$10$key-1");
        assertThat(found.getScope()).isEqualTo(CredentialRecord.WRITE_ROOT);
        assertThat(found.getLastIp()).isEmpty();
        assertThat(found.getRefreshToken()).isEqualTo("key-1refresh");
        assertThat(found.getCreatedAt()).isNotNull();
    }

    @Test
    void insertRejectsSecondRecordForSameUser() {
        store.insert(record("jobs_core", "key-1"));

        assertThatThrownBy(() -> store.insert(record("jobs_core", "key-2")))
                .isInstanceOf(DataIntegrityViolationException.class);
        assertThat(store.count()).isEqualTo(1);
    }

    @Test
    void supersedeReplacesExistingRecord() {
        store.insert(record("jobs_core", "key-1"));

        store.supersede(record("jobs_core", "key-2"));

        assertThat(store.count()).isEqualTo(1);
        assertThat(store.findByUserId("jobs_core").orElseThrow().getUserKey()).isEqualTo("key-2");
    }

    @Test
    void supersedeWorksWithoutPriorRecord() {
        store.supersede(record("view_core", "key-1"));

        assertThat(store.findByUserId("view_core")).isPresent();
    }

    @Test
    void deleteReportsWhetherRecordExisted() {
        store.insert(record("jobs_core", "key-1"));

        assertThat(store.deleteByUserId("jobs_core")).isTrue();
        assertThat(store.deleteByUserId("jobs_core")).isFalse();
        assertThat(store.findByUserId("jobs_core")).isEmpty();
    }

    @Test
    void createsTableInDatabaseAlreadyHoldingOtherTables() {
        String url = "jdbc:h2:mem:shared-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        JdbcTemplate host = new JdbcTemplate(new DriverManagerDataSource(url));
        host.execute("CREATE TABLE other_app_table (id INT PRIMARY KEY)");
        host.execute("CREATE TABLE flyway_schema_history (installed_rank INT PRIMARY KEY, version VARCHAR(50))");
        host.update("INSERT INTO flyway_schema_history VALUES (1, '7')");

        try (JdbcCredentialRecordStore shared = JdbcCredentialRecordStore.connect(url)) {
            shared.supersede(record("jobs_core", "key-1"));

            assertThat(shared.findByUserId("jobs_core")).isPresent();
            assertThat(shared.count()).isEqualTo(1);
        }
        assertThat(host.queryForObject("SELECT version FROM flyway_schema_history", String.class))
                .isEqualTo("7");
    }

    @Test
    void reopeningStoreKeepsRecords() {
        String url = "jdbc:h2:mem:reopen-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        try (JdbcCredentialRecordStore first = JdbcCredentialRecordStore.connect(url)) {
            first.insert(record("jobs_core", "key-1"));
        }

        try (JdbcCredentialRecordStore second = JdbcCredentialRecordStore.connect(url)) {
            assertThat(second.findByUserId("jobs_core")).isPresent();
        }
    }

    @Test
    void connectRejectsBlankUrl() {
        assertThatThrownBy(() -> JdbcCredentialRecordStore.connect(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
