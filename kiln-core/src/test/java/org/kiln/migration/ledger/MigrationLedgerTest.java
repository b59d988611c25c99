package org.kiln.migration.ledger;

import org.kiln.migration.MigrationRecord;
import org.kiln.migration.dialect.h2.H2Dialect;
import org.kiln.store.JdbcStore;
import org.kiln.testing.H2Stores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MigrationLedgerTest {

    private final MigrationLedger ledger = new MigrationLedger();
    private final H2Dialect dialect = new H2Dialect();
    private JdbcStore store;

    @BeforeEach
    void setUp() {
        store = H2Stores.newStore();
    }

    private static MigrationRecord record(String name, int sequence) {
        return new MigrationRecord(name, sequence, "c" + sequence, LocalDateTime.of(2024, 3, sequence, 10, 0, 0, 123_456_000), 1);
    }

    @Test
    @DisplayName("기록 테이블이 없으면 빈 목록")
    void missingTableReadsEmpty() throws SQLException {
        assertFalse(store.withSession(ledger::exists));
        assertTrue(store.withSession(s -> ledger.read(s, dialect)).isEmpty());
    }

    @Test
    @DisplayName("ensureTable은 여러 번 호출해도 안전하다")
    void ensureTableIsIdempotent() throws SQLException {
        store.withSession(s -> {
            ledger.ensureTable(s, dialect);
            ledger.ensureTable(s, dialect);
            return null;
        });

        assertTrue(store.withSession(ledger::exists));
    }

    @Test
    @DisplayName("추가한 순서와 무관하게 sequence 순으로 읽는다")
    void readsInSequenceOrder() throws SQLException {
        store.withSession(s -> {
            ledger.ensureTable(s, dialect);
            ledger.append(s, dialect, record("b", 2));
            ledger.append(s, dialect, record("a", 1));
            return null;
        });

        assertEquals(List.of(record("a", 1), record("b", 2)), store.withSession(s -> ledger.read(s, dialect)));
    }

    @Test
    @DisplayName("같은 이름을 두 번 기록할 수 없다")
    void nameIsUnique() throws SQLException {
        store.withSession(s -> {
            ledger.ensureTable(s, dialect);
            ledger.append(s, dialect, record("a", 1));
            return null;
        });

        assertThrows(SQLException.class, () -> store.withSession(s -> {
            ledger.append(s, dialect, record("a", 2));
            return null;
        }));
    }
}
