package org.kiln.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SqlErrorTranslatorTest {

    @Test
    @DisplayName("SQLState 23xxx는 제약 위반")
    void constraintViolation() {
        assertEquals(SqlErrorTranslator.Category.CONSTRAINT_VIOLATION,
                SqlErrorTranslator.classify(new SQLException("dup", "23505")));
        assertEquals(SqlErrorTranslator.Category.CONSTRAINT_VIOLATION,
                SqlErrorTranslator.classify(new SQLIntegrityConstraintViolationException("Duplicate entry")));
    }

    @Test
    @DisplayName("SQLState 08xxx와 연결 예외는 연결 끊김")
    void connectionLost() {
        assertEquals(SqlErrorTranslator.Category.CONNECTION_LOST,
                SqlErrorTranslator.classify(new SQLException("link failure", "08S01")));
        assertEquals(SqlErrorTranslator.Category.CONNECTION_LOST,
                SqlErrorTranslator.classify(new SQLNonTransientConnectionException("closed")));
    }

    @Test
    @DisplayName("취소 상태와 그 밖의 오류")
    void cancelledAndOther() {
        assertEquals(SqlErrorTranslator.Category.CANCELLED,
                SqlErrorTranslator.classify(new SQLException("cancelled", StoreSession.CANCELLED_STATE)));
        assertEquals(SqlErrorTranslator.Category.OTHER,
                SqlErrorTranslator.classify(new SQLException("syntax", "42000")));
        assertEquals(SqlErrorTranslator.Category.OTHER, SqlErrorTranslator.classify(new SQLException("no state")));
    }

    @Test
    @DisplayName("연결된 다음 예외까지 살펴본다")
    void followsNextException() {
        SQLException batch = new SQLException("batch failed", "HY000");
        batch.setNextException(new SQLException("dup", "23000"));

        assertEquals(SqlErrorTranslator.Category.CONSTRAINT_VIOLATION, SqlErrorTranslator.classify(batch));
    }

    @Test
    @DisplayName("메시지에 포함된 제약 이름 중 가장 긴 것을 고른다")
    void longestConstraintNameWins() {
        SQLException e = new SQLException("Unique index or primary key violation: \"PUBLIC.UQ_USERS__EMAIL_TENANT_INDEX_4\"", "23505");

        assertEquals(Optional.of("uq_users__email_tenant"),
                SqlErrorTranslator.findConstraintName(e, List.of("uq_users__email", "uq_users__email_tenant", "fk_x")));
        assertEquals(Optional.empty(), SqlErrorTranslator.findConstraintName(e, List.of("fk_posts__author_id__users")));
    }
}
