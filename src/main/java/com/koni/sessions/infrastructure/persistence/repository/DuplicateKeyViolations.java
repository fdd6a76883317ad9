package com.koni.sessions.infrastructure.persistence.repository;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;

import java.sql.SQLException;

/**
 * Tells primary key collisions apart from the other integrity violations a write can hit.
 *
 * Only a collision means a concurrent writer got there first. Length, NOT NULL and check
 * violations are data errors and must not be reported as conflicts.
 */
final class DuplicateKeyViolations {

    /**
     * SQLState for unique and primary key violations, shared by PostgreSQL and H2.
     */
    static final String UNIQUE_VIOLATION = "23505";

    private DuplicateKeyViolations() {
    }

    static boolean isDuplicateKey(DataIntegrityViolationException exception) {
        if (exception instanceof DuplicateKeyException) {
            return true;
        }
        for (Throwable cause = exception.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException
                    && UNIQUE_VIOLATION.equals(((SQLException) cause).getSQLState())) {
                return true;
            }
        }
        return false;
    }
}
