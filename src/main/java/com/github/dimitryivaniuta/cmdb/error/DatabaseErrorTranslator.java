package com.github.dimitryivaniuta.cmdb.error;

import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;

import java.sql.SQLException;

/**
 * Maps PostgreSQL SQLSTATE codes carried by a Spring {@link DataAccessException} onto the
 * error taxonomy used in API responses.
 */
public final class DatabaseErrorTranslator {

    private static final String UNIQUE_VIOLATION = "23505";
    private static final String FOREIGN_KEY_VIOLATION = "23503";
    private static final String NOT_NULL_VIOLATION = "23502";

    private DatabaseErrorTranslator() {}

    public static DatabaseOperationException translate(DataAccessException ex) {
        String sqlState = sqlState(ex);
        if (UNIQUE_VIOLATION.equals(sqlState)) {
            return new DatabaseOperationException(HttpStatus.CONFLICT,
                    DatabaseOperationException.DUPLICATE_RECORD, "Record already exists", ex);
        }
        if (FOREIGN_KEY_VIOLATION.equals(sqlState)) {
            return new DatabaseOperationException(HttpStatus.BAD_REQUEST,
                    DatabaseOperationException.FOREIGN_KEY_VIOLATION, "Referenced record does not exist", ex);
        }
        if (NOT_NULL_VIOLATION.equals(sqlState)) {
            return new DatabaseOperationException(HttpStatus.BAD_REQUEST,
                    DatabaseOperationException.REQUIRED_FIELD_MISSING, "Required field is missing", ex);
        }
        return new DatabaseOperationException(HttpStatus.INTERNAL_SERVER_ERROR,
                DatabaseOperationException.DATABASE_ERROR, "Database operation failed", ex);
    }

    public static String sqlState(Throwable ex) {
        Throwable t = ex;
        while (t != null) {
            if (t instanceof SQLException sql && sql.getSQLState() != null) {
                return sql.getSQLState();
            }
            t = t.getCause();
        }
        return null;
    }
}
