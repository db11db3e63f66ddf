package com.example.podcast_backend.util;

import org.hibernate.exception.JDBCConnectionException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.List;
import java.util.Locale;

/**
 * Classifies database errors that are worth another attempt on a fresh connection.
 */
public final class TransientDataErrors {
    private static final int MAX_CAUSE_DEPTH = 12;

    // driver messages seen when the connection dropped under us
    private static final List<String> CONNECTION_TOKENS = List.of(
            "connection refused",
            "connection timed out",
            "could not connect",
            "timeout expired",
            "server closed the connection",
            "server is closed",
            "connection reset",
            "terminating connection",
            "connection has been closed",
            "an i/o error occurred"
    );

    private TransientDataErrors() {
    }

    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_DEPTH) {
            if (current instanceof TransientDataAccessException
                    || current instanceof DataAccessResourceFailureException
                    || current instanceof CannotCreateTransactionException
                    || current instanceof JDBCConnectionException
                    || current instanceof SQLTransientException
                    || current instanceof SQLRecoverableException
                    || current instanceof SQLNonTransientConnectionException) {
                return true;
            }
            // SQLSTATE class 08 = connection exception
            if (current instanceof SQLException sql && sql.getSQLState() != null && sql.getSQLState().startsWith("08")) {
                return true;
            }
            if (mentionsConnectionLoss(current.getMessage())) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean mentionsConnectionLoss(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String token : CONNECTION_TOKENS) {
            if (lower.contains(token)) {
                return true;
            }
        }
        return false;
    }
}
