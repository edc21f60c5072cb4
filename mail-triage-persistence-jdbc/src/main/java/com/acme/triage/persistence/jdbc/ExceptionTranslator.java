package com.acme.triage.persistence.jdbc;

import com.acme.triage.core.PermanentException;
import com.acme.triage.core.TransientException;
import org.slf4j.Logger;

import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.util.Locale;
import java.util.Set;

/**
 * Translates {@link SQLException} into the workflow's error taxonomy.
 * Connectivity, lock and rollback failures become {@link TransientException};
 * schema, syntax and constraint failures become {@link PermanentException}.
 * Anything unrecognised is treated as transient.
 */
public final class ExceptionTranslator {

    /** SQLState shared by H2 and PostgreSQL for a unique/primary key violation. */
    public static final String UNIQUE_VIOLATION = "23505";

    // 08 connection, 40 transaction rollback (deadlock, serialization), 53 insufficient resources
    private static final Set<String> TRANSIENT_STATE_CLASSES = Set.of("08", "40", "53", "57");

    // 22 data, 23 integrity, 42 syntax/access, 3D catalog, 3F schema
    private static final Set<String> PERMANENT_STATE_CLASSES = Set.of("22", "23", "42", "3D", "3F");

    // H2 vendor codes: 50200 lock timeout, 90108 out of memory, 90098 database closed
    private static final Set<Integer> H2_TRANSIENT_CODES = Set.of(50200, 90108, 90098);

    // H2 vendor codes: 42102/42104 table not found, 42122 column not found, 90007 closed statement
    private static final Set<Integer> H2_PERMANENT_CODES = Set.of(42102, 42104, 42122, 90007);

    private ExceptionTranslator() {
    }

    /**
     * Logs the failure and returns the domain exception to throw.
     *
     * @param e         the driver exception
     * @param operation what was being attempted, for the log and message
     * @param logger    caller's logger
     */
    public static RuntimeException translateException(SQLException e, String operation, Logger logger) {
        logger.error("Database operation failed: {}", operation, e);

        String detail = String.format("%s failed: %s", operation, e.getMessage());
        if (isTransient(e)) {
            return new TransientException("Transient database error: " + detail, e);
        }
        if (isPermanent(e)) {
            return new PermanentException("Permanent database error: " + detail, e);
        }
        return new TransientException("Database error: " + detail, e);
    }

    /**
     * True when the statement lost an insert race on a unique or primary key.
     * Callers implementing insert-if-absent treat this as "already present".
     */
    public static boolean isUniqueViolation(SQLException e) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            if (UNIQUE_VIOLATION.equals(cur.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    static boolean isTransient(SQLException e) {
        if (e instanceof SQLTransientException) {
            return true;
        }
        if (H2_TRANSIENT_CODES.contains(e.getErrorCode())) {
            return true;
        }
        String stateClass = stateClass(e);
        if (stateClass != null && TRANSIENT_STATE_CLASSES.contains(stateClass)) {
            return true;
        }
        String message = lower(e.getMessage());
        return message.contains("timeout")
                || message.contains("connection refused")
                || message.contains("deadlock")
                || message.contains("too many connections")
                || message.contains("pool exhausted");
    }

    static boolean isPermanent(SQLException e) {
        if (H2_PERMANENT_CODES.contains(e.getErrorCode())) {
            return true;
        }
        String stateClass = stateClass(e);
        if (stateClass != null && PERMANENT_STATE_CLASSES.contains(stateClass)) {
            return true;
        }
        String message = lower(e.getMessage());
        return message.contains("syntax error")
                || message.contains("not found")
                || message.contains("does not exist")
                || message.contains("constraint")
                || message.contains("type mismatch");
    }

    private static String stateClass(SQLException e) {
        String state = e.getSQLState();
        return state != null && state.length() >= 2 ? state.substring(0, 2).toUpperCase(Locale.ROOT) : null;
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
