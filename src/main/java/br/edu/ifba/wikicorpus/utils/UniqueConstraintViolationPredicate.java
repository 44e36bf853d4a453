package br.edu.ifba.wikicorpus.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Recognizes a unique or primary-key constraint violation reported by SQLite.
 *
 * <p>Used by get-or-create logic: an {@code INSERT} that loses the race against
 * another writer fails with one of these errors, and the caller re-reads the
 * winning row instead of propagating the failure.</p>
 *
 * <p>Checks, in order, along the cause chain:</p>
 * <ul>
 *   <li>the extended SQLite result code ({@code SQLITE_CONSTRAINT_UNIQUE},
 *       {@code SQLITE_CONSTRAINT_PRIMARYKEY})</li>
 *   <li>SQLSTATE class 23 with a uniqueness message</li>
 *   <li>the "UNIQUE constraint failed" message SQLite emits when only the
 *       primary result code is available</li>
 * </ul>
 * Other constraint failures (NOT NULL, FOREIGN KEY, CHECK) do not match.
 */
public final class UniqueConstraintViolationPredicate implements Predicate<Throwable> {

    private static final Logger logger = LoggerFactory.getLogger(UniqueConstraintViolationPredicate.class);

    private static final Set<SQLiteErrorCode> UNIQUE_CODES = Set.of(
        SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE,
        SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY);

    private static final Pattern UNIQUE_MESSAGE_PATTERN = Pattern.compile(
        "(?i)(unique\\s+constraint\\s+failed|primary\\s+key\\s+must\\s+be\\s+unique|is\\s+not\\s+unique)");

    private static final String INTEGRITY_SQLSTATE_CLASS = "23";

    @Override
    public boolean test(final Throwable throwable) {
        Throwable current = throwable;
        int guard = 0;
        while (current != null && guard++ < 16) {
            if (current instanceof SQLException sqlException && isUniqueViolation(sqlException)) {
                return true;
            }
            Throwable cause = current.getCause();
            current = cause == current ? null : cause;
        }
        return false;
    }

    private boolean isUniqueViolation(final SQLException e) {
        if (e instanceof SQLiteException sqliteException) {
            SQLiteErrorCode code = sqliteException.getResultCode();
            if (UNIQUE_CODES.contains(code)) {
                logger.debug("Unique violation detected by result code {}: {}", code, e.getMessage());
                return true;
            }
            if (code != SQLiteErrorCode.SQLITE_CONSTRAINT) {
                return false;
            }
        }

        String sqlState = e.getSQLState();
        boolean integrityState = sqlState != null && sqlState.startsWith(INTEGRITY_SQLSTATE_CLASS);
        boolean uniqueMessage = e.getMessage() != null && UNIQUE_MESSAGE_PATTERN.matcher(e.getMessage()).find();

        if (uniqueMessage && (integrityState
                || e instanceof SQLiteException
                || e instanceof SQLIntegrityConstraintViolationException)) {
            logger.debug("Unique violation detected by message: {}", e.getMessage());
            return true;
        }
        return false;
    }
}
