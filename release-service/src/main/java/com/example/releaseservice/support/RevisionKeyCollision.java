package com.example.releaseservice.support;

import java.sql.SQLException;
import java.util.List;
import java.util.Locale;

/**
 * Recognizes a unique-key collision on the revisions table, the only
 * integrity failure a revision insert may be retried on.
 *
 * H2 names the backing index (PUBLIC.UQ_REVISIONS_RELEASE_SEQ_INDEX_x, or
 * PRIMARY_KEY_x ON PUBLIC.REVISIONS(NAME) for the primary key); PostgreSQL
 * names the constraint itself.
 */
public final class RevisionKeyCollision {

    static final String UNIQUE_VIOLATION = "23505";

    private static final List<String> REVISION_KEYS = List.of(
            "UQ_REVISIONS_RELEASE_SEQ",
            "UQ_REVISIONS_RELEASE_NUMBER",
            "PK_REVISIONS",
            "PUBLIC.REVISIONS(NAME");

    private RevisionKeyCollision() {
    }

    public static boolean matches(Throwable ex) {
        for (Throwable current = ex; current != null; current = current.getCause()) {
            if (current instanceof SQLException sqlException
                    && UNIQUE_VIOLATION.equals(sqlException.getSQLState())) {
                String message = String.valueOf(sqlException.getMessage()).toUpperCase(Locale.ROOT);
                return REVISION_KEYS.stream().anyMatch(message::contains);
            }
        }
        return false;
    }
}
