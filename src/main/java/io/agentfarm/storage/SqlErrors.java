package io.agentfarm.storage;

import java.sql.SQLException;
import java.util.Locale;

final class SqlErrors {
    static final int SQLITE_BUSY = 5;
    static final int SQLITE_LOCKED = 6;
    static final int SQLITE_CONSTRAINT = 19;

    private SqlErrors() {
    }

    static boolean isBusy(Throwable error) {
        int code = primaryCode(error);
        return code == SQLITE_BUSY || code == SQLITE_LOCKED;
    }

    static boolean isConstraint(Throwable error) {
        return primaryCode(error) == SQLITE_CONSTRAINT;
    }

    /**
     * True when the failure is a UNIQUE or PRIMARY KEY violation on {@code table.column}.
     */
    static boolean isUniqueViolation(Throwable error, String table, String column) {
        if (!isConstraint(error)) {
            return false;
        }
        String message = message(error).toLowerCase(Locale.ROOT);
        return (message.contains("unique") || message.contains("primary key"))
                && message.contains((table + "." + column).toLowerCase(Locale.ROOT));
    }

    static String message(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SQLException && t.getMessage() != null) {
                return t.getMessage();
            }
        }
        return error == null || error.getMessage() == null ? "" : error.getMessage();
    }

    private static int primaryCode(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql && sql.getErrorCode() != 0) {
                return sql.getErrorCode() & 0xff;
            }
        }
        return 0;
    }
}
