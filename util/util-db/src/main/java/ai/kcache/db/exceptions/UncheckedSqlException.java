package ai.kcache.db.exceptions;

import java.sql.SQLException;

/**
 * Carries a {@link SQLException} out of code that cannot declare it, e.g. a lazily consumed stream.
 */
public class UncheckedSqlException extends RuntimeException {

    public UncheckedSqlException(SQLException cause) {
        super(cause.getMessage(), cause);
    }

    @Override
    public synchronized SQLException getCause() {
        return (SQLException) super.getCause();
    }
}
