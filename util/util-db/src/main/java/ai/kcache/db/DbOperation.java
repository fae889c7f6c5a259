package ai.kcache.db;

import java.sql.Connection;
import java.sql.SQLException;

public interface DbOperation {
    static void execute(Storage storage, DbRunnable op) throws SQLException {
        execute(storage, con -> {
            op.execute(con);
            return null;
        });
    }

    static <T> T execute(Storage storage, DbSupplier<T> op) throws SQLException {
        try (var con = storage.connect()) {
            return op.execute(con);
        }
    }

    interface DbRunnable {
        void execute(Connection connection) throws SQLException;
    }

    interface DbSupplier<T> {
        T execute(Connection connection) throws SQLException;
    }

}
