package ai.kcache.db;

import java.sql.Connection;
import java.sql.SQLException;

public interface Storage extends AutoCloseable {

    Connection connect() throws SQLException;

    @Override
    void close();
}
