package ai.kcache.db;

import com.google.common.annotations.VisibleForTesting;
import com.mchange.v2.c3p0.ComboPooledDataSource;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.flywaydb.core.Flyway;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Pooled connection source with Flyway migrations applied on construction.
 * The owner is responsible for closing it, the pool is never shared through static state.
 */
public abstract class StorageImpl implements Storage {
    private static final Logger LOG = LogManager.getLogger(StorageImpl.class);

    private static final String VALIDATION_QUERY_SQL = "select 1";

    private final ComboPooledDataSource dataSource;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Consumer<Storage> onClose = null;

    protected StorageImpl(DatabaseConfiguration dbConfig, String migrationsPath) {
        this(dbConfig, migrationsPath, "flyway_schema_history");
    }

    protected StorageImpl(DatabaseConfiguration dbConfig, String migrationsPath, String historyTable) {
        var schema = dbConfig.getSchema();

        dataSource = new ComboPooledDataSource();
        dataSource.setJdbcUrl(dbConfig.getUrl() + "?currentSchema=" + schema);
        dataSource.setUser(dbConfig.getUsername());
        dataSource.setPassword(dbConfig.getPassword());

        dataSource.setMinPoolSize(dbConfig.getMinPoolSize());
        dataSource.setMaxPoolSize(dbConfig.getMaxPoolSize());

        dataSource.setTestConnectionOnCheckout(true);
        dataSource.setPreferredTestQuery(VALIDATION_QUERY_SQL);

        LOG.info("Applying migrations from {} to schema {}", migrationsPath, schema);
        var flyway = Flyway.configure()
            .defaultSchema(schema)
            .table(historyTable)
            .dataSource(dbConfig.getUrl(), dbConfig.getUsername(), dbConfig.getPassword())
            .locations(migrationsPath)
            .load();
        flyway.migrate();
    }

    @Override
    public final Connection connect() throws SQLException {
        var conn = dataSource.getConnection();
        conn.setAutoCommit(true);
        conn.setTransactionIsolation(isolationLevel());
        return conn;
    }

    @PreDestroy
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        var fn = onClose;
        if (fn != null) {
            fn.accept(this);
        }
        dataSource.close();
        LOG.info("Connection pool closed");
    }

    @VisibleForTesting
    public void setOnClose(Consumer<Storage> onClose) {
        this.onClose = onClose;
    }

    protected int isolationLevel() {
        return Connection.TRANSACTION_READ_COMMITTED;
    }
}
