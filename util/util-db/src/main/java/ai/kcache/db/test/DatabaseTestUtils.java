package ai.kcache.db.test;

import ai.kcache.db.DatabaseConfiguration;
import ai.kcache.db.Storage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.HashMap;

public enum DatabaseTestUtils {
    ;

    private static final Logger LOG = LogManager.getLogger(DatabaseTestUtils.class);

    @SuppressWarnings("checkstyle:Indentation")
    public static HashMap<String, Object> preparePostgresConfig(String app, Object ci) {
        /* io.zonky.test.db.postgres.embedded.ConnectionInfo ci */
        try {
            var port = getFieldValue(ci, "port", Integer.class);
            var dbName = getFieldValue(ci, "dbName", String.class);

            return new HashMap<>() {{
                put(app + ".database.url", "jdbc:postgresql://localhost:%d/%s".formatted(port, dbName));
                put(app + ".database.username", "postgres");
                put(app + ".database.password", "");
            }};
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    public static DatabaseConfiguration preparePostgresConfig(Object ci) {
        /* io.zonky.test.db.postgres.embedded.ConnectionInfo ci */
        try {
            var port = getFieldValue(ci, "port", Integer.class);
            var dbName = getFieldValue(ci, "dbName", String.class);

            var result = new DatabaseConfiguration();
            result.setUrl("jdbc:postgresql://localhost:%d/%s".formatted(port, dbName));
            result.setUsername("postgres");
            result.setPassword("");
            result.setMinPoolSize(1);
            result.setMaxPoolSize(10);
            return result;
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    public static void cleanup(Storage storage) {
        try (var conn = storage.connect()) {
            conn.prepareStatement("DROP SCHEMA public CASCADE").execute();
            conn.prepareStatement("CREATE SCHEMA public").execute();
            conn.prepareStatement("GRANT ALL ON SCHEMA public TO postgres").execute();
            conn.prepareStatement("GRANT ALL ON SCHEMA public TO public").execute();
        } catch (SQLException e) {
            LOG.error("Cannot cleanup database: {}", e.getMessage(), e);
        }
    }

    private static <T> T getFieldValue(Object obj, String fieldName, Class<T> type) throws Exception {
        var field = obj.getClass().getDeclaredField(fieldName);
        field.setAccessible(true);
        return type.cast(field.get(obj));
    }
}
