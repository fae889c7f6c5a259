package ai.kcache.watcher.storage;

import ai.kcache.db.StorageImpl;
import ai.kcache.watcher.configs.ServiceConfig;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

@Singleton
@Requires(property = "kcache.database.url")
@Requires(property = "kcache.database.username")
@Requires(property = "kcache.database.password")
public class KcacheDataSource extends StorageImpl {
    public KcacheDataSource(ServiceConfig config) {
        super(config.getDatabase(), "classpath:db/kcache/migrations");
    }
}
