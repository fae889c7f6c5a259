package ai.kcache.k8s.cache;

import ai.kcache.db.DatabaseConfiguration;
import ai.kcache.db.StorageImpl;

public class CacheTestStorage extends StorageImpl {
    public CacheTestStorage(DatabaseConfiguration config) {
        super(config, "classpath:db/kcache/migrations");
    }
}
