package ai.kcache.k8s.cache;

import ai.kcache.db.DbOperation;
import ai.kcache.db.Storage;
import ai.kcache.db.exceptions.UncheckedSqlException;
import ai.kcache.k8s.exceptions.ProgrammingException;
import ai.kcache.k8s.exceptions.ValidationException;
import ai.kcache.k8s.model.Gvk;
import ai.kcache.k8s.model.K8sObject;
import ai.kcache.k8s.model.K8sObjectFilter;
import ai.kcache.k8s.model.K8sObjectMeta;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

public class K8sDbCache implements K8sObjectCache {
    private static final Logger LOG = LogManager.getLogger(K8sDbCache.class);

    public static final int DEFAULT_FETCH_SIZE = 100;

    private static final String FIELDS = "name, namespace, manifest, \"group\", version, kind, cluster, user_id";

    private static final String SELECT_QUERY = "SELECT %s FROM k8s_objects".formatted(FIELDS);

    private static final String UPSERT_QUERY = """
        INSERT INTO k8s_objects (name, namespace, manifest, "group", version, kind, cluster, user_id)
        VALUES (?, ?, cast(? as jsonb), ?, ?, ?, ?, ?)
        ON CONFLICT ((lower(coalesce("group", ''))), (lower(version)), (lower(kind)), cluster, namespace, name)
        DO UPDATE SET manifest = excluded.manifest, user_id = excluded.user_id, deleted = FALSE, updated_at = now()
        """;

    private static final String DELETE_QUERY = "DELETE FROM k8s_objects";

    private static final String MARK_DELETED_QUERY = "UPDATE k8s_objects SET deleted = TRUE, updated_at = now()";

    private static final String PURGE_DELETED_QUERY = """
        DELETE FROM k8s_objects
        WHERE deleted = TRUE AND updated_at < now() - cast(? as interval)
        """;

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REFERENCE = new TypeReference<>() { };

    private final Storage storage;
    private final ObjectMapper objectMapper;
    private final boolean requireUserId;
    private final int fetchSize;

    public K8sDbCache(Storage storage, ObjectMapper objectMapper, boolean requireUserId, int fetchSize) {
        this.storage = storage;
        this.objectMapper = objectMapper;
        this.requireUserId = requireUserId;
        this.fetchSize = fetchSize;
    }

    public K8sDbCache(Storage storage, ObjectMapper objectMapper, boolean requireUserId) {
        this(storage, objectMapper, requireUserId, DEFAULT_FETCH_SIZE);
    }

    @Override
    public boolean requiresUserId() {
        return requireUserId;
    }

    @Override
    public void upsert(K8sObject obj) throws SQLException {
        if (requireUserId && obj.userId() == null) {
            throw new ValidationException("user id is required to cache object " + obj.meta());
        }
        var manifest = toJson(obj.manifest());
        DbOperation.execute(storage, c -> {
            try (PreparedStatement ps = c.prepareStatement(UPSERT_QUERY)) {
                var i = 0;
                ps.setString(++i, obj.name());
                ps.setString(++i, storedNamespace(obj.namespace()));
                ps.setString(++i, manifest);
                ps.setString(++i, obj.gvk().group());
                ps.setString(++i, obj.gvk().version());
                ps.setString(++i, obj.gvk().kind());
                ps.setString(++i, obj.cluster());
                ps.setString(++i, obj.userId());
                ps.executeUpdate();
            }
        });
        LOG.debug("Cached {}", obj.meta());
    }

    @Nullable
    @Override
    public K8sObject get(K8sObjectMeta meta) throws SQLException {
        var params = new ArrayList<String>();
        var query = SELECT_QUERY + identityClause(meta, params) + " AND deleted = FALSE";
        return DbOperation.execute(storage, c -> {
            try (PreparedStatement ps = c.prepareStatement(query)) {
                bind(ps, params);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        return readObject(rs);
                    }
                    return null;
                }
            }
        });
    }

    @Override
    public void delete(K8sObjectMeta meta) throws SQLException {
        var params = new ArrayList<String>();
        var query = DELETE_QUERY + identityClause(meta, params);
        var deleted = DbOperation.execute(storage, c -> {
            try (PreparedStatement ps = c.prepareStatement(query)) {
                bind(ps, params);
                return ps.executeUpdate();
            }
        });
        LOG.debug("Removed {} cache entries of {}", deleted, meta);
    }

    @Override
    public void markDeleted(K8sObjectMeta meta) throws SQLException {
        var params = new ArrayList<String>();
        var query = MARK_DELETED_QUERY + identityClause(meta, params) + " AND deleted = FALSE";
        DbOperation.execute(storage, c -> {
            try (PreparedStatement ps = c.prepareStatement(query)) {
                bind(ps, params);
                ps.executeUpdate();
            }
        });
    }

    @Override
    public int purgeDeleted(Duration olderThan) throws SQLException {
        var purged = DbOperation.execute(storage, c -> {
            try (PreparedStatement ps = c.prepareStatement(PURGE_DELETED_QUERY)) {
                ps.setString(1, olderThan.toString());
                return ps.executeUpdate();
            }
        });
        if (purged > 0) {
            LOG.info("Purged {} deleted cache entries older than {}", purged, olderThan);
        }
        return purged;
    }

    @Override
    public Stream<K8sObject> list(K8sObjectFilter filter) throws SQLException {
        var params = new ArrayList<String>();
        var query = SELECT_QUERY + whereClause(filter, params) + " ORDER BY cluster, namespace, name";

        var conn = storage.connect();
        try {
            // postgres uses a server side cursor only inside a transaction
            conn.setAutoCommit(false);
            var ps = conn.prepareStatement(query);
            ps.setFetchSize(fetchSize);
            bind(ps, params);
            var rs = ps.executeQuery();
            return StreamSupport.stream(new RowSpliterator(rs), false)
                .onClose(() -> closeCursor(conn, ps, rs));
        } catch (SQLException e) {
            try {
                conn.close();
            } catch (SQLException ex) {
                e.addSuppressed(ex);
            }
            throw e;
        }
    }

    private String whereClause(K8sObjectFilter filter, List<String> params) {
        var sb = new StringBuilder(" WHERE deleted = FALSE");
        if (filter.name() != null) {
            sb.append(" AND name = ?");
            params.add(filter.name());
        }
        if (filter.namespace() != null) {
            sb.append(" AND namespace = ?");
            params.add(filter.namespace());
        }
        if (filter.cluster() != null) {
            sb.append(" AND cluster = ?");
            params.add(filter.cluster());
        }
        if (filter.kind() != null) {
            sb.append(" AND lower(kind) = lower(?)");
            params.add(filter.kind());
        }
        if (filter.version() != null) {
            sb.append(" AND lower(version) = lower(?)");
            params.add(filter.version());
        }
        if (filter.group() != null) {
            if (filter.matchesCoreGroupOnly()) {
                sb.append(" AND \"group\" IS NULL");
            } else {
                sb.append(" AND lower(\"group\") = lower(?)");
                params.add(filter.group());
            }
        }
        if (filter.userId() != null) {
            sb.append(" AND user_id = ?");
            params.add(filter.userId());
        }
        if (filter.labelSelector() != null && !filter.labelSelector().isEmpty()) {
            sb.append(" AND manifest -> 'metadata' -> 'labels' @> cast(? as jsonb)");
            params.add(toJson(filter.labelSelector()));
        }
        return sb.toString();
    }

    private static String identityClause(K8sObjectMeta meta, List<String> params) {
        var sb = new StringBuilder(" WHERE name = ? AND namespace = ? AND cluster = ?")
            .append(" AND lower(kind) = lower(?) AND lower(version) = lower(?)");
        params.add(meta.name());
        params.add(storedNamespace(meta.namespace()));
        params.add(meta.cluster());
        params.add(meta.gvk().kind());
        params.add(meta.gvk().version());
        if (meta.gvk().group() == null) {
            sb.append(" AND \"group\" IS NULL");
        } else {
            sb.append(" AND lower(\"group\") = lower(?)");
            params.add(meta.gvk().group());
        }
        if (meta.userId() != null) {
            sb.append(" AND user_id = ?");
            params.add(meta.userId());
        }
        return sb.toString();
    }

    private static void bind(PreparedStatement ps, List<String> params) throws SQLException {
        var i = 0;
        for (var param : params) {
            ps.setString(++i, param);
        }
    }

    private static String storedNamespace(@Nullable String namespace) {
        return namespace == null ? "" : namespace;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ProgrammingException("Cannot serialize value to json", e);
        }
    }

    private K8sObject readObject(ResultSet rs) throws SQLException {
        Map<String, Object> manifest;
        try {
            manifest = objectMapper.readValue(rs.getString("manifest"), MAP_TYPE_REFERENCE);
        } catch (JsonProcessingException e) {
            throw new ProgrammingException("Cannot read manifest of cached object " + rs.getString("name"), e);
        }
        return new K8sObject(
            rs.getString("name"),
            rs.getString("namespace"),
            rs.getString("cluster"),
            Gvk.of(rs.getString("group"), rs.getString("version"), rs.getString("kind")),
            manifest,
            rs.getString("user_id"));
    }

    private static void closeCursor(Connection conn, PreparedStatement ps, ResultSet rs) {
        try (conn; ps; rs) {
            // read only transaction
            conn.rollback();
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            LOG.warn("Cannot close cache cursor: {}", e.getMessage(), e);
        }
    }

    private final class RowSpliterator extends Spliterators.AbstractSpliterator<K8sObject> {
        private final ResultSet rs;

        private RowSpliterator(ResultSet rs) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.rs = rs;
        }

        @Override
        public boolean tryAdvance(Consumer<? super K8sObject> action) {
            try {
                if (!rs.next()) {
                    return false;
                }
                action.accept(readObject(rs));
                return true;
            } catch (SQLException e) {
                throw new UncheckedSqlException(e);
            }
        }
    }
}
