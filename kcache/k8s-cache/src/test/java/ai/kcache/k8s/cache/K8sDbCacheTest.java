package ai.kcache.k8s.cache;

import ai.kcache.db.test.DatabaseTestUtils;
import ai.kcache.k8s.exceptions.ValidationException;
import ai.kcache.k8s.model.Gvk;
import ai.kcache.k8s.model.K8sObject;
import ai.kcache.k8s.model.K8sObjectFilter;
import ai.kcache.k8s.model.K8sObjectMeta;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.zonky.test.db.postgres.junit.EmbeddedPostgresRules;
import io.zonky.test.db.postgres.junit.PreparedDbRule;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class K8sDbCacheTest {
    private static final Gvk SESSION = Gvk.of("amalthea.dev", "v1alpha1", "AmaltheaSession");
    private static final Gvk POD = Gvk.core("v1", "Pod");

    @Rule
    public PreparedDbRule db = EmbeddedPostgresRules.preparedDatabase(ds -> {});

    private CacheTestStorage storage;
    private K8sDbCache cache;

    @Before
    public void setUp() {
        storage = new CacheTestStorage(DatabaseTestUtils.preparePostgresConfig(db.getConnectionInfo()));
        cache = new K8sDbCache(storage, new ObjectMapper(), false, 2);
    }

    @After
    public void tearDown() {
        DatabaseTestUtils.cleanup(storage);
        storage.close();
    }

    private static K8sObject object(String name, String namespace, String cluster, Gvk gvk, String userId,
                                    Map<String, String> labels)
    {
        var metadata = Map.<String, Object>of("name", name, "labels", labels);
        return new K8sObject(name, namespace, cluster, gvk, Map.of("metadata", metadata, "spec", Map.of()), userId);
    }

    private static K8sObject session(String name, String cluster, String userId) {
        return object(name, "renku", cluster, SESSION, userId, Map.of());
    }

    private List<K8sObject> list(K8sObjectFilter filter) throws SQLException {
        try (var stream = cache.list(filter)) {
            return stream.collect(Collectors.toList());
        }
    }

    @Test
    public void upsertAndGet() throws SQLException {
        var obj = session("s1", "c1", "alice");
        cache.upsert(obj);

        var cached = cache.get(obj.meta());
        Assert.assertEquals(obj, cached);

        var sameWithOtherCase = new K8sObjectMeta("s1", "renku", "c1",
            Gvk.of("Amalthea.Dev", "V1Alpha1", "amaltheasession"));
        Assert.assertNotNull(cache.get(sameWithOtherCase));
    }

    @Test
    public void getRespectsUserId() throws SQLException {
        cache.upsert(session("s1", "c1", "alice"));

        var meta = new K8sObjectMeta("s1", "renku", "c1", SESSION);
        Assert.assertNotNull(cache.get(meta.withUserId("alice")));
        Assert.assertNull(cache.get(meta.withUserId("bob")));
        Assert.assertNotNull(cache.get(meta));
    }

    @Test
    public void identityIsUnique() throws SQLException {
        cache.upsert(session("s1", "c1", "alice"));
        var updated = object("s1", "renku", "c1", SESSION, "alice", Map.of("state", "running"));
        cache.upsert(updated);

        var all = list(K8sObjectFilter.all());
        Assert.assertEquals(1, all.size());
        Assert.assertEquals(Map.of("state", "running"), all.get(0).labels());

        // another cluster is another identity
        cache.upsert(session("s1", "c2", "alice"));
        Assert.assertEquals(2, list(K8sObjectFilter.all()).size());
    }

    @Test
    public void deleteIsIdempotent() throws SQLException {
        var obj = session("s1", "c1", "alice");
        cache.upsert(obj);

        cache.delete(obj.meta());
        Assert.assertNull(cache.get(obj.meta()));

        cache.delete(obj.meta());
        Assert.assertNull(cache.get(obj.meta()));
        Assert.assertTrue(list(K8sObjectFilter.all()).isEmpty());
    }

    @Test
    public void clusterScopedObject() throws SQLException {
        var node = new K8sObject("node-1", null, "c1", Gvk.core("v1", "Node"),
            Map.of("metadata", Map.of("name", "node-1")), null);
        cache.upsert(node);

        var cached = cache.get(node.meta());
        Assert.assertNotNull(cached);
        Assert.assertNull(cached.namespace());
        Assert.assertFalse(cached.namespaced());
    }

    @Test
    public void listFilters() throws SQLException {
        cache.upsert(object("s1", "renku", "c1", SESSION, "alice", Map.of("app", "web", "tier", "front")));
        cache.upsert(object("s2", "renku", "c1", SESSION, "bob", Map.of("app", "web")));
        cache.upsert(object("s3", "other", "c2", SESSION, "alice", Map.of("app", "db")));
        cache.upsert(object("p1", "renku", "c1", POD, "alice", Map.of("app", "web")));

        Assert.assertEquals(4, list(K8sObjectFilter.all()).size());

        var byUser = list(K8sObjectFilter.builder().userId("alice").build());
        Assert.assertEquals(List.of("p1", "s1", "s3"), names(byUser));

        var byCluster = list(K8sObjectFilter.builder().cluster("c2").build());
        Assert.assertEquals(List.of("s3"), names(byCluster));

        var byNamespace = list(K8sObjectFilter.builder().namespace("renku").build());
        Assert.assertEquals(3, byNamespace.size());

        var byKind = list(K8sObjectFilter.builder().kind("amaltheasession").version("V1ALPHA1").build());
        Assert.assertEquals(3, byKind.size());

        var coreOnly = list(K8sObjectFilter.builder().group(Gvk.CORE_GROUP).build());
        Assert.assertEquals(List.of("p1"), names(coreOnly));

        var byGroup = list(K8sObjectFilter.builder().group("AMALTHEA.dev").build());
        Assert.assertEquals(3, byGroup.size());

        var byLabels = list(K8sObjectFilter.builder().labelSelector(Map.of("app", "web")).build());
        Assert.assertEquals(3, byLabels.size());

        var byTwoLabels = list(K8sObjectFilter.builder().labelSelector(Map.of("app", "web", "tier", "front")).build());
        Assert.assertEquals(List.of("s1"), names(byTwoLabels));

        var combined = list(K8sObjectFilter.builder()
            .gvk(SESSION)
            .cluster("c1")
            .userId("alice")
            .labelSelector(Map.of("app", "web"))
            .build());
        Assert.assertEquals(List.of("s1"), names(combined));

        var byName = list(K8sObjectFilter.builder().name("s2").build());
        Assert.assertEquals(List.of("s2"), names(byName));
    }

    @Test
    public void listIsLazyOverSeveralFetches() throws SQLException {
        for (int i = 0; i < 7; i++) {
            cache.upsert(session("s" + i, "c1", "alice"));
        }

        try (var stream = cache.list(K8sObjectFilter.all())) {
            var first = stream.limit(3).collect(Collectors.toList());
            Assert.assertEquals(3, first.size());
        }
        Assert.assertEquals(7, list(K8sObjectFilter.all()).size());
    }

    @Test
    public void softDeleteLifecycle() throws SQLException {
        var obj = session("s1", "c1", "alice");
        cache.upsert(obj);

        cache.markDeleted(obj.meta());
        Assert.assertNull(cache.get(obj.meta()));
        Assert.assertTrue(list(K8sObjectFilter.all()).isEmpty());

        // upsert resurrects
        cache.upsert(obj);
        Assert.assertNotNull(cache.get(obj.meta()));

        cache.markDeleted(obj.meta());
        Assert.assertEquals(0, cache.purgeDeleted(Duration.ofHours(1)));
        Assert.assertEquals(1, cache.purgeDeleted(Duration.ZERO));

        cache.upsert(obj);
        Assert.assertEquals(1, list(K8sObjectFilter.all()).size());
    }

    @Test
    public void userIdRequired() throws SQLException {
        var scoped = new K8sDbCache(storage, new ObjectMapper(), true);
        Assert.assertTrue(scoped.requiresUserId());

        var obj = session("s1", "c1", null);
        Assert.assertThrows(ValidationException.class, () -> scoped.upsert(obj));

        scoped.upsert(obj.withUserId("alice"));
        Assert.assertNotNull(scoped.get(obj.meta()));
    }

    private static List<String> names(List<K8sObject> objects) {
        return objects.stream().map(K8sObject::name).sorted().toList();
    }
}
