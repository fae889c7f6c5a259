package ai.kcache.k8s.client;

import ai.kcache.k8s.exceptions.NotFoundException;
import ai.kcache.k8s.exceptions.ValidationException;
import ai.kcache.k8s.model.ClusterConnection;
import ai.kcache.k8s.model.Gvk;
import ai.kcache.k8s.model.K8sObject;
import ai.kcache.k8s.model.K8sObjectFilter;
import ai.kcache.k8s.model.K8sObjectMeta;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.client.server.mock.KubernetesServer;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class K8sClusterClientTest {
    static final Gvk CONFIG_MAP = Gvk.core("v1", "ConfigMap");
    static final String OWNER_LABEL = "kcache.ai/owner";
    static final String NAMESPACE = "test";

    @Rule
    public KubernetesServer server = new KubernetesServer(false, true);

    private K8sClusterClient client;

    @Before
    public void setUp() {
        var converter = new ManifestConverter(new ObjectMapper(),
            new UserIdExtractor(Map.of("ConfigMap", OWNER_LABEL)));
        client = new K8sClusterClient(new ClusterConnection("c1", NAMESPACE, server.getClient()), converter);
    }

    static K8sObject configMap(String cluster, String name, String owner, Map<String, String> labels) {
        var allLabels = new HashMap<>(labels);
        if (owner != null) {
            allLabels.put(OWNER_LABEL, owner);
        }
        return new K8sObject(name, NAMESPACE, cluster, CONFIG_MAP, Map.of(
            "apiVersion", "v1",
            "kind", "ConfigMap",
            "metadata", Map.of("name", name, "labels", allLabels),
            "data", Map.of("key", "value")), owner);
    }

    @Test
    public void createAndGet() {
        var created = client.create(configMap("c1", "cm1", "alice", Map.of()), true);

        Assert.assertEquals("cm1", created.name());
        Assert.assertEquals(NAMESPACE, created.namespace());
        Assert.assertEquals("c1", created.cluster());
        Assert.assertEquals("alice", created.userId());
        Assert.assertEquals(CONFIG_MAP, created.gvk());

        var fetched = client.get(new K8sObjectMeta("cm1", NAMESPACE, "c1", CONFIG_MAP));
        Assert.assertNotNull(fetched);
        Assert.assertEquals("alice", fetched.userId());
        Assert.assertEquals(Map.of("key", "value"), fetched.manifest().get("data"));
        Assert.assertEquals("ConfigMap", fetched.manifest().get("kind"));
    }

    @Test
    public void getMissingOrForeign() {
        Assert.assertNull(client.get(new K8sObjectMeta("missing", NAMESPACE, "c1", CONFIG_MAP)));

        client.create(configMap("c1", "cm1", "alice", Map.of()), false);
        var meta = new K8sObjectMeta("cm1", NAMESPACE, "c1", CONFIG_MAP);
        Assert.assertNotNull(client.get(meta.withUserId("alice")));
        Assert.assertNull(client.get(meta.withUserId("bob")));
    }

    @Test
    public void objectOfAnotherClusterIsRejected() {
        Assert.assertThrows(ValidationException.class, () -> client.create(configMap("c2", "cm1", null, Map.of()),
            false));
    }

    @Test
    public void mergePatch() {
        var obj = client.create(configMap("c1", "cm1", "alice", Map.of()), false);

        var patched = client.patch(obj.meta(), Map.of("metadata", Map.of("labels", Map.of("state", "running"))));
        Assert.assertEquals("running", patched.labels().get("state"));
        Assert.assertEquals("alice", patched.labels().get(OWNER_LABEL));

        var fetched = client.get(obj.meta());
        Assert.assertNotNull(fetched);
        Assert.assertEquals("running", fetched.labels().get("state"));
    }

    @Test
    public void jsonPatch() {
        var obj = client.create(configMap("c1", "cm1", "alice", Map.of()), false);

        var patched = client.jsonPatch(obj.meta(), List.of(
            Map.of("op", "replace", "path", "/data/key", "value", "other")));
        Assert.assertEquals(Map.of("key", "other"), patched.manifest().get("data"));
    }

    @Test
    public void patchMissing() {
        var meta = new K8sObjectMeta("missing", NAMESPACE, "c1", CONFIG_MAP);
        Assert.assertThrows(NotFoundException.class, () -> client.patch(meta, Map.of("data", Map.of("a", "b"))));
    }

    @Test
    public void deleteIsIdempotent() {
        var obj = client.create(configMap("c1", "cm1", "alice", Map.of()), false);

        client.delete(obj.meta());
        Assert.assertNull(client.get(obj.meta()));

        client.delete(obj.meta());
        Assert.assertNull(client.get(obj.meta()));
    }

    @Test
    public void list() {
        client.create(configMap("c1", "cm1", "alice", Map.of("app", "web")), false);
        client.create(configMap("c1", "cm2", "bob", Map.of("app", "web")), false);
        client.create(configMap("c1", "cm3", "alice", Map.of("app", "db")), false);

        var byKind = K8sObjectFilter.builder().gvk(CONFIG_MAP).build();
        Assert.assertEquals(List.of("cm1", "cm2", "cm3"), names(byKind));

        var byLabel = byKind.toBuilder().labelSelector(Map.of("app", "web")).build();
        Assert.assertEquals(List.of("cm1", "cm2"), names(byLabel));

        var byUser = byKind.toBuilder().userId("alice").build();
        Assert.assertEquals(List.of("cm1", "cm3"), names(byUser));

        var byName = byKind.toBuilder().name("cm2").build();
        Assert.assertEquals(List.of("cm2"), names(byName));

        var otherCluster = byKind.toBuilder().cluster("c2").build();
        Assert.assertEquals(List.of(), names(otherCluster));
    }

    @Test
    public void listRequiresKindAndVersion() {
        Assert.assertThrows(ValidationException.class, () -> client.list(K8sObjectFilter.all()));
        Assert.assertThrows(ValidationException.class, () -> client.list(K8sObjectFilter.builder().kind("Pod").build()));
    }

    private List<String> names(K8sObjectFilter filter) {
        try (var stream = client.list(filter)) {
            return stream.map(K8sObject::name).sorted().collect(Collectors.toList());
        }
    }
}
