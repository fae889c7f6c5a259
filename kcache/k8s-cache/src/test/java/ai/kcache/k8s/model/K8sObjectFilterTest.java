package ai.kcache.k8s.model;

import ai.kcache.k8s.exceptions.ValidationException;
import org.junit.Assert;
import org.junit.Test;

import java.util.Map;

public class K8sObjectFilterTest {
    private static final Gvk SESSION = Gvk.of("amalthea.dev", "v1alpha1", "AmaltheaSession");

    private static K8sObject session(String name, String userId, Map<String, String> labels) {
        return new K8sObject(name, "renku", "c1", SESSION,
            Map.of("metadata", Map.of("name", name, "labels", labels)), userId);
    }

    @Test
    public void metaToFilterMatchesOnlyItself() {
        var obj = session("s1", "alice", Map.of());
        var filter = obj.meta().toFilter();

        Assert.assertTrue(filter.matches(obj));
        Assert.assertFalse(filter.matches(session("s2", "alice", Map.of())));
        Assert.assertFalse(filter.matches(session("s1", "bob", Map.of())));
        Assert.assertFalse(filter.matches(new K8sObject("s1", "renku", "c1", Gvk.core("v1", "Pod"), Map.of(),
            "alice")));
    }

    @Test
    public void coreGroupFilter() {
        var pod = new K8sObject("p1", "renku", "c1", Gvk.core("v1", "Pod"), Map.of(), null);
        var coreOnly = K8sObjectFilter.builder().group("core").build();

        Assert.assertTrue(coreOnly.matchesCoreGroupOnly());
        Assert.assertTrue(coreOnly.matches(pod));
        Assert.assertFalse(coreOnly.matches(session("s1", null, Map.of())));
        Assert.assertTrue(K8sObjectFilter.all().matches(pod));
    }

    @Test
    public void labelSelector() {
        var filter = K8sObjectFilter.builder().labelSelector(Map.of("app", "web")).build();

        Assert.assertTrue(filter.matches(session("s1", null, Map.of("app", "web", "tier", "front"))));
        Assert.assertFalse(filter.matches(session("s1", null, Map.of("app", "db"))));
        Assert.assertFalse(filter.matches(session("s1", null, Map.of())));
    }

    @Test
    public void emptyNamespaceIsClusterScoped() {
        var meta = new K8sObjectMeta("node-1", "", "c1", Gvk.core("v1", "Node"));
        Assert.assertNull(meta.namespace());
        Assert.assertFalse(meta.namespaced());
        Assert.assertThrows(ValidationException.class, () -> new K8sObjectMeta("", "ns", "c1", SESSION));
        Assert.assertThrows(ValidationException.class, () -> new K8sObjectMeta("a", "ns", null, SESSION));
    }

    @Test
    public void withCluster() {
        var filter = K8sObjectFilter.builder().kind("Pod").cluster("c1").build();
        var moved = filter.withCluster("c2");

        Assert.assertEquals("c2", moved.cluster());
        Assert.assertEquals("Pod", moved.kind());
        Assert.assertEquals("c1", filter.cluster());
    }
}
