package ai.kcache.k8s.client;

import ai.kcache.k8s.exceptions.NotFoundException;
import ai.kcache.k8s.exceptions.ValidationException;
import ai.kcache.k8s.model.ClusterConnection;
import ai.kcache.k8s.model.Gvk;
import ai.kcache.k8s.model.K8sObject;
import ai.kcache.k8s.model.K8sObjectFilter;
import ai.kcache.k8s.model.K8sObjectMeta;
import io.fabric8.kubernetes.api.Pluralize;
import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.api.model.ListOptionsBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import io.fabric8.kubernetes.client.dsl.base.PatchType;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Live client of a single cluster, works with any kind through fabric8 generic resources.
 */
public class K8sClusterClient implements K8sClient {
    private static final Logger LOG = LogManager.getLogger(K8sClusterClient.class);

    public static final long DEFAULT_PAGE_SIZE = 100;

    private final ClusterConnection cluster;
    private final ManifestConverter converter;
    private final long pageSize;

    public K8sClusterClient(ClusterConnection cluster, ManifestConverter converter, long pageSize) {
        this.cluster = cluster;
        this.converter = converter;
        this.pageSize = pageSize;
    }

    public K8sClusterClient(ClusterConnection cluster, ManifestConverter converter) {
        this(cluster, converter, DEFAULT_PAGE_SIZE);
    }

    public ClusterConnection cluster() {
        return cluster;
    }

    public String clusterId() {
        return cluster.id();
    }

    @Override
    public K8sObject create(K8sObject obj, boolean refresh) {
        checkCluster(obj);
        LOG.info("Creating {} {} in cluster {}", obj.gvk(), obj.name(), cluster.id());

        var created = resources(obj.gvk(), obj.namespace())
            .resource(converter.toResource(obj))
            .create();

        if (refresh) {
            var fresh = resource(obj).get();
            if (fresh != null) {
                created = fresh;
            } else {
                LOG.warn("Object {} has gone right after creation", obj.meta());
            }
        }
        return converter.toObject(created, cluster.id(), obj.gvk(), obj.userId());
    }

    @Nullable
    @Override
    public K8sObject get(K8sObjectMeta meta) {
        checkCluster(meta);
        var resource = resource(meta).get();
        if (resource == null) {
            return null;
        }

        var obj = converter.toObject(resource, cluster.id(), meta.gvk(), meta.userId());
        if (meta.userId() != null && !meta.userId().equals(obj.userId())) {
            LOG.debug("Object {} belongs to another user", meta);
            return null;
        }
        return obj;
    }

    @Override
    public K8sObject patch(K8sObjectMeta meta, Map<String, Object> patch) {
        return doPatch(meta, PatchType.JSON_MERGE, converter.toJson(patch));
    }

    @Override
    public K8sObject jsonPatch(K8sObjectMeta meta, List<Map<String, Object>> operations) {
        return doPatch(meta, PatchType.JSON, converter.toJson(operations));
    }

    private K8sObject doPatch(K8sObjectMeta meta, PatchType type, String patch) {
        checkCluster(meta);
        LOG.debug("Patching {} with {}", meta, patch);
        try {
            var patched = resource(meta).patch(PatchContext.of(type), patch);
            return converter.toObject(patched, cluster.id(), meta.gvk(), meta.userId());
        } catch (KubernetesClientException e) {
            if (K8sUtils.isResourceNotFound(e)) {
                throw new NotFoundException("Cannot patch %s, object not found".formatted(meta));
            }
            LOG.error("Cannot patch {}: {}", meta, e.getMessage());
            throw e;
        }
    }

    @Override
    public void delete(K8sObjectMeta meta, DeletionPropagation propagation) {
        checkCluster(meta);
        LOG.info("Deleting {} with propagation {}", meta, propagation);
        try {
            resource(meta).withPropagationPolicy(propagation).delete();
        } catch (KubernetesClientException e) {
            if (K8sUtils.isResourceNotFound(e)) {
                LOG.debug("Object {} is already deleted", meta);
                return;
            }
            throw e;
        }
    }

    @Override
    public Stream<K8sObject> list(K8sObjectFilter filter) {
        if (filter.cluster() != null && !filter.cluster().equals(cluster.id())) {
            return Stream.empty();
        }
        if (filter.kind() == null || filter.version() == null) {
            throw new ValidationException("Kind and version are required to list objects of cluster " + cluster.id());
        }

        var gvk = Gvk.of(filter.group(), filter.version(), filter.kind());
        var namespace = filter.namespace() != null ? filter.namespace() : cluster.namespace();

        if (filter.name() != null) {
            var obj = get(new K8sObjectMeta(filter.name(), namespace, cluster.id(), gvk));
            return obj == null ? Stream.empty() : Stream.of(obj).filter(filter::matches);
        }

        var resources = resources(gvk, namespace);
        var pages = new PageSpliterator(continueToken -> {
            var options = new ListOptionsBuilder()
                .withLimit(pageSize)
                .withContinue(continueToken)
                .build();
            if (filter.labelSelector() != null && !filter.labelSelector().isEmpty()) {
                return resources.withLabels(filter.labelSelector()).list(options);
            }
            return resources.list(options);
        });

        return StreamSupport.stream(pages, false)
            .map(r -> converter.toObject(r, cluster.id(), gvk, null))
            .filter(filter::matches);
    }

    /**
     * Watches objects of the kind in the cluster namespace.
     */
    public Watch watch(Gvk gvk, Watcher<GenericKubernetesResource> watcher) {
        return resources(gvk, cluster.namespace()).watch(watcher);
    }

    public K8sObject toObject(GenericKubernetesResource resource, Gvk gvk) {
        return converter.toObject(resource, cluster.id(), gvk, null);
    }

    private Resource<GenericKubernetesResource> resource(K8sObjectMeta meta) {
        return resources(meta.gvk(), meta.namespace()).withName(meta.name());
    }

    private NonNamespaceOperation<GenericKubernetesResource, GenericKubernetesResourceList,
        Resource<GenericKubernetesResource>> resources(Gvk gvk, @Nullable String namespace)
    {
        var context = new ResourceDefinitionContext.Builder()
            .withGroup(gvk.group())
            .withVersion(gvk.version())
            .withKind(gvk.kind())
            .withPlural(Pluralize.toPlural(gvk.kind().toLowerCase(Locale.ROOT)))
            .withNamespaced(namespace != null)
            .build();

        var resources = cluster.api().genericKubernetesResources(context);
        return namespace != null ? resources.inNamespace(namespace) : resources;
    }

    private void checkCluster(K8sObjectMeta meta) {
        if (!cluster.id().equals(meta.cluster())) {
            throw new ValidationException("Object %s does not belong to cluster %s".formatted(meta, cluster.id()));
        }
    }

    @Override
    public String toString() {
        return "K8sClusterClient{cluster=%s}".formatted(cluster.id());
    }

    private interface PageLoader {
        GenericKubernetesResourceList load(@Nullable String continueToken);
    }

    private static final class PageSpliterator extends Spliterators.AbstractSpliterator<GenericKubernetesResource> {
        private final PageLoader loader;
        private Iterator<GenericKubernetesResource> page = Collections.emptyIterator();
        private String continueToken = null;
        private boolean lastPage = false;

        private PageSpliterator(PageLoader loader) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.loader = loader;
        }

        @Override
        public boolean tryAdvance(Consumer<? super GenericKubernetesResource> action) {
            while (!page.hasNext()) {
                if (lastPage) {
                    return false;
                }
                var list = loader.load(continueToken);
                page = list.getItems().iterator();
                continueToken = list.getMetadata() != null ? list.getMetadata().getContinue() : null;
                lastPage = continueToken == null || continueToken.isEmpty();
            }
            action.accept(page.next());
            return true;
        }
    }
}
