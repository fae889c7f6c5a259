package ai.kcache.k8s.client;

import io.fabric8.kubernetes.client.KubernetesClientException;

import java.net.HttpURLConnection;

public final class K8sUtils {

    private K8sUtils() {
    }

    public static boolean isResourceNotFound(KubernetesClientException ex) {
        return ex.getCode() == HttpURLConnection.HTTP_NOT_FOUND;
    }
}
