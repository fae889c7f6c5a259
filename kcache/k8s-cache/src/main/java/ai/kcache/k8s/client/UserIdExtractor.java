package ai.kcache.k8s.client;

import ai.kcache.k8s.model.K8sObject;
import jakarta.annotation.Nullable;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Derives the owner of a live object from its labels. The label holding the user id depends on the kind.
 */
public class UserIdExtractor {
    public static final String SAFE_USERNAME_LABEL = "renku.io/safe-username";
    public static final String USER_ID_LABEL = "renku.io/userId";

    public static final Map<String, String> DEFAULT_LABELS = Map.of(
        "jupyterserver", USER_ID_LABEL,
        "amaltheasession", SAFE_USERNAME_LABEL,
        "buildrun", SAFE_USERNAME_LABEL);

    private final Map<String, String> labelsByKind;
    private final Map<String, String> fixedUserIdsByKind;

    public UserIdExtractor(Map<String, String> labelsByKind, Map<String, String> fixedUserIdsByKind) {
        this.labelsByKind = lowerCaseKeys(labelsByKind);
        this.fixedUserIdsByKind = lowerCaseKeys(fixedUserIdsByKind);
    }

    public UserIdExtractor(Map<String, String> labelsByKind) {
        this(labelsByKind, Map.of());
    }

    public static UserIdExtractor withDefaults() {
        return new UserIdExtractor(DEFAULT_LABELS);
    }

    @Nullable
    public String extract(K8sObject obj) {
        var kind = obj.gvk().kind().toLowerCase(Locale.ROOT);
        var fixed = fixedUserIdsByKind.get(kind);
        if (fixed != null) {
            return fixed;
        }
        var label = labelsByKind.get(kind);
        if (label == null) {
            return null;
        }
        return obj.labels().get(label);
    }

    private static Map<String, String> lowerCaseKeys(Map<String, String> map) {
        var result = new HashMap<String, String>();
        map.forEach((k, v) -> result.put(k.toLowerCase(Locale.ROOT), v));
        return Map.copyOf(result);
    }
}
