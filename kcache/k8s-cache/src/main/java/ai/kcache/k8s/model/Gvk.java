package ai.kcache.k8s.model;

import ai.kcache.k8s.exceptions.ValidationException;
import jakarta.annotation.Nullable;

import java.util.Locale;
import java.util.Objects;

/**
 * Group, version and kind of a resource. Compared case-insensitively, the core group is
 * always represented by {@code null}.
 */
public final class Gvk {
    public static final String CORE_GROUP = "core";

    @Nullable
    private final String group;
    private final String version;
    private final String kind;

    private Gvk(@Nullable String group, String version, String kind) {
        if (version == null || version.isBlank()) {
            throw new ValidationException("Resource version is required");
        }
        if (kind == null || kind.isBlank()) {
            throw new ValidationException("Resource kind is required");
        }
        this.group = isCoreGroup(group) ? null : group;
        this.version = version;
        this.kind = kind;
    }

    public static Gvk of(@Nullable String group, String version, String kind) {
        return new Gvk(group, version, kind);
    }

    public static Gvk core(String version, String kind) {
        return new Gvk(null, version, kind);
    }

    public static Gvk fromApiVersion(String apiVersion, String kind) {
        if (apiVersion == null) {
            throw new ValidationException("apiVersion is required");
        }
        var idx = apiVersion.indexOf('/');
        if (idx < 0) {
            return new Gvk(null, apiVersion, kind);
        }
        return new Gvk(apiVersion.substring(0, idx), apiVersion.substring(idx + 1), kind);
    }

    /**
     * Parses {@code group/version/Kind} or {@code version/Kind}.
     */
    public static Gvk parse(String value) {
        var idx = value == null ? -1 : value.lastIndexOf('/');
        if (idx <= 0 || idx == value.length() - 1) {
            throw new ValidationException("Cannot parse resource type '" + value + "'");
        }
        return fromApiVersion(value.substring(0, idx), value.substring(idx + 1));
    }

    public static boolean isCoreGroup(@Nullable String group) {
        return group == null || group.isEmpty() || CORE_GROUP.equalsIgnoreCase(group);
    }

    @Nullable
    public String group() {
        return group;
    }

    public String version() {
        return version;
    }

    public String kind() {
        return kind;
    }

    public String groupVersion() {
        return group == null ? version : group + "/" + version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Gvk other)) {
            return false;
        }
        return kind.equalsIgnoreCase(other.kind)
            && version.equalsIgnoreCase(other.version)
            && (group == null ? other.group == null : group.equalsIgnoreCase(other.group));
    }

    @Override
    public int hashCode() {
        return Objects.hash(
            group == null ? null : group.toLowerCase(Locale.ROOT),
            version.toLowerCase(Locale.ROOT),
            kind.toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return groupVersion() + "/" + kind;
    }
}
