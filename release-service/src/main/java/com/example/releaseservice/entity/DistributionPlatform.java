package com.example.releaseservice.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * Package registries a release can be distributed to.
 */
public enum DistributionPlatform {
    ARTIFACT_HUB(new DistributionPlatformValue(
        "Artifact Hub",
        "artifacthub",
        "https://artifacthub.io/api/v1/packages/helm/{owner_namespace}/{package}/{version}",
        "https://artifacthub.io/api/v1/packages/helm/{owner_namespace}/{package}/{version}?staging=true",
        true,
        null)),
    DOCKER_HUB(new DistributionPlatformValue(
        "Docker Hub",
        "dockerhub",
        "https://hub.docker.com/v2/namespaces/{owner_namespace}/repositories/{package}/tags/{version}",
        null,
        false,
        "library")),
    MAVEN(new DistributionPlatformValue(
        "Maven Central",
        "maven",
        "https://search.maven.org/solrsearch/select?q=g:{owner_namespace}+AND+a:{package}+AND+v:{version}&core=gav&rows=20&wt=json",
        "https://repository.apache.org/service/local/lucene/search?g={owner_namespace}&a={package}&v={version}",
        true,
        null)),
    NPM(new DistributionPlatformValue(
        "npm",
        "npm",
        "https://registry.npmjs.org/{package}/{version}",
        null,
        false,
        null)),
    NPM_SCOPED(new DistributionPlatformValue(
        "npm (scoped)",
        "npm-scoped",
        "https://registry.npmjs.org/@{owner_namespace}/{package}/{version}",
        null,
        true,
        null)),
    PYPI(new DistributionPlatformValue(
        "PyPI",
        "pypi",
        "https://pypi.org/pypi/{package}/{version}/json",
        "https://test.pypi.org/pypi/{package}/{version}/json",
        false,
        null));

    private final DistributionPlatformValue value;

    DistributionPlatform(DistributionPlatformValue value) {
        this.value = value;
    }

    public DistributionPlatformValue value() {
        return value;
    }

    public static Optional<DistributionPlatform> fromSlug(String slug) {
        return Arrays.stream(values())
            .filter(platform -> platform.value.ghSlug().equals(slug))
            .findFirst();
    }

    /**
     * Owner namespace to use for this platform: the given one when present,
     * else the platform default, else the empty string.
     *
     * @throws IllegalArgumentException when the platform requires a namespace and none is available
     */
    public String ownerNamespace(String requested) {
        if (requested != null && !requested.isBlank()) {
            return requested;
        }
        if (value.defaultOwnerNamespace() != null) {
            return value.defaultOwnerNamespace();
        }
        if (value.requiresOwnerNamespace()) {
            throw new IllegalArgumentException(value.displayName() + " requires an owner namespace");
        }
        return "";
    }

    /**
     * Resolves the API URL of a package on this platform.
     *
     * @throws IllegalArgumentException when staging is requested but the platform has no staging registry
     */
    public String apiUrl(String ownerNamespace, String packageName, String version, boolean staging) {
        String template = value.templateUrl();
        if (staging) {
            if (!value.supportsStaging()) {
                throw new IllegalArgumentException(value.displayName() + " has no staging registry");
            }
            template = value.stagingTemplateUrl();
        }
        return template
            .replace("{owner_namespace}", ownerNamespace(ownerNamespace))
            .replace("{package}", packageName)
            .replace("{version}", version);
    }
}
