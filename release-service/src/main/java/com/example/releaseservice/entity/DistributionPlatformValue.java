package com.example.releaseservice.entity;

/**
 * Configuration carried by each {@link DistributionPlatform}.
 *
 * @param displayName          human readable platform name
 * @param ghSlug               identifier used by GitHub workflows
 * @param templateUrl          API URL of a published package, with
 *                             {owner_namespace}, {package} and {version} placeholders
 * @param stagingTemplateUrl   same for the staging registry, null when the platform has none
 * @param requiresOwnerNamespace whether an owner namespace must be supplied
 * @param defaultOwnerNamespace namespace used when none is supplied, may be null
 */
public record DistributionPlatformValue(
    String displayName,
    String ghSlug,
    String templateUrl,
    String stagingTemplateUrl,
    boolean requiresOwnerNamespace,
    String defaultOwnerNamespace
) {

    public boolean supportsStaging() {
        return stagingTemplateUrl != null;
    }
}
