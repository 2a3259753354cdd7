package com.example.releaseservice.support;

/**
 * Deterministic names for releases and revisions.
 */
public final class ReleaseNames {

    private ReleaseNames() {
    }

    public static String release(String projectName, String version) {
        return projectName + "-" + version;
    }

    public static String revision(String releaseName, int number) {
        return releaseName + "-" + number;
    }
}
