package com.example.releaseservice.exception;

import com.example.releaseservice.entity.ReleasePhase;

/**
 * A uniqueness, check, foreign key or business constraint was violated.
 * The operation had no effect.
 */
public class ConstraintViolationException extends StoreException {

    public ConstraintViolationException(String code, String message) {
        super(code, message);
    }

    public ConstraintViolationException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }

    public static ConstraintViolationException releaseExists(String projectName, String version) {
        return new ConstraintViolationException(
            "RELEASE_ALREADY_EXISTS",
            String.format("Release %s %s already exists", projectName, version)
        );
    }

    public static ConstraintViolationException releaseNameTaken(String name) {
        return new ConstraintViolationException(
            "RELEASE_NAME_TAKEN",
            String.format("Release name %s is already used by another release", name)
        );
    }

    public static ConstraintViolationException committeeExists(String name) {
        return new ConstraintViolationException(
            "COMMITTEE_ALREADY_EXISTS",
            String.format("Committee %s already exists", name)
        );
    }

    public static ConstraintViolationException projectExists(String name) {
        return new ConstraintViolationException(
            "PROJECT_ALREADY_EXISTS",
            String.format("Project %s already exists", name)
        );
    }

    public static ConstraintViolationException committeeCycle(String name, String parentName) {
        return new ConstraintViolationException(
            "COMMITTEE_CYCLE",
            String.format("Committee %s cannot have %s as parent: the hierarchy would contain a cycle",
                name, parentName)
        );
    }

    public static ConstraintViolationException committeeInUse(String name, long projectCount) {
        return new ConstraintViolationException(
            "COMMITTEE_IN_USE",
            String.format("Committee %s is still referenced by %d project(s)", name, projectCount)
        );
    }

    public static ConstraintViolationException revisionNotLatest(String releaseName, int selected, Integer latest) {
        return new ConstraintViolationException(
            "REVISION_NOT_LATEST",
            String.format("Revision %d of %s is not the latest revision (latest is %s)",
                selected, releaseName, latest)
        );
    }

    public static ConstraintViolationException tasksOngoing(String releaseName, int revisionNumber, long count) {
        return new ConstraintViolationException(
            "TASKS_ONGOING",
            String.format("%d task(s) are still queued or active for %s revision %d",
                count, releaseName, revisionNumber)
        );
    }

    public static ConstraintViolationException distributionExists(String releaseName, String platform) {
        return new ConstraintViolationException(
            "DISTRIBUTION_ALREADY_EXISTS",
            String.format("Distribution of %s to %s is already recorded", releaseName, platform)
        );
    }

    public static ConstraintViolationException notDistributable(String releaseName, ReleasePhase phase) {
        return new ConstraintViolationException(
            "RELEASE_NOT_DISTRIBUTABLE",
            String.format("Release %s is in %s and cannot be distributed yet", releaseName, phase)
        );
    }

    public static ConstraintViolationException integrity(String entity, Throwable cause) {
        return new ConstraintViolationException(
            "DATA_INTEGRITY_ERROR",
            String.format("Data integrity constraint violated while writing %s", entity),
            cause
        );
    }
}
