package com.example.releaseservice.exception;

/**
 * Exception for lookups by key that match no row.
 */
public class ResourceNotFoundException extends StoreException {

    public ResourceNotFoundException(String code, String message) {
        super(code, message);
    }

    public static ResourceNotFoundException committeeNotFound(String name) {
        return new ResourceNotFoundException(
            "COMMITTEE_NOT_FOUND",
            String.format("Committee %s not found", name)
        );
    }

    public static ResourceNotFoundException projectNotFound(String name) {
        return new ResourceNotFoundException(
            "PROJECT_NOT_FOUND",
            String.format("Project %s not found", name)
        );
    }

    public static ResourceNotFoundException releaseNotFound(String name) {
        return new ResourceNotFoundException(
            "RELEASE_NOT_FOUND",
            String.format("Release %s not found", name)
        );
    }

    public static ResourceNotFoundException revisionNotFound(String releaseName, int number) {
        return new ResourceNotFoundException(
            "REVISION_NOT_FOUND",
            String.format("Revision %d of release %s not found", number, releaseName)
        );
    }

    public static ResourceNotFoundException taskNotFound(Long id) {
        return new ResourceNotFoundException(
            "TASK_NOT_FOUND",
            String.format("Task with ID %d not found", id)
        );
    }
}
