package com.example.releaseservice.exception;

/**
 * Write attempted on a release that has reached its terminal phase.
 */
public class ReleaseImmutableException extends StoreException {

    public ReleaseImmutableException(String releaseName, String attempted) {
        super(
            "RELEASE_IMMUTABLE",
            String.format("Release %s is published and cannot be changed: %s", releaseName, attempted)
        );
    }
}
