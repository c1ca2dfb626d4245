package com.openaasx.harvester.harvest.model;

/**
 * Disk, temp-directory or other local failures. These abort the run instead of degrading.
 */
public class LocalEnvironmentException extends RuntimeException {

    public LocalEnvironmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
