package com.phillippitts.mediatoolbox.exception;

/**
 * Base exception for all media-toolbox application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class MediaToolboxException extends RuntimeException {

    public MediaToolboxException(String message) {
        super(message);
    }

    public MediaToolboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
