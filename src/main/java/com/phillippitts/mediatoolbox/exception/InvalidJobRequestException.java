package com.phillippitts.mediatoolbox.exception;

/**
 * Thrown when a start request cannot be turned into a job (missing tool kind,
 * empty argument vector, unusable working directory).
 */
public class InvalidJobRequestException extends MediaToolboxException {

    private final String reason;

    public InvalidJobRequestException(String reason) {
        super("Invalid job request: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
