package com.csd.updateserver.exception;

/**
 * Base for failures that abort a single request or build.
 */
public class UpdateServerException extends RuntimeException {

    public UpdateServerException(String message) {
        super(message);
    }

    public UpdateServerException(String message, Throwable cause) {
        super(message, cause);
    }
}
