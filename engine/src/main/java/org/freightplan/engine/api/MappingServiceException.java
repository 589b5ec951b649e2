package org.freightplan.engine.api;

/**
 * Raised when the mapping service cannot produce a route matrix
 * (unreachable, quota exceeded, malformed address, unexpected payload).
 */
public class MappingServiceException extends RuntimeException {

    public MappingServiceException(String message) {
        super(message);
    }

    public MappingServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
