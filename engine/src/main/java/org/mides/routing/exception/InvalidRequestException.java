package org.mides.routing.exception;

/**
 * A route request that passed field validation but is still unusable,
 * such as a time window whose start is not before its end.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }
}
