package org.mides.routing.exception;

public class RouteSolverException extends RuntimeException {
    public RouteSolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
