package org.mides.routing.exception;

public class InvalidSpeedException extends IllegalArgumentException {
    public InvalidSpeedException(double speedKmh) {
        super(String.format("Vehicle speed must be positive, got %s km/h", speedKmh));
    }
}
