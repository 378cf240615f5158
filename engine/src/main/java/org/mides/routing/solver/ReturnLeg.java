package org.mides.routing.solver;

import lombok.Value;

@Value
public class ReturnLeg {
    double distanceKm;
    double minutes;
    double arrivalMinutes;
    boolean onTime;
}
