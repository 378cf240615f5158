package org.mides.routing.solver;

import lombok.Value;
import org.mides.routing.model.GeoPoint;

/**
 * Where the vehicle is after its last admitted stop.
 * {@code clockMinutes} is the time it may leave, {@code distanceKm} the distance
 * driven since the depot and {@code elapsedMinutes} the time since departing the depot.
 */
@Value
public class RouteState {
    GeoPoint location;
    double clockMinutes;
    double distanceKm;
    double elapsedMinutes;

    public static RouteState atDepot(RouteContext context) {
        return new RouteState(context.getDepot(), context.getStartMinutes(), 0.0, 0.0);
    }
}
