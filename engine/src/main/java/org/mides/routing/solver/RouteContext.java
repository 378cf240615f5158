package org.mides.routing.solver;

import lombok.Value;
import org.mides.routing.model.GeoPoint;
import org.mides.routing.model.OptimizeBy;
import org.mides.routing.model.RouteRequest;

/**
 * The fixed facts of one solve, taken from an initialized request.
 */
@Value
public class RouteContext {
    GeoPoint depot;
    double startMinutes;
    double endMinutes;
    double speedKmh;
    int serviceMinutes;
    boolean returnToOrigin;
    OptimizeBy optimizeBy;

    public static RouteContext from(RouteRequest request) {
        var pickup = request.getPickup();
        var settings = request.getSettings();
        var window = pickup.operatingWindow();

        return new RouteContext(
            pickup.location(),
            window.startMinutes(),
            window.endMinutes(),
            settings.getVehicleSpeedKmph(),
            settings.getTimePerStopMinutes(),
            settings.isReturnToOrigin(),
            settings.getOptimizeBy()
        );
    }
}
