package org.mides.routing.solver;

import org.mides.routing.config.EngineConfig;
import org.mides.routing.model.Delivery;
import org.mides.routing.model.SkipReason;
import org.mides.routing.model.TimeWindow;
import org.mides.routing.util.GeoMetrics;

/**
 * Decides whether a delivery can follow the current end of a route without breaking a
 * hard constraint. Constraints are checked in a fixed order and the first violation is
 * reported: time window (including service running past midnight), cumulative distance,
 * cumulative time, then the return leg.
 */
public class FeasibilityChecker {

    static final double EPSILON = 1e-9;

    private final EngineConfig config;
    private final RouteContext context;

    public FeasibilityChecker(EngineConfig config, RouteContext context) {
        this.config = config;
        this.context = context;
    }

    public RouteState initialState() {
        return RouteState.atDepot(context);
    }

    public RouteContext context() {
        return context;
    }

    public FeasibilityResult check(RouteState state, Delivery candidate) {
        double legKm = GeoMetrics.distanceKm(state.getLocation(), candidate.location());
        double legMinutes = GeoMetrics.travelMinutes(state.getLocation(), candidate.location(), context.getSpeedKmh());
        TimeWindow window = candidate.getTimeWindow();

        double reached = state.getClockMinutes() + legMinutes;
        if (reached > window.endMinutes() + EPSILON)
            return FeasibilityResult.reject(candidate, SkipReason.TIME_WINDOW_VIOLATED, legKm, legMinutes);

        double arrival = Math.max(reached, window.startMinutes());
        double wait = arrival - reached;
        double departure = arrival + context.getServiceMinutes();

        /* Service must finish on the same day */
        if (departure > TimeWindow.MINUTES_PER_DAY + EPSILON)
            return FeasibilityResult.reject(candidate, SkipReason.TIME_WINDOW_VIOLATED, legKm, legMinutes);

        double distance = state.getDistanceKm() + legKm;
        if (distance > config.getMaxRouteDistanceKm() + EPSILON)
            return FeasibilityResult.reject(candidate, SkipReason.MAX_DISTANCE_EXCEEDED, legKm, legMinutes);

        double elapsed = arrival - context.getStartMinutes();
        if (elapsed > config.maxTravelMinutes() + EPSILON)
            return FeasibilityResult.reject(candidate, SkipReason.MAX_TIME_EXCEEDED, legKm, legMinutes);

        if (context.isReturnToOrigin()) {
            double back = departure + GeoMetrics.travelMinutes(candidate.location(), context.getDepot(), context.getSpeedKmh());
            if (back > context.getEndMinutes() + EPSILON)
                return FeasibilityResult.reject(candidate, SkipReason.RETURN_INFEASIBLE, legKm, legMinutes);
        }

        var next = new RouteState(candidate.location(), departure, distance, departure - context.getStartMinutes());
        return FeasibilityResult.admit(candidate, legKm, legMinutes, arrival, wait, departure, next);
    }
}
