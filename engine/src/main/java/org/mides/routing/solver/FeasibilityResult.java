package org.mides.routing.solver;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.mides.routing.model.Delivery;
import org.mides.routing.model.SkipReason;

/**
 * Outcome of appending one delivery to a partial route: either the admitted visit
 * with its schedule, or the first constraint it broke.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FeasibilityResult {
    Delivery delivery;
    SkipReason rejection;
    double legDistanceKm;
    double legMinutes;
    /* Service start, after any wait for the window to open */
    double arrivalMinutes;
    double waitMinutes;
    double departureMinutes;
    RouteState next;

    static FeasibilityResult admit(Delivery delivery, double legDistanceKm, double legMinutes,
                                   double arrivalMinutes, double waitMinutes, double departureMinutes,
                                   RouteState next) {
        return new FeasibilityResult(delivery, null, legDistanceKm, legMinutes,
            arrivalMinutes, waitMinutes, departureMinutes, next);
    }

    static FeasibilityResult reject(Delivery delivery, SkipReason reason, double legDistanceKm, double legMinutes) {
        return new FeasibilityResult(delivery, reason, legDistanceKm, legMinutes, Double.NaN, Double.NaN, Double.NaN, null);
    }

    public boolean isAdmitted() {
        return rejection == null;
    }
}
