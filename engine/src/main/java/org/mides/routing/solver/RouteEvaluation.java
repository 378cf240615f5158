package org.mides.routing.solver;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.mides.routing.model.Delivery;
import org.mides.routing.model.OptimizeBy;
import org.mides.routing.model.SkipReason;
import org.mides.routing.util.GeoMetrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A complete ordering replayed stop by stop through the {@link FeasibilityChecker}.
 * An infeasible evaluation records where replay stopped and why; its totals are not
 * meaningful.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RouteEvaluation {
    RouteContext context;
    List<FeasibilityResult> visits;
    /* Null when the route does not go back to the depot */
    ReturnLeg returnLeg;
    int failedIndex;
    SkipReason failure;

    public static RouteEvaluation of(List<Delivery> order, FeasibilityChecker checker) {
        var context = checker.context();
        var visits = new ArrayList<FeasibilityResult>(order.size());
        var state = checker.initialState();

        for (int i = 0; i < order.size(); i++) {
            var result = checker.check(state, order.get(i));
            if (!result.isAdmitted())
                return new RouteEvaluation(context, Collections.unmodifiableList(visits), null, i, result.getRejection());

            visits.add(result);
            state = result.getNext();
        }

        ReturnLeg returnLeg = null;
        if (context.isReturnToOrigin()) {
            double km = GeoMetrics.distanceKm(state.getLocation(), context.getDepot());
            double minutes = GeoMetrics.travelMinutes(km, context.getSpeedKmh());
            double arrival = state.getClockMinutes() + minutes;
            returnLeg = new ReturnLeg(km, minutes, arrival, arrival <= context.getEndMinutes() + FeasibilityChecker.EPSILON);
        }

        if (returnLeg != null && !returnLeg.isOnTime())
            return new RouteEvaluation(context, Collections.unmodifiableList(visits), returnLeg,
                order.size(), SkipReason.RETURN_INFEASIBLE);

        return new RouteEvaluation(context, Collections.unmodifiableList(visits), returnLeg, -1, null);
    }

    public boolean isFeasible() {
        return failure == null;
    }

    /* Distance driven up to the last delivery, the figure the distance cap applies to */
    public double deliveryDistanceKm() {
        return visits.isEmpty() ? 0.0 : visits.get(visits.size() - 1).getNext().getDistanceKm();
    }

    public double totalDistanceKm() {
        return deliveryDistanceKm() + (returnLeg != null ? returnLeg.getDistanceKm() : 0.0);
    }

    public double endMinutes() {
        if (returnLeg != null)
            return returnLeg.getArrivalMinutes();
        return visits.isEmpty() ? context.getStartMinutes() : visits.get(visits.size() - 1).getDepartureMinutes();
    }

    public double totalMinutes() {
        return endMinutes() - context.getStartMinutes();
    }

    public double departureAfter(int position) {
        return position == 0 ? context.getStartMinutes() : visits.get(position - 1).getDepartureMinutes();
    }

    public double travelCost(OptimizeBy optimizeBy) {
        return optimizeBy.travelCost(totalDistanceKm(), totalMinutes());
    }
}
