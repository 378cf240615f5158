package org.mides.routing.solver;

import org.mides.routing.model.OptimizationMetrics;
import org.mides.routing.model.OptimizationResult;
import org.mides.routing.model.Pickup;
import org.mides.routing.model.RouteRequest;
import org.mides.routing.model.Stop;
import org.mides.routing.util.Utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link SolvedRoute} into the response payload: timestamped stops from the
 * depot departure to the optional return, leg totals and run metrics.
 */
public class ResultAssembler {

    public OptimizationResult assemble(RouteRequest request, SolvedRoute solved, double processingTimeSeconds) {
        var evaluation = solved.getEvaluation();
        var context = evaluation.getContext();
        var pickup = request.getPickup();

        List<Stop> route = new ArrayList<>();
        route.add(depotStop(pickup, pickup.getAddress(), context.getStartMinutes()));

        for (var visit : evaluation.getVisits()) {
            var delivery = visit.getDelivery();
            var arrival = Utils.minutesToDuration(visit.getArrivalMinutes());
            route.add(Stop.builder()
                .stop(delivery.getAddress())
                .zipcode(delivery.getZipcode())
                .arrivalTime(arrival)
                .departureTime(arrival.plusMinutes(context.getServiceMinutes()))
                .address(delivery.getAddress())
                .lat(delivery.getLat())
                .lng(delivery.getLng())
                .priority(delivery.getPriority())
                .delivery(delivery)
                .build());
        }

        if (evaluation.getReturnLeg() != null)
            route.add(depotStop(pickup, pickup.getAddress() + " (Return)", evaluation.getReturnLeg().getArrivalMinutes()));

        var result = new OptimizationResult();
        result.setRoute(route);
        result.setTotalDistanceKm(Utils.round3(evaluation.totalDistanceKm()));
        result.setTotalTimeMinutes(Utils.round3(evaluation.totalMinutes()));
        result.setFeasible(solved.isFeasible());
        result.setSkippedDeliveries(new ArrayList<>(solved.getSkipped()));
        result.setOptimizationMetrics(new OptimizationMetrics(
            processingTimeSeconds,
            context.getOptimizeBy(),
            route.size(),
            solved.getSkipped().size()
        ));
        return result;
    }

    /* The depot is never serviced, so departure equals arrival */
    private static Stop depotStop(Pickup pickup, String name, double minutes) {
        var time = Utils.minutesToDuration(minutes);
        return Stop.builder()
            .stop(name)
            .zipcode(pickup.getZipcode())
            .arrivalTime(time)
            .departureTime(time)
            .address(pickup.getAddress())
            .lat(pickup.getLat())
            .lng(pickup.getLng())
            .build();
    }
}
