package org.mides.routing.solver;

import lombok.Value;
import org.mides.routing.model.SkippedDelivery;

import java.util.List;

/**
 * Output of {@link RouteSolver}: the final feasible ordering with its schedule and
 * the deliveries left out.
 */
@Value
public class SolvedRoute {
    RouteEvaluation evaluation;
    List<SkippedDelivery> skipped;
    boolean feasible;
}
