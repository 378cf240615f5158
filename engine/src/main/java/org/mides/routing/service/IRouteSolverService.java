package org.mides.routing.service;

import org.mides.routing.model.OptimizationResult;
import org.mides.routing.model.RouteRequest;

public interface IRouteSolverService {
    OptimizationResult solve(RouteRequest request);
}
