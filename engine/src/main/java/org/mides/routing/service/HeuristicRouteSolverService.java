package org.mides.routing.service;

import org.mides.routing.config.EngineConfig;
import org.mides.routing.model.OptimizationResult;
import org.mides.routing.model.RouteRequest;
import org.mides.routing.solver.ResultAssembler;
import org.mides.routing.solver.RouteSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Construction plus local search, with no external solver. Every call works on its own
 * request objects, so concurrent solves share nothing but the read-only configuration.
 */
@Service
public class HeuristicRouteSolverService implements IRouteSolverService {

    private static final Logger logger = LoggerFactory.getLogger(HeuristicRouteSolverService.class);

    private final EngineConfig engineConfig;
    private final RouteSolver routeSolver;
    private final ResultAssembler resultAssembler;

    @Autowired
    public HeuristicRouteSolverService(EngineConfig engineConfig) {
        this.engineConfig = engineConfig;
        this.routeSolver = new RouteSolver(engineConfig);
        this.resultAssembler = new ResultAssembler();
    }

    @Override
    public OptimizationResult solve(RouteRequest request) {
        if (!request.isInitialized())
            request.initialize(engineConfig);

        long started = System.nanoTime();
        var solved = routeSolver.solve(request);
        double processingTimeSeconds = (System.nanoTime() - started) / 1_000_000_000.0;

        var result = resultAssembler.assemble(request, solved, processingTimeSeconds);
        logger.info("Solved {} deliveries by {}: {} routed, {} skipped, feasible={}, {} km, {} min in {}s",
            request.getDeliveries().size(),
            request.getSettings().getOptimizeBy(),
            solved.getEvaluation().getVisits().size(),
            result.getSkippedDeliveries().size(),
            result.isFeasible(),
            result.getTotalDistanceKm(),
            result.getTotalTimeMinutes(),
            String.format("%.3f", processingTimeSeconds));
        return result;
    }
}
