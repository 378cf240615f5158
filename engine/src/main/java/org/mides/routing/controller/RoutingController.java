package org.mides.routing.controller;

import jakarta.validation.Valid;
import org.mides.routing.config.EngineConfig;
import org.mides.routing.exception.RouteSolverException;
import org.mides.routing.model.ApiInfo;
import org.mides.routing.model.DistanceMatrixRequest;
import org.mides.routing.model.DistanceMatrixResponse;
import org.mides.routing.model.ExampleRequests;
import org.mides.routing.model.HealthStatus;
import org.mides.routing.model.OptimizationResult;
import org.mides.routing.model.RouteRequest;
import org.mides.routing.service.IDistanceMatrixService;
import org.mides.routing.service.IRouteSolverService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

@Validated
@RestController
@CrossOrigin(origins = "*")
@RequestMapping("routing/v1")
public class RoutingController {

    private static final Logger logger = LoggerFactory.getLogger(RoutingController.class);

    private static final String API_VERSION = "1.0.0";

    private final IRouteSolverService routeSolverService;
    private final IDistanceMatrixService distanceMatrixService;
    private final EngineConfig engineConfig;
    private final ExecutorService executorService;

    @Autowired
    public RoutingController(
        IRouteSolverService routeSolverService,
        IDistanceMatrixService distanceMatrixService,
        EngineConfig engineConfig,
        ExecutorService executorService)
    {
        this.routeSolverService = routeSolverService;
        this.distanceMatrixService = distanceMatrixService;
        this.engineConfig = engineConfig;
        this.executorService = executorService;
    }

    @PostMapping("/optimize-route")
    public CompletableFuture<ResponseEntity<OptimizationResult>> optimizeRoute(@RequestBody @Valid RouteRequest request) {
        request.initialize(engineConfig);
        logger.info("Received optimization request for {} deliveries", request.getDeliveries().size());

        return CompletableFuture.supplyAsync(() -> {
            try {
                return routeSolverService.solve(request);
            } catch (RuntimeException e) {
                throw new RouteSolverException("Route solver failed", e);
            }
        }, executorService).thenApply(ResponseEntity::ok);
    }

    @GetMapping
    public ResponseEntity<ApiInfo> info() {
        var endpoints = new LinkedHashMap<String, String>();
        endpoints.put("/optimize-route", "POST - Optimize delivery route");
        endpoints.put("/distance-matrix", "POST - Calculate distance/time matrix");
        endpoints.put("/calculate-distance-matrix", "POST - Same as /distance-matrix");
        endpoints.put("/health", "GET - Health check");
        endpoints.put("/example-data", "GET - Sample optimization request");
        endpoints.put("/config", "GET - Effective engine configuration");

        return ResponseEntity.ok(new ApiInfo(
            "Delivery Routing API",
            API_VERSION,
            "Single-vehicle delivery routing with time windows and priorities",
            endpoints
        ));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthStatus> health() {
        var summary = new HealthStatus.Summary(
            engineConfig.getMaxTravelTimeHours(),
            engineConfig.getDefaultSpeedKmh(),
            engineConfig.getHighPriorityWeight()
        );
        double timestamp = System.currentTimeMillis() / 1000.0;
        return ResponseEntity.ok(new HealthStatus("healthy", timestamp, summary));
    }

    @GetMapping("/example-data")
    public ResponseEntity<RouteRequest> exampleData() {
        return ResponseEntity.ok(ExampleRequests.mumbai());
    }

    @PostMapping({"/distance-matrix", "/calculate-distance-matrix"})
    public ResponseEntity<DistanceMatrixResponse> distanceMatrix(@RequestBody @Valid DistanceMatrixRequest request) {
        return ResponseEntity.ok(distanceMatrixService.queryMatrix(request.getPoints(), request.getSpeedKmph()));
    }

    @GetMapping("/config")
    public ResponseEntity<EngineConfig> config() {
        return ResponseEntity.ok(engineConfig);
    }
}
