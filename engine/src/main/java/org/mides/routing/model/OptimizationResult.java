package org.mides.routing.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class OptimizationResult {

    @JsonProperty("route")
    private List<Stop> route = new ArrayList<>();

    @JsonProperty("total_distance_km")
    private double totalDistanceKm;

    @JsonProperty("total_time_minutes")
    private double totalTimeMinutes;

    @JsonProperty("is_feasible")
    private boolean feasible;

    @JsonProperty("skipped_deliveries")
    private List<SkippedDelivery> skippedDeliveries = new ArrayList<>();

    @JsonProperty("optimization_metrics")
    private OptimizationMetrics optimizationMetrics;
}
