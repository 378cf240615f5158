package org.mides.routing.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mides.routing.converter.OptimizeBySerializer;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationMetrics {

    @JsonProperty("processing_time_seconds")
    private double processingTimeSeconds;

    @JsonProperty("optimization_method")
    @JsonSerialize(using = OptimizeBySerializer.class)
    private OptimizeBy optimizationMethod;

    @JsonProperty("total_stops")
    private int totalStops;

    @JsonProperty("skipped_stops")
    private int skippedStops;
}
