package org.mides.routing.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HealthStatus {

    @JsonProperty("status")
    private String status;

    /* Seconds since the epoch */
    @JsonProperty("timestamp")
    private double timestamp;

    @JsonProperty("config")
    private Summary config;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {

        @JsonProperty("max_travel_time_hours")
        private double maxTravelTimeHours;

        @JsonProperty("default_speed_kmh")
        private double defaultSpeedKmh;

        @JsonProperty("high_priority_weight")
        private double highPriorityWeight;
    }
}
