package org.mides.routing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "routing")
public class RoutingConfiguration {
    private double maxTravelTimeHours = 4.0;
    private double defaultSpeedKmh = 50.0;
    private double bufferTimeMinutes = 15.0;
    private double maxRouteDistanceKm = 200.0;
    private int defaultServiceTimeMinutes = 10;
    private int improvementIterationLimit = 100;
    private int workerThreads = 10;
}
