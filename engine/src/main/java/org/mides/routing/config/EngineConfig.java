package org.mides.routing.config;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only engine configuration shared by every solve.
 * <p>
 * Built once at startup from {@link RoutingConfiguration} and {@link PriorityConfiguration},
 * or from {@link #defaults()} outside of Spring. Weights and skip penalties are per priority
 * tier; penalties are expressed in the unit of the travel cost being minimized (km for
 * distance and priority solves, minutes for time solves).
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EngineConfig {

    double maxTravelTimeHours;
    double defaultSpeedKmh;
    double bufferTimeMinutes;
    double maxRouteDistanceKm;
    int defaultServiceTimeMinutes;
    int improvementIterationLimit;

    double highPriorityWeight;
    double mediumPriorityWeight;
    double lowPriorityWeight;

    double penaltyMissingHighPriority;
    double penaltyMissingMediumPriority;
    double penaltyMissingLowPriority;

    public static EngineConfig defaults() {
        return EngineConfig.builder()
            .maxTravelTimeHours(4.0)
            .defaultSpeedKmh(50.0)
            .bufferTimeMinutes(15.0)
            .maxRouteDistanceKm(200.0)
            .defaultServiceTimeMinutes(10)
            .improvementIterationLimit(100)
            .highPriorityWeight(1000.0)
            .mediumPriorityWeight(100.0)
            .lowPriorityWeight(1.0)
            .penaltyMissingHighPriority(10000.0)
            .penaltyMissingMediumPriority(1000.0)
            .penaltyMissingLowPriority(50.0)
            .build();
    }

    public double maxTravelMinutes() {
        return maxTravelTimeHours * 60.0;
    }

    /**
     * Checks the invariants the solver relies on.
     *
     * @throws IllegalStateException naming the first offending setting
     */
    public void validate() {
        requirePositive(maxTravelTimeHours, "max travel time hours");
        requirePositive(defaultSpeedKmh, "default speed");
        requirePositive(maxRouteDistanceKm, "max route distance");
        requirePositive(defaultServiceTimeMinutes, "default service time");
        requirePositive(improvementIterationLimit, "improvement iteration limit");

        if (bufferTimeMinutes < 0)
            throw new IllegalStateException("Buffer time must not be negative, got " + bufferTimeMinutes);

        if (!(highPriorityWeight > mediumPriorityWeight && mediumPriorityWeight > lowPriorityWeight && lowPriorityWeight > 0))
            throw new IllegalStateException(String.format(
                "Priority weights must satisfy HIGH > MEDIUM > LOW > 0, got %s/%s/%s",
                highPriorityWeight, mediumPriorityWeight, lowPriorityWeight));

        if (!(penaltyMissingHighPriority > penaltyMissingMediumPriority
            && penaltyMissingMediumPriority > penaltyMissingLowPriority
            && penaltyMissingLowPriority >= 0))
            throw new IllegalStateException(String.format(
                "Skip penalties must satisfy HIGH > MEDIUM > LOW >= 0, got %s/%s/%s",
                penaltyMissingHighPriority, penaltyMissingMediumPriority, penaltyMissingLowPriority));
    }

    private static void requirePositive(double value, String name) {
        if (!(value > 0))
            throw new IllegalStateException(String.format("Configured %s must be positive, got %s", name, value));
    }
}
