package org.mides.routing.solver;

import org.mides.routing.config.EngineConfig;
import org.mides.routing.model.Priority;

/**
 * Inclusion weight and skip penalty of each priority tier, read from configuration.
 * HIGH has both the largest weight and the largest skip penalty, LOW the smallest of each;
 * {@link EngineConfig#validate()} enforces that ordering.
 */
public class PriorityModel {

    private final EngineConfig config;

    public PriorityModel(EngineConfig config) {
        this.config = config;
    }

    public double weight(Priority priority) {
        switch (priority) {
            case HIGH:
                return config.getHighPriorityWeight();
            case MEDIUM:
                return config.getMediumPriorityWeight();
            default:
                return config.getLowPriorityWeight();
        }
    }

    public double penalty(Priority priority) {
        switch (priority) {
            case HIGH:
                return config.getPenaltyMissingHighPriority();
            case MEDIUM:
                return config.getPenaltyMissingMediumPriority();
            default:
                return config.getPenaltyMissingLowPriority();
        }
    }
}
