package org.mides.routing.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class SpringConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(SpringConfiguration.class);

    @Bean
    public EngineConfig engineConfig(RoutingConfiguration routing, PriorityConfiguration priority) {
        var config = EngineConfig.builder()
            .maxTravelTimeHours(routing.getMaxTravelTimeHours())
            .defaultSpeedKmh(routing.getDefaultSpeedKmh())
            .bufferTimeMinutes(routing.getBufferTimeMinutes())
            .maxRouteDistanceKm(routing.getMaxRouteDistanceKm())
            .defaultServiceTimeMinutes(routing.getDefaultServiceTimeMinutes())
            .improvementIterationLimit(routing.getImprovementIterationLimit())
            .highPriorityWeight(priority.getHighPriorityWeight())
            .mediumPriorityWeight(priority.getMediumPriorityWeight())
            .lowPriorityWeight(priority.getLowPriorityWeight())
            .penaltyMissingHighPriority(priority.getPenaltyMissingHighPriority())
            .penaltyMissingMediumPriority(priority.getPenaltyMissingMediumPriority())
            .penaltyMissingLowPriority(priority.getPenaltyMissingLowPriority())
            .build();

        config.validate();
        logger.info("Routing engine configured: {}", config);
        return config;
    }

    @Bean
    public ExecutorService executorService(RoutingConfiguration routing) {
        if (routing.getWorkerThreads() <= 0)
            throw new IllegalStateException("routing.worker-threads must be positive");

        return Executors.newFixedThreadPool(routing.getWorkerThreads());
    }
}
