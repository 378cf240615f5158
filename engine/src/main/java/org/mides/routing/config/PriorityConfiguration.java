package org.mides.routing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "priority")
public class PriorityConfiguration {
    private double highPriorityWeight = 1000.0;
    private double mediumPriorityWeight = 100.0;
    private double lowPriorityWeight = 1.0;
    private double penaltyMissingHighPriority = 10000.0;
    private double penaltyMissingMediumPriority = 1000.0;
    private double penaltyMissingLowPriority = 50.0;
}
