package org.mides.routing.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.mides.routing.config.EngineConfig;
import org.mides.routing.exception.InvalidRequestException;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class RouteRequest {

    @NotNull
    @Valid
    @JsonProperty("pickup")
    private Pickup pickup;

    @NotNull
    @Valid
    @JsonProperty("settings")
    private Settings settings = new Settings();

    @NotEmpty
    @Valid
    @JsonProperty("deliveries")
    private List<Delivery> deliveries = new ArrayList<>();

    @JsonIgnore
    @Setter(AccessLevel.PRIVATE)
    private boolean initialized;

    public RouteRequest(Pickup pickup, Settings settings, List<Delivery> deliveries) {
        this.pickup = pickup;
        this.settings = settings;
        this.deliveries = new ArrayList<>(deliveries);
    }

    /**
     * Checks the cross-field rules bean validation cannot express, fills unset settings
     * from the engine defaults and numbers the deliveries in request order.
     *
     * @throws InvalidRequestException if a time window is empty or reversed
     */
    public void initialize(EngineConfig config) {
        if (deliveries == null || deliveries.isEmpty())
            throw new InvalidRequestException("At least one delivery is required");

        if (!pickup.operatingWindow().isOrdered())
            throw new InvalidRequestException(
                String.format("Pickup %s has start_time not before end_time", pickup.getAddress()));

        if (settings.getTimePerStopMinutes() == null)
            settings.setTimePerStopMinutes(config.getDefaultServiceTimeMinutes());
        if (settings.getVehicleSpeedKmph() == null)
            settings.setVehicleSpeedKmph(config.getDefaultSpeedKmh());
        if (settings.getOptimizeBy() == null)
            settings.setOptimizeBy(OptimizeBy.PRIORITY);

        int index = 0;
        for (Delivery delivery : deliveries) {
            if (delivery.getTimeWindow() == null || !delivery.getTimeWindow().isOrdered())
                throw new InvalidRequestException(
                    String.format("Error with time window from delivery %d (%s)", index, delivery.getAddress()));

            delivery.setIndex(index);
            index = index + 1;
        }

        initialized = true;
    }
}
