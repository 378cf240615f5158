package org.mides.routing.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mides.routing.converter.OptimizeByDeserializer;
import org.mides.routing.converter.OptimizeBySerializer;

/**
 * Per-request vehicle settings. Missing service time and speed fall back to the
 * engine defaults when the request is initialized.
 */
@Data
@NoArgsConstructor
public class Settings {

    @JsonProperty("return_to_origin")
    private boolean returnToOrigin = true;

    @Min(1)
    @Max(120)
    @JsonProperty("time_per_stop_minutes")
    private Integer timePerStopMinutes;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("200.0")
    @JsonProperty("vehicle_speed_kmph")
    private Double vehicleSpeedKmph;

    @JsonProperty("optimize_by")
    @JsonDeserialize(using = OptimizeByDeserializer.class)
    @JsonSerialize(using = OptimizeBySerializer.class)
    private OptimizeBy optimizeBy = OptimizeBy.PRIORITY;

    public Settings(boolean returnToOrigin, int timePerStopMinutes, double vehicleSpeedKmph, OptimizeBy optimizeBy) {
        this.returnToOrigin = returnToOrigin;
        this.timePerStopMinutes = timePerStopMinutes;
        this.vehicleSpeedKmph = vehicleSpeedKmph;
        this.optimizeBy = optimizeBy;
    }
}
