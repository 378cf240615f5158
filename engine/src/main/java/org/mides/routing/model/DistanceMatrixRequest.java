package org.mides.routing.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class DistanceMatrixRequest {

    @NotNull
    @Size(min = 2, message = "At least 2 points are required")
    @JsonProperty("points")
    private List<@Valid @NotNull GeoPoint> points = new ArrayList<>();

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("200.0")
    @JsonProperty("speed_kmph")
    private Double speedKmph;
}
