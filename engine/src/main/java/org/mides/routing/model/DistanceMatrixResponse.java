package org.mides.routing.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DistanceMatrixResponse {

    /* Kilometres, row = origin */
    @JsonProperty("distances")
    private List<List<Double>> distances;

    /* Minutes at the requested speed */
    @JsonProperty("times")
    private List<List<Double>> times;

    @JsonProperty("points")
    private List<GeoPoint> points;
}
