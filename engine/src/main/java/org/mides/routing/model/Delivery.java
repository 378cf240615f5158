package org.mides.routing.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mides.routing.converter.PriorityDeserializer;
import org.mides.routing.converter.PrioritySerializer;

@Data
@NoArgsConstructor
public class Delivery {

    @JsonProperty("address")
    private String address;

    @JsonProperty("zipcode")
    private String zipcode;

    @NotNull
    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    @JsonProperty("lat")
    private Double lat;

    @NotNull
    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    @JsonProperty("lng")
    private Double lng;

    @NotNull
    @JsonProperty("priority")
    @JsonDeserialize(using = PriorityDeserializer.class)
    @JsonSerialize(using = PrioritySerializer.class)
    private Priority priority;

    @NotNull
    @Valid
    @JsonProperty("time_window")
    private TimeWindow timeWindow;

    /* Position in the request, assigned by RouteRequest.initialize() */
    @JsonIgnore
    private int index;

    public Delivery(String address, String zipcode, double lat, double lng, Priority priority, TimeWindow timeWindow) {
        this.address = address;
        this.zipcode = zipcode;
        this.lat = lat;
        this.lng = lng;
        this.priority = priority;
        this.timeWindow = timeWindow;
    }

    public GeoPoint location() {
        return GeoPoint.of(lat, lng);
    }

    @Override
    public String toString() {
        return String.format("%s[%s]", address != null ? address : "#" + index, priority);
    }
}
