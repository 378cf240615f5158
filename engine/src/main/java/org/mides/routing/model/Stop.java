package org.mides.routing.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.Builder;
import lombok.Value;
import org.mides.routing.converter.DurationSerializer;
import org.mides.routing.converter.PrioritySerializer;

import java.time.Duration;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Stop {

    @JsonProperty("stop")
    String stop;

    @JsonProperty("zipcode")
    String zipcode;

    @JsonProperty("arrival_time")
    @JsonSerialize(using = DurationSerializer.class)
    Duration arrivalTime;

    @JsonProperty("departure_time")
    @JsonSerialize(using = DurationSerializer.class)
    Duration departureTime;

    @JsonProperty("address")
    String address;

    @JsonProperty("lat")
    Double lat;

    @JsonProperty("lng")
    Double lng;

    @JsonProperty("priority")
    @JsonSerialize(using = PrioritySerializer.class)
    Priority priority;

    /* Null for the depot at either end of the route */
    @JsonIgnore
    Delivery delivery;

    @JsonIgnore
    public boolean isDepot() {
        return delivery == null;
    }
}
