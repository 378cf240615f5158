package org.mides.routing.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.Builder;
import lombok.Value;
import org.mides.routing.converter.PrioritySerializer;
import org.mides.routing.converter.SkipReasonSerializer;

@Value
@Builder
public class SkippedDelivery {

    @JsonProperty("address")
    String address;

    @JsonProperty("zipcode")
    String zipcode;

    @JsonProperty("lat")
    Double lat;

    @JsonProperty("lng")
    Double lng;

    @JsonProperty("priority")
    @JsonSerialize(using = PrioritySerializer.class)
    Priority priority;

    @JsonProperty("time_window")
    TimeWindow timeWindow;

    @JsonProperty("reason")
    @JsonSerialize(using = SkipReasonSerializer.class)
    SkipReason reason;

    @JsonIgnore
    Delivery delivery;

    public static SkippedDelivery of(Delivery delivery, SkipReason reason) {
        return SkippedDelivery.builder()
            .address(delivery.getAddress())
            .zipcode(delivery.getZipcode())
            .lat(delivery.getLat())
            .lng(delivery.getLng())
            .priority(delivery.getPriority())
            .timeWindow(delivery.getTimeWindow())
            .reason(reason)
            .delivery(delivery)
            .build();
    }
}
