package org.mides.routing.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mides.routing.converter.DurationDeserializer;
import org.mides.routing.converter.DurationSerializer;

import java.time.Duration;

/**
 * The depot the vehicle leaves from, and returns to when the settings ask for it.
 */
@Data
@NoArgsConstructor
public class Pickup {

    @NotBlank
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
    @JsonProperty("start_time")
    @JsonDeserialize(using = DurationDeserializer.class)
    @JsonSerialize(using = DurationSerializer.class)
    private Duration startTime;

    @NotNull
    @JsonProperty("end_time")
    @JsonDeserialize(using = DurationDeserializer.class)
    @JsonSerialize(using = DurationSerializer.class)
    private Duration endTime;

    public Pickup(String address, String zipcode, double lat, double lng, TimeWindow operatingWindow) {
        this.address = address;
        this.zipcode = zipcode;
        this.lat = lat;
        this.lng = lng;
        this.startTime = operatingWindow.getStart();
        this.endTime = operatingWindow.getEnd();
    }

    public GeoPoint location() {
        return GeoPoint.of(lat, lng);
    }

    public TimeWindow operatingWindow() {
        return new TimeWindow(startTime, endTime);
    }
}
