package org.mides.routing.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mides.routing.converter.DurationDeserializer;
import org.mides.routing.converter.DurationSerializer;

import java.time.Duration;

@Data
@NoArgsConstructor
public class TimeWindow {
    public static final long MINUTES_PER_DAY = 24 * 60;

    @NotNull
    @JsonProperty("start")
    @JsonDeserialize(using = DurationDeserializer.class)
    @JsonSerialize(using = DurationSerializer.class)
    private Duration start;

    @NotNull
    @JsonProperty("end")
    @JsonDeserialize(using = DurationDeserializer.class)
    @JsonSerialize(using = DurationSerializer.class)
    private Duration end;

    public TimeWindow(Duration start, Duration end) {
        this.start = start;
        this.end = end;
    }

    public static TimeWindow of(String start, String end) {
        return new TimeWindow(parse(start), parse(end));
    }

    public double startMinutes() {
        return start.toMillis() / 60_000.0;
    }

    public double endMinutes() {
        return end.toMillis() / 60_000.0;
    }

    @JsonIgnore
    public boolean isOrdered() {
        return start != null && end != null && start.compareTo(end) < 0;
    }

    private static Duration parse(String hhmm) {
        String[] parts = hhmm.split(":");
        return Duration.ofHours(Integer.parseInt(parts[0])).plusMinutes(Integer.parseInt(parts[1]));
    }
}
