package org.mides.routing.converter;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * Reads a wall-clock {@code HH:MM} string as the offset from midnight.
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm")
        .withResolverStyle(ResolverStyle.STRICT);

    @Override
    public Duration deserialize(JsonParser p, DeserializationContext context) throws IOException {
        String text = p.getText();
        try {
            LocalTime time = LocalTime.parse(text, TIME_FORMATTER);
            return Duration.between(LocalTime.MIDNIGHT, time);
        } catch (DateTimeParseException e) {
            throw new InvalidFormatException(p, "Expected time as HH:MM but got '" + text + "'", text, Duration.class);
        }
    }
}
