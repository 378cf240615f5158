package org.mides.routing.converter;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.time.Duration;

/**
 * Writes an offset from midnight as {@code HH:MM}. Offsets past midnight are not wrapped.
 */
public class DurationSerializer extends JsonSerializer<Duration> {

    @Override
    public void serialize(Duration duration, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        gen.writeString(format(duration));
    }

    public static String format(Duration duration) {
        long minutes = duration.toMinutes();
        return String.format("%02d:%02d", minutes / 60, minutes % 60);
    }
}
