package org.mides.routing.converter;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import org.mides.routing.model.OptimizeBy;

import java.io.IOException;
import java.util.Locale;

public class OptimizeBySerializer extends JsonSerializer<OptimizeBy> {

    @Override
    public void serialize(OptimizeBy optimizeBy, JsonGenerator gen, SerializerProvider serializer) throws IOException {
        gen.writeString(optimizeBy.name().toLowerCase(Locale.ROOT));
    }
}
