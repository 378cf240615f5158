package org.mides.routing.converter;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import org.mides.routing.model.SkipReason;

import java.io.IOException;
import java.util.Locale;

public class SkipReasonSerializer extends JsonSerializer<SkipReason> {

    @Override
    public void serialize(SkipReason reason, JsonGenerator gen, SerializerProvider serializer) throws IOException {
        gen.writeString(reason.name().toLowerCase(Locale.ROOT));
    }
}
