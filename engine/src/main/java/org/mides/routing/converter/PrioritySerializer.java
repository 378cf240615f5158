package org.mides.routing.converter;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import org.mides.routing.model.Priority;

import java.io.IOException;

public class PrioritySerializer extends JsonSerializer<Priority> {

    @Override
    public void serialize(Priority priority, JsonGenerator gen, SerializerProvider serializer) throws IOException {
        gen.writeNumber(priority.getLevel());
    }
}
