package org.mides.routing.converter;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import org.mides.routing.model.OptimizeBy;

import java.io.IOException;
import java.util.Locale;

public class OptimizeByDeserializer extends JsonDeserializer<OptimizeBy> {

    @Override
    public OptimizeBy deserialize(JsonParser p, DeserializationContext context) throws IOException {
        String method = p.getText();
        try {
            return OptimizeBy.valueOf(method.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidFormatException(p,
                "optimize_by must be one of distance, time, priority but got '" + method + "'",
                method, OptimizeBy.class);
        }
    }
}
