package org.mides.routing.converter;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import org.mides.routing.model.Priority;

import java.io.IOException;

/**
 * Reads a priority tier from its numeric level (1 = high, 3 = low).
 */
public class PriorityDeserializer extends JsonDeserializer<Priority> {

    @Override
    public Priority deserialize(JsonParser p, DeserializationContext context) throws IOException {
        if (p.currentToken() != JsonToken.VALUE_NUMBER_INT)
            throw new InvalidFormatException(p, "priority must be an integer between 1 and 3", p.getText(), Priority.class);

        int level = p.getIntValue();
        try {
            return Priority.fromLevel(level);
        } catch (IllegalArgumentException e) {
            throw new InvalidFormatException(p, e.getMessage(), level, Priority.class);
        }
    }
}
