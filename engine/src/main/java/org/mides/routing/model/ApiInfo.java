package org.mides.routing.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiInfo {

    @JsonProperty("message")
    private String message;

    @JsonProperty("version")
    private String version;

    @JsonProperty("description")
    private String description;

    /* Path to a short "METHOD - purpose" line */
    @JsonProperty("endpoints")
    private Map<String, String> endpoints;
}
