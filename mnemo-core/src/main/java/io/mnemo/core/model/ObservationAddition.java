package io.mnemo.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ObservationAddition(String entityName, List<String> contents) {

    public ObservationAddition {
        contents = contents == null ? List.of() : List.copyOf(contents);
    }
}
