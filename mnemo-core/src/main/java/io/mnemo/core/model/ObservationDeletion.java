package io.mnemo.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ObservationDeletion(String entityName, List<String> observations) {

    public ObservationDeletion {
        observations = observations == null ? List.of() : List.copyOf(observations);
    }
}
