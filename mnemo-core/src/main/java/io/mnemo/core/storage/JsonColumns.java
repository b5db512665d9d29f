package io.mnemo.core.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

public final class JsonColumns {
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> METADATA = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public JsonColumns(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String writeList(List<String> values) throws SQLException {
        return write(values == null ? List.of() : values);
    }

    public String writeMap(Map<String, Object> values) throws SQLException {
        return write(values == null ? Map.of() : values);
    }

    public List<String> readList(String json) throws SQLException {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return mapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt observation list: " + e.getOriginalMessage(), e);
        }
    }

    public Map<String, Object> readMap(String json) throws SQLException {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(json, METADATA);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt metadata column: " + e.getOriginalMessage(), e);
        }
    }

    private String write(Object value) throws SQLException {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SQLException("Failed to encode JSON column: " + e.getOriginalMessage(), e);
        }
    }
}
