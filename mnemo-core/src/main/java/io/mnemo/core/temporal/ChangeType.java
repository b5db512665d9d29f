package io.mnemo.core.temporal;

import java.util.Locale;
import java.util.Optional;

public enum ChangeType {
    CREATE,
    UPDATE,
    DELETE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ChangeType> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        for (ChangeType type : values()) {
            if (type.wireName().equalsIgnoreCase(raw.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
