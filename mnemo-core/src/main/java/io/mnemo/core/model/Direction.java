package io.mnemo.core.model;

import java.util.Locale;
import java.util.Optional;

public enum Direction {
    OUTGOING,
    INCOMING,
    BOTH;

    public boolean includesOutgoing() {
        return this != INCOMING;
    }

    public boolean includesIncoming() {
        return this != OUTGOING;
    }

    public static Optional<Direction> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.of(BOTH);
        }
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
