package io.mnemo.core.storage;

import java.nio.file.Path;

public record DatabaseUrl(Path path) {

    public static DatabaseUrl parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Database path not specified in URL");
        }
        String value = raw.trim();
        String location;
        if (value.startsWith("jdbc:sqlite:")) {
            location = value.substring("jdbc:sqlite:".length());
        } else if (value.startsWith("sqlite:///")) {
            location = value.substring("sqlite://".length());
        } else if (value.startsWith("sqlite://")) {
            location = value.substring("sqlite://".length());
        } else if (value.startsWith("sqlite:")) {
            location = value.substring("sqlite:".length());
        } else {
            location = value;
        }
        if (location.isBlank() || location.startsWith(":memory:")) {
            throw new IllegalArgumentException("A file-backed database path is required: " + raw);
        }
        if (location.startsWith("~/")) {
            return new DatabaseUrl(Path.of(System.getProperty("user.home")).resolve(location.substring(2)).toAbsolutePath());
        }
        return new DatabaseUrl(Path.of(location).toAbsolutePath());
    }

    public String jdbcUrl() {
        return "jdbc:sqlite:" + path;
    }

    public Path walPath() {
        return path.resolveSibling(path.getFileName() + "-wal");
    }
}
