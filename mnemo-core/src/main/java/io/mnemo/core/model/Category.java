package io.mnemo.core.model;

public record Category(long id, String name, int priority, Integer retentionDays) {
}
