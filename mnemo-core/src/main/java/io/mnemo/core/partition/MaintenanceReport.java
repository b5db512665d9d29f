package io.mnemo.core.partition;

import java.time.Instant;

public record MaintenanceReport(
    Instant startedAt,
    long durationMillis,
    int movedToIntermediate,
    int movedToArchive,
    int entityTypes,
    int relationTypes,
    boolean skipped
) {

    public static MaintenanceReport skipped(Instant at) {
        return new MaintenanceReport(at, 0, 0, 0, 0, 0, true);
    }
}
