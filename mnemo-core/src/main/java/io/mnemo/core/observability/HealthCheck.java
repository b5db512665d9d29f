package io.mnemo.core.observability;

import io.mnemo.core.storage.ConnectionPool;
import io.mnemo.core.storage.DatabaseUrl;
import io.mnemo.core.storage.PoolStats;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HealthCheck {
    private static final Logger LOG = LoggerFactory.getLogger(HealthCheck.class);

    private final ConnectionPool pool;
    private final Clock clock;

    public HealthCheck(ConnectionPool pool, Clock clock) {
        this.pool = pool;
        this.clock = clock;
    }

    public HealthReport check(boolean open) {
        DatabaseUrl url = pool.url();
        PoolStats stats = pool.stats();
        long databaseBytes = sizeOf(url.path());
        long walBytes = sizeOf(url.walPath());
        String status;
        if (!open) {
            status = "closed";
        } else if (databaseBytes < 0 || stats.available() == 0) {
            status = "degraded";
        } else {
            status = "ok";
        }
        return new HealthReport(
            status,
            clock.instant(),
            url.path().toString(),
            Math.max(0, databaseBytes),
            Math.max(0, walBytes),
            stats
        );
    }

    private long sizeOf(Path path) {
        if (!Files.exists(path)) {
            return -1;
        }
        try {
            return Files.size(path);
        } catch (IOException e) {
            LOG.debug("Could not read size of {}: {}", path, e.getMessage());
            return -1;
        }
    }
}
