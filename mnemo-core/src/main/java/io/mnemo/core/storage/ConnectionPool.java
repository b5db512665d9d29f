package io.mnemo.core.storage;

import io.mnemo.core.config.model.StorageConfig;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ConnectionPool implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionPool.class);

    private final DatabaseUrl url;
    private final int maxSize;
    private final Duration defaultTimeout;
    private final int statementCapacity;
    private final List<String> pragmas;
    private final Properties properties;
    private final Runnable onAcquire;
    private final Semaphore permits;
    private final ConcurrentLinkedDeque<PooledConnection> idle = new ConcurrentLinkedDeque<>();
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger peakActive = new AtomicInteger();
    private final AtomicLong handleIds = new AtomicLong();
    private final AtomicLong acquireTimeouts = new AtomicLong();
    private volatile boolean closed;

    public ConnectionPool(DatabaseUrl url, StorageConfig config, int statementCapacity, Runnable onAcquire) {
        if (config.poolSize() <= 0) {
            throw new IllegalArgumentException("poolSize must be > 0");
        }
        this.url = url;
        this.maxSize = config.poolSize();
        this.defaultTimeout = Duration.ofMillis(config.acquireTimeoutMs());
        this.statementCapacity = statementCapacity;
        this.pragmas = List.of(
            "PRAGMA journal_mode=" + Sanitizer.keyword(config.journalMode()),
            "PRAGMA synchronous=" + Sanitizer.keyword(config.synchronous()),
            "PRAGMA cache_size=-" + Math.max(0, config.cacheSizeKb())
        );
        this.properties = new Properties();
        properties.setProperty("transaction_mode", "IMMEDIATE");
        properties.setProperty("busy_timeout", Integer.toString(Math.max(0, config.busyTimeoutMs())));
        this.onAcquire = onAcquire == null ? () -> { } : onAcquire;
        this.permits = new Semaphore(maxSize, true);
    }

    public PooledConnection acquire() throws PoolExhaustedException, SQLException {
        return acquire(defaultTimeout);
    }

    public PooledConnection acquire(Duration timeout) throws PoolExhaustedException, SQLException {
        if (closed) {
            throw new IllegalStateException("Connection pool is closed");
        }
        boolean granted;
        try {
            granted = permits.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PoolExhaustedException("Interrupted while waiting for a database handle", e);
        }
        if (!granted) {
            acquireTimeouts.incrementAndGet();
            LOG.warn("Database pool exhausted: {} handles busy after waiting {} ms", maxSize, timeout.toMillis());
            throw new PoolExhaustedException("No database handle available within " + timeout.toMillis() + " ms");
        }
        PooledConnection handle;
        try {
            handle = takeIdleOrOpen();
        } catch (SQLException | RuntimeException e) {
            permits.release();
            throw e;
        }
        handle.checkOut();
        int current = active.incrementAndGet();
        peakActive.accumulateAndGet(current, Math::max);
        try {
            onAcquire.run();
        } catch (RuntimeException e) {
            LOG.warn("Cache maintenance on acquire failed: {}", e.getMessage());
        }
        return handle;
    }

    void release(PooledConnection handle) {
        if (!handle.checkIn()) {
            return;
        }
        active.decrementAndGet();
        if (closed || !handle.isUsable() || handle.inTransaction()) {
            LOG.debug("Retiring database handle {}", handle.id());
            handle.retire();
        } else {
            idle.offerFirst(handle);
        }
        permits.release();
    }

    public PoolStats stats() {
        int available = permits.availablePermits();
        return new PoolStats(
            maxSize,
            active.get(),
            available,
            idle.size(),
            peakActive.get(),
            handleIds.get(),
            acquireTimeouts.get()
        );
    }

    public int maxSize() {
        return maxSize;
    }

    public DatabaseUrl url() {
        return url;
    }

    @Override
    public void close() {
        closed = true;
        List<PooledConnection> drained = new ArrayList<>();
        PooledConnection handle;
        while ((handle = idle.pollFirst()) != null) {
            drained.add(handle);
        }
        drained.forEach(PooledConnection::retire);
        LOG.info("Closed connection pool for {} ({} idle handles retired)", url.path(), drained.size());
    }

    private PooledConnection takeIdleOrOpen() throws SQLException {
        PooledConnection handle;
        while ((handle = idle.pollFirst()) != null) {
            if (handle.isUsable()) {
                return handle;
            }
            handle.retire();
        }
        return open();
    }

    private PooledConnection open() throws SQLException {
        Connection connection = DriverManager.getConnection(url.jdbcUrl(), properties);
        try (Statement statement = connection.createStatement()) {
            for (String pragma : pragmas) {
                statement.execute(pragma);
            }
            CaseFold.register(connection);
        } catch (SQLException e) {
            connection.close();
            throw e;
        }
        long id = handleIds.incrementAndGet();
        LOG.debug("Opened database handle {} for {}", id, url.path());
        return new PooledConnection(id, connection, new StatementCache(statementCapacity), this);
    }
}
