package io.mnemo.core.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.mnemo.core.config.model.CacheConfig;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.observability.HealthCheck;
import io.mnemo.core.observability.HealthReport;
import io.mnemo.core.observability.MetricsCollector;
import io.mnemo.core.observability.MetricsSnapshot;
import io.mnemo.core.result.ErrorKind;
import io.mnemo.core.result.StoreException;
import io.mnemo.core.result.StoreResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns everything an operation needs: the connection pool, the shared result cache, metrics,
 * the clock and the JSON codec. Created once at startup and closed on shutdown.
 *
 * <p>Every unit of work goes through {@link #read}, {@link #transaction} or {@link #write}, which
 * check out a handle, time the call, and turn {@link SQLException} and pool timeouts into
 * failed {@link StoreResult}s.
 */
public final class StorageContext implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(StorageContext.class);

    private final MnemoConfig config;
    private final Clock clock;
    private final ConnectionPool pool;
    private final ResultCache resultCache;
    private final MetricsCollector metrics;
    private final HealthCheck healthCheck;
    private final TransactionCoordinator transactions = new TransactionCoordinator();
    private final ObjectMapper mapper;
    private final JsonColumns json;
    private volatile boolean open = true;

    private StorageContext(MnemoConfig config, Clock clock, DatabaseUrl url) {
        this.config = config;
        this.clock = clock;
        CacheConfig cache = config.cache();
        this.resultCache = new ResultCache(
            cache.resultCapacity(),
            Duration.ofSeconds(cache.resultTtlSeconds()),
            Duration.ofSeconds(cache.cleanupIntervalSeconds()),
            cache.resultTargetRatio(),
            clock
        );
        this.pool = new ConnectionPool(url, config.storage(), cache.statementCapacity(), resultCache::cleanupIfDue);
        this.metrics = new MetricsCollector(clock);
        this.healthCheck = new HealthCheck(pool, clock);
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.json = new JsonColumns(mapper);
    }

    /**
     * Opens the database named by the configuration, creating parent directories and the schema
     * when absent.
     */
    public static StorageContext open(MnemoConfig config, Clock clock) throws IOException {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        DatabaseUrl url = DatabaseUrl.parse(config.storage().databaseUrl());
        Path parent = url.path().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        StorageContext context = new StorageContext(config, clock, url);
        try (PooledConnection handle = context.pool.acquire()) {
            GraphSchema.apply(handle.connection());
        } catch (SQLException | StoreException e) {
            context.close();
            throw new IOException("Failed to initialize graph store at " + url.path(), e);
        }
        LOG.info("Opened graph store at {} (pool size {})", url.path(), context.pool.maxSize());
        return context;
    }

    /**
     * Runs read-only work in auto-commit mode.
     */
    public <T> StoreResult<T> read(String operation, ConnectionWork<T> work) {
        return execute(operation, work);
    }

    /**
     * Runs work inside one transaction without touching the result cache.
     */
    public <T> StoreResult<T> transaction(String operation, ConnectionWork<T> work) {
        return execute(operation, handle -> transactions.inTransaction(handle, work));
    }

    /**
     * Runs a graph mutation inside one transaction and clears the result cache once it has
     * committed.
     */
    public <T> StoreResult<T> write(String operation, ConnectionWork<T> work) {
        StoreResult<T> result = transaction(operation, work);
        if (result.isOk()) {
            resultCache.invalidateAll();
        }
        return result;
    }

    /**
     * Records a call that was answered without touching the database.
     */
    public void recordCacheHit(String operation, long startedNanos) {
        metrics.record(operation, Duration.ofNanos(System.nanoTime() - startedNanos), true, true);
    }

    private <T> StoreResult<T> execute(String operation, ConnectionWork<T> work) {
        if (!open) {
            return StoreResult.failure(ErrorKind.STORAGE_FAILURE, operation + " failed: graph store is closed");
        }
        long started = System.nanoTime();
        StoreResult<T> result;
        try (PooledConnection handle = pool.acquire()) {
            result = work.apply(handle);
        } catch (StoreException e) {
            result = StoreResult.failure(e.error());
        } catch (SQLException e) {
            LOG.error("Storage failure during {}: {}", operation, e.getMessage(), e);
            result = StoreResult.failure(ErrorKind.STORAGE_FAILURE, operation + " failed: " + e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure during {}", operation, e);
            result = StoreResult.failure(ErrorKind.STORAGE_FAILURE, operation + " failed: " + e.getMessage());
        }
        metrics.record(operation, Duration.ofNanos(System.nanoTime() - started), false, result.isOk());
        return result;
    }

    public MetricsSnapshot metricsSnapshot() {
        return new MetricsSnapshot(
            clock.instant(),
            pool.stats(),
            resultCache.size(),
            resultCache.hits(),
            resultCache.misses(),
            metrics.snapshot()
        );
    }

    public HealthReport health() {
        return healthCheck.check(open);
    }

    public MnemoConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public ConnectionPool pool() {
        return pool;
    }

    public ResultCache resultCache() {
        return resultCache;
    }

    public MetricsCollector metrics() {
        return metrics;
    }

    public JsonColumns json() {
        return json;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        if (!open) {
            return;
        }
        open = false;
        resultCache.invalidateAll();
        pool.close();
    }
}
