package io.mnemo.core.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class StatementCache {
    private static final Logger LOG = LoggerFactory.getLogger(StatementCache.class);

    private final int capacity;
    private final Map<String, PreparedStatement> statements = new LinkedHashMap<>(16, 0.75f, true);
    private long hits;
    private long misses;

    public StatementCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
    }

    public synchronized PreparedStatement getOrPrepare(Connection connection, String sql) throws SQLException {
        PreparedStatement cached = statements.get(sql);
        if (cached != null && !cached.isClosed()) {
            hits++;
            return cached;
        }
        misses++;
        if (cached != null) {
            statements.remove(sql);
        }
        while (statements.size() >= capacity) {
            evictEldest();
        }
        PreparedStatement prepared = connection.prepareStatement(sql);
        statements.put(sql, prepared);
        return prepared;
    }

    public synchronized boolean contains(String sql) {
        return statements.containsKey(sql);
    }

    public synchronized int size() {
        return statements.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized long hits() {
        return hits;
    }

    public synchronized long misses() {
        return misses;
    }

    public synchronized void clear() {
        for (PreparedStatement statement : statements.values()) {
            closeQuietly(statement);
        }
        statements.clear();
    }

    private void evictEldest() {
        Iterator<Map.Entry<String, PreparedStatement>> iterator = statements.entrySet().iterator();
        if (!iterator.hasNext()) {
            return;
        }
        Map.Entry<String, PreparedStatement> eldest = iterator.next();
        iterator.remove();
        closeQuietly(eldest.getValue());
        LOG.debug("Evicted prepared statement: {}", eldest.getKey());
    }

    private void closeQuietly(PreparedStatement statement) {
        try {
            statement.close();
        } catch (SQLException e) {
            LOG.warn("Failed to close prepared statement: {}", e.getMessage());
        }
    }
}
