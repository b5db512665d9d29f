package io.mnemo.core.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class PooledConnection implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(PooledConnection.class);

    private final long id;
    private final Connection connection;
    private final StatementCache statements;
    private final ConnectionPool owner;
    private final AtomicBoolean checkedOut = new AtomicBoolean();
    private boolean inTransaction;
    private boolean broken;

    PooledConnection(long id, Connection connection, StatementCache statements, ConnectionPool owner) {
        this.id = id;
        this.connection = connection;
        this.statements = statements;
        this.owner = owner;
    }

    public long id() {
        return id;
    }

    public Connection connection() {
        return connection;
    }

    public PreparedStatement prepare(String sql) throws SQLException {
        PreparedStatement statement = statements.getOrPrepare(connection, sql);
        statement.clearParameters();
        return statement;
    }

    public StatementCache statementCache() {
        return statements;
    }

    public boolean inTransaction() {
        return inTransaction;
    }

    void beginTransaction() {
        inTransaction = true;
    }

    void endTransaction() {
        inTransaction = false;
    }

    void markBroken() {
        broken = true;
    }

    boolean isUsable() {
        if (broken) {
            return false;
        }
        try {
            return !connection.isClosed();
        } catch (SQLException e) {
            return false;
        }
    }

    void checkOut() {
        if (!checkedOut.compareAndSet(false, true)) {
            throw new IllegalStateException("Handle " + id + " is already checked out");
        }
    }

    boolean checkIn() {
        return checkedOut.compareAndSet(true, false);
    }

    void retire() {
        statements.clear();
        try {
            connection.close();
        } catch (SQLException e) {
            LOG.warn("Failed to close database handle {}: {}", id, e.getMessage());
        }
    }

    @Override
    public void close() {
        owner.release(this);
    }
}
