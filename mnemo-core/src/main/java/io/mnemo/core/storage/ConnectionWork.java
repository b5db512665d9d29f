package io.mnemo.core.storage;

import io.mnemo.core.result.StoreResult;
import java.sql.SQLException;

@FunctionalInterface
public interface ConnectionWork<T> {
    StoreResult<T> apply(PooledConnection handle) throws SQLException;
}
