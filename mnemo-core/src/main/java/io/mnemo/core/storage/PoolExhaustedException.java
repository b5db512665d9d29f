package io.mnemo.core.storage;

import io.mnemo.core.result.ErrorKind;
import io.mnemo.core.result.StoreError;
import io.mnemo.core.result.StoreException;

public final class PoolExhaustedException extends StoreException {

    public PoolExhaustedException(String message) {
        super(new StoreError(ErrorKind.POOL_EXHAUSTED, message));
    }

    public PoolExhaustedException(String message, Throwable cause) {
        super(new StoreError(ErrorKind.POOL_EXHAUSTED, message), cause);
    }
}
