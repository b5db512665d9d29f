package io.mnemo.core.result;

import java.util.function.Function;

/**
 * Outcome of a storage operation: either a value or a typed {@link StoreError}, never both.
 *
 * @param <T> payload type
 */
public record StoreResult<T>(T value, StoreError error) {

    public static <T> StoreResult<T> ok(T value) {
        return new StoreResult<>(value, null);
    }

    public static <T> StoreResult<T> failure(StoreError error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new StoreResult<>(null, error);
    }

    public static <T> StoreResult<T> failure(ErrorKind kind, String message) {
        return failure(new StoreError(kind, message));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public <U> StoreResult<U> propagate() {
        if (isOk()) {
            throw new IllegalStateException("cannot propagate a successful result");
        }
        return failure(error);
    }

    public <U> StoreResult<U> map(Function<? super T, ? extends U> mapper) {
        return isOk() ? ok(mapper.apply(value)) : failure(error);
    }

    public T orElseThrow() throws StoreException {
        if (isFailure()) {
            throw new StoreException(error);
        }
        return value;
    }
}
