package io.mnemo.core.result;

public class StoreException extends Exception {
    private final StoreError error;

    public StoreException(StoreError error) {
        super(error.toString());
        this.error = error;
    }

    public StoreException(StoreError error, Throwable cause) {
        super(error.toString(), cause);
        this.error = error;
    }

    public StoreError error() {
        return error;
    }

    public ErrorKind kind() {
        return error.kind();
    }
}
