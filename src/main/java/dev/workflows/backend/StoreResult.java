package dev.workflows.backend;

/**
 * Success/data/error envelope returned by the workflow store and resource catalogs.
 */
public record StoreResult<T>(
    boolean success,
    T data,       // nullable
    String error  // nullable, set when success is false
) {
    public static <T> StoreResult<T> ok(T data) {
        return new StoreResult<>(true, data, null);
    }

    public static <T> StoreResult<T> failed(String error) {
        return new StoreResult<>(false, null, error);
    }

    public boolean hasData() {
        return success && data != null;
    }
}
