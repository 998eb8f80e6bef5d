package com.faasrt.storage;

/**
 * Key-value store the runtime reads input from and writes output to.
 * Implementation is platform-specific (Redis).
 * <p>
 * Transport failures surface as {@link com.faasrt.exception.StoreAccessException}.
 */
public interface RuntimeStore {

    /**
     * Establish the connection used by later calls. Default no-op for stores
     * that connect lazily.
     */
    default void connect() {
        // no-op
    }

    /**
     * @return the raw value, or {@code null} if the key is not set
     */
    String get(String key);

    void set(String key, String value);
}
