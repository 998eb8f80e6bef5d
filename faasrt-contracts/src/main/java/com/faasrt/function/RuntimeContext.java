package com.faasrt.function;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the runtime metadata handed to every {@link FunctionHandler} call.
 * The same instance is passed to each invocation for the lifetime of the process.
 */
public interface RuntimeContext {

    String getStoreHost();

    int getStorePort();

    String getInputKey();

    String getOutputKey();

    /**
     * Modification time of the handler file, captured when it was loaded.
     * The file is not watched; a newer jar needs a restart.
     */
    Instant getHandlerSourceModifiedAt();

    /**
     * Time of the last successful publish, empty until the first one.
     */
    Optional<Instant> getLastExecutionAt();

    /**
     * Free-form settings from {@code runtime.environment.*}. Unmodifiable.
     */
    Map<String, Object> getEnvironment();
}
