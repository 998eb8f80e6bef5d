package com.faasrt.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Resolved runtime settings, without Spring.
 */
public record RuntimeConfig(String storeHost,
                            int storePort,
                            String inputKey,
                            String outputKey,
                            Path handlerPath,
                            Duration pollInterval,
                            ObservationPolicy observationPolicy,
                            StoreRetryPolicy storeRetryPolicy,
                            Map<String, Object> environment) {

    public static final Path DEFAULT_HANDLER_PATH = Path.of("/opt/usermodule.jar");
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);

    public RuntimeConfig {
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            pollInterval = DEFAULT_POLL_INTERVAL;
        }
        if (observationPolicy == null) {
            observationPolicy = ObservationPolicy.ADVANCE_ON_READ;
        }
        if (storeRetryPolicy == null) {
            storeRetryPolicy = StoreRetryPolicy.UNBOUNDED;
        }
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }
}
