package com.faasrt.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RuntimeConfigTest {

    @Test
    void shouldFallBackToDefaultPollIntervalWhenNotPositive() {
        assertEquals(RuntimeConfig.DEFAULT_POLL_INTERVAL, withInterval(Duration.ZERO).pollInterval());
        assertEquals(RuntimeConfig.DEFAULT_POLL_INTERVAL, withInterval(Duration.ofSeconds(-1)).pollInterval());
        assertEquals(RuntimeConfig.DEFAULT_POLL_INTERVAL, withInterval(null).pollInterval());
    }

    @Test
    void shouldKeepPositivePollInterval() {
        assertEquals(Duration.ofMillis(250), withInterval(Duration.ofMillis(250)).pollInterval());
    }

    @Test
    void shouldApplyPolicyDefaults() {
        RuntimeConfig config = withInterval(Duration.ofSeconds(1));

        assertEquals(ObservationPolicy.ADVANCE_ON_READ, config.observationPolicy());
        assertEquals(StoreRetryPolicy.UNBOUNDED, config.storeRetryPolicy());
        assertEquals(Map.of(), config.environment());
    }

    private static RuntimeConfig withInterval(Duration interval) {
        return new RuntimeConfig("localhost", 6379, "metrics", "metrics-output",
                Path.of("/opt/usermodule.jar"), interval, null, null, null);
    }
}
