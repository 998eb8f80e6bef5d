package com.faasrt.config;

import com.faasrt.exception.StartupException;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runtime settings, bound from application.yml (which maps the REDIS_* environment variables).
 */
@Getter
@Component
@ConfigurationProperties(prefix = "runtime")
public class RuntimeProperties {

    private final Redis redis = new Redis();
    private final Handler handler = new Handler();
    private final Poll poll = new Poll();
    private final Store store = new Store();
    private final Seed seed = new Seed();

    /**
     * Free-form values exposed to handlers through the runtime context.
     */
    @Setter
    private Map<String, String> environment = new LinkedHashMap<>();

    @Setter
    @Getter
    public static class Redis {
        private String host = "localhost";
        // kept as text so a bad REDIS_PORT gets a readable startup error
        private String port = "6379";
        private String inputKey = "metrics";
        private String outputKey;
        private Duration commandTimeout = Duration.ofSeconds(10);

        public int resolvePort() {
            int value;
            try {
                value = Integer.parseInt(port == null ? "" : port.trim());
            } catch (NumberFormatException e) {
                throw new StartupException("Invalid REDIS_PORT value: " + port, e);
            }
            if (value < 1 || value > 65535) {
                throw new StartupException("Invalid REDIS_PORT value: " + port);
            }
            return value;
        }
    }

    @Setter
    @Getter
    public static class Handler {
        private String path = RuntimeConfig.DEFAULT_HANDLER_PATH.toString();
    }

    @Setter
    @Getter
    public static class Poll {
        private Duration interval = RuntimeConfig.DEFAULT_POLL_INTERVAL;
        private ObservationPolicy observationPolicy = ObservationPolicy.ADVANCE_ON_READ;
    }

    @Setter
    @Getter
    public static class Store {
        private int maxConsecutiveFailures = 0;
        private double backoffCoefficient = 1.0;
        private Duration maxInterval = Duration.ofMinutes(5);
    }

    @Setter
    @Getter
    public static class Seed {
        private String key;
    }
}
