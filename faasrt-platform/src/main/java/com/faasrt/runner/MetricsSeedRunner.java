package com.faasrt.runner;

import com.faasrt.config.RuntimeProperties;
import com.faasrt.storage.RuntimeStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Profile {@code seed}: writes a mock metrics object for demos and exits.
 */
@Slf4j
@Component
@Profile("seed")
@RequiredArgsConstructor
public class MetricsSeedRunner implements CommandLineRunner {

    private final RuntimeStore runtimeStore;
    private final RuntimeProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public void run(String... args) throws Exception {
        String key = properties.getSeed().getKey();
        if (key == null || key.isBlank()) {
            key = properties.getRedis().getInputKey();
        }

        Map<String, Object> payload = buildMockPayload();
        runtimeStore.set(key, objectMapper.writeValueAsString(payload));

        log.info("Seeded key '{}' on {}:{}", key, properties.getRedis().getHost(), properties.getRedis().getPort());
        log.info("Payload:\n{}", objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload));
    }

    static Map<String, Object> buildMockPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("percent-network-egress", 100.00);
        payload.put("percent-memory-cache", 100.00);
        payload.put("avg-util-cpu0-60sec", 25.45);
        payload.put("avg-util-cpu1-60sec", 25.89);
        payload.put("avg-util-cpu2-60sec", 0.34);
        payload.put("avg-util-cpu3-60sec", 1.12);
        return payload;
    }
}
