package com.faasrt.demo;

import com.faasrt.function.FunctionHandler;
import com.faasrt.function.RuntimeContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summarizes a metrics snapshot such as:
 * <pre>
 * {
 *   "percent-network-egress": 100.0,
 *   "percent-memory-cache": 100.0,
 *   "avg-util-cpu0-60sec": 25.45,
 *   "avg-util-cpu1-60sec": 25.89
 * }
 * </pre>
 */
@Slf4j
public class MetricsSummaryFunction implements FunctionHandler {

    static final String CPU_PREFIX = "avg-util-cpu";
    static final String CPU_SUFFIX = "-60sec";

    @Override
    public Object handler(Map<String, Object> payload, RuntimeContext context) {
        Map<String, Double> cpus = new TreeMap<>();
        for (Map.Entry<String, Object> entry : payload.entrySet()) {
            String key = entry.getKey();
            if (key.startsWith(CPU_PREFIX) && key.endsWith(CPU_SUFFIX)) {
                String cpu = "cpu" + key.substring(CPU_PREFIX.length(), key.length() - CPU_SUFFIX.length());
                cpus.put(cpu, toDouble(key, entry.getValue()));
            }
        }

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("cpu-count", cpus.size());
        out.put("avg-util-cpu-60sec", round(cpus.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0)));
        out.put("busiest-cpu", cpus.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(null));
        out.put("percent-network-egress", payload.get("percent-network-egress"));
        out.put("percent-memory-cache", payload.get("percent-memory-cache"));
        out.put("processed-at", Instant.now().toString());
        out.put("previous-execution", context.getLastExecutionAt().map(Instant::toString).orElse(null));
        out.put("handler-modified-at", String.valueOf(context.getHandlerSourceModifiedAt()));

        log.debug("Summarized {} cpus for key '{}'", cpus.size(), context.getInputKey());
        return out;
    }

    private static double toDouble(String key, Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            return Double.parseDouble(text.trim());
        }
        throw new IllegalArgumentException("Metric '" + key + "' is not numeric: " + value);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
