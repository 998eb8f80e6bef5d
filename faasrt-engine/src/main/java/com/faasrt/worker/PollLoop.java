package com.faasrt.worker;

import com.faasrt.config.RuntimeConfig;
import com.faasrt.context.DefaultRuntimeContext;
import com.faasrt.exception.StoreUnavailableException;
import com.faasrt.function.FunctionHandler;
import com.faasrt.loader.LoadedHandler;
import com.faasrt.storage.RuntimeStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Single-threaded poll cycle:
 * <ol>
 *   <li>GET the input key</li>
 *   <li>skip if the raw value equals the last observed one</li>
 *   <li>decode it as a JSON object</li>
 *   <li>call the handler with the payload and the runtime context</li>
 *   <li>SET the JSON-encoded map result on the output key</li>
 *   <li>sleep</li>
 * </ol>
 * Every step after the read fails in isolation: it is logged and the loop goes on.
 */
@Slf4j
public class PollLoop {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final RuntimeStore store;
    private final FunctionHandler handler;
    private final String handlerName;
    private final DefaultRuntimeContext context;
    private final RuntimeConfig config;
    private final ObjectMapper objectMapper;
    private final ObjectReader payloadReader;
    private final Sleeper sleeper;
    private final Clock clock;

    // loop-owned state
    private String lastObserved;
    private int consecutiveStoreFailures;

    public PollLoop(RuntimeStore store,
                    LoadedHandler loadedHandler,
                    DefaultRuntimeContext context,
                    RuntimeConfig config,
                    ObjectMapper objectMapper) {
        this(store, loadedHandler, context, config, objectMapper, Sleeper.THREAD, Clock.systemUTC());
    }

    public PollLoop(RuntimeStore store,
                    LoadedHandler loadedHandler,
                    DefaultRuntimeContext context,
                    RuntimeConfig config,
                    ObjectMapper objectMapper,
                    Sleeper sleeper,
                    Clock clock) {
        this.store = store;
        this.handler = loadedHandler.handler();
        this.handlerName = loadedHandler.name();
        this.context = context;
        this.config = config;
        this.objectMapper = objectMapper;
        this.payloadReader = objectMapper.readerFor(PAYLOAD_TYPE)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Connects and polls until the thread is interrupted or a bounded store
     * retry policy gives up.
     */
    public void run() throws InterruptedException {
        store.connect();
        log.info("Runtime started with host={}, port={}, input_key={}, output_key={}, handler={}",
                config.storeHost(), config.storePort(), config.inputKey(), config.outputKey(), handlerName);

        while (!Thread.currentThread().isInterrupted()) {
            CycleOutcome outcome = pollOnce();
            log.debug("Cycle finished: {}", outcome);
            sleeper.sleep(nextDelay(outcome));
        }
    }

    /**
     * One cycle without the trailing sleep.
     */
    public CycleOutcome pollOnce() {
        String raw;
        try {
            raw = store.get(config.inputKey());
        } catch (RuntimeException e) {
            consecutiveStoreFailures++;
            log.error("Failed to read key '{}' from store (failure {}); retrying after delay",
                    config.inputKey(), consecutiveStoreFailures, e);
            if (config.storeRetryPolicy().isExhausted(consecutiveStoreFailures)) {
                throw new StoreUnavailableException("Store unreachable after "
                        + consecutiveStoreFailures + " consecutive failures", e);
            }
            return CycleOutcome.READ_FAILED;
        }
        consecutiveStoreFailures = 0;

        if (Objects.equals(raw, lastObserved)) {
            return CycleOutcome.UNCHANGED;
        }

        String previous = lastObserved;
        lastObserved = raw;

        CycleOutcome outcome = process(raw);
        if (!config.observationPolicy().keepsObservation(outcome)) {
            lastObserved = previous;
        }
        return outcome;
    }

    Duration nextDelay(CycleOutcome outcome) {
        if (outcome == CycleOutcome.READ_FAILED) {
            return config.storeRetryPolicy().delayAfter(consecutiveStoreFailures, config.pollInterval());
        }
        return config.pollInterval();
    }

    private CycleOutcome process(String raw) {
        if (raw == null) {
            log.info("Input key '{}' is not set; nothing to process", config.inputKey());
            return CycleOutcome.NO_INPUT;
        }

        Map<String, Object> payload;
        try {
            payload = payloadReader.readValue(raw);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse JSON input from key '{}'", config.inputKey(), e);
            return CycleOutcome.DECODE_FAILED;
        }
        if (payload == null) {
            log.warn("Input under key '{}' is JSON null; expected an object", config.inputKey());
            return CycleOutcome.DECODE_FAILED;
        }

        Object result;
        try {
            result = handler.handler(payload, context);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            log.error("Exception inside user handler {}", handlerName, t);
            return CycleOutcome.HANDLER_FAILED;
        } finally {
            clearHandlerInterrupt();
        }

        if (!(result instanceof Map<?, ?> output)) {
            log.warn("Handler return is not a map ({}); skipping write",
                    result == null ? "null" : result.getClass().getName());
            return CycleOutcome.INVALID_RESULT;
        }

        return publish(output);
    }

    // the interrupt flag belongs to the loop; a handler must not stop it
    private void clearHandlerInterrupt() {
        if (Thread.interrupted()) {
            log.warn("Handler {} left the thread interrupted; clearing the flag", handlerName);
        }
    }

    private CycleOutcome publish(Map<?, ?> output) {
        try {
            String json = objectMapper.writeValueAsString(output);
            store.set(config.outputKey(), json);
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to write handler output to key '{}'", config.outputKey(), e);
            return CycleOutcome.PUBLISH_FAILED;
        }

        context.recordExecution(clock.instant());
        log.info("Processed input and wrote output to key '{}'", config.outputKey());
        return CycleOutcome.PUBLISHED;
    }
}
