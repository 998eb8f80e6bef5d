package com.faasrt.function;

import java.util.Map;

/**
 * Entry point of a user module.
 * <p>
 * A handler jar registers exactly one implementation in
 * {@code META-INF/services/com.faasrt.function.FunctionHandler}. The runtime
 * instantiates it once at startup and calls {@link #handler(Map, RuntimeContext)}
 * every time the input key changes.
 */
public interface FunctionHandler {

    /**
     * Process one decoded input payload.
     *
     * @param payload JSON object read from the input key
     * @param context runtime metadata, shared across invocations
     * @return a {@link Map} to publish as JSON on the output key; any other
     * value (including {@code null}) is logged and nothing is published
     * @throws Exception any failure skips the current cycle
     */
    Object handler(Map<String, Object> payload, RuntimeContext context) throws Exception;
}
