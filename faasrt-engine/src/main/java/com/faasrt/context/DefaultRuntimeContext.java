package com.faasrt.context;

import com.faasrt.config.RuntimeConfig;
import com.faasrt.function.RuntimeContext;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * The one context instance of the process. Owned by the poll loop, which is the
 * only caller of {@link #recordExecution(Instant)}; handlers only see the
 * {@link RuntimeContext} view.
 */
@Getter
@ToString
public class DefaultRuntimeContext implements RuntimeContext {

    private final String storeHost;
    private final int storePort;
    private final String inputKey;
    private final String outputKey;
    private final Instant handlerSourceModifiedAt;
    private final Map<String, Object> environment;

    private Instant lastExecutionAt;

    public DefaultRuntimeContext(String storeHost,
                                 int storePort,
                                 String inputKey,
                                 String outputKey,
                                 Instant handlerSourceModifiedAt,
                                 Map<String, Object> environment) {
        this.storeHost = storeHost;
        this.storePort = storePort;
        this.inputKey = inputKey;
        this.outputKey = outputKey;
        this.handlerSourceModifiedAt = handlerSourceModifiedAt;
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public static DefaultRuntimeContext of(RuntimeConfig config, Instant handlerSourceModifiedAt) {
        return new DefaultRuntimeContext(
                config.storeHost(),
                config.storePort(),
                config.inputKey(),
                config.outputKey(),
                handlerSourceModifiedAt,
                config.environment()
        );
    }

    @Override
    public Optional<Instant> getLastExecutionAt() {
        return Optional.ofNullable(lastExecutionAt);
    }

    public void recordExecution(Instant executedAt) {
        this.lastExecutionAt = executedAt;
    }
}
