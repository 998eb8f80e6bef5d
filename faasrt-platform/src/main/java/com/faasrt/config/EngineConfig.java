package com.faasrt.config;

import com.faasrt.context.DefaultRuntimeContext;
import com.faasrt.exception.StartupException;
import com.faasrt.loader.HandlerLoader;
import com.faasrt.loader.LoadedHandler;
import com.faasrt.storage.RuntimeStore;
import com.faasrt.worker.PollLoop;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.nio.file.Path;
import java.util.LinkedHashMap;

/**
 * Startup: resolves configuration, loads the handler and assembles the poll loop.
 * Any {@link StartupException} here aborts the context and the process exits non-zero.
 */
@Slf4j
@Configuration
@Profile("!seed")
public class EngineConfig {

    @Bean
    public RuntimeConfig runtimeConfig(RuntimeProperties props) {
        RuntimeProperties.Redis redis = props.getRedis();
        if (redis.getOutputKey() == null || redis.getOutputKey().isBlank()) {
            throw new StartupException("REDIS_OUTPUT_KEY not set; exiting");
        }
        int port = redis.resolvePort();

        RuntimeProperties.Store store = props.getStore();
        StoreRetryPolicy retryPolicy = new StoreRetryPolicy(
                store.getMaxConsecutiveFailures(),
                store.getBackoffCoefficient(),
                store.getMaxInterval()
        );

        return new RuntimeConfig(
                redis.getHost(),
                port,
                redis.getInputKey(),
                redis.getOutputKey(),
                Path.of(props.getHandler().getPath()),
                props.getPoll().getInterval(),
                props.getPoll().getObservationPolicy(),
                retryPolicy,
                new LinkedHashMap<>(props.getEnvironment())
        );
    }

    @Bean
    public HandlerLoader handlerLoader() {
        return new HandlerLoader();
    }

    @Bean
    public LoadedHandler loadedHandler(HandlerLoader handlerLoader, RuntimeConfig config) {
        return handlerLoader.load(config.handlerPath());
    }

    @Bean
    public DefaultRuntimeContext runtimeContext(RuntimeConfig config, LoadedHandler loadedHandler) {
        DefaultRuntimeContext context = DefaultRuntimeContext.of(config, loadedHandler.sourceModifiedAt());
        log.debug("Runtime context: {}", context);
        return context;
    }

    @Bean
    public PollLoop pollLoop(RuntimeStore runtimeStore,
                             LoadedHandler loadedHandler,
                             DefaultRuntimeContext runtimeContext,
                             RuntimeConfig config,
                             ObjectMapper objectMapper) {
        log.info("Poll interval {}, observation policy {}, store retry {}",
                config.pollInterval(), config.observationPolicy(), config.storeRetryPolicy());
        return new PollLoop(runtimeStore, loadedHandler, runtimeContext, config, objectMapper);
    }
}
