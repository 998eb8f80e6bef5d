package com.faasrt.loader;

import com.faasrt.function.FunctionHandler;

import java.nio.file.Path;
import java.time.Instant;

public record LoadedHandler(FunctionHandler handler,
                            Path source,
                            Instant sourceModifiedAt) {

    public String name() {
        return handler.getClass().getName();
    }
}
