package com.faasrt.loader;

import com.faasrt.exception.StartupException;
import com.faasrt.function.FunctionHandler;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.jar.JarFile;

/**
 * Loads the user module: a jar registering one {@link FunctionHandler} through
 * {@code META-INF/services}.
 * <p>
 * Loading runs user code (static initializers, the constructor) with the
 * runtime's own permissions. Every failure is a {@link StartupException}.
 * The class loader stays open for the life of the process.
 */
@Slf4j
public class HandlerLoader {

    private final ClassLoader parent;

    public HandlerLoader() {
        this(HandlerLoader.class.getClassLoader());
    }

    public HandlerLoader(ClassLoader parent) {
        this.parent = parent;
    }

    public LoadedHandler load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new StartupException("User module not found at " + path);
        }
        verifyJar(path);
        Instant modifiedAt = modifiedAt(path);

        URLClassLoader classLoader = new URLClassLoader("usermodule", new URL[]{toUrl(path)}, parent);
        List<FunctionHandler> handlers = discover(classLoader, path);

        if (handlers.isEmpty()) {
            throw new StartupException(path + " must register a " + FunctionHandler.class.getName()
                    + " implementation exposing handler(payload, context)");
        }
        if (handlers.size() > 1) {
            List<String> names = handlers.stream().map(h -> h.getClass().getName()).toList();
            throw new StartupException(path + " registers more than one handler: " + names);
        }

        LoadedHandler loaded = new LoadedHandler(handlers.get(0), path, modifiedAt);
        log.info("Loaded handler {} from {} (modified {})", loaded.name(), path, modifiedAt);
        return loaded;
    }

    private List<FunctionHandler> discover(ClassLoader classLoader, Path path) {
        List<FunctionHandler> found = new ArrayList<>();
        try {
            for (FunctionHandler handler : ServiceLoader.load(FunctionHandler.class, classLoader)) {
                found.add(handler);
            }
        } catch (ServiceConfigurationError | LinkageError | RuntimeException e) {
            throw new StartupException("Failed to load user module " + path, e);
        }
        return found;
    }

    private static void verifyJar(Path path) {
        try (JarFile ignored = new JarFile(path.toFile())) {
            log.debug("Opened user module {}", path);
        } catch (IOException e) {
            throw new StartupException("User module " + path + " is not a readable jar", e);
        }
    }

    private static Instant modifiedAt(Path path) {
        try {
            return Files.getLastModifiedTime(path).toInstant();
        } catch (IOException e) {
            throw new StartupException("Cannot read modification time of " + path, e);
        }
    }

    private static URL toUrl(Path path) {
        try {
            return path.toUri().toURL();
        } catch (MalformedURLException e) {
            throw new StartupException("Invalid user module path " + path, e);
        }
    }
}
