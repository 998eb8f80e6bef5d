package com.faasrt.loader;

import com.faasrt.config.RuntimeConfig;
import com.faasrt.context.DefaultRuntimeContext;
import com.faasrt.exception.StartupException;
import com.faasrt.loader.fixtures.ConstantHandler;
import com.faasrt.loader.fixtures.EchoHandler;
import com.faasrt.loader.fixtures.FailingConstructorHandler;
import com.faasrt.loader.fixtures.FailingInitializerHandler;
import com.faasrt.loader.fixtures.NotAHandler;
import com.faasrt.support.HandlerJars;
import com.faasrt.support.HidingClassLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HandlerLoaderTest {

    @TempDir
    Path dir;

    private final HandlerLoader loader = new HandlerLoader();

    @Test
    void shouldLoadSingleRegisteredHandler() throws Exception {
        Path jar = HandlerJars.withProviders(dir, EchoHandler.class.getName());
        Instant modified = Instant.parse("2024-05-01T10:15:30Z");
        Files.setLastModifiedTime(jar, FileTime.from(modified));

        LoadedHandler loaded = loader.load(jar);

        assertInstanceOf(EchoHandler.class, loaded.handler());
        assertEquals(EchoHandler.class.getName(), loaded.name());
        assertEquals(jar, loaded.source());
        assertEquals(modified, loaded.sourceModifiedAt());
    }

    @Test
    void shouldFailWhenFileIsMissing() {
        StartupException ex = assertThrows(StartupException.class,
                () -> loader.load(dir.resolve("absent.jar")));

        assertTrue(ex.getMessage().contains("not found"));
    }

    @Test
    void shouldFailWhenPathIsDirectory() {
        assertThrows(StartupException.class, () -> loader.load(dir));
    }

    @Test
    void shouldFailWhenFileIsNotJar() throws Exception {
        Path garbage = Files.writeString(dir.resolve("usermodule.jar"), "def handler(payload, context):");

        StartupException ex = assertThrows(StartupException.class, () -> loader.load(garbage));

        assertTrue(ex.getMessage().contains("not a readable jar"));
    }

    @Test
    void shouldFailWhenNoHandlerIsRegistered() throws Exception {
        Path jar = HandlerJars.withProviders(dir);

        StartupException ex = assertThrows(StartupException.class, () -> loader.load(jar));

        assertTrue(ex.getMessage().contains("handler(payload, context)"));
    }

    @Test
    void shouldFailWhenMoreThanOneHandlerIsRegistered() throws Exception {
        Path jar = HandlerJars.withProviders(dir, EchoHandler.class.getName(), ConstantHandler.class.getName());

        StartupException ex = assertThrows(StartupException.class, () -> loader.load(jar));

        assertTrue(ex.getMessage().contains("more than one handler"));
    }

    @Test
    void shouldFailWhenStaticInitializerThrows() throws Exception {
        Path jar = HandlerJars.withProviders(dir, FailingInitializerHandler.class.getName());

        StartupException ex = assertThrows(StartupException.class, () -> loader.load(jar));

        assertTrue(ex.getMessage().startsWith("Failed to load user module"));
    }

    @Test
    void shouldFailWhenConstructorThrows() throws Exception {
        Path jar = HandlerJars.withProviders(dir, FailingConstructorHandler.class.getName());

        assertThrows(StartupException.class, () -> loader.load(jar));
    }

    @Test
    void shouldFailWhenRegisteredClassIsNotHandler() throws Exception {
        Path jar = HandlerJars.withProviders(dir, NotAHandler.class.getName());

        assertThrows(StartupException.class, () -> loader.load(jar));
    }

    @Test
    void shouldFailWhenRegisteredClassDoesNotExist() throws Exception {
        Path jar = HandlerJars.withProviders(dir, "com.example.MissingHandler");

        assertThrows(StartupException.class, () -> loader.load(jar));
    }

    @Test
    void shouldLoadHandlerWhoseBytecodeIsOnlyInTheJar() throws Exception {
        Path jar = HandlerJars.withBundledProviders(dir, EchoHandler.class);
        HandlerLoader isolated = new HandlerLoader(fixturesHidden());

        LoadedHandler loaded = isolated.load(jar);

        Class<?> loadedType = loaded.handler().getClass();
        assertEquals(EchoHandler.class.getName(), loadedType.getName());
        assertNotSame(EchoHandler.class, loadedType);
        assertEquals("usermodule", loadedType.getClassLoader().getName());

        RuntimeConfig config = new RuntimeConfig("localhost", 6379, "metrics", "metrics-output",
                jar, null, null, null, Map.of());
        Object result = loaded.handler().handler(Map.of("x", 1),
                DefaultRuntimeContext.of(config, loaded.sourceModifiedAt()));
        assertEquals(Map.of("x", 1, "outputKey", "metrics-output"), result);
    }

    @Test
    void shouldFailWhenRegisteredClassIsNotBundled() throws Exception {
        Path jar = HandlerJars.withProviders(dir, EchoHandler.class.getName());
        HandlerLoader isolated = new HandlerLoader(fixturesHidden());

        StartupException ex = assertThrows(StartupException.class, () -> isolated.load(jar));

        assertTrue(ex.getMessage().startsWith("Failed to load user module"));
    }

    private static ClassLoader fixturesHidden() {
        return new HidingClassLoader(HandlerLoaderTest.class.getClassLoader(),
                EchoHandler.class.getPackageName());
    }
}
