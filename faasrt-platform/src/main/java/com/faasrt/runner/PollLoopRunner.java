package com.faasrt.runner;

import com.faasrt.worker.PollLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Runs the poll loop on the main thread once the context is up.
 */
@Component
@Profile("!seed")
public class PollLoopRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(PollLoopRunner.class);

    private final PollLoop pollLoop;

    public PollLoopRunner(PollLoop pollLoop) {
        this.pollLoop = pollLoop;
    }

    @Override
    public void run(String... args) {
        log.info("Starting poll loop...");
        try {
            pollLoop.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Poll loop interrupted, stopping");
        }
    }
}
