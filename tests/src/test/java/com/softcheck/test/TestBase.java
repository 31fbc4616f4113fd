package com.softcheck.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for all test suites.
 *
 * <p>Logs the start and end of each test and offers Given/When/Then step logging.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private long startNanos;

    @BeforeEach
    void logTestStart(TestInfo testInfo) {
        startNanos = System.nanoTime();
        logger.debug("Starting test: {}", testInfo.getDisplayName());
    }

    @AfterEach
    void logTestEnd(TestInfo testInfo) {
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.debug("Finished test: {} ({} ms)", testInfo.getDisplayName(), elapsedMs);
    }

    /**
     * Logs a Given/When/Then step.
     */
    protected void logStep(String step) {
        logger.info("  {}", step);
    }

    /**
     * Logs a named value observed during the test.
     */
    protected void logData(String label, Object value) {
        logger.info("    {}: {}", label, value);
    }
}
