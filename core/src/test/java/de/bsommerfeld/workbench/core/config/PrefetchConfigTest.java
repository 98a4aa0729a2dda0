package de.bsommerfeld.workbench.core.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Limit resolution, including the warnings for values that cannot be used.
 */
class PrefetchConfigTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger(PrefetchConfig.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attachAppender() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        logger.detachAppender(appender);
    }

    private List<String> warnings() {
        return appender.list.stream()
                .filter(e -> e.getLevel() == Level.WARN)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
    }

    @Test
    void zeroTierLimit_shouldInheritGlobalLimitSilently() {
        var config = new PrefetchConfig();
        config.setConcurrencyLimit(5);

        assertEquals(5, config.resolvePriorityLimit());
        assertTrue(warnings().isEmpty());
    }

    @Test
    void negativeTierLimit_shouldFallBackToGlobalLimitWithWarning() {
        var config = new PrefetchConfig();
        config.setConcurrencyLimit(4);
        config.setBackgroundConcurrencyLimit(-2);

        assertEquals(4, config.resolveBackgroundLimit());
        assertEquals(1, warnings().size());
        assertTrue(warnings().get(0).contains("background-concurrency-limit = -2"));
    }

    @Test
    void invalidGlobalLimit_shouldFallBackToDefaultWithWarning() {
        var config = new PrefetchConfig();
        config.setConcurrencyLimit(-1);

        assertEquals(PrefetchConfig.DEFAULT_CONCURRENCY_LIMIT, config.resolvePriorityLimit());
        assertEquals(1, warnings().size());
        assertTrue(warnings().get(0).contains("concurrency-limit = -1"));
    }

    @Test
    void validLimits_shouldNotWarn() {
        var config = new PrefetchConfig();
        config.setPriorityConcurrencyLimit(2);

        assertEquals(2, config.resolvePriorityLimit());
        assertEquals(3, config.resolveBackgroundLimit());
        assertTrue(warnings().isEmpty());
    }
}
