package blockwise.coordinator.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerConfigTest {

    @Test
    void defaults() {
        SchedulerConfig config = SchedulerConfig.defaults();

        assertEquals(Runtime.getRuntime().availableProcessors(), config.maxTotalWorkers());
        assertEquals(1, config.defaultNumWorkers());
        assertEquals(0, config.defaultMaxRetries());
        assertFalse(config.hasDatabase());
        assertEquals(Duration.ofSeconds(5), config.progressInterval());
    }

    @Test
    void fluentSetters() {
        SchedulerConfig config = SchedulerConfig.defaults()
                .withMaxTotalWorkers(3)
                .withDefaultNumWorkers(2)
                .withDefaultMaxRetries(4)
                .withDatabaseUrl("jdbc:h2:mem:cfg")
                .withProgressInterval(Duration.ofMillis(100));

        assertEquals(3, config.maxTotalWorkers());
        assertEquals(2, config.defaultNumWorkers());
        assertEquals(4, config.defaultMaxRetries());
        assertTrue(config.hasDatabase());
        assertEquals(Duration.ofMillis(100), config.progressInterval());
    }

    @Test
    void rejectsInvalidValues() {
        SchedulerConfig config = SchedulerConfig.defaults();

        assertThrows(IllegalArgumentException.class, () -> config.withMaxTotalWorkers(0));
        assertThrows(IllegalArgumentException.class, () -> config.withDefaultNumWorkers(-1));
        assertThrows(IllegalArgumentException.class, () -> config.withDefaultMaxRetries(-1));
    }

    @Test
    void blankDatabaseUrlMeansNoStore() {
        assertFalse(SchedulerConfig.defaults().withDatabaseUrl("  ").hasDatabase());
    }

    @Test
    void dependenciesWithoutDatabaseHaveNoStore() {
        try (Dependencies deps = Dependencies.create(SchedulerConfig.defaults())) {
            assertNull(deps.database());
            assertNull(deps.blockDoneRepository());
            assertEquals(1, deps.progressBus().listenerCount());
            assertSame(deps.config(), deps.blockwiseService().config());
        }
    }
}
