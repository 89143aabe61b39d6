package me.golemcore.threads.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.threads.domain.conversation.SystemIdentity;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;

class AutoConfigurationTest {

    @Test
    void defaultPropertiesShouldBeValid() {
        assertDoesNotThrow(() -> AutoConfiguration.validate(new BotProperties()));
    }

    @Test
    void shouldRejectNonPositiveLimits() {
        BotProperties batchLimit = new BotProperties();
        batchLimit.getDebounce().setBatchLimit(0);
        BotProperties window = new BotProperties();
        window.getDebounce().setWindow(Duration.ZERO);
        BotProperties threadCap = new BotProperties();
        threadCap.getPipeline().setThreadCap(-1);

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> AutoConfiguration.validate(batchLimit));
        assertTrue(ex.getMessage().contains("bot.debounce.batch-limit"));
        assertThrows(IllegalStateException.class, () -> AutoConfiguration.validate(window));
        assertThrows(IllegalStateException.class, () -> AutoConfiguration.validate(threadCap));
    }

    @Test
    void shouldRejectBlankIdentityName() {
        BotProperties properties = new BotProperties();
        properties.getIdentity().setName(" ");

        assertThrows(IllegalStateException.class, () -> AutoConfiguration.validate(properties));
    }

    @Test
    void shouldBuildIdentityFromProperties() {
        BotProperties properties = new BotProperties();
        properties.getIdentity().setName("Nova");
        properties.getIdentity().setAliases(List.of("nv"));

        SystemIdentity identity = new AutoConfiguration(properties).systemIdentity();

        assertEquals("Nova", identity.name());
        assertTrue(identity.isNamedIn("hey nv, you there"));
        assertEquals("system:self", identity.selfId());
    }

    @Test
    void objectMapperShouldWriteInstantsAsIsoText() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        assertEquals("\"2026-03-01T12:00:00Z\"", mapper.writeValueAsString(Instant.parse("2026-03-01T12:00:00Z")));
    }

    @Test
    void executorsShouldUseNamedDaemonThreads() throws Exception {
        AutoConfiguration configuration = new AutoConfiguration(new BotProperties());
        ScheduledExecutorService scheduler = configuration.debounceScheduler();
        ExecutorService workers = configuration.conversationWorkerExecutor();
        try {
            Thread timerThread = scheduler.submit(Thread::currentThread).get();
            Thread workerThread = workers.submit(Thread::currentThread).get();

            assertTrue(timerThread.isDaemon());
            assertTrue(timerThread.getName().startsWith("debounce-timer-"));
            assertTrue(workerThread.isDaemon());
            assertTrue(workerThread.getName().startsWith("conversation-worker-"));
        } finally {
            scheduler.shutdownNow();
            workers.shutdownNow();
        }
    }
}
