package me.golemcore.threads.lifecycle;

import me.golemcore.threads.domain.conversation.ConversationTracker;
import me.golemcore.threads.infrastructure.config.BotProperties;
import me.golemcore.threads.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ThreadLifecycleSchedulerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    private ConversationTracker tracker;
    private BotProperties properties;
    private MutableClock clock;
    private ThreadLifecycleScheduler scheduler;

    @BeforeEach
    void setUp() {
        tracker = mock(ConversationTracker.class);
        properties = new BotProperties();
        properties.getConversation().setArchiveRetentionDays(30);
        clock = new MutableClock(T0);
        scheduler = new ThreadLifecycleScheduler(tracker, properties, clock);
    }

    @Test
    void tickShouldArchiveThenPersist() {
        when(tracker.archiveDeadThreads()).thenReturn(2);

        scheduler.tick();

        InOrder order = inOrder(tracker);
        order.verify(tracker).archiveDeadThreads();
        order.verify(tracker).saveIfDirty();
        order.verify(tracker).deleteExpiredArchives(30);
    }

    @Test
    void archiveCleanupShouldRunOncePerDay() {
        scheduler.tick();
        clock.advance(Duration.ofHours(23));
        scheduler.tick();

        verify(tracker, times(2)).archiveDeadThreads();
        verify(tracker, times(1)).deleteExpiredArchives(anyInt());

        clock.advance(Duration.ofHours(1));
        scheduler.tick();

        verify(tracker, times(2)).deleteExpiredArchives(anyInt());
    }

    @Test
    void failingTickShouldNotPropagate() {
        when(tracker.archiveDeadThreads()).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> scheduler.tick());
        assertDoesNotThrow(() -> scheduler.tick());

        verify(tracker, times(2)).archiveDeadThreads();
    }

    @Test
    void initShouldLoadStateAndShutdownShouldSave() {
        properties.getConversation().setTickInterval(Duration.ofHours(1));

        scheduler.init();
        scheduler.shutdown();

        InOrder order = inOrder(tracker);
        order.verify(tracker).loadState();
        order.verify(tracker).saveIfDirty();
    }
}
