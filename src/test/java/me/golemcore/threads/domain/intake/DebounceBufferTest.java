package me.golemcore.threads.domain.intake;

import me.golemcore.threads.domain.model.InboundMessage;
import me.golemcore.threads.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static me.golemcore.threads.testsupport.TestMessages.KEY;
import static me.golemcore.threads.testsupport.TestMessages.inbound;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class DebounceBufferTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> timer;
    private BatchSink sink;
    private DebounceBuffer buffer;

    @BeforeEach
    void setUp() {
        scheduler = mock(ScheduledExecutorService.class);
        timer = mock(ScheduledFuture.class);
        doReturn(timer).when(scheduler).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        sink = mock(BatchSink.class);

        BotProperties properties = new BotProperties();
        properties.getDebounce().setWindow(Duration.ofMillis(3500));
        properties.getDebounce().setBatchLimit(3);
        properties.getDebounce().setMaxBuffer(5);
        buffer = new DebounceBuffer(scheduler, sink, properties);
    }

    private static InboundMessage message(int n) {
        return inbound("m" + n, "alice", "message " + n, T0.plusSeconds(n));
    }

    private Runnable lastScheduledTimer() {
        ArgumentCaptor<Runnable> captor = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler, atLeastOnce()).schedule(captor.capture(), eq(3500L), eq(TimeUnit.MILLISECONDS));
        return captor.getValue();
    }

    @Test
    void shouldFlushWhenWindowElapses() {
        buffer.add(message(1));
        buffer.add(message(2));

        verify(sink, never()).submitBatch(anyString(), anyList());
        assertEquals(2, buffer.bufferedCount(KEY));

        lastScheduledTimer().run();

        verify(sink).submitBatch(KEY, List.of(message(1), message(2)));
        assertEquals(0, buffer.bufferedCount(KEY));
    }

    @Test
    void shouldFlushImmediatelyAtBatchLimit() {
        buffer.add(message(1));
        buffer.add(message(2));
        buffer.add(message(3));

        verify(sink).submitBatch(KEY, List.of(message(1), message(2), message(3)));
        verify(scheduler, times(2)).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        assertEquals(0, buffer.bufferedCount(KEY));
    }

    @Test
    void outdatedTimerShouldDoNothing() {
        buffer.add(message(1));
        Runnable first = lastScheduledTimer();
        buffer.add(message(2));
        Runnable second = lastScheduledTimer();

        first.run();
        verify(sink, never()).submitBatch(anyString(), anyList());
        verify(timer).cancel(false);

        second.run();
        verify(sink).submitBatch(KEY, List.of(message(1), message(2)));
    }

    @Test
    void timerAfterCountFlushShouldDoNothing() {
        buffer.add(message(1));
        Runnable pending = lastScheduledTimer();
        buffer.add(message(2));
        buffer.add(message(3));

        pending.run();

        verify(sink, times(1)).submitBatch(anyString(), anyList());
    }

    @Test
    void shouldDropOldestBeyondHardCap() {
        BotProperties properties = new BotProperties();
        properties.getDebounce().setBatchLimit(10);
        properties.getDebounce().setMaxBuffer(3);
        buffer = new DebounceBuffer(scheduler, sink, properties);

        for (int i = 1; i <= 5; i++) {
            buffer.add(message(i));
        }
        assertEquals(3, buffer.bufferedCount(KEY));

        lastScheduledTimer().run();

        verify(sink).submitBatch(KEY, List.of(message(3), message(4), message(5)));
    }

    @Test
    void shouldKeepConversationsSeparate() {
        InboundMessage other = inbound("x1", "bob", "elsewhere", T0);
        other.setChatId("random");

        buffer.add(message(1));
        buffer.add(other);
        buffer.add(message(2));

        assertEquals(2, buffer.bufferedCount(KEY));
        assertEquals(1, buffer.bufferedCount("discord:random"));
    }

    @Test
    void flushShouldSendBufferNow() {
        buffer.add(message(1));

        assertEquals(1, buffer.flush(KEY));
        assertEquals(0, buffer.flush(KEY));
        assertEquals(0, buffer.flush("discord:unknown"));

        verify(sink).submitBatch(KEY, List.of(message(1)));
    }

    @Test
    void resetShouldDiscardEverythingAndDisarmTimers() {
        buffer.add(message(1));
        buffer.add(message(2));
        Runnable pending = lastScheduledTimer();

        assertEquals(2, buffer.reset());
        pending.run();

        verify(sink, never()).submitBatch(anyString(), anyList());
        assertEquals(0, buffer.bufferedCount(KEY));
    }
}
