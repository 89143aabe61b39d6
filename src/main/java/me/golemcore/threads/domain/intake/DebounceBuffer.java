package me.golemcore.threads.domain.intake;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.threads.domain.model.InboundMessage;
import me.golemcore.threads.infrastructure.config.BotProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Per-conversation debounce buffer.
 *
 * <p>
 * Messages accumulate in arrival order until one of two triggers fires:
 * <ul>
 * <li>the debounce window passes with no new arrival</li>
 * <li>the buffer reaches the batch limit, which flushes immediately</li>
 * </ul>
 * The whole buffer then goes to the {@link BatchSink} as one batch.
 *
 * <p>
 * Every arrival bumps the key's generation and schedules a check bound to
 * it. A timer whose generation is out of date does nothing, so a timer that
 * fires after a count flush or a reset is a no-op. Beyond the hard cap the
 * oldest messages are dropped.
 */
@Component
@Slf4j
public class DebounceBuffer {

    private final ScheduledExecutorService scheduler;
    private final BatchSink sink;
    private final BotProperties.DebounceProperties settings;

    private final Map<String, KeyBuffer> buffers = new ConcurrentHashMap<>();

    public DebounceBuffer(@Qualifier("debounceScheduler") ScheduledExecutorService scheduler, BatchSink sink,
            BotProperties properties) {
        this.scheduler = scheduler;
        this.sink = sink;
        this.settings = properties.getDebounce();
    }

    public void add(InboundMessage message) {
        String key = message.conversationKey();
        KeyBuffer buffer = buffers.computeIfAbsent(key, KeyBuffer::new);
        synchronized (buffer) {
            buffer.messages.add(message);
            long generation = ++buffer.generation;
            buffer.cancelTimer();

            int overflow = buffer.messages.size() - settings.getMaxBuffer();
            if (overflow > 0) {
                buffer.messages.subList(0, overflow).clear();
                log.warn("[Debounce] Buffer overflow in {}: dropped {} oldest messages", key, overflow);
            }

            if (buffer.messages.size() >= settings.getBatchLimit()) {
                log.debug("[Debounce] Batch limit reached in {}", key);
                flushLocked(buffer);
                return;
            }

            long delayMillis = settings.getWindow().toMillis();
            buffer.timer = scheduler.schedule(() -> onTimer(buffer, generation), delayMillis,
                    TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Flushes a conversation's buffer now.
     *
     * @return number of messages flushed
     */
    public int flush(String conversationKey) {
        KeyBuffer buffer = buffers.get(conversationKey);
        if (buffer == null) {
            return 0;
        }
        synchronized (buffer) {
            buffer.generation++;
            buffer.cancelTimer();
            return flushLocked(buffer);
        }
    }

    /**
     * Cancels every timer and discards every buffered message.
     *
     * @return number of messages discarded
     */
    public int reset() {
        int dropped = 0;
        for (KeyBuffer buffer : buffers.values()) {
            synchronized (buffer) {
                buffer.generation++;
                buffer.cancelTimer();
                dropped += buffer.messages.size();
                buffer.messages.clear();
            }
        }
        buffers.clear();
        return dropped;
    }

    public int bufferedCount(String conversationKey) {
        KeyBuffer buffer = buffers.get(conversationKey);
        if (buffer == null) {
            return 0;
        }
        synchronized (buffer) {
            return buffer.messages.size();
        }
    }

    private void onTimer(KeyBuffer buffer, long generation) {
        try {
            synchronized (buffer) {
                if (buffer.generation != generation) {
                    return;
                }
                buffer.timer = null;
                int flushed = flushLocked(buffer);
                if (flushed > 0) {
                    log.debug("[Debounce] Window elapsed in {}: flushed {} messages", buffer.key, flushed);
                }
            }
        } catch (Exception e) { // NOSONAR - must not kill scheduler thread
            log.error("[Debounce] Timer flush failed for {}", buffer.key, e);
        }
    }

    // Handing over under the buffer lock keeps batches of one key in flush order.
    private int flushLocked(KeyBuffer buffer) {
        if (buffer.messages.isEmpty()) {
            return 0;
        }
        List<InboundMessage> batch = new ArrayList<>(buffer.messages);
        buffer.messages.clear();
        sink.submitBatch(buffer.key, batch);
        return batch.size();
    }

    private static final class KeyBuffer {

        private final String key;
        private final List<InboundMessage> messages = new ArrayList<>();
        private long generation;
        private ScheduledFuture<?> timer;

        private KeyBuffer(String key) {
            this.key = key;
        }

        private void cancelTimer() {
            if (timer != null) {
                timer.cancel(false);
                timer = null;
            }
        }
    }
}
