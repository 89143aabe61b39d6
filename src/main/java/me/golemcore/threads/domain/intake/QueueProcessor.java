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

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs batches of one conversation strictly one at a time, in flush order.
 *
 * <p>
 * Each conversation key gets a queue with at most one running worker task.
 * When a run finishes and more than one batch has piled up, all of them are
 * merged into one batch capped at {@code bot.queue.merge-cap}, keeping the
 * newest messages. An idle queue with nothing left is evicted.
 *
 * <p>
 * {@link #reset()} returns only after interrupted workers have left the
 * handler, so nothing they do can land after the caller clears state.
 */
@Component
@Slf4j
public class QueueProcessor implements BatchSink {

    static final Duration RESET_WAIT = Duration.ofSeconds(10);

    private final ExecutorService workerExecutor;
    private final BatchHandler handler;
    private final BotProperties.QueueProperties settings;

    private final Map<String, ConversationQueue> queues = new ConcurrentHashMap<>();

    public QueueProcessor(@Qualifier("conversationWorkerExecutor") ExecutorService workerExecutor,
            BatchHandler handler, BotProperties properties) {
        this.workerExecutor = workerExecutor;
        this.handler = handler;
        this.settings = properties.getQueue();
    }

    @Override
    public void submitBatch(String conversationKey, List<InboundMessage> batch) {
        if (batch == null || batch.isEmpty()) {
            return;
        }
        List<InboundMessage> copy = List.copyOf(batch);
        while (true) {
            ConversationQueue queue = queues.computeIfAbsent(conversationKey, ConversationQueue::new);
            if (queue.enqueue(copy)) {
                return;
            }
        }
    }

    public int queueDepth(String conversationKey) {
        ConversationQueue queue = queues.get(conversationKey);
        return queue != null ? queue.depth() : 0;
    }

    public boolean isProcessing(String conversationKey) {
        ConversationQueue queue = queues.get(conversationKey);
        return queue != null && queue.isProcessing();
    }

    /**
     * Drops every queued batch, interrupts every running worker and waits up
     * to {@link #RESET_WAIT} for the interrupted workers to finish.
     */
    public ResetCounts reset() {
        int droppedBatches = 0;
        int cancelledWorkers = 0;
        List<CountDownLatch> inFlight = new ArrayList<>();
        for (ConversationQueue queue : queues.values()) {
            ClosedQueue closed = queue.close();
            droppedBatches += closed.droppedBatches();
            cancelledWorkers += closed.cancelledWorkers();
            if (closed.inFlight() != null) {
                inFlight.add(closed.inFlight());
            }
        }
        queues.clear();
        awaitStopped(inFlight);
        if (droppedBatches > 0 || cancelledWorkers > 0) {
            log.warn("[Queue] Reset: dropped {} queued batches, cancelled {} workers", droppedBatches,
                    cancelledWorkers);
        }
        return new ResetCounts(droppedBatches, cancelledWorkers);
    }

    private void awaitStopped(List<CountDownLatch> inFlight) {
        long deadline = System.nanoTime() + RESET_WAIT.toNanos();
        try {
            for (CountDownLatch done : inFlight) {
                long remaining = deadline - System.nanoTime();
                if (!done.await(Math.max(0, remaining), TimeUnit.NANOSECONDS)) {
                    log.warn("[Queue] Reset: a cancelled worker is still running after {}", RESET_WAIT);
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Queue] Reset interrupted while waiting for workers to stop");
        }
    }

    /**
     * Flattens queued batches oldest first and keeps the newest {@code cap}
     * messages.
     */
    static List<InboundMessage> mergeNewest(Iterable<List<InboundMessage>> batches, int cap) {
        List<InboundMessage> merged = new ArrayList<>();
        for (List<InboundMessage> batch : batches) {
            merged.addAll(batch);
        }
        if (merged.size() <= cap) {
            return merged;
        }
        return new ArrayList<>(merged.subList(merged.size() - cap, merged.size()));
    }

    public record ResetCounts(int droppedBatches, int cancelledWorkers) {
    }

    private record ClosedQueue(int droppedBatches, int cancelledWorkers, CountDownLatch inFlight) {
    }

    private final class ConversationQueue {

        private final String key;
        private final Object lock = new Object();
        private final Deque<List<InboundMessage>> batches = new ArrayDeque<>();

        private Future<?> runningTask;
        private boolean runStarted;
        private CountDownLatch runDone;
        private boolean closed;

        private ConversationQueue(String key) {
            this.key = key;
        }

        /**
         * @return false if this queue was evicted and the caller must retry
         */
        boolean enqueue(List<InboundMessage> batch) {
            synchronized (lock) {
                if (closed) {
                    return false;
                }
                if (isRunning()) {
                    batches.addLast(batch);
                    log.debug("[Queue] {} busy, queued batch of {} (depth {})", key, batch.size(),
                            batches.size());
                } else {
                    startRunLocked(batch);
                }
                return true;
            }
        }

        int depth() {
            synchronized (lock) {
                return batches.size();
            }
        }

        boolean isProcessing() {
            synchronized (lock) {
                return isRunning();
            }
        }

        ClosedQueue close() {
            synchronized (lock) {
                closed = true;
                int dropped = batches.size();
                batches.clear();
                int cancelled = 0;
                CountDownLatch inFlight = null;
                if (runningTask != null) {
                    if (runStarted) {
                        inFlight = runDone;
                    }
                    if (runningTask.cancel(true)) {
                        cancelled = 1;
                    }
                }
                runningTask = null;
                return new ClosedQueue(dropped, cancelled, inFlight);
            }
        }

        private boolean isRunning() {
            return runningTask != null && !runningTask.isDone();
        }

        private void startRunLocked(List<InboundMessage> batch) {
            CountDownLatch done = new CountDownLatch(1);
            runStarted = false;
            runDone = done;
            runningTask = workerExecutor.submit(() -> {
                try {
                    if (markStarted()) {
                        runBatch(batch);
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        private boolean markStarted() {
            synchronized (lock) {
                if (closed) {
                    return false;
                }
                runStarted = true;
                return true;
            }
        }

        private void runBatch(List<InboundMessage> batch) {
            try {
                handler.handle(key, batch);
            } catch (Exception e) { // NOSONAR - must not kill executor thread
                handleRunFailure(e);
            } finally {
                onRunComplete();
            }
        }

        private void handleRunFailure(Exception e) {
            if (e instanceof InterruptedException || Thread.currentThread().isInterrupted()) {
                Thread.currentThread().interrupt();
                log.info("[Queue] Batch processing interrupted: {}", key);
                return;
            }
            log.error("[Queue] Batch processing failed for {}: {}", key, e.getMessage(), e);
        }

        private void onRunComplete() {
            synchronized (lock) {
                runningTask = null;
                if (closed) {
                    return;
                }
                List<InboundMessage> next = dequeueNextLocked();
                if (next != null) {
                    startRunLocked(next);
                    return;
                }
                closed = true;
                queues.remove(key, this);
                log.debug("[Queue] Evicted idle queue {}", key);
            }
        }

        private List<InboundMessage> dequeueNextLocked() {
            if (batches.isEmpty()) {
                return null;
            }
            if (batches.size() == 1) {
                return batches.removeFirst();
            }
            int batchCount = batches.size();
            int total = batches.stream().mapToInt(List::size).sum();
            List<InboundMessage> merged = mergeNewest(batches, settings.getMergeCap());
            batches.clear();
            if (merged.size() < total) {
                log.warn("[Queue] Merged {} batches in {}: kept newest {} of {} messages", batchCount, key,
                        merged.size(), total);
            } else {
                log.info("[Queue] Merged {} batches in {} ({} messages)", batchCount, key, total);
            }
            return merged;
        }
    }
}
