package me.golemcore.threads.lifecycle;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.threads.domain.conversation.ConversationTracker;
import me.golemcore.threads.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background driver of the thread lifecycle.
 *
 * <p>
 * On startup it restores persisted tracker state. Every tick it:
 * <ul>
 * <li>advances thread states and archives threads that died</li>
 * <li>persists the tracker when something changed</li>
 * <li>once a day, removes archive files past retention</li>
 * </ul>
 *
 * <p>
 * Ticks never overlap: if one is still running, the next is skipped. State is
 * saved one final time on shutdown.
 *
 * @since 1.0
 * @see ConversationTracker#tick(Instant)
 */
@Component
@Slf4j
public class ThreadLifecycleScheduler {

    private static final Duration ARCHIVE_CLEANUP_INTERVAL = Duration.ofDays(1);

    private final ConversationTracker tracker;
    private final BotProperties properties;
    private final Clock clock;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;
    private volatile Instant lastArchiveCleanup;

    public ThreadLifecycleScheduler(ConversationTracker tracker, BotProperties properties, Clock clock) {
        this.tracker = tracker;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        tracker.loadState();

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "thread-lifecycle-scheduler");
            // Non-daemon: nothing else keeps a headless process running.
            t.setDaemon(false);
            return t;
        });

        long intervalMillis = properties.getConversation().getTickInterval().toMillis();
        tickTask = scheduler.scheduleAtFixedRate(
                this::tick,
                intervalMillis,
                intervalMillis,
                TimeUnit.MILLISECONDS);

        log.info("[Lifecycle] Started with tick interval: {}ms", intervalMillis);
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        tracker.saveIfDirty();
        log.info("[Lifecycle] Shut down");
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Lifecycle] Tick skipped: previous execution still in progress");
            return;
        }
        try {
            int archived = tracker.archiveDeadThreads();
            if (archived > 0) {
                log.debug("[Lifecycle] Tick archived {} threads", archived);
            }
            tracker.saveIfDirty();
            cleanupArchivesIfDue();
        } catch (Exception e) { // NOSONAR - must not kill the scheduler thread
            log.error("[Lifecycle] Tick failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }

    private void cleanupArchivesIfDue() {
        Instant now = clock.instant();
        Instant last = lastArchiveCleanup;
        if (last != null && Duration.between(last, now).compareTo(ARCHIVE_CLEANUP_INTERVAL) < 0) {
            return;
        }
        lastArchiveCleanup = now;
        int retentionDays = properties.getConversation().getArchiveRetentionDays();
        int deleted = tracker.deleteExpiredArchives(retentionDays);
        if (deleted > 0) {
            log.info("[Lifecycle] Deleted {} archive files older than {} days", deleted, retentionDays);
        }
    }
}
