package me.golemcore.threads.domain.pipeline;

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
import me.golemcore.threads.domain.conversation.ConversationTracker;
import me.golemcore.threads.domain.conversation.SystemIdentity;
import me.golemcore.threads.domain.intake.BatchHandler;
import me.golemcore.threads.domain.model.ConversationThread;
import me.golemcore.threads.domain.model.FocusDirective;
import me.golemcore.threads.domain.model.InboundMessage;
import me.golemcore.threads.domain.model.OutboundReply;
import me.golemcore.threads.domain.model.ReplyRequest;
import me.golemcore.threads.domain.model.ThreadedContext;
import me.golemcore.threads.infrastructure.config.BotProperties;
import me.golemcore.threads.port.outbound.FocusPort;
import me.golemcore.threads.port.outbound.OutboundDispatchPort;
import me.golemcore.threads.port.outbound.ReplyGeneratorPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Processes one debounced batch of a conversation end to end.
 *
 * <p>
 * Steps:
 * <ol>
 * <li>tag messages that sat in the buffers too long as stale</li>
 * <li>classify and apply the deterministic overrides</li>
 * <li>batches with nothing to answer are only ingested (lurk)</li>
 * <li>otherwise ingest, then reply either once with the full threaded context
 * or once per reply-worthy thread, capped per cycle</li>
 * </ol>
 *
 * <p>
 * Shown cursors advance only after a reply was delivered. A failure in one
 * per-thread reply does not affect the others. Tracker state is saved at the
 * end of every batch if anything changed. An interrupted worker (hard reset)
 * leaves the tracker untouched once classification returns.
 */
@Service
@Slf4j
public class BatchPipeline implements BatchHandler {

    private final ConversationTracker tracker;
    private final MessageClassificationService classificationService;
    private final ReplyGeneratorPort replyGenerator;
    private final OutboundDispatchPort dispatchPort;
    private final FocusPort focusPort;
    private final ReplyTargetResolver replyTargetResolver;
    private final SystemIdentity identity;
    private final Clock clock;
    private final BotProperties.PipelineProperties settings;

    public BatchPipeline(ConversationTracker tracker, MessageClassificationService classificationService,
            ReplyGeneratorPort replyGenerator, OutboundDispatchPort dispatchPort, FocusPort focusPort,
            ReplyTargetResolver replyTargetResolver, SystemIdentity identity, Clock clock,
            BotProperties properties) {
        this.tracker = tracker;
        this.classificationService = classificationService;
        this.replyGenerator = replyGenerator;
        this.dispatchPort = dispatchPort;
        this.focusPort = focusPort;
        this.replyTargetResolver = replyTargetResolver;
        this.identity = identity;
        this.clock = clock;
        this.settings = properties.getPipeline();
    }

    @Override
    public void handle(String conversationKey, List<InboundMessage> batch) {
        if (batch.isEmpty()) {
            return;
        }
        try {
            tagStale(batch);
            ClassifiedBatch classified = classificationService.classify(conversationKey, batch);
            log.debug("[Pipeline] {}: {} respond, {} context, {} dropped", conversationKey,
                    classified.respond().size(), classified.context().size(), classified.dropped());
            if (Thread.currentThread().isInterrupted()) {
                log.info("[Pipeline] {} interrupted during classification, batch discarded", conversationKey);
                return;
            }

            if (!classified.hasRespond()) {
                if (!classified.context().isEmpty()) {
                    tracker.ingestBatch(List.of(), classified.context(), conversationKey);
                }
                return;
            }

            tracker.ingestBatch(classified.respond(), classified.context(), conversationKey);
            if (Thread.currentThread().isInterrupted()) {
                log.info("[Pipeline] {} interrupted before dispatch", conversationKey);
                return;
            }

            InboundMessage trigger = selectTrigger(classified.respond());
            List<String> threadIds = tracker.respondThreadIds(conversationKey);
            if (threadIds.size() > 1) {
                dispatchPerThread(conversationKey, threadIds, classified, trigger);
            } else {
                dispatchCombined(conversationKey, classified, trigger);
            }
        } finally {
            if (!Thread.currentThread().isInterrupted()) {
                tracker.saveIfDirty();
            }
        }
    }

    void tagStale(List<InboundMessage> batch) {
        Instant now = clock.instant();
        Duration maxAge = settings.getStaleMessageAge();
        for (InboundMessage message : batch) {
            if (message.getTimestamp() == null) {
                continue;
            }
            Duration age = Duration.between(message.getTimestamp(), now);
            if (age.compareTo(maxAge) > 0) {
                message.setStale(true);
                message.setStaleMinutes((int) age.toMinutes());
            }
        }
    }

    /**
     * The last respond message, unless a later one names the system or
     * replies to it.
     */
    InboundMessage selectTrigger(List<InboundMessage> respond) {
        InboundMessage trigger = respond.get(respond.size() - 1);
        for (InboundMessage message : respond) {
            if (message.isReplyToSystem() || identity.isNamedIn(message.safeContent())) {
                trigger = message;
            }
        }
        return trigger;
    }

    private void dispatchCombined(String conversationKey, ClassifiedBatch classified, InboundMessage trigger) {
        ThreadedContext context = tracker.buildContext(classified.respond(), classified.context(), conversationKey);
        try {
            deliver(conversationKey, context, trigger, classified.respond().size(), null,
                    context.getShownThreadIds());
        } catch (DispatchException e) {
            log.error("[Pipeline] Reply failed for {}: {}", conversationKey, e.getMessage(), e);
        }
    }

    private void dispatchPerThread(String conversationKey, List<String> threadIds, ClassifiedBatch classified,
            InboundMessage batchTrigger) {
        int cap = settings.getThreadCap();
        List<String> selected = threadIds.subList(0, Math.min(cap, threadIds.size()));
        if (threadIds.size() > cap) {
            log.info("[Pipeline] {}: {} threads need replies, deferring {} to the next cycle", conversationKey,
                    threadIds.size(), threadIds.size() - cap);
        }

        for (String threadId : selected) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("[Pipeline] {} interrupted during per-thread dispatch", conversationKey);
                return;
            }
            try {
                Optional<ThreadedContext> built = tracker.buildThreadContext(threadId, conversationKey);
                if (built.isEmpty()) {
                    log.debug("[Pipeline] Thread {} vanished before dispatch", threadId);
                    continue;
                }
                ThreadedContext context = built.get();
                focusPort.setFocus(FocusDirective.builder()
                        .conversationKey(conversationKey)
                        .threadId(threadId)
                        .primaryAuthorName(context.getPrimaryAuthorName())
                        .build());

                List<InboundMessage> inThread = batchMessagesIn(threadId, classified.respond());
                InboundMessage trigger = inThread.isEmpty() ? batchTrigger : inThread.get(inThread.size() - 1);
                deliver(conversationKey, context, trigger, Math.max(1, inThread.size()), threadId,
                        List.of(threadId));
            } catch (Exception e) { // NOSONAR - one thread's failure must not abort the others
                log.error("[Pipeline] Reply for thread {} in {} failed: {}", threadId, conversationKey,
                        e.getMessage(), e);
            } finally {
                focusPort.clearFocus(conversationKey);
            }
        }
    }

    private List<InboundMessage> batchMessagesIn(String threadId, List<InboundMessage> messages) {
        Optional<ConversationThread> thread = tracker.findThread(threadId);
        if (thread.isEmpty()) {
            return List.of();
        }
        return messages.stream()
                .filter(InboundMessage::hasMessageId)
                .filter(m -> thread.get().containsMessage(m.getMessageId()))
                .toList();
    }

    private void deliver(String conversationKey, ThreadedContext context, InboundMessage trigger,
            int messageCount, String threadId, List<String> threadsToCommit) {
        ReplyRequest request = ReplyRequest.builder()
                .conversationKey(conversationKey)
                .context(context)
                .trigger(trigger)
                .messageCount(messageCount)
                .build();

        Optional<String> reply = await(replyGenerator.generate(request), "generate reply");
        if (reply == null || reply.isEmpty() || reply.get().isBlank()) {
            log.debug("[Pipeline] No reply for {}", conversationKey);
            return;
        }

        String text = reply.get();
        OutboundReply outbound = OutboundReply.builder()
                .channelType(trigger.getChannelType())
                .chatId(trigger.getChatId())
                .content(text)
                .replyToMessageId(replyTargetResolver.resolve(context, trigger))
                .collapsedCount(messageCount)
                .threadId(threadId)
                .build();
        await(dispatchPort.send(outbound), "send reply");

        tracker.commitShownIndices(threadsToCommit);
        tracker.markReplySent(context.getCoveredMessageIds(), text);
        log.info("[Pipeline] Replied in {} ({} messages{})", conversationKey, messageCount,
                threadId != null ? ", thread " + threadId : "");
    }

    private <T> T await(CompletableFuture<T> future, String action) {
        Duration timeout = settings.getReplyTimeout();
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DispatchException("Timed out after " + timeout.toMillis() + "ms: " + action, e);
        } catch (ExecutionException e) {
            throw new DispatchException("Failed to " + action, e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException("Interrupted: " + action, e);
        }
    }
}
