package me.golemcore.threads.domain.conversation;

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
import me.golemcore.threads.domain.model.ConversationThread;
import me.golemcore.threads.domain.model.InboundMessage;
import me.golemcore.threads.domain.model.MessageClassification;
import me.golemcore.threads.domain.model.PendingMessage;
import me.golemcore.threads.domain.model.ThreadMessage;
import me.golemcore.threads.domain.model.ThreadState;
import me.golemcore.threads.domain.model.ThreadedContext;
import me.golemcore.threads.domain.model.TrackerSnapshot;
import me.golemcore.threads.domain.model.TrackerStats;
import me.golemcore.threads.infrastructure.config.BotProperties;
import me.golemcore.threads.port.outbound.ThreadStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Owns every thread and pending message, assigns incoming messages to threads
 * and runs the thread lifecycle.
 *
 * <p>
 * Assignment order for each message:
 * <ol>
 * <li>replies to a message inside a thread join that thread</li>
 * <li>replies to a pending message promote it into a new thread</li>
 * <li>otherwise the best-scoring live thread wins if it reaches the threshold
 * and is not beaten by a pending message</li>
 * <li>else a pending message reaching the threshold is promoted</li>
 * <li>else the message itself becomes pending</li>
 * </ol>
 *
 * <p>
 * All state is guarded by one lock because conversation workers and the
 * lifecycle scheduler call in concurrently. Storage I/O happens outside that
 * lock; saves are serialized on their own lock and skipped when nothing
 * changed.
 */
@Service
@Slf4j
public class ConversationTracker {

    private static final int KEYWORD_WINDOW = 10;

    private final ThreadStorePort threadStore;
    private final SignalScorer signalScorer;
    private final KeywordExtractor keywordExtractor;
    private final ContextFormatter contextFormatter;
    private final SystemIdentity identity;
    private final Clock clock;

    private final Duration staleAfter;
    private final Duration deadAfter;
    private final int maxActivePerConversation;
    private final int maxMessages;
    private final double assignmentThreshold;

    private final Object lock = new Object();
    private final Object saveLock = new Object();

    private final Map<String, ConversationThread> threads = new LinkedHashMap<>();
    private final Map<String, String> messageToThread = new HashMap<>();
    private final List<PendingMessage> pending = new ArrayList<>();
    private final Map<String, ChannelState> channelStates = new HashMap<>();
    private final List<ConversationThread> unarchived = new ArrayList<>();
    private boolean dirty;

    public ConversationTracker(ThreadStorePort threadStore, SignalScorer signalScorer,
            KeywordExtractor keywordExtractor, ContextFormatter contextFormatter, SystemIdentity identity,
            Clock clock, BotProperties properties) {
        this.threadStore = threadStore;
        this.signalScorer = signalScorer;
        this.keywordExtractor = keywordExtractor;
        this.contextFormatter = contextFormatter;
        this.identity = identity;
        this.clock = clock;
        BotProperties.ConversationProperties conversation = properties.getConversation();
        this.staleAfter = conversation.getStaleAfter();
        this.deadAfter = conversation.getDeadAfter();
        this.maxActivePerConversation = conversation.getMaxActivePerConversation();
        this.maxMessages = conversation.getMaxMessages();
        this.assignmentThreshold = conversation.getAssignmentThreshold();
    }

    // ==================== Persistence ====================

    /**
     * Replaces live state with the persisted snapshot. Loaded history counts
     * as already shown, since it is part of the conversation's separately
     * persisted history. Anything that expired during downtime is ticked and
     * archived right away.
     */
    public void loadState() {
        TrackerSnapshot snapshot;
        try {
            snapshot = threadStore.load();
        } catch (RuntimeException e) {
            log.error("[Tracker] Failed to load thread state, starting empty", e);
            snapshot = TrackerSnapshot.empty();
        }

        synchronized (lock) {
            threads.clear();
            messageToThread.clear();
            pending.clear();
            for (ConversationThread thread : snapshot.threads()) {
                threads.put(thread.getId(), thread);
                for (String messageId : thread.getMessageIds()) {
                    messageToThread.put(messageId, thread.getId());
                }
                if (thread.normalizeShownIndex()) {
                    dirty = true;
                }
            }
            pending.addAll(snapshot.pending());
        }

        archiveDeadThreads();
        log.info("[Tracker] Loaded {} threads, {} pending", threadCount(), pendingCount());
    }

    public void saveState() {
        synchronized (saveLock) {
            TrackerSnapshot snapshot;
            synchronized (lock) {
                snapshot = snapshotLocked();
                dirty = false;
            }
            try {
                threadStore.save(snapshot);
                log.debug("[Tracker] Saved {} threads, {} pending", snapshot.threads().size(),
                        snapshot.pending().size());
            } catch (RuntimeException e) {
                synchronized (lock) {
                    dirty = true;
                }
                log.error("[Tracker] Failed to save thread state", e);
            }
        }
    }

    public void saveIfDirty() {
        if (isDirty()) {
            saveState();
        }
    }

    public boolean isDirty() {
        synchronized (lock) {
            return dirty;
        }
    }

    // ==================== Ingestion ====================

    /**
     * Assigns a classified batch to threads. Respond messages are processed
     * before context messages, each group in arrival order, so later messages
     * can join threads formed by earlier ones in the same call.
     */
    public void ingestBatch(List<InboundMessage> respond, List<InboundMessage> context, String conversationKey) {
        archiveDeadThreads();

        Instant now = clock.instant();
        synchronized (lock) {
            List<ThreadMessage> wrapped = new ArrayList<>();
            for (InboundMessage message : respond) {
                wrapped.add(wrap(message, MessageClassification.RESPOND, now));
            }
            for (InboundMessage message : context) {
                wrapped.add(wrap(message, MessageClassification.CONTEXT, now));
            }

            for (ThreadMessage message : wrapped) {
                assign(message, conversationKey, now);
            }

            ChannelState channelState = channelStates.computeIfAbsent(conversationKey, ChannelState::new);
            for (ThreadMessage message : wrapped) {
                channelState.update(message.getAuthorId(), message.getTimestamp(), false,
                        message.getClassification() == MessageClassification.RESPOND);
            }
            if (!wrapped.isEmpty()) {
                dirty = true;
            }
        }
    }

    private ThreadMessage wrap(InboundMessage message, MessageClassification classification, Instant now) {
        return ThreadMessage.builder()
                .messageId(message.getMessageId() != null ? message.getMessageId() : "")
                .authorName(message.displayName())
                .authorHandle(message.getAuthorHandle())
                .authorId(message.authorId())
                .content(message.safeContent())
                .timestamp(message.getTimestamp() != null ? message.getTimestamp() : now)
                .replyToMessageId(message.getReplyToMessageId())
                .replyToSystem(message.isReplyToSystem())
                .classification(classification)
                .fromSystem(false)
                .build();
    }

    private void assign(ThreadMessage message, String conversationKey, Instant now) {
        if (message.hasReplyTarget()) {
            ConversationThread replied = threadContaining(message.getReplyToMessageId(), conversationKey);
            if (replied != null) {
                log.debug("[Tracker] {} joins thread {} by reply", message.getMessageId(), shortId(replied));
                appendToThread(replied, message, now);
                return;
            }
            PendingMessage repliedPending = pendingWithId(message.getReplyToMessageId(), conversationKey);
            if (repliedPending != null) {
                promote(repliedPending, message, conversationKey);
                return;
            }
        }

        ConversationThread bestThread = null;
        double bestThreadScore = 0.0;
        for (ConversationThread thread : threads.values()) {
            if (!thread.isLive() || !conversationKey.equals(thread.getConversationKey())) {
                continue;
            }
            double score = signalScorer.scoreThread(message, thread).total();
            if (score > bestThreadScore) {
                bestThreadScore = score;
                bestThread = thread;
            }
        }

        PendingMessage bestPending = null;
        double bestPendingScore = 0.0;
        for (PendingMessage candidate : pending) {
            if (!conversationKey.equals(candidate.getConversationKey())) {
                continue;
            }
            double score = signalScorer.scorePending(message, candidate).total();
            if (score > bestPendingScore) {
                bestPendingScore = score;
                bestPending = candidate;
            }
        }

        if (bestThread != null && bestThreadScore >= assignmentThreshold && bestThreadScore >= bestPendingScore) {
            log.debug("[Tracker] {} assigned to thread {} (score {})", message.getMessageId(),
                    shortId(bestThread), bestThreadScore);
            appendToThread(bestThread, message, now);
            return;
        }
        if (bestPending != null && bestPendingScore >= assignmentThreshold) {
            promote(bestPending, message, conversationKey);
            return;
        }

        pending.add(PendingMessage.builder()
                .message(message)
                .conversationKey(conversationKey)
                .createdAt(now)
                .build());
        log.debug("[Tracker] {} pending in {}", message.getMessageId(), conversationKey);
    }

    private void appendToThread(ConversationThread thread, ThreadMessage message, Instant now) {
        if (shouldSplit(message, thread)) {
            split(thread, message, now);
            return;
        }

        List<ThreadMessage> trimmed = thread.addMessage(message, maxMessages);
        unindex(trimmed, thread.getId());
        index(message, thread.getId());
        refreshKeywords(thread);

        if (thread.getState() != ThreadState.RESOLVED && isResolvedBy(thread, message)) {
            thread.transitionTo(ThreadState.RESOLVED, now);
            log.debug("[Tracker] Thread {} resolved by {}", shortId(thread), message.displayName());
        } else if (thread.getState() == ThreadState.STALE) {
            thread.transitionTo(ThreadState.ACTIVE, now);
            log.debug("[Tracker] Thread {} reactivated", shortId(thread));
        }
    }

    /**
     * A topic-shift marker plus zero keyword overlap with the thread. Known to
     * fragment a coherent thread when someone says "btw" mid-topic.
     */
    boolean shouldSplit(ThreadMessage message, ConversationThread thread) {
        if (!ConversationPatterns.hasShiftMarker(message.getContent())) {
            return false;
        }
        Set<String> messageWords = keywordExtractor.extractSet(message.getContent());
        if (messageWords.isEmpty()) {
            return false;
        }
        return thread.getTopicKeywords().stream().noneMatch(messageWords::contains);
    }

    private static boolean isResolvedBy(ConversationThread thread, ThreadMessage message) {
        if (thread.getParticipantCount() < 2 || thread.getMessageCount() < 3) {
            return false;
        }
        return ConversationPatterns.isResolution(message.getContent());
    }

    private void split(ConversationThread parent, ThreadMessage message, Instant now) {
        ConversationThread child = ConversationThread.createChild(parent, now);
        child.addMessage(message, maxMessages);
        child.updateTopicKeywords(keywordExtractor.extract(message.getContent()));
        parent.addChild(child.getId());
        threads.put(child.getId(), child);
        indexAll(child);
        log.debug("[Tracker] Thread split {} -> {} (trigger: {})", shortId(parent), shortId(child),
                message.displayName());
    }

    private void promote(PendingMessage candidate, ThreadMessage message, String conversationKey) {
        ThreadMessage first = candidate.getMessage();
        Instant startedAt = first.getTimestamp() != null ? first.getTimestamp() : candidate.getCreatedAt();
        ConversationThread thread = ConversationThread.create(conversationKey, startedAt);
        thread.addMessage(first, maxMessages);
        thread.addMessage(message, maxMessages);
        thread.updateTopicKeywords(keywordExtractor.extract(first.getContent() + " " + message.getContent()));

        threads.put(thread.getId(), thread);
        indexAll(thread);
        pending.remove(candidate);
        log.debug("[Tracker] Promoted pending -> thread {} ({} + {})", shortId(thread), first.displayName(),
                message.displayName());
    }

    private void refreshKeywords(ConversationThread thread) {
        String recentText = thread.recentMessages(KEYWORD_WINDOW).stream()
                .map(ThreadMessage::getContent)
                .collect(Collectors.joining(" "));
        thread.updateTopicKeywords(keywordExtractor.extract(recentText));
    }

    private void index(ThreadMessage message, String threadId) {
        if (message.hasMessageId()) {
            messageToThread.put(message.getMessageId(), threadId);
        }
    }

    private void indexAll(ConversationThread thread) {
        for (ThreadMessage kept : thread.getMessages()) {
            index(kept, thread.getId());
        }
    }

    private void unindex(Collection<ThreadMessage> messages, String threadId) {
        for (ThreadMessage message : messages) {
            if (message.hasMessageId()) {
                messageToThread.remove(message.getMessageId(), threadId);
            }
        }
    }

    private ConversationThread threadContaining(String messageId, String conversationKey) {
        String threadId = messageToThread.get(messageId);
        if (threadId == null) {
            return null;
        }
        ConversationThread thread = threads.get(threadId);
        if (thread == null || !conversationKey.equals(thread.getConversationKey())) {
            return null;
        }
        return thread;
    }

    private PendingMessage pendingWithId(String messageId, String conversationKey) {
        for (PendingMessage candidate : pending) {
            if (conversationKey.equals(candidate.getConversationKey())
                    && messageId.equals(candidate.getMessageId())) {
                return candidate;
            }
        }
        return null;
    }

    // ==================== Lifecycle ====================

    /**
     * Advances the lifecycle state machine:
     * <ul>
     * <li>active threads idle past the stale duration become stale</li>
     * <li>stale and resolved threads untouched past the dead duration, counted
     * from their last transition or update, die and leave the live map</li>
     * <li>pending messages older than the stale duration are discarded</li>
     * <li>conversations over the active-thread cap demote their oldest</li>
     * </ul>
     *
     * @return threads that died in this tick; the caller archives them
     */
    public List<ConversationThread> tick(Instant now) {
        synchronized (lock) {
            List<ConversationThread> dead = new ArrayList<>();
            for (ConversationThread thread : threads.values()) {
                if (thread.getState() == ThreadState.ACTIVE
                        && Duration.between(thread.getUpdatedAt(), now).compareTo(staleAfter) > 0) {
                    thread.transitionTo(ThreadState.STALE, now);
                    dirty = true;
                    continue;
                }
                if (thread.getState() == ThreadState.STALE || thread.getState() == ThreadState.RESOLVED) {
                    Instant lastTouched = latest(thread.getStateChangedAt(), thread.getUpdatedAt());
                    if (Duration.between(lastTouched, now).compareTo(deadAfter) > 0) {
                        thread.transitionTo(ThreadState.DEAD, now);
                        dead.add(thread);
                    }
                }
            }

            for (ConversationThread thread : dead) {
                threads.remove(thread.getId());
                unindex(thread.getMessages(), thread.getId());
                dirty = true;
            }

            Iterator<PendingMessage> iterator = pending.iterator();
            while (iterator.hasNext()) {
                PendingMessage candidate = iterator.next();
                if (Duration.between(candidate.getCreatedAt(), now).compareTo(staleAfter) > 0) {
                    iterator.remove();
                    dirty = true;
                }
            }

            enforceConversationLimits(now);
            return dead;
        }
    }

    /**
     * Ticks at the current time and archives whatever died, together with
     * dead threads a previous attempt failed to archive. A failed batch is
     * kept and retried on the next call.
     *
     * @return number of threads archived
     */
    public int archiveDeadThreads() {
        List<ConversationThread> dead = tick(clock.instant());
        List<ConversationThread> batch;
        synchronized (lock) {
            batch = new ArrayList<>(unarchived);
            unarchived.clear();
        }
        batch.addAll(dead);
        if (batch.isEmpty()) {
            return 0;
        }
        try {
            int archived = threadStore.archive(batch);
            log.info("[Tracker] Archived {} dead threads", archived);
            return archived;
        } catch (RuntimeException e) {
            synchronized (lock) {
                unarchived.addAll(0, batch);
            }
            log.error("[Tracker] Failed to archive {} dead threads, will retry", batch.size(), e);
            return 0;
        }
    }

    /**
     * Dead threads waiting for a successful archive write.
     */
    public int unarchivedCount() {
        synchronized (lock) {
            return unarchived.size();
        }
    }

    public int deleteExpiredArchives(int retentionDays) {
        try {
            return threadStore.deleteArchivesOlderThan(retentionDays);
        } catch (RuntimeException e) {
            log.error("[Tracker] Failed to clean up thread archives", e);
            return 0;
        }
    }

    private void enforceConversationLimits(Instant now) {
        Map<String, List<ConversationThread>> activeByConversation = new HashMap<>();
        for (ConversationThread thread : threads.values()) {
            if (thread.getState() == ThreadState.ACTIVE) {
                activeByConversation.computeIfAbsent(thread.getConversationKey(), key -> new ArrayList<>())
                        .add(thread);
            }
        }
        for (Map.Entry<String, List<ConversationThread>> entry : activeByConversation.entrySet()) {
            List<ConversationThread> active = entry.getValue();
            if (active.size() <= maxActivePerConversation) {
                continue;
            }
            active.sort(Comparator.comparing(ConversationThread::getUpdatedAt));
            int overflow = active.size() - maxActivePerConversation;
            for (ConversationThread thread : active.subList(0, overflow)) {
                thread.transitionTo(ThreadState.STALE, now);
                dirty = true;
            }
            log.debug("[Tracker] Demoted {} threads over capacity in {}", overflow, entry.getKey());
        }
    }

    // ==================== Context ====================

    public ThreadedContext buildContext(List<InboundMessage> respond, List<InboundMessage> context,
            String conversationKey) {
        synchronized (lock) {
            return contextFormatter.buildThreadedContext(threadsOfLocked(conversationKey),
                    pendingOfLocked(conversationKey), respond, context);
        }
    }

    public Optional<ThreadedContext> buildThreadContext(String threadId, String conversationKey) {
        synchronized (lock) {
            ConversationThread focus = threads.get(threadId);
            if (focus == null || !conversationKey.equals(focus.getConversationKey())) {
                return Optional.empty();
            }
            return Optional.of(contextFormatter.buildSingleThreadContext(focus, threadsOfLocked(conversationKey),
                    pendingOfLocked(conversationKey)));
        }
    }

    /**
     * Live system-involved threads with unshown messages, those holding an
     * unshown respond message first, then most recently updated first.
     */
    public List<String> respondThreadIds(String conversationKey) {
        synchronized (lock) {
            return threads.values().stream()
                    .filter(t -> conversationKey.equals(t.getConversationKey()))
                    .filter(ConversationThread::isLive)
                    .filter(ConversationThread::isSystemInvolved)
                    .filter(ConversationThread::hasUnshownMessages)
                    .sorted(Comparator
                            .comparing(ConversationThread::hasUnshownRespondMessage)
                            .thenComparing(ConversationThread::getUpdatedAt)
                            .reversed())
                    .map(ConversationThread::getId)
                    .toList();
        }
    }

    /**
     * Advances the shown cursor of each thread to its current size. Called
     * only after the context that rendered these threads was answered.
     */
    public void commitShownIndices(Collection<String> threadIds) {
        synchronized (lock) {
            for (String threadId : threadIds) {
                ConversationThread thread = threads.get(threadId);
                if (thread != null && thread.getLastShownIndex() != thread.getMessageCount()) {
                    thread.markAllShown();
                    dirty = true;
                }
            }
        }
    }

    /**
     * Records a reply the system sent. Every thread holding one of the covered
     * message ids is flagged as answered, and the reply text is appended to
     * the first such thread. Blank replies and raw tool-call markup are
     * ignored.
     *
     * @return true when the reply was recorded
     */
    public boolean markReplySent(Collection<String> coveredMessageIds, String replyText) {
        if (replyText == null || replyText.isBlank()) {
            return false;
        }
        if (ConversationPatterns.looksLikeToolMarkup(replyText)) {
            log.warn("[Tracker] Skipping reply that looks like tool-call markup ({} chars)", replyText.length());
            return false;
        }

        Instant now = clock.instant();
        synchronized (lock) {
            Set<String> seen = new HashSet<>();
            ConversationThread first = null;
            for (String messageId : coveredMessageIds) {
                String threadId = messageToThread.get(messageId);
                if (threadId == null || !seen.add(threadId)) {
                    continue;
                }
                ConversationThread thread = threads.get(threadId);
                if (thread == null) {
                    continue;
                }
                thread.markSystemResponded();
                if (first == null) {
                    first = thread;
                }
            }
            if (first == null) {
                return false;
            }

            boolean fullyShown = first.getLastShownIndex() >= first.getMessageCount();
            List<ThreadMessage> trimmed = first.addMessage(ThreadMessage.builder()
                    .messageId("")
                    .authorName(identity.name())
                    .authorId(identity.selfId())
                    .content(replyText)
                    .timestamp(now)
                    .classification(MessageClassification.RESPOND)
                    .fromSystem(true)
                    .build(), maxMessages);
            unindex(trimmed, first.getId());
            if (fullyShown) {
                first.markAllShown();
            }
            channelStates.computeIfAbsent(first.getConversationKey(), ChannelState::new)
                    .update(identity.selfId(), now, true, false);
            dirty = true;
            return true;
        }
    }

    // ==================== Queries ====================

    /**
     * Last {@code limit} lines of a conversation, oldest first, as
     * {@code "Author: text"}, across live threads and pending messages.
     */
    public List<String> recentContext(String conversationKey, int limit) {
        synchronized (lock) {
            List<ThreadMessage> all = new ArrayList<>();
            for (ConversationThread thread : threads.values()) {
                if (conversationKey.equals(thread.getConversationKey()) && thread.isLive()) {
                    all.addAll(thread.getMessages());
                }
            }
            for (PendingMessage candidate : pending) {
                if (conversationKey.equals(candidate.getConversationKey())) {
                    all.add(candidate.getMessage());
                }
            }
            all.sort(Comparator.comparing(ThreadMessage::getTimestamp,
                    Comparator.nullsFirst(Comparator.naturalOrder())));
            int from = Math.max(0, all.size() - limit);
            return all.subList(from, all.size()).stream()
                    .map(m -> (m.isFromSystem() ? identity.name() : m.displayName()) + ": " + m.getContent())
                    .toList();
        }
    }

    /**
     * Conversation signals for the relevance fallback, or empty when nothing
     * was seen in this conversation yet.
     */
    public Optional<RelevanceSignals> relevanceSignals(InboundMessage message) {
        String conversationKey = message.conversationKey();
        Instant now = clock.instant();
        synchronized (lock) {
            ChannelState state = channelStates.get(conversationKey);
            if (state == null) {
                return Optional.empty();
            }
            return Optional.of(new RelevanceSignals(
                    state.secondsSinceSystemSpoke(now),
                    state.authorEngagementRatio(message.authorId()),
                    isInSystemThreadLocked(message, conversationKey),
                    state.isSystemWasLastSpeaker()));
        }
    }

    private boolean isInSystemThreadLocked(InboundMessage message, String conversationKey) {
        if (message.getReplyToMessageId() != null) {
            ConversationThread replied = threadContaining(message.getReplyToMessageId(), conversationKey);
            if (replied != null && replied.isSystemInvolved()) {
                return true;
            }
        }
        String authorId = message.authorId();
        return threads.values().stream()
                .filter(t -> conversationKey.equals(t.getConversationKey()))
                .filter(ConversationThread::isLive)
                .filter(ConversationThread::isSystemInvolved)
                .anyMatch(t -> t.getParticipants().contains(authorId));
    }

    public TrackerStats stats() {
        synchronized (lock) {
            Map<ThreadState, Integer> byState = new EnumMap<>(ThreadState.class);
            for (ConversationThread thread : threads.values()) {
                byState.merge(thread.getState(), 1, Integer::sum);
            }
            return TrackerStats.builder()
                    .totalThreads(threads.size())
                    .pendingMessages(pending.size())
                    .byState(byState)
                    .messageIndexSize(messageToThread.size())
                    .build();
        }
    }

    /**
     * Drops all live state. Used by hard reset.
     *
     * @return stats from just before the reset
     */
    public TrackerStats reset() {
        synchronized (lock) {
            TrackerStats before = stats();
            threads.clear();
            messageToThread.clear();
            pending.clear();
            channelStates.clear();
            unarchived.clear();
            dirty = true;
            log.warn("[Tracker] Reset: cleared {} threads and {} pending", before.getTotalThreads(),
                    before.getPendingMessages());
            return before;
        }
    }

    /**
     * Detached copies of a conversation's threads, including resolved ones.
     */
    public List<ConversationThread> threadsOf(String conversationKey) {
        synchronized (lock) {
            return threadsOfLocked(conversationKey).stream()
                    .map(ConversationThread::copy)
                    .toList();
        }
    }

    public List<PendingMessage> pendingOf(String conversationKey) {
        synchronized (lock) {
            return pendingOfLocked(conversationKey);
        }
    }

    public Optional<ConversationThread> findThreadByMessageId(String messageId) {
        synchronized (lock) {
            String threadId = messageToThread.get(messageId);
            return Optional.ofNullable(threadId != null ? threads.get(threadId) : null)
                    .map(ConversationThread::copy);
        }
    }

    public Optional<ConversationThread> findThread(String threadId) {
        synchronized (lock) {
            return Optional.ofNullable(threads.get(threadId)).map(ConversationThread::copy);
        }
    }

    public TrackerSnapshot snapshot() {
        synchronized (lock) {
            return snapshotLocked();
        }
    }

    private int threadCount() {
        synchronized (lock) {
            return threads.size();
        }
    }

    private int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    private TrackerSnapshot snapshotLocked() {
        List<ConversationThread> copies = threads.values().stream()
                .map(ConversationThread::copy)
                .toList();
        return new TrackerSnapshot(copies, new ArrayList<>(pending));
    }

    private List<ConversationThread> threadsOfLocked(String conversationKey) {
        return threads.values().stream()
                .filter(t -> Objects.equals(conversationKey, t.getConversationKey()))
                .toList();
    }

    private List<PendingMessage> pendingOfLocked(String conversationKey) {
        return pending.stream()
                .filter(p -> Objects.equals(conversationKey, p.getConversationKey()))
                .toList();
    }

    private static Instant latest(Instant first, Instant second) {
        return first.isAfter(second) ? first : second;
    }

    private static String shortId(ConversationThread thread) {
        String id = thread.getId();
        return id.length() > 8 ? id.substring(0, 8) : id;
    }
}
