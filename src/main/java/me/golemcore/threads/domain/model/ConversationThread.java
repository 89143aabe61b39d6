package me.golemcore.threads.domain.model;

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

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A tracked cluster of related messages within one conversation.
 *
 * <p>
 * Participants and the message-id index are always derived from
 * {@link #getMessages()}; they are rebuilt whenever old messages are trimmed.
 * {@code lastShownIndex} counts how many of the current messages have already
 * been surfaced to the reply generator.
 *
 * <p>
 * Not thread-safe. Instances are owned by the conversation tracker and only
 * touched under its lock.
 */
@Getter
public class ConversationThread {

    private final String id;
    private final String conversationKey;
    private ThreadState state;
    private final Instant createdAt;
    private Instant updatedAt;
    private Instant stateChangedAt;
    private boolean systemInvolved;
    private boolean systemResponded;
    private final List<ThreadMessage> messages;
    private List<String> topicKeywords;
    private final String parentId;
    private final List<String> childIds;
    private int lastShownIndex;

    private final Set<String> participants = new LinkedHashSet<>();
    private final Set<String> messageIds = new HashSet<>();

    @Builder(builderMethodName = "restore")
    private ConversationThread(String id, String conversationKey, ThreadState state, Instant createdAt,
            Instant updatedAt, Instant stateChangedAt, boolean systemInvolved, boolean systemResponded,
            List<ThreadMessage> messages, List<String> topicKeywords, String parentId, List<String> childIds,
            int lastShownIndex) {
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.conversationKey = conversationKey;
        this.state = state != null ? state : ThreadState.ACTIVE;
        this.createdAt = createdAt != null ? createdAt : Instant.EPOCH;
        this.updatedAt = updatedAt != null ? updatedAt : this.createdAt;
        this.stateChangedAt = stateChangedAt != null ? stateChangedAt : this.updatedAt;
        this.systemInvolved = systemInvolved;
        this.systemResponded = systemResponded;
        this.messages = messages != null ? new ArrayList<>(messages) : new ArrayList<>();
        this.topicKeywords = topicKeywords != null ? List.copyOf(topicKeywords) : List.of();
        this.parentId = parentId;
        this.childIds = childIds != null ? new ArrayList<>(childIds) : new ArrayList<>();
        this.lastShownIndex = Math.max(0, lastShownIndex);
        rebuildIndexes();
    }

    public static ConversationThread create(String conversationKey, Instant now) {
        return restore()
                .conversationKey(conversationKey)
                .state(ThreadState.ACTIVE)
                .createdAt(now)
                .updatedAt(now)
                .stateChangedAt(now)
                .build();
    }

    public static ConversationThread createChild(ConversationThread parent, Instant now) {
        return restore()
                .conversationKey(parent.getConversationKey())
                .state(ThreadState.ACTIVE)
                .createdAt(now)
                .updatedAt(now)
                .stateChangedAt(now)
                .parentId(parent.getId())
                .build();
    }

    /**
     * Appends a message and trims the oldest ones beyond {@code maxMessages}.
     *
     * @return the trimmed messages, oldest first; empty when nothing was
     *         trimmed
     */
    public List<ThreadMessage> addMessage(ThreadMessage message, int maxMessages) {
        messages.add(message);
        if (message.getAuthorId() != null) {
            participants.add(message.getAuthorId());
        }
        if (message.hasMessageId()) {
            messageIds.add(message.getMessageId());
        }
        Instant timestamp = message.getTimestamp();
        if (timestamp != null && timestamp.isAfter(updatedAt)) {
            updatedAt = timestamp;
        }
        if (message.getClassification() == MessageClassification.RESPOND || message.isReplyToSystem()
                || message.isFromSystem()) {
            systemInvolved = true;
        }

        if (maxMessages <= 0 || messages.size() <= maxMessages) {
            return List.of();
        }
        int excess = messages.size() - maxMessages;
        List<ThreadMessage> head = messages.subList(0, excess);
        List<ThreadMessage> removed = new ArrayList<>(head);
        head.clear();
        lastShownIndex = Math.max(0, lastShownIndex - excess);
        rebuildIndexes();
        return removed;
    }

    /**
     * Moves the thread to {@code target}.
     *
     * @return false when the thread is already in {@code target}
     * @throws IllegalStateException
     *             if the lifecycle does not allow the transition
     */
    public boolean transitionTo(ThreadState target, Instant now) {
        if (state == target) {
            return false;
        }
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal thread transition " + state + " -> " + target + " for " + id);
        }
        state = target;
        stateChangedAt = now;
        return true;
    }

    public void markSystemResponded() {
        systemInvolved = true;
        systemResponded = true;
    }

    public void updateTopicKeywords(List<String> keywords) {
        this.topicKeywords = keywords != null ? List.copyOf(keywords) : List.of();
    }

    public void addChild(String childId) {
        childIds.add(childId);
    }

    public void markAllShown() {
        lastShownIndex = messages.size();
    }

    /**
     * Treats history loaded from disk as already surfaced, and clamps a cursor
     * that points past the end.
     *
     * @return true when the cursor changed
     */
    public boolean normalizeShownIndex() {
        int size = messages.size();
        if ((lastShownIndex == 0 && size > 0) || lastShownIndex > size) {
            lastShownIndex = size;
            return true;
        }
        return false;
    }

    public boolean containsMessage(String messageId) {
        return messageId != null && messageIds.contains(messageId);
    }

    public List<ThreadMessage> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public Set<String> getParticipants() {
        return Collections.unmodifiableSet(participants);
    }

    public Set<String> getMessageIds() {
        return Collections.unmodifiableSet(messageIds);
    }

    public List<String> getChildIds() {
        return Collections.unmodifiableList(childIds);
    }

    public int getMessageCount() {
        return messages.size();
    }

    public int getParticipantCount() {
        return participants.size();
    }

    public boolean isLive() {
        return state.isLive();
    }

    public List<ThreadMessage> unshownMessages() {
        if (lastShownIndex >= messages.size()) {
            return List.of();
        }
        return List.copyOf(messages.subList(lastShownIndex, messages.size()));
    }

    public boolean hasUnshownMessages() {
        return messages.size() > lastShownIndex;
    }

    public boolean hasUnshownRespondMessage() {
        return unshownMessages().stream()
                .anyMatch(m -> m.getClassification() == MessageClassification.RESPOND);
    }

    public List<ThreadMessage> recentMessages(int count) {
        int from = Math.max(0, messages.size() - count);
        return List.copyOf(messages.subList(from, messages.size()));
    }

    /**
     * Distinct display names in first-appearance order. System messages show
     * as {@code systemName}.
     */
    public List<String> participantNames(String systemName) {
        Set<String> names = new LinkedHashSet<>();
        for (ThreadMessage message : messages) {
            names.add(message.isFromSystem() ? systemName : message.displayName());
        }
        return new ArrayList<>(names);
    }

    /**
     * Detached copy used for persistence snapshots taken under the tracker
     * lock.
     */
    public ConversationThread copy() {
        return restore()
                .id(id)
                .conversationKey(conversationKey)
                .state(state)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .stateChangedAt(stateChangedAt)
                .systemInvolved(systemInvolved)
                .systemResponded(systemResponded)
                .messages(messages)
                .topicKeywords(topicKeywords)
                .parentId(parentId)
                .childIds(childIds)
                .lastShownIndex(lastShownIndex)
                .build();
    }

    private void rebuildIndexes() {
        participants.clear();
        messageIds.clear();
        for (ThreadMessage message : messages) {
            if (message.getAuthorId() != null) {
                participants.add(message.getAuthorId());
            }
            if (message.hasMessageId()) {
                messageIds.add(message.getMessageId());
            }
        }
    }
}
