package me.golemcore.threads.adapter.outbound.storage;

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

import me.golemcore.threads.adapter.outbound.storage.dto.PendingMessageDocument;
import me.golemcore.threads.adapter.outbound.storage.dto.ThreadDocument;
import me.golemcore.threads.adapter.outbound.storage.dto.ThreadMessageDocument;
import me.golemcore.threads.domain.model.ConversationThread;
import me.golemcore.threads.domain.model.MessageClassification;
import me.golemcore.threads.domain.model.PendingMessage;
import me.golemcore.threads.domain.model.ThreadMessage;
import me.golemcore.threads.domain.model.ThreadState;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Converts between domain threads and their persisted documents.
 */
final class ThreadDocumentMapper {

    private ThreadDocumentMapper() {
    }

    static ThreadDocument toDocument(ConversationThread thread, Instant archivedAt) {
        return ThreadDocument.builder()
                .id(thread.getId())
                .conversationKey(thread.getConversationKey())
                .state(thread.getState().label())
                .createdAt(thread.getCreatedAt())
                .updatedAt(thread.getUpdatedAt())
                .stateChangedAt(thread.getStateChangedAt())
                .systemInvolved(thread.isSystemInvolved())
                .systemResponded(thread.isSystemResponded())
                .messages(thread.getMessages().stream().map(ThreadDocumentMapper::toDocument).toList())
                .topicKeywords(List.copyOf(thread.getTopicKeywords()))
                .parentId(thread.getParentId())
                .childIds(List.copyOf(thread.getChildIds()))
                .lastShownIndex(thread.getLastShownIndex())
                .archivedAt(archivedAt)
                .build();
    }

    static ConversationThread toDomain(ThreadDocument document) {
        List<ThreadMessageDocument> messages = document.getMessages() != null ? document.getMessages() : List.of();
        return ConversationThread.restore()
                .id(document.getId())
                .conversationKey(document.getConversationKey())
                .state(document.getState() != null ? ThreadState.fromLabel(document.getState()) : null)
                .createdAt(document.getCreatedAt())
                .updatedAt(document.getUpdatedAt())
                .stateChangedAt(document.getStateChangedAt())
                .systemInvolved(document.isSystemInvolved())
                .systemResponded(document.isSystemResponded())
                .messages(messages.stream().map(ThreadDocumentMapper::toDomain).toList())
                .topicKeywords(document.getTopicKeywords())
                .parentId(document.getParentId())
                .childIds(document.getChildIds())
                .lastShownIndex(document.getLastShownIndex())
                .build();
    }

    static PendingMessageDocument toDocument(PendingMessage pending) {
        return PendingMessageDocument.builder()
                .message(toDocument(pending.getMessage()))
                .conversationKey(pending.getConversationKey())
                .createdAt(pending.getCreatedAt())
                .build();
    }

    static PendingMessage toDomain(PendingMessageDocument document) {
        ThreadMessage message = toDomain(document.getMessage());
        Instant createdAt = document.getCreatedAt() != null ? document.getCreatedAt() : message.getTimestamp();
        return PendingMessage.builder()
                .message(message)
                .conversationKey(document.getConversationKey())
                .createdAt(createdAt != null ? createdAt : Instant.EPOCH)
                .build();
    }

    static ThreadMessageDocument toDocument(ThreadMessage message) {
        return ThreadMessageDocument.builder()
                .messageId(message.getMessageId())
                .authorName(message.getAuthorName())
                .authorHandle(message.getAuthorHandle())
                .authorId(message.getAuthorId())
                .content(message.getContent())
                .timestamp(message.getTimestamp())
                .replyToMessageId(message.getReplyToMessageId())
                .replyToSystem(message.isReplyToSystem())
                .classification(message.getClassification().name().toLowerCase(Locale.ROOT))
                .fromSystem(message.isFromSystem())
                .build();
    }

    static ThreadMessage toDomain(ThreadMessageDocument document) {
        return ThreadMessage.builder()
                .messageId(document.getMessageId() != null ? document.getMessageId() : "")
                .authorName(document.getAuthorName())
                .authorHandle(document.getAuthorHandle())
                .authorId(document.getAuthorId())
                .content(document.getContent() != null ? document.getContent() : "")
                .timestamp(document.getTimestamp())
                .replyToMessageId(document.getReplyToMessageId())
                .replyToSystem(document.isReplyToSystem())
                .classification(parseClassification(document.getClassification()))
                .fromSystem(document.isFromSystem())
                .build();
    }

    private static MessageClassification parseClassification(String value) {
        if (value == null || value.isBlank()) {
            return MessageClassification.CONTEXT;
        }
        return MessageClassification.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
