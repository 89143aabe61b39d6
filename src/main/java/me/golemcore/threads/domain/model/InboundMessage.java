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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Chat message as received from a platform adapter.
 *
 * <p>
 * The {@code stale} flag and {@code staleMinutes} are assigned by the batch
 * pipeline when the message sat in the buffers for too long.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundMessage {

    private String channelType;
    private String chatId;
    private String senderId;
    private String messageId;
    private String authorName;
    private String authorHandle;
    private String content;
    private Instant timestamp;
    private String replyToMessageId;
    private boolean replyToSystem;
    private boolean atMention;
    private boolean stale;
    private int staleMinutes;

    public String conversationKey() {
        return channelType + ":" + chatId;
    }

    /**
     * Stable author id, unique across platforms.
     */
    public String authorId() {
        return channelType + ":" + senderId;
    }

    public String safeContent() {
        return content != null ? content : "";
    }

    public String displayName() {
        if (authorName != null && !authorName.isBlank()) {
            return authorName;
        }
        return senderId != null ? senderId : "unknown";
    }

    public boolean hasMessageId() {
        return messageId != null && !messageId.isEmpty();
    }
}
