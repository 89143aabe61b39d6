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
import lombok.Value;

import java.time.Instant;

/**
 * One chat message as absorbed into a thread. Never mutated after insertion.
 */
@Value
@Builder(toBuilder = true)
public class ThreadMessage {

    String messageId;
    String authorName;
    String authorHandle;
    String authorId;
    @Builder.Default
    String content = "";
    Instant timestamp;
    String replyToMessageId;
    boolean replyToSystem;
    @Builder.Default
    MessageClassification classification = MessageClassification.CONTEXT;
    boolean fromSystem;

    public boolean hasMessageId() {
        return messageId != null && !messageId.isEmpty();
    }

    public boolean hasReplyTarget() {
        return replyToMessageId != null && !replyToMessageId.isEmpty();
    }

    public String safeContent() {
        return content != null ? content : "";
    }

    /**
     * Display name with a fallback to the stable author id.
     */
    public String displayName() {
        if (authorName != null && !authorName.isBlank()) {
            return authorName;
        }
        return authorId != null ? authorId : "unknown";
    }
}
