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

/**
 * One reply leaving the pipeline for a chat platform.
 */
@Value
@Builder
public class OutboundReply {

    String channelType;
    String chatId;
    String content;
    /** External message id the reply should be attached to. */
    String replyToMessageId;
    /** How many source messages this reply covers. */
    int collapsedCount;
    /** Set for per-thread replies in multi-thread dispatch. */
    String threadId;

    public String conversationKey() {
        return channelType + ":" + chatId;
    }
}
