package me.golemcore.threads.port.inbound;

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

import me.golemcore.threads.domain.model.HardResetResult;
import me.golemcore.threads.domain.model.InboundMessage;

/**
 * Entry point for platform adapters delivering chat messages.
 *
 * <p>
 * Accepted messages are debounced per conversation, queued, classified,
 * threaded and possibly answered asynchronously; nothing is returned to the
 * caller beyond whether the message was admitted.
 */
public interface MessageIntakePort {

    /**
     * Admit one inbound message.
     *
     * @return false if the sender is over its rate limit
     * @throws IllegalArgumentException
     *             if the message has no channel type or chat id
     */
    boolean submit(InboundMessage message);

    /**
     * Administrative escape hatch: cancels all timers and workers and clears
     * buffers, queues and thread state. Safe to call during live traffic.
     */
    HardResetResult hardReset();
}
