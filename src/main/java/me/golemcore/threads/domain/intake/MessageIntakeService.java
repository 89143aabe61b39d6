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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.threads.domain.conversation.ConversationTracker;
import me.golemcore.threads.domain.model.HardResetResult;
import me.golemcore.threads.domain.model.InboundMessage;
import me.golemcore.threads.domain.model.RateLimitResult;
import me.golemcore.threads.domain.model.TrackerStats;
import me.golemcore.threads.port.inbound.MessageIntakePort;
import me.golemcore.threads.ratelimit.RateLimiter;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Validates inbound messages, applies the per-sender rate limit and feeds the
 * debounce buffer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageIntakeService implements MessageIntakePort {

    private final DebounceBuffer debounceBuffer;
    private final QueueProcessor queueProcessor;
    private final ConversationTracker tracker;
    private final RateLimiter rateLimiter;
    private final Clock clock;

    @Override
    public boolean submit(InboundMessage message) {
        validate(message);
        if (message.getContent() == null) {
            message.setContent("");
        }
        if (message.getTimestamp() == null) {
            message.setTimestamp(clock.instant());
        }

        RateLimitResult rateLimit = rateLimiter.tryConsumeSender(message.authorId());
        if (!rateLimit.isAllowed()) {
            log.info("[Intake] Dropped message from {} in {}: {}", message.authorId(), message.conversationKey(),
                    rateLimit.getReason());
            return false;
        }

        debounceBuffer.add(message);
        return true;
    }

    @Override
    public HardResetResult hardReset() {
        int droppedBuffered = debounceBuffer.reset();
        QueueProcessor.ResetCounts queueCounts = queueProcessor.reset();
        TrackerStats cleared = tracker.reset();
        tracker.saveIfDirty();

        HardResetResult result = HardResetResult.builder()
                .droppedBufferedMessages(droppedBuffered)
                .droppedQueuedBatches(queueCounts.droppedBatches())
                .cancelledWorkers(queueCounts.cancelledWorkers())
                .clearedThreads(cleared.getTotalThreads())
                .clearedPending(cleared.getPendingMessages())
                .build();
        log.warn("[Intake] Hard reset: {}", result);
        return result;
    }

    private static void validate(InboundMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("message is required");
        }
        if (isBlank(message.getChannelType())) {
            throw new IllegalArgumentException("channelType is required");
        }
        if (isBlank(message.getChatId())) {
            throw new IllegalArgumentException("chatId is required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
