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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-conversation activity used by the relevance fallback: when the system
 * last spoke, whether it spoke last, and how often each author engages it.
 *
 * <p>
 * Not thread-safe; guarded by the tracker lock.
 */
public class ChannelState {

    private static final int MAX_INTERACTIONS_PER_AUTHOR = 50;

    private final String conversationKey;
    private Instant systemLastSpoke;
    private boolean systemWasLastSpeaker;
    private final Map<String, Integer> authorMessageCounts = new HashMap<>();
    private final Map<String, Deque<Instant>> authorInteractions = new HashMap<>();

    public ChannelState(String conversationKey) {
        this.conversationKey = conversationKey;
    }

    public String getConversationKey() {
        return conversationKey;
    }

    public void update(String authorId, Instant timestamp, boolean fromSystem, boolean interactedWithSystem) {
        if (fromSystem) {
            systemLastSpoke = timestamp;
            systemWasLastSpeaker = true;
            return;
        }
        systemWasLastSpeaker = false;
        authorMessageCounts.merge(authorId, 1, Integer::sum);
        if (interactedWithSystem) {
            Deque<Instant> interactions = authorInteractions.computeIfAbsent(authorId, id -> new ArrayDeque<>());
            interactions.addLast(timestamp);
            while (interactions.size() > MAX_INTERACTIONS_PER_AUTHOR) {
                interactions.removeFirst();
            }
        }
    }

    /**
     * Seconds since the system last spoke here, or positive infinity if it
     * never did.
     */
    public double secondsSinceSystemSpoke(Instant now) {
        if (systemLastSpoke == null || now == null) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.max(0.0, Duration.between(systemLastSpoke, now).toMillis() / 1000.0);
    }

    public boolean isSystemWasLastSpeaker() {
        return systemWasLastSpeaker;
    }

    /**
     * Fraction of the author's messages that engaged the system, capped at 1.
     */
    public double authorEngagementRatio(String authorId) {
        int total = authorMessageCounts.getOrDefault(authorId, 0);
        if (total == 0) {
            return 0.0;
        }
        Deque<Instant> interactions = authorInteractions.get(authorId);
        if (interactions == null || interactions.isEmpty()) {
            return 0.0;
        }
        return Math.min(1.0, (double) interactions.size() / total);
    }
}
