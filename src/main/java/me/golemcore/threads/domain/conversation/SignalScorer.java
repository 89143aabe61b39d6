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

import lombok.RequiredArgsConstructor;
import me.golemcore.threads.domain.model.ConversationThread;
import me.golemcore.threads.domain.model.PendingMessage;
import me.golemcore.threads.domain.model.ThreadMessage;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Scores how strongly a message belongs to a thread or to a pending message.
 *
 * <p>
 * Five signals are summed:
 * <ul>
 * <li>reply-chain (1.0): the message replies to a message in the thread</li>
 * <li>mention affinity (0.9): the text names a thread participant</li>
 * <li>temporal (up to 0.4): closeness to the thread's last update</li>
 * <li>speaker continuity (0.4): the author already takes part</li>
 * <li>lexical overlap (up to 0.3): shared topic keywords</li>
 * </ul>
 *
 * <p>
 * Temporal alone can never reach the assignment threshold of 0.5. Missing
 * fields simply produce no signal.
 */
@Component
@RequiredArgsConstructor
public class SignalScorer {

    public static final double REPLY_CHAIN_WEIGHT = 1.0;
    public static final double MENTION_WEIGHT = 0.9;
    public static final double SPEAKER_WEIGHT = 0.4;
    public static final double LEXICAL_WEIGHT = 0.3;
    public static final double TEMPORAL_MAX = 0.4;

    private static final int MIN_NAME_LENGTH = 3;

    private final KeywordExtractor keywordExtractor;

    public SignalScores scoreThread(ThreadMessage message, ConversationThread thread) {
        double replyChain = message.hasReplyTarget() && thread.containsMessage(message.getReplyToMessageId())
                ? REPLY_CHAIN_WEIGHT
                : 0.0;
        double mention = mentionsAny(message.safeContent(), participantNames(thread)) ? MENTION_WEIGHT : 0.0;
        double temporal = temporal(message.getTimestamp(), thread.getUpdatedAt());
        double speaker = message.getAuthorId() != null && thread.getParticipants().contains(message.getAuthorId())
                ? SPEAKER_WEIGHT
                : 0.0;
        double lexical = lexical(keywordExtractor.extractSet(message.safeContent()),
                new HashSet<>(thread.getTopicKeywords()));
        return new SignalScores(replyChain, mention, temporal, speaker, lexical);
    }

    /**
     * Same signals against a lone pending message, approximated from its own
     * author, text and timestamp.
     */
    public SignalScores scorePending(ThreadMessage message, PendingMessage pending) {
        ThreadMessage other = pending.getMessage();
        double replyChain = message.hasReplyTarget() && message.getReplyToMessageId().equals(other.getMessageId())
                ? REPLY_CHAIN_WEIGHT
                : 0.0;
        double mention = !other.isFromSystem() && mentionsAny(message.safeContent(), List.of(other.displayName()))
                ? MENTION_WEIGHT
                : 0.0;
        double temporal = temporal(message.getTimestamp(), other.getTimestamp());
        double speaker = message.getAuthorId() != null && message.getAuthorId().equals(other.getAuthorId())
                ? SPEAKER_WEIGHT
                : 0.0;
        double lexical = lexical(keywordExtractor.extractSet(message.safeContent()),
                keywordExtractor.extractSet(other.safeContent()));
        return new SignalScores(replyChain, mention, temporal, speaker, lexical);
    }

    /**
     * Step decay: under 10s 0.4, under 30s 0.3, under 2 min 0.2, under 5 min
     * 0.1, otherwise 0. A message older than the reference counts as
     * simultaneous.
     */
    static double temporal(Instant messageTime, Instant reference) {
        if (messageTime == null || reference == null) {
            return 0.0;
        }
        double seconds = Math.max(0.0, Duration.between(reference, messageTime).toMillis() / 1000.0);
        if (seconds < 10) {
            return TEMPORAL_MAX;
        } else if (seconds < 30) {
            return 0.3;
        } else if (seconds < 120) {
            return 0.2;
        } else if (seconds < 300) {
            return 0.1;
        }
        return 0.0;
    }

    static double lexical(Set<String> messageWords, Set<String> topicWords) {
        if (messageWords.isEmpty() || topicWords.isEmpty()) {
            return 0.0;
        }
        long overlap = messageWords.stream().filter(topicWords::contains).count();
        double ratio = Math.min(overlap / 3.0, 1.0);
        return LEXICAL_WEIGHT * ratio;
    }

    private static Set<String> participantNames(ConversationThread thread) {
        Set<String> names = new LinkedHashSet<>();
        for (ThreadMessage message : thread.getMessages()) {
            if (!message.isFromSystem() && message.getAuthorName() != null) {
                names.add(message.getAuthorName());
            }
        }
        return names;
    }

    private static boolean mentionsAny(String content, Iterable<String> names) {
        if (content.isEmpty()) {
            return false;
        }
        String lower = content.toLowerCase(Locale.ROOT);
        for (String name : names) {
            if (name != null && name.length() >= MIN_NAME_LENGTH && lower.contains(name.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
