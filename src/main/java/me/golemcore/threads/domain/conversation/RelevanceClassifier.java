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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.threads.domain.model.ClassificationResult;
import me.golemcore.threads.domain.model.InboundMessage;
import me.golemcore.threads.domain.model.MessageClassification;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Deterministic classifier used when the external classifier is unavailable.
 *
 * <p>
 * With conversation state available it combines weighted features in [0, 1]
 * as Naive Bayes log-odds:
 *
 * <pre>
 * P(directed at system) = sigmoid(ln(0.15 / 0.85) + sum(w_i * f_i))
 * </pre>
 *
 * <p>
 * {@code >= 0.7} responds, {@code >= 0.3} keeps the message as context, lower
 * scores drop it. Without conversation state a name or reply-to-system signal
 * responds and everything else is context.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RelevanceClassifier {

    public static final double RESPOND_THRESHOLD = 0.7;
    public static final double CONTEXT_THRESHOLD = 0.3;

    static final double PRIOR_LOG_ODDS = Math.log(0.15 / 0.85);

    private static final Map<String, Double> WEIGHTS = weights();
    private static final double RECENCY_HALF_LIFE_SECONDS = 120.0;
    private static final double ADJACENCY_WINDOW_SECONDS = 60.0;
    private static final double ADJACENCY_DECAY_SECONDS = 30.0;

    private final SystemIdentity identity;

    public ClassificationResult classify(InboundMessage message, Optional<RelevanceSignals> signals) {
        if (signals.isEmpty()) {
            return classifyByPattern(message);
        }
        Map<String, Double> features = features(message, signals.get());
        double score = score(features);
        MessageClassification classification;
        if (score >= RESPOND_THRESHOLD) {
            classification = MessageClassification.RESPOND;
        } else if (score >= CONTEXT_THRESHOLD) {
            classification = MessageClassification.CONTEXT;
        } else {
            classification = MessageClassification.DROP;
        }
        Map.Entry<String, Double> top = features.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .orElse(Map.entry("none", 0.0));
        String reason = String.format(Locale.ROOT, "math(%.2f): %s=%.1f", score, top.getKey(), top.getValue());
        log.debug("[Relevance] {} for {} ({})", classification, message.authorId(), reason);
        return ClassificationResult.builder()
                .classification(classification)
                .confidence(score)
                .reason(reason)
                .fallbackUsed(true)
                .build();
    }

    ClassificationResult classifyByPattern(InboundMessage message) {
        boolean addressed = identity.isNamedIn(message.getContent()) || message.isReplyToSystem();
        return ClassificationResult.builder()
                .classification(addressed ? MessageClassification.RESPOND : MessageClassification.CONTEXT)
                .confidence(addressed ? 1.0 : 0.5)
                .reason(addressed ? "names the system" : "no direct signal")
                .fallbackUsed(true)
                .build();
    }

    /**
     * Feature values in [0, 1], keyed by feature name.
     */
    Map<String, Double> features(InboundMessage message, RelevanceSignals signals) {
        String content = message.safeContent();
        Map<String, Double> f = new LinkedHashMap<>();
        f.put("mention", message.isAtMention() ? 1.0 : 0.0);
        f.put("reply", message.isReplyToSystem() ? 1.0 : 0.0);
        f.put("name", identity.isNamedIn(content) ? 1.0 : 0.0);

        double sinceSpoke = signals.secondsSinceSystemSpoke();
        if (Double.isFinite(sinceSpoke)) {
            double lambda = Math.log(2) / RECENCY_HALF_LIFE_SECONDS;
            f.put("recency", Math.exp(-lambda * Math.max(0.0, sinceSpoke)));
        } else {
            f.put("recency", 0.0);
        }

        f.put("authorHistory", Math.min(1.0, Math.max(0.0, signals.authorEngagementRatio())));
        f.put("question", questionFeature(content));
        f.put("systemThread", signals.inSystemThread() ? 1.0 : 0.0);

        if (signals.systemWasLastSpeaker() && sinceSpoke < ADJACENCY_WINDOW_SECONDS) {
            f.put("adjacency", Math.exp(-sinceSpoke / ADJACENCY_DECAY_SECONDS));
        } else {
            f.put("adjacency", 0.0);
        }
        return f;
    }

    static double score(Map<String, Double> features) {
        double logOdds = PRIOR_LOG_ODDS;
        for (Map.Entry<String, Double> weight : WEIGHTS.entrySet()) {
            logOdds += weight.getValue() * features.getOrDefault(weight.getKey(), 0.0);
        }
        return sigmoid(logOdds);
    }

    static double sigmoid(double x) {
        if (x >= 0) {
            return 1.0 / (1.0 + Math.exp(-x));
        }
        double ex = Math.exp(x);
        return ex / (1.0 + ex);
    }

    private static double questionFeature(String content) {
        String stripped = content.strip();
        if (stripped.endsWith("?")) {
            return 1.0;
        }
        if (stripped.isEmpty()) {
            return 0.0;
        }
        String firstWord = stripped.split("\\s+")[0].toLowerCase(Locale.ROOT);
        return ConversationPatterns.QUESTION_WORDS.contains(firstWord) ? 0.5 : 0.0;
    }

    private static Map<String, Double> weights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("mention", 6.0);
        weights.put("reply", 5.5);
        weights.put("name", 4.0);
        weights.put("recency", 1.5);
        weights.put("authorHistory", 1.0);
        weights.put("question", 0.5);
        weights.put("systemThread", 2.0);
        weights.put("adjacency", 1.5);
        return weights;
    }
}
