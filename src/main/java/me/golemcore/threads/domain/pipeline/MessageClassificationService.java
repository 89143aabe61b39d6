package me.golemcore.threads.domain.pipeline;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.threads.domain.conversation.ConversationTracker;
import me.golemcore.threads.domain.conversation.RelevanceClassifier;
import me.golemcore.threads.domain.conversation.SystemIdentity;
import me.golemcore.threads.domain.model.ClassificationRequest;
import me.golemcore.threads.domain.model.ClassificationResult;
import me.golemcore.threads.domain.model.InboundMessage;
import me.golemcore.threads.domain.model.MessageClassification;
import me.golemcore.threads.infrastructure.config.BotProperties;
import me.golemcore.threads.port.outbound.ClassifierPort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Classifies the messages of a batch and applies the deterministic rules on
 * top of the classifier's answer.
 *
 * <p>
 * Rules, in order:
 * <ol>
 * <li>muted senders are dropped without asking the classifier</li>
 * <li>a high-severity security flag mutes the sender and drops the
 * message</li>
 * <li>naming the system or replying to it forces respond</li>
 * <li>a stale respond below the confidence threshold becomes context</li>
 * </ol>
 * A classifier that fails or times out is replaced by the local
 * {@link RelevanceClassifier}.
 */
@Service
@Slf4j
public class MessageClassificationService {

    private final ClassifierPort classifierPort;
    private final RelevanceClassifier relevanceClassifier;
    private final ConversationTracker tracker;
    private final SystemIdentity identity;
    private final MuteRegistry muteRegistry;
    private final BotProperties.PipelineProperties settings;

    public MessageClassificationService(ClassifierPort classifierPort, RelevanceClassifier relevanceClassifier,
            ConversationTracker tracker, SystemIdentity identity, MuteRegistry muteRegistry,
            BotProperties properties) {
        this.classifierPort = classifierPort;
        this.relevanceClassifier = relevanceClassifier;
        this.tracker = tracker;
        this.identity = identity;
        this.muteRegistry = muteRegistry;
        this.settings = properties.getPipeline();
    }

    public ClassifiedBatch classify(String conversationKey, List<InboundMessage> batch) {
        List<InboundMessage> respond = new ArrayList<>();
        List<InboundMessage> context = new ArrayList<>();
        int dropped = 0;

        for (InboundMessage message : batch) {
            if (muteRegistry.isMuted(message.authorId())) {
                log.debug("[Pipeline] Dropped message from muted sender {}", message.authorId());
                dropped++;
                continue;
            }

            ClassificationResult raw = classifyOne(conversationKey, message);
            MessageClassification classification = postProcess(message, raw);
            log.debug("[Pipeline] {} from {} -> {} ({}; {})", message.getMessageId(), message.displayName(),
                    classification, String.format("%.2f", raw.getConfidence()), raw.getReason());

            switch (classification) {
            case RESPOND -> respond.add(message);
            case CONTEXT -> context.add(message);
            case DROP -> dropped++;
            default -> throw new IllegalStateException("Unknown classification: " + classification);
            }
        }
        return new ClassifiedBatch(respond, context, dropped);
    }

    MessageClassification postProcess(InboundMessage message, ClassificationResult result) {
        if (result.shouldAutoMute()) {
            muteRegistry.mute(message.authorId());
            log.warn("[Pipeline] Auto-muted {} in {}: {}", message.authorId(), message.conversationKey(),
                    result.getSecurityFlags());
            return MessageClassification.DROP;
        }
        if (identity.isNamedIn(message.safeContent()) || message.isReplyToSystem()) {
            return MessageClassification.RESPOND;
        }
        MessageClassification classification = result.getClassification() != null
                ? result.getClassification()
                : MessageClassification.CONTEXT;
        if (message.isStale() && classification == MessageClassification.RESPOND
                && result.getConfidence() < settings.getStaleConfidenceThreshold()) {
            log.debug("[Pipeline] Stale respond downgraded to context ({} min old)", message.getStaleMinutes());
            return MessageClassification.CONTEXT;
        }
        return classification;
    }

    private ClassificationResult classifyOne(String conversationKey, InboundMessage message) {
        if (!classifierPort.isAvailable()) {
            return fallback(message);
        }

        ClassificationRequest request = ClassificationRequest.builder()
                .message(message)
                .recentContext(tracker.recentContext(conversationKey, settings.getRecentContextLimit()))
                .stale(message.isStale())
                .staleMinutes(message.getStaleMinutes())
                .build();
        Duration timeout = settings.getClassifierTimeout();
        try {
            ClassificationResult result = classifierPort.classify(request)
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                log.warn("[Pipeline] Classifier returned nothing for {}, using fallback", message.getMessageId());
                return fallback(message);
            }
            return result;
        } catch (TimeoutException e) {
            log.warn("[Pipeline] Classifier timed out after {}ms, using fallback", timeout.toMillis());
        } catch (ExecutionException e) {
            log.warn("[Pipeline] Classifier failed, using fallback: {}", e.getCause() != null
                    ? e.getCause().getMessage()
                    : e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("[Pipeline] Interrupted while classifying, using fallback");
        }
        return fallback(message);
    }

    private ClassificationResult fallback(InboundMessage message) {
        return relevanceClassifier.classify(message, tracker.relevanceSignals(message));
    }
}
