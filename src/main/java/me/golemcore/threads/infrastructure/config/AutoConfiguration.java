package me.golemcore.threads.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.threads.domain.conversation.SystemIdentity;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core beans of the message pipeline.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the shared {@link Clock} and {@link ObjectMapper}</li>
 * <li>Builds the {@link SystemIdentity} from {@code bot.identity.*}</li>
 * <li>Provides the debounce timer scheduler and the conversation worker
 * pool</li>
 * <li>Rejects invalid limits at startup</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BotProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public SystemIdentity systemIdentity() {
        BotProperties.IdentityProperties identity = properties.getIdentity();
        return new SystemIdentity(identity.getName(), identity.getAliases(), identity.getSelfId());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService debounceScheduler() {
        return Executors.newSingleThreadScheduledExecutor(namedDaemonThreads("debounce-timer"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService conversationWorkerExecutor() {
        return Executors.newCachedThreadPool(namedDaemonThreads("conversation-worker"));
    }

    @PostConstruct
    public void init() {
        validate(properties);
        log.info("GolemCore Threads starting as '{}'", properties.getIdentity().getName());
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
        log.info("Debounce: window={}ms, batch-limit={}, max-buffer={}",
                properties.getDebounce().getWindow().toMillis(), properties.getDebounce().getBatchLimit(),
                properties.getDebounce().getMaxBuffer());
    }

    static void validate(BotProperties properties) {
        BotProperties.DebounceProperties debounce = properties.getDebounce();
        requirePositive("bot.debounce.window", debounce.getWindow());
        requirePositive("bot.debounce.batch-limit", debounce.getBatchLimit());
        requirePositive("bot.debounce.max-buffer", debounce.getMaxBuffer());
        requirePositive("bot.queue.merge-cap", properties.getQueue().getMergeCap());

        BotProperties.ConversationProperties conversation = properties.getConversation();
        requirePositive("bot.conversation.stale-after", conversation.getStaleAfter());
        requirePositive("bot.conversation.dead-after", conversation.getDeadAfter());
        requirePositive("bot.conversation.max-active-per-conversation",
                conversation.getMaxActivePerConversation());
        requirePositive("bot.conversation.max-messages", conversation.getMaxMessages());
        requirePositive("bot.conversation.tick-interval", conversation.getTickInterval());
        requirePositive("bot.conversation.archive-retention-days", conversation.getArchiveRetentionDays());

        BotProperties.PipelineProperties pipeline = properties.getPipeline();
        requirePositive("bot.pipeline.thread-cap", pipeline.getThreadCap());
        requirePositive("bot.pipeline.recent-context-limit", pipeline.getRecentContextLimit());
        requirePositive("bot.pipeline.classifier-timeout", pipeline.getClassifierTimeout());
        requirePositive("bot.pipeline.reply-timeout", pipeline.getReplyTimeout());
        requirePositive("bot.pipeline.mute-duration", pipeline.getMuteDuration());

        BotProperties.RateLimitProperties rateLimit = properties.getRateLimit();
        requirePositive("bot.rate-limit.messages-per-window", rateLimit.getMessagesPerWindow());
        requirePositive("bot.rate-limit.window", rateLimit.getWindow());

        String name = properties.getIdentity().getName();
        if (name == null || name.isBlank()) {
            throw new IllegalStateException("bot.identity.name must not be blank");
        }
    }

    private static void requirePositive(String property, int value) {
        if (value <= 0) {
            throw new IllegalStateException(property + " must be positive, got " + value);
        }
    }

    private static void requirePositive(String property, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalStateException(property + " must be a positive duration, got " + value);
        }
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
