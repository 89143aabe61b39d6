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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code bot.*} prefix. Nested
 * property classes cover each subsystem:
 * <ul>
 * <li>{@link IdentityProperties} - how the bot is named in chats</li>
 * <li>{@link DebounceProperties} - intake buffering</li>
 * <li>{@link QueueProperties} - per-conversation processing queue</li>
 * <li>{@link ConversationProperties} - thread tracking and lifecycle</li>
 * <li>{@link PipelineProperties} - classification and dispatch</li>
 * <li>{@link RateLimitProperties} - per-sender intake limits</li>
 * <li>{@link StorageProperties} - persistence configuration</li>
 * </ul>
 *
 * <p>
 * Uses Spring Boot's {@link ConfigurationProperties} for type-safe property
 * binding.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private IdentityProperties identity = new IdentityProperties();
    private DebounceProperties debounce = new DebounceProperties();
    private QueueProperties queue = new QueueProperties();
    private ConversationProperties conversation = new ConversationProperties();
    private PipelineProperties pipeline = new PipelineProperties();
    private RateLimitProperties rateLimit = new RateLimitProperties();
    private StorageProperties storage = new StorageProperties();

    @Data
    public static class IdentityProperties {
        private String name = "golem";
        private List<String> aliases = new ArrayList<>();
        private String selfId = "system:self";
    }

    @Data
    public static class DebounceProperties {
        private Duration window = Duration.ofMillis(3500);
        private int batchLimit = 15;
        private int maxBuffer = 40;
    }

    @Data
    public static class QueueProperties {
        private int mergeCap = 30;
    }

    @Data
    public static class ConversationProperties {
        private Duration staleAfter = Duration.ofSeconds(300);
        private Duration deadAfter = Duration.ofSeconds(900);
        private int maxActivePerConversation = 10;
        private int maxMessages = 100;
        private double assignmentThreshold = 0.5;
        private Duration tickInterval = Duration.ofSeconds(30);
        private int archiveRetentionDays = 30;
    }

    @Data
    public static class PipelineProperties {
        private Duration staleMessageAge = Duration.ofMinutes(5);
        private double staleConfidenceThreshold = 0.85;
        private int threadCap = 3;
        private Duration muteDuration = Duration.ofMinutes(30);
        private int recentContextLimit = 8;
        private Duration classifierTimeout = Duration.ofSeconds(15);
        private Duration replyTimeout = Duration.ofSeconds(120);
    }

    @Data
    public static class RateLimitProperties {
        private boolean enabled = true;
        private int messagesPerWindow = 10;
        private Duration window = Duration.ofSeconds(30);
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private DirectoriesProperties directories = new DirectoriesProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/threads";
    }

    @Data
    public static class DirectoriesProperties {
        private String threads = "threads";
    }
}
