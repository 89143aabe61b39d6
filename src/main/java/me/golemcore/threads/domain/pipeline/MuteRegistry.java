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
import me.golemcore.threads.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Senders whose messages are dropped before classification. Mutes expire
 * lazily, on lookup.
 */
@Component
@Slf4j
public class MuteRegistry {

    private final Clock clock;
    private final Duration defaultDuration;
    private final Map<String, Instant> mutedUntil = new ConcurrentHashMap<>();

    public MuteRegistry(Clock clock, BotProperties properties) {
        this.clock = clock;
        this.defaultDuration = properties.getPipeline().getMuteDuration();
    }

    public Instant mute(String authorId) {
        return mute(authorId, defaultDuration);
    }

    public Instant mute(String authorId, Duration duration) {
        Instant until = clock.instant().plus(duration);
        mutedUntil.put(authorId, until);
        log.warn("[Mute] {} muted until {}", authorId, until);
        return until;
    }

    public boolean unmute(String authorId) {
        boolean removed = mutedUntil.remove(authorId) != null;
        if (removed) {
            log.info("[Mute] {} unmuted", authorId);
        }
        return removed;
    }

    public boolean isMuted(String authorId) {
        return mutedUntilFor(authorId).isPresent();
    }

    public Optional<Instant> mutedUntilFor(String authorId) {
        Instant until = mutedUntil.get(authorId);
        if (until == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(until)) {
            mutedUntil.remove(authorId, until);
            return Optional.empty();
        }
        return Optional.of(until);
    }

    public void clear() {
        mutedUntil.clear();
    }
}
