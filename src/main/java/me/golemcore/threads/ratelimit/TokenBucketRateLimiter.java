package me.golemcore.threads.ratelimit;

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
import me.golemcore.threads.domain.model.RateLimitResult;
import me.golemcore.threads.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token bucket rate limiter keyed by sender.
 *
 * <p>
 * Each sender gets {@code bot.rate-limit.messages-per-window} tokens refilled
 * over {@code bot.rate-limit.window}. Buckets are rebuilt when the configured
 * limits change. Can be disabled via {@code bot.rate-limit.enabled=false}.
 *
 * @since 1.0
 * @see TokenBucket
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TokenBucketRateLimiter implements RateLimiter {

    static final int PRUNE_THRESHOLD = 1000;

    private final BotProperties properties;

    private final Map<String, ConfiguredBucket> buckets = new ConcurrentHashMap<>();

    @Override
    public RateLimitResult tryConsumeSender(String senderKey) {
        BotProperties.RateLimitProperties rateLimit = properties.getRateLimit();
        if (!rateLimit.isEnabled()) {
            return RateLimitResult.allowed(Long.MAX_VALUE);
        }

        if (buckets.size() > PRUNE_THRESHOLD) {
            pruneIdleBuckets();
        }
        String key = "sender:" + senderKey;
        TokenBucket bucket = resolveBucket(key, rateLimit.getMessagesPerWindow(), rateLimit.getWindow());

        RateLimitResult result = bucket.tryConsume();
        if (!result.isAllowed()) {
            log.debug("Rate limit exceeded ({})", key);
        }
        return result;
    }

    @Override
    public void reset() {
        buckets.clear();
    }

    /**
     * Drops buckets that refilled completely; a new bucket for the same sender
     * starts full anyway.
     */
    int pruneIdleBuckets() {
        int before = buckets.size();
        buckets.values().removeIf(configured -> configured.bucket().isFull());
        int removed = before - buckets.size();
        if (removed > 0) {
            log.debug("Pruned {} idle rate-limit buckets", removed);
        }
        return removed;
    }

    int bucketCount() {
        return buckets.size();
    }

    private TokenBucket resolveBucket(String key, int capacity, Duration refillPeriod) {
        ConfiguredBucket configured = buckets.compute(key, (bucketKey, existing) -> {
            if (existing == null || existing.capacity() != capacity
                    || !existing.refillPeriod().equals(refillPeriod)) {
                return new ConfiguredBucket(new TokenBucket(capacity, refillPeriod), capacity, refillPeriod);
            }
            return existing;
        });
        return configured.bucket();
    }

    private record ConfiguredBucket(TokenBucket bucket, int capacity, Duration refillPeriod) {
    }
}
