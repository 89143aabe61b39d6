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

import me.golemcore.threads.domain.model.RateLimitResult;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe token bucket for per-sender intake limits.
 *
 * <p>
 * The bucket starts full with {@code capacity} tokens, refills continuously
 * over {@code refillPeriod} and denies a message when empty, reporting the
 * wait until the next token. Refill is computed lazily on each
 * {@code tryConsume()} from the time elapsed since the last refill.
 *
 * @since 1.0
 */
public class TokenBucket {

    private final long capacity;
    private final Duration refillPeriod;
    private final AtomicLong tokens;
    private final AtomicLong lastRefillNanos;

    public TokenBucket(long capacity, Duration refillPeriod) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        if (refillPeriod.isZero() || refillPeriod.isNegative()) {
            throw new IllegalArgumentException("refillPeriod must be positive: " + refillPeriod);
        }
        this.capacity = capacity;
        this.refillPeriod = refillPeriod;
        this.tokens = new AtomicLong(capacity);
        this.lastRefillNanos = new AtomicLong(System.nanoTime());
    }

    /**
     * Try to consume one token.
     */
    public synchronized RateLimitResult tryConsume() {
        refill();

        if (tokens.get() > 0) {
            long remaining = tokens.decrementAndGet();
            return RateLimitResult.allowed(remaining);
        }

        return RateLimitResult.denied(nanosPerToken() / 1_000_000, "Rate limit exceeded");
    }

    public synchronized long availableTokens() {
        refill();
        return tokens.get();
    }

    /**
     * Idle means full: nothing would be lost by discarding the bucket.
     */
    public synchronized boolean isFull() {
        refill();
        return tokens.get() >= capacity;
    }

    private void refill() {
        long now = System.nanoTime();
        long elapsedNanos = now - lastRefillNanos.get();

        if (elapsedNanos <= 0) {
            return;
        }

        long tokensToAdd = (elapsedNanos * capacity) / refillPeriod.toNanos();
        if (tokensToAdd > 0) {
            tokens.set(Math.min(capacity, tokens.get() + tokensToAdd));
            lastRefillNanos.set(now);
        }
    }

    private long nanosPerToken() {
        return refillPeriod.toNanos() / capacity;
    }
}
