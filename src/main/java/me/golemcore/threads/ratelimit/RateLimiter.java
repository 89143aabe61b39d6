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

/**
 * Per-sender admission control applied before a message enters the debounce
 * buffer.
 *
 * @since 1.0
 * @see TokenBucketRateLimiter
 */
public interface RateLimiter {

    /**
     * Check and consume a token for one sender.
     *
     * @param senderKey
     *            stable author id, {@code channelType:senderId}
     */
    RateLimitResult tryConsumeSender(String senderKey);

    /**
     * Forget every bucket.
     */
    void reset();
}
