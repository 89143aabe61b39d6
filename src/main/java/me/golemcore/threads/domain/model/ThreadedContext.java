package me.golemcore.threads.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rendered conversation context handed to the reply generator.
 *
 * <p>
 * {@code tagMap} maps reply tags ({@code #msg1}, {@code #msg2}, ...) to
 * external message ids in emission order. {@code shownThreadIds} lists the
 * system-involved threads rendered in windowed mode; the caller commits their
 * shown cursor after a successful reply.
 */
@Value
@Builder
public class ThreadedContext {

    String content;
    @Builder.Default
    Map<String, String> tagMap = new LinkedHashMap<>();
    @Builder.Default
    List<String> shownThreadIds = List.of();
    @Builder.Default
    List<String> coveredMessageIds = List.of();
    String primaryAuthorName;
    String focusThreadId;
    int threadCount;
    int backgroundThreadCount;
    boolean rawFallback;

    /**
     * External id behind the highest-numbered tag that has a mapping.
     */
    public String highestTaggedMessageId() {
        String best = null;
        int bestNumber = -1;
        for (Map.Entry<String, String> entry : tagMap.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isEmpty()) {
                continue;
            }
            int number = tagNumber(entry.getKey());
            if (number > bestNumber) {
                bestNumber = number;
                best = entry.getValue();
            }
        }
        return best;
    }

    private static int tagNumber(String tag) {
        if (tag == null || !tag.startsWith("#msg")) {
            return -1;
        }
        try {
            return Integer.parseInt(tag.substring(4));
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
