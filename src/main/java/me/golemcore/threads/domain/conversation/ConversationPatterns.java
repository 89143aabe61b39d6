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

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Text patterns used by thread resolution, topic splitting and reply
 * bookkeeping.
 */
public final class ConversationPatterns {

    /** Closing phrases that resolve a thread. */
    public static final Pattern RESOLUTION = Pattern.compile(
            "\\b(thanks|thank you|thx|ty|got it|makes sense|ok cool|understood|"
                    + "perfect|nvm|nevermind|never mind|figured it out|solved|all good|"
                    + "appreciate it|cheers|aight bet|np|no worries)\\b",
            Pattern.CASE_INSENSITIVE);

    /** Topic-shift markers that may split a thread. */
    public static final Pattern SHIFT_MARKER = Pattern.compile(
            "\\b(btw|by the way|anyway|on another note|speaking of|"
                    + "also unrelated|random but|unrelated but|off topic|"
                    + "oh and|changing topic|side note)\\b",
            Pattern.CASE_INSENSITIVE);

    /** Raw tool-call markup that must never be recorded as a reply. */
    public static final Pattern TOOL_MARKUP = Pattern.compile("<\\s*(?:function|invoke|parameter)",
            Pattern.CASE_INSENSITIVE);

    public static final Set<String> QUESTION_WORDS = Set.of(
            "who", "what", "where", "when", "why", "how",
            "can", "could", "would", "should", "do", "does",
            "is", "are", "will", "did");

    private ConversationPatterns() {
    }

    public static boolean isResolution(String content) {
        return content != null && RESOLUTION.matcher(content).find();
    }

    public static boolean hasShiftMarker(String content) {
        return content != null && SHIFT_MARKER.matcher(content).find();
    }

    public static boolean looksLikeToolMarkup(String content) {
        return content != null && TOOL_MARKUP.matcher(content).find();
    }
}
