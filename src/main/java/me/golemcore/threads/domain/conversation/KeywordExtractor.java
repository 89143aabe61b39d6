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

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts topic keywords: lowercase words of three or more letters, minus
 * stopwords and chat slang, ranked by frequency. Ties keep first-occurrence
 * order.
 */
@Component
public class KeywordExtractor {

    public static final int DEFAULT_MAX_KEYWORDS = 5;

    private static final Pattern WORD = Pattern.compile("[a-zA-Z]{3,}");

    private static final Set<String> STOPWORDS = new HashSet<>(Arrays.asList(
            // English
            "the", "a", "an", "is", "are", "was", "were", "be", "been", "being",
            "have", "has", "had", "do", "does", "did", "will", "would", "could",
            "should", "may", "might", "can", "shall", "not", "and", "but", "or",
            "nor", "for", "yet", "so", "in", "on", "at", "to", "of", "by",
            "with", "from", "up", "out", "if", "then", "than", "too", "very",
            "just", "about", "also", "that", "this", "these", "those", "what",
            "which", "who", "how", "when", "where", "why", "its", "it", "i",
            "me", "my", "we", "our", "you", "your", "he", "she", "they",
            "them", "her", "his", "all", "each", "some", "any", "most", "more",
            "other", "into", "over", "only", "own", "same", "such", "no", "not",
            "don", "now", "here", "there", "back", "even", "well", "still",
            "get", "got", "know", "think", "say", "said", "make", "made",
            "let", "like", "come", "came", "take", "took", "see", "saw",
            "want", "tell", "told", "give", "gave", "way", "thing", "good",
            "new", "first", "last", "long", "great", "little", "right", "look",
            // chat slang
            "lol", "lmao", "lmfao", "rofl", "haha", "hehe", "xd", "xdd",
            "yeah", "yes", "yep", "yea", "yah", "nah", "nope", "ngl", "tbh",
            "imo", "imho", "idk", "idc", "bruh", "bro", "dude", "man", "guys",
            "like", "gonna", "wanna", "gotta", "kinda", "sorta", "tho",
            "lmk", "omg", "omfg", "smh", "fyi", "btw", "irl",
            "rn", "rip", "gg", "ez", "pog", "poggers", "based", "cap", "nocap",
            "sus", "vibe", "vibes", "lit", "fire", "bet", "aight", "ight",
            "msg", "damn", "dang", "huh", "hmm", "uhh", "umm", "mhm",
            "hey", "hello", "hi", "sup", "yo", "ayy"));

    private final Set<String> stopwords;

    public KeywordExtractor(SystemIdentity identity) {
        Set<String> words = new HashSet<>(STOPWORDS);
        words.addAll(identity.lowercaseNames());
        this.stopwords = Collections.unmodifiableSet(words);
    }

    public List<String> extract(String text) {
        return extract(text, DEFAULT_MAX_KEYWORDS);
    }

    public List<String> extract(String text, int maxKeywords) {
        if (text == null || text.isEmpty() || maxKeywords <= 0) {
            return List.of();
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String word = matcher.group();
            if (!stopwords.contains(word)) {
                counts.merge(word, 1, Integer::sum);
            }
        }
        if (counts.isEmpty()) {
            return List.of();
        }
        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(counts.entrySet());
        // List.sort is stable, so equal counts keep first-occurrence order
        ranked.sort((left, right) -> Integer.compare(right.getValue(), left.getValue()));
        List<String> keywords = new ArrayList<>();
        for (int i = 0; i < ranked.size() && i < maxKeywords; i++) {
            keywords.add(ranked.get(i).getKey());
        }
        return keywords;
    }

    public Set<String> extractSet(String text) {
        return new LinkedHashSet<>(extract(text));
    }
}
