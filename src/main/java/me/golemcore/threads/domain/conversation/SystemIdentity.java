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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The bot's own identity inside conversations: its display name, extra names
 * users call it by, and the author id stamped on its own messages.
 */
public final class SystemIdentity {

    private final String name;
    private final List<String> aliases;
    private final String selfId;
    private final Pattern namePattern;

    public SystemIdentity(String name, List<String> aliases, String selfId) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("System name must not be blank");
        }
        this.name = name.trim();
        this.aliases = aliases != null ? List.copyOf(aliases) : List.of();
        this.selfId = selfId != null && !selfId.isBlank() ? selfId : "system:self";
        this.namePattern = buildPattern(this.name, this.aliases);
    }

    public String name() {
        return name;
    }

    public List<String> aliases() {
        return aliases;
    }

    public String selfId() {
        return selfId;
    }

    /**
     * Whole-word, case-insensitive match of the name or any alias.
     */
    public boolean isNamedIn(String content) {
        return content != null && namePattern.matcher(content).find();
    }

    /**
     * Lowercased name and aliases, for keyword filtering.
     */
    public List<String> lowercaseNames() {
        List<String> names = new ArrayList<>();
        names.add(name.toLowerCase(Locale.ROOT));
        for (String alias : aliases) {
            if (alias != null && !alias.isBlank()) {
                names.add(alias.trim().toLowerCase(Locale.ROOT));
            }
        }
        return names;
    }

    private static Pattern buildPattern(String name, List<String> aliases) {
        List<String> all = new ArrayList<>();
        all.add(name);
        aliases.stream()
                .filter(alias -> alias != null && !alias.isBlank())
                .map(String::trim)
                .forEach(all::add);
        String alternation = all.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("\\b(?:" + alternation + ")\\b", Pattern.CASE_INSENSITIVE);
    }
}
