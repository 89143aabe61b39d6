package me.golemcore.threads.adapter.outbound.focus;

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

import me.golemcore.threads.domain.model.FocusDirective;
import me.golemcore.threads.port.outbound.FocusPort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the current focus per conversation in memory for the reply side to
 * read.
 */
@Component
public class InMemoryFocusAdapter implements FocusPort {

    private final Map<String, FocusDirective> focus = new ConcurrentHashMap<>();

    @Override
    public void setFocus(FocusDirective directive) {
        focus.put(directive.getConversationKey(), directive);
    }

    @Override
    public Optional<FocusDirective> currentFocus(String conversationKey) {
        return Optional.ofNullable(focus.get(conversationKey));
    }

    @Override
    public void clearFocus(String conversationKey) {
        focus.remove(conversationKey);
    }
}
