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

import me.golemcore.threads.domain.model.InboundMessage;
import me.golemcore.threads.domain.model.ThreadedContext;
import org.springframework.stereotype.Component;

/**
 * Chooses the platform message a reply is threaded under: the highest tagged
 * message of the rendered context, else the trigger message itself.
 */
@Component
public class ReplyTargetResolver {

    public String resolve(ThreadedContext context, InboundMessage trigger) {
        String tagged = context != null ? context.highestTaggedMessageId() : null;
        if (tagged != null) {
            return tagged;
        }
        if (trigger != null && trigger.hasMessageId()) {
            return trigger.getMessageId();
        }
        return null;
    }
}
