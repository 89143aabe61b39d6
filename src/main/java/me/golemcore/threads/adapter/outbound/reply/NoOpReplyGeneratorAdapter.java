package me.golemcore.threads.adapter.outbound.reply;

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
import me.golemcore.threads.domain.model.ReplyRequest;
import me.golemcore.threads.port.outbound.ReplyGeneratorPort;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Default reply generator: never answers.
 */
@Component
@Slf4j
public class NoOpReplyGeneratorAdapter implements ReplyGeneratorPort {

    @Override
    public CompletableFuture<Optional<String>> generate(ReplyRequest request) {
        log.debug("[Reply] No generator configured, skipping reply in {} ({} chars of context)",
                request.getConversationKey(), request.getContext().getContent().length());
        return CompletableFuture.completedFuture(Optional.empty());
    }
}
