package me.golemcore.threads.adapter.outbound.dispatch;

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
import me.golemcore.threads.domain.model.OutboundReply;
import me.golemcore.threads.port.outbound.OutboundDispatchPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Default dispatch target: logs the reply instead of sending it anywhere.
 */
@Component
@Slf4j
public class LoggingDispatchAdapter implements OutboundDispatchPort {

    @Override
    public CompletableFuture<Void> send(OutboundReply reply) {
        log.info("[Dispatch] {} reply-to={} collapsed={} thread={}: {}", reply.conversationKey(),
                reply.getReplyToMessageId(), reply.getCollapsedCount(), reply.getThreadId(), reply.getContent());
        return CompletableFuture.completedFuture(null);
    }
}
