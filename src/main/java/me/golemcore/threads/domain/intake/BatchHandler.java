package me.golemcore.threads.domain.intake;

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

import java.util.List;

/**
 * Processes one batch of a conversation. Called by the queue worker, never
 * concurrently for the same conversation key.
 */
public interface BatchHandler {

    void handle(String conversationKey, List<InboundMessage> batch);
}
