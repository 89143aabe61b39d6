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

import java.util.List;

/**
 * A batch split by classification. Dropped messages are only counted.
 */
public record ClassifiedBatch(List<InboundMessage> respond, List<InboundMessage> context, int dropped) {

    public ClassifiedBatch {
        respond = List.copyOf(respond);
        context = List.copyOf(context);
    }

    public boolean hasRespond() {
        return !respond.isEmpty();
    }

    public boolean isEmpty() {
        return respond.isEmpty() && context.isEmpty();
    }
}
