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

import java.util.List;

/**
 * Detached copy of the tracker's live state, as persisted.
 */
public record TrackerSnapshot(List<ConversationThread> threads, List<PendingMessage> pending) {

    public TrackerSnapshot {
        threads = threads != null ? List.copyOf(threads) : List.of();
        pending = pending != null ? List.copyOf(pending) : List.of();
    }

    public static TrackerSnapshot empty() {
        return new TrackerSnapshot(List.of(), List.of());
    }
}
