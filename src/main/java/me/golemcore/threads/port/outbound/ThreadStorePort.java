package me.golemcore.threads.port.outbound;

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

import me.golemcore.threads.domain.model.ConversationThread;
import me.golemcore.threads.domain.model.TrackerSnapshot;

import java.util.List;

/**
 * Persistence of live thread state and cold archival of dead threads. The
 * only component allowed to touch thread files.
 */
public interface ThreadStorePort {

    /**
     * Loads the persisted live state. Missing or unreadable documents yield
     * empty collections.
     */
    TrackerSnapshot load();

    /**
     * Replaces the persisted live state atomically.
     *
     * @throws RuntimeException
     *             if the documents cannot be written
     */
    void save(TrackerSnapshot snapshot);

    /**
     * Appends dead threads to the archive, one line per thread.
     *
     * @return number of threads archived
     */
    int archive(List<ConversationThread> threads);

    /**
     * Deletes archive partitions older than {@code retentionDays}.
     *
     * @return number of partitions deleted
     */
    int deleteArchivesOlderThan(int retentionDays);
}
