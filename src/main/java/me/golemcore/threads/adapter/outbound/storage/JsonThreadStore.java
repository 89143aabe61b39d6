package me.golemcore.threads.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.threads.adapter.outbound.storage.dto.PendingMessageDocument;
import me.golemcore.threads.adapter.outbound.storage.dto.ThreadDocument;
import me.golemcore.threads.domain.model.ConversationThread;
import me.golemcore.threads.domain.model.PendingMessage;
import me.golemcore.threads.domain.model.TrackerSnapshot;
import me.golemcore.threads.infrastructure.config.BotProperties;
import me.golemcore.threads.port.outbound.StoragePort;
import me.golemcore.threads.port.outbound.ThreadStorePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thread state persisted as JSON through {@link StoragePort}.
 *
 * <p>
 * {@code active.json} maps thread id to thread and {@code pending.json} holds
 * the pending list; both are replaced atomically on every save. Dead threads
 * are appended, one JSON line each, to {@code archive/yyyy-MM-dd.jsonl} and
 * never rewritten.
 */
@Component
@Slf4j
public class JsonThreadStore implements ThreadStorePort {

    static final String ACTIVE_FILE = "active.json";
    static final String PENDING_FILE = "pending.json";
    private static final String ARCHIVE_SUFFIX = ".jsonl";
    private static final String NEWLINE = "\n";

    private static final TypeReference<LinkedHashMap<String, ThreadDocument>> ACTIVE_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<PendingMessageDocument>> PENDING_TYPE = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String directory;

    public JsonThreadStore(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            BotProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.directory = properties.getStorage().getDirectories().getThreads();
    }

    @Override
    public TrackerSnapshot load() {
        Map<String, ThreadDocument> active = read(ACTIVE_FILE, ACTIVE_TYPE, new LinkedHashMap<>());
        List<PendingMessageDocument> pending = read(PENDING_FILE, PENDING_TYPE, new ArrayList<>());

        List<ConversationThread> threads = new ArrayList<>();
        for (Map.Entry<String, ThreadDocument> entry : active.entrySet()) {
            ThreadDocument document = entry.getValue();
            if (document == null) {
                continue;
            }
            if (document.getId() == null) {
                document.setId(entry.getKey());
            }
            try {
                threads.add(ThreadDocumentMapper.toDomain(document));
            } catch (IllegalArgumentException e) {
                log.warn("[Storage] Skipping unreadable thread {}: {}", entry.getKey(), e.getMessage());
            }
        }

        List<PendingMessage> pendingMessages = new ArrayList<>();
        for (PendingMessageDocument document : pending) {
            if (document == null || document.getMessage() == null) {
                continue;
            }
            try {
                pendingMessages.add(ThreadDocumentMapper.toDomain(document));
            } catch (IllegalArgumentException e) {
                log.warn("[Storage] Skipping unreadable pending message: {}", e.getMessage());
            }
        }
        return new TrackerSnapshot(threads, pendingMessages);
    }

    @Override
    public void save(TrackerSnapshot snapshot) {
        Map<String, ThreadDocument> active = new LinkedHashMap<>();
        for (ConversationThread thread : snapshot.threads()) {
            active.put(thread.getId(), ThreadDocumentMapper.toDocument(thread, null));
        }
        List<PendingMessageDocument> pending = snapshot.pending().stream()
                .map(ThreadDocumentMapper::toDocument)
                .toList();

        storagePort.putTextAtomic(directory, ACTIVE_FILE, toJson(active), false).join();
        storagePort.putTextAtomic(directory, PENDING_FILE, toJson(pending), false).join();
    }

    @Override
    public int archive(List<ConversationThread> threads) {
        if (threads.isEmpty()) {
            return 0;
        }
        Instant now = clock.instant();
        StringBuilder lines = new StringBuilder();
        for (ConversationThread thread : threads) {
            lines.append(toJson(ThreadDocumentMapper.toDocument(thread, now))).append(NEWLINE);
        }
        storagePort.appendText(directory, archivePath(LocalDate.ofInstant(now, ZoneOffset.UTC)), lines.toString())
                .join();
        return threads.size();
    }

    @Override
    public int deleteArchivesOlderThan(int retentionDays) {
        LocalDate cutoff = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).minusDays(retentionDays);
        List<String> files = storagePort.listObjects(directory, LocalStorageAdapter.ARCHIVE_DIR).join();
        int deleted = 0;
        for (String file : files) {
            LocalDate date = archiveDate(file);
            if (date != null && date.isBefore(cutoff)) {
                storagePort.deleteObject(directory, file).join();
                deleted++;
            }
        }
        return deleted;
    }

    static String archivePath(LocalDate date) {
        return LocalStorageAdapter.ARCHIVE_DIR + "/" + date + ARCHIVE_SUFFIX;
    }

    static LocalDate archiveDate(String file) {
        int slash = file.lastIndexOf('/');
        String name = slash >= 0 ? file.substring(slash + 1) : file;
        if (!name.endsWith(ARCHIVE_SUFFIX)) {
            return null;
        }
        try {
            return LocalDate.parse(name.substring(0, name.length() - ARCHIVE_SUFFIX.length()));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private <T> T read(String file, TypeReference<T> type, T empty) {
        String content = storagePort.getText(directory, file).join();
        if (content == null || content.isBlank()) {
            return empty;
        }
        try {
            T value = objectMapper.readValue(content, type);
            return value != null ? value : empty;
        } catch (JsonProcessingException e) {
            log.error("[Storage] Corrupt {}/{}, ignoring it: {}", directory, file, e.getOriginalMessage());
            return empty;
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize thread state", e);
        }
    }
}
