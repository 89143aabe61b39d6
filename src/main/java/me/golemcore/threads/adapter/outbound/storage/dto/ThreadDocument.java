package me.golemcore.threads.adapter.outbound.storage.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted form of one thread, as stored in active.json and in archive
 * lines. Participants and the message index are derived on load.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThreadDocument {
    private String id;
    private String conversationKey;
    private String state;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant stateChangedAt;
    private boolean systemInvolved;
    private boolean systemResponded;
    @Builder.Default
    private List<ThreadMessageDocument> messages = new ArrayList<>();
    @Builder.Default
    private List<String> topicKeywords = new ArrayList<>();
    private String parentId;
    @Builder.Default
    private List<String> childIds = new ArrayList<>();
    private int lastShownIndex;
    private Instant archivedAt;
}
