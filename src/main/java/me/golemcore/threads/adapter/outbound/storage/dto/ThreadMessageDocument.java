package me.golemcore.threads.adapter.outbound.storage.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThreadMessageDocument {
    private String messageId;
    private String authorName;
    private String authorHandle;
    private String authorId;
    private String content;
    private Instant timestamp;
    private String replyToMessageId;
    private boolean replyToSystem;
    private String classification;
    private boolean fromSystem;
}
