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
public class PendingMessageDocument {
    private ThreadMessageDocument message;
    private String conversationKey;
    private Instant createdAt;
}
