package me.golemcore.threads.adapter.outbound.dispatch;

import me.golemcore.threads.domain.model.OutboundReply;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class LoggingDispatchAdapterTest {

    @Test
    void shouldCompleteImmediately() {
        LoggingDispatchAdapter adapter = new LoggingDispatchAdapter();
        OutboundReply reply = OutboundReply.builder()
                .channelType("discord")
                .chatId("general")
                .content("hello")
                .replyToMessageId("m1")
                .collapsedCount(1)
                .build();

        CompletableFuture<Void> sent = adapter.send(reply);

        assertTrue(sent.isDone());
        assertFalse(sent.isCompletedExceptionally());
    }
}
