package me.golemcore.threads.testsupport;

import me.golemcore.threads.domain.model.InboundMessage;
import me.golemcore.threads.domain.model.MessageClassification;
import me.golemcore.threads.domain.model.ThreadMessage;

import java.time.Instant;

public final class TestMessages {

    public static final String CHANNEL = "discord";
    public static final String CHAT = "general";
    public static final String KEY = CHANNEL + ":" + CHAT;

    private TestMessages() {
    }

    public static InboundMessage inbound(String id, String sender, String content, Instant timestamp) {
        return InboundMessage.builder()
                .channelType(CHANNEL)
                .chatId(CHAT)
                .senderId(sender)
                .messageId(id)
                .authorName(sender)
                .content(content)
                .timestamp(timestamp)
                .build();
    }

    public static InboundMessage reply(String id, String sender, String content, Instant timestamp,
            String replyTo) {
        InboundMessage message = inbound(id, sender, content, timestamp);
        message.setReplyToMessageId(replyTo);
        return message;
    }

    public static ThreadMessage threadMessage(String id, String author, String content, Instant timestamp) {
        return ThreadMessage.builder()
                .messageId(id)
                .authorName(author)
                .authorId(CHANNEL + ":" + author)
                .content(content)
                .timestamp(timestamp)
                .classification(MessageClassification.CONTEXT)
                .build();
    }
}
