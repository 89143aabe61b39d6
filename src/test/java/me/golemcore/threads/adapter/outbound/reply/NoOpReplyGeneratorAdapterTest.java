package me.golemcore.threads.adapter.outbound.reply;

import me.golemcore.threads.domain.model.ReplyRequest;
import me.golemcore.threads.domain.model.ThreadedContext;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class NoOpReplyGeneratorAdapterTest {

    @Test
    void shouldNeverProduceReply() {
        NoOpReplyGeneratorAdapter adapter = new NoOpReplyGeneratorAdapter();
        ReplyRequest request = ReplyRequest.builder()
                .conversationKey("discord:general")
                .context(ThreadedContext.builder().content("alice: hi golem").build())
                .messageCount(1)
                .build();

        Optional<String> reply = adapter.generate(request).join();

        assertTrue(reply.isEmpty());
    }
}
