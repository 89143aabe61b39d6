package me.golemcore.threads.adapter.outbound.focus;

import me.golemcore.threads.domain.model.FocusDirective;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryFocusAdapterTest {

    private final InMemoryFocusAdapter adapter = new InMemoryFocusAdapter();

    @Test
    void shouldKeepFocusPerConversation() {
        adapter.setFocus(FocusDirective.builder().conversationKey("discord:a").threadId("t1")
                .primaryAuthorName("Alice").build());
        adapter.setFocus(FocusDirective.builder().conversationKey("discord:b").threadId("t2").build());

        assertEquals("t1", adapter.currentFocus("discord:a").orElseThrow().getThreadId());
        assertEquals("Alice", adapter.currentFocus("discord:a").orElseThrow().getPrimaryAuthorName());
        assertEquals("t2", adapter.currentFocus("discord:b").orElseThrow().getThreadId());
    }

    @Test
    void shouldReplaceAndClearFocus() {
        adapter.setFocus(FocusDirective.builder().conversationKey("discord:a").threadId("t1").build());
        adapter.setFocus(FocusDirective.builder().conversationKey("discord:a").threadId("t3").build());
        assertEquals("t3", adapter.currentFocus("discord:a").orElseThrow().getThreadId());

        adapter.clearFocus("discord:a");

        assertTrue(adapter.currentFocus("discord:a").isEmpty());
    }
}
