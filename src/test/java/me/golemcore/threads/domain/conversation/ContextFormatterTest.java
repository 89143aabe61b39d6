package me.golemcore.threads.domain.conversation;

import me.golemcore.threads.domain.model.ConversationThread;
import me.golemcore.threads.domain.model.InboundMessage;
import me.golemcore.threads.domain.model.MessageClassification;
import me.golemcore.threads.domain.model.PendingMessage;
import me.golemcore.threads.domain.model.ThreadMessage;
import me.golemcore.threads.domain.model.ThreadState;
import me.golemcore.threads.domain.model.ThreadedContext;
import me.golemcore.threads.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static me.golemcore.threads.testsupport.TestMessages.KEY;
import static me.golemcore.threads.testsupport.TestMessages.inbound;
import static me.golemcore.threads.testsupport.TestMessages.threadMessage;
import static org.junit.jupiter.api.Assertions.*;

class ContextFormatterTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    private ContextFormatter formatter;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(T0.plusSeconds(120));
        formatter = new ContextFormatter(clock, new SystemIdentity("golem", List.of(), "system:self"));
    }

    private static ThreadMessage respond(String id, String author, String content, Instant timestamp) {
        return threadMessage(id, author, content, timestamp).toBuilder()
                .classification(MessageClassification.RESPOND)
                .build();
    }

    private static ConversationThread thread(ThreadMessage... messages) {
        ConversationThread thread = ConversationThread.create(KEY, messages[0].getTimestamp());
        for (ThreadMessage message : messages) {
            thread.addMessage(message, 100);
        }
        return thread;
    }

    @Test
    void shouldReturnRawContentForLoneMessageWithNothingElseToShow() {
        InboundMessage message = inbound("m1", "alice", "golem what time is it", T0);

        ThreadedContext context = formatter.buildThreadedContext(List.of(), List.of(), List.of(message), List.of());

        assertTrue(context.isRawFallback());
        assertEquals("golem what time is it", context.getContent());
        assertEquals(List.of("m1"), context.getCoveredMessageIds());
    }

    @Test
    void shouldRenderSystemThreadAndTagLastHumanMessage() {
        ConversationThread thread = thread(
                respond("m1", "alice", "golem can you help with math", T0),
                threadMessage("m2", "alice", "the homework is due", T0.plusSeconds(2)));
        InboundMessage trigger = inbound("m2", "alice", "the homework is due", T0.plusSeconds(2));

        ThreadedContext context = formatter.buildThreadedContext(List.of(thread), List.of(), List.of(trigger),
                List.of());

        String content = context.getContent();
        assertTrue(content.startsWith(ContextFormatter.SYSTEM_SECTION));
        assertTrue(content.contains("--- Thread: started 2 min ago, 2 messages (active) ---"));
        assertTrue(content.contains("Participants: alice"));
        assertTrue(content.contains("alice: golem can you help with math"));
        assertTrue(content.contains("#msg1 alice: the homework is due"));
        assertEquals("m2", context.getTagMap().get("#msg1"));
        assertEquals(List.of(thread.getId()), context.getShownThreadIds());
        assertEquals(1, context.getThreadCount());
        assertFalse(context.isRawFallback());
    }

    @Test
    void shouldNotMutateShownIndex() {
        ConversationThread thread = thread(
                respond("m1", "alice", "golem can you help", T0),
                threadMessage("m2", "alice", "with math", T0.plusSeconds(2)));

        formatter.buildThreadedContext(List.of(thread), List.of(),
                List.of(inbound("m2", "alice", "with math", T0.plusSeconds(2))), List.of());

        assertEquals(0, thread.getLastShownIndex());
    }

    @Test
    void shouldRenderOnlyNewMessagesOfContinuedThread() {
        ConversationThread thread = thread(
                respond("m1", "alice", "golem can you help", T0),
                threadMessage("m2", "alice", "with math", T0.plusSeconds(2)));
        thread.markAllShown();
        thread.addMessage(threadMessage("m3", "bob", "me too please", T0.plusSeconds(10)), 100);

        ThreadedContext context = formatter.buildThreadedContext(List.of(thread), List.of(),
                List.of(inbound("m3", "bob", "me too please", T0.plusSeconds(10))), List.of());

        String content = context.getContent();
        assertTrue(content.contains("--- Thread (continued, 1 new): 2 earlier messages already in your history ---"));
        assertFalse(content.contains("with math"));
        assertTrue(content.contains("#msg1 bob: me too please"));
    }

    @Test
    void shouldElideMiddleOfLongSystemThread() {
        ThreadMessage[] messages = new ThreadMessage[9];
        messages[0] = respond("m0", "alice", "message 0", T0);
        for (int i = 1; i < messages.length; i++) {
            messages[i] = threadMessage("m" + i, i % 2 == 0 ? "alice" : "bob", "message " + i, T0.plusSeconds(i));
        }
        ConversationThread thread = thread(messages);

        ThreadedContext context = formatter.buildThreadedContext(List.of(thread), List.of(),
                List.of(inbound("m8", "alice", "message 8", T0.plusSeconds(8))), List.of());

        String content = context.getContent();
        assertTrue(content.contains("message 1"));
        assertTrue(content.contains("[... 3 earlier messages omitted ...]"));
        assertFalse(content.contains("message 3\n"));
        assertTrue(content.contains("#msg1 alice: message 8"));
    }

    @Test
    void shouldCapSystemThreadsAndMentionTheRest() {
        ConversationThread first = thread(respond("a1", "alice", "one", T0.plusSeconds(4)));
        ConversationThread second = thread(respond("b1", "bob", "two", T0.plusSeconds(3)));
        ConversationThread third = thread(respond("c1", "carol", "three", T0.plusSeconds(2)));
        ConversationThread fourth = thread(respond("d1", "dave", "four", T0.plusSeconds(1)));

        ThreadedContext context = formatter.buildThreadedContext(List.of(fourth, third, second, first), List.of(),
                List.of(inbound("a1", "alice", "one", T0.plusSeconds(4))), List.of());

        assertEquals(List.of(first.getId(), second.getId(), third.getId()), context.getShownThreadIds());
        assertTrue(context.getContent().contains("[... 1 more threads you're part of, not shown ...]"));
        assertFalse(context.getContent().contains("dave: four"));
        assertEquals(4, context.getThreadCount());
    }

    @Test
    void shouldRenderBackgroundAndUnthreadedSections() {
        ConversationThread background = thread(
                threadMessage("b1", "bob", "football tonight", T0),
                threadMessage("b2", "carol", "who is playing", T0.plusSeconds(5)));
        PendingMessage pending = PendingMessage.builder()
                .message(threadMessage("p1", "dave", "golem are you there", T0.plusSeconds(30)))
                .conversationKey(KEY)
                .createdAt(T0.plusSeconds(30))
                .build();

        ThreadedContext context = formatter.buildThreadedContext(List.of(background), List.of(pending),
                List.of(inbound("p1", "dave", "golem are you there", T0.plusSeconds(30))), List.of());

        String content = context.getContent();
        assertTrue(content.contains(ContextFormatter.BACKGROUND_SECTION));
        assertTrue(content.contains("carol: who is playing"));
        assertTrue(content.contains(ContextFormatter.UNTHREADED_SECTION));
        assertTrue(content.contains("#msg1 dave: golem are you there"));
        assertEquals("p1", context.highestTaggedMessageId());
        assertTrue(context.getShownThreadIds().isEmpty());
        assertEquals(1, context.getBackgroundThreadCount());
    }

    @Test
    void shouldSkipDeadThreads() {
        ConversationThread dead = thread(threadMessage("d1", "dave", "ancient history", T0));
        dead.transitionTo(ThreadState.STALE, T0);
        dead.transitionTo(ThreadState.DEAD, T0);
        InboundMessage message = inbound("m1", "alice", "golem hi", T0);

        ThreadedContext context = formatter.buildThreadedContext(List.of(dead), List.of(), List.of(message),
                List.of());

        assertFalse(context.getContent().contains("ancient history"));
    }

    @Test
    void shouldFallBackToTraceWhenNothingElseRenders() {
        InboundMessage first = inbound("m1", "alice", "golem hi", T0);
        InboundMessage second = inbound("m2", "bob", "golem hello", T0.plusSeconds(1));

        ThreadedContext context = formatter.buildThreadedContext(List.of(), List.of(), List.of(first, second),
                List.of(inbound("c1", "carol", "just chatting", T0)));

        String content = context.getContent();
        assertTrue(content.startsWith(ContextFormatter.TRACE_SECTION));
        assertTrue(content.contains("alice: golem hi"));
        assertTrue(content.contains("#msg1 bob: golem hello"));
        assertTrue(content.contains("carol: just chatting"));
        assertEquals("m2", context.highestTaggedMessageId());
        assertTrue(context.isRawFallback());
    }

    @Test
    void shouldRenderHandleWhenDifferentFromName() {
        ThreadMessage message = threadMessage("m1", "Alice", "golem hi", T0).toBuilder()
                .authorHandle("alice_w")
                .classification(MessageClassification.RESPOND)
                .build();
        ConversationThread thread = thread(message, threadMessage("m2", "Alice", "you there", T0.plusSeconds(1)));

        ThreadedContext context = formatter.buildThreadedContext(List.of(thread), List.of(),
                List.of(inbound("m2", "Alice", "you there", T0.plusSeconds(1))), List.of());

        assertTrue(context.getContent().contains("Alice (@alice_w): golem hi"));
    }

    @Test
    void singleThreadContextShouldFocusOneThread() {
        ConversationThread focus = thread(
                respond("m1", "alice", "golem can you help", T0),
                threadMessage("m2", "alice", "with math", T0.plusSeconds(2)));
        ConversationThread other = thread(
                respond("o1", "bob", "golem what about physics", T0.plusSeconds(3)));

        ThreadedContext context = formatter.buildSingleThreadContext(focus, List.of(focus, other), List.of());

        String content = context.getContent();
        assertTrue(content.startsWith(ContextFormatter.FOCUS_SECTION));
        assertTrue(content.contains("#msg1 alice: with math"));
        assertTrue(content.contains(ContextFormatter.FOCUS_BACKGROUND_SECTION));
        assertTrue(content.contains("bob: golem what about physics"));
        assertEquals(focus.getId(), context.getFocusThreadId());
        assertEquals("alice", context.getPrimaryAuthorName());
        assertEquals(List.of("m1", "m2"), context.getCoveredMessageIds());
        assertTrue(context.getShownThreadIds().isEmpty());
        assertEquals(0, focus.getLastShownIndex());
    }

    @Test
    void formatAgeShouldPickCoarsestUnit() {
        assertEquals("42s ago", ContextFormatter.formatAge(T0, T0.plusSeconds(42)));
        assertEquals("5 min ago", ContextFormatter.formatAge(T0, T0.plusSeconds(300)));
        assertEquals("2h ago", ContextFormatter.formatAge(T0, T0.plusSeconds(7200)));
        assertEquals("3d ago", ContextFormatter.formatAge(T0, T0.plusSeconds(3 * 86_400)));
        assertEquals("0s ago", ContextFormatter.formatAge(T0.plusSeconds(5), T0));
    }
}
