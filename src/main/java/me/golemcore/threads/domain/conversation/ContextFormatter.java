package me.golemcore.threads.domain.conversation;

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
import me.golemcore.threads.domain.model.InboundMessage;
import me.golemcore.threads.domain.model.PendingMessage;
import me.golemcore.threads.domain.model.ThreadMessage;
import me.golemcore.threads.domain.model.ThreadState;
import me.golemcore.threads.domain.model.ThreadedContext;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders tracked threads into the text the reply generator reads, plus a
 * {@code #msgN} tag map used to route the reply to the right message.
 *
 * <p>
 * Output layout for the multi-thread view:
 *
 * <pre>
 * (system section header, see SYSTEM_SECTION)
 * --- Thread: started 2 min ago, 3 messages (active) ---
 * Participants: Alice, golem
 * Alice: can you check this
 * golem: sure, one sec
 * #msg1 Alice (@alice): thanks, also the second one
 *
 * (background section header, see BACKGROUND_SECTION)
 * ...
 * [unthreaded]
 * ...
 * </pre>
 *
 * <p>
 * The formatter never mutates threads. Threads it rendered in windowed mode
 * are returned in {@link ThreadedContext#getShownThreadIds()} and the caller
 * advances their cursor once the reply actually went out.
 */
@Component
public class ContextFormatter {

    static final int SYSTEM_THREAD_FIRST_N = 2;
    static final int SYSTEM_THREAD_LAST_N = 4;
    static final int SYSTEM_THREAD_SHORT_THRESHOLD = 6;
    static final int SYSTEM_THREAD_MAX_DISPLAY = 3;
    static final int BACKGROUND_THREAD_LAST_N = 3;
    static final int BACKGROUND_THREAD_MAX_DISPLAY = 2;
    static final int UNTHREADED_LAST_N = 5;
    static final int TRACE_CONTEXT_LAST_N = 5;
    static final int FOCUS_FALLBACK_LAST_N = 4;
    static final int FOCUS_BACKGROUND_MAX_DISPLAY = 3;
    static final int FOCUS_UNTHREADED_LAST_N = 3;

    static final String SYSTEM_SECTION = "[active conversations — you are part of these threads]";
    static final String BACKGROUND_SECTION = "[background conversations — not directed at you, just awareness]";
    static final String UNTHREADED_SECTION = "[unthreaded]";
    static final String TRACE_SECTION = "[conversation trace]";
    static final String TRACE_BACKGROUND_SECTION = "[background — not directed at you]";
    static final String FOCUS_SECTION = "[your conversation — respond to this thread]";
    static final String FOCUS_BACKGROUND_SECTION = "[background — other conversations happening around you]";

    private static final Comparator<ConversationThread> MOST_RECENT_FIRST = Comparator
            .comparing(ConversationThread::getUpdatedAt).reversed();

    private final Clock clock;
    private final SystemIdentity identity;

    public ContextFormatter(Clock clock, SystemIdentity identity) {
        this.clock = clock;
        this.identity = identity;
    }

    /**
     * Multi-thread view of one conversation for a batch.
     *
     * @param threads
     *            threads of the conversation; dead ones are skipped
     * @param pending
     *            unthreaded messages of the conversation
     * @param respond
     *            batch messages classified as respond, in arrival order
     * @param context
     *            batch messages classified as context, in arrival order
     */
    public ThreadedContext buildThreadedContext(List<ConversationThread> threads, List<PendingMessage> pending,
            List<InboundMessage> respond, List<InboundMessage> context) {
        Instant now = clock.instant();
        List<ConversationThread> visible = threads.stream()
                .filter(t -> t.getState() != ThreadState.DEAD)
                .toList();
        List<InboundMessage> all = new ArrayList<>(respond);
        all.addAll(context);
        List<String> covered = all.stream()
                .filter(InboundMessage::hasMessageId)
                .map(InboundMessage::getMessageId)
                .toList();

        if (all.size() == 1 && context.isEmpty() && pending.isEmpty()
                && visible.stream().noneMatch(ConversationThread::hasUnshownMessages)) {
            return ThreadedContext.builder()
                    .content(respond.get(0).safeContent())
                    .coveredMessageIds(covered)
                    .rawFallback(true)
                    .build();
        }

        List<ConversationThread> systemThreads = visible.stream()
                .filter(ConversationThread::isSystemInvolved)
                .sorted(MOST_RECENT_FIRST)
                .toList();
        List<ConversationThread> backgroundThreads = visible.stream()
                .filter(t -> !t.isSystemInvolved())
                .sorted(MOST_RECENT_FIRST)
                .toList();

        Renderer renderer = new Renderer();
        List<String> shown = new ArrayList<>();

        if (!systemThreads.isEmpty()) {
            renderer.section(SYSTEM_SECTION);
            for (ConversationThread thread : systemThreads.subList(0,
                    Math.min(SYSTEM_THREAD_MAX_DISPLAY, systemThreads.size()))) {
                renderSystemThread(renderer, thread, now);
                renderer.blank();
                shown.add(thread.getId());
            }
            if (systemThreads.size() > SYSTEM_THREAD_MAX_DISPLAY) {
                int omitted = systemThreads.size() - SYSTEM_THREAD_MAX_DISPLAY;
                renderer.section("[... " + omitted + " more threads you're part of, not shown ...]");
            }
        }

        if (!backgroundThreads.isEmpty()) {
            renderer.section(BACKGROUND_SECTION);
            for (ConversationThread thread : backgroundThreads.subList(0,
                    Math.min(BACKGROUND_THREAD_MAX_DISPLAY, backgroundThreads.size()))) {
                renderBackgroundThread(renderer, thread, now);
                renderer.blank();
            }
        }

        if (!pending.isEmpty()) {
            renderer.section(UNTHREADED_SECTION);
            List<PendingMessage> tail = tail(pending, UNTHREADED_LAST_N);
            for (int i = 0; i < tail.size(); i++) {
                renderer.message(tail.get(i).getMessage(), i == tail.size() - 1);
            }
            renderer.blank();
        }

        boolean rawFallback = renderer.isEmpty();
        if (rawFallback) {
            renderTrace(renderer, respond, context);
        }

        return ThreadedContext.builder()
                .content(renderer.content())
                .tagMap(renderer.tagMap)
                .shownThreadIds(shown)
                .coveredMessageIds(covered)
                .threadCount(systemThreads.size())
                .backgroundThreadCount(backgroundThreads.size())
                .rawFallback(rawFallback)
                .build();
    }

    /**
     * Focused view of one thread for a per-thread reply. Other threads of the
     * conversation appear as background. Nothing is reported as shown.
     */
    public ThreadedContext buildSingleThreadContext(ConversationThread focus, List<ConversationThread> threads,
            List<PendingMessage> pending) {
        Instant now = clock.instant();
        Renderer renderer = new Renderer();

        List<ThreadMessage> newMessages = focus.unshownMessages();
        if (newMessages.isEmpty()) {
            newMessages = focus.recentMessages(FOCUS_FALLBACK_LAST_N);
        }

        renderer.section(FOCUS_SECTION);
        if (focus.getLastShownIndex() > 0) {
            renderer.line("--- Thread (continued, " + newMessages.size() + " new): "
                    + focus.getLastShownIndex() + " earlier messages already in your history ---");
        } else {
            renderer.line(startedHeader(focus, now));
        }
        renderer.line(participantsLine(focus));
        int tagIndex = lastNonSystemIndex(newMessages);
        for (int i = 0; i < newMessages.size(); i++) {
            renderer.message(newMessages.get(i), i == tagIndex);
        }
        renderer.blank();

        String primaryAuthor = tagIndex >= 0 ? newMessages.get(tagIndex).displayName() : null;

        List<ConversationThread> others = threads.stream()
                .filter(t -> t.getState() != ThreadState.DEAD)
                .filter(t -> !Objects.equals(t.getId(), focus.getId()))
                .sorted(MOST_RECENT_FIRST)
                .toList();
        if (!others.isEmpty()) {
            renderer.section(FOCUS_BACKGROUND_SECTION);
            for (ConversationThread thread : others.subList(0,
                    Math.min(FOCUS_BACKGROUND_MAX_DISPLAY, others.size()))) {
                renderBackgroundThread(renderer, thread, now);
                renderer.blank();
            }
        }

        if (!pending.isEmpty()) {
            renderer.section(UNTHREADED_SECTION);
            for (PendingMessage message : tail(pending, FOCUS_UNTHREADED_LAST_N)) {
                renderer.message(message.getMessage(), false);
            }
        }

        List<String> covered = newMessages.stream()
                .filter(ThreadMessage::hasMessageId)
                .map(ThreadMessage::getMessageId)
                .toList();

        return ThreadedContext.builder()
                .content(renderer.content())
                .tagMap(renderer.tagMap)
                .coveredMessageIds(covered)
                .primaryAuthorName(primaryAuthor)
                .focusThreadId(focus.getId())
                .threadCount(1)
                .backgroundThreadCount(others.size())
                .build();
    }

    static String formatAge(Instant since, Instant now) {
        long seconds = Math.max(0, Duration.between(since, now).getSeconds());
        if (seconds < 60) {
            return seconds + "s ago";
        } else if (seconds < 3600) {
            return (seconds / 60) + " min ago";
        } else if (seconds < 86_400) {
            return (seconds / 3600) + "h ago";
        }
        return (seconds / 86_400) + "d ago";
    }

    private void renderSystemThread(Renderer renderer, ConversationThread thread, Instant now) {
        if (thread.getLastShownIndex() > 0) {
            List<ThreadMessage> newMessages = thread.unshownMessages();
            if (newMessages.isEmpty()) {
                renderer.line("--- Thread (no new messages, last activity "
                        + formatAge(thread.getUpdatedAt(), now) + ") ---");
                renderer.line(participantsLine(thread));
                return;
            }
            renderer.line("--- Thread (continued, " + newMessages.size() + " new): "
                    + thread.getLastShownIndex() + " earlier messages already in your history ---");
            renderer.line(participantsLine(thread));
            renderTagged(renderer, newMessages);
            return;
        }

        renderer.line(startedHeader(thread, now));
        renderer.line(participantsLine(thread));
        List<ThreadMessage> messages = thread.getMessages();
        if (messages.size() <= SYSTEM_THREAD_SHORT_THRESHOLD) {
            renderTagged(renderer, messages);
            return;
        }
        for (ThreadMessage message : messages.subList(0, SYSTEM_THREAD_FIRST_N)) {
            renderer.message(message, false);
        }
        int omitted = messages.size() - SYSTEM_THREAD_FIRST_N - SYSTEM_THREAD_LAST_N;
        renderer.line("[... " + omitted + " earlier messages omitted ...]");
        renderTagged(renderer, tail(messages, SYSTEM_THREAD_LAST_N));
    }

    private void renderBackgroundThread(Renderer renderer, ConversationThread thread, Instant now) {
        renderer.line(startedHeader(thread, now));
        renderer.line(participantsLine(thread));
        for (ThreadMessage message : thread.recentMessages(BACKGROUND_THREAD_LAST_N)) {
            renderer.message(message, false);
        }
    }

    private void renderTagged(Renderer renderer, List<ThreadMessage> messages) {
        int tagIndex = lastNonSystemIndex(messages);
        for (int i = 0; i < messages.size(); i++) {
            renderer.message(messages.get(i), i == tagIndex);
        }
    }

    private void renderTrace(Renderer renderer, List<InboundMessage> respond, List<InboundMessage> context) {
        renderer.section(TRACE_SECTION);
        for (int i = 0; i < respond.size(); i++) {
            InboundMessage message = respond.get(i);
            String prefix = "";
            if (i == respond.size() - 1) {
                prefix = renderer.nextTag(message.getMessageId()) + " ";
            }
            renderer.line(prefix + authorLabel(message.displayName(), message.getAuthorHandle())
                    + ": " + message.safeContent());
        }
        if (!context.isEmpty()) {
            renderer.blank();
            renderer.section(TRACE_BACKGROUND_SECTION);
            for (InboundMessage message : tail(context, TRACE_CONTEXT_LAST_N)) {
                renderer.line(message.displayName() + ": " + message.safeContent());
            }
        }
    }

    private String startedHeader(ConversationThread thread, Instant now) {
        return "--- Thread: started " + formatAge(thread.getCreatedAt(), now) + ", "
                + thread.getMessageCount() + " messages (" + thread.getState().label() + ") ---";
    }

    private String participantsLine(ConversationThread thread) {
        return "Participants: " + String.join(", ", thread.participantNames(identity.name()));
    }

    private String formatMessage(ThreadMessage message) {
        if (message.isFromSystem()) {
            return identity.name() + ": " + message.safeContent();
        }
        return authorLabel(message.displayName(), message.getAuthorHandle()) + ": " + message.safeContent();
    }

    private static String authorLabel(String name, String handle) {
        if (handle != null && !handle.isEmpty() && !handle.equals(name)) {
            return name + " (@" + handle + ")";
        }
        return name;
    }

    private static int lastNonSystemIndex(List<ThreadMessage> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (!messages.get(i).isFromSystem()) {
                return i;
            }
        }
        return -1;
    }

    private static <T> List<T> tail(List<T> items, int count) {
        return items.subList(Math.max(0, items.size() - count), items.size());
    }

    private final class Renderer {

        private final List<String> lines = new ArrayList<>();
        private final Map<String, String> tagMap = new LinkedHashMap<>();
        private int counter = 1;

        void section(String header) {
            lines.add(header);
            lines.add("");
        }

        void line(String text) {
            lines.add(text);
        }

        void blank() {
            lines.add("");
        }

        void message(ThreadMessage message, boolean tagged) {
            String prefix = tagged ? nextTag(message.getMessageId()) + " " : "";
            lines.add(prefix + formatMessage(message));
        }

        String nextTag(String messageId) {
            String tag = "#msg" + counter++;
            if (messageId != null && !messageId.isEmpty()) {
                tagMap.put(tag, messageId);
            }
            return tag;
        }

        boolean isEmpty() {
            return lines.isEmpty();
        }

        String content() {
            return String.join("\n", lines).strip();
        }
    }
}
