package me.golemcore.threads.domain.pipeline;

import me.golemcore.threads.adapter.outbound.focus.InMemoryFocusAdapter;
import me.golemcore.threads.domain.conversation.ContextFormatter;
import me.golemcore.threads.domain.conversation.ConversationTracker;
import me.golemcore.threads.domain.conversation.KeywordExtractor;
import me.golemcore.threads.domain.conversation.RelevanceClassifier;
import me.golemcore.threads.domain.conversation.SignalScorer;
import me.golemcore.threads.domain.conversation.SystemIdentity;
import me.golemcore.threads.domain.intake.DebounceBuffer;
import me.golemcore.threads.domain.intake.MessageIntakeService;
import me.golemcore.threads.domain.intake.QueueProcessor;
import me.golemcore.threads.domain.model.ConversationThread;
import me.golemcore.threads.domain.model.HardResetResult;
import me.golemcore.threads.domain.model.InboundMessage;
import me.golemcore.threads.domain.model.OutboundReply;
import me.golemcore.threads.domain.model.ThreadMessage;
import me.golemcore.threads.infrastructure.config.BotProperties;
import me.golemcore.threads.port.outbound.ClassifierPort;
import me.golemcore.threads.port.outbound.ThreadStorePort;
import me.golemcore.threads.ratelimit.TokenBucketRateLimiter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static me.golemcore.threads.testsupport.TestMessages.KEY;
import static me.golemcore.threads.testsupport.TestMessages.inbound;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Wires intake, debounce, queue, pipeline and tracker together with in-memory
 * adapters.
 */
class MessageFlowTest {

    private ScheduledExecutorService debounceScheduler;
    private ExecutorService workers;
    private ThreadStorePort threadStore;
    private ClassifierPort classifierPort;
    private ConversationTracker tracker;
    private MessageIntakeService intake;
    private final List<OutboundReply> sent = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        debounceScheduler = Executors.newSingleThreadScheduledExecutor();
        workers = Executors.newCachedThreadPool();
        threadStore = mock(ThreadStorePort.class);
        classifierPort = mock(ClassifierPort.class);

        BotProperties properties = new BotProperties();
        properties.getDebounce().setWindow(Duration.ofMillis(50));
        properties.getDebounce().setBatchLimit(2);
        Clock clock = Clock.systemUTC();
        SystemIdentity identity = new SystemIdentity("golem", List.of(), "system:self");
        KeywordExtractor keywordExtractor = new KeywordExtractor(identity);
        tracker = new ConversationTracker(threadStore, new SignalScorer(keywordExtractor), keywordExtractor,
                new ContextFormatter(clock, identity), identity, clock, properties);

        MessageClassificationService classification = new MessageClassificationService(
                classifierPort, new RelevanceClassifier(identity), tracker, identity,
                new MuteRegistry(clock, properties), properties);
        BatchPipeline pipeline = new BatchPipeline(tracker, classification,
                request -> CompletableFuture.completedFuture(Optional.of("try functools.wraps")),
                reply -> {
                    sent.add(reply);
                    return CompletableFuture.completedFuture(null);
                },
                new InMemoryFocusAdapter(), new ReplyTargetResolver(), identity, clock, properties);
        QueueProcessor queue = new QueueProcessor(workers, pipeline, properties);
        DebounceBuffer debounce = new DebounceBuffer(debounceScheduler, queue, properties);
        intake = new MessageIntakeService(debounce, queue, tracker, new TokenBucketRateLimiter(properties), clock);
    }

    @AfterEach
    void tearDown() {
        debounceScheduler.shutdownNow();
        workers.shutdownNow();
    }

    @Test
    void questionAndAnswerShouldFormThreadAndRecordReply() {
        InboundMessage question = inbound("m1", "alice", "golem can you help with python decorators", null);
        InboundMessage followUp = inbound("m2", "bob", "sure what about python decorators", null);
        followUp.setReplyToMessageId("m1");

        assertTrue(intake.submit(question));
        assertTrue(intake.submit(followUp));

        verify(threadStore, timeout(2000)).save(any());

        assertEquals(1, sent.size());
        assertEquals("try functools.wraps", sent.get(0).getContent());
        assertEquals("m2", sent.get(0).getReplyToMessageId());

        List<ConversationThread> threads = tracker.threadsOf(KEY);
        assertEquals(1, threads.size());
        ConversationThread thread = threads.get(0);
        assertEquals(List.of("m1", "m2", ""), thread.getMessages().stream().map(ThreadMessage::getMessageId)
                .toList());
        assertTrue(thread.getMessages().get(2).isFromSystem());
        assertTrue(thread.isSystemResponded());
        assertEquals(3, thread.getLastShownIndex());
        assertTrue(tracker.pendingOf(KEY).isEmpty());
        assertTrue(tracker.respondThreadIds(KEY).isEmpty());
    }

    @Test
    void chatterShouldBeTrackedWithoutReply() throws InterruptedException {
        intake.submit(inbound("m1", "alice", "anyone watching the match", null));

        verify(threadStore, timeout(2000)).save(any());
        TimeUnit.MILLISECONDS.sleep(50);

        assertTrue(sent.isEmpty());
        assertEquals(1, tracker.pendingOf(KEY).size());
    }

    @Test
    void hardResetShouldDiscardBatchStuckInClassifier() throws InterruptedException {
        CountDownLatch classifying = new CountDownLatch(1);
        when(classifierPort.isAvailable()).thenReturn(true);
        when(classifierPort.classify(any())).thenAnswer(invocation -> {
            classifying.countDown();
            return new CompletableFuture<>();
        });

        intake.submit(inbound("m1", "alice", "anyone watching the match tonight", null));
        assertTrue(classifying.await(2, TimeUnit.SECONDS));

        HardResetResult result = intake.hardReset();
        TimeUnit.MILLISECONDS.sleep(200);

        assertEquals(1, result.getCancelledWorkers());
        assertEquals(0, tracker.stats().getTotalThreads());
        assertEquals(0, tracker.stats().getPendingMessages());
        assertTrue(tracker.pendingOf(KEY).isEmpty());
        assertTrue(sent.isEmpty());
    }
}
