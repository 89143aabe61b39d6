package me.golemcore.threads.domain.conversation;

import me.golemcore.threads.domain.model.ClassificationResult;
import me.golemcore.threads.domain.model.InboundMessage;
import me.golemcore.threads.domain.model.MessageClassification;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static me.golemcore.threads.testsupport.TestMessages.inbound;
import static org.junit.jupiter.api.Assertions.*;

class RelevanceClassifierTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");
    private static final double EPSILON = 1e-6;

    private final RelevanceClassifier classifier = new RelevanceClassifier(
            new SystemIdentity("golem", List.of("gol"), "system:self"));

    // ===== Without conversation state =====

    @Test
    void shouldRespondWhenNamedWithoutState() {
        ClassificationResult result = classifier.classify(inbound("m1", "alice", "Golem, what's up", T0),
                Optional.empty());

        assertEquals(MessageClassification.RESPOND, result.getClassification());
        assertEquals(1.0, result.getConfidence(), EPSILON);
        assertTrue(result.isFallbackUsed());
    }

    @Test
    void shouldRespondToReplyWithoutState() {
        InboundMessage message = inbound("m1", "alice", "and then?", T0);
        message.setReplyToSystem(true);

        assertEquals(MessageClassification.RESPOND,
                classifier.classify(message, Optional.empty()).getClassification());
    }

    @Test
    void shouldKeepUnaddressedMessageAsContextWithoutState() {
        ClassificationResult result = classifier.classify(inbound("m1", "alice", "golemcore is a library", T0),
                Optional.empty());

        assertEquals(MessageClassification.CONTEXT, result.getClassification());
        assertEquals(0.5, result.getConfidence(), EPSILON);
    }

    // ===== With conversation state =====

    @Test
    void shouldDropChatterWithNoSignals() {
        ClassificationResult result = classifier.classify(inbound("m1", "alice", "random chatter", T0),
                Optional.of(RelevanceSignals.NONE));

        assertEquals(MessageClassification.DROP, result.getClassification());
        assertEquals(0.15, result.getConfidence(), EPSILON);
        assertTrue(result.isFallbackUsed());
    }

    @Test
    void shouldRespondToAtMention() {
        InboundMessage message = inbound("m1", "alice", "hey", T0);
        message.setAtMention(true);

        ClassificationResult result = classifier.classify(message, Optional.of(RelevanceSignals.NONE));

        assertEquals(MessageClassification.RESPOND, result.getClassification());
        assertTrue(result.getConfidence() > 0.98);
        assertEquals("math(0.99): mention=1.0", result.getReason());
    }

    @Test
    void shouldKeepSystemThreadMessageAsContext() {
        RelevanceSignals signals = new RelevanceSignals(Double.POSITIVE_INFINITY, 0.0, true, false);

        ClassificationResult result = classifier.classify(inbound("m1", "alice", "ok", T0),
                Optional.of(signals));

        assertEquals(MessageClassification.CONTEXT, result.getClassification());
        assertEquals(RelevanceClassifier.sigmoid(RelevanceClassifier.PRIOR_LOG_ODDS + 2.0),
                result.getConfidence(), EPSILON);
    }

    @Test
    void shouldRespondRightAfterSystemSpoke() {
        RelevanceSignals signals = new RelevanceSignals(0.0, 0.0, false, true);

        ClassificationResult result = classifier.classify(inbound("m1", "alice", "and the second part?", T0),
                Optional.of(signals));

        assertEquals(MessageClassification.RESPOND, result.getClassification());
    }

    @Test
    void adjacencyShouldOnlyApplyWithinWindowWhenSystemSpokeLast() {
        InboundMessage message = inbound("m1", "alice", "ok", T0);

        Map<String, Double> notLast = classifier.features(message, new RelevanceSignals(5.0, 0.0, false, false));
        Map<String, Double> tooLate = classifier.features(message, new RelevanceSignals(90.0, 0.0, false, true));
        Map<String, Double> adjacent = classifier.features(message, new RelevanceSignals(30.0, 0.0, false, true));

        assertEquals(0.0, notLast.get("adjacency"), EPSILON);
        assertEquals(0.0, tooLate.get("adjacency"), EPSILON);
        assertEquals(Math.exp(-1.0), adjacent.get("adjacency"), EPSILON);
    }

    @Test
    void recencyShouldHalveEveryTwoMinutes() {
        InboundMessage message = inbound("m1", "alice", "ok", T0);

        assertEquals(1.0, classifier.features(message, new RelevanceSignals(0.0, 0.0, false, false))
                .get("recency"), EPSILON);
        assertEquals(0.5, classifier.features(message, new RelevanceSignals(120.0, 0.0, false, false))
                .get("recency"), EPSILON);
        assertEquals(0.0, classifier.features(message, RelevanceSignals.NONE).get("recency"), EPSILON);
    }

    @Test
    void questionFeatureShouldDistinguishMarkAndQuestionWord() {
        assertEquals(1.0, classifier.features(inbound("m1", "a", "is it done?", T0), RelevanceSignals.NONE)
                .get("question"), EPSILON);
        assertEquals(0.5, classifier.features(inbound("m1", "a", "How is it done", T0), RelevanceSignals.NONE)
                .get("question"), EPSILON);
        assertEquals(0.0, classifier.features(inbound("m1", "a", "it is done", T0), RelevanceSignals.NONE)
                .get("question"), EPSILON);
    }

    @Test
    void authorHistoryShouldBeClamped() {
        Map<String, Double> features = classifier.features(inbound("m1", "a", "ok", T0),
                new RelevanceSignals(Double.POSITIVE_INFINITY, 3.0, false, false));

        assertEquals(1.0, features.get("authorHistory"), EPSILON);
    }

    @Test
    void sigmoidShouldBeStableForLargeInputs() {
        assertEquals(0.5, RelevanceClassifier.sigmoid(0.0), EPSILON);
        assertEquals(1.0, RelevanceClassifier.sigmoid(800.0), EPSILON);
        assertEquals(0.0, RelevanceClassifier.sigmoid(-800.0), EPSILON);
    }
}
