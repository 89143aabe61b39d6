package me.golemcore.threads.domain.conversation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeywordExtractorTest {

    private final KeywordExtractor extractor = new KeywordExtractor(
            new SystemIdentity("golem", List.of("Golemy"), "system:self"));

    @Test
    void shouldDropStopwordsAndShortWords() {
        assertEquals(List.of("someone", "help", "python", "decorators"),
                extractor.extract("Can someone help with python decorators?"));
    }

    @Test
    void shouldRankByFrequencyKeepingFirstOccurrenceOnTies() {
        assertEquals(List.of("rust", "python", "java"),
                extractor.extract("python java rust rust python rust"));
    }

    @Test
    void shouldIgnoreSystemNameAndAliases() {
        assertEquals(List.of("weather"), extractor.extract("golem golemy weather"));
    }

    @Test
    void shouldIgnoreChatSlang() {
        assertTrue(extractor.extract("lol bruh ngl that is sus haha").isEmpty());
    }

    @Test
    void shouldLimitKeywordCount() {
        List<String> keywords = extractor.extract("alpha bravo charlie delta echo foxtrot golf", 3);

        assertEquals(List.of("alpha", "bravo", "charlie"), keywords);
        assertEquals(KeywordExtractor.DEFAULT_MAX_KEYWORDS,
                extractor.extract("alpha bravo charlie delta echo foxtrot golf").size());
    }

    @Test
    void shouldHandleEmptyInput() {
        assertTrue(extractor.extract(null).isEmpty());
        assertTrue(extractor.extract("").isEmpty());
        assertTrue(extractor.extract("12 34 !!").isEmpty());
        assertTrue(extractor.extract("python", 0).isEmpty());
    }
}
