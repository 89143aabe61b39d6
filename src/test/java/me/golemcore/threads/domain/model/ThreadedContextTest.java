package me.golemcore.threads.domain.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ThreadedContextTest {

    @Test
    void shouldPickHighestNumberedTagNotLastInserted() {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("#msg10", "m10");
        tags.put("#msg2", "m2");
        tags.put("#msg9", "m9");

        ThreadedContext context = ThreadedContext.builder().content("x").tagMap(tags).build();

        assertEquals("m10", context.highestTaggedMessageId());
    }

    @Test
    void shouldSkipUnmappedAndMalformedTags() {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("#msg1", "m1");
        tags.put("#msg3", "");
        tags.put("#msgX", "mx");

        ThreadedContext context = ThreadedContext.builder().content("x").tagMap(tags).build();

        assertEquals("m1", context.highestTaggedMessageId());
    }

    @Test
    void shouldReturnNullWithoutTags() {
        assertNull(ThreadedContext.builder().content("x").build().highestTaggedMessageId());
    }
}
