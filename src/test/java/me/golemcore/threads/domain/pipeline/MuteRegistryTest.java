package me.golemcore.threads.domain.pipeline;

import me.golemcore.threads.infrastructure.config.BotProperties;
import me.golemcore.threads.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MuteRegistryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");
    private static final String ALICE = "discord:alice";

    private MutableClock clock;
    private MuteRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        BotProperties properties = new BotProperties();
        properties.getPipeline().setMuteDuration(Duration.ofMinutes(30));
        registry = new MuteRegistry(clock, properties);
    }

    @Test
    void shouldMuteForConfiguredDuration() {
        Instant until = registry.mute(ALICE);

        assertEquals(T0.plus(Duration.ofMinutes(30)), until);
        assertTrue(registry.isMuted(ALICE));
        assertFalse(registry.isMuted("discord:bob"));
    }

    @Test
    void muteShouldExpireOnLookup() {
        registry.mute(ALICE, Duration.ofMinutes(5));

        clock.advance(Duration.ofMinutes(4));
        assertEquals(Optional.of(T0.plus(Duration.ofMinutes(5))), registry.mutedUntilFor(ALICE));

        clock.advance(Duration.ofMinutes(1));
        assertFalse(registry.isMuted(ALICE));
        assertFalse(registry.unmute(ALICE));
    }

    @Test
    void shouldUnmuteAndClear() {
        registry.mute(ALICE);
        registry.mute("discord:bob");

        assertTrue(registry.unmute(ALICE));
        assertFalse(registry.isMuted(ALICE));

        registry.clear();
        assertFalse(registry.isMuted("discord:bob"));
    }
}
