package me.golemcore.sentinel.domain.service;

import me.golemcore.sentinel.domain.model.ChatMessage;
import me.golemcore.sentinel.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageWindowTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-02-11T10:00:00Z");

    private MutableClock clock;
    private MessageWindow window;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(FIXED_NOW);
        window = new MessageWindow(100, Duration.ofMinutes(10), Duration.ofSeconds(60), clock);
    }

    @Test
    void shouldKeepOnlyMostRecentMessagesInArrivalOrder() {
        List<ChatMessage> batch = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            batch.add(ChatMessage.of("user" + (i % 7), "message " + i, FIXED_NOW.plusMillis(i)));
        }

        window.ingestAll(batch);

        List<ChatMessage> snapshot = window.snapshot();
        assertEquals(100, snapshot.size());
        assertEquals("message 50", snapshot.get(0).content());
        assertEquals("message 149", snapshot.get(99).content());
        for (int i = 1; i < snapshot.size(); i++) {
            assertTrue(snapshot.get(i - 1).timestamp().isBefore(snapshot.get(i).timestamp()));
        }
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class,
                () -> new MessageWindow(0, Duration.ofMinutes(10), Duration.ofSeconds(60), clock));
    }

    @Test
    void shouldIgnoreNullMessages() {
        window.ingest(null);
        window.ingestAll(null);

        assertTrue(window.isEmpty());
        assertEquals(0, window.size());
    }

    @Test
    void shouldCountMessagesPerUserWithinRateWindow() {
        window.ingest(ChatMessage.of("alice", "old", FIXED_NOW.minusSeconds(90)));
        window.ingest(ChatMessage.of("alice", "one", FIXED_NOW.minusSeconds(30)));
        window.ingest(ChatMessage.of("alice", "two", FIXED_NOW.minusSeconds(10)));
        window.ingest(ChatMessage.of("bob", "hello", FIXED_NOW.minusSeconds(5)));
        window.ingest(ChatMessage.of("carol", "stale", FIXED_NOW.minusSeconds(120)));

        Map<String, Integer> rates = window.userRates();

        assertEquals(2, rates.get("alice"));
        assertEquals(1, rates.get("bob"));
        assertFalse(rates.containsKey("carol"));
    }

    @Test
    void shouldPruneUserHistoryBeyondHorizon() {
        window.ingest(ChatMessage.of("alice", "hi", FIXED_NOW));
        assertEquals(1, window.userRates().get("alice"));

        clock.advance(Duration.ofMinutes(11));

        assertTrue(window.userRates().isEmpty());
        assertEquals(1, window.size());
    }

    @Test
    void shouldUseClockWhenMessageHasNoTimestamp() {
        window.ingest(ChatMessage.of("alice", "no time", null));

        assertEquals(1, window.userRates().get("alice"));
    }

    @Test
    void shouldCountAnonymousMessagesUnderUnknownUser() {
        window.ingest(ChatMessage.of(null, "anon", FIXED_NOW));
        window.ingest(ChatMessage.of("  ", "blank", FIXED_NOW));
        window.ingest(ChatMessage.of("alice", "hi", FIXED_NOW));

        Map<String, Integer> rates = window.userRates();

        assertEquals(2, rates.get(MessageWindow.UNKNOWN_USER));
        assertEquals(1, rates.get("alice"));
        assertEquals(3, window.size());
    }

    @Test
    void shouldClearMessagesAndHistories() {
        window.ingest(ChatMessage.of("alice", "hi", FIXED_NOW));

        window.clear();

        assertTrue(window.isEmpty());
        assertTrue(window.userRates().isEmpty());
    }
}
