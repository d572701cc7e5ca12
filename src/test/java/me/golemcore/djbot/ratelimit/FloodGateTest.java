package me.golemcore.djbot.ratelimit;

import me.golemcore.djbot.domain.model.FloodStats;
import me.golemcore.djbot.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class FloodGateTest {

    private static final String CHAT = "group-1";
    private static final String USER = "user-1";

    private MutableClock clock;
    private FloodGate floodGate;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T12:00:00Z");
        floodGate = new FloodGate(3, Duration.ofMinutes(10), Duration.ofMinutes(10), clock);
    }

    @Test
    void shouldAllowUpToLimitWithinWindow() {
        assertTrue(floodGate.checkMessage(CHAT, USER));
        assertTrue(floodGate.checkMessage(CHAT, USER));
        assertTrue(floodGate.checkMessage(CHAT, USER));

        assertFalse(floodGate.checkMessage(CHAT, USER));
    }

    @Test
    void shouldAllowAgainAfterWindowSlides() {
        for (int i = 0; i < 3; i++) {
            floodGate.checkMessage(CHAT, USER);
            clock.advance(Duration.ofSeconds(10));
        }
        assertFalse(floodGate.checkMessage(CHAT, USER));

        // first message was at t=0, now t=60 plus one second
        clock.advance(Duration.ofSeconds(31));
        assertTrue(floodGate.checkMessage(CHAT, USER));
        assertFalse(floodGate.checkMessage(CHAT, USER));
    }

    @Test
    void shouldNotCountBlockedMessages() {
        for (int i = 0; i < 3; i++) {
            floodGate.checkMessage(CHAT, USER);
        }
        for (int i = 0; i < 10; i++) {
            assertFalse(floodGate.checkMessage(CHAT, USER));
        }

        clock.advance(Duration.ofSeconds(61));
        assertTrue(floodGate.checkMessage(CHAT, USER));
    }

    @Test
    void shouldTrackUsersAndChatsSeparately() {
        for (int i = 0; i < 3; i++) {
            floodGate.checkMessage(CHAT, USER);
        }

        assertTrue(floodGate.checkMessage(CHAT, "user-2"));
        assertTrue(floodGate.checkMessage("group-2", USER));
        assertFalse(floodGate.checkMessage(CHAT, USER));
    }

    @Test
    void shouldDropIdleUsersOnCleanup() {
        floodGate.checkMessage(CHAT, USER);
        clock.advance(Duration.ofMinutes(5));
        floodGate.checkMessage(CHAT, "user-2");
        clock.advance(Duration.ofMinutes(6));

        floodGate.cleanup();

        FloodStats stats = floodGate.getStats();
        assertEquals(1, stats.activeUsers());
        assertEquals(3, stats.limitPerMinute());
        assertEquals(60, stats.windowSeconds());
    }

    @Test
    void shouldStopIdempotently() {
        floodGate.init();
        floodGate.stop();
        floodGate.stop();

        assertTrue(floodGate.checkMessage(CHAT, USER));
    }
}
