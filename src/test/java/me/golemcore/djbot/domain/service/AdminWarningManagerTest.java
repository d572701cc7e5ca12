package me.golemcore.djbot.domain.service;

import me.golemcore.djbot.domain.service.AdminWarningManager.WarningType;
import me.golemcore.djbot.port.outbound.ChatFrontendPort;
import me.golemcore.djbot.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class AdminWarningManagerTest {

    private static final WarningType TYPE = WarningType.PLAYBACK_SETTINGS;

    private ChatFrontendPort frontend;
    private MutableClock clock;
    private AdminWarningManager manager;

    @BeforeEach
    void setUp() {
        frontend = mock(ChatFrontendPort.class);
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        manager = new AdminWarningManager(frontend, Duration.ofMinutes(30), clock);
        when(frontend.sendDirectMessage("1", "warn")).thenReturn("m1");
        when(frontend.sendDirectMessage("2", "warn")).thenReturn("m2");
    }

    // ===== Cooldown =====

    @Test
    void shouldAllowFirstWarning() {
        assertTrue(manager.shouldSendWarning(TYPE));
    }

    @Test
    void shouldSuppressWarningWithinCooldown() {
        manager.sendWarning(TYPE, List.of("1"), "warn");

        clock.advance(Duration.ofMinutes(29));
        assertFalse(manager.shouldSendWarning(TYPE));

        clock.advance(Duration.ofMinutes(1));
        assertTrue(manager.shouldSendWarning(TYPE));
    }

    @Test
    void shouldKeepCooldownAfterClear() {
        manager.sendWarning(TYPE, List.of("1"), "warn");

        manager.clearWarning(TYPE);

        assertFalse(manager.shouldSendWarning(TYPE));
    }

    // ===== Sending =====

    @Test
    void shouldSendToEveryAdminAndCountDeliveries() {
        when(frontend.sendDirectMessage("3", "warn")).thenThrow(new IllegalStateException("blocked"));

        int delivered = manager.sendWarning(TYPE, List.of("1", "2", "3"), "warn");

        assertEquals(2, delivered);
        assertTrue(manager.isWarningActive(TYPE));
    }

    @Test
    void shouldReplacePreviousWarningMessages() {
        manager.sendWarning(TYPE, List.of("1"), "warn");
        clock.advance(Duration.ofHours(1));

        manager.sendWarning(TYPE, List.of("1"), "warn");

        verify(frontend).deleteMessage("1", "m1");
        verify(frontend, times(2)).sendDirectMessage("1", "warn");
    }

    @Test
    void shouldNotBeActiveWhenNothingDelivered() {
        when(frontend.sendDirectMessage(anyString(), anyString())).thenThrow(new IllegalStateException("down"));

        assertEquals(0, manager.sendWarning(TYPE, List.of("1"), "warn"));
        assertFalse(manager.isWarningActive(TYPE));
    }

    // ===== Clearing =====

    @Test
    void shouldDeleteMessagesOnClear() {
        manager.sendWarning(TYPE, List.of("1", "2"), "warn");

        manager.clearWarning(TYPE);

        verify(frontend).deleteMessage("1", "m1");
        verify(frontend).deleteMessage("2", "m2");
        assertFalse(manager.isWarningActive(TYPE));
    }

    @Test
    void shouldIgnoreClearWithoutWarning() {
        manager.clearWarning(TYPE);

        verify(frontend, never()).deleteMessage(anyString(), anyString());
    }

    @Test
    void shouldContinueClearingWhenDeleteFails() {
        manager.sendWarning(TYPE, List.of("1", "2"), "warn");
        doThrow(new IllegalStateException("gone")).when(frontend).deleteMessage("1", "m1");

        manager.clearWarning(TYPE);

        verify(frontend).deleteMessage("2", "m2");
    }
}
