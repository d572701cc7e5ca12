package me.golemcore.djbot.auto;

import me.golemcore.djbot.domain.service.AdminWarningManager;
import me.golemcore.djbot.domain.service.AdminWarningManager.WarningType;
import me.golemcore.djbot.infrastructure.config.BotProperties;
import me.golemcore.djbot.port.outbound.ChatFrontendException;
import me.golemcore.djbot.port.outbound.ChatFrontendPort;
import me.golemcore.djbot.testsupport.MutableClock;
import me.golemcore.djbot.testsupport.TestMessages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class BotPermissionsMonitorTest {

    private static final String CHAT_ID = "-100";
    private static final String WARNING = "bot.permissions_warning";

    private ChatFrontendPort frontend;
    private MutableClock clock;
    private AdminWarningManager warningManager;
    private BotProperties properties;
    private BotPermissionsMonitor monitor;

    @BeforeEach
    void setUp() {
        frontend = mock(ChatFrontendPort.class);
        clock = MutableClock.startingAt("2026-02-01T20:00:00Z");
        warningManager = new AdminWarningManager(frontend, Duration.ofMinutes(30), clock);
        properties = new BotProperties();
        properties.getTelegram().setGroupId(CHAT_ID);

        when(frontend.getAdminUserIds(CHAT_ID)).thenReturn(List.of("1", "2"));
        when(frontend.sendDirectMessage(anyString(), eq(WARNING))).thenReturn("dm1", "dm2", "dm3", "dm4");

        monitor = new BotPermissionsMonitor(frontend, warningManager, properties, TestMessages.keys());
    }

    // ===== Bot is admin =====

    @Test
    void shouldStayQuietWhenBotIsAdmin() {
        when(frontend.isBotAdmin(CHAT_ID)).thenReturn(true);

        monitor.tick();

        verify(frontend, never()).getAdminUserIds(anyString());
        verify(frontend, never()).sendDirectMessage(anyString(), anyString());
    }

    @Test
    void shouldDeleteWarningOnceRightsAreGranted() {
        when(frontend.isBotAdmin(CHAT_ID)).thenReturn(false, true);

        monitor.tick();
        monitor.tick();

        verify(frontend).deleteMessage("1", "dm1");
        verify(frontend).deleteMessage("2", "dm2");
        assertFalse(warningManager.isWarningActive(WarningType.BOT_PERMISSIONS));
    }

    // ===== Missing rights =====

    @Test
    void shouldWarnEveryAdminOncePerCooldown() {
        when(frontend.isBotAdmin(CHAT_ID)).thenReturn(false);

        monitor.tick();
        clock.advance(Duration.ofMinutes(5));
        monitor.tick();

        verify(frontend).sendDirectMessage("1", WARNING);
        verify(frontend).sendDirectMessage("2", WARNING);
        assertTrue(warningManager.isWarningActive(WarningType.BOT_PERMISSIONS));
    }

    @Test
    void shouldRepeatWarningAfterCooldown() {
        when(frontend.isBotAdmin(CHAT_ID)).thenReturn(false);

        monitor.tick();
        clock.advance(Duration.ofMinutes(31));
        monitor.tick();

        verify(frontend, times(2)).sendDirectMessage("1", WARNING);
        verify(frontend).deleteMessage("1", "dm1");
    }

    @Test
    void shouldKeepPermissionWarningIndependentOfOtherTypes() {
        when(frontend.isBotAdmin(CHAT_ID)).thenReturn(false);
        when(frontend.sendDirectMessage("1", "settings")).thenReturn("s1");
        warningManager.sendWarning(WarningType.PLAYBACK_SETTINGS, List.of("1"), "settings");

        monitor.tick();

        verify(frontend).sendDirectMessage("1", WARNING);
        assertTrue(warningManager.isWarningActive(WarningType.PLAYBACK_SETTINGS));
    }

    @Test
    void shouldSkipWarningWithoutAdmins() {
        when(frontend.isBotAdmin(CHAT_ID)).thenReturn(false);
        when(frontend.getAdminUserIds(CHAT_ID)).thenReturn(List.of());

        monitor.tick();

        verify(frontend, never()).sendDirectMessage(anyString(), anyString());
    }

    // ===== Failures =====

    @Test
    void shouldIgnoreFailedCheck() {
        when(frontend.isBotAdmin(CHAT_ID)).thenThrow(new ChatFrontendException("Telegram client not initialized"));

        assertDoesNotThrow(monitor::tick);

        verify(frontend, never()).getAdminUserIds(anyString());
    }

    @Test
    void shouldDoNothingWithoutGroup() {
        properties.getTelegram().setGroupId("");

        monitor.tick();

        verify(frontend, never()).isBotAdmin(anyString());
    }

    @Test
    void shouldSurviveAdminListFailure() {
        when(frontend.isBotAdmin(CHAT_ID)).thenReturn(false);
        when(frontend.getAdminUserIds(CHAT_ID)).thenThrow(new ChatFrontendException("403"));

        assertDoesNotThrow(monitor::tick);
    }
}
