package me.golemcore.djbot.domain.approval;

import me.golemcore.djbot.domain.model.AdminApprovalRequest;
import me.golemcore.djbot.domain.model.ApprovalCallbackEvent;
import me.golemcore.djbot.domain.model.ApprovalKind;
import me.golemcore.djbot.domain.model.ChatMessage;
import me.golemcore.djbot.domain.model.PromptButton;
import me.golemcore.djbot.infrastructure.config.BotProperties;
import me.golemcore.djbot.port.outbound.AdminApprovalCapablePort;
import me.golemcore.djbot.port.outbound.ChatFrontendException;
import me.golemcore.djbot.port.outbound.ChatFrontendPort;
import me.golemcore.djbot.testsupport.TestMessages;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class AdminApprovalServiceTest {

    private static final String CHAT_ID = "-100";

    private ChatFrontendPort frontend;
    private BotProperties properties;
    private ApprovalCleanupExecutor cleanupExecutor;
    private AdminApprovalService service;
    private AdminApprovalRequest request;

    @BeforeEach
    void setUp() {
        frontend = mock(ChatFrontendPort.class, withSettings().extraInterfaces(AdminApprovalCapablePort.class));
        AdminApprovalCapablePort capable = (AdminApprovalCapablePort) frontend;
        when(capable.isAdminApprovalEnabled()).thenReturn(true);
        when(capable.sendDirectPrompt(anyString(), anyString(), anyList()))
                .thenAnswer(inv -> "dm-" + inv.getArgument(0));
        when(frontend.getAdminUserIds(CHAT_ID)).thenReturn(List.of("a1", "a2"));

        properties = new BotProperties();
        properties.getTelegram().setAdminApproval(true);
        cleanupExecutor = new ApprovalCleanupExecutor();
        service = new AdminApprovalService(frontend, properties, TestMessages.keys(),
                Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC), cleanupExecutor);

        ChatMessage origin = ChatMessage.builder()
                .id("7").chatId(CHAT_ID).senderId("42").senderName("@alice").text("x").group(true)
                .build();
        request = new AdminApprovalRequest(origin, "AC/DC - Hells Bells", "https://open.spotify.com/track/x",
                "hard rock");
    }

    @AfterEach
    void tearDown() {
        cleanupExecutor.shutdown();
    }

    // ===== Availability =====

    @Test
    void shouldBeAvailableWhenEnabledAndCapable() {
        assertTrue(service.isAvailable());

        properties.getTelegram().setAdminApproval(false);
        assertFalse(service.isAvailable());
    }

    @Test
    void shouldBeUnavailableForPlainFrontend() {
        AdminApprovalService plain = new AdminApprovalService(mock(ChatFrontendPort.class), properties,
                TestMessages.keys(), Clock.systemUTC(), cleanupExecutor);

        assertFalse(plain.isAvailable());
        assertThrows(ExecutionException.class, () -> plain.requestApproval(request, 5).get());
    }

    // ===== Decisions =====

    @Test
    void shouldApproveOnFirstAdminAnswerAndCleanUpPrompts() throws Exception {
        CompletableFuture<Boolean> decision = service.requestApproval(request, 30);
        String key = promptKey();

        service.onApprovalCallback(callback(key, true, "a2"));
        service.onApprovalCallback(callback(key, false, "a1"));

        assertTrue(decision.get(1, TimeUnit.SECONDS));
        verify(frontend, timeout(1000)).deleteMessage("a1", "dm-a1");
        verify(frontend, timeout(1000)).deleteMessage("a2", "dm-a2");
        verify(frontend).answerCallback("cb-a2", "callback.approved");
        verify(frontend).answerCallback("cb-a1", "callback.expired");
        assertEquals(0, service.pendingCount());
    }

    @Test
    void shouldDenyWhenAdminDenies() throws Exception {
        CompletableFuture<Boolean> decision = service.requestApproval(request, 30);

        service.onApprovalCallback(callback(promptKey(), false, "a1"));

        assertFalse(decision.get(1, TimeUnit.SECONDS));
        verify(frontend).answerCallback("cb-a1", "callback.denied");
    }

    @Test
    void shouldRejectAnswersFromNonRecipients() {
        CompletableFuture<Boolean> decision = service.requestApproval(request, 30);

        service.onApprovalCallback(callback(promptKey(), true, "intruder"));

        assertFalse(decision.isDone());
        verify(frontend).answerCallback("cb-intruder", "callback.unauthorized");
    }

    @Test
    void shouldDenyOnTimeout() throws Exception {
        CompletableFuture<Boolean> decision = service.requestApproval(request, 1);

        assertFalse(decision.get(3, TimeUnit.SECONDS));
        assertEquals(0, service.pendingCount());
    }

    @Test
    void shouldDenyWhenCancelled() throws Exception {
        CompletableFuture<Boolean> decision = service.requestApproval(request, 30);

        service.cancel(CHAT_ID, "7");

        assertFalse(decision.get(1, TimeUnit.SECONDS));
        verify(frontend, timeout(1000)).deleteMessage("a1", "dm-a1");
    }

    @Test
    void shouldNotCancelOtherRequests() {
        CompletableFuture<Boolean> decision = service.requestApproval(request, 30);

        service.cancel(CHAT_ID, "8");

        assertFalse(decision.isDone());
    }

    // ===== Delivery =====

    @Test
    void shouldAutoApproveWhenChatHasNoAdmins() throws Exception {
        when(frontend.getAdminUserIds(CHAT_ID)).thenReturn(List.of());

        assertTrue(service.requestApproval(request, 30).get());
        verify((AdminApprovalCapablePort) frontend, never()).sendDirectPrompt(anyString(), anyString(), anyList());
    }

    @Test
    void shouldSucceedWhenSomeDeliveriesFail() {
        when(((AdminApprovalCapablePort) frontend).sendDirectPrompt(eq("a1"), anyString(), anyList()))
                .thenThrow(new ChatFrontendException("blocked"));

        CompletableFuture<Boolean> decision = service.requestApproval(request, 30);

        assertFalse(decision.isDone());
        assertEquals(1, service.pendingCount());
    }

    @Test
    void shouldFailWhenNoAdminCanBeReached() {
        when(((AdminApprovalCapablePort) frontend).sendDirectPrompt(anyString(), anyString(), anyList()))
                .thenThrow(new ChatFrontendException("blocked"));

        CompletableFuture<Boolean> decision = service.requestApproval(request, 30);

        ExecutionException error = assertThrows(ExecutionException.class, decision::get);
        assertInstanceOf(ApprovalException.class, error.getCause());
        assertEquals(0, service.pendingCount());
    }

    @Test
    void shouldFailWhenAdminListUnavailable() {
        when(frontend.getAdminUserIds(CHAT_ID)).thenThrow(new ChatFrontendException("no rights"));

        CompletableFuture<Boolean> decision = service.requestApproval(request, 30);

        assertTrue(decision.isCompletedExceptionally());
    }

    @SuppressWarnings("unchecked")
    private String promptKey() {
        ArgumentCaptor<List<PromptButton>> buttons = ArgumentCaptor.forClass(List.class);
        verify((AdminApprovalCapablePort) frontend, atLeastOnce())
                .sendDirectPrompt(anyString(), anyString(), buttons.capture());
        String data = buttons.getValue().get(0).callbackData();
        return data.substring(data.indexOf(':') + 1, data.lastIndexOf(':'));
    }

    private ApprovalCallbackEvent callback(String key, boolean approved, String responderId) {
        return new ApprovalCallbackEvent(ApprovalKind.ADMIN, key, approved, responderId, "cb-" + responderId,
                responderId, "dm-" + responderId);
    }
}
