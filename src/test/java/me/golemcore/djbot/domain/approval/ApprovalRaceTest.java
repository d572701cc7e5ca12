package me.golemcore.djbot.domain.approval;

import me.golemcore.djbot.domain.model.ApprovalOutcome;
import me.golemcore.djbot.domain.model.ApprovalSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ApprovalRaceTest {

    private final ApprovalRace race = new ApprovalRace();

    private CompletableFuture<Boolean> admin;
    private CompletableFuture<Boolean> community;
    private AtomicInteger adminCancels;
    private AtomicInteger communityCancels;
    private CompletableFuture<ApprovalOutcome> outcome;

    @BeforeEach
    void setUp() {
        admin = new CompletableFuture<>();
        community = new CompletableFuture<>();
        adminCancels = new AtomicInteger();
        communityCancels = new AtomicInteger();
        outcome = race.race(admin, community, adminCancels::incrementAndGet, communityCancels::incrementAndGet);
    }

    @Test
    void shouldLetCommunityWinAndCancelAdmin() throws Exception {
        community.complete(true);

        ApprovalOutcome result = outcome.get();
        assertTrue(result.approved());
        assertEquals(ApprovalSource.COMMUNITY, result.source());
        assertEquals(1, adminCancels.get());
        assertEquals(0, communityCancels.get());
    }

    @Test
    void shouldLetAdminApprovalWinAndCancelCommunity() throws Exception {
        admin.complete(true);

        assertEquals(ApprovalOutcome.admin(true), outcome.get());
        assertEquals(1, communityCancels.get());
        assertEquals(0, adminCancels.get());
    }

    @Test
    void shouldLetAdminDenialWinAndCancelCommunity() throws Exception {
        admin.complete(false);

        assertEquals(ApprovalOutcome.admin(false), outcome.get());
        assertEquals(1, communityCancels.get());
    }

    @Test
    void shouldKeepWaitingForAdminWhenCommunityFallsShort() throws Exception {
        community.complete(false);
        assertFalse(outcome.isDone());

        admin.complete(true);
        assertEquals(ApprovalSource.ADMIN, outcome.get().source());
    }

    @Test
    void shouldIgnoreLateResultFromLoser() throws Exception {
        community.complete(true);
        admin.complete(false);

        assertEquals(ApprovalSource.COMMUNITY, outcome.get().source());
        assertTrue(outcome.get().approved());
    }

    @Test
    void shouldFailAndCancelBothWhenAdminErrors() {
        admin.completeExceptionally(new ApprovalException("boom"));

        ExecutionException error = assertThrows(ExecutionException.class, outcome::get);
        assertInstanceOf(ApprovalException.class, error.getCause());
        assertEquals(1, adminCancels.get());
        assertEquals(1, communityCancels.get());
    }
}
