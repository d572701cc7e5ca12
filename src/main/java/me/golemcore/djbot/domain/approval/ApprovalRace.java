package me.golemcore.djbot.domain.approval;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.djbot.domain.model.ApprovalOutcome;
import me.golemcore.djbot.domain.model.ApprovalSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Combines admin and community approval so that whichever gate approves first
 * wins.
 *
 * <ul>
 * <li>admin answers (either way) - that answer decides</li>
 * <li>community approves - approved, admin wait is cancelled</li>
 * <li>community rejects or times out - keep waiting for admin</li>
 * <li>either side fails - the race fails</li>
 * </ul>
 * Once decided, the losing wait is cancelled so its prompts are cleaned up.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class ApprovalRace {

    public CompletableFuture<ApprovalOutcome> race(CompletableFuture<Boolean> admin,
            CompletableFuture<Boolean> community, Runnable cancelAdmin, Runnable cancelCommunity) {
        CompletableFuture<ApprovalOutcome> result = new CompletableFuture<>();

        admin.whenComplete((approved, ex) -> {
            if (ex != null) {
                result.completeExceptionally(ex);
            } else {
                result.complete(ApprovalOutcome.admin(Boolean.TRUE.equals(approved)));
            }
        });
        community.whenComplete((approved, ex) -> {
            if (ex != null) {
                if (!(ex instanceof CancellationException)) {
                    result.completeExceptionally(ex);
                }
            } else if (Boolean.TRUE.equals(approved)) {
                result.complete(ApprovalOutcome.community());
            } else {
                log.debug("[Approval] Community approval not reached, waiting for admin");
            }
        });

        result.whenComplete((outcome, ex) -> {
            if (outcome != null && outcome.source() == ApprovalSource.COMMUNITY) {
                cancelAdmin.run();
            } else {
                cancelCommunity.run();
                if (ex != null) {
                    cancelAdmin.run();
                }
            }
        });
        return result;
    }
}
