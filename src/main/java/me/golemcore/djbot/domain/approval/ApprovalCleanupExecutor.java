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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the chat cleanup of resolved approvals (prompt deletion, reaction
 * unwatching) off the thread that resolved them.
 *
 * <p>
 * Approval timeouts fire on the JDK's shared delay thread, so a blocking
 * frontend call there would hold back every other pending deadline.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class ApprovalCleanupExecutor {

    private final ExecutorService executor;

    public ApprovalCleanupExecutor() {
        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "approval-cleanup-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void submit(String description, Runnable cleanup) {
        try {
            executor.execute(() -> {
                try {
                    cleanup.run();
                } catch (RuntimeException e) {
                    log.debug("[Approval] Cleanup of {} failed: {}", description, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("[Approval] Cleanup of {} skipped, executor is shut down", description);
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
