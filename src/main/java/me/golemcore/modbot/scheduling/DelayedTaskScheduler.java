package me.golemcore.modbot.scheduling;

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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Delayed single-fire tasks keyed by id.
 *
 * <p>
 * Guarantees:
 * <ul>
 * <li>Scheduling an id that is already pending replaces the old task.</li>
 * <li>Cancelling an unknown, fired or cancelled id is a no-op.</li>
 * <li>A task runs at most once; only the instance currently registered under
 * its id may run.</li>
 * <li>Exceptions thrown by a task are logged and never reach the executor, so
 * later tasks keep firing.</li>
 * </ul>
 *
 * <p>
 * State is in memory only. Owners that need durability (infraction expiry)
 * re-arm their tasks from persistent storage on startup.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class DelayedTaskScheduler {

    private final Clock clock;
    private final ScheduledExecutorService executor;
    private final Map<String, ScheduledTask> tasks = new ConcurrentHashMap<>();

    public DelayedTaskScheduler(Clock clock, ScheduledExecutorService executor) {
        this.clock = clock;
        this.executor = executor;
    }

    /**
     * Arm {@code action} to run at {@code fireAt}. A time in the past fires as
     * soon as possible.
     */
    public void schedule(String taskId, Instant fireAt, Runnable action) {
        ScheduledTask task = new ScheduledTask(taskId, fireAt, action);
        ScheduledTask previous = tasks.put(taskId, task);
        if (previous != null) {
            previous.cancelFuture();
            log.debug("[Scheduler] Replaced pending task {}", taskId);
        }

        long delayMillis = Math.max(0, Duration.between(clock.instant(), fireAt).toMillis());
        try {
            task.future = executor.schedule(() -> run(task), delayMillis, TimeUnit.MILLISECONDS);
            log.debug("[Scheduler] Scheduled task {} in {} ms", taskId, delayMillis);
        } catch (RejectedExecutionException e) {
            tasks.remove(taskId, task);
            log.warn("[Scheduler] Executor rejected task {}: {}", taskId, e.getMessage());
        }
    }

    /**
     * Cancel a pending task.
     *
     * @return true when a pending task was removed
     */
    public boolean cancel(String taskId) {
        ScheduledTask task = tasks.remove(taskId);
        if (task == null) {
            log.debug("[Scheduler] Nothing to cancel for {}", taskId);
            return false;
        }
        task.cancelFuture();
        log.debug("[Scheduler] Cancelled task {}", taskId);
        return true;
    }

    public void cancelAll() {
        for (String taskId : tasks.keySet()) {
            cancel(taskId);
        }
    }

    public boolean isScheduled(String taskId) {
        return tasks.containsKey(taskId);
    }

    public Optional<Instant> getFireTime(String taskId) {
        ScheduledTask task = tasks.get(taskId);
        return task != null ? Optional.of(task.fireAt) : Optional.empty();
    }

    public int size() {
        return tasks.size();
    }

    @PreDestroy
    public void shutdown() {
        cancelAll();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Scheduler] Shut down");
    }

    private void run(ScheduledTask task) {
        if (!tasks.remove(task.taskId, task)) {
            return;
        }
        try {
            task.action.run();
        } catch (Exception e) { // NOSONAR - a failing task must not affect other tasks
            log.error("[Scheduler] Task {} failed", task.taskId, e);
        }
    }

    private static final class ScheduledTask {

        private final String taskId;
        private final Instant fireAt;
        private final Runnable action;
        private volatile ScheduledFuture<?> future;

        private ScheduledTask(String taskId, Instant fireAt, Runnable action) {
            this.taskId = taskId;
            this.fireAt = fireAt;
            this.action = action;
        }

        private void cancelFuture() {
            ScheduledFuture<?> current = future;
            if (current != null) {
                current.cancel(false);
            }
        }
    }
}
