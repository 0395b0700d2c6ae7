package me.golemcore.chatflow.domain.service;

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
import me.golemcore.chatflow.domain.model.ChannelRunStatus;
import me.golemcore.chatflow.domain.model.ChatMessage;
import me.golemcore.chatflow.infrastructure.config.ChatflowProperties;
import me.golemcore.chatflow.port.outbound.AgentRunnerPort;
import me.golemcore.chatflow.port.outbound.PresencePort;
import me.golemcore.chatflow.port.outbound.SandboxPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Debounced, single-flight scheduling of agent runs per channel.
 *
 * <p>
 * Each channel owns a {@link ChannelRunner} guarded by its own lock:
 * </p>
 * <ul>
 * <li>{@link #submit} stores the event as the channel's only pending event
 * (latest wins) and arms a debounce timer unless a run is active.</li>
 * <li>When the timer fires and no newer submission arrived, the pending event
 * is taken and a run starts.</li>
 * <li>A run invokes the agent up to {@code max-attempts} times. Cancellation
 * ends it immediately.</li>
 * <li>When a run ends, for any reason, the pending event collected meanwhile
 * is run right away by the same worker, without another debounce wait.</li>
 * </ul>
 */
@Service
@Slf4j
public class ChannelRunScheduler {

    private final AgentRunnerPort agentRunner;
    private final ObjectProvider<SandboxPort> sandboxPortProvider;
    private final ObjectProvider<PresencePort> presencePortProvider;
    private final ChatflowProperties properties;
    private final ExecutorService channelRunExecutor;
    private final ScheduledExecutorService debounceExecutor;
    private final Clock clock;

    private final Map<String, ChannelRunner> runners = new ConcurrentHashMap<>();
    private final AtomicLong stampSequence = new AtomicLong();
    private volatile boolean shuttingDown;

    public ChannelRunScheduler(AgentRunnerPort agentRunner,
            ObjectProvider<SandboxPort> sandboxPortProvider,
            ObjectProvider<PresencePort> presencePortProvider,
            ChatflowProperties properties,
            @Qualifier("channelRunExecutor") ExecutorService channelRunExecutor,
            @Qualifier("debounceExecutor") ScheduledExecutorService debounceExecutor,
            Clock clock) {
        this.agentRunner = agentRunner;
        this.sandboxPortProvider = sandboxPortProvider;
        this.presencePortProvider = presencePortProvider;
        this.properties = properties;
        this.channelRunExecutor = channelRunExecutor;
        this.debounceExecutor = debounceExecutor;
        this.clock = clock;
    }

    public void submit(String channelKey, ChatMessage message) {
        requireChannelKey(channelKey);
        Objects.requireNonNull(message, "message");
        if (shuttingDown) {
            log.debug("[ChannelRunScheduler] shutting down, event ignored: channel={}", channelKey);
            return;
        }
        while (true) {
            ChannelRunner runner = runners.computeIfAbsent(channelKey, ChannelRunner::new);
            if (runner.submit(message)) {
                return;
            }
            // runner was evicted between lookup and lock, retry with a fresh one
        }
    }

    /**
     * Schedule a run that is not tied to a user message.
     */
    public void trigger(String channelKey) {
        submit(channelKey, ChatMessage.empty(channelKey));
    }

    /**
     * Stop the channel's sandbox and cancel its running agent task, waiting for
     * the task to acknowledge. The pending event is kept.
     *
     * @return {@code true} if a task or a sandbox was actually stopped
     */
    public boolean cancel(String channelKey) {
        requireChannelKey(channelKey);
        boolean stopped = stopSandbox(channelKey);

        ChannelRunner runner = runners.get(channelKey);
        if (runner != null && runner.cancel()) {
            stopped = true;
        }
        return stopped;
    }

    public ChannelRunStatus getStatus(String channelKey) {
        ChannelRunner runner = runners.get(channelKey);
        return runner != null ? runner.status() : ChannelRunStatus.idle(channelKey);
    }

    public boolean isRunning(String channelKey) {
        return getStatus(channelKey).running();
    }

    public List<ChannelRunStatus> activeChannels() {
        List<ChannelRunStatus> statuses = new ArrayList<>();
        for (ChannelRunner runner : runners.values()) {
            ChannelRunStatus status = runner.status();
            if (status.isBusy()) {
                statuses.add(status);
            }
        }
        return statuses;
    }

    /**
     * Cancel every active run and drop pending events. Submissions made after
     * this call are ignored.
     */
    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        for (ChannelRunner runner : runners.values()) {
            runner.abandon();
        }
        log.info("[ChannelRunScheduler] Shut down ({} channels tracked)", runners.size());
    }

    private boolean stopSandbox(String channelKey) {
        SandboxPort sandboxPort = sandboxPortProvider.getIfAvailable();
        if (sandboxPort == null) {
            return false;
        }
        try {
            boolean stopped = sandboxPort.stop(channelKey);
            if (stopped) {
                log.info("[ChannelRunScheduler] sandbox stopped: channel={}", channelKey);
            }
            return stopped;
        } catch (Exception e) { // NOSONAR - sandbox stop is best effort
            log.warn("[ChannelRunScheduler] sandbox stop failed: channel={}: {}", channelKey, e.getMessage());
            return false;
        }
    }

    private void setPresence(ChatMessage message, boolean active) {
        if (!properties.getScheduler().isPresenceEnabled() || message == null || !message.hasMessageId()) {
            return;
        }
        PresencePort presencePort = presencePortProvider.getIfAvailable();
        if (presencePort == null) {
            return;
        }
        try {
            presencePort.setActive(message, active);
        } catch (Exception e) { // NOSONAR - presence indicator is best effort
            log.debug("[ChannelRunScheduler] presence update failed: channel={}, active={}: {}",
                    message.getChannelKey(), active, e.getMessage());
        }
    }

    private static void requireChannelKey(String channelKey) {
        if (channelKey == null || channelKey.isBlank()) {
            throw new IllegalArgumentException("channelKey must not be blank");
        }
    }

    private final class ChannelRunner {

        private final String key;
        private final Object lock = new Object();

        private ChatMessage pending;
        private long debounceStamp;
        private ScheduledFuture<?> debounceTimer;
        private Instant lastSubmittedAt;
        private ActiveRun activeRun;
        private boolean retired;

        private ChannelRunner(String key) {
            this.key = key;
        }

        boolean submit(ChatMessage message) {
            synchronized (lock) {
                if (retired) {
                    return false;
                }
                if (shuttingDown) {
                    return true;
                }
                pending = message;
                long stamp = stampSequence.incrementAndGet();
                debounceStamp = stamp;
                lastSubmittedAt = Instant.now(clock);

                if (activeRun != null) {
                    log.debug("[ChannelRunScheduler] run active, event left pending: channel={}", key);
                    return true;
                }

                if (debounceTimer != null) {
                    debounceTimer.cancel(false);
                }
                Duration window = properties.resolveDebounce(key);
                debounceTimer = debounceExecutor.schedule(() -> onDebounceElapsed(stamp),
                        window.toMillis(), TimeUnit.MILLISECONDS);
                return true;
            }
        }

        boolean cancel() {
            ActiveRun run;
            synchronized (lock) {
                clearDebounceLocked();
                run = activeRun;
                if (run != null) {
                    run.requestCancel();
                }
            }

            if (run == null) {
                log.debug("[ChannelRunScheduler] cancel requested while no run active: channel={}", key);
                evictIfIdle();
                return false;
            }

            if (!run.isOwnedBy(Thread.currentThread())) {
                Duration timeout = properties.getScheduler().getCancelAwaitTimeout();
                if (!run.awaitDone(timeout)) {
                    log.warn("[ChannelRunScheduler] run did not stop within {}: channel={}", timeout, key);
                }
            }
            log.info("[ChannelRunScheduler] agent run cancelled: channel={}", key);
            return true;
        }

        ChannelRunStatus status() {
            synchronized (lock) {
                return new ChannelRunStatus(key, activeRun != null, pending != null, debounceTimer != null,
                        lastSubmittedAt);
            }
        }

        void abandon() {
            synchronized (lock) {
                clearDebounceLocked();
                pending = null;
                if (activeRun != null) {
                    activeRun.requestCancel();
                }
            }
        }

        private void onDebounceElapsed(long stamp) {
            synchronized (lock) {
                if (stamp != debounceStamp) {
                    log.debug("[ChannelRunScheduler] stale debounce ignored: channel={}", key);
                    return;
                }
                debounceTimer = null;
                if (activeRun != null || pending == null || shuttingDown) {
                    return;
                }
                startRunLocked(takePendingLocked());
            }
        }

        private void startRunLocked(ChatMessage message) {
            ActiveRun run = new ActiveRun(message);
            activeRun = run;
            try {
                channelRunExecutor.execute(() -> workLoop(run));
            } catch (RejectedExecutionException e) {
                activeRun = null;
                pending = message;
                log.warn("[ChannelRunScheduler] executor rejected run: channel={}", key);
            }
        }

        private void workLoop(ActiveRun first) {
            synchronized (lock) {
                first.bind(Thread.currentThread());
            }
            ActiveRun run = first;
            while (run != null) {
                ActiveRun current = run;
                try {
                    execute(current);
                } catch (Exception e) { // NOSONAR - must not kill executor thread
                    log.error("[ChannelRunScheduler] unexpected run failure: channel={}", key, e);
                } finally {
                    run = completeRun(current);
                }
            }
        }

        private void execute(ActiveRun run) {
            ChatMessage message = run.message;
            log.info("[ChannelRunScheduler] running agent: channel={}", key);
            setPresence(message, true);
            try {
                runWithRetries(run);
            } catch (AgentRunCancelledException e) {
                Thread.interrupted();
                log.info("[ChannelRunScheduler] agent run interrupted: channel={}", key);
            } finally {
                setPresence(message, false);
            }
        }

        private void runWithRetries(ActiveRun run) {
            int maxAttempts = Math.max(1, properties.getScheduler().getMaxAttempts());
            Exception lastFailure = null;
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                if (run.isCancelRequested() || Thread.currentThread().isInterrupted()) {
                    throw new AgentRunCancelledException(key);
                }
                try {
                    agentRunner.run(key, run.message);
                    if (attempt > 1) {
                        log.info("[ChannelRunScheduler] agent run succeeded on attempt {}: channel={}", attempt, key);
                    }
                    return;
                } catch (InterruptedException e) {
                    throw new AgentRunCancelledException(key, e);
                } catch (Exception e) { // NOSONAR - agent failures are retried
                    if (run.isCancelRequested() || Thread.currentThread().isInterrupted()) {
                        throw new AgentRunCancelledException(key, e);
                    }
                    lastFailure = e;
                    log.warn("[ChannelRunScheduler] attempt {}/{} failed: channel={}: {}",
                            attempt, maxAttempts, key, e.getMessage());
                }
            }
            log.error("[ChannelRunScheduler] agent run failed after {} attempts: channel={}",
                    maxAttempts, key, lastFailure);
        }

        private ActiveRun completeRun(ActiveRun finished) {
            ActiveRun next = null;
            synchronized (lock) {
                // drop an interrupt aimed at the finished run
                Thread.interrupted();
                finished.bind(null);
                activeRun = null;

                ChatMessage nextMessage = takePendingLocked();
                if (nextMessage != null && shuttingDown) {
                    log.debug("[ChannelRunScheduler] shutting down, pending event dropped: channel={}", key);
                } else if (nextMessage != null) {
                    if (finished.isCancelRequested()) {
                        log.info("[ChannelRunScheduler] run cancelled, continuing with pending event: channel={}",
                                key);
                    } else {
                        log.debug("[ChannelRunScheduler] re-chaining pending event: channel={}", key);
                    }
                    next = new ActiveRun(nextMessage);
                    next.bind(Thread.currentThread());
                    activeRun = next;
                }
            }
            finished.markDone();
            if (next == null) {
                evictIfIdle();
            }
            return next;
        }

        private ChatMessage takePendingLocked() {
            ChatMessage message = pending;
            pending = null;
            return message;
        }

        private void clearDebounceLocked() {
            if (debounceTimer != null) {
                debounceTimer.cancel(false);
                debounceTimer = null;
            }
            debounceStamp = 0;
        }

        private void evictIfIdle() {
            synchronized (lock) {
                if (activeRun != null || pending != null || debounceTimer != null) {
                    return;
                }
                retired = true;
            }
            if (runners.remove(key, this)) {
                log.debug("[ChannelRunScheduler] evicted idle channel: {}", key);
            }
        }
    }

    private static final class ActiveRun {

        private final ChatMessage message;
        private final CountDownLatch done = new CountDownLatch(1);
        private volatile boolean cancelRequested;
        private volatile Thread worker;

        private ActiveRun(ChatMessage message) {
            this.message = message;
        }

        // callers hold the channel lock
        void bind(Thread thread) {
            this.worker = thread;
            if (thread != null && cancelRequested) {
                thread.interrupt();
            }
        }

        // callers hold the channel lock
        void requestCancel() {
            cancelRequested = true;
            if (worker != null) {
                worker.interrupt();
            }
        }

        boolean isCancelRequested() {
            return cancelRequested;
        }

        boolean isOwnedBy(Thread thread) {
            return worker == thread;
        }

        void markDone() {
            done.countDown();
        }

        boolean awaitDone(Duration timeout) {
            try {
                return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }
}
