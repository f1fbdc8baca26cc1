package me.golemcore.discovery.infrastructure.loop;

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

import me.golemcore.discovery.domain.loop.EventLoop;
import me.golemcore.discovery.domain.loop.ScheduledHandle;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link EventLoop} backed by a single-thread
 * {@link ScheduledExecutorService}.
 *
 * <p>
 * A callback that throws is logged and does not cancel its periodic schedule.
 * Callbacks posted after shutdown are dropped.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class SingleThreadEventLoop implements EventLoop {

    static final String THREAD_NAME = "discovery-event-loop";

    private final ScheduledExecutorService scheduler;

    public SingleThreadEventLoop() {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, THREAD_NAME);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void execute(Runnable task) {
        try {
            scheduler.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            log.debug("[EventLoop] Dropping callback after shutdown");
        }
    }

    @Override
    public ScheduledHandle schedule(Runnable task, Duration delay) {
        try {
            return new FutureHandle(scheduler.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            log.debug("[EventLoop] Not scheduling after shutdown");
            return FutureHandle.CANCELLED;
        }
    }

    @Override
    public ScheduledHandle scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
        try {
            return new FutureHandle(scheduler.scheduleAtFixedRate(guarded(task), initialDelay.toMillis(),
                    period.toMillis(), TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            log.debug("[EventLoop] Not scheduling after shutdown");
            return FutureHandle.CANCELLED;
        }
    }

    public boolean isShutdown() {
        return scheduler.isShutdown();
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[EventLoop] Shut down");
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("[EventLoop] Callback failed: {}", e.getMessage(), e);
            }
        };
    }

    private static final class FutureHandle implements ScheduledHandle {

        private static final FutureHandle CANCELLED = new FutureHandle(null);

        private final ScheduledFuture<?> future;

        private FutureHandle(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public void cancel() {
            if (future != null) {
                future.cancel(false);
            }
        }

        @Override
        public boolean isCancelled() {
            return future == null || future.isCancelled();
        }
    }
}
