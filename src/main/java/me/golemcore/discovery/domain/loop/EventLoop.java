package me.golemcore.discovery.domain.loop;

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

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * Single-threaded cooperative scheduler shared by the orchestrator and all of
 * its agents.
 *
 * <p>
 * Every callback submitted here runs on the same logical thread, one at a
 * time. Agent state (in-flight tasks, discovery cache, metrics) is only ever
 * mutated from loop callbacks, so no further synchronization is needed. Work
 * that completes elsewhere (a strategy future finishing on an I/O thread) must
 * be re-posted with {@link #execute(Runnable)} before touching agent state.
 *
 * @since 1.0
 */
public interface EventLoop {

    /**
     * Queue a callback for execution on the loop as soon as possible.
     */
    void execute(Runnable task);

    /**
     * Run a callback once after the given delay.
     */
    ScheduledHandle schedule(Runnable task, Duration delay);

    /**
     * Run a callback repeatedly, first after {@code initialDelay} and then
     * every {@code period}.
     */
    ScheduledHandle scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);

    /**
     * Run a callable on the loop and expose its outcome to a caller living on
     * another thread.
     */
    default <T> CompletableFuture<T> submit(Callable<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        execute(() -> {
            try {
                result.complete(task.call());
            } catch (Exception e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }
}
