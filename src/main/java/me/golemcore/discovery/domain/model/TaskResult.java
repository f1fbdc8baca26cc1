package me.golemcore.discovery.domain.model;

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

import java.util.List;

/**
 * Outcome of one task execution.
 *
 * @param success
 *            whether the task ran to completion
 * @param finding
 *            what was found, {@code null} when the task found nothing
 * @param error
 *            failure reason for unsuccessful tasks
 * @param followUpTasks
 *            self-spawned work, admitted only while the agent has capacity
 */
public record TaskResult(boolean success, Finding finding, String error, List<DiscoveryTask> followUpTasks) {

    public TaskResult {
        followUpTasks = followUpTasks != null ? List.copyOf(followUpTasks) : List.of();
    }

    public static TaskResult found(Finding finding) {
        return new TaskResult(true, finding, null, List.of());
    }

    public static TaskResult empty() {
        return new TaskResult(true, null, null, List.of());
    }

    public static TaskResult failed(String error) {
        return new TaskResult(false, null, error, List.of());
    }

    public TaskResult withFollowUps(List<DiscoveryTask> tasks) {
        return new TaskResult(success, finding, error, tasks);
    }
}
