package me.golemcore.pipeline.domain.model;

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

/**
 * Outcome of running a function under a deadline. Callers must handle all three
 * cases; nothing is signalled through exceptions.
 *
 * @param <T>
 *            value type produced by the function
 */
public sealed interface ExecutionOutcome<T> {

    long durationMs();

    record Completed<T>(T value, long durationMs) implements ExecutionOutcome<T> {
    }

    record Failed<T>(Throwable error, long durationMs) implements ExecutionOutcome<T> {
    }

    record TimedOut<T>(long timeoutMs, long durationMs) implements ExecutionOutcome<T> {
    }
}
