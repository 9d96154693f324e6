package me.golemcore.pipeline.domain.service;

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
import me.golemcore.pipeline.domain.model.ExecutionOutcome;
import me.golemcore.pipeline.domain.model.OutputLevel;
import me.golemcore.pipeline.domain.model.ToolExecutionResult;
import me.golemcore.pipeline.domain.model.ToolFailureKind;
import me.golemcore.pipeline.domain.model.ToolTimeoutException;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs tool functions on an isolated worker pool under a wall-clock deadline.
 *
 * <p>
 * Cancellation is cooperative only: when the deadline passes the caller gets a
 * timeout and the worker is left running, never interrupted. Whatever the
 * worker eventually produces is logged and discarded.
 */
@Service
@Slf4j
public class ToolTimeoutIsolator {

    private static final String LOG_PREFIX = "[Timeout]";
    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;

    private final ExecutorService workers;
    private final Clock clock;

    @Autowired
    public ToolTimeoutIsolator(PipelineProperties properties, Clock clock) {
        this(properties.getTimeout().getThreadNamePrefix(), clock);
    }

    public ToolTimeoutIsolator(String threadNamePrefix, Clock clock) {
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, threadNamePrefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.clock = clock;
    }

    /**
     * Executes {@code fn} and reports how it ended. Never throws for tool
     * failures or timeouts.
     */
    public <T> ExecutionOutcome<T> run(Callable<T> fn, long timeoutMs) {
        long startNanos = System.nanoTime();
        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            try {
                return fn.call();
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, workers);

        try {
            T value = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return new ExecutionOutcome.Completed<>(value, elapsedMillis(startNanos));
        } catch (TimeoutException e) {
            future.whenComplete((late, error) -> log.debug("{} Discarding late completion after {}ms deadline: {}",
                    LOG_PREFIX, timeoutMs, error != null ? unwrap(error).getClass().getSimpleName() : "value"));
            log.warn("{} Execution exceeded {}ms", LOG_PREFIX, timeoutMs);
            return new ExecutionOutcome.TimedOut<>(timeoutMs, elapsedMillis(startNanos));
        } catch (ExecutionException e) {
            return new ExecutionOutcome.Failed<>(unwrap(e), elapsedMillis(startNanos));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new ExecutionOutcome.Failed<>(e, elapsedMillis(startNanos));
        }
    }

    /**
     * Executes {@code fn} and returns its value.
     *
     * @throws ToolTimeoutException
     *             when the deadline passes first
     * @throws Exception
     *             whatever {@code fn} threw
     */
    public <T> T executeWithTimeout(Callable<T> fn, String toolCallId, long timeoutMs) throws Exception {
        ExecutionOutcome<T> outcome = run(fn, timeoutMs);
        if (outcome instanceof ExecutionOutcome.Completed<T> completed) {
            return completed.value();
        }
        if (outcome instanceof ExecutionOutcome.TimedOut<T>) {
            throw new ToolTimeoutException(toolCallId, timeoutMs);
        }
        Throwable error = ((ExecutionOutcome.Failed<T>) outcome).error();
        if (error instanceof Exception exception) {
            throw exception;
        }
        throw (Error) error;
    }

    /**
     * Executes {@code fn} and wraps the outcome in a result with a short
     * observation. Never throws.
     */
    public ToolExecutionResult safeExecute(Callable<?> fn, String toolCallId, long timeoutMs, String toolName) {
        ExecutionOutcome<?> outcome = run(fn, timeoutMs);
        long now = clock.millis();
        ToolExecutionResult result;
        if (outcome instanceof ExecutionOutcome.Completed<?> completed) {
            result = ToolExecutionResult.success(toolCallId, toolName, formatResult(completed.value()),
                    OutputLevel.BRIEF, now);
        } else if (outcome instanceof ExecutionOutcome.TimedOut<?>) {
            result = ToolExecutionResult.timeout(toolCallId, toolName, timeoutMs, now);
        } else {
            Throwable error = ((ExecutionOutcome.Failed<?>) outcome).error();
            result = ToolExecutionResult.error(toolCallId, toolName, ToolFailureKind.EXECUTION_FAILED,
                    error.getClass().getSimpleName(), null, messageOf(error), now);
        }
        return result.withDuration(outcome.durationMs());
    }

    static String formatResult(Object result) {
        if (result == null) {
            return "Success (no output)";
        }
        if (result instanceof String text) {
            return text;
        }
        if (result instanceof Map<?, ?> map) {
            return "Success: " + map.size() + " fields returned";
        }
        if (result instanceof Collection<?> collection) {
            return "Success: " + collection.size() + " items returned";
        }
        return "Success: " + result.getClass().getSimpleName();
    }

    static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.debug("{} Worker pool did not terminate in time", LOG_PREFIX);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
