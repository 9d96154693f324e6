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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live turn contexts keyed by {@code conversationId:sessionId}.
 *
 * <p>
 * Opening a context for a key that is already live replaces it; the previous
 * turn is dropped without being persisted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TurnContextRegistry {

    private static final String DEFAULT_SESSION = "default";

    private final PipelineProperties properties;
    private final MonitoringService monitoringService;
    private final Clock clock;

    private final Map<String, TurnContext> contexts = new ConcurrentHashMap<>();

    public TurnContext open(String conversationId, String sessionId) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversationId cannot be empty");
        }
        String session = sessionId != null && !sessionId.isBlank() ? sessionId : DEFAULT_SESSION;
        TurnContext context = new TurnContext(conversationId, session,
                new ExecutionTracer(conversationId, session, properties.getTracing().isEnabled(), clock),
                new MetricsCollector(conversationId, session, properties.getMetrics().isEnabled(), clock));
        TurnContext previous = contexts.put(context.key(), context);
        if (previous != null) {
            log.warn("[Trace] Replacing unfinished turn for {}", context.key());
        }
        return context;
    }

    public Optional<TurnContext> get(String conversationId, String sessionId) {
        String session = sessionId != null && !sessionId.isBlank() ? sessionId : DEFAULT_SESSION;
        return Optional.ofNullable(contexts.get(TurnContext.keyOf(conversationId, session)));
    }

    /**
     * Removes the context and persists its trace and metrics.
     *
     * @return {@code true} if a trace document was written
     */
    public boolean complete(TurnContext context) {
        contexts.remove(context.key(), context);
        return monitoringService.persistTurn(context);
    }

    public void abandon(TurnContext context) {
        if (contexts.remove(context.key(), context)) {
            log.debug("[Trace] Abandoned turn {}", context.key());
        }
    }

    public int size() {
        return contexts.size();
    }
}
