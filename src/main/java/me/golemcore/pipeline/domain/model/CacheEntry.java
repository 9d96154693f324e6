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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * Slot of the idempotency cache. Owned exclusively by the cache and mutated
 * only under its lock.
 */
@Data
@Builder
@AllArgsConstructor
public class CacheEntry {

    private String key;
    private ToolExecutionResult value;
    private long createdAt;
    /** Epoch millis, 0 means the entry never expires. */
    private long expiresAt;
    private long hitCount;

    public boolean isExpired(long nowMillis) {
        return expiresAt != 0 && nowMillis > expiresAt;
    }

    public long ageMillis(long nowMillis) {
        return nowMillis - createdAt;
    }
}
