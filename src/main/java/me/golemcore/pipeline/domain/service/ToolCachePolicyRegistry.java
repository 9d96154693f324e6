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
import me.golemcore.pipeline.domain.component.ToolComponent;
import me.golemcore.pipeline.domain.model.ToolCachePolicy;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import org.springframework.stereotype.Service;

/**
 * Resolves the cache policy for a tool.
 *
 * <p>
 * Lookup order: {@code pipeline.tool-cache-policies.<tool>} override, the
 * tool's own default, then the built-in preset table. Unknown tools are never
 * cached.
 */
@Service
@RequiredArgsConstructor
public class ToolCachePolicyRegistry {

    private final PipelineProperties properties;

    public ToolCachePolicy policyFor(String toolName) {
        ToolCachePolicy override = properties.getToolCachePolicies().get(toolName);
        if (override != null) {
            return override;
        }
        return ToolCachePolicy.presetFor(toolName);
    }

    public ToolCachePolicy policyFor(ToolComponent tool) {
        ToolCachePolicy override = properties.getToolCachePolicies().get(tool.getToolName());
        if (override != null) {
            return override;
        }
        ToolCachePolicy declared = tool.getDefaultCachePolicy();
        return declared != null ? declared : ToolCachePolicy.presetFor(tool.getToolName());
    }
}
