package me.golemcore.pipeline.domain.component;

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

import me.golemcore.pipeline.domain.model.ToolCachePolicy;

import java.util.Map;

/**
 * Executable tool that the agent loop can invoke through the pipeline. Concrete
 * tools (SQL, file readers, web fetchers) live outside this project and plug in
 * by implementing this interface.
 */
public interface ToolComponent {

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    String getToolName();

    /**
     * Version that participates in the idempotency key. Bump it whenever the
     * tool's output for the same parameters changes.
     *
     * @return the tool version
     */
    default String getToolVersion() {
        return "1.0.0";
    }

    /**
     * Cache policy used when the request does not name one. Tools with side
     * effects must return {@link ToolCachePolicy#NO_CACHE}.
     *
     * @return the default cache policy
     */
    default ToolCachePolicy getDefaultCachePolicy() {
        return ToolCachePolicy.presetFor(getToolName());
    }

    /**
     * Executes the tool synchronously. The pipeline runs this on an isolated
     * worker under a deadline.
     *
     * @param parameters
     *            the execution parameters as a map
     * @return raw tool output
     * @throws Exception
     *             any failure of the underlying tool
     */
    Object execute(Map<String, Object> parameters) throws Exception;

    /**
     * Checks whether this tool is currently enabled and available for use.
     *
     * @return true if the tool is enabled, false otherwise
     */
    default boolean isEnabled() {
        return true;
    }
}
