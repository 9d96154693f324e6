package me.golemcore.pipeline.domain.component;

import java.util.Map;

/**
 * Bare tool body: takes the invocation parameters and returns raw output (a
 * map, a list, a string, a scalar or null). Any exception it throws becomes an
 * error result.
 */
@FunctionalInterface
public interface ToolFunction {

    Object apply(Map<String, Object> parameters) throws Exception;
}
