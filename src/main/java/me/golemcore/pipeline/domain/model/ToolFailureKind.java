package me.golemcore.pipeline.domain.model;

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * The tool did not finish within its deadline.
     */
    TIMEOUT,

    /**
     * The invocation request was malformed and was rejected before execution.
     */
    VALIDATION,

    /**
     * An artifact reference failed format or sandbox validation.
     */
    SECURITY,

    /**
     * Tool execution failed during runtime (exceptions, serialization errors,
     * etc.).
     */
    EXECUTION_FAILED
}
