package me.golemcore.ngchat.domain.model;

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * Arguments did not match the tool's schema, or the requested edit was
     * invalid.
     */
    VALIDATION_FAILED,

    /**
     * A referenced entity (saved state, layer) does not exist.
     */
    NOT_FOUND,

    /**
     * A viewer state could not be encoded or decoded.
     */
    SERIALIZATION_FAILED,

    /**
     * A pointer URL could not be fetched or did not contain a viewer state.
     */
    POINTER_RESOLUTION_FAILED,

    /**
     * The model asked for a tool that is not registered or is disabled.
     */
    UNKNOWN_TOOL,

    /**
     * Tool execution failed during runtime.
     */
    EXECUTION_FAILED
}
