package com.phillippitts.mediatoolbox.exception;

import com.phillippitts.mediatoolbox.domain.ToolKind;

/**
 * Thrown when an external tool cannot be started at all (binary missing, not executable,
 * working directory invalid).
 *
 * <p>Spawn failures are fatal for the request and never retried. Failures of a process that
 * did start are not exceptions; they are reported as
 * {@link com.phillippitts.mediatoolbox.domain.TerminalOutcome.Failed}.
 */
public class SpawnFailureException extends MediaToolboxException {

    private final ToolKind tool;

    public SpawnFailureException(String message, ToolKind tool) {
        super(message + " (tool: " + toolName(tool) + ")");
        this.tool = tool;
    }

    public SpawnFailureException(String message, ToolKind tool, Throwable cause) {
        super(message + " (tool: " + toolName(tool) + ")", cause);
        this.tool = tool;
    }

    public ToolKind getTool() {
        return tool;
    }

    private static String toolName(ToolKind tool) {
        return tool == null ? "unknown" : tool.displayName();
    }
}
