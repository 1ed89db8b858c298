package com.phillippitts.mediatoolbox.presentation.dto;

import com.phillippitts.mediatoolbox.domain.TerminalOutcome;
import com.phillippitts.mediatoolbox.domain.ToolKind;

import java.util.Map;

/**
 * Wire shape of the terminal event: its SSE event name and payload.
 *
 * <pre>
 * complete   {"outputPath": "..."}
 * cancelled  {}
 * error      {"message": "Downloader exited with code 1: ..."}
 * </pre>
 */
public record TerminalView(String eventName, Map<String, Object> payload) {

    public static final String COMPLETE = "complete";
    public static final String CANCELLED = "cancelled";
    public static final String ERROR = "error";

    public static TerminalView from(TerminalOutcome outcome, ToolKind tool) {
        if (outcome instanceof TerminalOutcome.Succeeded s) {
            String path = s.outputPath() == null ? "" : s.outputPath().toString();
            return new TerminalView(COMPLETE, Map.of("outputPath", path));
        }
        if (outcome instanceof TerminalOutcome.Failed f) {
            return new TerminalView(ERROR, Map.of("message", f.describe(tool)));
        }
        return new TerminalView(CANCELLED, Map.of());
    }
}
