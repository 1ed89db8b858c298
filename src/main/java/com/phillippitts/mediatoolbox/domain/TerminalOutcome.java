package com.phillippitts.mediatoolbox.domain;

import java.nio.file.Path;

/**
 * The single final classification of a job. Exactly one is produced per job.
 */
public sealed interface TerminalOutcome
        permits TerminalOutcome.Succeeded, TerminalOutcome.Cancelled, TerminalOutcome.Failed {

    /**
     * Lower-case label used for metrics tags and boundary event names.
     */
    String label();

    /**
     * The tool exited successfully and no cancellation was pending.
     *
     * @param outputPath resolved path of the produced file (may not exist if nothing could be resolved)
     */
    record Succeeded(Path outputPath) implements TerminalOutcome {
        @Override
        public String label() {
            return "succeeded";
        }
    }

    /**
     * A cancellation was pending when the process exited. Not an error.
     */
    record Cancelled() implements TerminalOutcome {
        @Override
        public String label() {
            return "cancelled";
        }
    }

    /**
     * The tool exited unsuccessfully, or waiting on it failed.
     *
     * @param exitCode process exit code, {@code -1} when no exit code could be obtained
     * @param diagnosticText trimmed captured stderr (may be empty)
     */
    record Failed(int exitCode, String diagnosticText) implements TerminalOutcome {

        public Failed {
            diagnosticText = diagnosticText == null ? "" : diagnosticText.trim();
        }

        @Override
        public String label() {
            return "failed";
        }

        /**
         * Message shown to the caller, e.g. {@code Downloader exited with code 1: ERROR: ...}.
         */
        public String describe(ToolKind tool) {
            String base = tool.displayName() + " exited with code " + exitCode;
            return diagnosticText.isEmpty() ? base : base + ": " + diagnosticText;
        }
    }
}
