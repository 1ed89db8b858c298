package com.phillippitts.mediatoolbox.domain;

import com.phillippitts.mediatoolbox.exception.InvalidJobRequestException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * A pre-validated start request: the argument vector handed to the tool plus the hints
 * used to locate the produced file afterwards.
 *
 * @param tool which tool to run
 * @param arguments argument vector, excluding the executable itself
 * @param workingDirectory working directory for the process (nullable, inherits when null)
 * @param expectedOutputPath output path known up front, e.g. the transcoder target (nullable)
 * @param outputFolder folder the tool writes into when the final name is only known later (nullable)
 * @param fileNameHint file name stem requested by the caller (nullable)
 * @param expectedExtension extension the caller anticipates, without the dot (nullable)
 * @param knownDuration length of the media the tool will produce when the caller knows it, e.g. a trim
 *                      range; percent is computed against it instead of the input length (nullable)
 */
public record JobRequest(
        ToolKind tool,
        List<String> arguments,
        Path workingDirectory,
        Path expectedOutputPath,
        Path outputFolder,
        String fileNameHint,
        String expectedExtension,
        Duration knownDuration
) {

    public JobRequest {
        if (tool == null) {
            throw new InvalidJobRequestException("tool must be specified");
        }
        if (arguments == null || arguments.isEmpty()) {
            throw new InvalidJobRequestException("argument vector must not be empty");
        }
        if (arguments.stream().anyMatch(a -> a == null)) {
            throw new InvalidJobRequestException("argument vector must not contain null entries");
        }
        if (knownDuration != null && (knownDuration.isNegative() || knownDuration.isZero())) {
            throw new InvalidJobRequestException("known duration must be positive");
        }
        arguments = List.copyOf(arguments);
    }

    public static Builder builder(ToolKind tool, List<String> arguments) {
        return new Builder(tool, arguments);
    }

    /**
     * Fluent builder for the optional hints.
     */
    public static final class Builder {
        private final ToolKind tool;
        private final List<String> arguments;
        private Path workingDirectory;
        private Path expectedOutputPath;
        private Path outputFolder;
        private String fileNameHint;
        private String expectedExtension;
        private Duration knownDuration;

        private Builder(ToolKind tool, List<String> arguments) {
            this.tool = tool;
            this.arguments = arguments;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder expectedOutputPath(Path expectedOutputPath) {
            this.expectedOutputPath = expectedOutputPath;
            return this;
        }

        public Builder outputFolder(Path outputFolder) {
            this.outputFolder = outputFolder;
            return this;
        }

        public Builder fileNameHint(String fileNameHint) {
            this.fileNameHint = fileNameHint;
            return this;
        }

        public Builder expectedExtension(String expectedExtension) {
            this.expectedExtension = expectedExtension;
            return this;
        }

        public Builder knownDuration(Duration knownDuration) {
            this.knownDuration = knownDuration;
            return this;
        }

        public JobRequest build() {
            return new JobRequest(tool, arguments, workingDirectory, expectedOutputPath,
                    outputFolder, fileNameHint, expectedExtension, knownDuration);
        }
    }
}
