package com.phillippitts.mediatoolbox.presentation.dto;

import com.phillippitts.mediatoolbox.domain.JobRequest;
import com.phillippitts.mediatoolbox.domain.ToolKind;
import com.phillippitts.mediatoolbox.exception.InvalidJobRequestException;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Body of {@code POST /api/jobs}. The argument vector is passed to the tool as-is.
 */
public record JobStartRequest(
        @NotNull(message = "tool is required")
        ToolKind tool,

        @NotEmpty(message = "arguments must not be empty")
        List<@NotNull String> arguments,

        String workingDirectory,
        String expectedOutputPath,
        String outputFolder,
        String fileNameHint,
        String expectedExtension,

        @Positive(message = "knownDurationSeconds must be positive")
        Double knownDurationSeconds
) {

    /**
     * @throws InvalidJobRequestException if a path field cannot be parsed
     */
    public JobRequest toJobRequest() {
        return JobRequest.builder(tool, arguments)
                .workingDirectory(toPath("workingDirectory", workingDirectory))
                .expectedOutputPath(toPath("expectedOutputPath", expectedOutputPath))
                .outputFolder(toPath("outputFolder", outputFolder))
                .fileNameHint(fileNameHint)
                .expectedExtension(expectedExtension)
                .knownDuration(knownDurationSeconds == null ? null
                        : Duration.ofMillis(Math.round(knownDurationSeconds * 1000.0)))
                .build();
    }

    private static Path toPath(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Path.of(value);
        } catch (InvalidPathException e) {
            throw new InvalidJobRequestException(field + " is not a valid path: " + e.getReason());
        }
    }
}
