package com.phillippitts.mediatoolbox.exception;

import com.phillippitts.mediatoolbox.domain.ToolKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link SpawnFailureException} with launch context.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw SpawnFailureExceptionBuilder.create("Failed to spawn process")
 *         .tool(ToolKind.DOWNLOADER)
 *         .cause(ioException)
 *         .metadata("binary", executable)
 *         .metadata("argCount", arguments.size())
 *         .build();
 * </pre>
 *
 * <p>The final message format is {@code {message} (key1=val1, key2=val2) (tool: name)}.
 */
public final class SpawnFailureExceptionBuilder {

    private final String message;
    private ToolKind tool;
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private SpawnFailureExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static SpawnFailureExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new SpawnFailureExceptionBuilder(message);
    }

    public SpawnFailureExceptionBuilder tool(ToolKind tool) {
        this.tool = tool;
        return this;
    }

    public SpawnFailureExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public SpawnFailureExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public SpawnFailureException build() {
        String detailedMessage = buildDetailedMessage();
        if (cause != null) {
            return new SpawnFailureException(detailedMessage, tool, cause);
        }
        return new SpawnFailureException(detailedMessage, tool);
    }

    private String buildDetailedMessage() {
        if (metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
