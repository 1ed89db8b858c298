/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.mediatoolbox.exception.InvalidJobRequestException} → 400 Bad Request</li>
 *   <li>Bean validation and unreadable bodies → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.mediatoolbox.exception.SpawnFailureException} → 503 Service Unavailable</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Runtime failures and cancellations of a running job are not exceptions; they arrive as the
 * terminal event of the job's stream.
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "SpawnFailureException",
 *   "message": "Tool could not be started",
 *   "details": "Failed to spawn Transcoder (binary=ffmpeg, argCount=4) (tool: Transcoder)",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.mediatoolbox.presentation.exception;
