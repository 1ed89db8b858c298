/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code POST /api/jobs} - start a job, response is a {@code text/event-stream}</li>
 *   <li>{@code POST /api/jobs/cancel} - cancel the active job (no-op when idle)</li>
 *   <li>{@code GET /api/jobs/active} - snapshot of the active job, 204 when idle</li>
 *   <li>{@code GET /ping} - liveness</li>
 * </ul>
 *
 * <p>Exceptions are left to {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.mediatoolbox.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.mediatoolbox.presentation.controller;
