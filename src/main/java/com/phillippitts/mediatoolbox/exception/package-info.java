/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.mediatoolbox.exception.MediaToolboxException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.mediatoolbox.exception.SpawnFailureException} - Thrown when an
 *       external tool cannot be started (binary missing or not executable)</li>
 *   <li>{@link com.phillippitts.mediatoolbox.exception.InvalidJobRequestException} - Thrown when a
 *       start request is malformed</li>
 * </ul>
 *
 * <p>Runtime failures of a started tool and cancellations are not exceptions. They travel through
 * the single terminal-outcome channel of a job
 * ({@link com.phillippitts.mediatoolbox.domain.TerminalOutcome}).
 *
 * @see com.phillippitts.mediatoolbox.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.mediatoolbox.exception;
