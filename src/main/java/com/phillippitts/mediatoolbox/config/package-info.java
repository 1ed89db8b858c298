/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.mediatoolbox.config.ThreadPoolConfig} - executors for job
 *       driving tasks and event delivery</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code @ConfigurationProperties} for tools, jobs and pools</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filter)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.mediatoolbox.config;
