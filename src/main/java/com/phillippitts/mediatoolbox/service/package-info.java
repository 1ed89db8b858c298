/**
 * Service layer containing the job engine and its observability hooks.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.job} - job supervision, process plumbing and progress parsing</li>
 *   <li>{@code service.health} - actuator health indicator for the external tools</li>
 *   <li>{@code service.metrics} - Micrometer job metrics</li>
 * </ul>
 *
 * <p>Services use constructor injection and throw domain exceptions, never HTTP exceptions.
 *
 * @see com.phillippitts.mediatoolbox.service.job
 */
package com.phillippitts.mediatoolbox.service;
