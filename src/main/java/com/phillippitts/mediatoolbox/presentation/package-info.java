/**
 * Presentation layer (REST API controllers, DTOs and exception handling).
 *
 * <p>Presentation depends on service but not vice versa. Controllers are thin adapters over
 * {@link com.phillippitts.mediatoolbox.service.job.JobSupervisor}.
 */
package com.phillippitts.mediatoolbox.presentation;
