/**
 * Job supervision: the active-job slot, start and cancel, and resolution of the terminal outcome.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code service.job.process} - spawning, locating and terminating tool processes</li>
 *   <li>{@code service.job.progress} - turning raw tool output into progress events</li>
 *   <li>{@code service.job.event} - application events published when a job finishes</li>
 * </ul>
 *
 * @see com.phillippitts.mediatoolbox.service.job.JobSupervisor
 */
package com.phillippitts.mediatoolbox.service.job;
