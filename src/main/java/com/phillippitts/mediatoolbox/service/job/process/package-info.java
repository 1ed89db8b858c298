/**
 * Process plumbing behind the supervisor. {@link com.phillippitts.mediatoolbox.service.job.process.ProcessFactory}
 * is the test seam for spawning; {@link com.phillippitts.mediatoolbox.service.job.process.Terminator}
 * the one for stopping.
 */
package com.phillippitts.mediatoolbox.service.job.process;
