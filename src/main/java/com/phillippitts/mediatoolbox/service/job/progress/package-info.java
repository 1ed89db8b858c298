/**
 * Progress stream parsing: splits raw tool output into CR/LF-delimited records, extracts
 * duration, position, rate, size, ETA, phase tags and destination announcements, and turns
 * them into {@link com.phillippitts.mediatoolbox.domain.ProgressEvent}s.
 *
 * <p>Parsing never fails a job. Records that match nothing are dropped; malformed bytes are
 * replaced; read errors end the stream.
 */
package com.phillippitts.mediatoolbox.service.job.progress;
