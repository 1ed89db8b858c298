package com.phillippitts.mediatoolbox.service.job.progress;

import com.phillippitts.mediatoolbox.domain.ProgressEvent;
import com.phillippitts.mediatoolbox.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns single records into progress events. One instance per parsed stream; it caches the
 * total duration and the last percent seen on that stream.
 *
 * <p>Every extraction is applied independently, so a record may contribute a position, a rate
 * and a status at once. A record that only announces the total duration updates state without
 * producing an event.
 */
final class RecordInterpreter {

    private static final Logger LOG = LogManager.getLogger(RecordInterpreter.class);

    static final Pattern DURATION = Pattern.compile("Duration:\\s*(\\d{2}):(\\d{2}):(\\d{2})\\.(\\d{2})");
    static final Pattern POSITION = Pattern.compile("time=(\\d{2}):(\\d{2}):(\\d{2})\\.(\\d{2})");
    static final Pattern SPEED = Pattern.compile("speed=\\s*(\\d+\\.?\\d*)x");
    static final Pattern FRACTION = Pattern.compile("\\[download\\]\\s+(\\d+\\.?\\d*)%");
    static final Pattern SIZE = Pattern.compile("of\\s+~?(\\d+\\.?\\d*[KMG]iB)");
    static final Pattern RATE = Pattern.compile("at\\s+(\\d+\\.?\\d*[KMG]iB/s)");
    static final Pattern ETA = Pattern.compile("ETA\\s+(\\d{2}:\\d{2})");
    static final Pattern TAG = Pattern.compile("^\\[([^\\]]+)\\]");
    static final Pattern ALREADY_DOWNLOADED =
            Pattern.compile("\\[download\\]\\s+(.+?)\\s+has already been downloaded");

    private static final String DESTINATION_MARKER = "Destination:";
    private static final String MERGE_MARKER = "Merging formats into";
    private static final String ERROR_MARKER = "ERROR:";
    private static final double FINALIZING_THRESHOLD = 99.9;

    private final Clock clock;
    private final Instant startedAt;
    private final RecordObserver observer;

    private Double totalDurationSeconds;
    private int lastPercent;

    RecordInterpreter(Clock clock, RecordObserver observer) {
        this(clock, observer, null);
    }

    /**
     * @param knownDuration length of the media the tool will produce, when the caller knows it (a trim
     *                      range, say); it then takes the place of any {@code Duration:} line
     */
    RecordInterpreter(Clock clock, RecordObserver observer, Duration knownDuration) {
        this.clock = clock;
        this.startedAt = clock.instant();
        this.observer = observer;
        if (knownDuration != null && !knownDuration.isNegative() && !knownDuration.isZero()) {
            totalDurationSeconds = knownDuration.toMillis() / 1000.0;
        }
    }

    OptionalDouble totalDurationSeconds() {
        return totalDurationSeconds == null ? OptionalDouble.empty() : OptionalDouble.of(totalDurationSeconds);
    }

    Optional<ProgressEvent> interpret(String record) {
        LOG.trace("record: {}", record);
        if (totalDurationSeconds == null) {
            Matcher duration = DURATION.matcher(record);
            if (duration.find()) {
                totalDurationSeconds = clockSeconds(duration);
                LOG.debug("Total duration: {}s", totalDurationSeconds);
            }
        }

        Integer percent = null;
        String elapsed = null;
        Matcher position = POSITION.matcher(record);
        if (position.find()) {
            double current = clockSeconds(position);
            percent = percentOfDuration(current);
            elapsed = TimeUtils.formatHms((long) current);
        }

        Double fraction = null;
        Matcher fractionMatch = FRACTION.matcher(record);
        if (fractionMatch.find()) {
            fraction = Double.parseDouble(fractionMatch.group(1));
            if (percent == null) {
                percent = clampPercent(Math.round(fraction));
            }
        }

        String speed = group(SPEED, record);
        String speedOrRate = speed != null ? speed + "x" : group(RATE, record);
        String size = group(SIZE, record);
        String eta = group(ETA, record);
        String status = inferStatus(record, fraction);

        boolean informative = percent != null || speedOrRate != null || size != null
                || eta != null || status != null;
        if (!informative) {
            return Optional.empty();
        }

        if (percent == null) {
            percent = lastPercent;
        } else {
            lastPercent = percent;
        }
        if (elapsed == null) {
            elapsed = TimeUtils.formatHms(Duration.between(startedAt, clock.instant()).getSeconds());
        }
        return Optional.of(new ProgressEvent(percent, elapsed, speedOrRate, status, size, eta));
    }

    private String inferStatus(String record, Double fraction) {
        String status = null;

        String destination = textAfter(record, DESTINATION_MARKER);
        if (destination != null) {
            announce(destination);
            status = "Creating output file...";
        }

        if (record.contains(MERGE_MARKER)) {
            String merged = textAfter(record, MERGE_MARKER);
            if (merged != null) {
                announce(merged);
            }
            status = "Merging audio and video...";
        } else if (record.contains("Deleting original file")) {
            status = "Cleaning up temporary files...";
        } else if (record.contains("Fixing video timestamp")) {
            status = "Finalizing media timestamps...";
        }

        String already = group(ALREADY_DOWNLOADED, record);
        if (already != null) {
            announce(already);
        }

        String tag = group(TAG, record);
        if (tag != null) {
            Optional<ComponentTag> component = ComponentTag.fromTag(tag);
            if (component.isPresent()) {
                String tagStatus = component.get().statusFor(record, fraction != null);
                if (tagStatus != null) {
                    status = tagStatus;
                }
            }
        }

        if (fraction != null && status == null) {
            status = fraction >= FINALIZING_THRESHOLD ? "Finalizing download..." : "Downloading...";
        }

        int error = record.indexOf(ERROR_MARKER);
        if (error >= 0) {
            String detail = record.substring(error + ERROR_MARKER.length()).trim();
            status = "Error: " + (detail.isEmpty() ? record : detail);
        }
        return status;
    }

    private int percentOfDuration(double currentSeconds) {
        if (totalDurationSeconds == null || totalDurationSeconds <= 0) {
            return 0;
        }
        return clampPercent(Math.round(currentSeconds / totalDurationSeconds * 100.0));
    }

    private static int clampPercent(long value) {
        return (int) Math.max(0L, Math.min(ProgressEvent.MAX_RUNNING_PERCENT, value));
    }

    private void announce(String raw) {
        try {
            observer.onDestination(Path.of(raw));
        } catch (InvalidPathException e) {
            LOG.debug("Ignoring unusable destination '{}': {}", raw, e.getMessage());
        }
    }

    private static double clockSeconds(Matcher m) {
        int h = Integer.parseInt(m.group(1));
        int min = Integer.parseInt(m.group(2));
        int s = Integer.parseInt(m.group(3));
        int hundredths = Integer.parseInt(m.group(4));
        return TimeUtils.toSeconds(h, min, s) + hundredths / 100.0;
    }

    private static String group(Pattern pattern, String record) {
        Matcher m = pattern.matcher(record);
        return m.find() ? m.group(1) : null;
    }

    /**
     * Text following {@code marker} with whitespace and surrounding quotes removed,
     * or {@code null} when the marker is absent or nothing follows it.
     */
    static String textAfter(String record, String marker) {
        int idx = record.indexOf(marker);
        if (idx < 0) {
            return null;
        }
        String candidate = stripQuotes(record.substring(idx + marker.length()).trim());
        return candidate.isEmpty() ? null : candidate;
    }

    private static String stripQuotes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && (s.charAt(start) == '"' || s.charAt(start) == '\'')) {
            start++;
        }
        while (end > start && (s.charAt(end - 1) == '"' || s.charAt(end - 1) == '\'')) {
            end--;
        }
        return s.substring(start, end);
    }
}
