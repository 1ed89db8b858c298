package com.phillippitts.mediatoolbox.service.job.progress;

import com.phillippitts.mediatoolbox.domain.ProgressEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressStreamParserTest {

    private MutableClock clock;
    private ProgressStreamParser parser;
    private RecordingObserver observer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        parser = new ProgressStreamParser(4096, clock);
        observer = new RecordingObserver();
    }

    @Test
    void firstDurationIsCachedAndLaterOnesIgnored() {
        List<ProgressEvent> events = parse(
                "  Duration: 00:02:00.00, start: 0.000000, bitrate: 1205 kb/s\n"
                + "  Duration: 00:00:10.00, start: 0.000000\n"
                + "frame=  900 fps=60 q=28.0 size=1024kB time=00:01:00.00 bitrate=139.8kbits/s speed=2.01x\r");

        assertThat(events).containsExactly(new ProgressEvent(50, "00:01:00", "2.01x", null));
    }

    @Test
    void interpreterKeepsFirstDuration() {
        RecordInterpreter interpreter = new RecordInterpreter(clock, RecordObserver.NONE);
        interpreter.interpret("Duration: 00:02:00.00, start: 0.0");
        interpreter.interpret("Duration: 00:00:10.00, start: 0.0");

        assertThat(interpreter.totalDurationSeconds()).hasValue(120.0);
    }

    @Test
    void percentFollowsPositionOverDuration() {
        List<ProgressEvent> events = parse("Duration: 00:00:10.00\rtime=00:00:05.00 speed=1.0x\r");

        assertThat(events).extracting(ProgressEvent::percent).containsExactly(50);
    }

    @Test
    void percentNeverReaches100WhileRunning() {
        List<ProgressEvent> events = parse("Duration: 00:00:10.00\ntime=00:00:09.99 speed=1.0x\n");

        assertThat(events).extracting(ProgressEvent::percent).containsExactly(99);
    }

    @Test
    void unknownDurationStillEmitsEventWithZeroPercent() {
        List<ProgressEvent> events = parse("frame=   10 fps=0.0 q=0.0 size=0kB time=00:00:03.00 bitrate=N/A speed=0.5x\n");

        assertThat(events).containsExactly(new ProgressEvent(0, "00:00:03", "0.5x", null));
    }

    @Test
    void knownDurationTakesPrecedenceOverDurationLine() {
        InputStream in = stream("  Duration: 01:00:00.00, start: 0.000000, bitrate: 1205 kb/s\n"
                + "frame=  120 fps=60 q=28.0 size=512kB time=00:00:05.00 bitrate=839kbits/s speed=2.5x\r");

        List<ProgressEvent> events = parser.parse(in, Duration.ofSeconds(10), () -> false, observer)
                .collect(Collectors.toList());

        assertThat(events).containsExactly(new ProgressEvent(50, "00:00:05", "2.5x", null));
    }

    @Test
    void interpreterSeededWithKnownDurationIgnoresDurationLine() {
        RecordInterpreter interpreter = new RecordInterpreter(clock, RecordObserver.NONE, Duration.ofMillis(12_500));
        interpreter.interpret("Duration: 00:02:00.00, start: 0.0");

        assertThat(interpreter.totalDurationSeconds()).hasValue(12.5);
    }

    @Test
    void transferLineYieldsFractionSizeRateAndEta() {
        List<ProgressEvent> events = parse("[download]  42.6% of ~10.00MiB at  1.50MiB/s ETA 00:05\n");

        assertThat(events).containsExactly(
                new ProgressEvent(43, "00:00:00", "1.50MiB/s", "Downloading...", "10.00MiB", "00:05"));
    }

    @Test
    void completeTransferIsClampedAndReportedAsFinalizing() {
        List<ProgressEvent> events = parse("[download] 100% of 10.00MiB in 00:00:05 at 2.00MiB/s\n");

        assertThat(events).hasSize(1);
        assertThat(events.get(0).percent()).isEqualTo(99);
        assertThat(events.get(0).statusText()).isEqualTo("Finalizing download...");
    }

    @Test
    void elapsedTimeFallsBackToWallClockSinceStart() {
        InputStream in = stream("[download]  10.0% of 5.00MiB at 1.00MiB/s ETA 00:04\n");
        var events = parser.parse(in, () -> false, observer);
        clock.advance(Duration.ofSeconds(75));

        assertThat(events.collect(Collectors.toList()))
                .extracting(ProgressEvent::elapsedTime)
                .containsExactly("00:01:15");
    }

    @Test
    void destinationAnnouncementsAreReportedLatestLast() {
        List<ProgressEvent> events = parse(
                "[download] Destination: /tmp/out/clip.f137.mp4\n"
                + "[download]  50.0% of 2.00MiB at 1.00MiB/s ETA 00:01\n"
                + "[Merger] Merging formats into \"/tmp/out/clip.mp4\"\n");

        assertThat(observer.destinations)
                .containsExactly(Path.of("/tmp/out/clip.f137.mp4"), Path.of("/tmp/out/clip.mp4"));
        assertThat(events).extracting(ProgressEvent::statusText)
                .containsExactly("Creating output file...", "Downloading...", "Merging audio and video...");
    }

    @Test
    void statusOnlyRecordsReuseLastPercent() {
        List<ProgressEvent> events = parse(
                "[download]  64.0% of 2.00MiB at 1.00MiB/s ETA 00:01\n"
                + "[Merger] Merging formats into \"/tmp/out/clip.mp4\"\n");

        assertThat(events).extracting(ProgressEvent::percent).containsExactly(64, 64);
    }

    @Test
    void alreadyDownloadedAnnouncesPath() {
        parse("[download] /tmp/out/clip.mp4 has already been downloaded\n");

        assertThat(observer.destinations).containsExactly(Path.of("/tmp/out/clip.mp4"));
    }

    @Test
    void componentTagsAndKeywordsMapToStatuses() {
        List<ProgressEvent> events = parse(
                "[info] Downloading webpage\n"
                + "[ExtractAudio] Destination: /tmp/out/clip.mp3\n"
                + "Deleting original file /tmp/out/clip.webm (pass -k to keep)\n"
                + "[FixupM3u8] Fixing video timestamp in \"/tmp/out/clip.mp4\"\n"
                + "[youtube] abc: Downloading player\n");

        assertThat(events).extracting(ProgressEvent::statusText).containsExactly(
                "Fetching metadata...",
                "Extracting audio...",
                "Cleaning up temporary files...",
                "Finalizing media timestamps...");
    }

    @Test
    void errorLinesBecomeErrorStatus() {
        List<ProgressEvent> events = parse("ERROR: [youtube] abc: Video unavailable\n");

        assertThat(events).extracting(ProgressEvent::statusText)
                .containsExactly("Error: [youtube] abc: Video unavailable");
    }

    @Test
    void uninformativeRecordsAreDroppedSilently() {
        List<ProgressEvent> events = parse(
                "ffmpeg version 6.0 Copyright (c) 2000-2023 the FFmpeg developers\n"
                + "Input #0, matroska,webm, from 'in.mkv':\n"
                + "Press [q] to stop, [?] for help\n");

        assertThat(events).isEmpty();
        assertThat(observer.records).hasSize(3);
    }

    @Test
    void stopsBetweenRecordsOnceCancelled() {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        InputStream in = stream("time=00:00:01.00\rtime=00:00:02.00\rtime=00:00:03.00\r");

        Iterator<ProgressEvent> events = parser.parse(in, cancelled::get, observer).iterator();
        assertThat(events.next().elapsedTime()).isEqualTo("00:00:01");
        cancelled.set(true);

        assertThat(events.hasNext()).isFalse();
        assertThat(observer.records).containsExactly("time=00:00:01.00");
    }

    @Test
    void eachParseStartsWithoutCachedDuration() {
        parse("Duration: 00:00:10.00\n");
        List<ProgressEvent> second = parse("time=00:00:05.00\n");

        assertThat(second).extracting(ProgressEvent::percent).containsExactly(0);
    }

    private List<ProgressEvent> parse(String text) {
        return parser.parse(stream(text), () -> false, observer).collect(Collectors.toList());
    }

    private static InputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private static final class RecordingObserver implements RecordObserver {
        final List<String> records = new ArrayList<>();
        final List<Path> destinations = new ArrayList<>();

        @Override
        public void onRecord(String record) {
            records.add(record);
        }

        @Override
        public void onDestination(Path destination) {
            destinations.add(destination);
        }
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
