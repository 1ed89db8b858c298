package com.phillippitts.mediatoolbox.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of external tools the supervisor knows how to run.
 *
 * <p>Each kind fixes which output streams are parsed for progress. Standard error is always
 * captured for diagnostics regardless of whether it is parsed.
 */
public enum ToolKind {

    /** Media transcoder; reports progress on stderr, stdout is discarded. */
    TRANSCODER("Transcoder", EnumSet.of(StreamChannel.STDERR)),

    /** Resource downloader; interleaves progress on both stdout and stderr. */
    DOWNLOADER("Downloader", EnumSet.of(StreamChannel.STDOUT, StreamChannel.STDERR));

    private final String displayName;
    private final Set<StreamChannel> monitoredStreams;

    ToolKind(String displayName, Set<StreamChannel> monitoredStreams) {
        this.displayName = displayName;
        this.monitoredStreams = Collections.unmodifiableSet(monitoredStreams);
    }

    public String displayName() {
        return displayName;
    }

    public Set<StreamChannel> monitoredStreams() {
        return monitoredStreams;
    }

    public boolean monitors(StreamChannel channel) {
        return monitoredStreams.contains(channel);
    }
}
