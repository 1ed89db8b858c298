package com.phillippitts.mediatoolbox.service.job.progress;

import java.util.Optional;

/**
 * Leading {@code [tag]} of a downloader output line, naming the phase that produced it.
 *
 * <p>Only the tags listed here carry a status; anything else is treated as uninformative.
 */
enum ComponentTag {
    DOWNLOAD("download"),
    MERGER("Merger"),
    EXTRACT_AUDIO("ExtractAudio"),
    INFO("info");

    private final String tag;

    ComponentTag(String tag) {
        this.tag = tag;
    }

    static Optional<ComponentTag> fromTag(String raw) {
        for (ComponentTag t : values()) {
            if (t.tag.equals(raw)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    /**
     * Status phrase for a record carrying this tag.
     *
     * @param record the full record text
     * @param hasPercent whether the record also carried a transfer percentage
     * @return status phrase, or {@code null} when the tag says nothing useful for this record
     */
    String statusFor(String record, boolean hasPercent) {
        return switch (this) {
            case MERGER -> "Merging audio and video...";
            case EXTRACT_AUDIO -> "Extracting audio...";
            case INFO -> infoStatus(record);
            case DOWNLOAD -> hasPercent ? null : downloadStatus(record);
        };
    }

    private static String infoStatus(String record) {
        if (record.contains("Downloading webpage")) {
            return "Fetching metadata...";
        }
        if (record.contains("Downloading m3u8")) {
            return "Preparing stream...";
        }
        return "Extracting metadata...";
    }

    private static String downloadStatus(String record) {
        if (record.contains("Destination:")) {
            return "Creating output file...";
        }
        if (record.contains("Downloading")) {
            return "Starting download...";
        }
        return null;
    }
}
