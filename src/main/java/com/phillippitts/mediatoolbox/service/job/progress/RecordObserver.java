package com.phillippitts.mediatoolbox.service.job.progress;

import java.nio.file.Path;

/**
 * Side channel of the parser for information that is not a progress event.
 */
public interface RecordObserver {

    RecordObserver NONE = new RecordObserver() { };

    /**
     * Called for every non-blank record, in arrival order, before it is interpreted.
     */
    default void onRecord(String record) {
    }

    /**
     * Called when a record announces where the tool is writing its output. Later
     * announcements supersede earlier ones.
     */
    default void onDestination(Path destination) {
    }
}
