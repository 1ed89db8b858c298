package com.phillippitts.mediatoolbox.service.job;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Best-effort removal of partial output after a cancel. Failures are logged, never thrown.
 */
@Component
public class OutputCleaner {

    private static final Logger LOG = LogManager.getLogger(OutputCleaner.class);

    /**
     * Deletes {@code path} if it names an existing regular file.
     *
     * @return {@code true} if a file was deleted
     */
    public boolean deleteIfExists(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return false;
        }
        try {
            boolean deleted = Files.deleteIfExists(path);
            if (deleted) {
                LOG.info("Deleted partial output {}", path);
            }
            return deleted;
        } catch (IOException | SecurityException e) {
            LOG.warn("Could not delete partial output {}: {}", path, e.toString());
            return false;
        }
    }
}
