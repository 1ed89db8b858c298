package com.phillippitts.mediatoolbox.service.job;

import com.phillippitts.mediatoolbox.domain.JobRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Works out where a successful job left its output.
 *
 * <p>Order of preference:
 * <ol>
 *   <li>the path the tool announced (or the expected output path) if it is a regular file;</li>
 *   <li>{@code <outputFolder>/<base>.<expectedExtension>}, where {@code base} is the file name hint
 *       with dots replaced by underscores, or {@code downloaded_file};</li>
 *   <li>any regular file in the output folder whose name without extension equals {@code base},
 *       for tools that picked a different extension than anticipated.</li>
 * </ol>
 * When nothing matches, the best candidate is returned even though it may not exist.
 */
@Component
public class OutputPathResolver {

    private static final Logger LOG = LogManager.getLogger(OutputPathResolver.class);

    static final String DEFAULT_BASE_NAME = "downloaded_file";

    public Path resolve(JobRequest request, Path recorded) {
        Path candidate = recorded != null ? recorded : request.expectedOutputPath();
        if (candidate != null && Files.isRegularFile(candidate)) {
            return candidate;
        }
        Path folder = request.outputFolder();
        if (folder == null) {
            return candidate;
        }
        String base = baseName(request.fileNameHint());
        String ext = request.expectedExtension();
        Path constructed = folder.resolve(ext == null || ext.isBlank() ? base : base + "." + stripDot(ext));
        if (Files.isRegularFile(constructed)) {
            return constructed;
        }
        Optional<Path> byStem = findByStem(folder, base);
        if (byStem.isPresent()) {
            LOG.debug("Resolved output by name match: {}", byStem.get());
            return byStem.get();
        }
        LOG.warn("Could not locate output file in {} (expected {})", folder, constructed.getFileName());
        return candidate != null ? candidate : constructed;
    }

    static String baseName(String fileNameHint) {
        if (fileNameHint == null || fileNameHint.isBlank()) {
            return DEFAULT_BASE_NAME;
        }
        return fileNameHint.trim().replace('.', '_');
    }

    private static String stripDot(String ext) {
        String trimmed = ext.trim();
        return trimmed.startsWith(".") ? trimmed.substring(1) : trimmed;
    }

    private static Optional<Path> findByStem(Path folder, String base) {
        if (!Files.isDirectory(folder)) {
            return Optional.empty();
        }
        try (Stream<Path> entries = Files.list(folder)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(p -> stem(p).equals(base))
                    .sorted()
                    .findFirst();
        } catch (IOException e) {
            LOG.debug("Could not list {}: {}", folder, e.toString());
            return Optional.empty();
        }
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
