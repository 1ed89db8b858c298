package com.phillippitts.mediatoolbox.service.job.process;

import com.phillippitts.mediatoolbox.MediaToolboxApplication;
import com.phillippitts.mediatoolbox.config.properties.ToolProperties;
import com.phillippitts.mediatoolbox.domain.ToolKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.system.ApplicationHome;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Resolves the executable for a tool.
 *
 * <p>A binary bundled next to the running application ({@code <app home>/<tools.bundled-dir>/<name>},
 * with {@code .exe} appended on Windows) is preferred. Otherwise the bare configured name is returned
 * and the operating system searches {@code PATH} when the process is spawned.
 */
@Component
public class ToolLocator {

    private static final Logger LOG = LogManager.getLogger(ToolLocator.class);

    private final ToolProperties properties;
    private final Path applicationHome;
    private final boolean windows;
    private final String searchPath;

    @Autowired
    public ToolLocator(ToolProperties properties) {
        this(properties,
                new ApplicationHome(MediaToolboxApplication.class).getDir().toPath(),
                System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win"),
                System.getenv("PATH"));
    }

    public ToolLocator(ToolProperties properties, Path applicationHome, boolean windows, String searchPath) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.applicationHome = Objects.requireNonNull(applicationHome, "applicationHome");
        this.windows = windows;
        this.searchPath = searchPath == null ? "" : searchPath;
    }

    /**
     * Returns the executable to start for {@code tool}: an absolute bundled path when present,
     * else the configured name.
     */
    public String resolve(ToolKind tool) {
        Path bundled = bundledPath(tool);
        if (Files.isRegularFile(bundled)) {
            LOG.debug("Using bundled {} at {}", tool.displayName(), bundled);
            return bundled.toAbsolutePath().toString();
        }
        return properties.binaryName(tool);
    }

    /**
     * Whether {@code tool} can be started: bundled binary present, or an executable with the
     * configured name found on the search path.
     */
    public boolean isAvailable(ToolKind tool) {
        if (Files.isRegularFile(bundledPath(tool))) {
            return true;
        }
        String name = executableName(properties.binaryName(tool));
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            try {
                if (Files.isExecutable(Path.of(dir).resolve(name))) {
                    return true;
                }
            } catch (InvalidPathException e) {
                LOG.debug("Skipping unusable PATH entry '{}'", dir);
            }
        }
        return false;
    }

    Path bundledPath(ToolKind tool) {
        return applicationHome.resolve(properties.bundledDir())
                .resolve(executableName(properties.binaryName(tool)));
    }

    private String executableName(String name) {
        if (windows && !name.toLowerCase(Locale.ROOT).endsWith(".exe")) {
            return name + ".exe";
        }
        return name;
    }
}
