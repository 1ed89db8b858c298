package com.phillippitts.mediatoolbox.service.job.process;

import com.phillippitts.mediatoolbox.domain.JobRequest;
import com.phillippitts.mediatoolbox.exception.SpawnFailureException;
import com.phillippitts.mediatoolbox.exception.SpawnFailureExceptionBuilder;
import com.phillippitts.mediatoolbox.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Spawns a tool for a {@link JobRequest} with both output streams piped as raw bytes.
 */
@Component
public class ProcessLauncher {

    private static final Logger LOG = LogManager.getLogger(ProcessLauncher.class);
    private static final int ARGS_LOG_MAX_CHARS = 512;

    private final ProcessFactory processFactory;
    private final ToolLocator toolLocator;

    @Autowired
    public ProcessLauncher(ToolLocator toolLocator) {
        this(new DefaultProcessFactory(), toolLocator);
    }

    public ProcessLauncher(ProcessFactory processFactory, ToolLocator toolLocator) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.toolLocator = Objects.requireNonNull(toolLocator, "toolLocator");
    }

    /**
     * Starts the tool.
     *
     * @param request validated request
     * @return handle with the process and, when obtainable, its OS id
     * @throws SpawnFailureException if the process could not be started
     */
    public LaunchedProcess launch(JobRequest request) {
        String executable = toolLocator.resolve(request.tool());
        List<String> command = new ArrayList<>(request.arguments().size() + 1);
        command.add(executable);
        command.addAll(request.arguments());

        LOG.info("Running {} with args: {}", request.tool().displayName(),
                LogSanitizer.describeArguments(request.arguments(), ARGS_LOG_MAX_CHARS));
        try {
            Process process = processFactory.start(command, request.workingDirectory());
            return new LaunchedProcess(process, processIdOf(process), executable);
        } catch (IOException | SecurityException | IllegalArgumentException e) {
            throw SpawnFailureExceptionBuilder.create("Failed to spawn " + request.tool().displayName())
                    .tool(request.tool())
                    .cause(e)
                    .metadata("binary", executable)
                    .metadata("argCount", request.arguments().size())
                    .metadata("workingDir", request.workingDirectory())
                    .metadata("error", e.getMessage())
                    .build();
        }
    }

    /**
     * Captures the OS id of a process that is still running. An id is not reported for a process
     * that already exited, since the number may be reused by an unrelated process.
     */
    static OptionalLong processIdOf(Process process) {
        try {
            if (!process.isAlive()) {
                return OptionalLong.empty();
            }
            return OptionalLong.of(process.pid());
        } catch (UnsupportedOperationException e) {
            return OptionalLong.empty();
        }
    }
}
