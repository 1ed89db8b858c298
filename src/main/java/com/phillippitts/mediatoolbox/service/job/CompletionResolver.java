package com.phillippitts.mediatoolbox.service.job;

import com.phillippitts.mediatoolbox.domain.JobRequest;
import com.phillippitts.mediatoolbox.domain.TerminalOutcome;
import com.phillippitts.mediatoolbox.service.job.progress.DiagnosticBuffer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.OptionalInt;

/**
 * Turns a finished process into exactly one {@link TerminalOutcome}.
 *
 * <p><b>Precedence:</b>
 * <pre>
 * cancel pending          → Cancelled (flag cleared, recorded output deleted), whatever the exit code
 * exit code 0             → Succeeded with the resolved output path
 * anything else           → Failed with the exit code (-1 if unknown) and trimmed diagnostics
 * </pre>
 */
@Component
public class CompletionResolver {

    private static final Logger LOG = LogManager.getLogger(CompletionResolver.class);

    static final int UNKNOWN_EXIT_CODE = -1;

    private final ActiveJobSlot slot;
    private final OutputPathResolver outputPathResolver;
    private final OutputCleaner outputCleaner;

    public CompletionResolver(ActiveJobSlot slot, OutputPathResolver outputPathResolver, OutputCleaner outputCleaner) {
        this.slot = slot;
        this.outputPathResolver = outputPathResolver;
        this.outputCleaner = outputCleaner;
    }

    /**
     * @param request the request the job was started with
     * @param exitCode process exit code, empty when waiting for the process failed
     * @param recordedOutputPath last output path the job announced, may be null
     * @param diagnostics captured stderr of the job
     */
    public TerminalOutcome resolve(JobRequest request, OptionalInt exitCode, Path recordedOutputPath,
                                   DiagnosticBuffer diagnostics) {
        if (slot.beginCompletion()) {
            outputCleaner.deleteIfExists(recordedOutputPath);
            if (exitCode.isPresent() && exitCode.getAsInt() == 0) {
                LOG.info("Process exited cleanly but a cancel was pending; reporting cancelled");
            }
            return new TerminalOutcome.Cancelled();
        }
        if (exitCode.isPresent() && exitCode.getAsInt() == 0) {
            return new TerminalOutcome.Succeeded(outputPathResolver.resolve(request, recordedOutputPath));
        }
        return new TerminalOutcome.Failed(exitCode.orElse(UNKNOWN_EXIT_CODE), diagnostics.text());
    }
}
