package com.phillippitts.mediatoolbox.service.job.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Default production implementation of {@link ProcessFactory} using {@link ProcessBuilder}.
 */
public final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        // Keep stderr separate from stdout: stderr also feeds the diagnostic buffer
        pb.redirectErrorStream(false);
        pb.redirectInput(ProcessBuilder.Redirect.PIPE);
        pb.redirectOutput(ProcessBuilder.Redirect.PIPE);
        pb.redirectError(ProcessBuilder.Redirect.PIPE);
        return pb.start();
    }
}
