package com.phillippitts.mediatoolbox.service.job.process;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link Terminator} built on {@link ProcessHandle}, with the same semantics on every platform:
 * the descendant tree is snapshotted, each snapshotted descendant is destroyed forcibly, then
 * the root is.
 */
@Component
public class ProcessHandleTerminator implements Terminator {

    private static final Logger LOG = LogManager.getLogger(ProcessHandleTerminator.class);

    @Override
    public boolean terminate(long processId) {
        if (processId == ProcessHandle.current().pid()) {
            LOG.warn("Refusing to terminate the application's own process {}", processId);
            return false;
        }
        Optional<ProcessHandle> root = ProcessHandle.of(processId);
        if (root.isEmpty() || !root.get().isAlive()) {
            LOG.debug("Process {} not found; nothing to terminate", processId);
            return false;
        }
        ProcessHandle handle = root.get();
        List<ProcessHandle> descendants = handle.descendants().collect(Collectors.toList());
        for (ProcessHandle descendant : descendants) {
            destroy(descendant);
        }
        destroy(handle);
        LOG.info("Sent terminate to process {} and {} descendant(s)", processId, descendants.size());
        return true;
    }

    private static void destroy(ProcessHandle handle) {
        try {
            if (!handle.destroyForcibly()) {
                LOG.debug("Terminate request not accepted for process {}", handle.pid());
            }
        } catch (SecurityException | IllegalStateException e) {
            LOG.warn("Could not terminate process {}: {}", handle.pid(), e.toString());
        }
    }
}
