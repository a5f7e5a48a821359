package io.agentfarm.system;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Terminates recorded processes. A pid that is already gone counts as stopped.
 */
public class ProcessControl {
    private static final Logger log = LoggerFactory.getLogger(ProcessControl.class);
    private static final long GRACE_MS = 2_000L;

    /**
     * Sends TERM to {@code pid} and its descendants, then KILL to whatever survives the grace period.
     *
     * @return true when nothing with this pid is left running
     */
    public boolean terminateTree(long pid) {
        if (pid <= 0) {
            return true;
        }
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty() || !handle.get().isAlive()) {
            return true;
        }
        ProcessHandle root = handle.get();
        List<ProcessHandle> tree = new ArrayList<>(root.descendants().toList());
        tree.add(root);
        tree.forEach(ProcessHandle::destroy);
        try {
            root.onExit().get(GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("pid {} ignored TERM, sending KILL", pid);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.debug("Waiting for pid {} failed: {}", pid, e.getMessage());
        }
        tree.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
        boolean stopped = !root.isAlive();
        if (!stopped) {
            log.warn("pid {} still alive after KILL", pid);
        }
        return stopped;
    }
}
