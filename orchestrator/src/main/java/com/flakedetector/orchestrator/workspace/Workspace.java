package com.flakedetector.orchestrator.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An acquired copy of the repository under test, owned by exactly one job.
 *
 * The directory is handed to every run as its working directory and is treated
 * as read-only while runs execute. Nothing changes the JVM's own working
 * directory; {@link #close()} deletes the tree and is the only cleanup needed.
 * Use it with try-with-resources so deletion happens on every exit path.
 */
public final class Workspace implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Workspace.class);

    private final Path          root;
    private final String        source;
    private final AtomicBoolean closed = new AtomicBoolean();

    Workspace(Path root, String source) {
        this.root   = root;
        this.source = source;
    }

    public Path root() {
        return root;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Delete the workspace tree. Idempotent; a failed delete is logged, not thrown,
     * so it never masks the job's own outcome.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            FileSystemUtils.deleteRecursively(root);
            log.info("Workspace {} deleted", root);
        } catch (IOException e) {
            log.warn("Could not delete workspace {}, manual cleanup may be needed: {}", root, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "Workspace[" + root + " <- " + source + "]";
    }
}
