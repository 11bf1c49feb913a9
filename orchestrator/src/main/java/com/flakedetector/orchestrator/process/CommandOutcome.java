package com.flakedetector.orchestrator.process;

import java.time.Duration;

/**
 * What happened when a command was launched. Never thrown; always returned.
 *
 * Callers branch with {@code instanceof} on the three variants instead of
 * catching process exceptions.
 */
public sealed interface CommandOutcome {

    /** The process exited on its own. */
    record Completed(int exitCode, String stdout, String stderr, Duration elapsed) implements CommandOutcome {
        public boolean succeeded() { return exitCode == 0; }
    }

    /** The process was still running at the deadline and has been killed. */
    record TimedOut(Duration timeout, String stdout, String stderr) implements CommandOutcome {}

    /** The process could not be started or awaited (missing executable, I/O error, interrupt). */
    record LaunchFailed(String message) implements CommandOutcome {}
}
