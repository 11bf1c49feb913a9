package com.flakedetector.orchestrator.workspace;

import com.flakedetector.orchestrator.process.CommandOutcome;
import com.flakedetector.orchestrator.process.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Materializes the repository under test into a fresh ephemeral directory.
 *
 * Remote repositories (allowed scheme prefixes) are cloned with git, bounded by
 * the clone timeout; local paths are copied. Each call gets its own directory from
 * {@link Files#createTempDirectory}, which picks a random name and creates it
 * atomically, so concurrent jobs never share one. If acquisition fails the
 * directory is removed before the exception propagates.
 */
public class RepositoryAcquirer {

    private static final Logger log = LoggerFactory.getLogger(RepositoryAcquirer.class);

    // git must never stop to ask for credentials; there is nobody to answer.
    private static final Map<String, String> GIT_ENV = Map.of("GIT_TERMINAL_PROMPT", "0");

    private final CommandRunner runner;
    private final List<String>  allowedSchemes;
    private final Path          baseDir;
    private final String        tempPrefix;
    private final Duration      cloneTimeout;

    public RepositoryAcquirer(CommandRunner runner,
                              List<String> allowedSchemes,
                              Path baseDir,
                              String tempPrefix,
                              Duration cloneTimeout) {
        this.runner         = runner;
        this.allowedSchemes = List.copyOf(allowedSchemes);
        this.baseDir        = baseDir;
        this.tempPrefix     = tempPrefix;
        this.cloneTimeout   = cloneTimeout;
    }

    /**
     * @param repo   validated remote URL or local path
     * @param jobTag short job identifier folded into the directory name for traceability
     * @return a workspace the caller must close
     * @throws AcquisitionException on clone failure/timeout, a bad local path, or copy errors
     */
    public Workspace acquire(String repo, String jobTag) {
        Path dir = createWorkspaceDir(jobTag);
        try {
            if (isRemote(repo)) {
                clone(repo, dir);
            } else {
                copyLocal(repo, dir);
            }
        } catch (RuntimeException e) {
            new Workspace(dir, repo).close();
            throw e;
        }
        return new Workspace(dir, repo);
    }

    private boolean isRemote(String repo) {
        return allowedSchemes.stream().anyMatch(repo::startsWith);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private Path createWorkspaceDir(String jobTag) {
        try {
            Files.createDirectories(baseDir);
            return Files.createTempDirectory(baseDir, tempPrefix + jobTag + "-");
        } catch (IOException e) {
            throw new AcquisitionException(AcquisitionException.Kind.WORKSPACE_ERROR,
                    "Could not create workspace directory under " + baseDir + ": " + e.getMessage(), e);
        }
    }

    private void clone(String repo, Path dir) {
        log.info("Cloning repository {} into {}", repo, dir);
        // "--" keeps a hostile URL from being read as a git option.
        List<String> cmd = List.of("git", "clone", "--quiet", "--", repo, dir.toString());
        CommandOutcome outcome = runner.run(cmd, baseDir, GIT_ENV, cloneTimeout);

        if (outcome instanceof CommandOutcome.Completed done) {
            if (!done.succeeded()) {
                throw new AcquisitionException(AcquisitionException.Kind.CLONE_FAILED,
                        "Failed to clone repository " + repo + " (exit " + done.exitCode() + "): "
                        + done.stderr().strip());
            }
            log.info("Repository cloned in {} ms", done.elapsed().toMillis());
        } else if (outcome instanceof CommandOutcome.TimedOut timedOut) {
            throw new AcquisitionException(AcquisitionException.Kind.CLONE_TIMED_OUT,
                    "Repository clone timed out after " + timedOut.timeout().toSeconds() + " seconds: " + repo);
        } else if (outcome instanceof CommandOutcome.LaunchFailed failed) {
            throw new AcquisitionException(AcquisitionException.Kind.CLONE_FAILED,
                    "Could not run git clone: " + failed.message());
        }
    }

    private void copyLocal(String repo, Path dir) {
        Path source = resolveLocal(repo);
        if (!Files.isDirectory(source)) {
            throw new AcquisitionException(AcquisitionException.Kind.INVALID_LOCAL_PATH,
                    "Local repository path does not exist or is not a directory: " + repo);
        }
        if (dir.toAbsolutePath().normalize().startsWith(source)) {
            throw new AcquisitionException(AcquisitionException.Kind.COPY_FAILED,
                    "Workspace directory " + dir + " lies inside the repository being copied: " + repo);
        }
        log.info("Copying local repository {} into {}", source, dir);
        try {
            FileSystemUtils.copyRecursively(source, dir);
        } catch (IOException e) {
            throw new AcquisitionException(AcquisitionException.Kind.COPY_FAILED,
                    "Failed to copy local repository " + repo + ": " + e.getMessage(), e);
        }
    }

    private static Path resolveLocal(String repo) {
        if (repo.equals("~") || repo.startsWith("~/")) {
            return Path.of(System.getProperty("user.home"), repo.substring(1).replaceFirst("^/", ""))
                    .toAbsolutePath().normalize();
        }
        return Path.of(repo).toAbsolutePath().normalize();
    }
}
