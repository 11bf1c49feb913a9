package com.flakedetector.orchestrator.validation;

import com.flakedetector.orchestrator.model.JobRequest;
import com.flakedetector.orchestrator.process.CommandTokenizer;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks a {@link JobRequest} against shape and range constraints.
 *
 * Checks run in a fixed order (repo, test_command, runs, parallelism) and the
 * first violation is reported. No I/O of any kind happens here: a local repo
 * path is only checked for shape, its existence is the acquirer's concern.
 */
public class JobRequestValidator {

    public static final int MIN_RUNS        = 1;
    public static final int MAX_RUNS        = 1000;
    public static final int MIN_PARALLELISM = 1;
    public static final int MAX_PARALLELISM = 50;

    // Any "scheme://" or scp-style "user@host:" remote.
    private static final Pattern URL_LIKE = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*://.*");
    private static final Pattern SCP_LIKE = Pattern.compile("^[\\w.-]+@[\\w.-]+:.*");

    private static final List<String> LOCAL_PATH_PREFIXES = List.of("/", "./", "../", "~/");

    private final List<String> allowedSchemes;

    public JobRequestValidator(List<String> allowedSchemes) {
        this.allowedSchemes = List.copyOf(allowedSchemes);
    }

    /**
     * @return the same request, unchanged
     * @throws JobValidationException naming the first violated field and constraint
     */
    public JobRequest validate(JobRequest request) {
        if (request == null) {
            throw new JobValidationException("request", "must not be null");
        }
        validateRepo(request.repo());
        validateTestCommand(request.testCommand());

        if (request.runs() < MIN_RUNS || request.runs() > MAX_RUNS) {
            throw new JobValidationException("runs",
                    "must be between %d and %d, got %d".formatted(MIN_RUNS, MAX_RUNS, request.runs()));
        }
        if (request.parallelism() < MIN_PARALLELISM || request.parallelism() > MAX_PARALLELISM) {
            throw new JobValidationException("parallelism",
                    "must be between %d and %d, got %d".formatted(
                            MIN_PARALLELISM, MAX_PARALLELISM, request.parallelism()));
        }
        return request;
    }

    // ------------------------------------------------------------------
    // Field checks
    // ------------------------------------------------------------------

    private void validateRepo(String repo) {
        if (repo == null || repo.isBlank()) {
            throw new JobValidationException("repo", "is required");
        }
        if (!repo.equals(repo.strip()) || repo.chars().anyMatch(Character::isISOControl)) {
            throw new JobValidationException("repo", "must not contain surrounding whitespace or control characters");
        }

        for (String scheme : allowedSchemes) {
            if (repo.startsWith(scheme)) {
                if (repo.length() == scheme.length() || repo.chars().anyMatch(Character::isWhitespace)) {
                    throw new JobValidationException("repo", "invalid repository URL: " + repo);
                }
                return;
            }
        }
        if (URL_LIKE.matcher(repo).matches() || SCP_LIKE.matcher(repo).matches()) {
            throw new JobValidationException("repo",
                    "URL scheme not allowed (allowed: %s): %s".formatted(allowedSchemes, repo));
        }

        boolean pathShaped = repo.equals(".") || repo.equals("..")
                || LOCAL_PATH_PREFIXES.stream().anyMatch(repo::startsWith);
        if (!pathShaped) {
            throw new JobValidationException("repo",
                    "must be a URL starting with one of %s or a local path starting with one of %s: %s"
                            .formatted(allowedSchemes, LOCAL_PATH_PREFIXES, repo));
        }
        try {
            Path.of(repo);
        } catch (InvalidPathException e) {
            throw new JobValidationException("repo", "invalid local path: " + e.getReason());
        }
    }

    private static void validateTestCommand(String testCommand) {
        if (testCommand == null || testCommand.isBlank()) {
            throw new JobValidationException("test_command", "is required");
        }
        try {
            CommandTokenizer.tokenize(testCommand);
        } catch (IllegalArgumentException e) {
            throw new JobValidationException("test_command", "cannot be parsed: " + e.getMessage());
        }
    }
}
