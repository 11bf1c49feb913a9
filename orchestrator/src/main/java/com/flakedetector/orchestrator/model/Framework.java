package com.flakedetector.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Optional;

/**
 * Test-runner family of the repository under test.
 *
 * Each variant carries everything the pipeline needs to know about it:
 * <ul>
 *   <li>marker files: the variant matches when any of them exists at the repo root;</li>
 *   <li>package dependency: for Node variants, the package.json dependency that must
 *       also be declared (dependencies or devDependencies);</li>
 *   <li>the manifest file that gates dependency installation and the install command;</li>
 *   <li>the environment variable that receives the per-run seed.</li>
 * </ul>
 *
 * Declaration order is detection priority: the first matching variant wins.
 */
public enum Framework {

    GO("go",
            List.of("go.mod"), null,
            "go.mod", List.of("go", "mod", "download"),
            "GO_TEST_SEED"),
    TS_JEST("ts-jest",
            List.of("package.json"), "jest",
            "package.json", List.of("npm", "install", "--silent"),
            "JEST_SEED"),
    TS_VITEST("ts-vitest",
            List.of("package.json"), "vitest",
            "package.json", List.of("npm", "install", "--silent"),
            "VITE_TEST_SEED"),
    JS_MOCHA("js-mocha",
            List.of("package.json"), "mocha",
            "package.json", List.of("npm", "install", "--silent"),
            "MOCHA_SEED"),
    PYTHON("python",
            List.of("requirements.txt", "pyproject.toml", "setup.py"), null,
            "requirements.txt", List.of("pip", "install", "-q", "-r", "requirements.txt"),
            "TEST_SEED"),
    UNKNOWN("unknown",
            List.of(), null,
            null, List.of(),
            "TEST_SEED");

    private final String       wireName;
    private final List<String> markerFiles;
    private final String       packageDependency;
    private final String       manifestFile;
    private final List<String> installCommand;
    private final String       seedVariable;

    Framework(String wireName,
              List<String> markerFiles,
              String packageDependency,
              String manifestFile,
              List<String> installCommand,
              String seedVariable) {
        this.wireName          = wireName;
        this.markerFiles       = markerFiles;
        this.packageDependency = packageDependency;
        this.manifestFile      = manifestFile;
        this.installCommand    = installCommand;
        this.seedVariable      = seedVariable;
    }

    @JsonValue
    public String wireName()             { return wireName; }
    public List<String> markerFiles()    { return markerFiles; }
    public List<String> installCommand() { return installCommand; }
    public String seedVariable()         { return seedVariable; }

    /** Present only for the Node variants, which share package.json as their marker. */
    public Optional<String> packageDependency() {
        return Optional.ofNullable(packageDependency);
    }

    /** Empty for {@link #UNKNOWN}, which has nothing to install. */
    public Optional<String> manifestFile() {
        return Optional.ofNullable(manifestFile);
    }

    /**
     * Parse a wire name. The long names used by older clients
     * ("typescript-jest", "typescript-vitest", "javascript-mocha") are accepted too.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static Framework fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("framework must not be null");
        }
        String v = value.trim().toLowerCase();
        for (Framework f : values()) {
            if (f.wireName.equals(v)) return f;
        }
        return switch (v) {
            case "typescript-jest"   -> TS_JEST;
            case "typescript-vitest" -> TS_VITEST;
            case "javascript-mocha"  -> JS_MOCHA;
            default -> throw new IllegalArgumentException("Unknown framework: '" + value + "'");
        };
    }

    @Override
    public String toString() {
        return wireName;
    }
}
