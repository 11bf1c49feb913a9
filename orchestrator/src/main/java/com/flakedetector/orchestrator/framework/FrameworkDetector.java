package com.flakedetector.orchestrator.framework;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flakedetector.orchestrator.model.Framework;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the {@link Framework} of an acquired repository.
 *
 * An explicit override is returned as-is. Otherwise the variants are tried in
 * declaration order and the first whose marker file exists at the repo root
 * (and, for Node variants, whose package is declared in package.json) wins.
 * Read-only: nothing in the tree is modified.
 */
public class FrameworkDetector {

    private static final Logger log = LoggerFactory.getLogger(FrameworkDetector.class);

    private static final String PACKAGE_JSON = "package.json";

    private final ObjectMapper objectMapper;

    public FrameworkDetector(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Framework detect(Path root, Optional<Framework> override) {
        if (override.isPresent()) {
            log.info("Using explicit framework: {}", override.get());
            return override.get();
        }
        Framework detected = detect(root);
        log.info("Detected framework: {}", detected);
        return detected;
    }

    public Framework detect(Path root) {
        Set<String> nodeDeps = null;   // parsed on first use
        for (Framework f : Framework.values()) {
            if (f == Framework.UNKNOWN || !hasAnyMarker(root, f)) {
                continue;
            }
            if (f.packageDependency().isEmpty()) {
                return f;
            }
            if (nodeDeps == null) {
                nodeDeps = declaredNodeDependencies(root);
            }
            if (nodeDeps.contains(f.packageDependency().get())) {
                return f;
            }
        }
        return Framework.UNKNOWN;
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private static boolean hasAnyMarker(Path root, Framework f) {
        return f.markerFiles().stream().anyMatch(m -> Files.isRegularFile(root.resolve(m)));
    }

    /**
     * Union of "dependencies" and "devDependencies" keys. An unreadable or
     * malformed package.json yields an empty set so detection falls through.
     */
    private Set<String> declaredNodeDependencies(Path root) {
        Set<String> deps = new HashSet<>();
        Path pkg = root.resolve(PACKAGE_JSON);
        try {
            JsonNode tree = objectMapper.readTree(pkg.toFile());
            if (tree == null) {
                return deps;
            }
            for (String section : new String[] {"dependencies", "devDependencies"}) {
                JsonNode node = tree.path(section);
                for (Iterator<String> it = node.fieldNames(); it.hasNext(); ) {
                    deps.add(it.next());
                }
            }
        } catch (IOException e) {
            log.warn("Ignoring unreadable {}: {}", pkg, e.getMessage());
        }
        return deps;
    }
}
