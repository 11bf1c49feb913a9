package com.flakedetector.orchestrator.execution;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Supplies the random seed injected into each run. Called concurrently from
 * run threads, once per run.
 */
@FunctionalInterface
public interface SeedSource {

    int nextSeed();

    /** Independent uniform draws from [min, max). */
    static SeedSource uniform(int min, int max) {
        if (min >= max) {
            throw new IllegalArgumentException("seed range [%d, %d) is empty".formatted(min, max));
        }
        return () -> ThreadLocalRandom.current().nextInt(min, max);
    }
}
