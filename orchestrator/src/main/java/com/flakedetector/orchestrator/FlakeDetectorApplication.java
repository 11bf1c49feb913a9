package com.flakedetector.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Flaky test detector: reruns a test command many times in parallel, each run
 * with a fresh seed, and reports how often it fails.
 *
 * To run:
 *   mvn -pl orchestrator spring-boot:run
 *   SPRING_PROFILES_ACTIVE=json mvn -pl orchestrator spring-boot:run   # JSON logs
 */
@SpringBootApplication
public class FlakeDetectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlakeDetectorApplication.class, args);
    }
}
