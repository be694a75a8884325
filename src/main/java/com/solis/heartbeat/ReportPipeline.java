package com.solis.heartbeat;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Work executed once per scheduled cycle while the run lock is held.
 */
@FunctionalInterface
public interface ReportPipeline {

    /**
     * @return path of the report written for {@code reportDate}, or empty when the cycle produced none
     */
    Optional<Path> run(LocalDate reportDate) throws Exception;
}
