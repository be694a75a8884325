package com.solis.app;

import org.apache.commons.cli.Options;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SolisApplicationTest {

    @TempDir
    Path tempDir;

    @Test
    void runShouldPrintHelpAndExitZero() {
        assertEquals(SolisApplication.EXIT_OK, new SolisApplication().run(new String[]{"--help"}, tempDir));
    }

    @Test
    void runShouldRejectUnknownOption() {
        assertEquals(SolisApplication.EXIT_USAGE, new SolisApplication().run(new String[]{"--bogus"}, tempDir));
    }

    @Test
    void runShouldRejectConflictingModes() {
        assertEquals(SolisApplication.EXIT_USAGE, new SolisApplication().run(new String[]{"--once", "--status"}, tempDir));
    }

    @Test
    void optionsShouldExposeEveryMode() {
        Options options = SolisApplication.buildOptions();

        for (String mode : new String[]{"once", "schedule", "status", "clear-cache", "help"}) {
            assertTrue(options.hasLongOption(mode), mode);
        }
        assertTrue(options.getOption("clear-cache").hasOptionalArg());
        assertFalse(options.getOption("once").hasArg());
    }
}
