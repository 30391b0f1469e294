package com.phillippitts.podscribe.service.stt.whisper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so the CLI engines can be tested hermetically.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests provide a stub that returns a fake
 * {@link Process} with controlled stdout, stderr, exit code and side effects on the output directory.
 */
interface ProcessFactory {
    /**
     * @param command    full command line, executable first
     * @param workingDir working directory for the process (may be null)
     * @return started process
     * @throws IOException if the process cannot be started (binary missing, not executable)
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
