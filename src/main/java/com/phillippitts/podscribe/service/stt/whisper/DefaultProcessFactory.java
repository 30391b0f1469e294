package com.phillippitts.podscribe.service.stt.whisper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Starts Whisper command-line tools as child processes.
 *
 * <p>Both supported engines are Python programs. Unbuffered stdout keeps segment lines flowing while
 * an episode is transcribed, and a UTF-8 stdio encoding keeps non-ASCII titles and text intact when
 * the host locale is not UTF-8.
 */
final class DefaultProcessFactory implements ProcessFactory {

    static final Map<String, String> PYTHON_ENVIRONMENT = Map.of(
            "PYTHONUNBUFFERED", "1",
            "PYTHONIOENCODING", "utf-8");

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command)
                .redirectInput(ProcessBuilder.Redirect.PIPE)
                .redirectErrorStream(false);
        if (workingDir != null) {
            builder.directory(workingDir.toFile());
        }
        builder.environment().putAll(PYTHON_ENVIRONMENT);
        return builder.start();
    }
}
