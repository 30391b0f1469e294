package com.phillippitts.podscribe.service.stt.whisper;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@EnabledOnOs({OS.LINUX, OS.MAC})
class DefaultProcessFactoryTest {

    @TempDir
    Path tmp;

    @Test
    void childSeesPythonEnvironmentAndWorkingDirectory() throws Exception {
        Process process = new DefaultProcessFactory().start(
                List.of("sh", "-c", "printf '%s|%s|' \"$PYTHONUNBUFFERED\" \"$PYTHONIOENCODING\"; pwd"),
                tmp);

        assertThat(process.waitFor(10, TimeUnit.SECONDS)).isTrue();
        String out = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();

        assertThat(out).startsWith("1|utf-8|");
        assertThat(Path.of(out.substring("1|utf-8|".length())).toRealPath()).isEqualTo(tmp.toRealPath());
    }
}
