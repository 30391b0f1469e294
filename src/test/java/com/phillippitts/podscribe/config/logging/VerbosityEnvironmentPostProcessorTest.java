package com.phillippitts.podscribe.config.logging;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import static org.assertj.core.api.Assertions.assertThat;

class VerbosityEnvironmentPostProcessorTest {

    private final VerbosityEnvironmentPostProcessor processor = new VerbosityEnvironmentPostProcessor();

    @Test
    void leavesLevelsAloneByDefault() {
        MockEnvironment env = new MockEnvironment();

        processor.postProcessEnvironment(env, null);

        assertThat(env.getPropertySources().contains(VerbosityEnvironmentPostProcessor.SOURCE_NAME)).isFalse();
        assertThat(env.getProperty(VerbosityEnvironmentPostProcessor.APP_LOGGER)).isNull();
    }

    @Test
    void switchRaisesApplicationLoggersToDebug() {
        MockEnvironment env = new MockEnvironment().withProperty(VerbosityEnvironmentPostProcessor.SWITCH, "true");

        processor.postProcessEnvironment(env, null);

        assertThat(env.getProperty(VerbosityEnvironmentPostProcessor.APP_LOGGER)).isEqualTo("DEBUG");
    }

    @Test
    void explicitLevelWins() {
        MockEnvironment env = new MockEnvironment()
                .withProperty(VerbosityEnvironmentPostProcessor.SWITCH, "true")
                .withProperty(VerbosityEnvironmentPostProcessor.APP_LOGGER, "WARN");

        processor.postProcessEnvironment(env, null);

        assertThat(env.getProperty(VerbosityEnvironmentPostProcessor.APP_LOGGER)).isEqualTo("WARN");
    }
}
