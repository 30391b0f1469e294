package com.phillippitts.podscribe.config.logging;

import com.phillippitts.podscribe.domain.EpisodeCandidate;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineLogContextTest {

    @AfterEach
    void clear() {
        ThreadContext.clearMap();
    }

    @Test
    void episodeScopeNestsInsidePassScope() {
        EpisodeCandidate candidate = EpisodeCandidate.imported("0123456789abcdef", "Dropped",
                Path.of("/import/Dropped.mp3"), false);

        try (PipelineLogContext pass = PipelineLogContext.forPass("p-42")) {
            try (PipelineLogContext episode = PipelineLogContext.forEpisode(candidate)) {
                assertThat(ThreadContext.get(PipelineLogContext.PASS_ID)).isEqualTo("p-42");
                assertThat(ThreadContext.get(PipelineLogContext.EPISODE_ID)).isEqualTo("01234567");
                assertThat(ThreadContext.get(PipelineLogContext.SOURCE)).isEqualTo("IMPORT");
            }
            assertThat(ThreadContext.containsKey(PipelineLogContext.EPISODE_ID)).isFalse();
            assertThat(ThreadContext.containsKey(PipelineLogContext.SOURCE)).isFalse();
            assertThat(ThreadContext.get(PipelineLogContext.PASS_ID)).isEqualTo("p-42");
        }
        assertThat(ThreadContext.isEmpty()).isTrue();
    }
}
