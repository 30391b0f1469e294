package com.phillippitts.podscribe.config.stt;

import com.phillippitts.podscribe.service.stt.TranscriptionEngine;
import com.phillippitts.podscribe.service.stt.whisper.FasterWhisperEngine;
import com.phillippitts.podscribe.service.stt.whisper.OpenAiWhisperEngine;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the single transcription engine for this process from {@code podscribe.engine.type}.
 */
@Configuration
@EnableConfigurationProperties(TranscriptionEngineProperties.class)
public class TranscriptionEngineConfig {

    /**
     * Default engine. Active when podscribe.engine.type is faster-whisper or missing.
     */
    @Bean
    @ConditionalOnProperty(prefix = "podscribe.engine", name = "type", havingValue = "faster-whisper",
            matchIfMissing = true)
    public TranscriptionEngine fasterWhisperEngine(TranscriptionEngineProperties props,
                                                   ApplicationEventPublisher publisher) {
        return new FasterWhisperEngine(props, publisher);
    }

    /**
     * Reference implementation. Active when podscribe.engine.type=openai-whisper.
     */
    @Bean
    @ConditionalOnProperty(prefix = "podscribe.engine", name = "type", havingValue = "openai-whisper")
    public TranscriptionEngine openAiWhisperEngine(TranscriptionEngineProperties props,
                                                   ApplicationEventPublisher publisher) {
        return new OpenAiWhisperEngine(props, publisher);
    }
}
