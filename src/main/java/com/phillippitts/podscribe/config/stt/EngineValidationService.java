package com.phillippitts.podscribe.config.stt;

import com.phillippitts.podscribe.service.stt.TranscriptionEngine;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Fail-fast startup check that the configured engine can run.
 *
 * <p>Aborts startup with {@link com.phillippitts.podscribe.exception.EngineNotAvailableException} when
 * the engine binary is not installed, instead of failing every episode later. Disabled in tests via
 * {@code podscribe.engine.validation.enabled=false}; the engine then initializes lazily on first use.
 */
@Component
@ConditionalOnProperty(name = "podscribe.engine.validation.enabled", havingValue = "true", matchIfMissing = true)
class EngineValidationService {

    private static final Logger LOG = LogManager.getLogger(EngineValidationService.class);

    private final TranscriptionEngine engine;
    private final TranscriptionEngineProperties props;

    EngineValidationService(TranscriptionEngine engine, TranscriptionEngineProperties props) {
        this.engine = engine;
        this.props = props;
    }

    @PostConstruct
    void validateOnStartup() {
        LOG.info("Validating transcription engine: type={}, model={}, device={}, os={}, arch={}",
                props.getType(), props.getModel(), props.getDevice(),
                System.getProperty("os.name"), System.getProperty("os.arch"));
        engine.initialize();
        LOG.info("Transcription engine validated: {}", engine.getEngineName());
    }
}
