package com.phillippitts.podscribe.service.stt.watchdog;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EngineFailureListenerTest {

    /** Clock whose instant the test moves forward by hand. */
    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-05-01T10:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    @Test
    void throttlesRepeatLogsWithinWindow() {
        MutableClock clock = new MutableClock();
        EngineFailureListener l = new EngineFailureListener(clock);

        assertThat(l.shouldLog("faster-whisper-transcription failure")).isTrue();
        assertThat(l.shouldLog("faster-whisper-transcription failure")).isFalse();
        assertThat(l.shouldLog("openai-whisper-transcription failure")).isTrue();

        clock.advance(EngineFailureListener.THROTTLE.plusSeconds(1));
        assertThat(l.shouldLog("faster-whisper-transcription failure")).isTrue();
    }

    @Test
    void handlerDoesNotThrow() {
        EngineFailureListener l = new EngineFailureListener(Clock.systemUTC());

        l.onEngineFailure(new EngineFailureEvent("faster-whisper", Instant.now(), "transcription failure",
                new RuntimeException("boom"), Map.of("audio", "a.mp3")));
        l.onEngineFailure(new EngineFailureEvent("faster-whisper", null, "transcription failure", null, null));
        assertThat(true).isTrue();
    }

    @Test
    void eventCopiesContext() {
        Map<String, String> ctx = new HashMap<>();
        ctx.put("audio", "a.mp3");
        EngineFailureEvent e = new EngineFailureEvent("faster-whisper", null, "m", null, ctx);
        ctx.put("model", "large");

        assertThat(e.context()).containsOnlyKeys("audio");
        assertThat(e.at()).isNotNull();
        assertThat(new EngineFailureEvent("x", null, "m", null, null).context()).isEmpty();
    }
}
