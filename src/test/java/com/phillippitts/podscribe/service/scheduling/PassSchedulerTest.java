package com.phillippitts.podscribe.service.scheduling;

import com.phillippitts.podscribe.domain.PassSummary;
import com.phillippitts.podscribe.exception.StateStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PassSchedulerTest {

    private PipelineService pipeline;
    private final List<Throwable> fatalErrors = new ArrayList<>();
    private PassScheduler scheduler;

    @BeforeEach
    void setUp() {
        pipeline = mock(PipelineService.class);
        scheduler = new PassScheduler(pipeline, fatalErrors::add);
    }

    private static PassSummary summary(String passId, int feedErrors) {
        Instant t = Instant.parse("2024-05-08T12:00:00Z");
        return new PassSummary(passId, t, t.plusSeconds(30), 3, 2, 2, 0, 0, feedErrors);
    }

    @Test
    void startsIdleAndSleepsAfterAPass() {
        when(pipeline.runPass(anyString())).thenReturn(summary("p", 0));
        assertThat(scheduler.getState()).isEqualTo(PassScheduler.State.IDLE);

        Optional<PassSummary> result = scheduler.trigger();

        assertThat(result).isPresent();
        assertThat(scheduler.getState()).isEqualTo(PassScheduler.State.SLEEPING);
        assertThat(scheduler.getPassCount()).isEqualTo(1);
        assertThat(scheduler.getLastSummary()).isEqualTo(result);
        assertThat(scheduler.isPassInFlight()).isFalse();
    }

    @Test
    void triggerWhilePassRunsIsRejected() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(pipeline.runPass(anyString())).thenAnswer(inv -> {
            release.await(5, TimeUnit.SECONDS);
            return summary("slow", 0);
        });

        CompletableFuture<Optional<PassSummary>> first = CompletableFuture.supplyAsync(scheduler::trigger);
        await().atMost(5, TimeUnit.SECONDS).until(scheduler::isPassInFlight);
        assertThat(scheduler.getState()).isEqualTo(PassScheduler.State.RUNNING);

        Optional<PassSummary> second = scheduler.trigger();
        release.countDown();

        assertThat(second).isEmpty();
        assertThat(first.get(5, TimeUnit.SECONDS)).isPresent();
        verify(pipeline, times(1)).runPass(anyString());
    }

    @Test
    void stateStoreFailureStopsSchedulerAndReportsFatalError() {
        StateStoreException failure = new StateStoreException("Cannot append to state file", "state.log",
                new IOException("read-only file system"));
        when(pipeline.runPass(anyString())).thenThrow(failure);

        Optional<PassSummary> result = scheduler.trigger();

        assertThat(result).isEmpty();
        assertThat(scheduler.getState()).isEqualTo(PassScheduler.State.STOPPED);
        assertThat(fatalErrors).containsExactly(failure);

        scheduler.trigger();
        verify(pipeline, times(1)).runPass(anyString());
    }

    @Test
    void otherErrorsAbortOnlyTheCurrentPass() {
        when(pipeline.runPass(anyString()))
                .thenThrow(new IllegalStateException("unexpected"))
                .thenReturn(summary("p2", 1));

        assertThat(scheduler.trigger()).isEmpty();
        assertThat(scheduler.getState()).isEqualTo(PassScheduler.State.SLEEPING);
        assertThat(scheduler.trigger()).map(PassSummary::feedErrors).contains(1);
        assertThat(fatalErrors).isEmpty();
        assertThat(scheduler.getPassCount()).isEqualTo(1);
    }

    @Test
    void stoppedSchedulerIgnoresTriggers() {
        scheduler.stop();

        assertThat(scheduler.trigger()).isEmpty();
        assertThat(scheduler.getState()).isEqualTo(PassScheduler.State.STOPPED);
        verify(pipeline, never()).runPass(anyString());
    }
}
