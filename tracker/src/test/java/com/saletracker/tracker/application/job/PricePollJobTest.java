package com.saletracker.tracker.application.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

import com.saletracker.common.event.NotificationEvent;
import com.saletracker.tracker.application.service.NotificationDispatcher;
import com.saletracker.tracker.domain.poll.PricePollEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PricePollJobTest {

    @Mock
    PricePollEngine pricePollEngine;

    @Mock
    NotificationDispatcher notificationDispatcher;

    private SimpleMeterRegistry meterRegistry;
    private PricePollJob job;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        job = new PricePollJob(pricePollEngine, notificationDispatcher, meterRegistry.counter("tracker.poll.rounds"));
    }

    @Test
    void shouldDispatchRoundAndCountIt() {
        // given
        Stream<NotificationEvent> events = Stream.empty();
        given(pricePollEngine.poll()).willReturn(events);
        given(notificationDispatcher.dispatch(events)).willReturn(3);

        // when
        var delivered = job.runRound("scheduled");

        // then
        assertThat(delivered).isEqualTo(3);
        assertThat(meterRegistry.counter("tracker.poll.rounds").count()).isEqualTo(1.0);
    }

    @Test
    void shouldSurviveFailedRoundSoNextTickStillRuns() {
        // given
        given(pricePollEngine.poll()).willThrow(new IllegalStateException("boom"));

        // when
        var delivered = job.runRound("scheduled");

        // then
        assertThat(delivered).isZero();
        assertThat(meterRegistry.counter("tracker.poll.rounds").count()).isZero();
        then(notificationDispatcher).should(never()).dispatch(any());
    }
}
