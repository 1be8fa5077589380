package com.saletracker.tracker.application.job;

import com.saletracker.tracker.application.service.NotificationDispatcher;
import com.saletracker.tracker.domain.poll.PricePollEngine;
import io.micrometer.core.instrument.Counter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs poll rounds on a fixed delay, plus on demand.
 * The fixed delay keeps scheduled rounds from overlapping each other; a forced round may overlap
 * a scheduled one, which the engine tolerates.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PricePollJob {

    private final PricePollEngine pricePollEngine;
    private final NotificationDispatcher notificationDispatcher;
    private final Counter pollRoundsCounter;

    @Scheduled(fixedDelayString = "${tracker.poll.interval}", initialDelayString = "${tracker.poll.interval}")
    public void runScheduledRound() {
        runRound("scheduled");
    }

    @Async
    public void runRoundAsync(String trigger) {
        runRound(trigger);
    }

    public int runRound(String trigger) {
        log.info("poll.round.begin: trigger={}", trigger);
        var started = System.currentTimeMillis();
        try {
            var delivered = notificationDispatcher.dispatch(pricePollEngine.poll());
            pollRoundsCounter.increment();
            log.info("poll.round.end: trigger={}, notifications={}, elapsed_ms={}",
                    trigger, delivered, System.currentTimeMillis() - started);
            return delivered;
        } catch (RuntimeException e) {
            log.error("Poll round failed: trigger={}", trigger, e);
            return 0;
        }
    }
}
