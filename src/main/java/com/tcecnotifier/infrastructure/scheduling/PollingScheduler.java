package com.tcecnotifier.infrastructure.scheduling;

import com.tcecnotifier.application.usecase.PollCurrentGameUseCase;
import com.tcecnotifier.domain.ports.OperatorLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs a polling turn with a fixed delay between the end of one turn and the start of the next.
 */
@Component
public class PollingScheduler {

    private static final Logger logger = LoggerFactory.getLogger(PollingScheduler.class);

    private final PollCurrentGameUseCase pollCurrentGameUseCase;
    private final OperatorLog log;

    public PollingScheduler(PollCurrentGameUseCase pollCurrentGameUseCase, OperatorLog log) {
        this.pollCurrentGameUseCase = pollCurrentGameUseCase;
        this.log = log;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.start();
    }

    @Scheduled(fixedDelayString = "${tcec.poll-delay:30000}", initialDelayString = "${tcec.initial-delay:1000}")
    public void poll() {
        try {
            PollCurrentGameUseCase.PollSummary summary = pollCurrentGameUseCase.execute();
            logger.debug("Polling turn finished: {}", summary.status());
        } catch (RuntimeException e) {
            // keep the schedule alive; the next turn retries
            logger.error("Polling turn failed", e);
            log.error("Polling turn failed: " + e.getMessage());
        }
    }
}
