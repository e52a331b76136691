package com.tcecnotifier.infrastructure.scheduling;

import com.tcecnotifier.application.usecase.PollCurrentGameUseCase;
import com.tcecnotifier.application.usecase.PollCurrentGameUseCase.PollSummary;
import com.tcecnotifier.domain.ports.OperatorLog;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PollingScheduler.
 */
class PollingSchedulerTest {

    @Test
    void testFailedTurnIsReportedToOperatorLog() {
        TestOperatorLog log = new TestOperatorLog();
        PollingScheduler scheduler = new PollingScheduler(new FailingUseCase(log), log);

        assertDoesNotThrow(scheduler::poll);

        assertEquals(1, log.errors.size());
        assertTrue(log.errors.get(0).startsWith("Polling turn failed"));
        assertTrue(log.errors.get(0).contains("hash unavailable"));
    }

    @Test
    void testStartIsAnnouncedWhenReady() {
        TestOperatorLog log = new TestOperatorLog();
        PollingScheduler scheduler = new PollingScheduler(new FailingUseCase(log), log);

        scheduler.onReady();

        assertEquals(1, log.starts);
        assertTrue(log.errors.isEmpty());
    }

    /**
     * Use case whose turn always dies with an unexpected exception.
     */
    private static class FailingUseCase extends PollCurrentGameUseCase {

        FailingUseCase(OperatorLog log) {
            super(null, null, null, null, log);
        }

        @Override
        public synchronized PollSummary execute() {
            throw new IllegalStateException("hash unavailable");
        }
    }

    private static class TestOperatorLog implements OperatorLog {
        private final List<String> errors = new ArrayList<>();
        private int starts;

        @Override
        public void start() {
            starts++;
        }

        @Override
        public void info(String message) {
        }

        @Override
        public void warning(String message) {
        }

        @Override
        public void error(String message) {
            errors.add(message);
        }
    }
}
