package com.tcecnotifier.infrastructure.rest;

import com.tcecnotifier.application.usecase.PollCurrentGameUseCase;
import com.tcecnotifier.domain.ports.SeenGameRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Set;
import java.util.TreeSet;

/**
 * REST controller for the notifier.
 */
@RestController
@RequestMapping("/games")
public class GameController {

    private static final Logger logger = LoggerFactory.getLogger(GameController.class);

    private final PollCurrentGameUseCase pollCurrentGameUseCase;
    private final SeenGameRepository seenGames;

    public GameController(PollCurrentGameUseCase pollCurrentGameUseCase, SeenGameRepository seenGames) {
        this.pollCurrentGameUseCase = pollCurrentGameUseCase;
        this.seenGames = seenGames;
    }

    /**
     * Runs a polling turn now instead of waiting for the scheduler.
     *
     * POST /games/poll
     *
     * @return Summary of the turn
     */
    @PostMapping("/poll")
    public ResponseEntity<PollCurrentGameUseCase.PollSummary> poll() {
        logger.info("Received request to poll the live game");

        try {
            PollCurrentGameUseCase.PollSummary summary = pollCurrentGameUseCase.execute();
            logger.info("Poll completed with status {}", summary.status());

            return ResponseEntity.ok(summary);
        } catch (Exception e) {
            logger.error("Error polling the live game", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * GET /games/status
     */
    @GetMapping("/status")
    public ResponseEntity<StatusResponse> status() {
        StatusResponse response = new StatusResponse(
            seenGames.size(),
            new TreeSet<>(pollCurrentGameUseCase.getNotifyConfig().engines().keySet())
        );
        return ResponseEntity.ok(response);
    }

    public record StatusResponse(int seenGames, Set<String> subscribedEngines) {}
}
