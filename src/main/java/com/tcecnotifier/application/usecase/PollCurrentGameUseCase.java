package com.tcecnotifier.application.usecase;

import com.tcecnotifier.domain.model.NotifyConfig;
import com.tcecnotifier.domain.model.NotifyContent;
import com.tcecnotifier.domain.model.PgnGame;
import com.tcecnotifier.domain.ports.GameFeedGateway;
import com.tcecnotifier.domain.ports.NotificationGateway;
import com.tcecnotifier.domain.ports.NotifyConfigGateway;
import com.tcecnotifier.domain.ports.OperatorLog;
import com.tcecnotifier.domain.ports.SeenGameRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Use case for one polling turn: refresh the subscriber configuration, read the
 * live game and announce it if it is new and out of book.
 *
 * Turns never overlap; the seen-games store is only touched from here.
 */
@Service
public class PollCurrentGameUseCase {

    private static final Logger logger = LoggerFactory.getLogger(PollCurrentGameUseCase.class);

    private final GameFeedGateway gameFeed;
    private final NotifyConfigGateway notifyConfigGateway;
    private final NotificationGateway notificationGateway;
    private final SeenGameRepository seenGames;
    private final OperatorLog log;

    private NotifyConfig notifyConfig = NotifyConfig.empty();
    private boolean configLoaded;
    private boolean firstRun = true;

    public PollCurrentGameUseCase(
            GameFeedGateway gameFeed,
            NotifyConfigGateway notifyConfigGateway,
            NotificationGateway notificationGateway,
            SeenGameRepository seenGames,
            OperatorLog log) {
        this.gameFeed = gameFeed;
        this.notifyConfigGateway = notifyConfigGateway;
        this.notificationGateway = notificationGateway;
        this.seenGames = seenGames;
        this.log = log;
    }

    /**
     * Runs one polling turn.
     *
     * @return Summary of the turn
     */
    public synchronized PollSummary execute() {
        refreshNotifyConfig();

        PgnGame game;
        try {
            game = gameFeed.fetchCurrentGame();
        } catch (Exception e) {
            log.warning("Unable to fetch in-progress game: " + e.getMessage());
            logger.debug("Fetch failure", e);
            return PollSummary.failed(e.getMessage());
        }

        // A game still in its opening hasn't 'started' yet
        if (!game.outOfBook()) {
            logger.debug("Game {} is still in book", game);
            return PollSummary.of(PollStatus.IN_BOOK, game, Set.of());
        }

        if (firstRun) {
            log.info(String.format("In progress: `%s` vs `%s` (%d plies)",
                game.getWhitePlayer(), game.getBlackPlayer(), game.getMoves().size()));
            firstRun = false;
        }

        if (seenGames.contains(game)) {
            return PollSummary.of(PollStatus.ALREADY_SEEN, game, Set.of());
        }

        log.info(String.format("`%s` vs `%s`", game.getWhitePlayer(), game.getBlackPlayer()));

        Set<String> mentions = new LinkedHashSet<>();
        for (Map.Entry<String, Set<String>> entry : notifyConfig.engines().entrySet()) {
            if (game.hasPlayer(entry.getKey())) {
                mentions.addAll(entry.getValue());
                log.info(String.format("Will notify %d users for engine `%s`",
                    entry.getValue().size(), entry.getKey()));
            }
        }

        try {
            notificationGateway.notify(NotifyContent.forGame(game, mentions));
        } catch (Exception e) {
            log.error("Unable to send notify: " + e.getMessage());
            logger.error("Notification failure", e);
        }

        // Recorded even when persisting fails, so this run won't announce it twice
        try {
            seenGames.add(game);
        } catch (Exception e) {
            log.error("Unable to write seen game to file: " + e.getMessage());
            logger.error("State write failure", e);
        }

        return PollSummary.of(PollStatus.NOTIFIED, game, mentions);
    }

    /**
     * @return The subscriber configuration currently in use
     */
    public synchronized NotifyConfig getNotifyConfig() {
        return notifyConfig;
    }

    private void refreshNotifyConfig() {
        NotifyConfig newConfig;
        try {
            newConfig = notifyConfigGateway.fetchNotifyConfig();
        } catch (Exception e) {
            log.warning("Unable to fetch new config: " + e.getMessage());
            return;
        }

        if (!configLoaded) {
            log.info("Loaded config: " + newConfig.engines());
            configLoaded = true;
        } else if (!notifyConfig.equals(newConfig)) {
            log.info("Config update loaded: " + newConfig.engines());
        }
        notifyConfig = newConfig;
    }

    public enum PollStatus {
        /** The feed could not be fetched or parsed. */
        FETCH_FAILED,
        /** The current game has not left its opening book. */
        IN_BOOK,
        /** The current game was announced before. */
        ALREADY_SEEN,
        /** The current game is new and was announced. */
        NOTIFIED
    }

    public record PollSummary(
        PollStatus status,
        String whitePlayer,
        String blackPlayer,
        Set<String> mentions,
        String error
    ) {

        static PollSummary failed(String error) {
            return new PollSummary(PollStatus.FETCH_FAILED, null, null, Set.of(), error);
        }

        static PollSummary of(PollStatus status, PgnGame game, Set<String> mentions) {
            return new PollSummary(status, game.getWhitePlayer().getRaw(), game.getBlackPlayer().getRaw(),
                Set.copyOf(mentions), null);
        }
    }
}
