package ch.fleetclash.sessionserver.service;

import ch.fleetclash.sessionserver.domain.Game;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Periodically abandons games nobody has acted on for a while.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code game.inactivity.sweep-interval-ms}: how often to look for idle games (default: 5 minutes)</li>
 *   <li>{@code game.inactivity.threshold-ms}: idle time after which a game is abandoned (default: 2 hours)</li>
 * </ul>
 *
 * <p>Turn timeouts do not count as activity, so a game whose players both left is eventually
 * removed even while its turn timer keeps cycling.
 */
@Service
@Slf4j
@Getter
public class InactiveGameReaper {

    private final GameRegistry registry;
    private final GameSessionEngine engine;
    private final Clock clock;
    private final long inactivityThresholdMs;

    public InactiveGameReaper(GameRegistry registry,
                              GameSessionEngine engine,
                              Clock clock,
                              @Value("${game.inactivity.threshold-ms:7200000}") long inactivityThresholdMs) {
        this.registry = registry;
        this.engine = engine;
        this.clock = clock;
        this.inactivityThresholdMs = inactivityThresholdMs;
    }

    @Scheduled(fixedRateString = "${game.inactivity.sweep-interval-ms:300000}")
    public void reapInactiveGames() {
        reap();
    }

    /**
     * Abandons all games whose last activity is older than the threshold.
     *
     * @return number of abandoned games
     */
    public int reap() {
        Instant threshold = clock.instant().minus(Duration.ofMillis(inactivityThresholdMs));
        List<String> idle = registry.all().stream()
                .filter(g -> g.getLastActivity().isBefore(threshold))
                .map(Game::getId)
                .toList();

        int abandoned = 0;
        for (String gameId : idle) {
            if (engine.abandon(gameId, "inactive")) {
                abandoned++;
            }
        }

        if (abandoned > 0) {
            log.info("Abandoned {} inactive game(s) (idle longer than {} ms)", abandoned, inactivityThresholdMs);
        } else {
            log.debug("No inactive games to abandon");
        }
        return abandoned;
    }
}
