package ch.fleetclash.sessionserver.config;

import ch.fleetclash.sessionserver.domain.GameConfiguration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Builds the rule set new games are created with from {@code game.*} properties.
 */
@Configuration
public class GameRulesConfig {

    @Bean
    public GameConfiguration gameConfiguration(
            @Value("${game.board-size:10}") int boardSize,
            @Value("${game.fleet:5,4,3,3,2}") List<Integer> fleet,
            @Value("${game.allow-adjacent:false}") boolean allowAdjacent,
            @Value("${game.turn-timeout-ms:60000}") long turnTimeoutMs) {
        return new GameConfiguration(boardSize, fleet, allowAdjacent, turnTimeoutMs);
    }
}
