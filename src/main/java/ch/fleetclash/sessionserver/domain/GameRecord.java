package ch.fleetclash.sessionserver.domain;

import ch.fleetclash.sessionserver.domain.common.BaseEntity;
import ch.fleetclash.sessionserver.domain.enums.GamePhase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Latest stored state of a game, serialized as JSON. One row per game.
 */
@Entity
@Table(name = "game_records")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class GameRecord extends BaseEntity {

    @Column(nullable = false, unique = true, length = 64)
    private String gameId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private GamePhase phase;

    @Lob
    @Column(nullable = false)
    private String payload;

    @Column(nullable = false)
    private Instant updatedAt;

    public GameRecord(String gameId, GamePhase phase, String payload, Instant updatedAt) {
        this.gameId = gameId;
        update(phase, payload, updatedAt);
    }

    public void update(GamePhase phase, String payload, Instant updatedAt) {
        this.phase = phase;
        this.payload = payload;
        this.updatedAt = updatedAt;
    }
}
