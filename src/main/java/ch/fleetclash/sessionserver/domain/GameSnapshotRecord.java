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
 * Point-in-time copy of a game taken at a milestone (created, started, finished, archived).
 */
@Entity
@Table(name = "game_snapshots")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class GameSnapshotRecord extends BaseEntity {

    @Column(nullable = false, length = 64)
    private String gameId;

    @Column(nullable = false, length = 40)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private GamePhase phase;

    @Lob
    @Column(nullable = false)
    private String payload;

    @Column(nullable = false)
    private Instant createdAt;

    public GameSnapshotRecord(String gameId, String reason, GamePhase phase, String payload, Instant createdAt) {
        this.gameId = gameId;
        this.reason = reason;
        this.phase = phase;
        this.payload = payload;
        this.createdAt = createdAt;
    }
}
