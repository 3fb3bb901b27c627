package ch.fleetclash.sessionserver.repository;

import ch.fleetclash.sessionserver.domain.GameSnapshotRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface GameSnapshotRecordRepository extends JpaRepository<GameSnapshotRecord, UUID> {

    /**
     * Returns all snapshots of a game, newest first.
     */
    List<GameSnapshotRecord> findByGameIdOrderByCreatedAtDesc(String gameId);

    void deleteByGameId(String gameId);
}
