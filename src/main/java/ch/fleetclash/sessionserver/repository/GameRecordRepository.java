package ch.fleetclash.sessionserver.repository;

import ch.fleetclash.sessionserver.domain.GameRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface GameRecordRepository extends JpaRepository<GameRecord, UUID> {

    Optional<GameRecord> findByGameId(String gameId);

    void deleteByGameId(String gameId);
}
