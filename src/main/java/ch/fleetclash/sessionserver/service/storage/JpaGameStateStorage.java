package ch.fleetclash.sessionserver.service.storage;

import ch.fleetclash.sessionserver.domain.GameRecord;
import ch.fleetclash.sessionserver.domain.GameSnapshotRecord;
import ch.fleetclash.sessionserver.repository.GameRecordRepository;
import ch.fleetclash.sessionserver.repository.GameSnapshotRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * {@link GameStateStorage} backed by Spring Data JPA.
 *
 * <p>Game state is stored as JSON: the latest state in {@code game_records} (one row per game)
 * and milestone copies in {@code game_snapshots}, pruned to the newest
 * {@code storage.snapshots.max-per-game} entries per game.
 */
@Service
@Slf4j
public class JpaGameStateStorage implements GameStateStorage {

    private final GameRecordRepository recordRepository;
    private final GameSnapshotRecordRepository snapshotRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int maxSnapshotsPerGame;

    public JpaGameStateStorage(GameRecordRepository recordRepository,
                               GameSnapshotRecordRepository snapshotRepository,
                               ObjectMapper objectMapper,
                               Clock clock,
                               @Value("${storage.snapshots.max-per-game:10}") int maxSnapshotsPerGame) {
        this.recordRepository = recordRepository;
        this.snapshotRepository = snapshotRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.maxSnapshotsPerGame = maxSnapshotsPerGame;
    }

    @Override
    @Transactional
    public void save(GameSnapshot snapshot) {
        String payload = write(snapshot);
        GameRecord record = recordRepository.findByGameId(snapshot.gameId())
                .orElseGet(() -> new GameRecord(snapshot.gameId(), snapshot.phase(), payload, clock.instant()));
        record.update(snapshot.phase(), payload, clock.instant());
        recordRepository.save(record);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<GameSnapshot> load(String gameId) {
        return recordRepository.findByGameId(gameId).map(r -> read(r.getPayload()));
    }

    @Override
    @Transactional
    public void snapshot(GameSnapshot snapshot, String reason) {
        snapshotRepository.save(new GameSnapshotRecord(
                snapshot.gameId(), reason, snapshot.phase(), write(snapshot), clock.instant()));

        List<GameSnapshotRecord> existing = snapshotRepository.findByGameIdOrderByCreatedAtDesc(snapshot.gameId());
        if (existing.size() > maxSnapshotsPerGame) {
            List<GameSnapshotRecord> outdated = existing.subList(maxSnapshotsPerGame, existing.size());
            snapshotRepository.deleteAll(outdated);
            log.debug("Pruned {} old snapshot(s) of game {}", outdated.size(), snapshot.gameId());
        }
    }

    @Override
    @Transactional
    public void delete(String gameId) {
        recordRepository.deleteByGameId(gameId);
        snapshotRepository.deleteByGameId(gameId);
    }

    private String write(GameSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize game " + snapshot.gameId(), e);
        }
    }

    private GameSnapshot read(String payload) {
        try {
            return objectMapper.readValue(payload, GameSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored game state is unreadable", e);
        }
    }
}
