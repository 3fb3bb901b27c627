package ch.fleetclash.sessionserver.web.api.controller;

import ch.fleetclash.sessionserver.service.GameSessionEngine;
import ch.fleetclash.sessionserver.web.api.dto.AttackRequest;
import ch.fleetclash.sessionserver.web.api.dto.AttackResultDto;
import ch.fleetclash.sessionserver.web.api.dto.CreateGameRequest;
import ch.fleetclash.sessionserver.web.api.dto.GameViewDto;
import ch.fleetclash.sessionserver.web.api.dto.JoinGameRequest;
import ch.fleetclash.sessionserver.web.api.dto.JoinGameResponseDto;
import ch.fleetclash.sessionserver.web.api.dto.PlaceShipsRequest;
import ch.fleetclash.sessionserver.web.api.dto.PlayerActionRequest;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST entry points for game actions. Failures are mapped by {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/api/games")
public class GameController {

    private final GameSessionEngine engine;

    public GameController(GameSessionEngine engine) {
        this.engine = engine;
    }

    @Operation(summary = "Create a new game; the host joins automatically")
    @PostMapping
    public ResponseEntity<JoinGameResponseDto> createGame(@RequestBody CreateGameRequest request) {
        return ResponseEntity.ok(engine.createSession(request.hostName()));
    }

    @Operation(summary = "Join a waiting game as second player")
    @PostMapping("/{gameId}/join")
    public ResponseEntity<JoinGameResponseDto> joinGame(@PathVariable String gameId,
                                                        @RequestBody JoinGameRequest request) {
        return ResponseEntity.ok(engine.join(gameId, request.playerName()));
    }

    @Operation(summary = "Place the player's fleet (once per game)")
    @PostMapping("/{gameId}/players/{playerId}/ships")
    public ResponseEntity<GameViewDto> placeShips(@PathVariable String gameId,
                                                  @PathVariable UUID playerId,
                                                  @RequestBody PlaceShipsRequest request) {
        return ResponseEntity.ok(engine.placeShips(gameId, playerId, request.toPlacements()));
    }

    @Operation(summary = "Attack a cell of the opponent's board")
    @PostMapping("/{gameId}/attacks")
    public ResponseEntity<AttackResultDto> attack(@PathVariable String gameId,
                                                  @RequestBody AttackRequest request) {
        return ResponseEntity.ok(engine.attack(gameId, request.attackerId(), request.position()));
    }

    @Operation(summary = "Pause a playing game")
    @PostMapping("/{gameId}/pause")
    public ResponseEntity<GameViewDto> pauseGame(@PathVariable String gameId,
                                                 @RequestBody PlayerActionRequest request) {
        engine.requestPause(gameId, request.playerId());
        return ResponseEntity.ok(engine.getView(gameId, request.playerId()));
    }

    @Operation(summary = "Resume a paused game")
    @PostMapping("/{gameId}/resume")
    public ResponseEntity<GameViewDto> resumeGame(@PathVariable String gameId,
                                                  @RequestBody PlayerActionRequest request) {
        engine.resume(gameId, request.playerId());
        return ResponseEntity.ok(engine.getView(gameId, request.playerId()));
    }

    @Operation(summary = "Get the game state as seen by a player")
    @GetMapping("/{gameId}")
    public ResponseEntity<GameViewDto> getGame(@PathVariable String gameId,
                                               @RequestParam UUID playerId) {
        return ResponseEntity.ok(engine.getView(gameId, playerId));
    }

    @Operation(summary = "Delete a game and close its connections")
    @DeleteMapping("/{gameId}")
    public ResponseEntity<Void> deleteGame(@PathVariable String gameId) {
        engine.deleteGame(gameId);
        return ResponseEntity.noContent().build();
    }
}
