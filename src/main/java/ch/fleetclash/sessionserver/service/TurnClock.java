package ch.fleetclash.sessionserver.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Per-game turn countdown.
 *
 * <p>At most one timer is armed per game. Arming a new timer cancels the previous one, and a
 * timer only fires its callback if it is still the armed timer of its game at expiry time, so
 * {@link #stop(String)} is idempotent and a cancelled timer can never act on a game later.
 *
 * <p>Timers are scheduled on the shared {@link TaskScheduler}. The expiry callback is supplied by
 * the session engine and re-enters the engine through the game lock.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TurnClock {

    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final Map<String, ArmedTimer> timers = new ConcurrentHashMap<>();

    /**
     * Arms the turn timer of a game, replacing any timer that is already armed.
     *
     * @param gameId     game the timer belongs to
     * @param durationMs time budget; a value {@code <= 0} only disarms the current timer
     * @param onExpire   invoked on a scheduler thread when the budget runs out
     */
    public void start(String gameId, long durationMs, Runnable onExpire) {
        stop(gameId);
        if (durationMs <= 0) {
            return;
        }
        Instant deadline = clock.instant().plus(Duration.ofMillis(durationMs));
        ArmedTimer timer = new ArmedTimer(deadline, onExpire);
        timers.put(gameId, timer);
        timer.future = taskScheduler.schedule(() -> fire(gameId, timer), deadline);
        if (timer.cancelled && timer.future != null) {
            timer.future.cancel(false);
        }
        log.debug("Turn timer armed for game {} ({} ms)", gameId, durationMs);
    }

    /**
     * Disarms the timer of a game.
     *
     * @return {@code true} if a timer was armed
     */
    public boolean stop(String gameId) {
        ArmedTimer timer = timers.remove(gameId);
        if (timer == null) {
            return false;
        }
        timer.cancel();
        return true;
    }

    /**
     * @return milliseconds left on the armed timer (never negative), empty if no timer is armed
     */
    public OptionalLong remaining(String gameId) {
        ArmedTimer timer = timers.get(gameId);
        if (timer == null) {
            return OptionalLong.empty();
        }
        long left = Duration.between(clock.instant(), timer.deadline).toMillis();
        return OptionalLong.of(Math.max(0, left));
    }

    public boolean isArmed(String gameId) {
        return timers.containsKey(gameId);
    }

    private void fire(String gameId, ArmedTimer timer) {
        if (!timers.remove(gameId, timer)) {
            log.debug("Ignoring superseded turn timer of game {}", gameId);
            return;
        }
        try {
            timer.onExpire.run();
        } catch (RuntimeException e) {
            log.error("Turn timeout handling failed for game {}", gameId, e);
        }
    }

    private static final class ArmedTimer {
        private final Instant deadline;
        private final Runnable onExpire;
        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;

        private ArmedTimer(Instant deadline, Runnable onExpire) {
            this.deadline = deadline;
            this.onExpire = onExpire;
        }

        private void cancel() {
            cancelled = true;
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
