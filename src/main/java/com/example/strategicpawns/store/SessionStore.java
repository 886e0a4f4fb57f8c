package com.example.strategicpawns.store;

import com.example.strategicpawns.config.GameProperties;
import com.example.strategicpawns.logic.GameStateFactory;
import com.example.strategicpawns.model.domain.GameOptions;
import com.example.strategicpawns.model.domain.GameState;
import com.example.strategicpawns.model.domain.GameStatus;
import com.example.strategicpawns.model.domain.JoinResult;
import com.example.strategicpawns.model.domain.Player;
import com.example.strategicpawns.model.domain.Session;
import com.example.strategicpawns.model.domain.TransitionResult;
import com.example.strategicpawns.model.domain.TransitionResult.Outcome;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Owns every live session. Each mutation runs inside a
 * {@link ConcurrentHashMap#compute compute} callback for its game id, which makes
 * "read session, change it, bump the sequence" one atomic step per game.
 * Cleanup timers go through the same path, so a timer firing and a player
 * reconnecting can never both win.
 */
@Slf4j
@Service
public class SessionStore {

    static final String GAME_NOT_FOUND = "Game not found or has expired.";
    static final String GAME_FULL = "Game is full. Cannot add new player.";

    private static final String ID_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int ID_LENGTH = 8;

    private final Map<String, SessionRecord> sessions = new ConcurrentHashMap<>();
    private final SecureRandom random = new SecureRandom();

    private final TaskScheduler taskScheduler;
    private final GameStateFactory stateFactory;
    private final GameProperties properties;
    private final Clock clock;

    private volatile ScheduledFuture<?> sweepTask;

    public SessionStore(@Qualifier("gameTaskScheduler") TaskScheduler taskScheduler,
                        GameStateFactory stateFactory,
                        GameProperties properties,
                        Clock clock) {
        this.taskScheduler = taskScheduler;
        this.stateFactory = stateFactory;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        if (sweepTask != null) {
            return;
        }
        Duration interval = properties.getStore().getSweepInterval();
        sweepTask = taskScheduler.scheduleWithFixedDelay(this::sweepExpiredGames, clock.instant().plus(interval), interval);
        log.info("Session store started, sweeping every {}", interval);
    }

    /**
     * Cancels the sweep and every pending cleanup timer, then drops all sessions.
     */
    @PreDestroy
    public void destroy() {
        ScheduledFuture<?> sweep = sweepTask;
        if (sweep != null) {
            sweep.cancel(false);
            sweepTask = null;
        }
        for (String gameId : new ArrayList<>(sessions.keySet())) {
            sessions.computeIfPresent(gameId, (id, record) -> {
                record.cancelCleanup();
                return null;
            });
        }
        log.info("Session store destroyed");
    }

    // --- Creation and lookup ---

    /**
     * Creates a session with the creator seated as player 1. An AI difficulty in
     * the options seats a computer opponent as player 2.
     *
     * @throws IllegalStateException if {@code options.gameIdToCreate} names a live game
     */
    public String createGame(String creatorHandle, String creatorName, GameOptions options) {
        GameOptions resolved = resolveOptions(options);
        long now = clock.millis();
        GameState state = stateFactory.initialState(resolved.toConfig());
        Integer rating = resolved.isRanked() ? properties.getMatchmaking().getDefaultRating() : null;

        String requested = resolved.getGameIdToCreate();
        String gameId;
        if (requested != null && !requested.isBlank()) {
            gameId = requested.trim().toUpperCase(Locale.ROOT);
            SessionRecord record = newRecord(gameId, state, resolved, now, creatorHandle, creatorName, rating);
            if (sessions.putIfAbsent(gameId, record) != null) {
                throw new IllegalStateException("Game " + gameId + " already exists");
            }
        } else {
            do {
                gameId = randomId();
            } while (sessions.putIfAbsent(gameId,
                    newRecord(gameId, state, resolved, now, creatorHandle, creatorName, rating)) != null);
        }
        log.info("Game {} created by {} (matchmaking={}, ai={})",
                gameId, creatorName, resolved.isMatchmaking(), resolved.getAiDifficulty());
        return gameId;
    }

    /**
     * Replaces a missing or unplayable pawn count with the configured default.
     */
    GameOptions resolveOptions(GameOptions options) {
        GameOptions requested = options == null ? GameOptions.defaults() : options;
        Integer pawns = requested.getPawnsPerPlayer();
        if (pawns != null && pawns > 0 && pawns <= GameStateFactory.MAX_PAWNS_PER_PLAYER) {
            return requested;
        }
        int fallback = properties.getRules().getPawnsPerPlayer();
        if (pawns != null) {
            log.warn("Ignoring pawnsPerPlayer={} (allowed 1..{}), using {}",
                    pawns, GameStateFactory.MAX_PAWNS_PER_PLAYER, fallback);
        }
        return requested.toBuilder().pawnsPerPlayer(fallback).build();
    }

    private SessionRecord newRecord(String gameId, GameState state, GameOptions options, long now,
                                    String handle, String name, Integer rating) {
        SessionRecord record = new SessionRecord(gameId, state, options, now);
        record.players.add(new Player(handle, name, 1, true, true, rating, false));
        if (options.getAiDifficulty() != null) {
            record.players.add(new Player("ai:" + gameId, "AI (" + options.getAiDifficulty().name().toLowerCase(Locale.ROOT) + ")",
                    2, true, false, rating, true));
        }
        return record;
    }

    private String randomId() {
        StringBuilder id = new StringBuilder(ID_LENGTH);
        for (int i = 0; i < ID_LENGTH; i++) {
            id.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return id.toString();
    }

    /**
     * Reads do not count as activity and leave any pending cleanup in place.
     */
    public Session getGame(String gameId) {
        if (gameId == null) {
            return null;
        }
        AtomicReference<Session> snapshot = new AtomicReference<>();
        sessions.computeIfPresent(normalizeId(gameId), (id, r) -> {
            snapshot.set(r.snapshot());
            return r;
        });
        return snapshot.get();
    }

    public GameStatus getGameStatus(String gameId) {
        Session session = getGame(gameId);
        if (session == null) {
            return GameStatus.missing();
        }
        return new GameStatus(true, session.hasActivePlayers(), session.isScheduledForCleanup());
    }

    public int size() {
        return sessions.size();
    }

    // --- State mutation ---

    public boolean updateGameState(String gameId, GameState newState) {
        AtomicReference<Boolean> updated = new AtomicReference<>(false);
        sessions.computeIfPresent(normalizeId(gameId), (id, record) -> {
            commit(record, newState);
            updated.set(true);
            return record;
        });
        if (!updated.get()) {
            log.warn("Rejected state update for unknown game {}", gameId);
        }
        return updated.get();
    }

    /**
     * Runs a player's action as one transaction: the player must be seated and
     * connected, both seats must be filled, and it must be their turn.
     * {@code transition} returns {@code null} to reject the action.
     */
    public TransitionResult applyPlayerAction(String gameId, String handle,
                                              Function<GameState, GameState> transition) {
        return transact(gameId, record -> {
            Optional<Player> player = record.players.stream()
                    .filter(p -> p.getHandle().equals(handle) && p.isConnected())
                    .findFirst();
            if (player.isEmpty()) {
                return Outcome.NOT_IN_GAME;
            }
            if (record.players.size() < 2) {
                return Outcome.WAITING_FOR_OPPONENT;
            }
            if (player.get().getPlayerId() != record.state.getCurrentPlayerId()) {
                return Outcome.NOT_YOUR_TURN;
            }
            return null;
        }, transition);
    }

    /**
     * Runs an action on behalf of seat {@code playerId}, accepted only while the
     * session is still at {@code expectedSequenceId}. Used for computer moves
     * computed against an earlier snapshot.
     */
    public TransitionResult applySeatAction(String gameId, int playerId, long expectedSequenceId,
                                            Function<GameState, GameState> transition) {
        return transact(gameId, record -> {
            if (record.sequenceId != expectedSequenceId) {
                return Outcome.STALE;
            }
            if (record.state.getCurrentPlayerId() != playerId) {
                return Outcome.NOT_YOUR_TURN;
            }
            return null;
        }, transition);
    }

    private TransitionResult transact(String gameId, Function<SessionRecord, Outcome> guard,
                                      Function<GameState, GameState> transition) {
        AtomicReference<TransitionResult> result = new AtomicReference<>(TransitionResult.of(Outcome.GAME_NOT_FOUND));
        sessions.computeIfPresent(normalizeId(gameId), (id, record) -> {
            Outcome refused = guard.apply(record);
            if (refused != null) {
                result.set(TransitionResult.of(refused));
                return record;
            }
            GameState previous = record.state;
            GameState next = transition.apply(previous);
            if (next == null) {
                result.set(TransitionResult.of(Outcome.REJECTED));
                return record;
            }
            commit(record, next);
            result.set(new TransitionResult(Outcome.APPLIED, previous, record.snapshot()));
            return record;
        });
        return result.get();
    }

    private void commit(SessionRecord record, GameState state) {
        record.state = stateFactory.normalize(state);
        record.sequenceId++;
        touch(record);
    }

    private void touch(SessionRecord record) {
        record.lastActivity = clock.millis();
        if (record.isScheduledForCleanup()) {
            record.cancelCleanup();
            log.debug("Cleanup of game {} cancelled by activity", record.gameId);
        }
    }

    // --- Players ---

    public JoinResult addPlayerToGame(String gameId, String handle, String name) {
        AtomicReference<JoinResult> result = new AtomicReference<>(
                JoinResult.failed(JoinResult.JoinFailure.GAME_NOT_FOUND, GAME_NOT_FOUND));
        sessions.computeIfPresent(normalizeId(gameId), (id, record) -> {
            result.set(join(record, handle, name));
            return record;
        });
        JoinResult joinResult = result.get();
        if (joinResult.isSuccess()) {
            log.info("{} joined game {} as player {}", name, gameId, joinResult.getAssignedPlayerId());
        } else {
            log.info("{} could not join game {}: {}", name, gameId, joinResult.getError());
        }
        return joinResult;
    }

    private JoinResult join(SessionRecord record, String handle, String name) {
        List<Player> players = record.players;

        for (int i = 0; i < players.size(); i++) {
            Player existing = players.get(i);
            if (existing.getHandle().equals(handle)) {
                players.set(i, existing.withConnected(true).withName(name));
                touch(record);
                return JoinResult.joined(existing.getPlayerId(), players);
            }
        }
        for (int i = 0; i < players.size(); i++) {
            Player existing = players.get(i);
            if (!existing.isConnected() && !existing.isAi() && existing.getName().equals(name)) {
                players.set(i, existing.withHandle(handle).withConnected(true));
                touch(record);
                return JoinResult.joined(existing.getPlayerId(), players);
            }
        }
        boolean nameInUse = players.stream().anyMatch(p -> p.isConnected() && p.getName().equals(name));
        if (nameInUse) {
            return JoinResult.failed(JoinResult.JoinFailure.NAME_IN_USE,
                    "Player name \"" + name + "\" is already in use in this game by an active player.");
        }
        if (record.connectedCount() >= 2) {
            return JoinResult.failed(JoinResult.JoinFailure.GAME_FULL, GAME_FULL);
        }
        // seats held by disconnected players stay reserved for their reconnection
        int slot = freeSlot(players);
        if (slot == 0) {
            return JoinResult.failed(JoinResult.JoinFailure.GAME_FULL, GAME_FULL);
        }
        Integer rating = record.options.isRanked() ? properties.getMatchmaking().getDefaultRating() : null;
        players.add(new Player(handle, name, slot, true, false, rating, false));
        touch(record);
        return JoinResult.joined(slot, players);
    }

    private static int freeSlot(List<Player> players) {
        for (int slot = 1; slot <= 2; slot++) {
            int candidate = slot;
            if (players.stream().noneMatch(p -> p.getPlayerId() == candidate)) {
                return slot;
            }
        }
        return 0;
    }

    /**
     * Marks the player disconnected. Once no human is connected any more the
     * session is scheduled for deletion after the configured idle TTL.
     *
     * @return the player as it was before disconnecting, or {@code null}
     */
    public Player removePlayerFromGame(String gameId, String handle) {
        AtomicReference<Player> removed = new AtomicReference<>();
        sessions.computeIfPresent(normalizeId(gameId), (id, record) -> {
            for (int i = 0; i < record.players.size(); i++) {
                Player player = record.players.get(i);
                if (player.getHandle().equals(handle)) {
                    record.players.set(i, player.withConnected(false));
                    record.lastActivity = clock.millis();
                    removed.set(player);
                    break;
                }
            }
            if (removed.get() != null && !record.hasConnectedHumans() && !record.isScheduledForCleanup()) {
                scheduleCleanup(record);
            }
            return record;
        });
        return removed.get();
    }

    private void scheduleCleanup(SessionRecord record) {
        Duration ttl = properties.getStore().getGameTtl();
        long generation = ++record.cleanupGeneration;
        String gameId = record.gameId;
        record.cleanupTask = taskScheduler.schedule(() -> expire(gameId, generation), clock.instant().plus(ttl));
        log.info("Game {} has no connected players, deleting in {}", gameId, ttl);
    }

    void expire(String gameId, long generation) {
        AtomicReference<Boolean> deleted = new AtomicReference<>(false);
        sessions.computeIfPresent(gameId, (id, record) -> {
            if (!record.isScheduledForCleanup() || record.cleanupGeneration != generation) {
                return record;
            }
            record.cleanupTask = null;
            deleted.set(true);
            return null;
        });
        if (deleted.get()) {
            log.info("Game {} expired after inactivity", gameId);
        }
    }

    // --- Deletion ---

    public void deleteGame(String gameId) {
        AtomicReference<Boolean> deleted = new AtomicReference<>(false);
        sessions.computeIfPresent(normalizeId(gameId), (id, record) -> {
            record.cancelCleanup();
            deleted.set(true);
            return null;
        });
        if (deleted.get()) {
            log.info("Game {} deleted", gameId);
        }
    }

    /**
     * Deletes every session idle for more than twice the TTL, whether or not a
     * cleanup was ever scheduled for it.
     *
     * @return the number of sessions removed
     */
    public int sweepExpiredGames() {
        long cutoff = clock.millis() - properties.getStore().getGameTtl().multipliedBy(2).toMillis();
        int removed = 0;
        for (String gameId : new ArrayList<>(sessions.keySet())) {
            AtomicReference<Boolean> deleted = new AtomicReference<>(false);
            sessions.computeIfPresent(gameId, (id, record) -> {
                if (record.lastActivity >= cutoff) {
                    return record;
                }
                record.cancelCleanup();
                deleted.set(true);
                return null;
            });
            if (deleted.get()) {
                removed++;
                log.warn("Sweep removed idle game {}", gameId);
            }
        }
        return removed;
    }

    private static String normalizeId(String gameId) {
        return gameId == null ? "" : gameId.trim().toUpperCase(Locale.ROOT);
    }
}
