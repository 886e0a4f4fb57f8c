package com.example.strategicpawns.store;

import com.example.strategicpawns.model.domain.GameOptions;
import com.example.strategicpawns.model.domain.GameState;
import com.example.strategicpawns.model.domain.Player;
import com.example.strategicpawns.model.domain.Session;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Mutable session bookkeeping. Only touched from inside the store's
 * per-key compute callbacks, which serialise access per game id.
 */
final class SessionRecord {

    final String gameId;
    final long createdAt;
    final GameOptions options;
    final List<Player> players = new ArrayList<>(2);
    GameState state;
    long sequenceId;
    long lastActivity;
    ScheduledFuture<?> cleanupTask;
    /** Incremented whenever a cleanup is scheduled, so a superseded timer recognises itself. */
    long cleanupGeneration;

    SessionRecord(String gameId, GameState state, GameOptions options, long now) {
        this.gameId = gameId;
        this.state = state;
        this.options = options;
        this.createdAt = now;
        this.lastActivity = now;
    }

    boolean isScheduledForCleanup() {
        return cleanupTask != null;
    }

    void cancelCleanup() {
        ScheduledFuture<?> task = cleanupTask;
        if (task != null && !task.isDone()) {
            task.cancel(false);
        }
        cleanupTask = null;
    }

    long connectedCount() {
        return players.stream().filter(Player::isConnected).count();
    }

    boolean hasConnectedHumans() {
        return players.stream().anyMatch(p -> p.isConnected() && !p.isAi());
    }

    Session snapshot() {
        return new Session(gameId, state, List.copyOf(players), sequenceId, lastActivity, createdAt,
                isScheduledForCleanup(), options);
    }
}
