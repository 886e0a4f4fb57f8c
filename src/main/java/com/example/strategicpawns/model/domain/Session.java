package com.example.strategicpawns.model.domain;

import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Read-only copy of a session handed out by the store. Mutating a snapshot
 * is impossible and never affects the stored record.
 */
@Value
public class Session {
    String gameId;
    GameState state;
    List<Player> players;
    long sequenceId;
    long lastActivity;
    long createdAt;
    boolean scheduledForCleanup;
    GameOptions options;

    public Optional<Player> findByHandle(String handle) {
        return players.stream().filter(p -> p.getHandle().equals(handle)).findFirst();
    }

    public Optional<Player> findByPlayerId(int playerId) {
        return players.stream().filter(p -> p.getPlayerId() == playerId).findFirst();
    }

    public boolean hasActivePlayers() {
        return players.stream().anyMatch(p -> p.isConnected() && !p.isAi());
    }
}
