package com.example.strategicpawns.model.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Options supplied when a session is created. A non-null {@code aiDifficulty}
 * seats a computer opponent as player 2. A missing {@code pawnsPerPlayer} is
 * resolved to the configured default by the session store.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class GameOptions {
    Integer pawnsPerPlayer;
    boolean publicGame;
    boolean matchmaking;
    boolean ranked;
    String gameIdToCreate;
    Difficulty aiDifficulty;

    public static GameOptions defaults() {
        return GameOptions.builder().build();
    }

    public GameConfig toConfig() {
        GameConfig.GameConfigBuilder config = GameConfig.builder()
                .publicGame(publicGame)
                .matchmaking(matchmaking)
                .ranked(ranked);
        if (pawnsPerPlayer != null) {
            config.pawnsPerPlayer(pawnsPerPlayer);
        }
        return config.build();
    }
}
