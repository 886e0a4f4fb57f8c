package com.example.strategicpawns.model.domain;

import lombok.Value;

@Value
public class GameStatus {
    boolean exists;
    boolean hasActivePlayers;
    boolean scheduledForCleanup;

    public static GameStatus missing() {
        return new GameStatus(false, false, false);
    }
}
