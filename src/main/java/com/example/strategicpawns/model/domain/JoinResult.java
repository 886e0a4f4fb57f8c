package com.example.strategicpawns.model.domain;

import lombok.Value;

import java.util.List;

@Value
public class JoinResult {
    boolean success;
    Integer assignedPlayerId;
    List<Player> players;
    String error;
    JoinFailure failure;

    public enum JoinFailure {
        GAME_NOT_FOUND,
        NAME_IN_USE,
        GAME_FULL
    }

    public static JoinResult joined(int playerId, List<Player> players) {
        return new JoinResult(true, playerId, List.copyOf(players), null, null);
    }

    public static JoinResult failed(JoinFailure failure, String error) {
        return new JoinResult(false, null, List.of(), error, failure);
    }
}
