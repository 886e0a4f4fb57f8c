package com.example.strategicpawns.model.dto;

import com.example.strategicpawns.model.domain.Player;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlayerEventMessage {
    public static final String OPPONENT_JOINED = "opponent_joined";
    public static final String GAME_START = "game_start";
    public static final String OPPONENT_DISCONNECTED = "opponent_disconnected";

    private String type;
    private String gameId;
    private String playerName;
    private int playerId;
    private List<Player> players;
}
