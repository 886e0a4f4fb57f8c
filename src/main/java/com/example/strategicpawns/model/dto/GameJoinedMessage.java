package com.example.strategicpawns.model.dto;

import com.example.strategicpawns.model.domain.GameOptions;
import com.example.strategicpawns.model.domain.Player;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameJoinedMessage {
    public static final String CREATED = "game_created";
    public static final String JOINED = "game_joined";

    private String type;
    private String gameId;
    private int playerId;
    private List<Player> players;
    private GameOptions options;
    private long sequenceId;
    private byte[] gameState;
}
