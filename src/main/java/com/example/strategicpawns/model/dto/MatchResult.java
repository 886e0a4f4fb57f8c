package com.example.strategicpawns.model.dto;

import com.example.strategicpawns.model.domain.GameOptions;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MatchResult {
    private String type = "match_found";
    private String gameId;
    private String opponentName;
    private int assignedPlayerId; // 1 or 2
    private long timestamp;
    private GameOptions options;

    public MatchResult(String gameId, String opponentName, int assignedPlayerId, long timestamp, GameOptions options) {
        this("match_found", gameId, opponentName, assignedPlayerId, timestamp, options);
    }
}
