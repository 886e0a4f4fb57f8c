package com.example.strategicpawns.model.domain;

import lombok.Builder;
import lombok.Value;

/**
 * The configuration block carried inside every {@link GameState}.
 */
@Value
@Builder(toBuilder = true)
public class GameConfig {
    @Builder.Default
    int pawnsPerPlayer = 6;
    boolean publicGame;
    boolean matchmaking;
    boolean ranked;
}
