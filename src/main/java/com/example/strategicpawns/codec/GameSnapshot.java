package com.example.strategicpawns.codec;

import com.example.strategicpawns.model.domain.GameState;
import lombok.Value;

@Value
public class GameSnapshot {
    GameState state;
    long sequenceId;
    long timestamp;
    int schemaVersion;
}
