package com.example.strategicpawns.ai;

import com.example.strategicpawns.model.domain.Difficulty;
import com.example.strategicpawns.model.domain.GameAction;
import com.example.strategicpawns.model.domain.GameState;

import java.util.concurrent.CompletableFuture;

/**
 * Computer opponent: given a snapshot and a difficulty, eventually yields the
 * action it wants to play, or {@code null} when it has none.
 * Implementations may take arbitrarily long but must complete the future.
 */
public interface AiOpponent {

    CompletableFuture<GameAction> computeMove(GameState snapshot, Difficulty difficulty);
}
