package com.example.strategicpawns.ai;

import com.example.strategicpawns.logic.GameEngine;
import com.example.strategicpawns.model.domain.Difficulty;
import com.example.strategicpawns.model.domain.GameAction;
import com.example.strategicpawns.model.domain.GamePhase;
import com.example.strategicpawns.model.domain.GameState;
import com.example.strategicpawns.model.domain.Square;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Default opponent: plays a winning move when one exists and a random legal
 * move otherwise. Replies after a short "thinking" delay that shrinks with
 * difficulty.
 */
@Component
public class RandomAiOpponent implements AiOpponent {

    private final GameEngine engine;
    private final ScheduledExecutorService aiScheduler;

    public RandomAiOpponent(GameEngine engine, @Qualifier("aiScheduler") ScheduledExecutorService aiScheduler) {
        this.engine = engine;
        this.aiScheduler = aiScheduler;
    }

    @Override
    public CompletableFuture<GameAction> computeMove(GameState snapshot, Difficulty difficulty) {
        CompletableFuture<GameAction> future = new CompletableFuture<>();
        aiScheduler.schedule(() -> {
            try {
                future.complete(chooseAction(snapshot));
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        }, thinkingDelayMs(difficulty), TimeUnit.MILLISECONDS);
        return future;
    }

    GameAction chooseAction(GameState state) {
        if (state.isGameOver()) {
            return null;
        }
        List<GameAction> candidates = legalActions(state);
        if (candidates.isEmpty()) {
            return null;
        }
        for (GameAction action : candidates) {
            GameState next = engine.apply(state, action);
            if (next != null && next.getWinner() != null) {
                return action;
            }
        }
        return candidates.get(ThreadLocalRandom.current().nextInt(candidates.size()));
    }

    List<GameAction> legalActions(GameState state) {
        int player = state.getCurrentPlayerId();
        List<GameAction> actions = new ArrayList<>();
        if (state.getGamePhase() == GamePhase.PLACEMENT) {
            for (Square square : state.getBoard()) {
                if (engine.isValidPlacement(state, square.getIndex(), player)) {
                    actions.add(GameAction.place(square.getIndex()));
                }
            }
            return actions;
        }
        for (Square square : state.getBoard()) {
            if (engine.canSelect(state, square.getIndex())) {
                for (int target : engine.getValidMoveDestinations(state, square.getIndex())) {
                    actions.add(GameAction.move(square.getIndex(), target));
                }
            }
        }
        return actions;
    }

    private static long thinkingDelayMs(Difficulty difficulty) {
        if (difficulty == null) {
            return 500;
        }
        switch (difficulty) {
            case EASY:
                return 800;
            case MEDIUM:
                return 500;
            default:
                return 250;
        }
    }
}
