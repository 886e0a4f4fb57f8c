package com.example.strategicpawns.model.domain;

import lombok.Value;

/**
 * Outcome of one read-apply-write transaction against a session.
 */
@Value
public class TransitionResult {

    public enum Outcome {
        APPLIED,
        REJECTED,
        GAME_NOT_FOUND,
        NOT_IN_GAME,
        NOT_YOUR_TURN,
        WAITING_FOR_OPPONENT,
        STALE
    }

    Outcome outcome;
    GameState previousState;
    Session session;

    public boolean isApplied() {
        return outcome == Outcome.APPLIED;
    }

    public static TransitionResult of(Outcome outcome) {
        return new TransitionResult(outcome, null, null);
    }
}
