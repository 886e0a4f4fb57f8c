package com.example.strategicpawns.model.domain;

/**
 * Game over is not a phase of its own: it is signalled by a non-null winner.
 */
public enum GamePhase {
    PLACEMENT((byte) 0),
    MOVEMENT((byte) 1);

    private final byte code;

    GamePhase(byte code) {
        this.code = code;
    }

    public byte getCode() {
        return code;
    }

    public static GamePhase fromCode(int code, GamePhase fallback) {
        for (GamePhase phase : values()) {
            if (phase.code == code) {
                return phase;
            }
        }
        return fallback;
    }
}
