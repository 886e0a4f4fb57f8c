package com.example.strategicpawns.model.domain;

public enum SquareColor {
    LIGHT((byte) 0),
    DARK((byte) 1);

    private final byte code;

    SquareColor(byte code) {
        this.code = code;
    }

    public byte getCode() {
        return code;
    }

    /**
     * Player 1 seats on light squares, player 2 on dark ones.
     */
    public static SquareColor forPlayer(int playerId) {
        return playerId == 1 ? LIGHT : DARK;
    }

    public static SquareColor of(int row, int col) {
        return (row + col) % 2 == 0 ? LIGHT : DARK;
    }

    public static SquareColor fromCode(int code, SquareColor fallback) {
        for (SquareColor color : values()) {
            if (color.code == code) {
                return color;
            }
        }
        return fallback;
    }
}
