package com.example.strategicpawns.model.domain;

public enum Highlight {
    NONE((byte) 0),
    SELECTED_PAWN((byte) 1),
    VALID_MOVE((byte) 2),
    DEAD_ZONE_INDICATOR((byte) 3);

    private final byte code;

    Highlight(byte code) {
        this.code = code;
    }

    public byte getCode() {
        return code;
    }

    public static Highlight fromCode(int code) {
        for (Highlight highlight : values()) {
            if (highlight.code == code) {
                return highlight;
            }
        }
        return NONE;
    }
}
