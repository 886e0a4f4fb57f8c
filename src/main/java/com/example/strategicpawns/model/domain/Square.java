package com.example.strategicpawns.model.domain;

import lombok.Value;
import lombok.With;

@Value
@With
public class Square {
    int index;
    int row;
    int col;
    SquareColor boardColor;
    Pawn pawn;
    Highlight highlight;

    public static Square empty(int row, int col, int size) {
        return new Square(row * size + col, row, col, SquareColor.of(row, col), null, Highlight.NONE);
    }

    public boolean isEmpty() {
        return pawn == null;
    }

    public boolean isOwnedBy(int playerId) {
        return pawn != null && pawn.getPlayerId() == playerId;
    }
}
