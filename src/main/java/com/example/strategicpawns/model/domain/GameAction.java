package com.example.strategicpawns.model.domain;

import lombok.Value;

/**
 * A player intent. Placement and selection use {@code squareIndex}; a move
 * uses {@code fromIndex} and {@code toIndex}.
 */
@Value
public class GameAction {

    public enum Type {
        PLACE,
        SELECT,
        DESELECT,
        MOVE
    }

    Type type;
    int squareIndex;
    int fromIndex;
    int toIndex;

    public static GameAction place(int squareIndex) {
        return new GameAction(Type.PLACE, squareIndex, -1, -1);
    }

    public static GameAction select(int squareIndex) {
        return new GameAction(Type.SELECT, squareIndex, -1, -1);
    }

    public static GameAction deselect() {
        return new GameAction(Type.DESELECT, -1, -1, -1);
    }

    public static GameAction move(int fromIndex, int toIndex) {
        return new GameAction(Type.MOVE, -1, fromIndex, toIndex);
    }
}
