package com.example.strategicpawns.model.domain;

import lombok.Value;

@Value
public class Pawn {
    String id;
    int playerId;
    SquareColor color;

    public static String idFor(int playerId, int ordinal) {
        return "p" + playerId + "_" + ordinal;
    }
}
