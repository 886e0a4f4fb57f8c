package com.example.strategicpawns.codec;

import lombok.Value;

import java.util.Map;

@Value
public class DeltaUpdate {

    public static final String PLAYER_TURN = "player_turn";
    public static final String GAME_PHASE = "game_phase";
    public static final String BOARD_UPDATE = "board_update";
    public static final String GAME_OVER = "game_over";
    public static final String PAWNS_TO_PLACE_UPDATE = "pawns_to_place_update";
    public static final String SELECTION_UPDATE = "selection_update";
    public static final String MARKERS_UPDATE = "markers_update";

    String type;
    Map<String, Object> changes;
}
