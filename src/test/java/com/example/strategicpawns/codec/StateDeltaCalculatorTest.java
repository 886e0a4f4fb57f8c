package com.example.strategicpawns.codec;

import com.example.strategicpawns.logic.GameEngine;
import com.example.strategicpawns.logic.GameStateFactory;
import com.example.strategicpawns.model.domain.GameConfig;
import com.example.strategicpawns.model.domain.GameState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class StateDeltaCalculatorTest {

    private final GameEngine engine = new GameEngine();

    @Test
    void testPlacementProducesTurnBoardAndCountUpdates() {
        GameState before = new GameStateFactory().initialState(GameConfig.builder().build());
        GameState after = engine.placePawn(before, 0);

        List<DeltaUpdate> updates = StateDeltaCalculator.calculate(before, after);
        List<String> types = updates.stream().map(DeltaUpdate::getType).collect(Collectors.toList());

        assertEquals(List.of(DeltaUpdate.PLAYER_TURN, DeltaUpdate.BOARD_UPDATE, DeltaUpdate.PAWNS_TO_PLACE_UPDATE), types);
        assertEquals(2, updates.get(0).getChanges().get("currentPlayerId"));
        assertEquals(0, updates.get(1).getChanges().get("index"));
        assertEquals(5, updates.get(2).getChanges().get("pawnsToPlacePlayer1"));
    }

    @Test
    void testIdenticalStatesProduceNoUpdates() {
        GameState state = new GameStateFactory().initialState(GameConfig.builder().build());

        assertTrue(StateDeltaCalculator.calculate(state, state).isEmpty());
    }
}
