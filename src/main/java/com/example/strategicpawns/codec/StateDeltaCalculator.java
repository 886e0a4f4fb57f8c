package com.example.strategicpawns.codec;

import com.example.strategicpawns.model.domain.GameState;
import com.example.strategicpawns.model.domain.Square;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lists what changed between two consecutive states of the same game so
 * observers can patch their copy instead of receiving a full snapshot.
 */
public final class StateDeltaCalculator {

    private StateDeltaCalculator() {
    }

    public static List<DeltaUpdate> calculate(GameState previous, GameState current) {
        List<DeltaUpdate> updates = new ArrayList<>();

        if (previous.getCurrentPlayerId() != current.getCurrentPlayerId()) {
            updates.add(update(DeltaUpdate.PLAYER_TURN, Map.of("currentPlayerId", current.getCurrentPlayerId())));
        }
        if (previous.getGamePhase() != current.getGamePhase()) {
            updates.add(update(DeltaUpdate.GAME_PHASE, Map.of("gamePhase", current.getGamePhase())));
        }

        List<Square> before = previous.getBoard();
        List<Square> after = current.getBoard();
        for (int i = 0; i < after.size(); i++) {
            Square square = after.get(i);
            if (i >= before.size() || !square.equals(before.get(i))) {
                Map<String, Object> changes = new LinkedHashMap<>();
                changes.put("index", square.getIndex());
                changes.put("pawn", square.getPawn());
                changes.put("highlight", square.getHighlight());
                updates.add(update(DeltaUpdate.BOARD_UPDATE, changes));
            }
        }

        if (previous.getPawnsToPlacePlayer1() != current.getPawnsToPlacePlayer1()
                || previous.getPawnsToPlacePlayer2() != current.getPawnsToPlacePlayer2()) {
            Map<String, Object> changes = new LinkedHashMap<>();
            changes.put("pawnsToPlacePlayer1", current.getPawnsToPlacePlayer1());
            changes.put("pawnsToPlacePlayer2", current.getPawnsToPlacePlayer2());
            changes.put("pawnsPlacedPlayer1", current.getPawnsPlacedPlayer1());
            changes.put("pawnsPlacedPlayer2", current.getPawnsPlacedPlayer2());
            updates.add(update(DeltaUpdate.PAWNS_TO_PLACE_UPDATE, changes));
        }

        if (!Objects.equals(previous.getSelectedPawnIndex(), current.getSelectedPawnIndex())
                || !previous.getHighlightedValidMoves().equals(current.getHighlightedValidMoves())) {
            Map<String, Object> changes = new HashMap<>();
            changes.put("selectedPawnIndex", current.getSelectedPawnIndex());
            changes.put("highlightedValidMoves", current.getHighlightedValidMoves());
            updates.add(update(DeltaUpdate.SELECTION_UPDATE, changes));
        }

        if (!previous.getBlockedPawns().equals(current.getBlockedPawns())
                || !previous.getBlockingPawns().equals(current.getBlockingPawns())
                || !previous.getDeadZoneSquares().equals(current.getDeadZoneSquares())
                || !previous.getDeadZoneCreatorPawns().equals(current.getDeadZoneCreatorPawns())) {
            Map<String, Object> changes = new LinkedHashMap<>();
            changes.put("blockedPawns", current.getBlockedPawns());
            changes.put("blockingPawns", current.getBlockingPawns());
            changes.put("deadZoneSquares", current.getDeadZoneSquares());
            changes.put("deadZoneCreatorPawns", current.getDeadZoneCreatorPawns());
            updates.add(update(DeltaUpdate.MARKERS_UPDATE, changes));
        }

        if (current.getWinner() != null && !current.getWinner().equals(previous.getWinner())) {
            Map<String, Object> changes = new LinkedHashMap<>();
            changes.put("winner", current.getWinner());
            changes.put("winningLine", current.getWinningLine());
            updates.add(update(DeltaUpdate.GAME_OVER, changes));
        }
        return updates;
    }

    private static DeltaUpdate update(String type, Map<String, Object> changes) {
        return new DeltaUpdate(type, changes);
    }
}
