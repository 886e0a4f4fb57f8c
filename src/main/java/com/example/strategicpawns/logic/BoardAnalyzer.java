package com.example.strategicpawns.logic;

import com.example.strategicpawns.model.domain.GameState;
import com.example.strategicpawns.model.domain.Pawn;
import com.example.strategicpawns.model.domain.Square;
import com.example.strategicpawns.model.domain.SquareColor;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recomputes blocking and dead-zone markers over the whole board. Every
 * horizontal and vertical run of three squares is inspected; nothing is
 * carried over from the previous position.
 */
public final class BoardAnalyzer {

    private BoardAnalyzer() {
    }

    public static BoardAnalysis analyze(List<Square> board) {
        int size = (int) Math.round(Math.sqrt(board.size()));
        Set<Integer> blocked = new HashSet<>();
        Set<Integer> blocking = new HashSet<>();
        Map<Integer, Integer> deadZones = new HashMap<>();
        Set<Integer> creators = new HashSet<>();

        for (int row = 0; row < size; row++) {
            for (int col = 0; col < size; col++) {
                int start = row * size + col;
                if (col + 2 < size) {
                    inspectTriple(board, start, start + 1, start + 2, blocked, blocking, deadZones, creators);
                }
                if (row + 2 < size) {
                    inspectTriple(board, start, start + size, start + 2 * size, blocked, blocking, deadZones, creators);
                }
            }
        }
        return new BoardAnalysis(blocked, blocking, deadZones, creators);
    }

    /**
     * Returns a copy of {@code state} whose derived marker sets match its board.
     */
    public static GameState refresh(GameState state) {
        BoardAnalysis analysis = analyze(state.getBoard());
        return state.toBuilder()
                .blockedPawns(analysis.getBlockedPawns())
                .blockingPawns(analysis.getBlockingPawns())
                .deadZoneSquares(analysis.getDeadZoneSquares())
                .deadZoneCreatorPawns(analysis.getDeadZoneCreatorPawns())
                .build();
    }

    private static void inspectTriple(List<Square> board, int first, int center, int last,
                                      Set<Integer> blocked, Set<Integer> blocking,
                                      Map<Integer, Integer> deadZones, Set<Integer> creators) {
        Pawn firstPawn = board.get(first).getPawn();
        Pawn lastPawn = board.get(last).getPawn();
        if (firstPawn == null || lastPawn == null || firstPawn.getPlayerId() != lastPawn.getPlayerId()) {
            return;
        }
        int owner = firstPawn.getPlayerId();
        Square centerSquare = board.get(center);
        Pawn centerPawn = centerSquare.getPawn();

        if (centerPawn != null) {
            if (centerPawn.getPlayerId() != owner) {
                blocked.add(center);
                blocking.add(first);
                blocking.add(last);
            }
        } else if (centerSquare.getBoardColor() == SquareColor.forPlayer(owner)) {
            deadZones.put(center, GameState.opponentOf(owner));
            creators.add(first);
            creators.add(last);
        }
    }
}
