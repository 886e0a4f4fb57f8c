package com.example.strategicpawns.logic;

import com.example.strategicpawns.model.domain.Pawn;
import com.example.strategicpawns.model.domain.Square;
import com.example.strategicpawns.model.domain.SquareColor;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.strategicpawns.logic.TestBoards.idx;
import static org.junit.jupiter.api.Assertions.*;

class BoardAnalyzerTest {

    @Test
    void testHorizontalSandwichBlocksCenterPawn() {
        List<Square> board = boardWith(Map.of(idx(2, 0), 1, idx(2, 1), 2, idx(2, 2), 1));

        BoardAnalysis analysis = BoardAnalyzer.analyze(board);

        assertEquals(Set.of(idx(2, 1)), analysis.getBlockedPawns());
        assertEquals(Set.of(idx(2, 0), idx(2, 2)), analysis.getBlockingPawns());
        assertTrue(analysis.getDeadZoneSquares().isEmpty());
    }

    @Test
    void testVerticalSandwichBlocksCenterPawn() {
        List<Square> board = boardWith(Map.of(idx(3, 5), 2, idx(4, 5), 1, idx(5, 5), 2));

        BoardAnalysis analysis = BoardAnalyzer.analyze(board);

        assertEquals(Set.of(idx(4, 5)), analysis.getBlockedPawns());
        assertEquals(Set.of(idx(3, 5), idx(5, 5)), analysis.getBlockingPawns());
    }

    @Test
    void testSameOwnerRunIsNotABlock() {
        List<Square> board = boardWith(Map.of(idx(0, 0), 1, idx(0, 1), 1, idx(0, 2), 1));

        BoardAnalysis analysis = BoardAnalyzer.analyze(board);

        assertTrue(analysis.getBlockedPawns().isEmpty());
        assertTrue(analysis.getBlockingPawns().isEmpty());
    }

    @Test
    void testEmptyCenterOfOwnersColorBecomesDeadZoneForOpponent() {
        // (0,2) is light, the color of player 1
        List<Square> board = boardWith(Map.of(idx(0, 1), 1, idx(0, 3), 1));

        BoardAnalysis analysis = BoardAnalyzer.analyze(board);

        assertEquals(Map.of(idx(0, 2), 2), analysis.getDeadZoneSquares());
        assertEquals(Set.of(idx(0, 1), idx(0, 3)), analysis.getDeadZoneCreatorPawns());
    }

    @Test
    void testEmptyCenterOfOtherColorIsNotADeadZone() {
        // (0,1) is dark, not the color of player 1
        List<Square> board = boardWith(Map.of(idx(0, 0), 1, idx(0, 2), 1));

        BoardAnalysis analysis = BoardAnalyzer.analyze(board);

        assertTrue(analysis.getDeadZoneSquares().isEmpty());
        assertTrue(analysis.getDeadZoneCreatorPawns().isEmpty());
    }

    /**
     * Places pawns regardless of square color so patterns that legal play
     * cannot reach can still be checked.
     */
    private static List<Square> boardWith(Map<Integer, Integer> pawns) {
        List<Square> board = GameStateFactory.emptyBoard(GameStateFactory.BOARD_SIZE);
        pawns.forEach((index, owner) -> board.set(index, board.get(index)
                .withPawn(new Pawn("p" + owner + "_" + index, owner, SquareColor.forPlayer(owner)))));
        return board;
    }
}
