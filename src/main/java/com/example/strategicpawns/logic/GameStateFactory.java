package com.example.strategicpawns.logic;

import com.example.strategicpawns.model.domain.GameConfig;
import com.example.strategicpawns.model.domain.GamePhase;
import com.example.strategicpawns.model.domain.GameState;
import com.example.strategicpawns.model.domain.Highlight;
import com.example.strategicpawns.model.domain.Square;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds fresh game states and resolves missing or out-of-range fields to
 * their documented defaults. The store runs every incoming state through
 * {@link #normalize(GameState)} before keeping it.
 */
public class GameStateFactory {

    public static final int BOARD_SIZE = 8;
    /** Squares of one colour; more pawns than that could never all be placed. */
    public static final int MAX_PAWNS_PER_PLAYER = BOARD_SIZE * BOARD_SIZE / 2;

    public GameState initialState(GameConfig config) {
        int pawns = config.getPawnsPerPlayer();
        return GameState.builder()
                .board(emptyBoard(BOARD_SIZE))
                .currentPlayerId(1)
                .gamePhase(GamePhase.PLACEMENT)
                .pawnsToPlacePlayer1(pawns)
                .pawnsToPlacePlayer2(pawns)
                .config(config)
                .build();
    }

    public static List<Square> emptyBoard(int size) {
        List<Square> board = new ArrayList<>(size * size);
        for (int row = 0; row < size; row++) {
            for (int col = 0; col < size; col++) {
                board.add(Square.empty(row, col, size));
            }
        }
        return board;
    }

    public GameState normalize(GameState state) {
        GameConfig config = state.getConfig();
        List<Square> board = state.getBoard();
        if (board.size() != BOARD_SIZE * BOARD_SIZE) {
            board = emptyBoard(BOARD_SIZE);
        }

        int currentPlayer = isPlayerId(state.getCurrentPlayerId()) ? state.getCurrentPlayerId() : 1;
        Integer winner = state.getWinner() != null && isPlayerId(state.getWinner()) ? state.getWinner() : null;

        Integer selected = state.getSelectedPawnIndex();
        if (selected != null && (selected < 0 || selected >= board.size() || board.get(selected).isEmpty())) {
            selected = null;
        }

        List<Integer> validMoves = state.getHighlightedValidMoves();
        if (selected == null && !validMoves.isEmpty()) {
            board = withoutHighlights(board);
            validMoves = List.of();
        }

        GameState normalized = state.toBuilder()
                .board(board)
                .currentPlayerId(currentPlayer)
                .pawnsToPlacePlayer1(remaining(config, state.getPawnsPlacedPlayer1(), state.getPawnsToPlacePlayer1()))
                .pawnsToPlacePlayer2(remaining(config, state.getPawnsPlacedPlayer2(), state.getPawnsToPlacePlayer2()))
                .selectedPawnIndex(selected)
                .winner(winner)
                .winningLine(winner == null ? null : state.getWinningLine())
                .highlightedValidMoves(validMoves)
                .build();
        return BoardAnalyzer.refresh(normalized);
    }

    private static int remaining(GameConfig config, int placed, int toPlace) {
        if (placed + toPlace == config.getPawnsPerPlayer()) {
            return toPlace;
        }
        return Math.max(0, config.getPawnsPerPlayer() - placed);
    }

    static List<Square> withoutHighlights(List<Square> board) {
        List<Square> cleared = new ArrayList<>(board.size());
        for (Square square : board) {
            cleared.add(square.getHighlight() == Highlight.NONE ? square : square.withHighlight(Highlight.NONE));
        }
        return cleared;
    }

    private static boolean isPlayerId(int value) {
        return value == 1 || value == 2;
    }
}
