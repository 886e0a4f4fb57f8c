package com.example.strategicpawns.logic;

import com.example.strategicpawns.model.domain.GameAction;
import com.example.strategicpawns.model.domain.GamePhase;
import com.example.strategicpawns.model.domain.GameState;
import com.example.strategicpawns.model.domain.Highlight;
import com.example.strategicpawns.model.domain.LastMove;
import com.example.strategicpawns.model.domain.Pawn;
import com.example.strategicpawns.model.domain.Square;
import com.example.strategicpawns.model.domain.SquareColor;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure Java class containing all game rules.
 * Stateless and thread-safe: every operation takes an immutable {@link GameState}
 * and returns a new one, or {@code null} when the action is illegal.
 */
public class GameEngine {

    private static final int[][] DIAGONALS = {{1, 1}, {1, -1}};

    private final int winLength;

    public GameEngine() {
        this(4);
    }

    public GameEngine(int winLength) {
        this.winLength = winLength;
    }

    public GameState apply(GameState state, GameAction action) {
        switch (action.getType()) {
            case PLACE:
                return placePawn(state, action.getSquareIndex());
            case SELECT:
                return canSelect(state, action.getSquareIndex())
                        ? highlightValidMoves(state, action.getSquareIndex())
                        : null;
            case DESELECT:
                return clearHighlights(state);
            case MOVE:
                GameState selected = state;
                Integer current = state.getSelectedPawnIndex();
                if (current == null || current != action.getFromIndex()) {
                    if (!canSelect(state, action.getFromIndex())) {
                        return null;
                    }
                    selected = highlightValidMoves(state, action.getFromIndex());
                }
                return movePawn(selected, action.getFromIndex(), action.getToIndex());
            default:
                throw new IllegalArgumentException("Unknown action type: " + action.getType());
        }
    }

    // --- Placement ---

    public boolean isValidPlacement(GameState state, int index, int playerId) {
        if (state.isGameOver() || state.getGamePhase() != GamePhase.PLACEMENT) {
            return false;
        }
        if (!inBounds(state, index) || state.getPawnsToPlace(playerId) <= 0) {
            return false;
        }
        Square square = state.getSquare(index);
        if (!square.isEmpty() || square.getBoardColor() != SquareColor.forPlayer(playerId)) {
            return false;
        }
        return !isRestrictedZone(state, index, playerId);
    }

    /**
     * A square is restricted when two opponent pawns flank it on a row or a column.
     */
    public boolean isRestrictedZone(GameState state, int index, int playerId) {
        int size = state.getBoardSize();
        int row = index / size;
        int col = index % size;
        int opponent = GameState.opponentOf(playerId);

        if (col > 0 && col < size - 1
                && state.getSquare(index - 1).isOwnedBy(opponent)
                && state.getSquare(index + 1).isOwnedBy(opponent)) {
            return true;
        }
        return row > 0 && row < size - 1
                && state.getSquare(index - size).isOwnedBy(opponent)
                && state.getSquare(index + size).isOwnedBy(opponent);
    }

    public GameState placePawn(GameState state, int index) {
        int player = state.getCurrentPlayerId();
        if (!isValidPlacement(state, index, player)) {
            return null;
        }

        Pawn pawn = new Pawn(Pawn.idFor(player, state.getPawnsPlaced(player) + 1), player, SquareColor.forPlayer(player));
        List<Square> board = GameStateFactory.withoutHighlights(state.getBoard());
        board.set(index, board.get(index).withPawn(pawn));

        int toPlace1 = state.getPawnsToPlacePlayer1() - (player == 1 ? 1 : 0);
        int toPlace2 = state.getPawnsToPlacePlayer2() - (player == 2 ? 1 : 0);
        GamePhase phase = toPlace1 == 0 && toPlace2 == 0 ? GamePhase.MOVEMENT : GamePhase.PLACEMENT;

        GameState placed = state.toBuilder()
                .board(board)
                .pawnsToPlacePlayer1(toPlace1)
                .pawnsToPlacePlayer2(toPlace2)
                .pawnsPlacedPlayer1(state.getPawnsPlacedPlayer1() + (player == 1 ? 1 : 0))
                .pawnsPlacedPlayer2(state.getPawnsPlacedPlayer2() + (player == 2 ? 1 : 0))
                .gamePhase(phase)
                .build();
        return finishTurn(placed, player, new LastMove(null, index));
    }

    // --- Movement ---

    public boolean canSelect(GameState state, int index) {
        if (state.isGameOver() || state.getGamePhase() != GamePhase.MOVEMENT || !inBounds(state, index)) {
            return false;
        }
        return state.getSquare(index).isOwnedBy(state.getCurrentPlayerId())
                && !state.getBlockedPawns().contains(index);
    }

    public List<Integer> getValidMoveDestinations(GameState state, int fromIndex) {
        if (!canSelect(state, fromIndex)) {
            return List.of();
        }
        SquareColor color = SquareColor.forPlayer(state.getCurrentPlayerId());
        List<Integer> destinations = new ArrayList<>();
        for (Square square : state.getBoard()) {
            if (square.isEmpty() && square.getBoardColor() == color) {
                destinations.add(square.getIndex());
            }
        }
        return destinations;
    }

    /**
     * Selects the pawn on {@code index} and marks every square it may move to.
     * Selecting the already selected pawn, or a pawn that cannot move, yields a
     * deselected state instead of a failure.
     */
    public GameState highlightValidMoves(GameState state, int index) {
        Integer current = state.getSelectedPawnIndex();
        if (!canSelect(state, index) || (current != null && current == index)) {
            return clearHighlights(state);
        }

        List<Integer> destinations = getValidMoveDestinations(state, index);
        List<Square> board = new ArrayList<>(state.getBoard().size());
        for (Square square : state.getBoard()) {
            Highlight highlight = Highlight.NONE;
            if (square.getIndex() == index) {
                highlight = Highlight.SELECTED_PAWN;
            } else if (destinations.contains(square.getIndex())) {
                highlight = Highlight.VALID_MOVE;
            }
            board.add(square.withHighlight(highlight));
        }
        return state.toBuilder()
                .board(board)
                .selectedPawnIndex(index)
                .highlightedValidMoves(destinations)
                .build();
    }

    public GameState movePawn(GameState state, int fromIndex, int toIndex) {
        Integer selected = state.getSelectedPawnIndex();
        if (selected == null || selected != fromIndex || !state.getHighlightedValidMoves().contains(toIndex)) {
            return null;
        }
        if (!canSelect(state, fromIndex) || !inBounds(state, toIndex)) {
            return null;
        }
        int player = state.getCurrentPlayerId();
        Square target = state.getSquare(toIndex);
        if (!target.isEmpty() || target.getBoardColor() != SquareColor.forPlayer(player)) {
            return null;
        }

        List<Square> board = GameStateFactory.withoutHighlights(state.getBoard());
        Pawn pawn = board.get(fromIndex).getPawn();
        board.set(fromIndex, board.get(fromIndex).withPawn(null));
        board.set(toIndex, board.get(toIndex).withPawn(pawn));

        return finishTurn(state.toBuilder().board(board).build(), player, new LastMove(fromIndex, toIndex));
    }

    public GameState clearHighlights(GameState state) {
        return state.toBuilder()
                .board(GameStateFactory.withoutHighlights(state.getBoard()))
                .selectedPawnIndex(null)
                .highlightedValidMoves(List.of())
                .build();
    }

    // --- Win detection ---

    /**
     * Scans every square as the start of a diagonal of {@code winLength} squares.
     * The first eligible line in row-major, down-right-then-down-left order wins.
     *
     * @return the winning line, or {@code null}
     */
    public List<Integer> findWinningLine(GameState state, int playerId) {
        int size = state.getBoardSize();
        SquareColor color = SquareColor.forPlayer(playerId);

        for (int row = 0; row < size; row++) {
            for (int col = 0; col < size; col++) {
                for (int[] direction : DIAGONALS) {
                    List<Integer> line = new ArrayList<>(winLength);
                    for (int step = 0; step < winLength; step++) {
                        int r = row + direction[0] * step;
                        int c = col + direction[1] * step;
                        if (r < 0 || r >= size || c < 0 || c >= size) {
                            break;
                        }
                        int index = r * size + c;
                        if (!isWinEligible(state, index, playerId, color)) {
                            break;
                        }
                        line.add(index);
                    }
                    if (line.size() == winLength) {
                        return line;
                    }
                }
            }
        }
        return null;
    }

    private boolean isWinEligible(GameState state, int index, int playerId, SquareColor color) {
        Square square = state.getSquare(index);
        Integer forbidden = state.getDeadZoneSquares().get(index);
        return square.isOwnedBy(playerId)
                && square.getBoardColor() == color
                && !state.getBlockedPawns().contains(index)
                && !state.getBlockingPawns().contains(index)
                && !state.getDeadZoneCreatorPawns().contains(index)
                && (forbidden == null || forbidden != playerId);
    }

    private GameState finishTurn(GameState moved, int player, LastMove lastMove) {
        GameState analysed = BoardAnalyzer.refresh(moved);
        List<Integer> line = findWinningLine(analysed, player);
        return analysed.toBuilder()
                .winner(line == null ? null : player)
                .winningLine(line)
                .currentPlayerId(line == null ? GameState.opponentOf(player) : player)
                .selectedPawnIndex(null)
                .highlightedValidMoves(List.of())
                .lastMove(lastMove)
                .build();
    }

    private static boolean inBounds(GameState state, int index) {
        return index >= 0 && index < state.getBoard().size();
    }
}
