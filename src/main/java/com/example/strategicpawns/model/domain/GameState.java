package com.example.strategicpawns.model.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Canonical, immutable snapshot of one game. Every collection handed to the
 * builder is copied, so a state can be shared across threads freely.
 */
@Value
public class GameState {
    List<Square> board;
    int currentPlayerId;
    GamePhase gamePhase;
    int pawnsToPlacePlayer1;
    int pawnsToPlacePlayer2;
    int pawnsPlacedPlayer1;
    int pawnsPlacedPlayer2;
    Integer selectedPawnIndex;
    Set<Integer> blockedPawns;
    Set<Integer> blockingPawns;
    /** Dead-zone square index mapped to the player forbidden from using it. */
    Map<Integer, Integer> deadZoneSquares;
    Set<Integer> deadZoneCreatorPawns;
    Integer winner;
    LastMove lastMove;
    List<Integer> winningLine;
    List<Integer> highlightedValidMoves;
    GameConfig config;

    @Builder(toBuilder = true)
    private GameState(List<Square> board, int currentPlayerId, GamePhase gamePhase,
                      int pawnsToPlacePlayer1, int pawnsToPlacePlayer2,
                      int pawnsPlacedPlayer1, int pawnsPlacedPlayer2,
                      Integer selectedPawnIndex, Set<Integer> blockedPawns, Set<Integer> blockingPawns,
                      Map<Integer, Integer> deadZoneSquares, Set<Integer> deadZoneCreatorPawns,
                      Integer winner, LastMove lastMove, List<Integer> winningLine,
                      List<Integer> highlightedValidMoves, GameConfig config) {
        this.board = board == null ? List.of() : List.copyOf(board);
        this.currentPlayerId = currentPlayerId;
        this.gamePhase = gamePhase == null ? GamePhase.PLACEMENT : gamePhase;
        this.pawnsToPlacePlayer1 = pawnsToPlacePlayer1;
        this.pawnsToPlacePlayer2 = pawnsToPlacePlayer2;
        this.pawnsPlacedPlayer1 = pawnsPlacedPlayer1;
        this.pawnsPlacedPlayer2 = pawnsPlacedPlayer2;
        this.selectedPawnIndex = selectedPawnIndex;
        this.blockedPawns = sortedCopy(blockedPawns);
        this.blockingPawns = sortedCopy(blockingPawns);
        this.deadZoneSquares = deadZoneSquares == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(deadZoneSquares));
        this.deadZoneCreatorPawns = sortedCopy(deadZoneCreatorPawns);
        this.winner = winner;
        this.lastMove = lastMove;
        this.winningLine = winningLine == null ? null : List.copyOf(winningLine);
        this.highlightedValidMoves = highlightedValidMoves == null ? List.of() : List.copyOf(highlightedValidMoves);
        this.config = config == null ? GameConfig.builder().build() : config;
    }

    private static Set<Integer> sortedCopy(Collection<Integer> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptySortedSet();
        }
        return Collections.unmodifiableSortedSet(new TreeSet<>(values));
    }

    public int getBoardSize() {
        return (int) Math.round(Math.sqrt(board.size()));
    }

    public Square getSquare(int index) {
        return board.get(index);
    }

    public int getPawnsToPlace(int playerId) {
        return playerId == 1 ? pawnsToPlacePlayer1 : pawnsToPlacePlayer2;
    }

    public int getPawnsPlaced(int playerId) {
        return playerId == 1 ? pawnsPlacedPlayer1 : pawnsPlacedPlayer2;
    }

    public boolean isGameOver() {
        return winner != null;
    }

    public static int opponentOf(int playerId) {
        return playerId == 1 ? 2 : 1;
    }
}
