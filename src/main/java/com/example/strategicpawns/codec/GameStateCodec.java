package com.example.strategicpawns.codec;

import com.example.strategicpawns.logic.BoardAnalyzer;
import com.example.strategicpawns.logic.GameStateFactory;
import com.example.strategicpawns.model.domain.GameConfig;
import com.example.strategicpawns.model.domain.GamePhase;
import com.example.strategicpawns.model.domain.GameState;
import com.example.strategicpawns.model.domain.Highlight;
import com.example.strategicpawns.model.domain.LastMove;
import com.example.strategicpawns.model.domain.Pawn;
import com.example.strategicpawns.model.domain.Square;
import com.example.strategicpawns.model.domain.SquareColor;
import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Encodes game snapshots into the versioned binary format described in
 * {@link WireFormat} and decodes them back.
 * <p>
 * Blocking and dead-zone markers are never put on the wire: the decoder
 * recomputes them from the board. Highlighted move targets are recovered from
 * the per-square highlight tags.
 */
@Slf4j
public class GameStateCodec {

    private final int defaultPawnsPerPlayer;

    public GameStateCodec(int defaultPawnsPerPlayer) {
        this.defaultPawnsPerPlayer = defaultPawnsPerPlayer;
    }

    public byte[] encode(GameState state, long sequenceId, long timestamp) {
        List<byte[]> squares = new ArrayList<>(state.getBoard().size());
        for (Square square : state.getBoard()) {
            squares.add(encodeSquare(square));
        }

        FieldWriter writer = new FieldWriter()
                .version(WireFormat.SCHEMA_VERSION)
                .records(WireFormat.STATE_BOARD, squares)
                .int8(WireFormat.STATE_CURRENT_PLAYER, state.getCurrentPlayerId())
                .int8(WireFormat.STATE_GAME_PHASE, state.getGamePhase().getCode())
                .int32(WireFormat.STATE_TO_PLACE_P1, state.getPawnsToPlacePlayer1())
                .int32(WireFormat.STATE_TO_PLACE_P2, state.getPawnsToPlacePlayer2())
                .int32(WireFormat.STATE_PLACED_P1, state.getPawnsPlacedPlayer1())
                .int32(WireFormat.STATE_PLACED_P2, state.getPawnsPlacedPlayer2())
                .int32(WireFormat.STATE_SELECTED_PAWN,
                        state.getSelectedPawnIndex() == null ? WireFormat.NO_INDEX : state.getSelectedPawnIndex())
                .int8(WireFormat.STATE_WINNER,
                        state.getWinner() == null ? WireFormat.NO_WINNER : state.getWinner());

        LastMove lastMove = state.getLastMove();
        if (lastMove != null) {
            writer.int32(WireFormat.STATE_LAST_MOVE_FROM,
                            lastMove.getFrom() == null ? WireFormat.NO_INDEX : lastMove.getFrom())
                    .int32(WireFormat.STATE_LAST_MOVE_TO, lastMove.getTo());
        }
        writer.int64(WireFormat.STATE_SEQUENCE_ID, sequenceId)
                .int64(WireFormat.STATE_TIMESTAMP, timestamp);
        if (state.getWinningLine() != null) {
            writer.int32List(WireFormat.STATE_WINNING_LINE, state.getWinningLine());
        }

        GameConfig config = state.getConfig();
        int flags = (config.isPublicGame() ? WireFormat.FLAG_PUBLIC : 0)
                | (config.isMatchmaking() ? WireFormat.FLAG_MATCHMAKING : 0)
                | (config.isRanked() ? WireFormat.FLAG_RANKED : 0);
        return writer.int32(WireFormat.STATE_PAWNS_PER_PLAYER, config.getPawnsPerPlayer())
                .int8(WireFormat.STATE_OPTION_FLAGS, flags)
                .toByteArray();
    }

    private byte[] encodeSquare(Square square) {
        FieldWriter writer = new FieldWriter()
                .int32(WireFormat.SQUARE_INDEX, square.getIndex())
                .int32(WireFormat.SQUARE_ROW, square.getRow())
                .int32(WireFormat.SQUARE_COL, square.getCol())
                .int8(WireFormat.SQUARE_COLOR, square.getBoardColor().getCode());
        Pawn pawn = square.getPawn();
        if (pawn != null) {
            writer.bytes(WireFormat.SQUARE_PAWN, new FieldWriter()
                    .string(WireFormat.PAWN_ID, pawn.getId())
                    .int8(WireFormat.PAWN_PLAYER, pawn.getPlayerId())
                    .int8(WireFormat.PAWN_COLOR, pawn.getColor().getCode())
                    .toByteArray());
        }
        return writer.int8(WireFormat.SQUARE_HIGHLIGHT, square.getHighlight().getCode())
                .toByteArray();
    }

    public GameSnapshot decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new CodecException("Snapshot has no schema version header");
        }
        ByteBuffer buffer = ByteBuffer.wrap(data);
        int version = buffer.get();
        if (version != WireFormat.SCHEMA_VERSION) {
            log.debug("Decoding snapshot with schema version {} (reader is {})", version, WireFormat.SCHEMA_VERSION);
        }
        FieldReader reader = FieldReader.parse(buffer);

        int flags = reader.int8(WireFormat.STATE_OPTION_FLAGS, 0);
        int pawnsPerPlayer = reader.int32(WireFormat.STATE_PAWNS_PER_PLAYER, defaultPawnsPerPlayer);
        GameConfig config = GameConfig.builder()
                .pawnsPerPlayer(pawnsPerPlayer)
                .publicGame((flags & WireFormat.FLAG_PUBLIC) != 0)
                .matchmaking((flags & WireFormat.FLAG_MATCHMAKING) != 0)
                .ranked((flags & WireFormat.FLAG_RANKED) != 0)
                .build();

        List<Square> board = decodeBoard(reader.records(WireFormat.STATE_BOARD));
        List<Integer> validMoves = new ArrayList<>();
        for (Square square : board) {
            if (square.getHighlight() == Highlight.VALID_MOVE) {
                validMoves.add(square.getIndex());
            }
        }

        int selected = reader.int32(WireFormat.STATE_SELECTED_PAWN, WireFormat.NO_INDEX);
        int winner = reader.int8(WireFormat.STATE_WINNER, WireFormat.NO_WINNER);
        int lastFrom = reader.int32(WireFormat.STATE_LAST_MOVE_FROM, WireFormat.NO_INDEX);
        int lastTo = reader.int32(WireFormat.STATE_LAST_MOVE_TO, WireFormat.NO_INDEX);

        GameState state = GameState.builder()
                .board(board)
                .currentPlayerId(reader.int8(WireFormat.STATE_CURRENT_PLAYER, 1))
                .gamePhase(GamePhase.fromCode(reader.int8(WireFormat.STATE_GAME_PHASE, 0), GamePhase.PLACEMENT))
                .pawnsToPlacePlayer1(reader.int32(WireFormat.STATE_TO_PLACE_P1, pawnsPerPlayer))
                .pawnsToPlacePlayer2(reader.int32(WireFormat.STATE_TO_PLACE_P2, pawnsPerPlayer))
                .pawnsPlacedPlayer1(reader.int32(WireFormat.STATE_PLACED_P1, 0))
                .pawnsPlacedPlayer2(reader.int32(WireFormat.STATE_PLACED_P2, 0))
                .selectedPawnIndex(selected < 0 ? null : selected)
                .winner(winner == WireFormat.NO_WINNER ? null : winner)
                .lastMove(lastTo < 0 ? null : new LastMove(lastFrom < 0 ? null : lastFrom, lastTo))
                .winningLine(reader.int32List(WireFormat.STATE_WINNING_LINE))
                .highlightedValidMoves(validMoves)
                .config(config)
                .build();

        return new GameSnapshot(BoardAnalyzer.refresh(state),
                reader.int64(WireFormat.STATE_SEQUENCE_ID, 0L),
                reader.int64(WireFormat.STATE_TIMESTAMP, 0L),
                version);
    }

    private List<Square> decodeBoard(List<byte[]> records) {
        int size = GameStateFactory.BOARD_SIZE;
        if (records == null || records.size() != size * size) {
            if (records != null) {
                log.warn("Board has {} squares, expected {}; using an empty board", records.size(), size * size);
            }
            return GameStateFactory.emptyBoard(size);
        }
        List<Square> board = new ArrayList<>(records.size());
        for (int position = 0; position < records.size(); position++) {
            board.add(decodeSquare(FieldReader.parse(records.get(position)), position, size));
        }
        return board;
    }

    private Square decodeSquare(FieldReader reader, int position, int size) {
        int index = reader.int32(WireFormat.SQUARE_INDEX, position);
        int row = reader.int32(WireFormat.SQUARE_ROW, index / size);
        int col = reader.int32(WireFormat.SQUARE_COL, index % size);
        SquareColor color = SquareColor.fromCode(
                reader.int8(WireFormat.SQUARE_COLOR, SquareColor.LIGHT.getCode()), SquareColor.LIGHT);

        Pawn pawn = null;
        byte[] pawnRecord = reader.bytes(WireFormat.SQUARE_PAWN);
        if (pawnRecord != null) {
            FieldReader pawnReader = FieldReader.parse(pawnRecord);
            int playerId = pawnReader.int8(WireFormat.PAWN_PLAYER, 1);
            String id = pawnReader.string(WireFormat.PAWN_ID);
            SquareColor pawnColor = SquareColor.fromCode(
                    pawnReader.int8(WireFormat.PAWN_COLOR, SquareColor.forPlayer(playerId).getCode()),
                    SquareColor.forPlayer(playerId));
            pawn = new Pawn(id == null ? "p" + playerId + "_" + index : id, playerId, pawnColor);
        }
        Highlight highlight = Highlight.fromCode(reader.int8(WireFormat.SQUARE_HIGHLIGHT, Highlight.NONE.getCode()));
        return new Square(index, row, col, color, pawn, highlight);
    }
}
