package com.example.strategicpawns.codec;

import com.example.strategicpawns.logic.GameEngine;
import com.example.strategicpawns.logic.GameStateFactory;
import com.example.strategicpawns.logic.TestBoards;
import com.example.strategicpawns.model.domain.GameAction;
import com.example.strategicpawns.model.domain.GameConfig;
import com.example.strategicpawns.model.domain.GamePhase;
import com.example.strategicpawns.model.domain.GameState;
import com.example.strategicpawns.model.domain.Highlight;
import com.example.strategicpawns.model.domain.SquareColor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.example.strategicpawns.logic.TestBoards.idx;
import static org.junit.jupiter.api.Assertions.*;

class GameStateCodecTest {

    private GameStateCodec codec;
    private GameEngine engine;
    private GameStateFactory factory;

    @BeforeEach
    void setUp() {
        codec = new GameStateCodec(6);
        engine = new GameEngine();
        factory = new GameStateFactory();
    }

    @Test
    void testInitialStateRoundTrip() {
        GameState initial = factory.initialState(GameConfig.builder().pawnsPerPlayer(6).ranked(true).matchmaking(true).build());

        GameSnapshot snapshot = codec.decode(codec.encode(initial, 7L, 1_700_000_000_000L));

        assertEquals(initial, snapshot.getState());
        assertEquals(7L, snapshot.getSequenceId());
        assertEquals(1_700_000_000_000L, snapshot.getTimestamp());
        assertEquals(WireFormat.SCHEMA_VERSION, snapshot.getSchemaVersion());
    }

    @Test
    void testRandomPlayedStatesRoundTrip() {
        Random random = new Random(7);
        for (int gameNo = 0; gameNo < 10; gameNo++) {
            GameState state = factory.initialState(GameConfig.builder().build());
            for (int turn = 0; turn < 60 && !state.isGameOver(); turn++) {
                List<GameAction> actions = legalActions(state);
                if (actions.isEmpty()) {
                    break;
                }
                state = engine.apply(state, actions.get(random.nextInt(actions.size())));
                assertEquals(state, codec.decode(codec.encode(state, turn, turn)).getState());

                if (state.getGamePhase() == GamePhase.MOVEMENT && !state.isGameOver()) {
                    // a selection in progress, with highlights on the board
                    for (int index = 0; index < 64; index++) {
                        if (engine.canSelect(state, index)) {
                            GameState selected = engine.highlightValidMoves(state, index);
                            assertEquals(selected, codec.decode(codec.encode(selected, turn, turn)).getState());
                            break;
                        }
                    }
                }
            }
        }
    }

    @Test
    void testWonMovementStateRoundTrip() {
        GameState state = TestBoards.position(
                Map.of(idx(0, 0), 1, idx(1, 1), 1, idx(2, 2), 1, idx(5, 7), 1, idx(7, 0), 2),
                GamePhase.MOVEMENT, 1);
        GameState won = engine.apply(state, GameAction.move(idx(5, 7), idx(3, 3)));
        assertNotNull(won.getWinner());

        GameState decoded = codec.decode(codec.encode(won, Long.MAX_VALUE, -1L)).getState();

        assertEquals(won, decoded);
        assertEquals(List.of(0, 9, 18, 27), decoded.getWinningLine());
        assertEquals(0, decoded.getPawnsToPlacePlayer1());
    }

    @Test
    void testVersionOnlyBufferDecodesToDefaults() {
        GameSnapshot snapshot = codec.decode(new byte[]{WireFormat.SCHEMA_VERSION});
        GameState state = snapshot.getState();

        assertEquals(1, state.getCurrentPlayerId());
        assertEquals(GamePhase.PLACEMENT, state.getGamePhase());
        assertEquals(6, state.getPawnsToPlacePlayer1());
        assertEquals(6, state.getPawnsToPlacePlayer2());
        assertEquals(0, state.getPawnsPlacedPlayer1());
        assertNull(state.getSelectedPawnIndex());
        assertNull(state.getWinner());
        assertNull(state.getLastMove());
        assertEquals(64, state.getBoard().size());
        assertEquals(0L, snapshot.getSequenceId());
    }

    @Test
    void testPawnCountsDefaultToConfiguredTotal() {
        GameStateCodec eightPawnCodec = new GameStateCodec(8);

        GameState state = eightPawnCodec.decode(new byte[]{WireFormat.SCHEMA_VERSION}).getState();

        assertEquals(8, state.getPawnsToPlacePlayer1());
        assertEquals(8, state.getConfig().getPawnsPerPlayer());
    }

    @Test
    void testUnknownSlotIsIgnored() {
        GameState state = engine.placePawn(factory.initialState(GameConfig.builder().build()), idx(0, 0));
        byte[] encoded = codec.encode(state, 3L, 4L);

        ByteArrayOutputStream extended = new ByteArrayOutputStream();
        extended.writeBytes(encoded);
        // slot 99, INT32, value 12345 followed by slot 100 with a 3-byte BYTES payload
        extended.writeBytes(new byte[]{99, WireFormat.TYPE_INT32, 0, 0, 0x30, 0x39});
        extended.writeBytes(new byte[]{100, WireFormat.TYPE_BYTES, 0, 0, 0, 3, 1, 2, 3});

        GameSnapshot snapshot = codec.decode(extended.toByteArray());

        assertEquals(state, snapshot.getState());
        assertEquals(3L, snapshot.getSequenceId());
    }

    @Test
    void testWrongWidthFieldFallsBackToDefault() {
        byte[] buffer = ByteBuffer.allocate(1 + 2 + 4)
                .put((byte) WireFormat.SCHEMA_VERSION)
                .put((byte) WireFormat.STATE_CURRENT_PLAYER)
                .put(WireFormat.TYPE_INT32)
                .putInt(2)
                .array();

        GameState state = codec.decode(buffer).getState();

        assertEquals(1, state.getCurrentPlayerId());
    }

    @Test
    void testTruncatedBufferKeepsFieldsReadSoFar() {
        GameState state = factory.initialState(GameConfig.builder().build()).toBuilder()
                .currentPlayerId(2)
                .build();
        byte[] encoded = codec.encode(state, 99L, 5L);
        byte[] truncated = Arrays.copyOf(encoded, encoded.length - 5);

        GameSnapshot snapshot = assertDoesNotThrow(() -> codec.decode(truncated));

        assertEquals(2, snapshot.getState().getCurrentPlayerId());
        assertEquals(64, snapshot.getState().getBoard().size());
    }

    @Test
    void testTruncatedBoardFallsBackToEmptyBoard() {
        byte[] buffer = ByteBuffer.allocate(1 + 2 + 4 + 2)
                .put((byte) WireFormat.SCHEMA_VERSION)
                .put((byte) WireFormat.STATE_BOARD)
                .put(WireFormat.TYPE_LIST)
                .putInt(500)
                .put(new byte[]{1, 2})
                .array();

        GameState state = codec.decode(buffer).getState();

        assertEquals(64, state.getBoard().size());
        assertTrue(state.getBoard().stream().allMatch(s -> s.isEmpty() && s.getHighlight() == Highlight.NONE));
    }

    @Test
    void testEnumerationsAreSignedBytes() {
        GameState state = TestBoards.position(Map.of(idx(0, 1), 2), GamePhase.MOVEMENT, 2);
        byte[] encoded = codec.encode(state, 0L, 0L);

        GameState decoded = codec.decode(encoded).getState();

        assertEquals(2, decoded.getCurrentPlayerId());
        assertEquals(GamePhase.MOVEMENT, decoded.getGamePhase());
        assertEquals(SquareColor.DARK, decoded.getSquare(idx(0, 1)).getBoardColor());
        assertEquals(2, decoded.getSquare(idx(0, 1)).getPawn().getPlayerId());
    }

    @Test
    void testEmptyBufferIsRejected() {
        assertThrows(CodecException.class, () -> codec.decode(new byte[0]));
    }

    private List<GameAction> legalActions(GameState state) {
        List<GameAction> actions = new ArrayList<>();
        for (int index = 0; index < 64; index++) {
            if (state.getGamePhase() == GamePhase.PLACEMENT) {
                if (engine.isValidPlacement(state, index, state.getCurrentPlayerId())) {
                    actions.add(GameAction.place(index));
                }
            } else if (engine.canSelect(state, index)) {
                for (int target : engine.getValidMoveDestinations(state, index)) {
                    actions.add(GameAction.move(index, target));
                }
            }
        }
        return actions;
    }
}
