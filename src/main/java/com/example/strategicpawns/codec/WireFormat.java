package com.example.strategicpawns.codec;

/**
 * Slot numbers and type tags of the binary snapshot format.
 * <p>
 * A snapshot starts with a one-byte schema version, followed by fields of the
 * form {@code [slot:int8][type:int8][payload]}. Integers are big-endian and
 * signed. Variable-length payloads carry an int32 byte length so readers can
 * skip slots they do not know. Nested records (squares, pawns) use the same
 * field layout without the version byte.
 */
public final class WireFormat {

    public static final int SCHEMA_VERSION = 1;

    // field types
    public static final byte TYPE_INT8 = 1;
    public static final byte TYPE_INT32 = 2;
    public static final byte TYPE_INT64 = 3;
    public static final byte TYPE_BYTES = 4;
    /** Sequence of length-prefixed nested records. */
    public static final byte TYPE_LIST = 5;
    public static final byte TYPE_INT32_LIST = 6;

    // game state slots
    public static final int STATE_BOARD = 0;
    public static final int STATE_CURRENT_PLAYER = 1;
    public static final int STATE_GAME_PHASE = 2;
    public static final int STATE_TO_PLACE_P1 = 3;
    public static final int STATE_TO_PLACE_P2 = 4;
    public static final int STATE_PLACED_P1 = 5;
    public static final int STATE_PLACED_P2 = 6;
    public static final int STATE_SELECTED_PAWN = 7;
    public static final int STATE_WINNER = 8;
    public static final int STATE_LAST_MOVE_FROM = 9;
    public static final int STATE_LAST_MOVE_TO = 10;
    public static final int STATE_SEQUENCE_ID = 11;
    public static final int STATE_TIMESTAMP = 12;
    public static final int STATE_WINNING_LINE = 13;
    public static final int STATE_PAWNS_PER_PLAYER = 14;
    public static final int STATE_OPTION_FLAGS = 15;

    // square slots
    public static final int SQUARE_INDEX = 0;
    public static final int SQUARE_ROW = 1;
    public static final int SQUARE_COL = 2;
    public static final int SQUARE_COLOR = 3;
    public static final int SQUARE_PAWN = 4;
    public static final int SQUARE_HIGHLIGHT = 5;

    // pawn slots
    public static final int PAWN_ID = 0;
    public static final int PAWN_PLAYER = 1;
    public static final int PAWN_COLOR = 2;

    // option flag bits
    public static final int FLAG_PUBLIC = 1;
    public static final int FLAG_MATCHMAKING = 1 << 1;
    public static final int FLAG_RANKED = 1 << 2;

    public static final int NO_INDEX = -1;
    public static final int NO_WINNER = 0;

    private WireFormat() {
    }
}
