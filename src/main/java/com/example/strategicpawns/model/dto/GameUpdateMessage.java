package com.example.strategicpawns.model.dto;

import com.example.strategicpawns.codec.DeltaUpdate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Broadcast on {@code /topic/game/{gameId}} after every accepted action.
 * A full update carries the zlib-compressed snapshot (base64 in JSON); a delta
 * carries only the changes since the previous sequence id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameUpdateMessage {
    public static final String FULL = "game_updated";
    public static final String DELTA = "game_delta";

    private String type;
    private String gameId;
    private long sequenceId;
    private long timestamp;
    private boolean fullUpdate;
    private byte[] gameState;
    private List<DeltaUpdate> updates;
}
