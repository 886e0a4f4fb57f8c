package com.example.strategicpawns.codec;

import com.example.strategicpawns.logic.GameStateFactory;
import com.example.strategicpawns.model.domain.GameConfig;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class StateCompressionTest {

    @Test
    void testCompressedSnapshotIsSmallerAndInflatesBack() {
        byte[] encoded = new GameStateCodec(6)
                .encode(new GameStateFactory().initialState(GameConfig.builder().build()), 1L, 2L);

        byte[] compressed = StateCompression.compress(encoded);

        assertTrue(compressed.length < encoded.length);
        assertArrayEquals(encoded, StateCompression.decompress(compressed));
    }

    @Test
    void testGarbageIsRejected() {
        assertThrows(CodecException.class, () -> StateCompression.decompress(new byte[]{1, 2, 3, 4, 5}));
    }

    @Test
    void testTruncatedStreamIsRejected() {
        byte[] compressed = StateCompression.compress(new byte[2048]);

        assertThrows(CodecException.class,
                () -> StateCompression.decompress(Arrays.copyOf(compressed, compressed.length / 2)));
    }
}
