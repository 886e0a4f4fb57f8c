package com.example.strategicpawns.codec;

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * zlib framing around encoded snapshots.
 */
public final class StateCompression {

    private static final int MAX_INFLATED_SIZE = 1 << 20;

    private StateCompression() {
    }

    public static byte[] compress(byte[] data) {
        Deflater deflater = new Deflater(Deflater.BEST_COMPRESSION);
        try {
            deflater.setInput(data);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length / 2));
            byte[] chunk = new byte[1024];
            while (!deflater.finished()) {
                int written = deflater.deflate(chunk);
                out.write(chunk, 0, written);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    public static byte[] decompress(byte[] data) {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(data);
            ByteArrayOutputStream out = new ByteArrayOutputStream(data.length * 4);
            byte[] chunk = new byte[1024];
            while (!inflater.finished()) {
                int read = inflater.inflate(chunk);
                if (read == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new CodecException("Compressed snapshot is truncated");
                }
                out.write(chunk, 0, read);
                if (out.size() > MAX_INFLATED_SIZE) {
                    throw new CodecException("Inflated snapshot exceeds " + MAX_INFLATED_SIZE + " bytes");
                }
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            throw new CodecException("Snapshot is not valid zlib data", e);
        } finally {
            inflater.end();
        }
    }
}
