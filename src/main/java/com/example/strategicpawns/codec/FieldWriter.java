package com.example.strategicpawns.codec;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Appends typed fields to a growing buffer.
 */
final class FieldWriter {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream(256);

    FieldWriter version(int schemaVersion) {
        out.write(schemaVersion);
        return this;
    }

    FieldWriter int8(int slot, int value) {
        header(slot, WireFormat.TYPE_INT8);
        out.write((byte) value);
        return this;
    }

    FieldWriter int32(int slot, int value) {
        header(slot, WireFormat.TYPE_INT32);
        writeInt(value);
        return this;
    }

    FieldWriter int64(int slot, long value) {
        header(slot, WireFormat.TYPE_INT64);
        writeInt((int) (value >>> 32));
        writeInt((int) value);
        return this;
    }

    FieldWriter bytes(int slot, byte[] value) {
        header(slot, WireFormat.TYPE_BYTES);
        writeInt(value.length);
        out.writeBytes(value);
        return this;
    }

    FieldWriter string(int slot, String value) {
        return bytes(slot, value.getBytes(StandardCharsets.UTF_8));
    }

    FieldWriter records(int slot, List<byte[]> records) {
        int length = 0;
        for (byte[] record : records) {
            length += 4 + record.length;
        }
        header(slot, WireFormat.TYPE_LIST);
        writeInt(length);
        for (byte[] record : records) {
            writeInt(record.length);
            out.writeBytes(record);
        }
        return this;
    }

    FieldWriter int32List(int slot, List<Integer> values) {
        header(slot, WireFormat.TYPE_INT32_LIST);
        writeInt(values.size() * 4);
        for (int value : values) {
            writeInt(value);
        }
        return this;
    }

    byte[] toByteArray() {
        return out.toByteArray();
    }

    private void header(int slot, byte type) {
        out.write((byte) slot);
        out.write(type);
    }

    private void writeInt(int value) {
        out.write(value >>> 24);
        out.write(value >>> 16);
        out.write(value >>> 8);
        out.write(value);
    }
}
