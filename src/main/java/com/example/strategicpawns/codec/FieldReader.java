package com.example.strategicpawns.codec;

import lombok.extern.slf4j.Slf4j;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses one record into its fields. Parsing stops at the first field that
 * is truncated or carries an unknown type tag; everything read up to that
 * point stays available. A slot read with the wrong type is reported absent.
 */
@Slf4j
final class FieldReader {

    private final Map<Integer, Field> fields = new HashMap<>();

    private FieldReader() {
    }

    static FieldReader parse(ByteBuffer buffer) {
        FieldReader reader = new FieldReader();
        while (buffer.remaining() >= 2) {
            int slot = buffer.get();
            byte type = buffer.get();
            try {
                Field field = readPayload(buffer, type);
                if (field == null) {
                    log.warn("Unknown field type {} in slot {}, ignoring rest of record", type, slot);
                    break;
                }
                reader.fields.putIfAbsent(slot, field);
            } catch (BufferUnderflowException | IllegalArgumentException e) {
                log.warn("Truncated field in slot {}, ignoring rest of record", slot);
                break;
            }
        }
        return reader;
    }

    static FieldReader parse(byte[] record) {
        return parse(ByteBuffer.wrap(record));
    }

    private static Field readPayload(ByteBuffer buffer, byte type) {
        switch (type) {
            case WireFormat.TYPE_INT8:
                return new Field(type, buffer.get(), null);
            case WireFormat.TYPE_INT32:
                return new Field(type, buffer.getInt(), null);
            case WireFormat.TYPE_INT64:
                return new Field(type, buffer.getLong(), null);
            case WireFormat.TYPE_BYTES:
            case WireFormat.TYPE_LIST:
            case WireFormat.TYPE_INT32_LIST:
                int length = buffer.getInt();
                if (length < 0 || length > buffer.remaining()) {
                    throw new IllegalArgumentException("length " + length);
                }
                byte[] payload = new byte[length];
                buffer.get(payload);
                return new Field(type, 0, payload);
            default:
                return null;
        }
    }

    int int8(int slot, int defaultValue) {
        Field field = typed(slot, WireFormat.TYPE_INT8);
        return field == null ? defaultValue : (byte) field.number;
    }

    int int32(int slot, int defaultValue) {
        Field field = typed(slot, WireFormat.TYPE_INT32);
        return field == null ? defaultValue : (int) field.number;
    }

    long int64(int slot, long defaultValue) {
        Field field = typed(slot, WireFormat.TYPE_INT64);
        return field == null ? defaultValue : field.number;
    }

    byte[] bytes(int slot) {
        Field field = typed(slot, WireFormat.TYPE_BYTES);
        return field == null ? null : field.payload;
    }

    String string(int slot) {
        byte[] value = bytes(slot);
        return value == null ? null : new String(value, StandardCharsets.UTF_8);
    }

    /**
     * @return the nested records in order, or {@code null} when the slot is absent
     */
    List<byte[]> records(int slot) {
        Field field = typed(slot, WireFormat.TYPE_LIST);
        if (field == null) {
            return null;
        }
        ByteBuffer buffer = ByteBuffer.wrap(field.payload);
        List<byte[]> records = new ArrayList<>();
        while (buffer.remaining() >= 4) {
            int length = buffer.getInt();
            if (length < 0 || length > buffer.remaining()) {
                log.warn("Truncated record in slot {}", slot);
                break;
            }
            byte[] record = new byte[length];
            buffer.get(record);
            records.add(record);
        }
        return records;
    }

    List<Integer> int32List(int slot) {
        Field field = typed(slot, WireFormat.TYPE_INT32_LIST);
        if (field == null) {
            return null;
        }
        ByteBuffer buffer = ByteBuffer.wrap(field.payload);
        List<Integer> values = new ArrayList<>(field.payload.length / 4);
        while (buffer.remaining() >= 4) {
            values.add(buffer.getInt());
        }
        return values;
    }

    private Field typed(int slot, byte expectedType) {
        Field field = fields.get(slot);
        if (field == null) {
            return null;
        }
        if (field.type != expectedType) {
            log.warn("Slot {} has type {} but {} was expected, using default", slot, field.type, expectedType);
            return null;
        }
        return field;
    }

    private static final class Field {
        private final byte type;
        private final long number;
        private final byte[] payload;

        private Field(byte type, long number, byte[] payload) {
            this.type = type;
            this.number = number;
            this.payload = payload;
        }
    }
}
