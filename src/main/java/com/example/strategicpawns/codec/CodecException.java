package com.example.strategicpawns.codec;

/**
 * Raised when a buffer cannot be read at all, e.g. it has no version header
 * or fails to inflate. Anomalies inside a readable buffer never raise this;
 * the affected fields fall back to their defaults instead.
 */
public class CodecException extends RuntimeException {

    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
