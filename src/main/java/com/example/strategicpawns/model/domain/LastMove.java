package com.example.strategicpawns.model.domain;

import lombok.Value;

/**
 * {@code from} is null for a placement.
 */
@Value
public class LastMove {
    Integer from;
    int to;
}
