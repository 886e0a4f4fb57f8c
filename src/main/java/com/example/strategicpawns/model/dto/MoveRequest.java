package com.example.strategicpawns.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Shared by place and select ({@code squareIndex}) and move ({@code fromIndex}, {@code toIndex}).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MoveRequest {
    private int squareIndex = -1;
    private int fromIndex = -1;
    private int toIndex = -1;
}
