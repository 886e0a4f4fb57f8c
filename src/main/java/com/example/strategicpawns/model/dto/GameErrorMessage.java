package com.example.strategicpawns.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GameErrorMessage {
    private String message;
    private ErrorType errorType;
    private String gameId;
}
