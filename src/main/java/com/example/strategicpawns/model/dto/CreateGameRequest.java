package com.example.strategicpawns.model.dto;

import com.example.strategicpawns.model.domain.GameOptions;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateGameRequest {
    private String playerName;
    private GameOptions options;
}
