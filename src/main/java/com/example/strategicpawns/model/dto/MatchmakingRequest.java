package com.example.strategicpawns.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MatchmakingRequest {
    private String playerName;
    private Integer rating;
}
