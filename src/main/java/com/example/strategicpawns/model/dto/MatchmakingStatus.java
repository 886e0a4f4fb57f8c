package com.example.strategicpawns.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MatchmakingStatus {
    public static final String JOINED = "matchmaking_joined";
    public static final String LEFT = "matchmaking_left";

    private String type;
    private int position;
    private String message;
}
