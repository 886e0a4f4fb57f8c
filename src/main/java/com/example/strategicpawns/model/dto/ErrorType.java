package com.example.strategicpawns.model.dto;

public enum ErrorType {
    JOIN_FAILED,
    GAME_NOT_FOUND,
    GAME_FULL,
    INVALID_MOVE,
    NOT_YOUR_TURN,
    MATCHMAKING_ERROR,
    SERVER_ERROR
}
