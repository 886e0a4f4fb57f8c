package com.example.strategicpawns.model.domain;

public enum Difficulty {
    EASY,
    MEDIUM,
    HARD,
    EXPERT
}
