package com.example.strategicpawns.service;

import lombok.Value;

import java.util.function.Consumer;

@Value
public class MatchmakingEntry {
    String handle;
    String name;
    int rating;
    long joinTime;
    /** Delivers matchmaking messages to the waiting player. */
    Consumer<Object> notifier;
}
