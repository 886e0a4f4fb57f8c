package com.example.strategicpawns.logic;

import lombok.Value;

import java.util.Map;
import java.util.Set;

@Value
public class BoardAnalysis {
    Set<Integer> blockedPawns;
    Set<Integer> blockingPawns;
    Map<Integer, Integer> deadZoneSquares;
    Set<Integer> deadZoneCreatorPawns;
}
