package com.example.strategicpawns.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;
import lombok.With;

@Value
@With
public class Player {
    /** Connection handle; rebound when a player reconnects by name. */
    @JsonIgnore
    String handle;
    String name;
    int playerId;
    boolean connected;
    boolean creator;
    Integer rating;
    boolean ai;
}
