package com.example.strategicpawns.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tunables for the game server, bound from {@code strategic-pawns.*} in application.yml.
 */
@Data
@Component
@ConfigurationProperties(prefix = "strategic-pawns")
public class GameProperties {

    private Store store = new Store();
    private Matchmaking matchmaking = new Matchmaking();
    private Rules rules = new Rules();
    private PlayerSettings player = new PlayerSettings();
    private Broadcast broadcast = new Broadcast();

    @Data
    public static class Store {
        /** Idle time after the last player leaves before a session is deleted. */
        private Duration gameTtl = Duration.ofHours(24);
        private Duration sweepInterval = Duration.ofMinutes(30);
    }

    @Data
    public static class Matchmaking {
        private Duration tickInterval = Duration.ofSeconds(5);
        private int defaultRating = 1000;
    }

    @Data
    public static class Rules {
        private int pawnsPerPlayer = 6;
        private int winLength = 4;
    }

    @Data
    public static class PlayerSettings {
        private int maxNameLength = 30;
    }

    @Data
    public static class Broadcast {
        /** Every n-th sequence id gets a full snapshot instead of a delta. */
        private int fullStateEvery = 10;
        private int maxDeltaUpdates = 10;
    }
}
