package com.example.strategicpawns.config;

import com.example.strategicpawns.codec.GameStateCodec;
import com.example.strategicpawns.logic.GameEngine;
import com.example.strategicpawns.logic.GameStateFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GameRulesConfig {

    @Bean
    public GameEngine gameEngine(GameProperties properties) {
        return new GameEngine(properties.getRules().getWinLength());
    }

    @Bean
    public GameStateFactory gameStateFactory() {
        return new GameStateFactory();
    }

    @Bean
    public GameStateCodec gameStateCodec(GameProperties properties) {
        return new GameStateCodec(properties.getRules().getPawnsPerPlayer());
    }
}
