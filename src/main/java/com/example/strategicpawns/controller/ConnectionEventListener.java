package com.example.strategicpawns.controller;

import com.example.strategicpawns.service.GameService;
import com.example.strategicpawns.service.MatchmakingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * A dropped connection leaves its game and the matchmaking queue.
 */
@Slf4j
@Component
public class ConnectionEventListener {

    private final GameService gameService;
    private final MatchmakingService matchmakingService;

    public ConnectionEventListener(GameService gameService, MatchmakingService matchmakingService) {
        this.gameService = gameService;
        this.matchmakingService = matchmakingService;
    }

    @EventListener
    public void onDisconnect(SessionDisconnectEvent event) {
        String handle = event.getSessionId();
        log.debug("Connection {} closed", handle);
        matchmakingService.dequeue(handle);
        gameService.handleDisconnect(handle);
    }
}
