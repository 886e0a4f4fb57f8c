package com.example.strategicpawns.controller;

import com.example.strategicpawns.model.dto.CreateGameRequest;
import com.example.strategicpawns.model.dto.ErrorType;
import com.example.strategicpawns.model.dto.JoinGameRequest;
import com.example.strategicpawns.model.dto.MoveRequest;
import com.example.strategicpawns.service.GameBroadcaster;
import com.example.strategicpawns.service.GameService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

/**
 * STOMP endpoints for playing a game. The WebSocket session id identifies
 * the connection (the "handle") in every call.
 */
@Slf4j
@Controller
public class GameSocketController {

    private final GameService gameService;
    private final GameBroadcaster broadcaster;

    public GameSocketController(GameService gameService, GameBroadcaster broadcaster) {
        this.gameService = gameService;
        this.broadcaster = broadcaster;
    }

    /**
     * Client sends to: /app/game/create, answer on /user/queue/game-created
     */
    @MessageMapping("/game/create")
    public void createGame(@Payload CreateGameRequest request, SimpMessageHeaderAccessor headers) {
        gameService.createGame(headers.getSessionId(), request.getPlayerName(), request.getOptions());
    }

    /**
     * Client sends to: /app/game/join, answer on /user/queue/game-joined
     */
    @MessageMapping("/game/join")
    public void joinGame(@Payload JoinGameRequest request, SimpMessageHeaderAccessor headers) {
        gameService.joinGame(headers.getSessionId(), request.getGameId(), request.getPlayerName());
    }

    @MessageMapping("/game/{gameId}/place")
    public void placePawn(@DestinationVariable String gameId, @Payload MoveRequest move,
                          SimpMessageHeaderAccessor headers) {
        gameService.placePawn(gameId, headers.getSessionId(), move.getSquareIndex());
    }

    @MessageMapping("/game/{gameId}/select")
    public void selectPawn(@DestinationVariable String gameId, @Payload MoveRequest move,
                           SimpMessageHeaderAccessor headers) {
        gameService.selectPawn(gameId, headers.getSessionId(), move.getSquareIndex());
    }

    @MessageMapping("/game/{gameId}/deselect")
    public void deselectPawn(@DestinationVariable String gameId, SimpMessageHeaderAccessor headers) {
        gameService.deselectPawn(gameId, headers.getSessionId());
    }

    @MessageMapping("/game/{gameId}/move")
    public void movePawn(@DestinationVariable String gameId, @Payload MoveRequest move,
                         SimpMessageHeaderAccessor headers) {
        gameService.movePawn(gameId, headers.getSessionId(), move.getFromIndex(), move.getToIndex());
    }

    /**
     * Resync: sends the full compressed snapshot to /user/queue/game-state.
     */
    @MessageMapping("/game/{gameId}/state")
    public void requestState(@DestinationVariable String gameId, SimpMessageHeaderAccessor headers) {
        gameService.sendFullState(gameId, headers.getSessionId());
    }

    @MessageMapping("/game/{gameId}/leave")
    public void leaveGame(@DestinationVariable String gameId, SimpMessageHeaderAccessor headers) {
        gameService.leaveGame(gameId, headers.getSessionId());
    }

    @MessageExceptionHandler
    public void handleException(Exception e, SimpMessageHeaderAccessor headers) {
        log.error("Unhandled error for connection {}", headers.getSessionId(), e);
        broadcaster.sendError(headers.getSessionId(), ErrorType.SERVER_ERROR, "An unexpected server error occurred.", null);
    }
}
