package com.example.strategicpawns.controller;

import com.example.strategicpawns.model.dto.ErrorType;
import com.example.strategicpawns.model.dto.MatchmakingRequest;
import com.example.strategicpawns.model.dto.MatchmakingStatus;
import com.example.strategicpawns.service.GameBroadcaster;
import com.example.strategicpawns.service.GameService;
import com.example.strategicpawns.service.MatchmakingService;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

@Controller
public class MatchmakingController {

    public static final String MATCHMAKING_QUEUE = "/queue/matchmaking";

    private final MatchmakingService matchmakingService;
    private final GameService gameService;
    private final GameBroadcaster broadcaster;

    public MatchmakingController(MatchmakingService matchmakingService, GameService gameService,
                                 GameBroadcaster broadcaster) {
        this.matchmakingService = matchmakingService;
        this.gameService = gameService;
        this.broadcaster = broadcaster;
    }

    /**
     * Client sends to: /app/matchmaking/join. Queue position and the eventual
     * match arrive on /user/queue/matchmaking.
     */
    @MessageMapping("/matchmaking/join")
    public void joinQueue(@Payload MatchmakingRequest request, SimpMessageHeaderAccessor headers) {
        String handle = headers.getSessionId();
        String name = gameService.validateName(request.getPlayerName());
        if (name == null) {
            broadcaster.sendError(handle, ErrorType.MATCHMAKING_ERROR, "Player name is required to join matchmaking.", null);
            return;
        }
        try {
            int position = matchmakingService.enqueue(handle, name, request.getRating(),
                    message -> broadcaster.sendToPlayer(handle, MATCHMAKING_QUEUE, message));
            broadcaster.sendToPlayer(handle, MATCHMAKING_QUEUE, new MatchmakingStatus(MatchmakingStatus.JOINED,
                    position, "Waiting for an opponent..."));
        } catch (IllegalStateException e) {
            broadcaster.sendError(handle, ErrorType.MATCHMAKING_ERROR, e.getMessage(), null);
        }
    }

    @MessageMapping("/matchmaking/leave")
    public void leaveQueue(SimpMessageHeaderAccessor headers) {
        String handle = headers.getSessionId();
        if (matchmakingService.dequeue(handle)) {
            broadcaster.sendToPlayer(handle, MATCHMAKING_QUEUE,
                    new MatchmakingStatus(MatchmakingStatus.LEFT, 0, "You left the matchmaking queue."));
        }
    }
}
