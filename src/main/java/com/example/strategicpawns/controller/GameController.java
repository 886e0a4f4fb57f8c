package com.example.strategicpawns.controller;

import com.example.strategicpawns.model.domain.GameStatus;
import com.example.strategicpawns.service.GameService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/game")
public class GameController {

    private final GameService gameService;

    public GameController(GameService gameService) {
        this.gameService = gameService;
    }

    /**
     * Lets a client check whether a game link is still alive before connecting.
     */
    @GetMapping("/{gameId}/status")
    public ResponseEntity<GameStatus> getStatus(@PathVariable String gameId) {
        GameStatus status = gameService.getGameStatus(gameId);
        if (!status.isExists()) {
            return ResponseEntity.status(404).body(status);
        }
        return ResponseEntity.ok(status);
    }
}
