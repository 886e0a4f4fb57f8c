package com.example.strategicpawns.ai;

import com.example.strategicpawns.config.GameProperties;
import com.example.strategicpawns.logic.GameEngine;
import com.example.strategicpawns.logic.GameStateFactory;
import com.example.strategicpawns.model.domain.Difficulty;
import com.example.strategicpawns.model.domain.GameAction;
import com.example.strategicpawns.model.domain.GameOptions;
import com.example.strategicpawns.model.domain.GameState;
import com.example.strategicpawns.model.domain.Session;
import com.example.strategicpawns.service.GameBroadcaster;
import com.example.strategicpawns.store.MutableClock;
import com.example.strategicpawns.store.SessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AiMoveCoordinatorTest {

    @Mock
    private AiOpponent aiOpponent;
    @Mock
    private GameBroadcaster broadcaster;
    @Mock
    private TaskScheduler taskScheduler;

    private final GameEngine engine = new GameEngine();
    private SessionStore sessionStore;
    private AiMoveCoordinator coordinator;
    private String gameId;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        sessionStore = new SessionStore(taskScheduler, new GameStateFactory(), new GameProperties(),
                new MutableClock(Instant.parse("2024-05-01T12:00:00Z")));
        coordinator = new AiMoveCoordinator(sessionStore, engine, aiOpponent, broadcaster);
        gameId = sessionStore.createGame("h1", "Alice", GameOptions.builder().aiDifficulty(Difficulty.MEDIUM).build());
    }

    @Test
    void testNoRequestWhileHumanToMove() {
        coordinator.requestMoveIfDue(sessionStore.getGame(gameId));

        verifyNoInteractions(aiOpponent);
    }

    @Test
    void testComputedMoveIsApplied() {
        Session afterHuman = sessionStore.applyPlayerAction(gameId, "h1", s -> engine.placePawn(s, 0)).getSession();
        CompletableFuture<GameAction> reply = new CompletableFuture<>();
        when(aiOpponent.computeMove(any(GameState.class), eq(Difficulty.MEDIUM))).thenReturn(reply);

        coordinator.requestMoveIfDue(afterHuman);
        reply.complete(GameAction.place(1));

        Session session = sessionStore.getGame(gameId);
        assertEquals(2L, session.getSequenceId());
        assertEquals(2, session.getState().getSquare(1).getPawn().getPlayerId());
        assertEquals(1, session.getState().getCurrentPlayerId());
        verify(broadcaster).broadcastState(any(Session.class), any(GameState.class), eq(true));
    }

    @Test
    void testStaleReplyIsDiscarded() {
        Session afterHuman = sessionStore.applyPlayerAction(gameId, "h1", s -> engine.placePawn(s, 0)).getSession();
        CompletableFuture<GameAction> first = new CompletableFuture<>();
        CompletableFuture<GameAction> second = new CompletableFuture<>();
        when(aiOpponent.computeMove(any(GameState.class), any(Difficulty.class))).thenReturn(first, second);

        coordinator.requestMoveIfDue(afterHuman);
        // state replaced while the first request is outstanding; still the computer's turn
        sessionStore.updateGameState(gameId, afterHuman.getState());
        coordinator.requestMoveIfDue(sessionStore.getGame(gameId));

        first.complete(GameAction.place(1));
        assertEquals(2L, sessionStore.getGame(gameId).getSequenceId());
        assertTrue(sessionStore.getGame(gameId).getState().getSquare(1).isEmpty());

        second.complete(GameAction.place(3));
        assertEquals(3L, sessionStore.getGame(gameId).getSequenceId());
        assertFalse(sessionStore.getGame(gameId).getState().getSquare(3).isEmpty());
        verify(broadcaster, times(1)).broadcastState(any(), any(), anyBoolean());
    }

    @Test
    void testEmptyOrFailedReplyChangesNothing() {
        Session afterHuman = sessionStore.applyPlayerAction(gameId, "h1", s -> engine.placePawn(s, 0)).getSession();
        when(aiOpponent.computeMove(any(GameState.class), any(Difficulty.class)))
                .thenReturn(CompletableFuture.completedFuture(null),
                        CompletableFuture.failedFuture(new IllegalStateException("search crashed")));

        coordinator.requestMoveIfDue(afterHuman);
        coordinator.requestMoveIfDue(afterHuman);

        assertEquals(1L, sessionStore.getGame(gameId).getSequenceId());
        verifyNoInteractions(broadcaster);
    }
}
