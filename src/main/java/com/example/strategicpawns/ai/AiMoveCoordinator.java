package com.example.strategicpawns.ai;

import com.example.strategicpawns.logic.GameEngine;
import com.example.strategicpawns.model.domain.GameAction;
import com.example.strategicpawns.model.domain.Player;
import com.example.strategicpawns.model.domain.Session;
import com.example.strategicpawns.model.domain.TransitionResult;
import com.example.strategicpawns.service.GameBroadcaster;
import com.example.strategicpawns.store.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Asks the {@link AiOpponent} for a move whenever it is the computer's turn
 * and applies the answer. Only the newest request per game counts: a reply
 * is dropped when a later request was issued or the session moved on since.
 */
@Slf4j
@Component
public class AiMoveCoordinator {

    private final SessionStore sessionStore;
    private final GameEngine engine;
    private final AiOpponent aiOpponent;
    private final GameBroadcaster broadcaster;

    /** game id -> sequence id the latest request was computed against */
    private final Map<String, Long> latestRequests = new ConcurrentHashMap<>();

    public AiMoveCoordinator(SessionStore sessionStore, GameEngine engine, AiOpponent aiOpponent,
                             GameBroadcaster broadcaster) {
        this.sessionStore = sessionStore;
        this.engine = engine;
        this.aiOpponent = aiOpponent;
        this.broadcaster = broadcaster;
    }

    public void requestMoveIfDue(Session session) {
        if (session.getOptions().getAiDifficulty() == null || session.getState().isGameOver()) {
            return;
        }
        Optional<Player> aiSeat = session.getPlayers().stream().filter(Player::isAi).findFirst();
        if (aiSeat.isEmpty() || aiSeat.get().getPlayerId() != session.getState().getCurrentPlayerId()) {
            return;
        }
        String gameId = session.getGameId();
        long sequenceId = session.getSequenceId();
        int seat = aiSeat.get().getPlayerId();
        latestRequests.put(gameId, sequenceId);

        aiOpponent.computeMove(session.getState(), session.getOptions().getAiDifficulty())
                .whenComplete((action, error) -> {
                    if (error != null) {
                        log.error("AI move computation failed for game {}", gameId, error);
                        return;
                    }
                    onMoveComputed(gameId, seat, sequenceId, action);
                });
    }

    void onMoveComputed(String gameId, int seat, long sequenceId, GameAction action) {
        Long latest = latestRequests.get(gameId);
        if (latest == null || latest != sequenceId) {
            log.debug("Discarding stale AI reply for game {} (seq {}, latest {})", gameId, sequenceId, latest);
            return;
        }
        if (action == null) {
            log.info("AI has no move in game {}", gameId);
            return;
        }
        TransitionResult result = sessionStore.applySeatAction(gameId, seat, sequenceId,
                state -> engine.apply(state, action));
        if (!result.isApplied()) {
            log.warn("AI action {} in game {} was not applied: {}", action, gameId, result.getOutcome());
            return;
        }
        latestRequests.remove(gameId, sequenceId);
        Session session = result.getSession();
        broadcaster.broadcastState(session, result.getPreviousState(), action.getType() == GameAction.Type.PLACE);
        requestMoveIfDue(session);
    }

    public void forget(String gameId) {
        latestRequests.remove(gameId);
    }
}
