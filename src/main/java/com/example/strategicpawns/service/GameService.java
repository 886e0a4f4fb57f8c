package com.example.strategicpawns.service;

import com.example.strategicpawns.ai.AiMoveCoordinator;
import com.example.strategicpawns.config.GameProperties;
import com.example.strategicpawns.logic.GameEngine;
import com.example.strategicpawns.model.domain.GameAction;
import com.example.strategicpawns.model.domain.GameOptions;
import com.example.strategicpawns.model.domain.GameStatus;
import com.example.strategicpawns.model.domain.JoinResult;
import com.example.strategicpawns.model.domain.Player;
import com.example.strategicpawns.model.domain.Session;
import com.example.strategicpawns.model.domain.TransitionResult;
import com.example.strategicpawns.model.dto.ErrorType;
import com.example.strategicpawns.model.dto.GameJoinedMessage;
import com.example.strategicpawns.model.dto.PlayerEventMessage;
import com.example.strategicpawns.store.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for player intents arriving over the socket. Each intent is
 * turned into one store transaction, and the outcome is pushed back to the
 * requester or broadcast to the game.
 */
@Slf4j
@Service
public class GameService {

    public static final String GAME_CREATED_QUEUE = "/queue/game-created";
    public static final String GAME_JOINED_QUEUE = "/queue/game-joined";
    public static final String GAME_STATE_QUEUE = "/queue/game-state";

    private final SessionStore sessionStore;
    private final GameEngine engine;
    private final GameBroadcaster broadcaster;
    private final AiMoveCoordinator aiMoveCoordinator;
    private final GameProperties properties;

    /** connection handle -> game it last joined, for disconnect handling */
    private final Map<String, String> joinedGames = new ConcurrentHashMap<>();

    public GameService(SessionStore sessionStore, GameEngine engine, GameBroadcaster broadcaster,
                       AiMoveCoordinator aiMoveCoordinator, GameProperties properties) {
        this.sessionStore = sessionStore;
        this.engine = engine;
        this.broadcaster = broadcaster;
        this.aiMoveCoordinator = aiMoveCoordinator;
        this.properties = properties;
    }

    /**
     * @return the trimmed name, or {@code null} when it is blank or too long
     */
    public String validateName(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        if (trimmed.isEmpty() || trimmed.length() > properties.getPlayer().getMaxNameLength()) {
            return null;
        }
        return trimmed;
    }

    public String createGame(String handle, String playerName, GameOptions options) {
        String name = validateName(playerName);
        if (name == null) {
            broadcaster.sendError(handle, ErrorType.JOIN_FAILED, invalidNameMessage(), null);
            return null;
        }
        GameOptions resolved = options == null ? GameOptions.defaults() : options;

        String gameId;
        try {
            gameId = sessionStore.createGame(handle, name, resolved);
        } catch (IllegalStateException e) {
            broadcaster.sendError(handle, ErrorType.JOIN_FAILED, e.getMessage(), resolved.getGameIdToCreate());
            return null;
        }
        leaveCurrentGame(handle, gameId);
        joinedGames.put(handle, gameId);

        Session session = sessionStore.getGame(gameId);
        broadcaster.sendToPlayer(handle, GAME_CREATED_QUEUE, joinedMessage(GameJoinedMessage.CREATED, session, 1));
        if (session.getPlayers().size() == 2) {
            broadcaster.broadcast(gameId, new PlayerEventMessage(PlayerEventMessage.GAME_START, gameId, name, 1,
                    session.getPlayers()));
        }
        return gameId;
    }

    public JoinResult joinGame(String handle, String gameId, String playerName) {
        String name = validateName(playerName);
        if (name == null) {
            broadcaster.sendError(handle, ErrorType.JOIN_FAILED, invalidNameMessage(), gameId);
            return JoinResult.failed(null, invalidNameMessage());
        }
        JoinResult result = sessionStore.addPlayerToGame(gameId, handle, name);
        if (!result.isSuccess()) {
            broadcaster.sendError(handle, errorTypeFor(result.getFailure()), result.getError(), gameId);
            return result;
        }

        Session session = sessionStore.getGame(gameId);
        if (session == null) {
            broadcaster.sendError(handle, ErrorType.GAME_NOT_FOUND, "Game not found or has expired.", gameId);
            return JoinResult.failed(JoinResult.JoinFailure.GAME_NOT_FOUND, "Game not found or has expired.");
        }
        leaveCurrentGame(handle, session.getGameId());
        joinedGames.put(handle, session.getGameId());

        int playerId = result.getAssignedPlayerId();
        broadcaster.sendToPlayer(handle, GAME_JOINED_QUEUE, joinedMessage(GameJoinedMessage.JOINED, session, playerId));
        broadcaster.broadcast(session.getGameId(), new PlayerEventMessage(PlayerEventMessage.OPPONENT_JOINED,
                session.getGameId(), name, playerId, session.getPlayers()));
        if (session.getPlayers().stream().filter(Player::isConnected).count() == 2) {
            broadcaster.broadcast(session.getGameId(), new PlayerEventMessage(PlayerEventMessage.GAME_START,
                    session.getGameId(), name, playerId, session.getPlayers()));
            aiMoveCoordinator.requestMoveIfDue(session);
        }
        return result;
    }

    public TransitionResult placePawn(String gameId, String handle, int squareIndex) {
        return act(gameId, handle, GameAction.place(squareIndex));
    }

    public TransitionResult selectPawn(String gameId, String handle, int squareIndex) {
        return act(gameId, handle, GameAction.select(squareIndex));
    }

    public TransitionResult deselectPawn(String gameId, String handle) {
        return act(gameId, handle, GameAction.deselect());
    }

    public TransitionResult movePawn(String gameId, String handle, int fromIndex, int toIndex) {
        return act(gameId, handle, GameAction.move(fromIndex, toIndex));
    }

    private TransitionResult act(String gameId, String handle, GameAction action) {
        TransitionResult result = sessionStore.applyPlayerAction(gameId, handle, state -> engine.apply(state, action));
        switch (result.getOutcome()) {
            case APPLIED:
                Session session = result.getSession();
                broadcaster.broadcastState(session, result.getPreviousState(), action.getType() == GameAction.Type.PLACE);
                if (session.getState().isGameOver() && result.getPreviousState().getWinner() == null) {
                    log.info("Game {} won by player {}", session.getGameId(), session.getState().getWinner());
                }
                aiMoveCoordinator.requestMoveIfDue(session);
                break;
            case GAME_NOT_FOUND:
                broadcaster.sendError(handle, ErrorType.GAME_NOT_FOUND, "Game not found or has expired.", gameId);
                break;
            case NOT_IN_GAME:
                broadcaster.sendError(handle, ErrorType.INVALID_MOVE, "You are not a player in this game.", gameId);
                break;
            case WAITING_FOR_OPPONENT:
                broadcaster.sendError(handle, ErrorType.INVALID_MOVE, "Waiting for an opponent to join.", gameId);
                break;
            case NOT_YOUR_TURN:
                broadcaster.sendError(handle, ErrorType.NOT_YOUR_TURN, "It is not your turn.", gameId);
                break;
            default:
                broadcaster.sendError(handle, ErrorType.INVALID_MOVE, "Invalid " + describe(action) + ".", gameId);
                break;
        }
        return result;
    }

    public void sendFullState(String gameId, String handle) {
        Session session = sessionStore.getGame(gameId);
        if (session == null) {
            broadcaster.sendError(handle, ErrorType.GAME_NOT_FOUND, "Game not found or has expired.", gameId);
            return;
        }
        broadcaster.sendToPlayer(handle, GAME_STATE_QUEUE, broadcaster.fullUpdate(session));
    }

    public void leaveGame(String gameId, String handle) {
        Player player = sessionStore.removePlayerFromGame(gameId, handle);
        joinedGames.remove(handle, gameId);
        if (player == null) {
            return;
        }
        log.info("{} left game {}", player.getName(), gameId);
        Session session = sessionStore.getGame(gameId);
        broadcaster.broadcast(gameId, new PlayerEventMessage(PlayerEventMessage.OPPONENT_DISCONNECTED, gameId,
                player.getName(), player.getPlayerId(), session == null ? null : session.getPlayers()));
        if (session != null && !session.hasActivePlayers()) {
            aiMoveCoordinator.forget(gameId);
        }
    }

    public void handleDisconnect(String handle) {
        String gameId = joinedGames.get(handle);
        if (gameId != null) {
            leaveGame(gameId, handle);
        }
    }

    public GameStatus getGameStatus(String gameId) {
        return sessionStore.getGameStatus(gameId);
    }

    private void leaveCurrentGame(String handle, String nextGameId) {
        String current = joinedGames.get(handle);
        if (current != null && !current.equals(nextGameId)) {
            leaveGame(current, handle);
        }
    }

    private GameJoinedMessage joinedMessage(String type, Session session, int playerId) {
        return GameJoinedMessage.builder()
                .type(type)
                .gameId(session.getGameId())
                .playerId(playerId)
                .players(session.getPlayers())
                .options(session.getOptions())
                .sequenceId(session.getSequenceId())
                .gameState(broadcaster.compressedSnapshot(session))
                .build();
    }

    private String invalidNameMessage() {
        return "Player name must be between 1 and " + properties.getPlayer().getMaxNameLength() + " characters.";
    }

    private static ErrorType errorTypeFor(JoinResult.JoinFailure failure) {
        if (failure == null) {
            return ErrorType.JOIN_FAILED;
        }
        switch (failure) {
            case GAME_NOT_FOUND:
                return ErrorType.GAME_NOT_FOUND;
            case GAME_FULL:
                return ErrorType.GAME_FULL;
            default:
                return ErrorType.JOIN_FAILED;
        }
    }

    private static String describe(GameAction action) {
        switch (action.getType()) {
            case PLACE:
                return "placement";
            case SELECT:
                return "selection";
            default:
                return "move";
        }
    }
}
