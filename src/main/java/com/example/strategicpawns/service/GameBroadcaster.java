package com.example.strategicpawns.service;

import com.example.strategicpawns.codec.DeltaUpdate;
import com.example.strategicpawns.codec.GameStateCodec;
import com.example.strategicpawns.codec.StateCompression;
import com.example.strategicpawns.codec.StateDeltaCalculator;
import com.example.strategicpawns.config.GameProperties;
import com.example.strategicpawns.model.domain.GameState;
import com.example.strategicpawns.model.domain.Session;
import com.example.strategicpawns.model.dto.ErrorType;
import com.example.strategicpawns.model.dto.GameErrorMessage;
import com.example.strategicpawns.model.dto.GameUpdateMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Sends game traffic over the STOMP broker. Players are addressed by their
 * WebSocket session id; every game has a shared topic.
 */
@Slf4j
@Component
public class GameBroadcaster {

    public static final String ERRORS = "/queue/errors";

    private final SimpMessagingTemplate messagingTemplate;
    private final GameStateCodec codec;
    private final GameProperties properties;
    private final Clock clock;

    public GameBroadcaster(SimpMessagingTemplate messagingTemplate, GameStateCodec codec,
                           GameProperties properties, Clock clock) {
        this.messagingTemplate = messagingTemplate;
        this.codec = codec;
        this.properties = properties;
        this.clock = clock;
    }

    public static String gameTopic(String gameId) {
        return "/topic/game/" + gameId;
    }

    public void sendToPlayer(String handle, String destination, Object payload) {
        messagingTemplate.convertAndSendToUser(handle, destination, payload, headersFor(handle));
    }

    public void broadcast(String gameId, Object payload) {
        messagingTemplate.convertAndSend(gameTopic(gameId), payload);
    }

    public void sendError(String handle, ErrorType errorType, String message, String gameId) {
        log.debug("Error for {} in game {}: {} ({})", handle, gameId, message, errorType);
        sendToPlayer(handle, ERRORS, new GameErrorMessage(message, errorType, gameId));
    }

    public byte[] compressedSnapshot(Session session) {
        return StateCompression.compress(codec.encode(session.getState(), session.getSequenceId(), clock.millis()));
    }

    public GameUpdateMessage fullUpdate(Session session) {
        return GameUpdateMessage.builder()
                .type(GameUpdateMessage.FULL)
                .gameId(session.getGameId())
                .sequenceId(session.getSequenceId())
                .timestamp(clock.millis())
                .fullUpdate(true)
                .gameState(compressedSnapshot(session))
                .build();
    }

    /**
     * Publishes the new state of {@code session}: a full snapshot on every
     * n-th sequence id, when {@code forceFull} is set, or when the delta would
     * be empty or too large; otherwise only the changes since {@code previous}.
     */
    public void broadcastState(Session session, GameState previous, boolean forceFull) {
        GameUpdateMessage message = updateFor(session, previous, forceFull);
        broadcast(session.getGameId(), message);
    }

    GameUpdateMessage updateFor(Session session, GameState previous, boolean forceFull) {
        GameProperties.Broadcast policy = properties.getBroadcast();
        boolean periodic = policy.getFullStateEvery() > 0 && session.getSequenceId() % policy.getFullStateEvery() == 0;
        if (forceFull || periodic || previous == null) {
            return fullUpdate(session);
        }
        List<DeltaUpdate> updates = StateDeltaCalculator.calculate(previous, session.getState());
        if (updates.isEmpty() || updates.size() > policy.getMaxDeltaUpdates()) {
            return fullUpdate(session);
        }
        return GameUpdateMessage.builder()
                .type(GameUpdateMessage.DELTA)
                .gameId(session.getGameId())
                .sequenceId(session.getSequenceId())
                .timestamp(clock.millis())
                .fullUpdate(false)
                .updates(updates)
                .build();
    }

    private static MessageHeaders headersFor(String handle) {
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        accessor.setSessionId(handle);
        accessor.setLeaveMutable(true);
        return accessor.getMessageHeaders();
    }
}
