package com.example.strategicpawns.service;

import com.example.strategicpawns.config.GameProperties;
import com.example.strategicpawns.model.domain.GameOptions;
import com.example.strategicpawns.model.domain.JoinResult;
import com.example.strategicpawns.model.dto.MatchResult;
import com.example.strategicpawns.store.SessionStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * Waiting room for ranked games. A periodic tick pairs the two players who
 * have waited longest. If the game cannot be set up both are put back at the
 * head of the queue in their original order.
 */
@Slf4j
@Service
public class MatchmakingService {

    private final LinkedList<MatchmakingEntry> queue = new LinkedList<>();
    /** Handles taken off the queue for a pairing that is still being set up. Guarded by {@code queue}. */
    private final Set<String> pairing = new HashSet<>();
    /** In-flight handles that left matchmaking meanwhile; they are not requeued. Guarded by {@code queue}. */
    private final Set<String> cancelled = new HashSet<>();
    private final SessionStore sessionStore;
    private final TaskScheduler taskScheduler;
    private final GameProperties properties;
    private final Clock clock;

    private ScheduledFuture<?> tickTask;

    public MatchmakingService(SessionStore sessionStore,
                              @Qualifier("gameTaskScheduler") TaskScheduler taskScheduler,
                              GameProperties properties,
                              Clock clock) {
        this.sessionStore = sessionStore;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public synchronized void start() {
        if (tickTask != null) {
            return;
        }
        Duration interval = properties.getMatchmaking().getTickInterval();
        tickTask = taskScheduler.scheduleWithFixedDelay(this::processQueue, interval);
        log.info("Matchmaking started, pairing every {}", interval);
    }

    @PreDestroy
    public synchronized void stop() {
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
            log.info("Matchmaking stopped");
        }
    }

    /**
     * @return the 1-based queue position of the new entry
     * @throws IllegalStateException if the handle is already queued
     */
    public int enqueue(String handle, String name, Integer rating, Consumer<Object> notifier) {
        synchronized (queue) {
            if (pairing.contains(handle) || queue.stream().anyMatch(e -> e.getHandle().equals(handle))) {
                throw new IllegalStateException("You are already in the matchmaking queue.");
            }
            int resolvedRating = rating == null ? properties.getMatchmaking().getDefaultRating() : rating;
            queue.add(new MatchmakingEntry(handle, name, resolvedRating, clock.millis(), notifier));
            log.info("{} joined matchmaking ({} waiting)", name, queue.size());
            return queue.size();
        }
    }

    public boolean dequeue(String handle) {
        synchronized (queue) {
            boolean removed = queue.removeIf(e -> e.getHandle().equals(handle));
            if (!removed && pairing.contains(handle)) {
                removed = cancelled.add(handle);
            }
            if (removed) {
                log.info("Connection {} left matchmaking", handle);
            }
            return removed;
        }
    }

    public int queueSize() {
        synchronized (queue) {
            return queue.size();
        }
    }

    public List<MatchmakingEntry> snapshot() {
        synchronized (queue) {
            return new ArrayList<>(queue);
        }
    }

    /**
     * Pairs waiting players until fewer than two remain or a pairing fails.
     */
    public void processQueue() {
        while (true) {
            MatchmakingEntry first;
            MatchmakingEntry second;
            synchronized (queue) {
                if (queue.size() < 2) {
                    return;
                }
                queue.sort(Comparator.comparingLong(MatchmakingEntry::getJoinTime));
                first = queue.removeFirst();
                second = queue.removeFirst();
                pairing.add(first.getHandle());
                pairing.add(second.getHandle());
            }
            boolean paired = pair(first, second);
            synchronized (queue) {
                boolean keepFirst = !cancelled.remove(first.getHandle());
                boolean keepSecond = !cancelled.remove(second.getHandle());
                pairing.remove(first.getHandle());
                pairing.remove(second.getHandle());
                if (!paired) {
                    requeue(keepFirst ? first : null, keepSecond ? second : null);
                    return;
                }
            }
        }
    }

    private boolean pair(MatchmakingEntry first, MatchmakingEntry second) {
        GameOptions options = GameOptions.builder()
                .pawnsPerPlayer(properties.getRules().getPawnsPerPlayer())
                .matchmaking(true)
                .ranked(true)
                .publicGame(false)
                .build();
        String secondName = second.getName().equals(first.getName())
                ? distinctName(second.getName())
                : second.getName();
        String gameId = null;
        try {
            gameId = sessionStore.createGame(first.getHandle(), first.getName(), options);
            JoinResult join = sessionStore.addPlayerToGame(gameId, second.getHandle(), secondName);
            if (!join.isSuccess()) {
                log.warn("Could not seat {} in matched game {}: {}", second.getName(), gameId, join.getError());
                sessionStore.deleteGame(gameId);
                return false;
            }
        } catch (RuntimeException e) {
            log.error("Failed to set up match between {} and {}", first.getName(), second.getName(), e);
            if (gameId != null) {
                sessionStore.deleteGame(gameId);
            }
            return false;
        }

        log.info("Matched {} vs {} in game {}", first.getName(), second.getName(), gameId);
        long now = clock.millis();
        sendMatch(first, new MatchResult(gameId, secondName, 1, now, options));
        sendMatch(second, new MatchResult(gameId, first.getName(), 2, now, options));
        return true;
    }

    /**
     * Seats with the same display name would be refused by the store, so the
     * second player of such a pair plays under a suffixed name.
     */
    static String distinctName(String name) {
        return name + " (2)";
    }

    /**
     * Puts the entries back at the head of the queue in their original order.
     * A {@code null} entry left matchmaking while its pairing was set up.
     * Caller holds the queue lock.
     */
    private void requeue(MatchmakingEntry first, MatchmakingEntry second) {
        if (first == null && second == null) {
            return;
        }
        if (second != null) {
            queue.addFirst(second);
        }
        if (first != null) {
            queue.addFirst(first);
        }
        log.warn("Put {} and {} back at the head of the queue",
                first == null ? "-" : first.getName(), second == null ? "-" : second.getName());
    }

    private void sendMatch(MatchmakingEntry entry, Object message) {
        try {
            entry.getNotifier().accept(message);
        } catch (RuntimeException e) {
            log.warn("Could not notify {} of their match", entry.getName(), e);
        }
    }
}
