package com.gnovoa.matchsim.ws;

import java.io.IOException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Tracks subscribers per channel. A channel is either one match ({@code match:<id>}) or one round
 * ({@code fixture:<id>}); sessions on any other path are closed straight away.
 */
@Component
public final class WsRouter extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(WsRouter.class);

    static final String MATCH_PATH = "/ws/matches/";
    static final String FIXTURE_PATH = "/ws/fixtures/";

    private final ConcurrentHashMap<String, Set<WebSocketSession>> channels = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        Optional<String> channel = channelOf(session);
        if (channel.isEmpty()) {
            log.warn("Closing WebSocket {} on unroutable path {}", session.getId(), session.getUri());
            session.close(CloseStatus.POLICY_VIOLATION.withReason("unknown channel"));
            return;
        }
        channels.computeIfAbsent(channel.get(), k -> ConcurrentHashMap.newKeySet()).add(session);
        log.debug("Session {} subscribed to {}", session.getId(), channel.get());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        channelOf(session).ifPresent(channel -> channels.computeIfPresent(channel, (k, subscribers) -> {
            subscribers.remove(session);
            return subscribers.isEmpty() ? null : subscribers;
        }));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // push-only channels
        log.debug("Ignoring client frame on session {}", session.getId());
    }

    public Set<WebSocketSession> subscribers(String channel) {
        return channels.getOrDefault(channel, Set.of());
    }

    public static String matchChannel(String matchId) {
        return "match:" + matchId;
    }

    public static String fixtureChannel(String fixtureId) {
        return "fixture:" + fixtureId;
    }

    private static Optional<String> channelOf(WebSocketSession session) {
        return session.getUri() == null ? Optional.empty() : channelFor(session.getUri().getPath());
    }

    /** Maps {@code /ws/matches/{id}} and {@code /ws/fixtures/{id}} to their channel names. */
    static Optional<String> channelFor(String path) {
        if (path == null) return Optional.empty();
        if (path.startsWith(MATCH_PATH)) return lastSegment(path, MATCH_PATH).map(WsRouter::matchChannel);
        if (path.startsWith(FIXTURE_PATH)) return lastSegment(path, FIXTURE_PATH).map(WsRouter::fixtureChannel);
        return Optional.empty();
    }

    private static Optional<String> lastSegment(String path, String prefix) {
        String id = path.substring(prefix.length());
        return id.isBlank() || id.contains("/") ? Optional.empty() : Optional.of(id);
    }
}
