package com.gnovoa.matchsim.out;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.matchsim.events.LiveMatchUpdate;
import com.gnovoa.matchsim.ws.WsRouter;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

@Component
public final class WebSocketEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(WebSocketEventPublisher.class);

    private final WsRouter router;
    private final ObjectMapper mapper;

    public WebSocketEventPublisher(WsRouter router, ObjectMapper mapper) {
        this.router = router;
        this.mapper = mapper;
    }

    @Override
    public void publish(LiveMatchUpdate update) {
        String json;
        try {
            json = mapper.writeValueAsString(update);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} for match {}", update.event().type(), update.matchId(), e);
            return;
        }
        TextMessage msg = new TextMessage(json);
        log.debug("Publishing {} for match {}", update.event().type(), update.matchId());

        send(WsRouter.matchChannel(update.matchId()), msg);
        if (update.fixtureId() != null) send(WsRouter.fixtureChannel(update.fixtureId()), msg);
    }

    private void send(String key, TextMessage msg) {
        for (WebSocketSession s : router.subscribers(key)) {
            if (!s.isOpen()) continue;
            try {
                // sessions are not safe for concurrent sends
                synchronized (s) {
                    s.sendMessage(msg);
                }
            } catch (IOException e) {
                log.warn("Dropping update for session {} on {}: {}", s.getId(), key, e.getMessage());
            }
        }
    }
}
