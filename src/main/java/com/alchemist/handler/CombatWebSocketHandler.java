package com.alchemist.handler;

import com.alchemist.model.CastResult;
import com.alchemist.model.Element;
import com.alchemist.model.SelectionResult;
import com.alchemist.service.CombatWorldService;
import com.alchemist.service.VisualCatalog;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Input adapter: turns JSON actions into queued simulation commands and pushes
 * world snapshots back to every connected client.
 */
@Component
public class CombatWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(CombatWebSocketHandler.class);

    private final CombatWorldService world;
    private final WorldSnapshotWriter snapshots;
    private final VisualCatalog visuals;
    private final ObjectMapper objectMapper;

    private final List<WebSocketSession> activeSessions = new CopyOnWriteArrayList<>();

    public CombatWebSocketHandler(CombatWorldService world, WorldSnapshotWriter snapshots, VisualCatalog visuals) {
        this.world = world;
        this.snapshots = snapshots;
        this.visuals = visuals;
        this.objectMapper = snapshots.getObjectMapper();
    }

    // --- BROADCAST ---
    @Scheduled(fixedRateString = "${alchemist.combat.tick-millis:50}")
    public void broadcastWorld() {
        if (activeSessions.isEmpty()) return;
        TextMessage update = new TextMessage(snapshots.worldUpdate(world.getPlayer(), world.getNow()).toString());
        for (WebSocketSession session : activeSessions) {
            send(session, update);
        }
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        activeSessions.add(session);
        log.info("Client {} connected", session.getId());

        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("event", "welcome");
        msg.set("combos", snapshots.combos());
        send(session, new TextMessage(msg.toString()));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        activeSessions.remove(session);
        log.info("Client {} disconnected ({})", session.getId(), status.getCode());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        try {
            JsonNode json = objectMapper.readTree(message.getPayload());
            String action = json.path("action").asText("");

            if ("select_element".equals(action)) {
                Element element = Element.fromLabel(json.path("element").asText());
                onCompletion(session, action, world.selectElement(element),
                        result -> sendSelection(session, element, result));
            }
            else if ("cast".equals(action)) {
                onCompletion(session, action, world.cast(), result -> sendCastResult(session, result));
            }
            else if ("clear_selection".equals(action)) {
                onCompletion(session, action, world.clearSelection(), null);
            }
            else if ("request_move".equals(action)) {
                if (!json.hasNonNull("x") || !json.hasNonNull("y")) {
                    sendError(session, "request_move needs x and y");
                    return;
                }
                onCompletion(session, action, world.requestMove(json.get("x").asDouble(), json.get("y").asDouble()), null);
            }
            else if ("face".equals(action)) {
                onCompletion(session, action, world.face(json.path("right").asBoolean(true)), null);
            }
            else {
                sendError(session, "Unknown action: " + action);
            }
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Bad message from {}: {}", session.getId(), e.getMessage());
            sendError(session, e.getMessage());
        }
    }

    /**
     * Commands run later on the frame thread; a command that fails there is reported back as an error event.
     */
    private <T> void onCompletion(WebSocketSession session, String action, CompletableFuture<T> pending,
                                  Consumer<T> onResult) {
        pending.whenComplete((result, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                log.warn("{} from {} failed: {}", action, session.getId(), cause.getMessage());
                sendError(session, action + " failed: " + cause.getMessage());
            } else if (onResult != null) {
                onResult.accept(result);
            }
        });
    }

    private void sendSelection(WebSocketSession session, Element element, SelectionResult result) {
        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("event", "selection");
        msg.put("element", element.getLabel());
        msg.put("result", result.toString());
        send(session, new TextMessage(msg.toString()));
    }

    private void sendCastResult(WebSocketSession session, CastResult result) {
        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("event", "cast_result");
        msg.put("status", result.getStatus().toString());
        result.getAttempted().ifPresent(effect -> {
            msg.put("effect", effect.getName());
            msg.put("icon", visuals.iconFor(effect));
        });
        send(session, new TextMessage(msg.toString()));
    }

    private void sendError(WebSocketSession session, String reason) {
        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("event", "error");
        msg.put("message", reason);
        send(session, new TextMessage(msg.toString()));
    }

    private void send(WebSocketSession session, TextMessage message) {
        if (!session.isOpen()) return;
        try {
            // Session writes are not thread-safe
            synchronized (session) {
                session.sendMessage(message);
            }
        } catch (IOException e) {
            log.debug("Dropping message to {}: {}", session.getId(), e.getMessage());
        }
    }

    public int getSessionCount() { return activeSessions.size(); }
}
